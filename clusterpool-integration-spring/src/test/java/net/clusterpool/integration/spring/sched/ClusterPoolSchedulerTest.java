package net.clusterpool.integration.spring.sched;

import net.clusterpool.core.model.WorkUnit;
import net.clusterpool.core.service.PassOrchestrator;
import net.clusterpool.core.support.PoolHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.MapPropertySource;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Duration;
import java.util.Map;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class ClusterPoolSchedulerTest {

    final PoolHarness h = new PoolHarness();
    AnnotationConfigApplicationContext ctx;

    @Configuration
    @EnableScheduling
    static class Config {
        @Bean
        ClusterPoolScheduler clusterPoolScheduler(PassOrchestrator orchestrator) {
            return new ClusterPoolScheduler(orchestrator);
        }
    }

    @AfterEach
    void tearDown() {
        if (ctx != null) ctx.close();
        h.close();
    }

    @Test
    void passes_run_on_the_configured_delay() throws Exception {
        WorkUnit unit = h.submit("daily", "etl");

        ctx = new AnnotationConfigApplicationContext();
        ctx.getEnvironment().getPropertySources().addFirst(new MapPropertySource("test",
                Map.of("clusterpool.scheduler.delay-ms", "50")));
        ctx.registerBean(PassOrchestrator.class, () -> h.orchestrator);
        ctx.register(Config.class);
        ctx.refresh();

        await().atMost(Duration.ofSeconds(5))
                .until(() -> h.store.unit(unit.id()).status() == WorkUnit.Status.PENDING);

        ClusterPoolScheduler scheduler = ctx.getBean(ClusterPoolScheduler.class);
        await().atMost(Duration.ofSeconds(5)).until(() -> scheduler.lastReport() != null);
        assertNotNull(h.store.unit(unit.id()).clusterId());
    }
}
