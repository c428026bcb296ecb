package net.clusterpool.integration.spring.sched;

import net.clusterpool.core.service.PassOrchestrator;
import net.clusterpool.core.service.PassReport;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Fixed-delay trigger for scheduling passes. Off unless the application enables it; the cadence is
 * normally owned by an external caller.
 */
public class ClusterPoolScheduler {
    private final PassOrchestrator orchestrator;

    private volatile PassReport lastReport;

    public ClusterPoolScheduler(PassOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Scheduled(fixedDelayString = "${clusterpool.scheduler.delay-ms:60000}",
            initialDelayString = "${clusterpool.scheduler.initial-delay-ms:0}")
    public void pass() throws Exception {
        lastReport = orchestrator.runPass(null);
    }

    public PassReport lastReport() {
        return lastReport;
    }
}
