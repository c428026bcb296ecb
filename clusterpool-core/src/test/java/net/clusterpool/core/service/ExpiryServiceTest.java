package net.clusterpool.core.service;

import net.clusterpool.core.model.Cluster;
import net.clusterpool.core.support.Fixtures;
import net.clusterpool.core.support.PoolHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ExpiryServiceTest {

    PoolHarness h;
    Instant now;

    @BeforeEach
    void setUp() {
        h = new PoolHarness();
        now = h.clock.now();
    }

    @AfterEach
    void tearDown() {
        h.close();
    }

    @Test
    void only_past_deadlines_are_terminated() throws Exception {
        user("j-past", now.minusSeconds(1));
        user("j-future", now.plusSeconds(60));
        user("j-none", null);

        int terminated = h.expiry.terminateExpired(h.limiter());

        assertEquals(1, terminated);
        assertEquals(Cluster.Status.TERMINATED, h.store.cluster("j-past").status());
        assertEquals(Cluster.Status.WAITING, h.store.cluster("j-future").status());
        assertEquals(Cluster.Status.WAITING, h.store.cluster("j-none").status());
        assertEquals(1, h.remote.count("terminate:"));
    }

    @Test
    void managed_and_user_clusters_are_both_swept() throws Exception {
        user("j-user", now.minusSeconds(5));
        Cluster managed = h.idleCluster("j-managed", Fixtures.launchConfig("cfg"));
        managed.extend(Duration.ofMinutes(1), now.minus(Duration.ofMinutes(2)));

        assertEquals(2, h.expiry.terminateExpired(h.limiter()));
    }

    @Test
    void failed_termination_does_not_stop_the_sweep() throws Exception {
        user("j-1", now.minusSeconds(30));
        user("j-2", now.minusSeconds(20));
        user("j-3", now.minusSeconds(10));
        h.remote.failTerminate("j-2");

        int terminated = h.expiry.terminateExpired(h.limiter());

        assertEquals(2, terminated);
        assertEquals(Cluster.Status.TERMINATED_WITH_ERRORS, h.store.cluster("j-2").status());
        assertEquals(Cluster.Status.TERMINATED, h.store.cluster("j-3").status());
    }

    @Test
    void terminal_clusters_are_skipped() throws Exception {
        Cluster done = user("j-done", now.minusSeconds(30));
        done.transitionTo(Cluster.Status.TERMINATED);

        assertEquals(0, h.expiry.terminateExpired(h.limiter()));
        assertEquals(0, h.remote.count("terminate:"));
    }

    private Cluster user(String id, Instant terminateOn) {
        h.remote.existingCluster(id, "WAITING");
        return h.store.put(Fixtures.userCluster(id, "bob", Fixtures.launchConfig("cfg"), Cluster.Status.WAITING,
                terminateOn, now.minus(Duration.ofHours(1))));
    }
}
