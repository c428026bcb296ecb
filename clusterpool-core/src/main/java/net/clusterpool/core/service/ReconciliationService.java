package net.clusterpool.core.service;

import net.clusterpool.core.error.UpdateStatusException;
import net.clusterpool.core.model.Cluster;
import net.clusterpool.core.model.WorkUnit;
import net.clusterpool.core.quota.RateLimiter;
import net.clusterpool.core.spi.Clock;
import net.clusterpool.core.spi.ClusterRepository;
import net.clusterpool.core.spi.TxRunner;
import net.clusterpool.core.spi.WorkUnitRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Refreshes every non-terminal cluster and work unit from the control plane.
 * <p>
 * The two streams run concurrently, each in its own transaction, and share the pass's
 * {@link RateLimiter}. A failure on one entity is logged and never stops its stream.
 */
public final class ReconciliationService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    public record Result(int clusters, int workUnits) {}

    private final ClusterRepository clusters;
    private final WorkUnitRepository workUnits;
    private final TxRunner tx;
    private final EntityBinder binder;
    private final Clock clock;
    private final Duration idleGrace;
    private final ExecutorService executor;

    public ReconciliationService(ClusterRepository clusters, WorkUnitRepository workUnits, TxRunner tx,
                                 EntityBinder binder, Clock clock, Duration idleGrace) {
        this.clusters = clusters;
        this.workUnits = workUnits;
        this.tx = tx;
        this.binder = binder;
        this.clock = clock;
        this.idleGrace = idleGrace;
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "clusterpool-reconcile-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Runs both streams and returns once both are done. */
    public Result reconcileAll(RateLimiter limiter) throws Exception {
        CompletableFuture<Integer> c = CompletableFuture.supplyAsync(() -> unchecked(() -> reconcileClusters(limiter)), executor);
        CompletableFuture<Integer> w = CompletableFuture.supplyAsync(() -> unchecked(() -> reconcileWorkUnits(limiter)), executor);
        try {
            CompletableFuture.allOf(c, w).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StreamFailure sf) throw sf.getCause() instanceof Exception ex ? ex : sf;
            throw e;
        }
        return new Result(c.join(), w.join());
    }

    public int reconcileClusters(RateLimiter limiter) throws Exception {
        return tx.requiresNew(() -> {
            List<Cluster> list = clusters.findNonTerminal();
            int refreshed = 0;
            for (Cluster cluster : list) {
                if (binder.tryBind(cluster, limiter)) {
                    try {
                        log.debug("Updating cluster {}", cluster.id());
                        cluster.reconcile(clock.now(), idleGrace);
                        refreshed++;
                    } catch (UpdateStatusException e) {
                        log.warn("Cluster {} keeps status {} - msg: {}", cluster.id(), cluster.status(), e.getMessage());
                    } catch (RuntimeException e) {
                        log.error("Unexpected failure updating cluster {} - msg: {}", cluster.id(), e.getMessage(), e);
                    }
                }
                cluster.touch(clock.now());
                if (!clusters.update(cluster)) {
                    log.info("Cluster {} reached a terminal status meanwhile; refresh dropped", cluster.id());
                }
            }
            log.debug("Reconciled {}/{} clusters", refreshed, list.size());
            return refreshed;
        });
    }

    public int reconcileWorkUnits(RateLimiter limiter) throws Exception {
        return tx.requiresNew(() -> {
            List<WorkUnit> list = workUnits.findNonTerminal();
            int refreshed = 0;
            for (WorkUnit unit : list) {
                if (unit.clusterId() == null) continue;     // nothing remote to look at yet
                if (binder.tryBind(unit, limiter)) {
                    try {
                        log.debug("Updating work unit {}", unit.id());
                        unit.reconcile();
                        refreshed++;
                    } catch (UpdateStatusException e) {
                        log.warn("Work unit {} keeps status {} - msg: {}", unit.id(), unit.status(), e.getMessage());
                    } catch (RuntimeException e) {
                        log.error("Unexpected failure updating work unit {} - msg: {}", unit.id(), e.getMessage(), e);
                    }
                }
                unit.touch(clock.now());
                if (!workUnits.update(unit)) {
                    log.info("Work unit {} reached a terminal status meanwhile; refresh dropped", unit.id());
                }
            }
            log.debug("Reconciled {}/{} work units", refreshed, list.size());
            return refreshed;
        });
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    @FunctionalInterface
    private interface Stream {
        int run() throws Exception;
    }

    private static int unchecked(Stream stream) {
        try {
            return stream.run();
        } catch (Exception e) {
            throw new StreamFailure(e);
        }
    }

    private static final class StreamFailure extends RuntimeException {
        StreamFailure(Exception cause) { super(cause); }
    }
}
