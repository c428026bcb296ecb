package net.clusterpool.core.service;

import net.clusterpool.core.error.ParseRequestException;
import net.clusterpool.core.quota.RateLimiter;
import net.clusterpool.core.spi.TxRunner;
import net.clusterpool.core.trigger.TriggerParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One scheduling pass: reconcile, then assign, then expire. Assignment and expiry share one
 * transaction. Passes in this process never overlap.
 */
public final class PassOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PassOrchestrator.class);

    private final ReconciliationService reconciliation;
    private final AssignmentService assignment;
    private final ExpiryService expiry;
    private final TxRunner tx;
    private final PassSettings settings;
    private final TriggerParser triggers = new TriggerParser();
    private final ReentrantLock passLock = new ReentrantLock();

    public PassOrchestrator(ReconciliationService reconciliation, AssignmentService assignment, ExpiryService expiry,
                            TxRunner tx, PassSettings settings) {
        this.reconciliation = reconciliation;
        this.assignment = assignment;
        this.expiry = expiry;
        this.tx = tx;
        this.settings = settings;
    }

    /** Runs a pass for the units named by a trigger body (see {@link TriggerParser}). */
    public PassReport runTriggered(String body) throws Exception {
        Optional<List<Long>> ids;
        try {
            ids = triggers.parse(body);
        } catch (ParseRequestException e) {
            log.warn("Rejected scheduling trigger - msg: {}", e.getMessage());
            throw e;
        }
        return runPass(ids.orElse(null));
    }

    /**
     * @param ids units to consider; null means every pending unit
     */
    public PassReport runPass(Collection<Long> ids) throws Exception {
        passLock.lock();
        try {
            long started = System.nanoTime();
            RateLimiter limiter = new RateLimiter(settings.quota(), settings.sleeper());

            ReconciliationService.Result recon = reconciliation.reconcileAll(limiter);
            Outcome outcome = tx.required(() -> {
                AssignmentService.Result a = assignment.assignPending(ids, limiter);
                int terminated = expiry.terminateExpired(limiter);
                return new Outcome(a, terminated);
            });

            PassReport report = PassReport.of(recon, outcome.assignment(), outcome.terminated(),
                    Duration.ofNanos(System.nanoTime() - started));
            log.info("Pass done: {}", report);
            return report;
        } finally {
            passLock.unlock();
        }
    }

    private record Outcome(AssignmentService.Result assignment, int terminated) {}
}
