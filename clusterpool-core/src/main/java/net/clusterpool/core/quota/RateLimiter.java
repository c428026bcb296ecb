package net.clusterpool.core.quota;

import net.clusterpool.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Burst-then-throttle limiter scoped to one scheduling pass. Counters never refill within the pass;
 * create a new instance per pass.
 * <p>
 * Thread-safe: the two reconciliation streams share one instance.
 */
public final class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final QuotaPolicy policy;
    private final Sleeper sleeper;
    private final Map<OperationKind, AtomicInteger> counters = new EnumMap<>(OperationKind.class);

    public RateLimiter(QuotaPolicy policy, Sleeper sleeper) {
        this.policy = policy;
        this.sleeper = sleeper;
        for (OperationKind k : OperationKind.values()) counters.put(k, new AtomicInteger());
    }

    /** Takes the next slot of {@code kind} and waits if the burst is used up. */
    public void acquire(OperationKind kind) {
        int index = counters.get(kind).getAndIncrement();
        awaitPermit(kind, index);
    }

    /**
     * Blocks the caller before its {@code index}-th (0-based) call of {@code kind} when that index is
     * past the burst capacity.
     */
    public void awaitPermit(OperationKind kind, long index) {
        if (index < policy.burstCapacity(kind)) return;
        Duration delay = policy.throttleDelay(kind);
        log.debug("{} call #{} over burst, waiting {} ms", kind.key(), index + 1, delay.toMillis());
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while throttling {}, proceeding", kind.key());
        }
    }

    /** calls of {@code kind} taken so far */
    public int used(OperationKind kind) { return counters.get(kind).get(); }
}
