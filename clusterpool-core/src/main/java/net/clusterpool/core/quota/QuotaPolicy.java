package net.clusterpool.core.quota;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-operation budgets plus a safety coefficient. The coefficient scales both the burst capacity and
 * the throttling delay.
 */
public final class QuotaPolicy {
    private final Map<OperationKind, QuotaBucket> buckets;
    private final double coefficient;

    public QuotaPolicy(Map<OperationKind, QuotaBucket> buckets, double coefficient) {
        if (!(coefficient > 0)) throw new IllegalArgumentException("coefficient must be > 0");
        EnumMap<OperationKind, QuotaBucket> copy = new EnumMap<>(OperationKind.class);
        copy.putAll(defaultBuckets());
        if (buckets != null) copy.putAll(buckets);
        this.buckets = Collections.unmodifiableMap(copy);
        this.coefficient = coefficient;
    }

    /** EMR's published API limits. */
    public static QuotaPolicy defaults() {
        return new QuotaPolicy(defaultBuckets(), 1.0);
    }

    private static Map<OperationKind, QuotaBucket> defaultBuckets() {
        EnumMap<OperationKind, QuotaBucket> m = new EnumMap<>(OperationKind.class);
        m.put(OperationKind.CREATE_CLUSTER, new QuotaBucket(10, 0.5));
        m.put(OperationKind.ADD_WORK, new QuotaBucket(10, 0.5));
        m.put(OperationKind.DESCRIBE_CLUSTER, new QuotaBucket(10, 1.0));
        m.put(OperationKind.TERMINATE_CLUSTER, new QuotaBucket(10, 0.5));
        m.put(OperationKind.CANCEL_WORK, new QuotaBucket(10, 0.2));
        m.put(OperationKind.DESCRIBE_WORK, new QuotaBucket(10, 0.5));
        return m;
    }

    public QuotaBucket bucket(OperationKind kind) { return buckets.get(kind); }

    public double coefficient() { return coefficient; }

    /** number of calls of {@code kind} that go through without waiting */
    public long burstCapacity(OperationKind kind) {
        return (long) (buckets.get(kind).burst() * coefficient);
    }

    public Duration throttleDelay(OperationKind kind) {
        double seconds = 1.0 / buckets.get(kind).refillPerSecond() * coefficient;
        return Duration.ofNanos((long) (seconds * 1_000_000_000L));
    }
}
