package net.clusterpool.core.quota;

/**
 * Budget of one operation kind: {@code burst} calls go through immediately, every later call in the
 * same pass waits {@code 1 / refillPerSecond} seconds.
 */
public record QuotaBucket(int burst, double refillPerSecond) {
    public QuotaBucket {
        if (burst < 0) throw new IllegalArgumentException("burst must be >= 0");
        if (!(refillPerSecond > 0)) throw new IllegalArgumentException("refillPerSecond must be > 0");
    }
}
