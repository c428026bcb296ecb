package net.clusterpool.core.service;

import net.clusterpool.core.quota.QuotaPolicy;
import net.clusterpool.core.spi.Sleeper;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of a scheduling pass.
 *
 * @param idleGrace       deadline given to a cluster first seen idle
 * @param defaultLifetime deadline of a user cluster launched without an explicit lifetime
 */
public record PassSettings(QuotaPolicy quota, Sleeper sleeper, Duration idleGrace, Duration defaultLifetime) {
    public static final Duration DEFAULT_IDLE_GRACE = Duration.ofMinutes(15);
    public static final Duration DEFAULT_LIFETIME = Duration.ofMinutes(240);

    public PassSettings {
        Objects.requireNonNull(quota, "quota");
        if (sleeper == null) sleeper = Sleeper.THREAD;
        if (idleGrace == null) idleGrace = DEFAULT_IDLE_GRACE;
        if (defaultLifetime == null) defaultLifetime = DEFAULT_LIFETIME;
    }

    public static PassSettings defaults() {
        return new PassSettings(QuotaPolicy.defaults(), Sleeper.THREAD, DEFAULT_IDLE_GRACE, DEFAULT_LIFETIME);
    }
}
