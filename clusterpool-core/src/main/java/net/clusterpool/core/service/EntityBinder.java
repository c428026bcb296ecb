package net.clusterpool.core.service;

import net.clusterpool.core.error.CredentialsException;
import net.clusterpool.core.model.Cluster;
import net.clusterpool.core.model.Credentials;
import net.clusterpool.core.model.WorkUnit;
import net.clusterpool.core.quota.RateLimiter;
import net.clusterpool.core.spi.ControlPlaneClient;
import net.clusterpool.core.spi.ControlPlaneClientFactory;
import net.clusterpool.core.status.CredentialExpiry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gives every materialized entity its own control-plane handle, built from the entity's credentials
 * and checked before first use. Handles are never shared between entities.
 */
public final class EntityBinder {
    private static final Logger log = LoggerFactory.getLogger(EntityBinder.class);

    private final ControlPlaneClientFactory factory;

    public EntityBinder(ControlPlaneClientFactory factory) {
        this.factory = factory;
    }

    public void bind(WorkUnit unit, RateLimiter limiter) throws CredentialsException {
        unit.bind(checkedClient(unit.credentials(), limiter, "work unit " + unit.id()));
    }

    public void bind(Cluster cluster, RateLimiter limiter) throws CredentialsException {
        cluster.bind(checkedClient(cluster.credentials(), limiter, "cluster " + cluster.id()));
    }

    /**
     * Binds a unit loaded by a sweep. Expired credentials make the unit EXPIRED_TOKEN; any other
     * credential failure leaves it untouched for the next pass.
     *
     * @return whether the unit can be worked on
     */
    boolean tryBind(WorkUnit unit, RateLimiter limiter) {
        try {
            bind(unit, limiter);
            return true;
        } catch (CredentialsException e) {
            if (CredentialExpiry.indicatedBy(e)) unit.transitionTo(WorkUnit.Status.EXPIRED_TOKEN);
            log.warn("Skipping work unit {} - msg: {}", unit.id(), e.getMessage());
            return false;
        }
    }

    boolean tryBind(Cluster cluster, RateLimiter limiter) {
        try {
            bind(cluster, limiter);
            return true;
        } catch (CredentialsException e) {
            if (CredentialExpiry.indicatedBy(e)) cluster.transitionTo(Cluster.Status.EXPIRED_TOKEN);
            log.warn("Skipping cluster {} - msg: {}", cluster.id(), e.getMessage());
            return false;
        }
    }

    private ControlPlaneClient checkedClient(Credentials credentials, RateLimiter limiter, String subject)
            throws CredentialsException {
        ControlPlaneClient raw;
        try {
            raw = factory.forCredentials(credentials);
        } catch (RuntimeException e) {
            throw new CredentialsException(null, "Unable to build a control-plane client for " + subject + ": " + e.getMessage(), e);
        }
        ControlPlaneClient client = new GuardedControlPlaneClient(raw, limiter);
        client.checkCredentials();
        return client;
    }
}
