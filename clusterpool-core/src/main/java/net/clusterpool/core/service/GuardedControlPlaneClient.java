package net.clusterpool.core.service;

import net.clusterpool.core.error.CancelException;
import net.clusterpool.core.error.CreateClusterException;
import net.clusterpool.core.error.CredentialsException;
import net.clusterpool.core.error.UnableToAssignException;
import net.clusterpool.core.error.UnableToTerminateException;
import net.clusterpool.core.error.UpdateStatusException;
import net.clusterpool.core.model.LaunchConfig;
import net.clusterpool.core.quota.OperationKind;
import net.clusterpool.core.quota.RateLimiter;
import net.clusterpool.core.spi.ControlPlaneClient;

import java.util.Map;

/**
 * Decorates an entity's control-plane handle: takes a rate-limit slot before every remote call
 * and turns any unchecked failure of the delegate into the operation's typed exception.
 */
final class GuardedControlPlaneClient implements ControlPlaneClient {
    private final ControlPlaneClient delegate;
    private final RateLimiter limiter;   // null: not throttled

    GuardedControlPlaneClient(ControlPlaneClient delegate, RateLimiter limiter) {
        this.delegate = delegate;
        this.limiter = limiter;
    }

    @Override
    public void checkCredentials() throws CredentialsException {
        try {
            delegate.checkCredentials();
        } catch (RuntimeException e) {
            throw new CredentialsException(null, "Credential check failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String createCluster(LaunchConfig launchConfig) throws CreateClusterException {
        acquire(OperationKind.CREATE_CLUSTER);
        try {
            return delegate.createCluster(launchConfig);
        } catch (RuntimeException e) {
            throw new CreateClusterException(launchConfig.name(), "Error creating cluster: " + e.getMessage(), e);
        }
    }

    @Override
    public String addWorkUnit(String clusterId, Map<String, Object> workSpec) throws UnableToAssignException {
        acquire(OperationKind.ADD_WORK);
        try {
            return delegate.addWorkUnit(clusterId, workSpec);
        } catch (RuntimeException e) {
            throw new UnableToAssignException(clusterId, "Error adding work unit to cluster " + clusterId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, Object> describeCluster(String clusterId) throws UpdateStatusException {
        acquire(OperationKind.DESCRIBE_CLUSTER);
        try {
            return delegate.describeCluster(clusterId);
        } catch (RuntimeException e) {
            throw new UpdateStatusException(clusterId, "Error describing cluster " + clusterId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, Object> describeWorkUnit(String clusterId, String workId) throws UpdateStatusException {
        acquire(OperationKind.DESCRIBE_WORK);
        try {
            return delegate.describeWorkUnit(clusterId, workId);
        } catch (RuntimeException e) {
            throw new UpdateStatusException(workId, "Error describing work unit " + workId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void terminateCluster(String clusterId) throws UnableToTerminateException {
        acquire(OperationKind.TERMINATE_CLUSTER);
        try {
            delegate.terminateCluster(clusterId);
        } catch (RuntimeException e) {
            throw new UnableToTerminateException(clusterId, "Error terminating cluster " + clusterId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void cancelWorkUnit(String clusterId, String workId) throws CancelException {
        acquire(OperationKind.CANCEL_WORK);
        try {
            delegate.cancelWorkUnit(clusterId, workId);
        } catch (RuntimeException e) {
            throw new CancelException(workId, "Error cancelling work unit " + workId + ": " + e.getMessage(), e);
        }
    }

    private void acquire(OperationKind kind) {
        if (limiter != null) limiter.acquire(kind);
    }
}
