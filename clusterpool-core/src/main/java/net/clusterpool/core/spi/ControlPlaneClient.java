package net.clusterpool.core.spi;

import net.clusterpool.core.error.CancelException;
import net.clusterpool.core.error.CreateClusterException;
import net.clusterpool.core.error.CredentialsException;
import net.clusterpool.core.error.UnableToAssignException;
import net.clusterpool.core.error.UnableToTerminateException;
import net.clusterpool.core.error.UpdateStatusException;
import net.clusterpool.core.model.LaunchConfig;

import java.util.Map;

/**
 * Remote compute control plane, bound to one set of credentials.
 * <p>
 * Implementations never let transport exceptions escape: every failure is reported through the
 * typed exception of the operation.
 * Describe operations return the raw payload in the remote API's own shape
 * ({@code {"Cluster": {"Status": {"State": ...}}}} / {@code {"Step": {...}}}).
 */
public interface ControlPlaneClient {

    void checkCredentials() throws CredentialsException;

    /** @return remote cluster id */
    String createCluster(LaunchConfig launchConfig) throws CreateClusterException;

    /** @return remote id of the added work unit */
    String addWorkUnit(String clusterId, Map<String, Object> workSpec) throws UnableToAssignException;

    Map<String, Object> describeCluster(String clusterId) throws UpdateStatusException;

    Map<String, Object> describeWorkUnit(String clusterId, String workId) throws UpdateStatusException;

    void terminateCluster(String clusterId) throws UnableToTerminateException;

    void cancelWorkUnit(String clusterId, String workId) throws CancelException;
}
