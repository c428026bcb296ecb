package net.clusterpool.core.support;

import net.clusterpool.core.error.CancelException;
import net.clusterpool.core.error.CreateClusterException;
import net.clusterpool.core.error.CredentialsException;
import net.clusterpool.core.error.UnableToAssignException;
import net.clusterpool.core.error.UnableToTerminateException;
import net.clusterpool.core.error.UpdateStatusException;
import net.clusterpool.core.model.Credentials;
import net.clusterpool.core.model.LaunchConfig;
import net.clusterpool.core.spi.ControlPlaneClient;
import net.clusterpool.core.spi.ControlPlaneClientFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable remote control plane. Clusters start STARTING, work units start PENDING; tests move
 * them with {@link #clusterState} / {@link #workState} and inject failures per id.
 */
public final class FakeControlPlane implements ControlPlaneClientFactory {
    public static final String LOG_URI = "s3://logs.example/emr";

    private final Map<String, String> clusterStates = new LinkedHashMap<>();
    private final Map<String, String> workStates = new LinkedHashMap<>();
    private final Map<String, String> workHosts = new LinkedHashMap<>();
    private final List<String> calls = new ArrayList<>();
    private final AtomicInteger clusterSeq = new AtomicInteger();
    private final AtomicInteger workSeq = new AtomicInteger();
    private final AtomicInteger clientsBuilt = new AtomicInteger();

    private final Set<String> rejectedConfigs = new HashSet<>();
    private final Set<String> rejectedAddWork = new HashSet<>();
    private final Set<String> failingDescribe = new HashSet<>();
    private final Set<String> crashingDescribe = new HashSet<>();
    private final Set<String> failingTerminate = new HashSet<>();
    private final Set<String> failingCancel = new HashSet<>();
    private final Set<String> expiredKeys = new HashSet<>();
    private final Set<String> invalidKeys = new HashSet<>();
    private boolean dropWorkIds;

    @Override
    public ControlPlaneClient forCredentials(Credentials credentials) {
        clientsBuilt.incrementAndGet();
        return new Client(credentials.controlPlane().accessKeyId());
    }

    public synchronized FakeControlPlane rejectConfig(String launchConfigName) { rejectedConfigs.add(launchConfigName); return this; }
    public synchronized FakeControlPlane rejectAddWork(String clusterId) { rejectedAddWork.add(clusterId); return this; }
    public synchronized FakeControlPlane failDescribe(String id) { failingDescribe.add(id); return this; }
    public synchronized FakeControlPlane crashDescribe(String id) { crashingDescribe.add(id); return this; }
    public synchronized FakeControlPlane failTerminate(String clusterId) { failingTerminate.add(clusterId); return this; }
    public synchronized FakeControlPlane failCancel(String workId) { failingCancel.add(workId); return this; }
    public synchronized FakeControlPlane expireKey(String accessKeyId) { expiredKeys.add(accessKeyId); return this; }
    public synchronized FakeControlPlane invalidateKey(String accessKeyId) { invalidKeys.add(accessKeyId); return this; }
    /** add-work calls succeed but report no remote id */
    public synchronized FakeControlPlane dropWorkIds() { dropWorkIds = true; return this; }

    public synchronized void clusterState(String clusterId, String state) { clusterStates.put(clusterId, state); }
    public synchronized void workState(String workId, String state) { workStates.put(workId, state); }
    public synchronized String clusterState(String clusterId) { return clusterStates.get(clusterId); }
    public synchronized String hostOf(String workId) { return workHosts.get(workId); }

    /** registers a cluster that already exists remotely */
    public synchronized void existingCluster(String clusterId, String state) { clusterStates.put(clusterId, state); }

    public synchronized List<String> calls() { return List.copyOf(calls); }

    public synchronized long count(String prefix) { return calls.stream().filter(c -> c.startsWith(prefix)).count(); }

    public int clientsBuilt() { return clientsBuilt.get(); }

    private synchronized void record(String call) { calls.add(call); }

    private final class Client implements ControlPlaneClient {
        private final String key;

        Client(String key) { this.key = key; }

        @Override
        public void checkCredentials() throws CredentialsException {
            synchronized (FakeControlPlane.this) {
                if (expiredKeys.contains(key)) {
                    throw new CredentialsException(null, "ExpiredTokenException: The security token included in the request is expired");
                }
                if (invalidKeys.contains(key)) {
                    throw new CredentialsException(null, "AccessDenied: not authorized to perform elasticmapreduce:ListClusters");
                }
            }
        }

        @Override
        public String createCluster(LaunchConfig launchConfig) throws CreateClusterException {
            record("create:" + launchConfig.name());
            synchronized (FakeControlPlane.this) {
                if (rejectedConfigs.contains(launchConfig.name())) {
                    throw new CreateClusterException(null, "ValidationException: invalid InstanceType for " + launchConfig.name());
                }
                String id = String.format("j-%06d", clusterSeq.incrementAndGet());
                clusterStates.put(id, "STARTING");
                return id;
            }
        }

        @Override
        public String addWorkUnit(String clusterId, Map<String, Object> workSpec) throws UnableToAssignException {
            record("add:" + clusterId);
            synchronized (FakeControlPlane.this) {
                if (rejectedAddWork.contains(clusterId)) {
                    throw new UnableToAssignException(clusterId, "InvalidRequestException: cluster " + clusterId + " is not active");
                }
                String id = String.format("s-%06d", workSeq.incrementAndGet());
                workStates.put(id, "PENDING");
                workHosts.put(id, clusterId);
                return dropWorkIds ? null : id;
            }
        }

        @Override
        public Map<String, Object> describeCluster(String clusterId) throws UpdateStatusException {
            record("describe-cluster:" + clusterId);
            synchronized (FakeControlPlane.this) {
                if (crashingDescribe.contains(clusterId)) throw new IllegalStateException("connection reset");
                if (failingDescribe.contains(clusterId)) {
                    throw new UpdateStatusException(clusterId, "ThrottlingException: rate exceeded");
                }
                String state = clusterStates.get(clusterId);
                if (state == null) throw new UpdateStatusException(clusterId, "Cluster " + clusterId + " not found");
                Map<String, Object> timeline = new LinkedHashMap<>();
                timeline.put("CreationDateTime", "2024-01-31T09:30:15Z");
                if (!"STARTING".equals(state) && !"BOOTSTRAPPING".equals(state)) {
                    timeline.put("ReadyDateTime", "2024-01-31T09:38:02Z");
                }
                Map<String, Object> status = new LinkedHashMap<>();
                status.put("State", state);
                status.put("Timeline", timeline);
                Map<String, Object> cluster = new LinkedHashMap<>();
                cluster.put("Id", clusterId);
                cluster.put("Status", status);
                cluster.put("MasterPublicDnsName", "ip-10-63-57-26.ec2.internal");
                cluster.put("LogUri", LOG_URI);
                cluster.put("Tags", List.of(Map.of("Key", "team", "Value", "data")));
                return Map.of("Cluster", cluster);
            }
        }

        @Override
        public Map<String, Object> describeWorkUnit(String clusterId, String workId) throws UpdateStatusException {
            record("describe-work:" + workId);
            synchronized (FakeControlPlane.this) {
                if (crashingDescribe.contains(workId)) throw new IllegalStateException("connection reset");
                if (failingDescribe.contains(workId)) {
                    throw new UpdateStatusException(workId, "ThrottlingException: rate exceeded");
                }
                String state = workStates.get(workId);
                if (state == null) throw new UpdateStatusException(workId, "Step " + workId + " not found");
                Map<String, Object> timeline = new LinkedHashMap<>();
                timeline.put("CreationDateTime", "2024-01-31T09:40:00Z");
                if (!"PENDING".equals(state)) timeline.put("StartDateTime", "2024-01-31T09:41:00Z");
                Map<String, Object> status = new LinkedHashMap<>();
                status.put("State", state);
                status.put("Timeline", timeline);
                Map<String, Object> step = new LinkedHashMap<>();
                step.put("Id", workId);
                step.put("Status", status);
                return Map.of("Step", step);
            }
        }

        @Override
        public void terminateCluster(String clusterId) throws UnableToTerminateException {
            record("terminate:" + clusterId);
            synchronized (FakeControlPlane.this) {
                if (failingTerminate.contains(clusterId)) {
                    throw new UnableToTerminateException(clusterId, "InternalServerError while terminating " + clusterId);
                }
                clusterStates.put(clusterId, "TERMINATING");
            }
        }

        @Override
        public void cancelWorkUnit(String clusterId, String workId) throws CancelException {
            record("cancel:" + workId);
            synchronized (FakeControlPlane.this) {
                if (failingCancel.contains(workId)) {
                    throw new CancelException(workId, "InvalidRequestException: step " + workId + " is not pending");
                }
                workStates.put(workId, "CANCELLED");
            }
        }
    }
}
