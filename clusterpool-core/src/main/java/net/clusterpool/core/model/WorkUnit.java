package net.clusterpool.core.model;

import net.clusterpool.core.error.CancelException;
import net.clusterpool.core.error.UpdateStatusException;
import net.clusterpool.core.error.WorkUnitCreationException;
import net.clusterpool.core.json.Json;
import net.clusterpool.core.spi.ControlPlaneClient;
import net.clusterpool.core.status.StatusBracket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A discrete unit of work submitted for execution on a cluster.
 * <p>
 * Status is {@link Status#UNASSIGNED} exactly while no cluster hosts the unit; {@link #checkIn}
 * is the only way to attach one. Terminal statuses are final: later transitions are ignored.
 */
public final class WorkUnit {
    private static final Logger log = LoggerFactory.getLogger(WorkUnit.class);

    public enum Status {
        UNASSIGNED, PENDING, RUNNING, COMPLETED, CANCELLED, FAILED, INTERRUPTED,
        BAD_CONFIG, ERROR, EXPIRED_TOKEN, CANCEL_ERROR, NO_UPDATE;

        public static final Set<Status> TERMINAL = Collections.unmodifiableSet(EnumSet.of(
                COMPLETED, CANCELLED, FAILED, INTERRUPTED, BAD_CONFIG, ERROR, EXPIRED_TOKEN));

        public boolean terminal() { return TERMINAL.contains(this); }

        public static Status from(String s) {
            if (s == null) return NO_UPDATE;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return NO_UPDATE; }
        }

        /** remote step state → local status; null for states this pool does not know */
        public static Status fromRemote(String state) {
            if (state == null) return null;
            return switch (state) {
                case "PENDING", "CANCEL_PENDING" -> PENDING;
                case "RUNNING" -> RUNNING;
                case "COMPLETED" -> COMPLETED;
                case "CANCELLED" -> CANCELLED;
                case "FAILED" -> FAILED;
                case "INTERRUPTED" -> INTERRUPTED;
                default -> null;
            };
        }

        public String code() { return name(); }
    }

    private Long id;
    private String name;
    private String remoteId;
    private Status status;
    private String clusterId;
    private String owner;
    private boolean test;
    private Credentials credentials;
    private Map<String, Object> workSpec;
    private LaunchConfig launchConfig;
    private Map<String, Object> customMetadata;
    private Map<String, Object> snapshot;
    private Instant createdAt;
    private Instant updatedAt;

    // derived, not persisted
    private Instant remoteCreatedOn;
    private Instant startedOn;
    private Instant endedOn;
    private String logsUri;
    private transient ControlPlaneClient controlPlane;

    private WorkUnit() {}

    /**
     * Builds a new unit in {@link Status#UNASSIGNED}. Any validation failure leaves the instance in
     * {@link Status#FAILED} and surfaces as {@link WorkUnitCreationException}.
     */
    public static WorkUnit create(String owner,
                                  Map<String, Object> workSpec,
                                  Map<String, Object> customMetadata,
                                  Credentials credentials,
                                  LaunchConfig launchConfig,
                                  boolean test,
                                  Instant now) throws WorkUnitCreationException {
        WorkUnit u = new WorkUnit();
        try {
            u.bracket().onError(Status.FAILED).onSuccess(Status.UNASSIGNED).run(() -> {
                if (owner == null || owner.isBlank()) throw new IllegalArgumentException("owner is required");
                Objects.requireNonNull(workSpec, "work spec is required");
                Object name = workSpec.get("Name");
                if (name == null || name.toString().isBlank()) {
                    throw new IllegalArgumentException("work spec has no Name");
                }
                u.name = name.toString();
                u.owner = owner;
                u.workSpec = Json.copy(workSpec);
                u.customMetadata = customMetadata == null ? new LinkedHashMap<>() : Json.copy(customMetadata);
                u.credentials = Objects.requireNonNull(credentials, "credentials are required");
                u.launchConfig = Objects.requireNonNull(launchConfig, "launch config is required");
                u.test = test;
                u.snapshot = new LinkedHashMap<>();
                u.createdAt = now;
                u.updatedAt = now;
                return null;
            });
        } catch (RuntimeException e) {
            throw new WorkUnitCreationException("Error creating the requested work unit - msg: " + e.getMessage(), e);
        }
        return u;
    }

    /** Rebuilds a unit from storage. Derived fields are recomputed from the snapshot. */
    public static WorkUnit restore(Long id, String name, String remoteId, Status status, String clusterId,
                                   String owner, boolean test, Credentials credentials,
                                   Map<String, Object> workSpec, LaunchConfig launchConfig,
                                   Map<String, Object> customMetadata, Map<String, Object> snapshot,
                                   Instant createdAt, Instant updatedAt) {
        WorkUnit u = new WorkUnit();
        u.id = id;
        u.name = name;
        u.remoteId = remoteId;
        u.status = status;
        u.clusterId = clusterId;
        u.owner = owner;
        u.test = test;
        u.credentials = credentials;
        u.workSpec = workSpec;
        u.launchConfig = launchConfig;
        u.customMetadata = customMetadata == null ? new LinkedHashMap<>() : customMetadata;
        u.snapshot = snapshot == null ? new LinkedHashMap<>() : snapshot;
        u.createdAt = createdAt;
        u.updatedAt = updatedAt;
        u.deriveTimeline();
        return u;
    }

    public void bind(ControlPlaneClient client) { this.controlPlane = client; }

    public boolean bound() { return controlPlane != null; }

    /** Records placement on a cluster and moves to PENDING; a placement without ids ends in ERROR. */
    public void checkIn(String hostClusterId, String hostRemoteId) {
        bracket().onError(Status.ERROR).onSuccess(Status.PENDING).run(() -> {
            if (hostClusterId == null || hostRemoteId == null) {
                throw new IllegalArgumentException("cluster id and remote id are required to check in unit " + id);
            }
            log.info("Added work unit {} ({}) to cluster {}", id, hostRemoteId, hostClusterId);
            this.clusterId = hostClusterId;
            this.remoteId = hostRemoteId;
            return null;
        });
    }

    /**
     * Pulls the remote status. A unit not yet placed has nothing to describe and is left alone.
     * A failed describe keeps the previous status unless the credentials have expired.
     */
    public void reconcile() throws UpdateStatusException {
        if (clusterId == null || remoteId == null) return;
        bracket().onError(Status.NO_UPDATE).preserveOn(UpdateStatusException.class).run(() -> {
            Map<String, Object> payload = client().describeWorkUnit(clusterId, remoteId);
            String state = RemoteSnapshot.of(payload).text("Step", "Status", "State");
            Status next = Status.fromRemote(state);
            if (next == null) {
                throw new UpdateStatusException(String.valueOf(id), "Unknown remote state " + state + " for work unit " + remoteId);
            }
            this.snapshot = Json.copy(payload);
            transitionTo(next);
            deriveTimeline();
            return null;
        });
    }

    /**
     * Signals the host cluster to drop this unit. A remote cancel failure is logged, not raised;
     * the unit is marked CANCELLED locally either way.
     *
     * @param hostActive whether the host cluster is still running (a terminated host needs no call)
     */
    public void cancel(boolean hostActive) {
        bracket().onError(Status.CANCEL_ERROR).onSuccess(Status.CANCELLED).run(() -> {
            if (clusterId != null && remoteId != null && hostActive) {
                try {
                    client().cancelWorkUnit(clusterId, remoteId);
                } catch (CancelException e) {
                    log.error("Error cancelling work unit {} in cluster {} - msg: {}", id, clusterId, e.getMessage());
                }
            }
            log.info("Cancelling work unit {} in cluster {}", id, clusterId);
            return null;
        });
    }

    /**
     * Sets the status unless the unit already reached a terminal one.
     *
     * @return whether the status changed
     */
    public boolean transitionTo(Status next) {
        if (status != null && status.terminal() && next != status) {
            log.debug("Work unit {} is {} and stays there (ignored {})", id, status, next);
            return false;
        }
        status = next;
        return true;
    }

    private StatusBracket<Status> bracket() {
        return StatusBracket.of("work unit " + id, this::transitionTo, Status.EXPIRED_TOKEN);
    }

    private ControlPlaneClient client() {
        if (controlPlane == null) throw new IllegalStateException("work unit " + id + " has no control-plane handle");
        return controlPlane;
    }

    private void deriveTimeline() {
        RemoteSnapshot s = RemoteSnapshot.of(snapshot);
        remoteCreatedOn = Timestamps.parse(s.text("Step", "Status", "Timeline", "CreationDateTime"));
        startedOn = Timestamps.parse(s.text("Step", "Status", "Timeline", "StartDateTime"));
        endedOn = Timestamps.parse(s.text("Step", "Status", "Timeline", "EndDateTime"));
    }

    /** Log location under the host cluster's log root. */
    public void deriveLogsUri(String clusterLogsUri) {
        if (clusterLogsUri != null && remoteId != null) {
            logsUri = clusterLogsUri + "/steps/" + remoteId;
        }
    }

    public void assignId(long newId) { this.id = newId; }

    public void touch(Instant now) { this.updatedAt = now; }

    public String configHash() { return launchConfig.hash(); }

    public boolean isTerminal() { return status != null && status.terminal(); }

    public Long id() { return id; }
    public String name() { return name; }
    public String remoteId() { return remoteId; }
    public Status status() { return status; }
    public String clusterId() { return clusterId; }
    public String owner() { return owner; }
    public boolean test() { return test; }
    public Credentials credentials() { return credentials; }
    public Map<String, Object> workSpec() { return workSpec; }
    public LaunchConfig launchConfig() { return launchConfig; }
    public Map<String, Object> customMetadata() { return customMetadata; }
    public Map<String, Object> snapshot() { return snapshot; }
    public Instant createdAt() { return createdAt; }
    public Instant updatedAt() { return updatedAt; }
    public Instant remoteCreatedOn() { return remoteCreatedOn; }
    public Instant startedOn() { return startedOn; }
    public Instant endedOn() { return endedOn; }
    public String logsUri() { return logsUri; }

    @Override
    public String toString() {
        return "WorkUnit{id=" + id + ", name='" + name + "', status=" + status + ", clusterId=" + clusterId + '}';
    }
}
