package net.clusterpool.core.model;

import net.clusterpool.core.error.CreateClusterException;
import net.clusterpool.core.error.UnableToAssignException;
import net.clusterpool.core.error.UnableToTerminateException;
import net.clusterpool.core.error.UpdateStatusException;
import net.clusterpool.core.json.Json;
import net.clusterpool.core.spi.ControlPlaneClient;
import net.clusterpool.core.status.StatusBracket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A remote compute cluster. User clusters and scheduler-managed clusters share this type;
 * {@link #managedByScheduler()} and {@link #kind()} tell them apart.
 * <p>
 * {@code terminateOn} is the idle deadline picked up by the expiry sweep. Adding a work unit clears it.
 */
public final class Cluster {
    private static final Logger log = LoggerFactory.getLogger(Cluster.class);

    public static final String SCHEDULER_OWNER = "manager";

    public enum Status {
        STARTING, BOOTSTRAPPING, RUNNING, WAITING, TERMINATING, TERMINATED, TERMINATED_WITH_ERRORS,
        ERROR, NO_UPDATE, EXPIRED_TOKEN;

        public static final Set<Status> TERMINAL = Collections.unmodifiableSet(EnumSet.of(
                TERMINATED, TERMINATED_WITH_ERRORS, EXPIRED_TOKEN));

        /** status of a cluster that can take work right away */
        public static final Status IDLE = WAITING;

        public boolean terminal() { return TERMINAL.contains(this); }

        public static Status from(String s) {
            if (s == null) return NO_UPDATE;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return NO_UPDATE; }
        }

        /** remote cluster state → local status; null for states this pool does not know */
        public static Status fromRemote(String state) {
            if (state == null) return null;
            return switch (state) {
                case "STARTING" -> STARTING;
                case "BOOTSTRAPPING" -> BOOTSTRAPPING;
                case "RUNNING" -> RUNNING;
                case "WAITING" -> WAITING;
                case "TERMINATING" -> TERMINATING;
                case "TERMINATED" -> TERMINATED;
                case "TERMINATED_WITH_ERRORS" -> TERMINATED_WITH_ERRORS;
                default -> null;
            };
        }

        public String code() { return name(); }
    }

    public enum Kind {
        USER, SCHEDULER;

        public static Kind from(String s) {
            return s == null ? USER : Kind.valueOf(s.toUpperCase());
        }

        public String code() { return name(); }
    }

    private String id;
    private Status status;
    private Kind kind;
    private boolean managedByScheduler;
    private String owner;
    private Credentials credentials;
    private LaunchConfig launchConfig;
    private List<String> assignedWorkUnits;
    private Instant terminateOn;
    private Map<String, Object> snapshot;
    private Instant createdAt;
    private Instant updatedAt;

    // derived from the snapshot, not persisted
    private String ipAddress;
    private String logsUri;
    private List<Object> tags;
    private Instant createdOn;
    private Instant readyOn;
    private Instant endedOn;
    private transient ControlPlaneClient controlPlane;

    private Cluster() {}

    /** A cluster requested by a user; it expires {@code lifetime} after creation unless extended. */
    public static Cluster newUserCluster(String owner, Credentials credentials, LaunchConfig launchConfig,
                                         Duration lifetime, Instant now) {
        if (owner == null || owner.isBlank()) throw new IllegalArgumentException("owner is required");
        Cluster c = blank(credentials, launchConfig, now);
        c.kind = Kind.USER;
        c.managedByScheduler = false;
        c.owner = owner;
        c.terminateOn = now.plus(Objects.requireNonNull(lifetime, "lifetime"));
        return c;
    }

    /** A cluster provisioned by the assignment engine. No deadline until it is seen idle. */
    public static Cluster newManaged(Credentials credentials, LaunchConfig launchConfig, Instant now) {
        Cluster c = blank(credentials, launchConfig, now);
        c.kind = Kind.SCHEDULER;
        c.managedByScheduler = true;
        c.owner = SCHEDULER_OWNER;
        return c;
    }

    private static Cluster blank(Credentials credentials, LaunchConfig launchConfig, Instant now) {
        Cluster c = new Cluster();
        c.credentials = Objects.requireNonNull(credentials, "credentials");
        c.launchConfig = Objects.requireNonNull(launchConfig, "launchConfig");
        c.assignedWorkUnits = new ArrayList<>();
        c.snapshot = new LinkedHashMap<>();
        c.createdAt = now;
        c.updatedAt = now;
        return c;
    }

    public static Cluster restore(String id, Status status, Kind kind, boolean managedByScheduler, String owner,
                                  Credentials credentials, LaunchConfig launchConfig, List<String> assignedWorkUnits,
                                  Instant terminateOn, Map<String, Object> snapshot,
                                  Instant createdAt, Instant updatedAt) {
        Cluster c = new Cluster();
        c.id = id;
        c.status = status;
        c.kind = kind;
        c.managedByScheduler = managedByScheduler;
        c.owner = managedByScheduler ? SCHEDULER_OWNER : owner;
        c.credentials = credentials;
        c.launchConfig = launchConfig;
        c.assignedWorkUnits = assignedWorkUnits == null ? new ArrayList<>() : new ArrayList<>(assignedWorkUnits);
        c.terminateOn = terminateOn;
        c.snapshot = snapshot == null ? new LinkedHashMap<>() : snapshot;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        c.deriveFromSnapshot();
        return c;
    }

    public void bind(ControlPlaneClient client) { this.controlPlane = client; }

    public boolean bound() { return controlPlane != null; }

    /** Provisions the remote cluster and records its id. */
    public void create() throws CreateClusterException {
        bracket().onError(Status.ERROR).onSuccess(Status.STARTING).run(() -> {
            try {
                this.id = client().createCluster(launchConfig);
                log.info("Created cluster {}", id);
            } catch (CreateClusterException e) {
                log.error("Error creating cluster {} - msg: {}", launchConfig.name(), e.getMessage());
                throw e;
            }
            return null;
        });
    }

    /**
     * Submits a work spec to this cluster.
     *
     * @return remote id of the added work unit
     */
    public String addWorkUnit(Map<String, Object> workSpec) throws UnableToAssignException {
        return bracket().onError(Status.ERROR).run(() -> {
            log.info("Adding a work unit to cluster {}", id);
            String remoteId;
            try {
                remoteId = client().addWorkUnit(id, workSpec);
            } catch (UnableToAssignException e) {
                log.error("Error adding work unit {} to cluster {} - msg: {}", workSpec.get("Name"), id, e.getMessage());
                throw e;
            }
            assignedWorkUnits.add(remoteId);
            terminateOn = null;
            return remoteId;
        });
    }

    /**
     * Pulls the remote status and derived fields. An idle cluster without a deadline gets one,
     * {@code idleGrace} from {@code now}. A failed describe keeps the previous status.
     */
    public void reconcile(Instant now, Duration idleGrace) throws UpdateStatusException {
        bracket().onError(Status.NO_UPDATE).preserveOn(UpdateStatusException.class).run(() -> {
            Map<String, Object> payload;
            try {
                payload = client().describeCluster(id);
            } catch (UpdateStatusException e) {
                log.error("Error updating status for cluster {} - msg: {}", id, e.getMessage());
                throw e;
            }
            String state = RemoteSnapshot.of(payload).text("Cluster", "Status", "State");
            Status next = Status.fromRemote(state);
            if (next == null) {
                throw new UpdateStatusException(id, "Unknown remote state " + state + " for cluster " + id);
            }
            this.snapshot = Json.copy(payload);
            transitionTo(next);
            deriveFromSnapshot();
            if (terminateOn == null && status == Status.IDLE) {
                terminateOn = now.plus(idleGrace);
                log.debug("Cluster {} is idle, expires at {}", id, terminateOn);
            }
            return null;
        });
    }

    public void terminate() throws UnableToTerminateException {
        bracket().onError(Status.TERMINATED_WITH_ERRORS).onSuccess(Status.TERMINATED).run(() -> {
            try {
                log.info("Terminating cluster {}", id);
                client().terminateCluster(id);
            } catch (UnableToTerminateException e) {
                log.error("Terminating cluster {} - msg: {}", id, e.getMessage());
                throw e;
            }
            return null;
        });
    }

    /** Pushes the deadline back. A cluster without a deadline gets one counted from {@code now}. */
    public void extend(Duration extra, Instant now) {
        terminateOn = (terminateOn == null ? now : terminateOn).plus(extra);
    }

    public boolean isExpired(Instant now) {
        return terminateOn != null && terminateOn.isBefore(now) && !isTerminal();
    }

    public boolean isTerminal() { return status != null && status.terminal(); }

    public boolean isIdle() { return status == Status.IDLE; }

    public boolean transitionTo(Status next) {
        if (status != null && status.terminal() && next != status) {
            log.debug("Cluster {} is {} and stays there (ignored {})", id, status, next);
            return false;
        }
        status = next;
        return true;
    }

    private StatusBracket<Status> bracket() {
        return StatusBracket.of("cluster " + id, this::transitionTo, Status.EXPIRED_TOKEN);
    }

    private ControlPlaneClient client() {
        if (controlPlane == null) throw new IllegalStateException("cluster " + id + " has no control-plane handle");
        return controlPlane;
    }

    private void deriveFromSnapshot() {
        RemoteSnapshot s = RemoteSnapshot.of(snapshot);
        if (s.isEmpty()) {
            ipAddress = null;
            logsUri = null;
            tags = null;
            return;
        }
        ipAddress = dnsNameToIp(s.text("Cluster", "MasterPublicDnsName"));
        String logRoot = s.text("Cluster", "LogUri");
        logsUri = logRoot == null || id == null ? null : (logRoot.endsWith("/") ? logRoot + id : logRoot + "/" + id);
        tags = s.list("Cluster", "Tags");
        createdOn = Timestamps.parse(s.text("Cluster", "Status", "Timeline", "CreationDateTime"));
        readyOn = Timestamps.parse(s.text("Cluster", "Status", "Timeline", "ReadyDateTime"));
        endedOn = Timestamps.parse(s.text("Cluster", "Status", "Timeline", "EndDateTime"));
    }

    /** {@code ip-10-63-57-26.ec2.internal} → {@code 10.63.57.26} */
    static String dnsNameToIp(String dnsName) {
        if (dnsName == null || dnsName.isBlank()) return null;
        String host = dnsName.split("\\.")[0];
        int dash = host.indexOf('-');
        return dash < 0 ? null : host.substring(dash + 1).replace('-', '.');
    }

    public void touch(Instant now) { this.updatedAt = now; }

    public String configHash() { return launchConfig.hash(); }

    public String id() { return id; }
    public Status status() { return status; }
    public Kind kind() { return kind; }
    public boolean managedByScheduler() { return managedByScheduler; }
    public String owner() { return owner; }
    public Credentials credentials() { return credentials; }
    public LaunchConfig launchConfig() { return launchConfig; }
    public List<String> assignedWorkUnits() { return Collections.unmodifiableList(assignedWorkUnits); }
    public Instant terminateOn() { return terminateOn; }
    public Map<String, Object> snapshot() { return snapshot; }
    public Instant createdAt() { return createdAt; }
    public Instant updatedAt() { return updatedAt; }
    public String ipAddress() { return ipAddress; }
    public String logsUri() { return logsUri; }
    public List<Object> tags() { return tags; }
    public Instant createdOn() { return createdOn; }
    public Instant readyOn() { return readyOn; }
    public Instant endedOn() { return endedOn; }

    @Override
    public String toString() {
        return "Cluster{id=" + id + ", kind=" + kind + ", status=" + status + ", terminateOn=" + terminateOn + '}';
    }
}
