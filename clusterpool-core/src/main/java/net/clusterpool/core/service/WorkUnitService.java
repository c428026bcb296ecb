package net.clusterpool.core.service;

import net.clusterpool.core.error.CredentialsException;
import net.clusterpool.core.error.EntityNotFoundException;
import net.clusterpool.core.error.NotOwnerException;
import net.clusterpool.core.error.WorkUnitCreationException;
import net.clusterpool.core.metrics.MetricEvent;
import net.clusterpool.core.metrics.Metrics;
import net.clusterpool.core.model.Cluster;
import net.clusterpool.core.model.ClusterConfigRequest;
import net.clusterpool.core.model.Credentials;
import net.clusterpool.core.model.LaunchConfig;
import net.clusterpool.core.model.WorkUnit;
import net.clusterpool.core.quota.RateLimiter;
import net.clusterpool.core.spi.Clock;
import net.clusterpool.core.spi.ClusterRepository;
import net.clusterpool.core.spi.MetricsSink;
import net.clusterpool.core.spi.TxRunner;
import net.clusterpool.core.spi.WorkUnitRepository;
import net.clusterpool.core.status.CredentialExpiry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Submission, cancellation and lookup of work units on behalf of a user. */
public final class WorkUnitService {
    private static final Logger log = LoggerFactory.getLogger(WorkUnitService.class);

    private final WorkUnitRepository workUnits;
    private final ClusterRepository clusters;
    private final TxRunner tx;
    private final EntityBinder binder;
    private final ClusterConfigurationService configurations;
    private final Clock clock;
    private final MetricsSink metrics;
    private final PassSettings settings;

    public WorkUnitService(WorkUnitRepository workUnits, ClusterRepository clusters, TxRunner tx, EntityBinder binder,
                           ClusterConfigurationService configurations, Clock clock, MetricsSink metrics,
                           PassSettings settings) {
        this.workUnits = workUnits;
        this.clusters = clusters;
        this.tx = tx;
        this.binder = binder;
        this.configurations = configurations;
        this.clock = clock;
        this.metrics = metrics;
        this.settings = settings;
    }

    /**
     * Creates an UNASSIGNED unit; the next scheduling pass places it.
     *
     * @throws WorkUnitCreationException when the unit cannot be built or its credentials are rejected
     */
    public WorkUnit submit(String actor, Map<String, Object> workSpec, Map<String, Object> customMetadata,
                           Credentials credentials, ClusterConfigRequest config, boolean test) throws Exception {
        LaunchConfig launchConfig = configurations.resolve(config);
        WorkUnit unit = WorkUnit.create(actor, workSpec, customMetadata, credentials, launchConfig, test, clock.now());
        try {
            binder.bind(unit, null);
        } catch (CredentialsException e) {
            unit.transitionTo(WorkUnit.Status.FAILED);
            throw new WorkUnitCreationException("Error creating the requested work unit - msg: " + e.getMessage(), e);
        }

        tx.required(() -> workUnits.insert(unit));
        log.info("Submitted work unit {} ({}) for {}", unit.id(), unit.name(), actor);
        Metrics.recordQuietly(metrics, MetricEvent.forWorkUnit(unit));
        return unit;
    }

    /**
     * Cancels a unit owned by {@code actor}. The remote call is skipped when the host cluster is
     * already gone; a failing remote cancel is logged and the unit still ends CANCELLED.
     */
    public WorkUnit cancel(long id, String actor) throws Exception {
        return tx.required(() -> {
            WorkUnit unit = workUnits.lockById(id)
                    .orElseThrow(() -> new EntityNotFoundException("Work unit " + id + " does not exist"));
            if (!unit.owner().equals(actor)) {
                throw new NotOwnerException("Work unit " + id + " belongs to another user");
            }
            if (unit.isTerminal()) {
                log.info("Work unit {} is already {}", id, unit.status());
                return unit;
            }

            boolean hostActive = false;
            if (unit.clusterId() != null) {
                hostActive = clusters.findById(unit.clusterId()).map(c -> !c.isTerminal()).orElse(false);
            }
            try {
                binder.bind(unit, new RateLimiter(settings.quota(), settings.sleeper()));
            } catch (CredentialsException e) {
                unit.transitionTo(CredentialExpiry.indicatedBy(e) ? WorkUnit.Status.EXPIRED_TOKEN : WorkUnit.Status.CANCEL_ERROR);
                unit.touch(clock.now());
                workUnits.update(unit);
                return unit;
            }
            unit.cancel(hostActive);
            unit.touch(clock.now());
            workUnits.update(unit);
            return unit;
        });
    }

    /** Loads a unit with its log location resolved against the host cluster. */
    public Optional<WorkUnit> find(long id) throws Exception {
        return tx.required(() -> {
            Optional<WorkUnit> unit = workUnits.findById(id);
            if (unit.isPresent()) withLogsUri(unit.get());
            return unit;
        });
    }

    public List<WorkUnit> listByStatus(WorkUnit.Status status) throws Exception {
        return tx.required(() -> workUnits.findByStatus(status));
    }

    public List<WorkUnit> listByCluster(String clusterId) throws Exception {
        return tx.required(() -> workUnits.findByCluster(clusterId));
    }

    private void withLogsUri(WorkUnit unit) throws Exception {
        if (unit.clusterId() == null) return;
        Optional<Cluster> host = clusters.findById(unit.clusterId());
        if (host.isEmpty()) {
            log.error("Unable to get log URI - msg: cluster {} of work unit {} was not found", unit.clusterId(), unit.id());
            return;
        }
        unit.deriveLogsUri(host.get().logsUri());
    }
}
