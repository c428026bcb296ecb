package net.clusterpool.core.service;

import net.clusterpool.core.error.CreateClusterException;
import net.clusterpool.core.error.UnableToAssignException;
import net.clusterpool.core.metrics.MetricEvent;
import net.clusterpool.core.metrics.Metrics;
import net.clusterpool.core.model.Cluster;
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

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Places pending work units on idle scheduler-managed clusters with the same config hash, oldest
 * cluster first, and provisions a new cluster when none is free.
 * <p>
 * Must run inside the pass transaction: pending units are locked for its duration. Idle clusters are
 * read without a lock.
 */
public final class AssignmentService {
    private static final Logger log = LoggerFactory.getLogger(AssignmentService.class);

    public record Result(int placed, int clustersCreated, int badConfig, int errors) {}

    private final WorkUnitRepository workUnits;
    private final ClusterRepository clusters;
    private final TxRunner tx;
    private final EntityBinder binder;
    private final Clock clock;
    private final MetricsSink metrics;

    public AssignmentService(WorkUnitRepository workUnits, ClusterRepository clusters, TxRunner tx,
                             EntityBinder binder, Clock clock, MetricsSink metrics) {
        this.workUnits = workUnits;
        this.clusters = clusters;
        this.tx = tx;
        this.binder = binder;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * @param ids restricts the pass to these units; null or empty means every pending unit
     */
    public Result assignPending(Collection<Long> ids, RateLimiter limiter) throws Exception {
        List<WorkUnit> pending = workUnits.lockUnassigned(ids == null || ids.isEmpty() ? null : ids);
        Map<String, Deque<Cluster>> idle = bucketByConfig(clusters.findIdleManaged());
        log.info("Assigning {} work unit(s), {} idle cluster group(s)", pending.size(), idle.size());

        int placed = 0, created = 0, badConfig = 0, errors = 0;
        for (WorkUnit unit : pending) {
            Placement p = new Placement();
            try {
                binder.bind(unit, limiter);
                p.cluster = viableCluster(unit, idle, limiter, p);
                String remoteId = p.cluster.addWorkUnit(unit.workSpec());
                unit.checkIn(p.cluster.id(), remoteId);
                Metrics.recordQuietly(metrics, MetricEvent.forCluster(p.cluster));
                placed++;
            } catch (CreateClusterException | UnableToAssignException e) {
                log.error("Work unit {} rejected - msg: {}", unit.id(), e.getMessage());
                unit.transitionTo(CredentialExpiry.indicatedBy(e) ? WorkUnit.Status.EXPIRED_TOKEN : WorkUnit.Status.BAD_CONFIG);
                badConfig++;
            } catch (Exception e) {
                log.error("Unexpected failure assigning work unit {} - msg: {}", unit.id(), e.getMessage(), e);
                unit.transitionTo(CredentialExpiry.indicatedBy(e) ? WorkUnit.Status.EXPIRED_TOKEN : WorkUnit.Status.ERROR);
                errors++;
            }
            if (p.created) created++;
            Instant now = clock.now();
            if (p.cluster != null && p.cluster.id() != null) {
                p.cluster.touch(now);
                clusters.update(p.cluster);
            }
            unit.touch(now);
            workUnits.update(unit);
        }
        return new Result(placed, created, badConfig, errors);
    }

    /** Groups idle clusters by config hash, keeping query order inside each group. */
    static Map<String, Deque<Cluster>> bucketByConfig(List<Cluster> idleClusters) {
        Map<String, Deque<Cluster>> buckets = new LinkedHashMap<>();
        for (Cluster c : idleClusters) {
            buckets.computeIfAbsent(c.configHash(), k -> new ArrayDeque<>()).addLast(c);
        }
        return buckets;
    }

    private Cluster viableCluster(WorkUnit unit, Map<String, Deque<Cluster>> idle, RateLimiter limiter, Placement p)
            throws Exception {
        Deque<Cluster> matching = idle.get(unit.configHash());
        if (matching != null && !matching.isEmpty()) {
            Cluster reused = matching.pollFirst();
            binder.bind(reused, limiter);
            log.debug("Reusing idle cluster {} for work unit {}", reused.id(), unit.id());
            return reused;
        }

        Cluster cluster = Cluster.newManaged(unit.credentials(), unit.launchConfig(), clock.now());
        binder.bind(cluster, limiter);
        cluster.create();
        // committed right away so the cluster exists even if the pass fails later
        tx.requiresNew(() -> { clusters.insert(cluster); return null; });
        p.created = true;
        return cluster;
    }

    private static final class Placement {
        Cluster cluster;
        boolean created;
    }
}
