package net.clusterpool.core.service;

import net.clusterpool.core.error.EntityNotFoundException;
import net.clusterpool.core.error.NotOwnerException;
import net.clusterpool.core.error.UnableToTerminateException;
import net.clusterpool.core.metrics.MetricEvent;
import net.clusterpool.core.metrics.Metrics;
import net.clusterpool.core.model.Cluster;
import net.clusterpool.core.model.ClusterConfigRequest;
import net.clusterpool.core.model.Credentials;
import net.clusterpool.core.model.LaunchConfig;
import net.clusterpool.core.quota.RateLimiter;
import net.clusterpool.core.spi.Clock;
import net.clusterpool.core.spi.ClusterRepository;
import net.clusterpool.core.spi.MetricsSink;
import net.clusterpool.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/** Clusters launched and terminated directly by users. */
public final class ClusterService {
    private static final Logger log = LoggerFactory.getLogger(ClusterService.class);

    private final ClusterRepository clusters;
    private final TxRunner tx;
    private final EntityBinder binder;
    private final ClusterConfigurationService configurations;
    private final Clock clock;
    private final MetricsSink metrics;
    private final PassSettings settings;

    public ClusterService(ClusterRepository clusters, TxRunner tx, EntityBinder binder,
                          ClusterConfigurationService configurations, Clock clock, MetricsSink metrics,
                          PassSettings settings) {
        this.clusters = clusters;
        this.tx = tx;
        this.binder = binder;
        this.configurations = configurations;
        this.clock = clock;
        this.metrics = metrics;
        this.settings = settings;
    }

    /**
     * Creates a user cluster that expires {@code lifetime} from now.
     *
     * @param lifetime null for the configured default
     */
    public Cluster launch(String actor, Credentials credentials, ClusterConfigRequest config, Duration lifetime)
            throws Exception {
        LaunchConfig launchConfig = configurations.resolve(config);
        Cluster cluster = Cluster.newUserCluster(actor, credentials, launchConfig,
                lifetime == null ? settings.defaultLifetime() : lifetime, clock.now());
        binder.bind(cluster, limiter());
        cluster.create();
        tx.required(() -> { clusters.insert(cluster); return null; });
        Metrics.recordQuietly(metrics, MetricEvent.forCluster(cluster));
        return cluster;
    }

    /**
     * Terminates a user's cluster. The resulting status is stored even when the remote call fails;
     * the failure is rethrown afterwards.
     */
    public Cluster terminate(String clusterId, String actor) throws Exception {
        Terminated t = tx.required(() -> {
            Cluster cluster = owned(clusterId, actor);
            binder.bind(cluster, limiter());
            UnableToTerminateException failure = null;
            try {
                cluster.terminate();
            } catch (UnableToTerminateException e) {
                failure = e;
            }
            cluster.touch(clock.now());
            clusters.update(cluster);
            return new Terminated(cluster, failure);
        });
        if (t.failure() != null) throw t.failure();
        return t.cluster();
    }

    /** Pushes the deadline of a user's cluster back by {@code extra}. */
    public Cluster extend(String clusterId, Duration extra, String actor) throws Exception {
        return tx.required(() -> {
            Cluster cluster = owned(clusterId, actor);
            if (cluster.isTerminal()) {
                throw new IllegalStateException("Cluster " + clusterId + " is already " + cluster.status());
            }
            cluster.extend(extra, clock.now());
            cluster.touch(clock.now());
            clusters.update(cluster);
            log.info("Cluster {} now expires at {}", clusterId, cluster.terminateOn());
            return cluster;
        });
    }

    public Optional<Cluster> find(String clusterId) throws Exception {
        return tx.required(() -> clusters.findById(clusterId));
    }

    /** every cluster still alive */
    public List<Cluster> list() throws Exception {
        return tx.required(clusters::findNonTerminal);
    }

    private Cluster owned(String clusterId, String actor) throws Exception {
        Cluster cluster = clusters.lockById(clusterId)
                .orElseThrow(() -> new EntityNotFoundException("Cluster " + clusterId + " does not exist"));
        if (!cluster.owner().equals(actor)) {
            throw new NotOwnerException("Cluster " + clusterId + " belongs to another user");
        }
        return cluster;
    }

    private RateLimiter limiter() {
        return new RateLimiter(settings.quota(), settings.sleeper());
    }

    private record Terminated(Cluster cluster, UnableToTerminateException failure) {}
}
