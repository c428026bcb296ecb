package net.clusterpool.core.service;

import net.clusterpool.core.error.UnableToTerminateException;
import net.clusterpool.core.model.Cluster;
import net.clusterpool.core.quota.RateLimiter;
import net.clusterpool.core.spi.Clock;
import net.clusterpool.core.spi.ClusterRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/** Terminates user and scheduler-managed clusters whose deadline has passed. */
public final class ExpiryService {
    private static final Logger log = LoggerFactory.getLogger(ExpiryService.class);

    private final ClusterRepository clusters;
    private final EntityBinder binder;
    private final Clock clock;

    public ExpiryService(ClusterRepository clusters, EntityBinder binder, Clock clock) {
        this.clusters = clusters;
        this.binder = binder;
        this.clock = clock;
    }

    /** @return number of clusters terminated */
    public int terminateExpired(RateLimiter limiter) throws Exception {
        Instant now = clock.now();
        List<Cluster> expired = clusters.lockExpired(now);
        int terminated = 0;
        for (Cluster cluster : expired) {
            if (!cluster.isExpired(now)) continue;
            if (binder.tryBind(cluster, limiter)) {
                try {
                    cluster.terminate();
                    terminated++;
                } catch (UnableToTerminateException e) {
                    log.warn("Cluster {} could not be terminated - msg: {}", cluster.id(), e.getMessage());
                }
            }
            cluster.touch(clock.now());
            clusters.update(cluster);
        }
        if (!expired.isEmpty()) log.info("Terminated {}/{} expired cluster(s)", terminated, expired.size());
        return terminated;
    }
}
