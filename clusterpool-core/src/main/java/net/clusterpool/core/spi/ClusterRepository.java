package net.clusterpool.core.spi;

import net.clusterpool.core.model.Cluster;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ClusterRepository {
    void insert(Cluster cluster) throws Exception;

    /** @return false when the stored row is already terminal; nothing is written then */
    boolean update(Cluster cluster) throws Exception;

    Optional<Cluster> findById(String id) throws Exception;

    /** FOR UPDATE */
    Optional<Cluster> lockById(String id) throws Exception;

    /** user and scheduler-managed clusters whose status is outside {@link Cluster.Status#TERMINAL} */
    List<Cluster> findNonTerminal() throws Exception;

    /** scheduler-managed clusters in WAITING, oldest first. No row lock. */
    List<Cluster> findIdleManaged() throws Exception;

    /** non-terminal clusters with TERMINATE_ON set and before {@code now}; FOR UPDATE */
    List<Cluster> lockExpired(Instant now) throws Exception;
}
