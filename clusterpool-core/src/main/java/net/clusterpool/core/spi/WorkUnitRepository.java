package net.clusterpool.core.spi;

import net.clusterpool.core.model.WorkUnit;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface WorkUnitRepository {
    /** INSERT, returns the generated local id (also written back into the unit) */
    long insert(WorkUnit unit) throws Exception;

    /**
     * Writes the unit's mutable fields unless the stored row already holds a terminal status.
     *
     * @return false when the stored row is terminal and nothing was written
     */
    boolean update(WorkUnit unit) throws Exception;

    Optional<WorkUnit> findById(long id) throws Exception;

    /** same as {@link #findById} but FOR UPDATE */
    Optional<WorkUnit> lockById(long id) throws Exception;

    /** UNASSIGNED units ordered by id, optionally restricted to {@code ids}; FOR UPDATE */
    List<WorkUnit> lockUnassigned(Collection<Long> ids) throws Exception;

    /** every unit whose status is outside {@link WorkUnit.Status#TERMINAL} */
    List<WorkUnit> findNonTerminal() throws Exception;

    List<WorkUnit> findByStatus(WorkUnit.Status status) throws Exception;

    List<WorkUnit> findByCluster(String clusterId) throws Exception;
}
