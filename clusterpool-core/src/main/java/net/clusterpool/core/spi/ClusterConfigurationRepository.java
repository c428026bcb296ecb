package net.clusterpool.core.spi;

import net.clusterpool.core.model.ClusterConfiguration;

import java.util.List;
import java.util.Optional;

public interface ClusterConfigurationRepository {
    ClusterConfiguration insert(ClusterConfiguration configuration) throws Exception;

    /** highest version for the name */
    Optional<ClusterConfiguration> findLatest(String name) throws Exception;

    Optional<ClusterConfiguration> findByNameAndVersion(String name, String version) throws Exception;

    /** every version of the name, newest first */
    List<ClusterConfiguration> findAllByName(String name) throws Exception;
}
