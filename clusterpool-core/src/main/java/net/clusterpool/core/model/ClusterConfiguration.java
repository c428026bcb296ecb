package net.clusterpool.core.model;

import java.time.Instant;

/**
 * Named, versioned launch-configuration template. The content lives in the content store at
 * {@code contentUri}; the row only indexes it. Immutable once registered.
 */
public record ClusterConfiguration(
        Long id,
        String name,
        String version,     // sortable UTC timestamp, e.g. 20240131093015123456
        String contentUri,
        String owner,
        Instant createdAt
) {
    public ClusterConfiguration withId(long newId) {
        return new ClusterConfiguration(newId, name, version, contentUri, owner, createdAt);
    }
}
