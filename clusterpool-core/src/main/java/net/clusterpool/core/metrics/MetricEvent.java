package net.clusterpool.core.metrics;

import net.clusterpool.core.model.Cluster;
import net.clusterpool.core.model.WorkUnit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A counter increment with its tags. Null tag values are dropped. */
public record MetricEvent(String name, Map<String, String> tags) {
    public static final String PREFIX = "business.cluster_pool.";

    public MetricEvent {
        tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public static MetricEvent forWorkUnit(WorkUnit unit) {
        Map<String, String> t = new LinkedHashMap<>();
        put(t, "name", unit.name());
        put(t, "user", unit.owner());
        put(t, "is_test", String.valueOf(unit.test()));
        put(t, "cluster_config_name", unit.launchConfig().name());
        unit.customMetadata().forEach((k, v) -> put(t, "custom." + k, v == null ? null : v.toString()));
        return new MetricEvent(PREFIX + "workunit", t);
    }

    public static MetricEvent forCluster(Cluster cluster) {
        Map<String, String> t = new LinkedHashMap<>();
        put(t, "id", cluster.id());
        put(t, "user", cluster.owner());
        put(t, "kind", cluster.kind().code().toLowerCase());
        put(t, "cluster_config_name", cluster.launchConfig().name());
        return new MetricEvent(PREFIX + "cluster", t);
    }

    private static void put(Map<String, String> tags, String key, String value) {
        if (value != null) tags.put(key, value);
    }
}
