package net.clusterpool.core.model;

import java.util.List;
import java.util.Map;

/**
 * How a caller asks for a launch configuration: either inline, or a template reference with
 * optional version, customizations and extra bootstrap actions.
 */
public record ClusterConfigRequest(
        Map<String, Object> inline,
        String name,
        String version,
        Map<String, Object> customParameters,
        List<Map<String, Object>> bootstrapActions
) {
    public static ClusterConfigRequest inline(Map<String, Object> launchConfig) {
        return new ClusterConfigRequest(launchConfig, null, null, null, null);
    }

    public static ClusterConfigRequest template(String name) {
        return new ClusterConfigRequest(null, name, null, null, null);
    }

    public static ClusterConfigRequest template(String name, String version) {
        return new ClusterConfigRequest(null, name, version, null, null);
    }

    public ClusterConfigRequest customizedWith(Map<String, Object> params, List<Map<String, Object>> actions) {
        return new ClusterConfigRequest(inline, name, version, params, actions);
    }

    public boolean isInline() { return inline != null; }
}
