package net.clusterpool.adapter.aws;

import software.amazon.awssdk.core.SdkField;
import software.amazon.awssdk.core.SdkPojo;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns an SDK response into plain maps keyed by the API's wire names,
 * e.g. {@code {"Cluster": {"Status": {"State": "WAITING"}}}}. Timestamps become ISO-8601 text;
 * unset members are left out.
 */
final class SnapshotMapper {
    private SnapshotMapper() {}

    static Map<String, Object> toMap(SdkPojo pojo) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (SdkField<?> field : pojo.sdkFields()) {
            Object value = field.getValueOrDefault(pojo);
            Object plain = plain(value);
            if (plain != null) out.put(field.locationName(), plain);
        }
        return out;
    }

    private static Object plain(Object value) {
        if (value == null) return null;
        if (value instanceof SdkPojo p) return toMap(p);
        if (value instanceof Instant i) return i.toString();
        if (value instanceof Collection<?> c) {
            // SDK leaves unset lists as auto-construct placeholders; they read as empty
            if (c.isEmpty()) return null;
            List<Object> list = new ArrayList<>(c.size());
            for (Object o : c) list.add(plain(o));
            return list;
        }
        if (value instanceof Map<?, ?> m) {
            if (m.isEmpty()) return null;
            Map<String, Object> map = new LinkedHashMap<>();
            m.forEach((k, v) -> map.put(String.valueOf(k), plain(v)));
            return map;
        }
        return value;
    }
}
