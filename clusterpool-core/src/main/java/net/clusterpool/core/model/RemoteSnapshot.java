package net.clusterpool.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Read helper over a describe payload stored as nested maps. */
public final class RemoteSnapshot {
    private final Map<String, Object> payload;

    private RemoteSnapshot(Map<String, Object> payload) {
        this.payload = payload == null ? Collections.emptyMap() : payload;
    }

    public static RemoteSnapshot of(Map<String, Object> payload) { return new RemoteSnapshot(payload); }

    public boolean isEmpty() { return payload.isEmpty(); }

    public Map<String, Object> payload() { return payload; }

    public Object at(String... path) {
        Object cur = payload;
        for (String p : path) {
            if (!(cur instanceof Map<?, ?> m)) return null;
            cur = m.get(p);
        }
        return cur;
    }

    public String text(String... path) {
        Object v = at(path);
        return v == null ? null : v.toString();
    }

    @SuppressWarnings("unchecked")
    public List<Object> list(String... path) {
        Object v = at(path);
        return v instanceof List<?> l ? (List<Object>) l : Collections.emptyList();
    }
}
