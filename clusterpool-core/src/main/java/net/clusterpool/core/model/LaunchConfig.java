package net.clusterpool.core.model;

import net.clusterpool.core.json.Json;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;

/**
 * Full launch specification of a cluster, kept as an insertion-ordered JSON object.
 * <p>
 * {@link #hash()} is the compatibility key used for placement: SHA-256 over the canonical
 * serialization. Canonical means "as serialized", keys are not sorted, so two configs that only
 * differ in key order hash differently.
 */
public final class LaunchConfig {
    private final Map<String, Object> document;
    private final String canonicalJson;
    private final String hash;

    private LaunchConfig(Map<String, Object> document) {
        this.document = Collections.unmodifiableMap(document);
        this.canonicalJson = Json.write(document);
        this.hash = sha256(canonicalJson);
    }

    public static LaunchConfig of(Map<String, Object> document) {
        Objects.requireNonNull(document, "document");
        return new LaunchConfig(Json.copy(document));
    }

    public static LaunchConfig parse(String json) {
        return new LaunchConfig(Json.readObject(json));
    }

    /** read-only view; use {@link #mutableCopy()} to derive a customized config */
    public Map<String, Object> document() { return document; }

    public Map<String, Object> mutableCopy() { return Json.copy(document); }

    public String canonicalJson() { return canonicalJson; }

    public String hash() { return hash; }

    /** value of the top-level {@code Name} entry, or null */
    public String name() {
        Object n = document.get("Name");
        return n == null ? null : n.toString();
    }

    private static String sha256(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LaunchConfig other)) return false;
        return canonicalJson.equals(other.canonicalJson);
    }

    @Override
    public int hashCode() { return canonicalJson.hashCode(); }

    @Override
    public String toString() { return "LaunchConfig{name=" + name() + ", hash=" + hash.substring(0, 12) + '}'; }
}
