package net.clusterpool.core.model;

import java.util.Objects;

/**
 * Per-entity credentials: one key for the compute control plane, one for the content store.
 * Never shared between entities; secrets are masked in {@link #toString()}.
 */
public record Credentials(AccessKey controlPlane, AccessKey contentStore) {

    public static final String DEFAULT_REGION = "us-east-1";

    public Credentials {
        Objects.requireNonNull(controlPlane, "controlPlane");
        if (contentStore == null) contentStore = controlPlane;
    }

    public record AccessKey(String accessKeyId, String secretAccessKey, String sessionToken, String region) {
        public AccessKey {
            if (accessKeyId == null || accessKeyId.isBlank()) throw new IllegalArgumentException("accessKeyId is required");
            if (secretAccessKey == null || secretAccessKey.isBlank()) throw new IllegalArgumentException("secretAccessKey is required");
            if (region == null || region.isBlank()) region = DEFAULT_REGION;
        }

        public static AccessKey of(String accessKeyId, String secretAccessKey) {
            return new AccessKey(accessKeyId, secretAccessKey, null, null);
        }

        @Override
        public String toString() {
            return "AccessKey{" + mask(accessKeyId) + ", region=" + region + (sessionToken != null ? ", session" : "") + '}';
        }

        private static String mask(String id) {
            return id.length() <= 4 ? "****" : "****" + id.substring(id.length() - 4);
        }
    }
}
