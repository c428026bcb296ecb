package net.clusterpool.adapter.jdbc.crypto;

import net.clusterpool.core.json.Json;
import net.clusterpool.core.model.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Seals per-entity credentials before they reach a table column.
 * Stored form: base64(iv || AES-GCM ciphertext) of a small JSON document.
 */
public final class CredentialsCipher {
    private static final Logger log = LoggerFactory.getLogger(CredentialsCipher.class);

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;

    private final SecretKey key;
    private final SecureRandom random = new SecureRandom();

    public CredentialsCipher(byte[] keyBytes) {
        int len = keyBytes == null ? 0 : keyBytes.length;
        if (len != 16 && len != 24 && len != 32) {
            throw new IllegalArgumentException("AES key must be 16, 24 or 32 bytes, got " + len);
        }
        this.key = new SecretKeySpec(keyBytes, "AES");
    }

    /** Key from configuration; blank means a throwaway key for this process only. */
    public static CredentialsCipher fromBase64(String base64Key) {
        if (base64Key == null || base64Key.isBlank()) return ephemeral();
        return new CredentialsCipher(Base64.getDecoder().decode(base64Key.trim()));
    }

    public static CredentialsCipher ephemeral() {
        log.warn("No credentials key configured; using an ephemeral key. Stored credentials will not survive a restart.");
        try {
            KeyGenerator gen = KeyGenerator.getInstance("AES");
            gen.init(256);
            return new CredentialsCipher(gen.generateKey().getEncoded());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES unavailable", e);
        }
    }

    public String encrypt(Credentials credentials) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("control_plane", toMap(credentials.controlPlane()));
        doc.put("content_store", toMap(credentials.contentStore()));
        byte[] plain = Json.write(doc).getBytes(StandardCharsets.UTF_8);
        try {
            byte[] iv = new byte[IV_BYTES];
            random.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            byte[] sealed = cipher.doFinal(plain);
            return Base64.getEncoder().encodeToString(ByteBuffer.allocate(iv.length + sealed.length).put(iv).put(sealed).array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("credentials encryption failed", e);
        }
    }

    public Credentials decrypt(String stored) {
        if (stored == null || stored.isBlank()) return null;
        byte[] all = Base64.getDecoder().decode(stored);
        if (all.length <= IV_BYTES) throw new IllegalStateException("stored credentials are truncated");
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, all, 0, IV_BYTES));
            byte[] plain = cipher.doFinal(all, IV_BYTES, all.length - IV_BYTES);
            Map<String, Object> doc = Json.readObject(new String(plain, StandardCharsets.UTF_8));
            return new Credentials(fromMap(doc.get("control_plane")), fromMap(doc.get("content_store")));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("stored credentials cannot be decrypted with the configured key", e);
        }
    }

    private static Map<String, Object> toMap(Credentials.AccessKey k) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("access_key_id", k.accessKeyId());
        m.put("secret_access_key", k.secretAccessKey());
        m.put("session_token", k.sessionToken());
        m.put("region", k.region());
        return m;
    }

    @SuppressWarnings("unchecked")
    private static Credentials.AccessKey fromMap(Object o) {
        if (!(o instanceof Map)) return null;
        Map<String, Object> m = (Map<String, Object>) o;
        return new Credentials.AccessKey(
                (String) m.get("access_key_id"),
                (String) m.get("secret_access_key"),
                (String) m.get("session_token"),
                (String) m.get("region"));
    }
}
