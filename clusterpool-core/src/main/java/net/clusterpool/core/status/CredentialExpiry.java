package net.clusterpool.core.status;

import java.util.List;

/** Recognizes failures caused by expired or revoked credentials from the error text. */
public final class CredentialExpiry {
    private static final List<String> MARKERS = List.of(
            "ExpiredToken",          // ExpiredTokenException, ExpiredToken error code
            "InvalidClientTokenId",
            "TokenRevoked");

    private CredentialExpiry() {}

    public static boolean indicatedBy(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            String msg = t.getMessage();
            if (msg != null) {
                for (String marker : MARKERS) {
                    if (msg.contains(marker)) return true;
                }
            }
            if (t.getCause() == t) break;
        }
        return false;
    }
}
