package net.clusterpool.core.error;

/** Thrown when credentials are invalid, expired or lack permissions. */
public class CredentialsException extends ControlPlaneException {
    public CredentialsException(String entityId, String message) { super(entityId, message, null); }
    public CredentialsException(String entityId, String message, Throwable cause) { super(entityId, message, cause); }
}
