package net.clusterpool.core.error;

/** Thrown when a describe call failed. */
public class UpdateStatusException extends ControlPlaneException {
    public UpdateStatusException(String entityId, String message) { super(entityId, message, null); }
    public UpdateStatusException(String entityId, String message, Throwable cause) { super(entityId, message, cause); }
}
