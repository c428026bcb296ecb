package net.clusterpool.core.error;

/** Thrown when a work unit could not be cancelled remotely. */
public class CancelException extends ControlPlaneException {
    public CancelException(String entityId, String message) { super(entityId, message, null); }
    public CancelException(String entityId, String message, Throwable cause) { super(entityId, message, cause); }
}
