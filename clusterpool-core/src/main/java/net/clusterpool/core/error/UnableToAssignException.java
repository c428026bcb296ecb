package net.clusterpool.core.error;

/** Thrown when a work unit could not be added to a cluster. */
public class UnableToAssignException extends ControlPlaneException {
    public UnableToAssignException(String entityId, String message) { super(entityId, message, null); }
    public UnableToAssignException(String entityId, String message, Throwable cause) { super(entityId, message, cause); }
}
