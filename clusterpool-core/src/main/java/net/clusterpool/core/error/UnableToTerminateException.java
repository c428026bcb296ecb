package net.clusterpool.core.error;

/** Thrown when a cluster could not be terminated. */
public class UnableToTerminateException extends ControlPlaneException {
    public UnableToTerminateException(String entityId, String message) { super(entityId, message, null); }
    public UnableToTerminateException(String entityId, String message, Throwable cause) { super(entityId, message, cause); }
}
