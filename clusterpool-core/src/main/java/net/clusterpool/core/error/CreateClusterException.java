package net.clusterpool.core.error;

/** Thrown when the remote API rejected the launch configuration. */
public class CreateClusterException extends ControlPlaneException {
    public CreateClusterException(String entityId, String message) { super(entityId, message, null); }
    public CreateClusterException(String entityId, String message, Throwable cause) { super(entityId, message, cause); }
}
