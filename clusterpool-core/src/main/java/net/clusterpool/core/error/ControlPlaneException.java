package net.clusterpool.core.error;

/** A remote control-plane or content-store call failed. Carries the id of the entity involved, when known. */
public abstract class ControlPlaneException extends ClusterPoolException {
    private final String entityId;

    protected ControlPlaneException(String entityId, String message, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
    }

    public String entityId() { return entityId; }
}
