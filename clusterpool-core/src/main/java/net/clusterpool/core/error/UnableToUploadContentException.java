package net.clusterpool.core.error;

/** Thrown when content could not be written to the content store. */
public class UnableToUploadContentException extends ControlPlaneException {
    public UnableToUploadContentException(String entityId, String message) { super(entityId, message, null); }
    public UnableToUploadContentException(String entityId, String message, Throwable cause) { super(entityId, message, cause); }
}
