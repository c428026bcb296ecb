package net.clusterpool.core.error;

public class EntityNotFoundException extends DomainException {
    public EntityNotFoundException(String message) { super(message); }
    public EntityNotFoundException(String message, Throwable cause) { super(message, cause); }
}
