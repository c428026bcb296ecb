package net.clusterpool.core.error;

public class NotOwnerException extends DomainException {
    public NotOwnerException(String message) { super(message); }
    public NotOwnerException(String message, Throwable cause) { super(message, cause); }
}
