package net.clusterpool.core.error;

public abstract class DomainException extends ClusterPoolException {
    protected DomainException(String message) { super(message); }
    protected DomainException(String message, Throwable cause) { super(message, cause); }
}
