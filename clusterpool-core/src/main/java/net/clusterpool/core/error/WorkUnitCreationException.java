package net.clusterpool.core.error;

public class WorkUnitCreationException extends DomainException {
    public WorkUnitCreationException(String message) { super(message); }
    public WorkUnitCreationException(String message, Throwable cause) { super(message, cause); }
}
