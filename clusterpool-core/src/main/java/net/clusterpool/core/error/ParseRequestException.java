package net.clusterpool.core.error;

public class ParseRequestException extends DomainException {
    public ParseRequestException(String message) { super(message); }
    public ParseRequestException(String message, Throwable cause) { super(message, cause); }
}
