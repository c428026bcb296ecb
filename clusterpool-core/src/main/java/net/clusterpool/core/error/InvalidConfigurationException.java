package net.clusterpool.core.error;

public class InvalidConfigurationException extends DomainException {
    public InvalidConfigurationException(String message) { super(message); }
    public InvalidConfigurationException(String message, Throwable cause) { super(message, cause); }
}
