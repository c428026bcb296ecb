package net.clusterpool.core.error;

public class ConfigurationNotFoundException extends DomainException {
    public ConfigurationNotFoundException(String message) { super(message); }
    public ConfigurationNotFoundException(String message, Throwable cause) { super(message, cause); }
}
