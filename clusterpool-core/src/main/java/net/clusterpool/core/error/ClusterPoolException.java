package net.clusterpool.core.error;

/** Root of every failure the cluster pool reports on purpose. */
public class ClusterPoolException extends Exception {
    public ClusterPoolException(String message) { super(message); }
    public ClusterPoolException(String message, Throwable cause) { super(message, cause); }
}
