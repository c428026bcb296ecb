package net.clusterpool.core.quota;

/** Control-plane operations, each with its own request budget. */
public enum OperationKind {
    CREATE_CLUSTER("create-cluster"),
    ADD_WORK("add-work"),
    DESCRIBE_CLUSTER("describe-cluster"),
    TERMINATE_CLUSTER("terminate-cluster"),
    CANCEL_WORK("cancel-work"),
    DESCRIBE_WORK("describe-work");

    private final String key;

    OperationKind(String key) { this.key = key; }

    /** property-style name, e.g. {@code describe-cluster} */
    public String key() { return key; }

    public static OperationKind fromKey(String key) {
        for (OperationKind k : values()) {
            if (k.key.equalsIgnoreCase(key) || k.name().equalsIgnoreCase(key)) return k;
        }
        throw new IllegalArgumentException("Unknown operation kind: " + key);
    }
}
