package crosspost.core.model.credential;

/**
 * Vault operations recorded in the access audit trail.
 */
public enum CredentialOperation {
    GET("get"),
    SAVE("save"),
    DELETE("delete"),
    CHECK("check");

    private final String label;

    CredentialOperation(String label) {
        this.label = label;
    }

    /**
     * Lower-case name used in audit records and metric tags.
     */
    public String label() {
        return label;
    }

    /**
     * Resolve an operation from its label.
     *
     * @throws IllegalArgumentException if no operation has the label
     */
    public static CredentialOperation fromLabel(String label) {
        for (CredentialOperation operation : values()) {
            if (operation.label.equals(label)) {
                return operation;
            }
        }
        throw new IllegalArgumentException("Unknown credential operation: " + label);
    }
}
