package tech.rowguard.platform.reconcile;

/**
 * Thrown when the desired-state definitions cannot be read or are invalid.
 */
public class PolicyDefinitionException extends ReconciliationException {

    public PolicyDefinitionException(String message) {
        super(message);
    }

    public PolicyDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
