package tech.rowguard.platform.reconcile;

/**
 * Base exception for failures that abort a reconciliation pass.
 *
 * <p>None of these are retried locally. The pass is idempotent, so the
 * caller re-runs it once the cause has been fixed.
 */
public abstract class ReconciliationException extends RuntimeException {

    protected ReconciliationException(String message) {
        super(message);
    }

    protected ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
