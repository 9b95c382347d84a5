package tech.rowguard.platform.reconcile;

/**
 * Outcome of a reconciliation pass.
 *
 * @param policiesCreated     Policies inserted because none existed for the role and group key
 * @param policiesUpdated     Existing policies whose synced fields were overwritten
 * @param policiesUnchanged   Existing policies that already matched the desired state
 * @param associationsCreated Role associations inserted
 */
public record ReconciliationReport(
    int policiesCreated,
    int policiesUpdated,
    int policiesUnchanged,
    int associationsCreated
) {

    public int total() {
        return policiesCreated + policiesUpdated + policiesUnchanged;
    }

    /**
     * True if the pass wrote anything.
     */
    public boolean changed() {
        return policiesCreated > 0 || policiesUpdated > 0 || associationsCreated > 0;
    }
}
