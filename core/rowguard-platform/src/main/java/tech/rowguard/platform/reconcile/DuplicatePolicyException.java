package tech.rowguard.platform.reconcile;

import java.util.List;

/**
 * Thrown when more than one policy exists for the same role and group key.
 */
public class DuplicatePolicyException extends ReconciliationException {

    private final String roleName;
    private final String groupKey;
    private final List<Long> policyIds;

    public DuplicatePolicyException(String roleName, String groupKey, List<Long> policyIds) {
        super("Found " + policyIds.size() + " row level security filters for role '" + roleName +
              "' and group key '" + groupKey + "' (ids " + policyIds + "), expected at most one");
        this.roleName = roleName;
        this.groupKey = groupKey;
        this.policyIds = List.copyOf(policyIds);
    }

    public String getRoleName() {
        return roleName;
    }

    public String getGroupKey() {
        return groupKey;
    }

    public List<Long> getPolicyIds() {
        return policyIds;
    }
}
