package tech.rowguard.platform.policy;

/**
 * Join record granting a role the given row-level security policy.
 */
public class PolicyRoleAssociation {

    public Long id;

    public Long roleId;

    public Long policyId;

    public PolicyRoleAssociation() {
    }

    public PolicyRoleAssociation(Long id, Long roleId, Long policyId) {
        this.id = id;
        this.roleId = roleId;
        this.policyId = policyId;
    }
}
