package tech.rowguard.platform.policy;

import java.util.Optional;

/**
 * Repository interface for policy/role join records.
 */
public interface PolicyRoleAssociationRepository {

    Optional<PolicyRoleAssociation> findByRoleAndPolicy(Long roleId, Long policyId);

    void persist(PolicyRoleAssociation association);
}
