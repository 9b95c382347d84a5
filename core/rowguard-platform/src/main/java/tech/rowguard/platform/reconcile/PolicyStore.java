package tech.rowguard.platform.reconcile;

import tech.rowguard.platform.policy.PolicyRoleAssociation;
import tech.rowguard.platform.policy.RowLevelPolicy;
import tech.rowguard.platform.resource.ProtectedResource;
import tech.rowguard.platform.role.Role;

import java.util.List;
import java.util.Optional;

/**
 * Persistence operations used by {@link PolicyReconciler}.
 *
 * <p>Writes made through {@link #save(RowLevelPolicy)} and
 * {@link #insertAssociation(Role, RowLevelPolicy)} are staged until
 * {@link #commit()}, which makes them durable and assigns ids to new policies.
 */
public interface PolicyStore {

    Optional<Role> findRole(String name);

    Optional<ProtectedResource> findResource(String schema, String name);

    /**
     * Policies with the given group key associated with the role, ordered by id.
     * More than one element means the store is inconsistent.
     */
    List<RowLevelPolicy> findPolicies(Role role, String groupKey);

    /**
     * A new, unsaved policy. Its id is assigned when it is committed.
     */
    RowLevelPolicy newPolicy();

    void save(RowLevelPolicy policy);

    void commit();

    Optional<PolicyRoleAssociation> findAssociation(Role role, RowLevelPolicy policy);

    /**
     * Stage a join record between the role and an already committed policy.
     *
     * @throws IllegalStateException if the policy has no id yet
     */
    void insertAssociation(Role role, RowLevelPolicy policy);
}
