package tech.rowguard.platform.policy;

import java.util.List;

/**
 * Repository interface for RowLevelPolicy entities.
 */
public interface RowLevelPolicyRepository {

    // Read operations

    /**
     * Find the policies with the given group key that are associated with the
     * given role, ordered by id.
     */
    List<RowLevelPolicy> findByRoleAndGroupKey(Long roleId, String groupKey);

    // Write operations
    void persist(RowLevelPolicy policy);
    void update(RowLevelPolicy policy);
}
