package tech.rowguard.platform.policy.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.rowguard.platform.policy.RowLevelPolicy;
import tech.rowguard.platform.policy.RowLevelPolicyRepository;
import tech.rowguard.platform.policy.entity.RowLevelSecurityFilterEntity;
import tech.rowguard.platform.policy.mapper.RowLevelPolicyMapper;
import tech.rowguard.platform.resource.ProtectedResource;
import tech.rowguard.platform.resource.ProtectedResourceRepository;

import java.util.List;

/**
 * Read-side repository for row-level security policies.
 * Uses EntityManager directly to return domain objects without conflicts.
 */
@ApplicationScoped
public class RowLevelPolicyReadRepository implements RowLevelPolicyRepository {

    @Inject
    EntityManager em;

    @Inject
    RowLevelPolicyWriteRepository writeRepo;

    @Inject
    ProtectedResourceRepository resourceRepo;

    @Override
    public List<RowLevelPolicy> findByRoleAndGroupKey(Long roleId, String groupKey) {
        return em.createQuery(
                "SELECT f FROM RowLevelSecurityFilterEntity f " +
                "WHERE f.groupKey = :groupKey " +
                "AND EXISTS (SELECT r.id FROM RlsFilterRoleEntity r WHERE r.rlsFilterId = f.id AND r.roleId = :roleId) " +
                "ORDER BY f.id",
                RowLevelSecurityFilterEntity.class)
            .setParameter("groupKey", groupKey)
            .setParameter("roleId", roleId)
            .getResultList()
            .stream()
            .map(entity -> RowLevelPolicyMapper.toDomain(entity, loadResources(entity.id)))
            .toList();
    }

    private List<ProtectedResource> loadResources(Long policyId) {
        List<Long> tableIds = em.createQuery(
                "SELECT t.tableId FROM RlsFilterTableEntity t WHERE t.rlsFilterId = :policyId ORDER BY t.id",
                Long.class)
            .setParameter("policyId", policyId)
            .getResultList();
        return resourceRepo.findByIds(tableIds);
    }

    // Write operations delegate to WriteRepository
    @Override
    public void persist(RowLevelPolicy policy) {
        writeRepo.persistPolicy(policy);
    }

    @Override
    public void update(RowLevelPolicy policy) {
        writeRepo.updatePolicy(policy);
    }
}
