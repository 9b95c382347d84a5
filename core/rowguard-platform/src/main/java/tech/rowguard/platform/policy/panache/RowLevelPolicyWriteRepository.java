package tech.rowguard.platform.policy.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.EntityNotFoundException;
import tech.rowguard.platform.policy.RowLevelPolicy;
import tech.rowguard.platform.policy.entity.RlsFilterTableEntity;
import tech.rowguard.platform.policy.entity.RowLevelSecurityFilterEntity;
import tech.rowguard.platform.policy.mapper.RowLevelPolicyMapper;
import tech.rowguard.platform.resource.ProtectedResource;

import java.time.Instant;
import java.util.Set;

/**
 * Write-side repository for row-level security policies.
 * Extends PanacheRepositoryBase for entity persistence; must be called inside a transaction.
 */
@ApplicationScoped
public class RowLevelPolicyWriteRepository implements PanacheRepositoryBase<RowLevelSecurityFilterEntity, Long> {

    /**
     * Persist a new policy and copy the generated id back onto the domain object.
     */
    public void persistPolicy(RowLevelPolicy policy) {
        Instant now = Instant.now();
        if (policy.createdOn == null) {
            policy.createdOn = now;
        }
        policy.changedOn = now;
        RowLevelSecurityFilterEntity entity = RowLevelPolicyMapper.toEntity(policy);
        persistAndFlush(entity);
        policy.id = entity.id;
        replaceResources(entity.id, policy.resources);
    }

    /**
     * Update an existing policy, including its table set.
     */
    public void updatePolicy(RowLevelPolicy policy) {
        RowLevelSecurityFilterEntity entity = findById(policy.id);
        if (entity == null) {
            throw new EntityNotFoundException("Row level security filter " + policy.id + " no longer exists");
        }
        policy.changedOn = Instant.now();
        RowLevelPolicyMapper.updateEntity(entity, policy);
        replaceResources(policy.id, policy.resources);
    }

    private void replaceResources(Long policyId, Set<ProtectedResource> resources) {
        getEntityManager().createQuery("DELETE FROM RlsFilterTableEntity WHERE rlsFilterId = :policyId")
            .setParameter("policyId", policyId)
            .executeUpdate();
        for (ProtectedResource resource : resources) {
            getEntityManager().persist(new RlsFilterTableEntity(resource.id, policyId));
        }
    }
}
