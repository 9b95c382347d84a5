package tech.rowguard.platform.policy.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.rowguard.platform.policy.PolicyRoleAssociation;
import tech.rowguard.platform.policy.PolicyRoleAssociationRepository;
import tech.rowguard.platform.policy.entity.RlsFilterRoleEntity;
import tech.rowguard.platform.policy.mapper.PolicyRoleAssociationMapper;

import java.util.Optional;

/**
 * Read-side repository for policy/role join records.
 */
@ApplicationScoped
public class PolicyRoleAssociationReadRepository implements PolicyRoleAssociationRepository {

    @Inject
    EntityManager em;

    @Inject
    PolicyRoleAssociationWriteRepository writeRepo;

    @Override
    public Optional<PolicyRoleAssociation> findByRoleAndPolicy(Long roleId, Long policyId) {
        var results = em.createQuery(
                "FROM RlsFilterRoleEntity WHERE roleId = :roleId AND rlsFilterId = :policyId ORDER BY id",
                RlsFilterRoleEntity.class)
            .setParameter("roleId", roleId)
            .setParameter("policyId", policyId)
            .setMaxResults(1)
            .getResultList();
        return results.isEmpty()
            ? Optional.empty()
            : Optional.of(PolicyRoleAssociationMapper.toDomain(results.get(0)));
    }

    @Override
    public void persist(PolicyRoleAssociation association) {
        writeRepo.persistAssociation(association);
    }
}
