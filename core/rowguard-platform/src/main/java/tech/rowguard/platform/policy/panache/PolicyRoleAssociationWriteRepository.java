package tech.rowguard.platform.policy.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.rowguard.platform.policy.PolicyRoleAssociation;
import tech.rowguard.platform.policy.entity.RlsFilterRoleEntity;
import tech.rowguard.platform.policy.mapper.PolicyRoleAssociationMapper;

/**
 * Write-side repository for policy/role join records.
 */
@ApplicationScoped
public class PolicyRoleAssociationWriteRepository implements PanacheRepositoryBase<RlsFilterRoleEntity, Long> {

    public void persistAssociation(PolicyRoleAssociation association) {
        RlsFilterRoleEntity entity = PolicyRoleAssociationMapper.toEntity(association);
        persistAndFlush(entity);
        association.id = entity.id;
    }
}
