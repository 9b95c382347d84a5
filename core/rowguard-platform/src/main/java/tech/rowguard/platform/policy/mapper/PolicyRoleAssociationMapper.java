package tech.rowguard.platform.policy.mapper;

import tech.rowguard.platform.policy.PolicyRoleAssociation;
import tech.rowguard.platform.policy.entity.RlsFilterRoleEntity;

/**
 * Mapper for converting between PolicyRoleAssociation and the rls_filter_roles entity.
 */
public final class PolicyRoleAssociationMapper {

    private PolicyRoleAssociationMapper() {
    }

    public static PolicyRoleAssociation toDomain(RlsFilterRoleEntity entity) {
        if (entity == null) {
            return null;
        }
        return new PolicyRoleAssociation(entity.id, entity.roleId, entity.rlsFilterId);
    }

    public static RlsFilterRoleEntity toEntity(PolicyRoleAssociation domain) {
        if (domain == null) {
            return null;
        }
        RlsFilterRoleEntity entity = new RlsFilterRoleEntity(domain.roleId, domain.policyId);
        entity.id = domain.id;
        return entity;
    }
}
