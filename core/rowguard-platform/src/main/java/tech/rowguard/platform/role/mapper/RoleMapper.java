package tech.rowguard.platform.role.mapper;

import tech.rowguard.platform.role.Role;
import tech.rowguard.platform.role.entity.RoleEntity;

/**
 * Mapper for converting the ab_role entity into the Role domain model.
 */
public final class RoleMapper {

    private RoleMapper() {
    }

    public static Role toDomain(RoleEntity entity) {
        if (entity == null) {
            return null;
        }
        return new Role(entity.id, entity.name);
    }
}
