package tech.rowguard.platform.resource.mapper;

import tech.rowguard.platform.resource.ProtectedResource;
import tech.rowguard.platform.resource.entity.SqlaTableEntity;

/**
 * Mapper for converting dataset table entities into ProtectedResource.
 */
public final class ProtectedResourceMapper {

    private ProtectedResourceMapper() {
    }

    public static ProtectedResource toDomain(SqlaTableEntity entity) {
        if (entity == null) {
            return null;
        }
        return new ProtectedResource(entity.id, entity.schemaName, entity.tableName);
    }
}
