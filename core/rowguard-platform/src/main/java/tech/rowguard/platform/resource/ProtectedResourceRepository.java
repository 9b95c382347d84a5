package tech.rowguard.platform.resource;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for ProtectedResource lookups.
 */
public interface ProtectedResourceRepository {

    Optional<ProtectedResource> findBySchemaAndName(String schema, String tableName);

    List<ProtectedResource> findByIds(List<Long> ids);
}
