package tech.rowguard.platform.resource.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.rowguard.platform.resource.ProtectedResource;
import tech.rowguard.platform.resource.ProtectedResourceRepository;
import tech.rowguard.platform.resource.entity.SqlaTableEntity;
import tech.rowguard.platform.resource.mapper.ProtectedResourceMapper;

import java.util.List;
import java.util.Optional;

/**
 * Read-side repository for registered dataset tables.
 */
@ApplicationScoped
public class ProtectedResourceReadRepository implements ProtectedResourceRepository {

    @Inject
    EntityManager em;

    @Override
    public Optional<ProtectedResource> findBySchemaAndName(String schema, String tableName) {
        var results = em.createQuery(
                "FROM SqlaTableEntity WHERE schemaName = :schema AND tableName = :tableName ORDER BY id",
                SqlaTableEntity.class)
            .setParameter("schema", schema)
            .setParameter("tableName", tableName)
            .setMaxResults(1)
            .getResultList();
        return results.isEmpty() ? Optional.empty() : Optional.of(ProtectedResourceMapper.toDomain(results.get(0)));
    }

    @Override
    public List<ProtectedResource> findByIds(List<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return em.createQuery("FROM SqlaTableEntity WHERE id IN :ids ORDER BY id", SqlaTableEntity.class)
            .setParameter("ids", ids)
            .getResultList()
            .stream()
            .map(ProtectedResourceMapper::toDomain)
            .toList();
    }
}
