package tech.rowguard.platform.role.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.rowguard.platform.role.Role;
import tech.rowguard.platform.role.RoleRepository;
import tech.rowguard.platform.role.entity.RoleEntity;
import tech.rowguard.platform.role.mapper.RoleMapper;

import java.util.Optional;

/**
 * Read-side repository for roles.
 * Uses EntityManager directly to return domain objects.
 */
@ApplicationScoped
public class RoleReadRepository implements RoleRepository {

    @Inject
    EntityManager em;

    @Override
    public Optional<Role> findByName(String name) {
        var results = em.createQuery("FROM RoleEntity WHERE name = :name", RoleEntity.class)
            .setParameter("name", name)
            .setMaxResults(1)
            .getResultList();
        return results.isEmpty() ? Optional.empty() : Optional.of(RoleMapper.toDomain(results.get(0)));
    }
}
