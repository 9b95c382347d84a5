package tech.rowguard.platform.role;

import java.util.Optional;

/**
 * Repository interface for Role lookups.
 */
public interface RoleRepository {

    Optional<Role> findByName(String name);
}
