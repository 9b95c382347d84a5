package tech.rowguard.platform.role.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;

/**
 * JPA entity for the ab_role table.
 *
 * <p>The table belongs to the analytics front end's security manager, so the
 * mapping is read-only.
 */
@Entity
@Immutable
@Table(name = "ab_role")
public class RoleEntity {

    @Id
    @Column(name = "id")
    public Long id;

    @Column(name = "name", nullable = false, length = 64)
    public String name;

    public RoleEntity() {
    }
}
