package tech.rowguard.platform.policy.entity;

import jakarta.persistence.*;

/**
 * JPA entity for the rls_filter_roles junction table (filter to role).
 */
@Entity
@Table(name = "rls_filter_roles")
public class RlsFilterRoleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    public Long id;

    @Column(name = "role_id", nullable = false)
    public Long roleId;

    @Column(name = "rls_filter_id")
    public Long rlsFilterId;

    public RlsFilterRoleEntity() {
    }

    public RlsFilterRoleEntity(Long roleId, Long rlsFilterId) {
        this.roleId = roleId;
        this.rlsFilterId = rlsFilterId;
    }
}
