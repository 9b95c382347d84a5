package tech.rowguard.platform.policy.entity;

import jakarta.persistence.*;

/**
 * JPA entity for the rls_filter_tables junction table (filter to dataset).
 */
@Entity
@Table(name = "rls_filter_tables")
public class RlsFilterTableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    public Long id;

    @Column(name = "table_id")
    public Long tableId;

    @Column(name = "rls_filter_id")
    public Long rlsFilterId;

    public RlsFilterTableEntity() {
    }

    public RlsFilterTableEntity(Long tableId, Long rlsFilterId) {
        this.tableId = tableId;
        this.rlsFilterId = rlsFilterId;
    }
}
