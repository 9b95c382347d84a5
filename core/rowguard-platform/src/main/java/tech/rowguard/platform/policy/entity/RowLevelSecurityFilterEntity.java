package tech.rowguard.platform.policy.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for the row_level_security_filters table.
 *
 * <p>The filter type is stored as its label ("Regular", "Base"); see
 * {@link tech.rowguard.platform.policy.FilterType#storedValue()}.
 */
@Entity
@Table(name = "row_level_security_filters")
public class RowLevelSecurityFilterEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    public Long id;

    @Column(name = "filter_type", length = 255)
    public String filterType;

    @Column(name = "group_key", length = 255)
    public String groupKey;

    @Column(name = "clause", nullable = false, columnDefinition = "TEXT")
    public String clause;

    @Column(name = "created_on")
    public Instant createdOn;

    @Column(name = "changed_on")
    public Instant changedOn;

    public RowLevelSecurityFilterEntity() {
    }
}
