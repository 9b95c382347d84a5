package tech.rowguard.platform.resource.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;

/**
 * JPA entity for the tables table (registered datasets).
 *
 * <p>Only the columns needed to resolve a dataset by schema and name are mapped.
 */
@Entity
@Immutable
@Table(name = "tables")
public class SqlaTableEntity {

    @Id
    @Column(name = "id")
    public Long id;

    // SCHEMA is reserved in MySQL
    @Column(name = "`schema`")
    public String schemaName;

    @Column(name = "table_name", nullable = false, length = 250)
    public String tableName;

    public SqlaTableEntity() {
    }
}
