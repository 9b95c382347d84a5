package tech.rowguard.platform.resource;

import java.util.Objects;

/**
 * A schema-qualified table registered with the analytics front end, to which
 * row-level security policies can be attached.
 *
 * Equality is by identity so that a policy's resource set behaves as a set of
 * stored tables.
 */
public class ProtectedResource {

    public Long id;

    public String schema;

    public String tableName;

    public ProtectedResource() {
    }

    public ProtectedResource(Long id, String schema, String tableName) {
        this.id = id;
        this.schema = schema;
        this.tableName = tableName;
    }

    /**
     * Qualified name in "schema.table" form, used in log and error messages.
     */
    public String qualifiedName() {
        return schema + "." + tableName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProtectedResource that = (ProtectedResource) o;
        return id != null && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "ProtectedResource[" + id + ", " + qualifiedName() + "]";
    }
}
