package tech.rowguard.platform.policy;

import tech.rowguard.platform.resource.ProtectedResource;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A stored row-level security filter.
 *
 * <p>The group key is the business identifier of the policy. Together with the
 * role the policy is associated with it identifies the policy across
 * reconciliation runs; the numeric id is assigned by the database on first
 * save and never changes afterwards.
 *
 * <p>The clause is a predicate template rendered at query time against the
 * requesting user and the row being read, e.g.
 * {@code {{can_view_courses(current_username(), "course_key")}}}.
 */
public class RowLevelPolicy {

    public Long id;

    public String groupKey;

    public FilterType filterType = FilterType.REGULAR;

    public String clause;

    /**
     * Tables this policy restricts. Policies managed here always carry exactly
     * one table, but the store models a set.
     */
    public Set<ProtectedResource> resources = new LinkedHashSet<>();

    public Instant createdOn;

    public Instant changedOn;

    public RowLevelPolicy() {
    }

    /**
     * True until the policy has been committed and received its id.
     */
    public boolean isNew() {
        return id == null;
    }

    /**
     * Check whether the synced fields already hold the given values.
     */
    public boolean matches(FilterType filterType, String groupKey, Set<ProtectedResource> resources, String clause) {
        return this.filterType == filterType
            && Objects.equals(this.groupKey, groupKey)
            && Objects.equals(this.resources, resources)
            && Objects.equals(this.clause, clause);
    }

    @Override
    public String toString() {
        return "RowLevelPolicy[" + id + ", groupKey=" + groupKey + ", filterType=" + filterType + "]";
    }
}
