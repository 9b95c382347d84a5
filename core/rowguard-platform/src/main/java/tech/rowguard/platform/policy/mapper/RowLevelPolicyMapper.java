package tech.rowguard.platform.policy.mapper;

import tech.rowguard.platform.policy.FilterType;
import tech.rowguard.platform.policy.RowLevelPolicy;
import tech.rowguard.platform.policy.entity.RowLevelSecurityFilterEntity;
import tech.rowguard.platform.resource.ProtectedResource;

import java.util.Collection;
import java.util.LinkedHashSet;

/**
 * Mapper for converting between RowLevelPolicy domain model and JPA entity.
 *
 * <p>The resource set lives in a junction table, so it is passed in separately
 * when mapping to the domain and written separately by the write repository.
 */
public final class RowLevelPolicyMapper {

    private RowLevelPolicyMapper() {
    }

    public static RowLevelPolicy toDomain(RowLevelSecurityFilterEntity entity, Collection<ProtectedResource> resources) {
        if (entity == null) {
            return null;
        }

        RowLevelPolicy domain = new RowLevelPolicy();
        domain.id = entity.id;
        domain.groupKey = entity.groupKey;
        domain.filterType = toFilterType(entity.filterType);
        domain.clause = entity.clause;
        domain.resources = resources != null ? new LinkedHashSet<>(resources) : new LinkedHashSet<>();
        domain.createdOn = entity.createdOn;
        domain.changedOn = entity.changedOn;
        return domain;
    }

    public static RowLevelSecurityFilterEntity toEntity(RowLevelPolicy domain) {
        if (domain == null) {
            return null;
        }

        RowLevelSecurityFilterEntity entity = new RowLevelSecurityFilterEntity();
        entity.id = domain.id;
        entity.groupKey = domain.groupKey;
        entity.filterType = toStoredValue(domain.filterType);
        entity.clause = domain.clause;
        entity.createdOn = domain.createdOn;
        entity.changedOn = domain.changedOn;
        return entity;
    }

    public static void updateEntity(RowLevelSecurityFilterEntity entity, RowLevelPolicy domain) {
        entity.groupKey = domain.groupKey;
        entity.filterType = toStoredValue(domain.filterType);
        entity.clause = domain.clause;
        entity.changedOn = domain.changedOn;
    }

    /**
     * Rows written by hand or by older releases may carry no filter type; the
     * metadata database treats those as regular filters.
     */
    static FilterType toFilterType(String storedValue) {
        if (storedValue == null || storedValue.isBlank()) {
            return FilterType.REGULAR;
        }
        return FilterType.parse(storedValue);
    }

    static String toStoredValue(FilterType filterType) {
        return filterType != null ? filterType.storedValue() : FilterType.REGULAR.storedValue();
    }
}
