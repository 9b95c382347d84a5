package tech.rowguard.platform.bootstrap;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import tech.rowguard.platform.policy.FilterType;

import java.util.List;
import java.util.Optional;

/**
 * Configuration for the row-level security sync.
 *
 * <p>Configure in application.properties:
 * <pre>
 * rowguard.rls.role-name=Open edX
 * rowguard.rls.policies[0].schema=xapi
 * rowguard.rls.policies[0].table=xapi_events_all
 * rowguard.rls.policies[0].group-key=xapi_course_id
 * rowguard.rls.policies[0].clause={{can_view_courses(current_username(), "course_id")}}
 * rowguard.rls.policies[0].filter-type=REGULAR
 * </pre>
 */
@ConfigMapping(prefix = "rowguard.rls")
public interface RowLevelSecurityConfig {

    /**
     * Whether the sync runs at all.
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Name of the role the filters are granted to. The role must already exist.
     */
    @WithDefault("Open edX")
    String roleName();

    /**
     * Abort when several filters share a group key for the role.
     * When false, the lowest id is updated and the others are left alone.
     */
    @WithDefault("true")
    boolean strictIntegrity();

    /**
     * Optional JSON file with additional filter definitions, appended after
     * the inline ones.
     */
    Optional<String> policiesFile();

    /**
     * Inline filter definitions, processed in index order.
     */
    List<PolicyEntry> policies();

    interface PolicyEntry {

        String schema();

        String table();

        String groupKey();

        String clause();

        @WithDefault("REGULAR")
        FilterType filterType();
    }
}
