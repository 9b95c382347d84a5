package tech.rowguard.platform.bootstrap;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.rowguard.platform.policy.FilterType;
import tech.rowguard.platform.reconcile.PolicyDefinitionException;
import tech.rowguard.platform.reconcile.PolicyDescriptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads filter definitions from a JSON file.
 *
 * <p>The file holds an array of objects:
 * <pre>{@code
 * [
 *   {
 *     "schema": "openedx",
 *     "table": "course_enrollments",
 *     "groupKey": "enrollments_course_id",
 *     "clause": "{{can_view_courses(current_username(), \"course_key\")}}",
 *     "filterType": "Regular"
 *   }
 * ]
 * }</pre>
 *
 * <p>{@code filterType} is optional and defaults to REGULAR; it accepts the
 * enum name or the stored label, in any case.
 */
@ApplicationScoped
public class PolicyDefinitionFileLoader {

    private static final Logger LOG = Logger.getLogger(PolicyDefinitionFileLoader.class);

    @Inject
    ObjectMapper objectMapper;

    /**
     * Load the definitions in file order.
     *
     * @throws PolicyDefinitionException if the file is missing, unreadable or holds an invalid entry
     */
    public List<PolicyDescriptor> load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new PolicyDefinitionException("Policy definition file not found: " + path);
        }

        List<PolicyFileEntry> entries;
        try {
            entries = objectMapper.readValue(path.toFile(), new TypeReference<List<PolicyFileEntry>>() {});
        } catch (IOException e) {
            throw new PolicyDefinitionException("Could not read policy definitions from " + path + ": " + e.getMessage(), e);
        }

        if (entries == null) {
            return List.of();
        }

        List<PolicyDescriptor> descriptors = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            descriptors.add(toDescriptor(path, i, entries.get(i)));
        }

        LOG.debugf("Loaded %d policy definition(s) from %s", descriptors.size(), path);
        return descriptors;
    }

    private PolicyDescriptor toDescriptor(Path path, int index, PolicyFileEntry entry) {
        if (entry == null) {
            throw new PolicyDefinitionException("Entry #" + index + " in " + path + " is null");
        }

        FilterType filterType;
        try {
            filterType = entry.filterType() == null ? FilterType.REGULAR : FilterType.parse(entry.filterType());
        } catch (IllegalArgumentException e) {
            throw new PolicyDefinitionException("Entry #" + index + " in " + path + ": " + e.getMessage(), e);
        }

        PolicyDescriptor descriptor = new PolicyDescriptor(
            entry.schema(),
            entry.table(),
            entry.groupKey(),
            entry.clause(),
            filterType
        );

        String error = descriptor.validate();
        if (error != null) {
            throw new PolicyDefinitionException("Entry #" + index + " in " + path + ": " + error);
        }
        return descriptor;
    }

    /**
     * One element of the JSON array.
     */
    public record PolicyFileEntry(
        String schema,
        String table,
        String groupKey,
        String clause,
        String filterType
    ) {
    }
}
