package tech.rowguard.platform.reconcile;

import tech.rowguard.platform.policy.FilterType;

/**
 * One entry of the desired state: a row-level security filter that should
 * exist on a table for the role being reconciled.
 *
 * @param schema       Schema of the protected table (e.g., "xapi")
 * @param resourceName Table name within the schema (e.g., "xapi_events_all")
 * @param groupKey     Business key of the filter, unique per role (e.g., "xapi_course_id")
 * @param clause       Predicate template evaluated at query time
 * @param filterType   How the filter composes with other filters on the table
 */
public record PolicyDescriptor(
    String schema,
    String resourceName,
    String groupKey,
    String clause,
    FilterType filterType
) {

    /**
     * Validate that every field is present.
     *
     * @return null if valid, or an error message if invalid
     */
    public String validate() {
        String schemaError = validateField("schema", schema);
        if (schemaError != null) return schemaError;

        String nameError = validateField("resourceName", resourceName);
        if (nameError != null) return nameError;

        String groupKeyError = validateField("groupKey", groupKey);
        if (groupKeyError != null) return groupKeyError;

        String clauseError = validateField("clause", clause);
        if (clauseError != null) return clauseError;

        if (filterType == null) {
            return "filterType is required";
        }
        return null;
    }

    private static String validateField(String fieldName, String value) {
        if (value == null || value.isBlank()) {
            return fieldName + " is required";
        }
        return null;
    }
}
