package tech.rowguard.platform.reconcile;

/**
 * Thrown when a desired policy names a table that is not registered.
 */
public class ResourceNotFoundException extends ReconciliationException {

    private final String schema;
    private final String resourceName;

    public ResourceNotFoundException(String schema, String resourceName) {
        super("Table '" + schema + "." + resourceName + "' doesn't exist yet");
        this.schema = schema;
        this.resourceName = resourceName;
    }

    public String getSchema() {
        return schema;
    }

    public String getResourceName() {
        return resourceName;
    }
}
