package tech.rowguard.platform.reconcile;

/**
 * Thrown when the role to reconcile policies for does not exist.
 */
public class RoleNotFoundException extends ReconciliationException {

    private final String roleName;

    public RoleNotFoundException(String roleName) {
        super("Role '" + roleName + "' doesn't exist yet");
        this.roleName = roleName;
    }

    public String getRoleName() {
        return roleName;
    }
}
