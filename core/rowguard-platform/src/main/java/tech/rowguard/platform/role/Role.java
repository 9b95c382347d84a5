package tech.rowguard.platform.role;

/**
 * A principal group defined in the analytics front end (e.g. "Open edX").
 *
 * Roles are provisioned outside this service and are only ever read here.
 * The name is unique across the metadata database.
 */
public class Role {

    public Long id;

    public String name;

    public Role() {
    }

    public Role(Long id, String name) {
        this.id = id;
        this.name = name;
    }

    @Override
    public String toString() {
        return "Role[" + id + ", " + name + "]";
    }
}
