package tech.rowguard.platform.reconcile;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.rowguard.platform.bootstrap.RowLevelSecurityConfig;
import tech.rowguard.platform.policy.RowLevelPolicy;
import tech.rowguard.platform.resource.ProtectedResource;
import tech.rowguard.platform.role.Role;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Makes the stored row-level security filters of a role match a desired state.
 *
 * <p>For each descriptor, in order:
 * <ol>
 *   <li>Resolve the table; a missing table aborts the pass</li>
 *   <li>Find the role's policy with the descriptor's group key, or start a new one</li>
 *   <li>Overwrite filter type, group key, tables and clause</li>
 *   <li>Commit a new policy straight away so it has an id</li>
 *   <li>Associate the policy with the role if it is not already</li>
 *   <li>Commit, if anything was written</li>
 * </ol>
 *
 * <p>Policies are never deleted, including those that are no longer in the
 * desired state. Every step is idempotent so a failed pass can be re-run from
 * the top. The reconciler assumes it is the only writer while it runs.
 */
@ApplicationScoped
public class PolicyReconciler {

    private static final Logger LOG = Logger.getLogger(PolicyReconciler.class);

    static final String SUCCESS_MESSAGE = "Successfully created row-level security filters.";

    @Inject
    PolicyStore store;

    @Inject
    RowLevelSecurityConfig config;

    /**
     * When true, more than one policy for a role and group key aborts the pass.
     * When false, a warning is logged and the lowest id is used.
     */
    boolean strictIntegrity = true;

    PolicyReconciler() {
    }

    public PolicyReconciler(PolicyStore store, boolean strictIntegrity) {
        this.store = store;
        this.strictIntegrity = strictIntegrity;
    }

    @PostConstruct
    void init() {
        strictIntegrity = config.strictIntegrity();
    }

    /**
     * Reconcile the policies of the named role against the desired state.
     *
     * @param roleName name of an existing role
     * @param desired  desired policies, processed in order
     * @return counts of what was created, updated and left alone
     * @throws RoleNotFoundException      if the role does not exist; nothing is written
     * @throws ResourceNotFoundException  if a descriptor names an unknown table; later descriptors are skipped
     * @throws DuplicatePolicyException   if the store holds several policies for one group key and strict
     *                                    integrity is enabled
     * @throws IllegalArgumentException   if the role name is blank or a descriptor is incomplete
     */
    public ReconciliationReport synchronize(String roleName, List<PolicyDescriptor> desired) {
        validateArguments(roleName, desired);

        Role role = store.findRole(roleName)
            .orElseThrow(() -> new RoleNotFoundException(roleName));

        LOG.infof("Reconciling %d row level security filter(s) for role '%s'", desired.size(), role.name);

        int created = 0;
        int updated = 0;
        int unchanged = 0;
        int associationsCreated = 0;

        for (PolicyDescriptor descriptor : desired) {
            ProtectedResource resource = store.findResource(descriptor.schema(), descriptor.resourceName())
                .orElseThrow(() -> new ResourceNotFoundException(descriptor.schema(), descriptor.resourceName()));

            RowLevelPolicy policy = findOrCreatePolicy(role, descriptor.groupKey());
            boolean isNew = policy.isNew();

            Set<ProtectedResource> resources = new LinkedHashSet<>();
            resources.add(resource);
            boolean alreadyInSync = !isNew
                && policy.matches(descriptor.filterType(), descriptor.groupKey(), resources, descriptor.clause());

            // Full overwrite: out-of-band edits to these fields are discarded
            policy.filterType = descriptor.filterType();
            policy.groupKey = descriptor.groupKey();
            policy.resources = resources;
            policy.clause = descriptor.clause();

            boolean pendingWrites = false;
            if (isNew) {
                store.save(policy);
                store.commit();
                created++;
                LOG.infof("Created row level security filter %d (group key '%s') on %s",
                    policy.id, policy.groupKey, resource.qualifiedName());
            } else if (alreadyInSync) {
                unchanged++;
                LOG.debugf("Row level security filter %d (group key '%s') already up to date",
                    policy.id, policy.groupKey);
            } else {
                store.save(policy);
                pendingWrites = true;
                updated++;
                LOG.infof("Updated row level security filter %d (group key '%s') on %s",
                    policy.id, policy.groupKey, resource.qualifiedName());
            }

            if (store.findAssociation(role, policy).isEmpty()) {
                store.insertAssociation(role, policy);
                pendingWrites = true;
                associationsCreated++;
                LOG.infof("Granted row level security filter %d to role '%s'", policy.id, role.name);
            } else {
                LOG.debugf("Role '%s' already has row level security filter %d", role.name, policy.id);
            }

            if (pendingWrites) {
                store.commit();
            }
        }

        ReconciliationReport report = new ReconciliationReport(created, updated, unchanged, associationsCreated);
        LOG.info(SUCCESS_MESSAGE);
        LOG.infof("Row level security sync complete: %d created, %d updated, %d unchanged, %d role grants added",
            report.policiesCreated(), report.policiesUpdated(), report.policiesUnchanged(),
            report.associationsCreated());
        return report;
    }

    private RowLevelPolicy findOrCreatePolicy(Role role, String groupKey) {
        List<RowLevelPolicy> matches = store.findPolicies(role, groupKey);
        if (matches.isEmpty()) {
            return store.newPolicy();
        }
        if (matches.size() > 1) {
            List<Long> ids = matches.stream().map(p -> p.id).toList();
            if (strictIntegrity) {
                throw new DuplicatePolicyException(role.name, groupKey, ids);
            }
            LOG.warnf("INTEGRITY: %d row level security filters for role '%s' and group key '%s' (ids %s), " +
                      "updating %d only", ids.size(), role.name, groupKey, ids, ids.get(0));
        }
        return matches.get(0);
    }

    private void validateArguments(String roleName, List<PolicyDescriptor> desired) {
        if (roleName == null || roleName.isBlank()) {
            throw new IllegalArgumentException("Role name must not be blank");
        }
        if (desired == null) {
            throw new IllegalArgumentException("Desired policies must not be null");
        }
        for (int i = 0; i < desired.size(); i++) {
            PolicyDescriptor descriptor = desired.get(i);
            if (descriptor == null) {
                throw new IllegalArgumentException("Policy descriptor #" + i + " is null");
            }
            String error = descriptor.validate();
            if (error != null) {
                throw new IllegalArgumentException("Invalid policy descriptor #" + i + ": " + error);
            }
        }
    }
}
