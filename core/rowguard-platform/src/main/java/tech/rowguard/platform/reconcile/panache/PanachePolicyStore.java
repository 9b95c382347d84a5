package tech.rowguard.platform.reconcile.panache;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.rowguard.platform.policy.PolicyRoleAssociation;
import tech.rowguard.platform.policy.PolicyRoleAssociationRepository;
import tech.rowguard.platform.policy.RowLevelPolicy;
import tech.rowguard.platform.policy.RowLevelPolicyRepository;
import tech.rowguard.platform.reconcile.PolicyStore;
import tech.rowguard.platform.resource.ProtectedResource;
import tech.rowguard.platform.resource.ProtectedResourceRepository;
import tech.rowguard.platform.role.Role;
import tech.rowguard.platform.role.RoleRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link PolicyStore} backed by the metadata database through the JPA repositories.
 *
 * <p>Each read runs in its own transaction (or joins the caller's), so results
 * never come from a session that predates an earlier commit. Writes are staged
 * and applied by {@link #commit()} in a new JTA transaction, so each commit is
 * durable on its own. If the transaction fails it is rolled back, the staged writes are
 * dropped, ids assigned to new policies during the attempt are cleared, and
 * the exception propagates unchanged.
 *
 * <p>Not thread-safe: one reconciliation pass at a time.
 */
@ApplicationScoped
public class PanachePolicyStore implements PolicyStore {

    private static final Logger LOG = Logger.getLogger(PanachePolicyStore.class);

    @Inject
    RoleRepository roleRepo;

    @Inject
    ProtectedResourceRepository resourceRepo;

    @Inject
    RowLevelPolicyRepository policyRepo;

    @Inject
    PolicyRoleAssociationRepository associationRepo;

    private final List<RowLevelPolicy> pendingPolicies = new ArrayList<>();
    private final List<PolicyRoleAssociation> pendingAssociations = new ArrayList<>();

    @Override
    public Optional<Role> findRole(String name) {
        return QuarkusTransaction.joiningExisting().call(() -> roleRepo.findByName(name));
    }

    @Override
    public Optional<ProtectedResource> findResource(String schema, String name) {
        return QuarkusTransaction.joiningExisting().call(() -> resourceRepo.findBySchemaAndName(schema, name));
    }

    @Override
    public List<RowLevelPolicy> findPolicies(Role role, String groupKey) {
        return QuarkusTransaction.joiningExisting().call(() -> policyRepo.findByRoleAndGroupKey(role.id, groupKey));
    }

    @Override
    public RowLevelPolicy newPolicy() {
        return new RowLevelPolicy();
    }

    @Override
    public void save(RowLevelPolicy policy) {
        boolean staged = pendingPolicies.stream().anyMatch(p -> p == policy);
        if (!staged) {
            pendingPolicies.add(policy);
        }
    }

    @Override
    public Optional<PolicyRoleAssociation> findAssociation(Role role, RowLevelPolicy policy) {
        if (policy.isNew()) {
            return Optional.empty();
        }
        return QuarkusTransaction.joiningExisting().call(() -> associationRepo.findByRoleAndPolicy(role.id, policy.id));
    }

    @Override
    public void insertAssociation(Role role, RowLevelPolicy policy) {
        if (policy.isNew()) {
            throw new IllegalStateException("Policy must be committed before it can be granted to role " + role.name);
        }
        pendingAssociations.add(new PolicyRoleAssociation(null, role.id, policy.id));
    }

    @Override
    public void commit() {
        if (pendingPolicies.isEmpty() && pendingAssociations.isEmpty()) {
            return;
        }

        List<RowLevelPolicy> policies = new ArrayList<>(pendingPolicies);
        List<PolicyRoleAssociation> associations = new ArrayList<>(pendingAssociations);
        List<RowLevelPolicy> created = policies.stream().filter(RowLevelPolicy::isNew).toList();
        pendingPolicies.clear();
        pendingAssociations.clear();

        try {
            QuarkusTransaction.requiringNew().run(() -> {
                for (RowLevelPolicy policy : policies) {
                    if (policy.isNew()) {
                        policyRepo.persist(policy);
                    } else {
                        policyRepo.update(policy);
                    }
                }
                for (PolicyRoleAssociation association : associations) {
                    associationRepo.persist(association);
                }
            });
        } catch (RuntimeException e) {
            for (RowLevelPolicy policy : created) {
                policy.id = null;
                policy.createdOn = null;
                policy.changedOn = null;
            }
            throw e;
        }

        LOG.debugf("Committed %d policy write(s) and %d role grant(s)", policies.size(), associations.size());
    }
}
