package tech.rowguard.platform.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.rowguard.platform.reconcile.PolicyDescriptor;
import tech.rowguard.platform.reconcile.PolicyReconciler;
import tech.rowguard.platform.reconcile.ReconciliationReport;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the row-level security sync once, from configuration.
 *
 * <p>The desired state is the inline {@code rowguard.rls.policies[n]} entries
 * followed by the entries of {@code rowguard.rls.policies-file}, if set.
 *
 * <p>Failures are not caught here: the caller decides how to report them.
 */
@ApplicationScoped
public class RowLevelSecurityBootstrap {

    private static final Logger LOG = Logger.getLogger(RowLevelSecurityBootstrap.class);

    @Inject
    RowLevelSecurityConfig config;

    @Inject
    PolicyReconciler reconciler;

    @Inject
    PolicyDefinitionFileLoader fileLoader;

    /**
     * Run the sync.
     *
     * @return the report, or empty if the sync is disabled
     */
    @ActivateRequestContext
    public Optional<ReconciliationReport> run() {
        if (!config.enabled()) {
            LOG.info("Row level security sync disabled via configuration");
            return Optional.empty();
        }

        LOG.info("=== ROW LEVEL SECURITY SYNC ===");
        try {
            List<PolicyDescriptor> desired = desiredState();
            if (desired.isEmpty()) {
                LOG.warnf("No row level security filters configured for role '%s'", config.roleName());
            }
            return Optional.of(reconciler.synchronize(config.roleName(), desired));
        } finally {
            LOG.info("===============================");
        }
    }

    /**
     * Assemble the desired state from configuration.
     */
    public List<PolicyDescriptor> desiredState() {
        List<PolicyDescriptor> desired = new ArrayList<>();

        for (RowLevelSecurityConfig.PolicyEntry entry : config.policies()) {
            desired.add(new PolicyDescriptor(
                entry.schema(),
                entry.table(),
                entry.groupKey(),
                entry.clause(),
                entry.filterType()
            ));
        }

        Optional<String> file = config.policiesFile().filter(f -> !f.isBlank());
        if (file.isPresent()) {
            List<PolicyDescriptor> fromFile = fileLoader.load(Path.of(file.get()));
            LOG.infof("Loaded %d row level security filter(s) from %s", fromFile.size(), file.get());
            desired.addAll(fromFile);
        }

        return desired;
    }
}
