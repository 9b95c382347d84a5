package tech.rowguard.app;

import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.rowguard.platform.bootstrap.RowLevelSecurityBootstrap;
import tech.rowguard.platform.reconcile.DuplicatePolicyException;
import tech.rowguard.platform.reconcile.PolicyDefinitionException;
import tech.rowguard.platform.reconcile.ResourceNotFoundException;
import tech.rowguard.platform.reconcile.RoleNotFoundException;

/**
 * Rowguard command-mode entry point.
 *
 * <p>Runs one row-level security sync against the metadata database and exits.
 * Intended to be run as an init job after the analytics front end has been
 * provisioned; re-running it is safe.
 *
 * <p>Exit status:
 * <ul>
 *   <li>0 - success, or sync disabled</li>
 *   <li>1 - unexpected failure (database errors etc.)</li>
 *   <li>2 - the role or a table does not exist yet</li>
 *   <li>3 - duplicate filters in the database, or invalid filter definitions</li>
 * </ul>
 */
@QuarkusMain
public class RowguardApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(RowguardApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_PRECONDITION_FAILED = 2;
    static final int EXIT_INVALID_STATE = 3;

    @Inject
    RowLevelSecurityBootstrap bootstrap;

    @Override
    public int run(String... args) {
        try {
            bootstrap.run();
            return EXIT_OK;
        } catch (RoleNotFoundException | ResourceNotFoundException e) {
            LOG.error("Row level security sync failed: " + e.getMessage() +
                      ". Make sure it is provisioned before running this job.");
            return EXIT_PRECONDITION_FAILED;
        } catch (DuplicatePolicyException | PolicyDefinitionException e) {
            LOG.error("Row level security sync failed: " + e.getMessage());
            return EXIT_INVALID_STATE;
        } catch (RuntimeException e) {
            LOG.error("Row level security sync failed: " + e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }
}
