package tech.rowguard.platform.reconcile;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.rowguard.platform.bootstrap.RowLevelSecurityConfig;
import tech.rowguard.platform.policy.FilterType;
import tech.rowguard.platform.policy.PolicyRoleAssociation;
import tech.rowguard.platform.policy.RowLevelPolicy;
import tech.rowguard.platform.resource.ProtectedResource;
import tech.rowguard.platform.role.Role;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PolicyReconciler.
 * Verifies the order of store calls and that commits only happen after writes.
 */
@ExtendWith(MockitoExtension.class)
class PolicyReconcilerTest {

    private static final String ROLE_NAME = "Open edX";
    private static final String GROUP_KEY = "xapi_course_id";
    private static final String CLAUSE = "{{can_view_courses(current_username(), \"course_id\")}}";

    @Mock
    private PolicyStore store;

    private PolicyReconciler reconciler;

    private final Role role = new Role(7L, ROLE_NAME);
    private final ProtectedResource xapiTable = new ProtectedResource(11L, "xapi", "xapi_events_all");

    @BeforeEach
    void setUp() {
        reconciler = new PolicyReconciler(store, true);
    }

    // ========================================
    // Create path
    // ========================================

    @Test
    @DisplayName("new policy is committed before its role grant is inserted")
    void synchronize_shouldCommitNewPolicyBeforeGrant_whenPolicyMissing() {
        // Arrange
        RowLevelPolicy fresh = new RowLevelPolicy();
        when(store.findRole(ROLE_NAME)).thenReturn(Optional.of(role));
        when(store.findResource("xapi", "xapi_events_all")).thenReturn(Optional.of(xapiTable));
        when(store.findPolicies(role, GROUP_KEY)).thenReturn(List.of());
        when(store.newPolicy()).thenReturn(fresh);
        doAnswer(invocation -> {
            if (fresh.id == null) {
                fresh.id = 100L;
            }
            return null;
        }).when(store).commit();
        when(store.findAssociation(role, fresh)).thenReturn(Optional.empty());

        // Act
        ReconciliationReport report = reconciler.synchronize(ROLE_NAME, List.of(descriptor(CLAUSE)));

        // Assert
        assertThat(report).isEqualTo(new ReconciliationReport(1, 0, 0, 1));
        assertThat(fresh.groupKey).isEqualTo(GROUP_KEY);
        assertThat(fresh.clause).isEqualTo(CLAUSE);
        assertThat(fresh.filterType).isEqualTo(FilterType.REGULAR);
        assertThat(fresh.resources).containsExactly(xapiTable);

        InOrder inOrder = inOrder(store);
        inOrder.verify(store).save(fresh);
        inOrder.verify(store).commit();
        inOrder.verify(store).findAssociation(role, fresh);
        inOrder.verify(store).insertAssociation(role, fresh);
        inOrder.verify(store).commit();
    }

    // ========================================
    // Update path
    // ========================================

    @Test
    @DisplayName("stale policy is overwritten in place and committed once")
    void synchronize_shouldUpdateInPlace_whenClauseIsStale() {
        // Arrange
        RowLevelPolicy existing = existingPolicy(55L, "stale clause");
        when(store.findRole(ROLE_NAME)).thenReturn(Optional.of(role));
        when(store.findResource("xapi", "xapi_events_all")).thenReturn(Optional.of(xapiTable));
        when(store.findPolicies(role, GROUP_KEY)).thenReturn(List.of(existing));
        when(store.findAssociation(role, existing))
            .thenReturn(Optional.of(new PolicyRoleAssociation(3L, role.id, existing.id)));

        // Act
        ReconciliationReport report = reconciler.synchronize(ROLE_NAME, List.of(descriptor(CLAUSE)));

        // Assert
        assertThat(report).isEqualTo(new ReconciliationReport(0, 1, 0, 0));
        assertThat(existing.id).isEqualTo(55L);
        assertThat(existing.clause).isEqualTo(CLAUSE);
        verify(store).save(existing);
        verify(store, times(1)).commit();
        verify(store, never()).newPolicy();
        verify(store, never()).insertAssociation(any(), any());
    }

    @Test
    @DisplayName("policy already in sync with its grant in place causes no writes")
    void synchronize_shouldNotCommit_whenNothingChanged() {
        // Arrange
        RowLevelPolicy existing = existingPolicy(55L, CLAUSE);
        when(store.findRole(ROLE_NAME)).thenReturn(Optional.of(role));
        when(store.findResource("xapi", "xapi_events_all")).thenReturn(Optional.of(xapiTable));
        when(store.findPolicies(role, GROUP_KEY)).thenReturn(List.of(existing));
        when(store.findAssociation(role, existing))
            .thenReturn(Optional.of(new PolicyRoleAssociation(3L, role.id, existing.id)));

        // Act
        ReconciliationReport report = reconciler.synchronize(ROLE_NAME, List.of(descriptor(CLAUSE)));

        // Assert
        assertThat(report).isEqualTo(new ReconciliationReport(0, 0, 1, 0));
        verify(store, never()).save(any());
        verify(store, never()).commit();
    }

    @Test
    @DisplayName("missing grant on an up-to-date policy is inserted and committed")
    void synchronize_shouldInsertGrant_whenAssociationMissing() {
        // Arrange
        RowLevelPolicy existing = existingPolicy(55L, CLAUSE);
        when(store.findRole(ROLE_NAME)).thenReturn(Optional.of(role));
        when(store.findResource("xapi", "xapi_events_all")).thenReturn(Optional.of(xapiTable));
        when(store.findPolicies(role, GROUP_KEY)).thenReturn(List.of(existing));
        when(store.findAssociation(role, existing)).thenReturn(Optional.empty());

        // Act
        ReconciliationReport report = reconciler.synchronize(ROLE_NAME, List.of(descriptor(CLAUSE)));

        // Assert
        assertThat(report).isEqualTo(new ReconciliationReport(0, 0, 1, 1));
        verify(store, never()).save(any());
        verify(store).insertAssociation(role, existing);
        verify(store, times(1)).commit();
    }

    // ========================================
    // Fatal lookups
    // ========================================

    @Test
    @DisplayName("missing role aborts before any other store access")
    void synchronize_shouldThrowRoleNotFound_whenRoleMissing() {
        when(store.findRole("nonexistent-role")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> reconciler.synchronize("nonexistent-role", List.of(descriptor(CLAUSE))))
            .isInstanceOf(RoleNotFoundException.class)
            .hasMessageContaining("nonexistent-role");

        verify(store).findRole("nonexistent-role");
        verifyNoMoreInteractions(store);
    }

    @Test
    @DisplayName("missing table stops the batch; later descriptors are not looked up")
    void synchronize_shouldStopAtMissingResource() {
        // Arrange
        RowLevelPolicy existing = existingPolicy(55L, CLAUSE);
        when(store.findRole(ROLE_NAME)).thenReturn(Optional.of(role));
        when(store.findResource("xapi", "xapi_events_all")).thenReturn(Optional.of(xapiTable));
        when(store.findResource("openedx", "missing")).thenReturn(Optional.empty());
        when(store.findPolicies(role, GROUP_KEY)).thenReturn(List.of(existing));
        when(store.findAssociation(role, existing))
            .thenReturn(Optional.of(new PolicyRoleAssociation(3L, role.id, existing.id)));

        List<PolicyDescriptor> desired = List.of(
            descriptor(CLAUSE),
            new PolicyDescriptor("openedx", "missing", "enrollments_course_id", CLAUSE, FilterType.REGULAR),
            new PolicyDescriptor("openedx", "never_reached", "other", CLAUSE, FilterType.REGULAR)
        );

        // Act & Assert
        assertThatThrownBy(() -> reconciler.synchronize(ROLE_NAME, desired))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessageContaining("openedx.missing")
            .satisfies(e -> {
                ResourceNotFoundException notFound = (ResourceNotFoundException) e;
                assertThat(notFound.getSchema()).isEqualTo("openedx");
                assertThat(notFound.getResourceName()).isEqualTo("missing");
            });

        verify(store, never()).findResource("openedx", "never_reached");
        verify(store, never()).findPolicies(role, "enrollments_course_id");
    }

    // ========================================
    // Integrity
    // ========================================

    @Test
    @DisplayName("several policies for one group key abort in strict mode")
    void synchronize_shouldThrowDuplicate_whenStrict() {
        when(store.findRole(ROLE_NAME)).thenReturn(Optional.of(role));
        when(store.findResource("xapi", "xapi_events_all")).thenReturn(Optional.of(xapiTable));
        when(store.findPolicies(role, GROUP_KEY))
            .thenReturn(List.of(existingPolicy(1L, "a"), existingPolicy(2L, "b")));

        assertThatThrownBy(() -> reconciler.synchronize(ROLE_NAME, List.of(descriptor(CLAUSE))))
            .isInstanceOf(DuplicatePolicyException.class)
            .hasMessageContaining(GROUP_KEY)
            .hasMessageContaining("[1, 2]");

        verify(store, never()).save(any());
        verify(store, never()).commit();
    }

    @Test
    @DisplayName("several policies for one group key: lenient mode updates the first")
    void synchronize_shouldUpdateFirst_whenLenient() {
        PolicyReconciler lenient = new PolicyReconciler(store, false);
        RowLevelPolicy first = existingPolicy(1L, "a");
        RowLevelPolicy second = existingPolicy(2L, "b");
        when(store.findRole(ROLE_NAME)).thenReturn(Optional.of(role));
        when(store.findResource("xapi", "xapi_events_all")).thenReturn(Optional.of(xapiTable));
        when(store.findPolicies(role, GROUP_KEY)).thenReturn(List.of(first, second));
        when(store.findAssociation(role, first))
            .thenReturn(Optional.of(new PolicyRoleAssociation(3L, role.id, first.id)));

        lenient.synchronize(ROLE_NAME, List.of(descriptor(CLAUSE)));

        assertThat(first.clause).isEqualTo(CLAUSE);
        assertThat(second.clause).isEqualTo("b");
        verify(store).save(first);
        verify(store, never()).save(second);
    }

    @Test
    @DisplayName("integrity mode is taken from the row level security configuration")
    void init_shouldReadStrictIntegrityFromConfig() {
        // Arrange
        RowLevelSecurityConfig config = mock(RowLevelSecurityConfig.class);
        when(config.strictIntegrity()).thenReturn(false);
        PolicyReconciler configured = new PolicyReconciler();
        configured.store = store;
        configured.config = config;
        configured.init();

        RowLevelPolicy first = existingPolicy(1L, "a");
        when(store.findRole(ROLE_NAME)).thenReturn(Optional.of(role));
        when(store.findResource("xapi", "xapi_events_all")).thenReturn(Optional.of(xapiTable));
        when(store.findPolicies(role, GROUP_KEY)).thenReturn(List.of(first, existingPolicy(2L, "b")));
        when(store.findAssociation(role, first))
            .thenReturn(Optional.of(new PolicyRoleAssociation(3L, role.id, first.id)));

        // Act
        ReconciliationReport report = configured.synchronize(ROLE_NAME, List.of(descriptor(CLAUSE)));

        // Assert
        assertThat(report.policiesUpdated()).isEqualTo(1);
        verify(store).save(first);
    }

    // ========================================
    // Argument validation and store failures
    // ========================================

    @Test
    @DisplayName("blank role name is rejected without touching the store")
    void synchronize_shouldRejectBlankRoleName() {
        assertThatThrownBy(() -> reconciler.synchronize(" ", List.of(descriptor(CLAUSE))))
            .isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("incomplete descriptor is rejected without touching the store")
    void synchronize_shouldRejectIncompleteDescriptor() {
        PolicyDescriptor noClause = new PolicyDescriptor("xapi", "xapi_events_all", GROUP_KEY, "", FilterType.REGULAR);
        List<PolicyDescriptor> withNull = new ArrayList<>(Arrays.asList(descriptor(CLAUSE), null));

        assertThatThrownBy(() -> reconciler.synchronize(ROLE_NAME, List.of(descriptor(CLAUSE), noClause)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("#1")
            .hasMessageContaining("clause is required");
        assertThatThrownBy(() -> reconciler.synchronize(ROLE_NAME, withNull))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("#1 is null");

        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("store failure propagates unchanged")
    void synchronize_shouldPropagateStoreFailure() {
        RowLevelPolicy fresh = new RowLevelPolicy();
        IllegalStateException failure = new IllegalStateException("connection refused");
        when(store.findRole(ROLE_NAME)).thenReturn(Optional.of(role));
        when(store.findResource("xapi", "xapi_events_all")).thenReturn(Optional.of(xapiTable));
        when(store.findPolicies(role, GROUP_KEY)).thenReturn(List.of());
        when(store.newPolicy()).thenReturn(fresh);
        doThrow(failure).when(store).commit();

        assertThatThrownBy(() -> reconciler.synchronize(ROLE_NAME, List.of(descriptor(CLAUSE))))
            .isSameAs(failure);

        verify(store, never()).insertAssociation(any(), any());
    }

    @Test
    @DisplayName("empty desired state still requires the role and writes nothing")
    void synchronize_shouldDoNothing_whenDesiredStateEmpty() {
        when(store.findRole(ROLE_NAME)).thenReturn(Optional.of(role));

        ReconciliationReport report = reconciler.synchronize(ROLE_NAME, List.of());

        assertThat(report.total()).isZero();
        assertThat(report.changed()).isFalse();
        verify(store).findRole(ROLE_NAME);
        verifyNoMoreInteractions(store);
    }

    // ========================================
    // HELPERS
    // ========================================

    private PolicyDescriptor descriptor(String clause) {
        return new PolicyDescriptor("xapi", "xapi_events_all", GROUP_KEY, clause, FilterType.REGULAR);
    }

    private RowLevelPolicy existingPolicy(Long id, String clause) {
        RowLevelPolicy policy = new RowLevelPolicy();
        policy.id = id;
        policy.groupKey = GROUP_KEY;
        policy.clause = clause;
        policy.filterType = FilterType.REGULAR;
        policy.resources.add(xapiTable);
        return policy;
    }
}
