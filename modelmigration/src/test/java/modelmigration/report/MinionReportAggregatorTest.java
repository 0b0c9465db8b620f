package modelmigration.report;

import modelmigration.exceptions.MigrationException;
import modelmigration.exceptions.NotFoundException;
import modelmigration.exceptions.NotValidException;
import modelmigration.exceptions.ReportConflictException;
import modelmigration.model.AgentTopology;
import modelmigration.names.Tag;
import modelmigration.phase.MigrationPhase;
import modelmigration.store.DocumentStore;
import modelmigration.store.TransactionAbortedException;
import modelmigration.store.TransactionRunner;
import modelmigration.store.TxnOp;
import modelmigration.watcher.NotifyWatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Set;

import static modelmigration.testing.WatcherAssert.assertNoChange;
import static modelmigration.testing.WatcherAssert.assertOneChange;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("MinionReportAggregator")
class MinionReportAggregatorTest {

    private static final String MODEL = "model-uuid";
    private static final String MIGRATION = MODEL + ":0";

    @Mock
    private AgentTopology topology;

    private AutoCloseable mocks;
    private DocumentStore store;
    private MinionReportAggregator aggregator;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        store = new DocumentStore();
        aggregator = new MinionReportAggregator(store, new TransactionRunner(store, 3), topology);
        when(topology.expectedAgents(any(), any())).thenReturn(Set.of());
    }

    @AfterEach
    void tearDown() throws Exception {
        store.close();
        mocks.close();
    }

    @Nested
    @DisplayName("report")
    class Report {

        @Test
        @DisplayName("should accept identical repeats")
        void shouldAcceptIdenticalRepeats() throws MigrationException {
            aggregator.report(MIGRATION, MigrationPhase.QUIESCE, Tag.machine("42"), true);
            long revision = store.currentRevision();

            aggregator.report(MIGRATION, MigrationPhase.QUIESCE, Tag.machine("42"), true);

            assertThat(store.currentRevision()).isEqualTo(revision);
        }

        @Test
        @DisplayName("should reject a contradicting report")
        void shouldRejectContradiction() throws MigrationException {
            aggregator.report(MIGRATION, MigrationPhase.QUIESCE, Tag.machine("42"), true);

            assertThatThrownBy(() -> aggregator.report(MIGRATION, MigrationPhase.QUIESCE, Tag.machine("42"), false))
                    .isInstanceOf(ReportConflictException.class)
                    .hasMessage("conflicting reports received for model-uuid:0/QUIESCE/machine-42");
        }

        @Test
        @DisplayName("should reject tags that are not machine or unit agents")
        void shouldRejectNonAgentTags() {
            assertThatThrownBy(() -> aggregator.report(MIGRATION, MigrationPhase.QUIESCE, Tag.machine("x"), true))
                    .isInstanceOf(NotValidException.class)
                    .hasMessage("agent tag machine-x not valid");
            assertThatThrownBy(() -> aggregator.report(MIGRATION, MigrationPhase.QUIESCE, Tag.user("bob"), true))
                    .isInstanceOf(NotValidException.class);

            assertThat(store.currentRevision()).isZero();
        }

        @Test
        @DisplayName("should only record reports for existing migrations when guarded")
        void shouldRequireMigrationDocument() throws Exception {
            MinionReportAggregator guarded = new MinionReportAggregator(store, new TransactionRunner(store, 3),
                    topology, "migrations");

            assertThatThrownBy(() -> guarded.report(MIGRATION, MigrationPhase.QUIESCE, Tag.machine("1"), true))
                    .isInstanceOf(NotFoundException.class);

            store.apply(List.of(TxnOp.insert("migrations", MIGRATION, "doc")));
            guarded.report(MIGRATION, MigrationPhase.QUIESCE, Tag.machine("1"), true);

            assertThat(guarded.reports(MIGRATION, MODEL, MigrationPhase.QUIESCE).succeeded())
                    .containsExactly(Tag.machine("1"));
        }

        @Test
        @DisplayName("should keep phases apart")
        void shouldKeepPhasesApart() throws MigrationException {
            aggregator.report(MIGRATION, MigrationPhase.QUIESCE, Tag.machine("42"), true);
            aggregator.report(MIGRATION, MigrationPhase.READONLY, Tag.machine("42"), false);

            assertThat(aggregator.reports(MIGRATION, MODEL, MigrationPhase.QUIESCE).succeeded())
                    .containsExactly(Tag.machine("42"));
            assertThat(aggregator.reports(MIGRATION, MODEL, MigrationPhase.READONLY).failed())
                    .containsExactly(Tag.machine("42"));
        }

        @Test
        @DisplayName("should resolve a concurrent identical insert as success")
        void shouldResolveConcurrentIdenticalInsert() throws MigrationException {
            store.setBeforeHooks(() -> {
                try {
                    aggregator.report(MIGRATION, MigrationPhase.QUIESCE, Tag.machine("1"), true);
                } catch (MigrationException e) {
                    throw new IllegalStateException(e);
                }
            });

            aggregator.report(MIGRATION, MigrationPhase.QUIESCE, Tag.machine("1"), true);

            assertThat(aggregator.reports(MIGRATION, MODEL, MigrationPhase.QUIESCE).succeeded())
                    .containsExactly(Tag.machine("1"));
        }

        @Test
        @DisplayName("should resolve a concurrent differing insert as conflict")
        void shouldResolveConcurrentDifferingInsert() {
            store.setBeforeHooks(() -> {
                try {
                    aggregator.report(MIGRATION, MigrationPhase.QUIESCE, Tag.machine("1"), false);
                } catch (MigrationException e) {
                    throw new IllegalStateException(e);
                }
            });

            assertThatThrownBy(() -> aggregator.report(MIGRATION, MigrationPhase.QUIESCE, Tag.machine("1"), true))
                    .isInstanceOf(ReportConflictException.class);
        }
    }

    @Nested
    @DisplayName("reports")
    class Reports {

        @Test
        @DisplayName("should partition the expected agents")
        void shouldPartitionExpectedAgents() throws MigrationException {
            Tag m0 = Tag.machine("0");
            Tag m1 = Tag.machine("1");
            Tag m2 = Tag.machine("2");
            Tag u0 = Tag.unit("mysql/0");
            when(topology.expectedAgents(MODEL, MigrationPhase.QUIESCE)).thenReturn(Set.of(m0, m1, m2, u0));

            aggregator.report(MIGRATION, MigrationPhase.QUIESCE, m0, true);
            aggregator.report(MIGRATION, MigrationPhase.QUIESCE, m1, false);
            aggregator.report(MIGRATION, MigrationPhase.QUIESCE, u0, true);

            MinionReports reports = aggregator.reports(MIGRATION, MODEL, MigrationPhase.QUIESCE);
            assertThat(reports.succeeded()).containsExactlyInAnyOrder(m0, u0);
            assertThat(reports.failed()).containsExactly(m1);
            assertThat(reports.unknown()).containsExactly(m2);
            assertThat(reports.isComplete()).isFalse();
            assertThat(reports.anyFailed()).isTrue();
            assertThat(reports.reportedCount()).isEqualTo(3);
            verify(topology).expectedAgents(eq(MODEL), eq(MigrationPhase.QUIESCE));
        }

        @Test
        @DisplayName("should include agents that were not expected")
        void shouldIncludeUnexpectedReporters() throws MigrationException {
            aggregator.report(MIGRATION, MigrationPhase.QUIESCE, Tag.machine("9"), true);

            MinionReports reports = aggregator.reports(MIGRATION, MODEL, MigrationPhase.QUIESCE);

            assertThat(reports.succeeded()).containsExactly(Tag.machine("9"));
            assertThat(reports.isComplete()).isTrue();
        }

        @Test
        @DisplayName("should not mix migrations with similar ids")
        void shouldNotMixMigrations() throws MigrationException {
            aggregator.report(MODEL + ":1", MigrationPhase.QUIESCE, Tag.machine("0"), true);
            aggregator.report(MODEL + ":10", MigrationPhase.QUIESCE, Tag.machine("1"), true);

            assertThat(aggregator.reports(MODEL + ":1", MODEL, MigrationPhase.QUIESCE).succeeded())
                    .containsExactly(Tag.machine("0"));
        }
    }

    @Nested
    @DisplayName("watch")
    class Watch {

        @Test
        @DisplayName("should fire only for the watched phase")
        void shouldFireForWatchedPhase() throws Exception {
            try (NotifyWatcher w = aggregator.watch(MIGRATION, MigrationPhase.QUIESCE)) {
                assertOneChange(w);

                aggregator.report(MIGRATION, MigrationPhase.QUIESCE, Tag.machine("0"), true);
                assertOneChange(w);

                aggregator.report(MIGRATION, MigrationPhase.IMPORT, Tag.machine("1"), true);
                assertNoChange(w);

                aggregator.report(MODEL + ":1", MigrationPhase.QUIESCE, Tag.machine("1"), true);
                assertNoChange(w);
            }
        }
    }

    @Nested
    @DisplayName("removeAllOps")
    class RemoveAll {

        @Test
        @DisplayName("should remove every report of a migration")
        void shouldRemoveEveryReport() throws MigrationException, TransactionAbortedException {
            aggregator.report(MIGRATION, MigrationPhase.QUIESCE, Tag.machine("0"), true);
            aggregator.report(MIGRATION, MigrationPhase.READONLY, Tag.machine("0"), true);
            aggregator.report(MODEL + ":1", MigrationPhase.QUIESCE, Tag.machine("0"), true);

            store.apply(aggregator.removeAllOps(MIGRATION));

            assertThat(aggregator.reports(MIGRATION, MODEL, MigrationPhase.QUIESCE).reportedCount()).isZero();
            assertThat(aggregator.reports(MIGRATION, MODEL, MigrationPhase.READONLY).reportedCount()).isZero();
            assertThat(aggregator.reports(MODEL + ":1", MODEL, MigrationPhase.QUIESCE).reportedCount()).isEqualTo(1);
        }
    }
}
