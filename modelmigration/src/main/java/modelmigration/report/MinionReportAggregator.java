package modelmigration.report;

import modelmigration.alert.MigrationAlertLogger;
import modelmigration.exceptions.MigrationException;
import modelmigration.exceptions.MigrationRaceException;
import modelmigration.exceptions.NotFoundException;
import modelmigration.exceptions.NotValidException;
import modelmigration.exceptions.ReportConflictException;
import modelmigration.model.AgentTopology;
import modelmigration.names.Tag;
import modelmigration.phase.MigrationPhase;
import modelmigration.store.DocumentStore;
import modelmigration.store.StoredDocument;
import modelmigration.store.TransactionAbortedException;
import modelmigration.store.TransactionRunner;
import modelmigration.store.TxnOp;
import modelmigration.watcher.DocumentWatcher;
import modelmigration.watcher.NotifyWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Records per-agent phase acknowledgements and summarises them.
 *
 * <p>Reports live in the {@code migrations.minionsync} collection, one
 * document per {@code <migrationId>:<phase>:<agent>}. A report is written at
 * most once: repeating it is a no-op, contradicting it is a
 * {@link ReportConflictException}. Reports are accepted for any phase, even
 * one the migration has already left.
 *
 * <p>When built with a migrations collection, a report is only written while
 * its migration document exists there.
 */
public final class MinionReportAggregator {

    private static final Logger log = LoggerFactory.getLogger(MinionReportAggregator.class);

    public static final String COLLECTION = "migrations.minionsync";

    private final DocumentStore store;
    private final TransactionRunner runner;
    private final AgentTopology topology;
    private final String migrationsCollection;

    public MinionReportAggregator(DocumentStore store, TransactionRunner runner, AgentTopology topology) {
        this(store, runner, topology, null);
    }

    /**
     * @param migrationsCollection collection holding one document per migration id,
     *                             or null to accept reports for any id
     */
    public MinionReportAggregator(DocumentStore store,
                                  TransactionRunner runner,
                                  AgentTopology topology,
                                  String migrationsCollection) {
        this.store = Objects.requireNonNull(store, "store");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.topology = Objects.requireNonNull(topology, "topology");
        this.migrationsCollection = migrationsCollection;
    }

    /**
     * Records that {@code agent} finished {@code phase} of a migration.
     *
     * @throws NotValidException if {@code agent} is not a valid machine or unit tag
     * @throws NotFoundException if the migration no longer exists
     * @throws ReportConflictException if the agent already reported a different outcome
     * @throws MigrationRaceException if the report could not be written within the attempt limit
     */
    public void report(String migrationId, MigrationPhase phase, Tag agent, boolean success)
            throws MigrationException {
        if (!isAgent(agent)) {
            throw NotValidException.of("agent", "agent tag " + agent);
        }
        String id = reportId(migrationId, phase, agent);
        MinionReportDoc doc = new MinionReportDoc(migrationId, phase, agent.toString(), success);
        try {
            runner.<MigrationException>run(attempt -> {
                if (migrationsCollection != null
                        && store.find(migrationsCollection, migrationId, Object.class).isEmpty()) {
                    throw new NotFoundException("migration not found", migrationId);
                }
                Optional<StoredDocument<MinionReportDoc>> existing = store.find(COLLECTION, id, MinionReportDoc.class);
                if (existing.isEmpty()) {
                    List<TxnOp> ops = new ArrayList<>();
                    if (migrationsCollection != null) {
                        ops.add(TxnOp.assertThat(migrationsCollection, migrationId, Object.class, d -> true));
                    }
                    ops.add(TxnOp.insert(COLLECTION, id, doc));
                    return ops;
                }
                if (existing.get().value().success() != success) {
                    MigrationAlertLogger.reportConflict(migrationId, phase, agent.toString(), success);
                    throw new ReportConflictException(migrationId, phase.name(), agent.toString());
                }
                log.debug("Duplicate report {} ignored", id);
                return List.of();
            });
        } catch (TransactionAbortedException e) {
            throw new MigrationRaceException("failed to record minion report", migrationId, e);
        }
    }

    /**
     * Summarises the reports for one phase against the agents expected to send them.
     */
    public MinionReports reports(String migrationId, String modelUUID, MigrationPhase phase) {
        Set<Tag> succeeded = new HashSet<>();
        Set<Tag> failed = new HashSet<>();
        for (StoredDocument<MinionReportDoc> doc : store.findByPrefix(COLLECTION, phasePrefix(migrationId, phase),
                MinionReportDoc.class)) {
            Tag agent = Tag.parse(doc.value().agent());
            if (doc.value().success()) {
                succeeded.add(agent);
            } else {
                failed.add(agent);
            }
        }
        Set<Tag> unknown = new HashSet<>(topology.expectedAgents(modelUUID, phase));
        unknown.removeAll(succeeded);
        unknown.removeAll(failed);
        return new MinionReports(migrationId, phase, succeeded, failed, unknown);
    }

    /**
     * Watches for reports on one phase of a migration.
     */
    public NotifyWatcher watch(String migrationId, MigrationPhase phase) {
        String prefix = phasePrefix(migrationId, phase);
        return DocumentWatcher.start("minion-reports " + prefix, store,
                change -> change.in(COLLECTION) && change.id().startsWith(prefix));
    }

    /**
     * Operations removing every report of a migration, for inclusion in a larger transaction.
     */
    public List<TxnOp> removeAllOps(String migrationId) {
        List<TxnOp> ops = new ArrayList<>();
        for (StoredDocument<MinionReportDoc> doc : store.findByPrefix(COLLECTION, migrationId + ":",
                MinionReportDoc.class)) {
            ops.add(TxnOp.remove(COLLECTION, doc.id()));
        }
        return ops;
    }

    private static boolean isAgent(Tag agent) {
        return agent != null
                && (agent.kind() == Tag.Kind.MACHINE || agent.kind() == Tag.Kind.UNIT)
                && agent.isValid();
    }

    static String reportId(String migrationId, MigrationPhase phase, Tag agent) {
        return phasePrefix(migrationId, phase) + agent;
    }

    static String phasePrefix(String migrationId, MigrationPhase phase) {
        return migrationId + ":" + phase.name() + ":";
    }
}
