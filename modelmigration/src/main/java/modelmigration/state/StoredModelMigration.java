package modelmigration.state;

import modelmigration.alert.MigrationAlertLogger;
import modelmigration.exceptions.IllegalPhaseTransitionException;
import modelmigration.exceptions.MigrationException;
import modelmigration.exceptions.MigrationRaceException;
import modelmigration.exceptions.NotFoundException;
import modelmigration.model.Models;
import modelmigration.names.Tag;
import modelmigration.phase.MigrationPhase;
import modelmigration.report.MinionReportAggregator;
import modelmigration.report.MinionReports;
import modelmigration.store.DocumentStore;
import modelmigration.store.StoredDocument;
import modelmigration.store.TransactionAbortedException;
import modelmigration.store.TxnOp;
import modelmigration.watcher.NotifyWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link ModelMigration} backed by the coordinator's document store.
 */
final class StoredModelMigration implements ModelMigration {

    private static final Logger log = LoggerFactory.getLogger(StoredModelMigration.class);

    private final DocumentStore store;
    private final Models models;
    private final MinionReportAggregator reports;
    private final Clock clock;
    private final MigrationDoc doc;

    private volatile MigrationStatusDoc status;

    StoredModelMigration(DocumentStore store,
                         Models models,
                         MinionReportAggregator reports,
                         Clock clock,
                         MigrationDoc doc,
                         MigrationStatusDoc status) {
        this.store = store;
        this.models = models;
        this.reports = reports;
        this.clock = clock;
        this.doc = doc;
        this.status = status;
    }

    @Override
    public String id() {
        return doc.id();
    }

    @Override
    public String modelUUID() {
        return doc.modelUUID();
    }

    @Override
    public int attempt() {
        return doc.attempt();
    }

    @Override
    public Tag initiatedBy() {
        return Tag.parse(doc.initiatedBy());
    }

    @Override
    public MigrationPhase phase() {
        return status.phase();
    }

    @Override
    public void setPhase(MigrationPhase next) throws MigrationException {
        MigrationStatusDoc current = status;
        MigrationPhase from = current.phase();
        if (!from.canTransitionTo(next)) {
            throw new IllegalPhaseTransitionException(id(), from.name(), String.valueOf(next));
        }

        Instant now = clock.instant();
        List<TxnOp> ops = new ArrayList<>();
        ops.add(TxnOp.update(MigrationCoordinator.STATUS_COLLECTION, id(), MigrationStatusDoc.class,
                d -> d.phase() == from,
                d -> d.withPhase(next, now)));
        if (next == MigrationPhase.READONLY) {
            ops.add(models.exportingOp(modelUUID(), id()));
        }
        if (next.isTerminal()) {
            ops.add(models.endMigrationOp(modelUUID(), id(), next.hasReachedSuccess()));
        }

        try {
            store.apply(ops);
        } catch (TransactionAbortedException e) {
            MigrationAlertLogger.phaseChangeRace(id(), from, next);
            throw new MigrationRaceException("phase already changed", id(), from.name());
        }
        status = current.withPhase(next, now);
        log.debug("Migration {} moved from {} to {}", id(), from, next);

        MigrationAlertLogger.phaseChanged(id(), from, next);
        if (next.isTerminal()) {
            MigrationAlertLogger.migrationEnded(id(), next, models.find(modelUUID())
                    .map(m -> m.migrationMode())
                    .orElse("unknown"));
        }
    }

    @Override
    public String statusMessage() {
        return status.statusMessage();
    }

    @Override
    public void setStatusMessage(String message) throws NotFoundException {
        try {
            store.apply(List.of(TxnOp.update(MigrationCoordinator.STATUS_COLLECTION, id(), MigrationStatusDoc.class,
                    d -> d.withStatusMessage(message))));
        } catch (TransactionAbortedException e) {
            throw new NotFoundException("migration not found", id());
        }
        status = status.withStatusMessage(message);
    }

    @Override
    public Instant startTime() {
        return status.startTime();
    }

    @Override
    public Instant phaseChangedTime() {
        return status.phaseChangedTime();
    }

    @Override
    public Optional<Instant> successTime() {
        return Optional.ofNullable(status.successTime());
    }

    @Override
    public Optional<Instant> endTime() {
        return Optional.ofNullable(status.endTime());
    }

    @Override
    public TargetInfo targetInfo() throws NotFoundException {
        return store.find(MigrationCoordinator.TARGET_COLLECTION, id(), TargetInfo.class)
                .map(StoredDocument::value)
                .orElseThrow(() -> new NotFoundException("migration not found", id()));
    }

    @Override
    public void minionReport(Tag agent, MigrationPhase phase, boolean success) throws MigrationException {
        reports.report(id(), phase, agent, success);
    }

    @Override
    public MinionReports getMinionReports(MigrationPhase phase) {
        return reports.reports(id(), modelUUID(), phase);
    }

    @Override
    public MinionReports getMinionReports() {
        return getMinionReports(phase());
    }

    @Override
    public NotifyWatcher watchMinionReports() {
        return reports.watch(id(), phase());
    }

    @Override
    public void refresh() throws NotFoundException {
        status = store.find(MigrationCoordinator.STATUS_COLLECTION, id(), MigrationStatusDoc.class)
                .map(StoredDocument::value)
                .orElseThrow(() -> new NotFoundException("migration not found", id()));
    }

    @Override
    public String toString() {
        return "ModelMigration{" + id() + ", phase=" + phase() + '}';
    }
}
