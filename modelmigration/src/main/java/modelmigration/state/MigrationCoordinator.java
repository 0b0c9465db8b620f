package modelmigration.state;

import modelmigration.alert.MigrationAlertLogger;
import modelmigration.config.MigrationConfig;
import modelmigration.config.MigrationConfigLoader;
import modelmigration.exceptions.MigrationConflictException;
import modelmigration.exceptions.MigrationException;
import modelmigration.exceptions.MigrationRaceException;
import modelmigration.exceptions.NotFoundException;
import modelmigration.model.AgentTopology;
import modelmigration.model.ModelRecord;
import modelmigration.model.Models;
import modelmigration.report.MinionReportAggregator;
import modelmigration.sequence.SequenceGenerator;
import modelmigration.store.DocumentChange;
import modelmigration.store.DocumentStore;
import modelmigration.store.StoredDocument;
import modelmigration.store.TransactionAbortedException;
import modelmigration.store.TransactionRunner;
import modelmigration.store.TxnOp;
import modelmigration.watcher.DocumentWatcher;
import modelmigration.watcher.NotifyWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Creates, finds and watches model migrations.
 *
 * <p>A migration is stored as three documents sharing the id
 * {@code <modelUUID>:<attempt>}: its identity in {@code migrations}, its
 * progress in {@code migrations.status} and its target in
 * {@code migrations.target}. A model has at most one migration in a
 * non-terminal phase; the model record's active-migration marker enforces
 * this and is only ever changed in the same transaction as the migration's
 * status.
 *
 * <p>All writes are optimistic. The coordinator retries only while creating a
 * migration, and only to turn a lost race into a definitive answer; every
 * other lost race is reported to the caller.
 *
 * <h2>Usage:</h2>
 * <pre>
 * MigrationCoordinator coordinator = new MigrationCoordinator(store, topology, Clock.systemUTC(), config);
 * ModelMigration mig = coordinator.create(modelUUID, spec);
 * mig.setPhase(MigrationPhase.READONLY);
 * </pre>
 */
public final class MigrationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MigrationCoordinator.class);

    public static final String MIGRATIONS_COLLECTION = "migrations";
    public static final String STATUS_COLLECTION = "migrations.status";
    public static final String TARGET_COLLECTION = "migrations.target";

    static final String SEQUENCE_NAME = "modelmigration";

    private final DocumentStore store;
    private final MigrationConfig config;
    private final Clock clock;
    private final Models models;
    private final SequenceGenerator sequences;
    private final TransactionRunner runner;
    private final MinionReportAggregator reports;

    public MigrationCoordinator(DocumentStore store, AgentTopology topology, Clock clock, MigrationConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.config = Objects.requireNonNull(config, "config");
        this.models = new Models(store, config);
        this.sequences = new SequenceGenerator(store);
        this.runner = new TransactionRunner(store, config.txnAttempts());
        this.reports = new MinionReportAggregator(store, runner, topology, MIGRATIONS_COLLECTION);

        MigrationAlertLogger.setAlertLevel(config.alertLevel());
        log.debug("Applied config: {}", config);
    }

    /**
     * Builds a coordinator configured from the classpath.
     *
     * @see MigrationConfigLoader#load()
     */
    public static MigrationCoordinator withLoadedConfig(DocumentStore store, AgentTopology topology, Clock clock) {
        return new MigrationCoordinator(store, topology, clock, MigrationConfigLoader.load());
    }

    /** The model records this coordinator migrates. */
    public Models models() {
        return models;
    }

    public MigrationConfig config() {
        return config;
    }

    /**
     * Starts a migration of a model.
     *
     * <p>On success the migration is in QUIESCE with attempt number one
     * higher than the model's previous migration (0 for the first), the model
     * is marked as migrating and is in the exporting mode. On failure nothing
     * is written and the attempt number is not used up.
     *
     * @throws modelmigration.exceptions.NotValidException if the spec is malformed
     * @throws NotFoundException if the model does not exist
     * @throws MigrationConflictException if the model cannot be migrated now
     * @throws MigrationRaceException if concurrent writers kept winning
     */
    public ModelMigration create(String modelUUID, MigrationSpec spec) throws MigrationException {
        spec.validate();

        AtomicReference<StoredModelMigration> created = new AtomicReference<>();
        try {
            runner.<MigrationException>run(attempt -> {
                ModelRecord model = models.get(modelUUID);
                checkCanMigrate(model, spec);

                SequenceGenerator.Claim claim = sequences.claim(modelUUID, SEQUENCE_NAME);
                String id = migrationId(modelUUID, claim.value());
                Instant now = clock.instant();
                MigrationDoc doc = new MigrationDoc(id, modelUUID, claim.value(), spec.initiatedBy().toString());
                MigrationStatusDoc status = MigrationStatusDoc.initial(id, modelUUID,
                        config.initialStatusMessage(), now);
                created.set(new StoredModelMigration(store, models, reports, clock, doc, status));

                return List.of(
                        claim.op(),
                        models.startMigrationOp(modelUUID, id),
                        TxnOp.insert(MIGRATIONS_COLLECTION, id, doc),
                        TxnOp.insert(STATUS_COLLECTION, id, status),
                        TxnOp.insert(TARGET_COLLECTION, id, spec.targetInfo()));
            });
        } catch (MigrationConflictException e) {
            MigrationAlertLogger.createRejected(modelUUID, e.getMessage());
            throw e;
        } catch (TransactionAbortedException e) {
            MigrationAlertLogger.createRejected(modelUUID, "too many concurrent writers");
            throw new MigrationRaceException("failed to create migration: too many concurrent writers", null, e);
        }

        StoredModelMigration mig = created.get();
        MigrationAlertLogger.migrationCreated(mig.id(), modelUUID,
                spec.targetInfo().controllerTag().toString(), spec.initiatedBy().toString());
        return mig;
    }

    private static void checkCanMigrate(ModelRecord model, MigrationSpec spec) throws MigrationConflictException {
        if (model.controllerModel()) {
            throw new MigrationConflictException("controllers can't be migrated");
        }
        if (spec.targetInfo().controllerTag().id().equals(model.controllerUUID())) {
            throw new MigrationConflictException("model already attached to target controller");
        }
        if (!model.isAlive()) {
            throw new MigrationConflictException("failed to create migration: model is not alive");
        }
        if (model.hasActiveMigration()) {
            throw new MigrationConflictException("failed to create migration: already in progress",
                    model.activeMigrationId());
        }
    }

    /**
     * @throws NotFoundException if there is no migration with this id
     */
    public ModelMigration get(String id) throws NotFoundException {
        MigrationDoc doc = store.find(MIGRATIONS_COLLECTION, id, MigrationDoc.class)
                .map(StoredDocument::value)
                .orElseThrow(() -> new NotFoundException("migration not found", id));
        return load(doc);
    }

    /**
     * The migration with the highest attempt number for a model.
     *
     * @throws NotFoundException if the model was never migrated
     */
    public ModelMigration latestForModel(String modelUUID) throws NotFoundException {
        MigrationDoc latest = migrationDocs(modelUUID).stream()
                .max(Comparator.comparingInt(MigrationDoc::attempt))
                .orElseThrow(() -> new NotFoundException("migration not found"));
        return load(latest);
    }

    /**
     * Every migration of a model, oldest attempt first.
     */
    public List<ModelMigration> allForModel(String modelUUID) throws NotFoundException {
        List<MigrationDoc> docs = new ArrayList<>(migrationDocs(modelUUID));
        docs.sort(Comparator.comparingInt(MigrationDoc::attempt));
        List<ModelMigration> result = new ArrayList<>(docs.size());
        for (MigrationDoc doc : docs) {
            result.add(load(doc));
        }
        return result;
    }

    /**
     * True while the model has a migration in a non-terminal phase.
     *
     * @throws NotFoundException if the model does not exist
     */
    public boolean isModelMigrationActive(String modelUUID) throws NotFoundException {
        return models.get(modelUUID).hasActiveMigration();
    }

    /**
     * Discards a finished migration together with its minion reports.
     *
     * @throws NotFoundException if there is no migration with this id
     * @throws MigrationConflictException if the migration has not reached a terminal phase
     * @throws MigrationRaceException if the migration changed while being removed
     */
    public void removeMigration(String id) throws MigrationException {
        MigrationStatusDoc status = store.find(STATUS_COLLECTION, id, MigrationStatusDoc.class)
                .map(StoredDocument::value)
                .orElseThrow(() -> new NotFoundException("migration not found", id));
        if (!status.phase().isTerminal()) {
            throw new MigrationConflictException("failed to remove migration: not finished", id);
        }

        List<TxnOp> ops = new ArrayList<>();
        ops.add(TxnOp.assertThat(STATUS_COLLECTION, id, MigrationStatusDoc.class, d -> d.phase().isTerminal()));
        ops.add(TxnOp.remove(STATUS_COLLECTION, id));
        ops.add(TxnOp.remove(MIGRATIONS_COLLECTION, id));
        ops.add(TxnOp.remove(TARGET_COLLECTION, id));
        ops.addAll(reports.removeAllOps(id));
        try {
            store.apply(ops);
        } catch (TransactionAbortedException e) {
            throw new MigrationRaceException("failed to remove migration", id, e);
        }
        log.debug("Removed migration {}", id);
    }

    /**
     * Watches for a model's migrations starting or ending.
     *
     * <p>Fires on start, then whenever a migration of the model is created or
     * reaches a terminal phase. Intermediate phase changes do not fire it.
     */
    public NotifyWatcher watchForModelMigration(String modelUUID) {
        return DocumentWatcher.start("model-migration " + modelUUID, store,
                change -> change.in(Models.COLLECTION)
                        && change.id().equals(modelUUID)
                        && !Objects.equals(activeMarker(change.before(ModelRecord.class)),
                                activeMarker(change.after(ModelRecord.class))));
    }

    /**
     * Watches every change to the status of a model's migrations.
     */
    public NotifyWatcher watchMigrationStatus(String modelUUID) {
        return DocumentWatcher.start("migration-status " + modelUUID, store,
                change -> change.in(STATUS_COLLECTION) && belongsTo(change, modelUUID));
    }

    private static String activeMarker(ModelRecord model) {
        return model != null ? model.activeMigrationId() : null;
    }

    private static boolean belongsTo(DocumentChange change, String modelUUID) {
        MigrationStatusDoc after = change.after(MigrationStatusDoc.class);
        MigrationStatusDoc before = change.before(MigrationStatusDoc.class);
        return (after != null && after.modelUUID().equals(modelUUID))
                || (before != null && before.modelUUID().equals(modelUUID));
    }

    private List<MigrationDoc> migrationDocs(String modelUUID) {
        List<MigrationDoc> docs = new ArrayList<>();
        for (StoredDocument<MigrationDoc> doc : store.findByPrefix(MIGRATIONS_COLLECTION, modelUUID + ":",
                MigrationDoc.class)) {
            docs.add(doc.value());
        }
        return docs;
    }

    private StoredModelMigration load(MigrationDoc doc) throws NotFoundException {
        MigrationStatusDoc status = store.find(STATUS_COLLECTION, doc.id(), MigrationStatusDoc.class)
                .map(StoredDocument::value)
                .orElseThrow(() -> new NotFoundException("migration not found", doc.id()));
        return new StoredModelMigration(store, models, reports, clock, doc, status);
    }

    static String migrationId(String modelUUID, int attempt) {
        return modelUUID + ":" + attempt;
    }
}
