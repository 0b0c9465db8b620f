package modelmigration.model;

import modelmigration.config.MigrationConfig;
import modelmigration.exceptions.NotFoundException;
import modelmigration.store.DocumentStore;
import modelmigration.store.StoredDocument;
import modelmigration.store.TransactionAbortedException;
import modelmigration.store.TxnOp;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Model records kept in the {@code models} collection.
 *
 * <p>Besides plain reads and writes, this class hands out the transaction
 * operations the migration coordinator composes with its own writes, so that
 * the active-migration marker and the model mode change in the same commit as
 * the migration documents.
 */
public final class Models {

    public static final String COLLECTION = "models";

    private final DocumentStore store;
    private final MigrationConfig config;

    public Models(DocumentStore store, MigrationConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Adds a live model in the configured active mode.
     *
     * @throws IllegalStateException if a model with the same UUID exists
     */
    public ModelRecord add(String uuid, String name, String controllerUUID, boolean controllerModel) {
        ModelRecord model = new ModelRecord(uuid, name, controllerUUID, controllerModel,
                Life.ALIVE, config.activeMode(), null, null);
        try {
            store.apply(List.of(TxnOp.insert(COLLECTION, uuid, model)));
        } catch (TransactionAbortedException e) {
            throw new IllegalStateException("model " + uuid + " already exists", e);
        }
        return model;
    }

    public Optional<ModelRecord> find(String uuid) {
        return store.find(COLLECTION, uuid, ModelRecord.class).map(StoredDocument::value);
    }

    /**
     * @throws NotFoundException if the model does not exist
     */
    public ModelRecord get(String uuid) throws NotFoundException {
        return find(uuid).orElseThrow(() -> new NotFoundException("model not found"));
    }

    public boolean isAlive(String uuid) throws NotFoundException {
        return get(uuid).isAlive();
    }

    public String migrationMode(String uuid) throws NotFoundException {
        return get(uuid).migrationMode();
    }

    /**
     * Sets the mode label of a model directly.
     */
    public void setMode(String uuid, String mode) throws NotFoundException {
        applyOrNotFound(uuid, TxnOp.update(COLLECTION, uuid, ModelRecord.class, m -> m.withMigrationMode(mode)));
    }

    /**
     * Moves a model one step towards death: ALIVE becomes DYING, DYING becomes DEAD.
     */
    public void destroy(String uuid) throws NotFoundException {
        applyOrNotFound(uuid, TxnOp.update(COLLECTION, uuid, ModelRecord.class,
                m -> m.withLife(m.life() == Life.ALIVE ? Life.DYING : Life.DEAD)));
    }

    /**
     * Asserts the model is alive with no migration in progress, then marks
     * {@code migrationId} active and switches to the exporting mode. The mode
     * the model had is kept for {@link #endMigrationOp}.
     */
    public TxnOp startMigrationOp(String uuid, String migrationId) {
        return TxnOp.update(COLLECTION, uuid, ModelRecord.class,
                m -> m.isAlive() && !m.hasActiveMigration(),
                m -> m.startMigration(migrationId, config.exportingMode()));
    }

    /**
     * Asserts {@code migrationId} is the active migration, then clears the
     * marker. A successful migration leaves the model in the migrated mode, an
     * aborted one restores the mode it had before the migration started.
     */
    public TxnOp endMigrationOp(String uuid, String migrationId, boolean succeeded) {
        String mode = succeeded ? config.migratedMode() : null;
        return TxnOp.update(COLLECTION, uuid, ModelRecord.class,
                m -> migrationId.equals(m.activeMigrationId()),
                m -> m.endMigration(mode));
    }

    /**
     * Sets the model to the exporting mode while {@code migrationId} is active.
     */
    public TxnOp exportingOp(String uuid, String migrationId) {
        return TxnOp.update(COLLECTION, uuid, ModelRecord.class,
                m -> migrationId.equals(m.activeMigrationId()),
                m -> m.withMigrationMode(config.exportingMode()));
    }

    private void applyOrNotFound(String uuid, TxnOp op) throws NotFoundException {
        try {
            store.apply(List.of(op));
        } catch (TransactionAbortedException e) {
            throw new NotFoundException("model not found");
        }
    }
}
