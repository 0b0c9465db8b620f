package modelmigration.model;

import java.util.Objects;

/**
 * Stored state of a model, as far as migrations are concerned.
 *
 * @param uuid the model UUID
 * @param name human readable model name
 * @param controllerUUID UUID of the controller currently hosting the model
 * @param controllerModel true for the model that hosts the controller itself
 * @param life lifecycle state
 * @param migrationMode externally visible mode label
 * @param activeMigrationId id of the migration in progress, or null
 * @param premigrationMode mode the model had when the active migration started, or null
 */
public record ModelRecord(String uuid,
                          String name,
                          String controllerUUID,
                          boolean controllerModel,
                          Life life,
                          String migrationMode,
                          String activeMigrationId,
                          String premigrationMode) {

    public ModelRecord {
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(controllerUUID, "controllerUUID");
        Objects.requireNonNull(life, "life");
        Objects.requireNonNull(migrationMode, "migrationMode");
    }

    public boolean isAlive() {
        return life == Life.ALIVE;
    }

    public boolean hasActiveMigration() {
        return activeMigrationId != null;
    }

    public ModelRecord withLife(Life newLife) {
        return new ModelRecord(uuid, name, controllerUUID, controllerModel, newLife, migrationMode, activeMigrationId,
                premigrationMode);
    }

    public ModelRecord withMigrationMode(String mode) {
        return new ModelRecord(uuid, name, controllerUUID, controllerModel, life, mode, activeMigrationId,
                premigrationMode);
    }

    /**
     * Marks {@code migrationId} active, remembering the current mode so an
     * abort can put it back.
     */
    public ModelRecord startMigration(String migrationId, String mode) {
        return new ModelRecord(uuid, name, controllerUUID, controllerModel, life, mode, migrationId, migrationMode);
    }

    /**
     * Clears the active migration. A null {@code mode} restores the mode from
     * before the migration started.
     */
    public ModelRecord endMigration(String mode) {
        String restored = mode != null ? mode : premigrationMode;
        return new ModelRecord(uuid, name, controllerUUID, controllerModel, life,
                restored != null ? restored : migrationMode, null, null);
    }
}
