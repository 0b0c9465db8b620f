package modelmigration.state;

import modelmigration.phase.MigrationPhase;

import java.time.Instant;

/**
 * Mutable progress of a migration, stored in {@code migrations.status}.
 *
 * <p>{@code successTime} and {@code endTime} are null until set, and are set once.
 */
record MigrationStatusDoc(String id,
                          String modelUUID,
                          MigrationPhase phase,
                          Instant phaseChangedTime,
                          String statusMessage,
                          Instant startTime,
                          Instant successTime,
                          Instant endTime) {

    static MigrationStatusDoc initial(String id, String modelUUID, String statusMessage, Instant now) {
        return new MigrationStatusDoc(id, modelUUID, MigrationPhase.initial(), now, statusMessage, now, null, null);
    }

    MigrationStatusDoc withPhase(MigrationPhase next, Instant now) {
        Instant success = successTime == null && next == MigrationPhase.SUCCESS ? now : successTime;
        Instant end = endTime == null && next.isTerminal() ? now : endTime;
        return new MigrationStatusDoc(id, modelUUID, next, now, statusMessage, startTime, success, end);
    }

    MigrationStatusDoc withStatusMessage(String message) {
        return new MigrationStatusDoc(id, modelUUID, phase, phaseChangedTime, message, startTime, successTime, endTime);
    }
}
