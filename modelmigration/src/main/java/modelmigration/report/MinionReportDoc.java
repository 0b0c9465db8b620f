package modelmigration.report;

import modelmigration.phase.MigrationPhase;

/**
 * Stored acknowledgement of one agent for one phase of one migration.
 *
 * @param migrationId the migration reported on
 * @param phase the phase reported on
 * @param agent the reporting agent's tag, as a string
 * @param success whether the agent completed the phase
 */
public record MinionReportDoc(String migrationId, MigrationPhase phase, String agent, boolean success) {
}
