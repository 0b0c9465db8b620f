package modelmigration.state;

/**
 * Immutable identity of a migration, stored in {@code migrations}.
 */
record MigrationDoc(String id, String modelUUID, int attempt, String initiatedBy) {
}
