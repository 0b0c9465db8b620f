package modelmigration.report;

import modelmigration.names.Tag;
import modelmigration.phase.MigrationPhase;

import java.util.Set;

/**
 * Agents partitioned by how they acknowledged a migration phase.
 *
 * <p>The three sets are disjoint. {@code unknown} holds expected agents that
 * have not reported; {@code succeeded} and {@code failed} hold every agent
 * that has, expected or not.
 */
public record MinionReports(String migrationId,
                            MigrationPhase phase,
                            Set<Tag> succeeded,
                            Set<Tag> failed,
                            Set<Tag> unknown) {

    public MinionReports {
        succeeded = Set.copyOf(succeeded);
        failed = Set.copyOf(failed);
        unknown = Set.copyOf(unknown);
    }

    /** True once no expected agent is missing. */
    public boolean isComplete() {
        return unknown.isEmpty();
    }

    /** True if at least one agent reported failure. */
    public boolean anyFailed() {
        return !failed.isEmpty();
    }

    public int reportedCount() {
        return succeeded.size() + failed.size();
    }
}
