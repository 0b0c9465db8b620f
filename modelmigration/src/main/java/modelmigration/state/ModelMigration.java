package modelmigration.state;

import modelmigration.exceptions.IllegalPhaseTransitionException;
import modelmigration.exceptions.MigrationException;
import modelmigration.exceptions.MigrationRaceException;
import modelmigration.exceptions.NotFoundException;
import modelmigration.exceptions.NotValidException;
import modelmigration.exceptions.ReportConflictException;
import modelmigration.names.Tag;
import modelmigration.phase.MigrationPhase;
import modelmigration.report.MinionReports;
import modelmigration.watcher.NotifyWatcher;

import java.time.Instant;
import java.util.Optional;

/**
 * Handle on one migration attempt of a model.
 *
 * <p>A handle caches the mutable fields it last read or wrote. Other handles
 * on the same migration do not see its writes until they {@link #refresh()}.
 * Identity ({@link #id()}, {@link #modelUUID()}, {@link #attempt()}) never
 * changes.
 */
public interface ModelMigration {

    /** {@code <modelUUID>:<attempt>}. */
    String id();

    String modelUUID();

    /** Zero-based attempt number of this migration for its model. */
    int attempt();

    Tag initiatedBy();

    MigrationPhase phase();

    /**
     * Moves the migration to {@code next}.
     *
     * <p>Reaching SUCCESS records the success time; reaching a terminal phase
     * records the end time and releases the model. The handle is only updated
     * if the write commits.
     *
     * @throws IllegalPhaseTransitionException if {@code next} is not reachable from the cached phase
     * @throws MigrationRaceException if the stored phase no longer matches the cached one
     */
    void setPhase(MigrationPhase next) throws MigrationException;

    String statusMessage();

    /**
     * @throws NotFoundException if the migration has been removed
     */
    void setStatusMessage(String message) throws NotFoundException;

    Instant startTime();

    Instant phaseChangedTime();

    /** When the migration reached SUCCESS, if it has. */
    Optional<Instant> successTime();

    /** When the migration reached a terminal phase, if it has. */
    Optional<Instant> endTime();

    /**
     * @throws NotFoundException if the migration has been removed
     */
    TargetInfo targetInfo() throws NotFoundException;

    /**
     * Records an agent's acknowledgement of a phase. Any phase is accepted,
     * whatever the migration's current phase.
     *
     * @throws NotValidException if {@code agent} is not a machine or unit tag
     * @throws NotFoundException if the migration has been removed
     * @throws ReportConflictException if the agent already reported a different outcome for that phase
     * @throws MigrationRaceException if the report could not be written
     */
    void minionReport(Tag agent, MigrationPhase phase, boolean success) throws MigrationException;

    MinionReports getMinionReports(MigrationPhase phase);

    /** Reports for the cached current phase. */
    MinionReports getMinionReports();

    /**
     * Watches reports for the phase the migration is in now.
     */
    NotifyWatcher watchMinionReports();

    /**
     * Re-reads the mutable fields from the store.
     *
     * @throws NotFoundException if the migration has been removed
     */
    void refresh() throws NotFoundException;
}
