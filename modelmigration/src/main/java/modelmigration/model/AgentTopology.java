package modelmigration.model;

import modelmigration.names.Tag;
import modelmigration.phase.MigrationPhase;

import java.util.Set;

/**
 * Knows which agents of a model must acknowledge a migration phase.
 */
@FunctionalInterface
public interface AgentTopology {

    /**
     * @param modelUUID the migrating model
     * @param phase the phase being acknowledged
     * @return the agents expected to report; never null
     */
    Set<Tag> expectedAgents(String modelUUID, MigrationPhase phase);
}
