package modelmigration.model;

import modelmigration.names.Tag;
import modelmigration.phase.MigrationPhase;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link AgentTopology} backed by explicit registration.
 *
 * <p>Machine and unit agents are registered per model as they are
 * provisioned; every registered agent is expected to report every phase.
 */
public final class RegisteredAgents implements AgentTopology {

    private final Map<String, Set<Tag>> agentsByModel = new ConcurrentHashMap<>();

    /**
     * Registers an agent.
     *
     * @throws IllegalArgumentException if the tag is not a valid machine or unit tag
     */
    public void register(String modelUUID, Tag agent) {
        if (agent.kind() != Tag.Kind.MACHINE && agent.kind() != Tag.Kind.UNIT) {
            throw new IllegalArgumentException(agent + " is not a machine or unit agent");
        }
        if (!agent.isValid()) {
            throw new IllegalArgumentException(agent + " is not a valid agent tag");
        }
        agentsByModel.computeIfAbsent(modelUUID, m -> ConcurrentHashMap.newKeySet()).add(agent);
    }

    public void unregister(String modelUUID, Tag agent) {
        Set<Tag> agents = agentsByModel.get(modelUUID);
        if (agents != null) {
            agents.remove(agent);
        }
    }

    @Override
    public Set<Tag> expectedAgents(String modelUUID, MigrationPhase phase) {
        return Set.copyOf(agentsByModel.getOrDefault(modelUUID, Set.of()));
    }
}
