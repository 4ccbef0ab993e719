package com.logsentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top-level POJO for a multi-agent configuration file.
 *
 * <pre>
 * agents:
 *   - agentId: wifi-security
 *     name: WiFi Security Agent
 *     ...
 * </pre>
 *
 * @since 1.0.0
 */
public class AgentsFile {

    private List<AgentDefinition> agents = new ArrayList<>();

    /**
     * @return unmodifiable list of agent definitions
     */
    public List<AgentDefinition> getAgents() {
        return Collections.unmodifiableList(agents);
    }

    /**
     * Set the agents list (used by SnakeYAML during deserialization).
     *
     * @param agents the agent definitions
     */
    public void setAgents(List<AgentDefinition> agents) {
        this.agents = agents != null ? new ArrayList<>(agents) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "AgentsFile{agents=" + agents + '}';
    }
}
