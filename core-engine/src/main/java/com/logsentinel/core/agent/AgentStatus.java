package com.logsentinel.core.agent;

/**
 * Lifecycle states of an agent.
 *
 * <pre>
 * initialized -&gt; active &lt;-&gt; analyzing -&gt; inactive
 *                   \           /
 *                    -&gt; error &lt;-
 * </pre>
 * <p>
 * {@code error} is not terminal: the agent stays schedulable and the next
 * cycle runs normally.
 * </p>
 *
 * @since 1.0.0
 */
public enum AgentStatus {

    INITIALIZED("initialized"),
    ACTIVE("active"),
    ANALYZING("analyzing"),
    INACTIVE("inactive"),
    ERROR("error");

    private final String value;

    AgentStatus(String value) {
        this.value = value;
    }

    /** Name written to the status store. */
    public String getValue() {
        return value;
    }

    /**
     * @return {@code true} if the scheduler may start a cycle in this state
     */
    public boolean isSchedulable() {
        return this == ACTIVE || this == ERROR;
    }
}
