/**
 * Agents and their scheduling.
 *
 * <ul>
 * <li>{@link com.logsentinel.core.agent.Agent}: the lifecycle contract,
 * implemented by the rule, ML and hybrid strategies.</li>
 * <li>{@link com.logsentinel.core.agent.CycleRunner}: the shared
 * fetch/extract/classify/persist cycle and status publication.</li>
 * <li>{@link com.logsentinel.core.agent.AgentRegistry}: registration and the
 * single tick that dispatches due agents to a worker pool.</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.agent;
