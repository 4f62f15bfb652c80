package dev.quorum.agent;

import dev.quorum.domain.enums.AgentRole;

/**
 * One row of the agent table: a role and the instructions it sends ahead of the diff.
 */
public record AgentDefinition(AgentRole role, String instructions) {
    public AgentDefinition {
        if (role == null) throw new IllegalArgumentException("role required");
        if (instructions == null || instructions.isBlank()) throw new IllegalArgumentException("instructions required");
    }
}
