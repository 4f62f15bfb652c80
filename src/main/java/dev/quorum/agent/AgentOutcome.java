package dev.quorum.agent;

import dev.quorum.domain.enums.AgentRole;
import dev.quorum.domain.enums.AgentStatus;
import dev.quorum.domain.valueobject.Finding;

import java.util.List;

/**
 * Terminal result of one agent within a run, after retries.
 */
public record AgentOutcome(AgentRole role, AgentStatus status, List<Finding> findings, String detail) {

    public AgentOutcome {
        findings = List.copyOf(findings);
    }

    public static AgentOutcome ok(AgentRole role, List<Finding> findings) {
        return new AgentOutcome(role, AgentStatus.OK, findings, null);
    }

    public static AgentOutcome timeout(AgentRole role) {
        return new AgentOutcome(role, AgentStatus.TIMEOUT, List.of(), "timed out");
    }

    public static AgentOutcome error(AgentRole role, String detail) {
        return new AgentOutcome(role, AgentStatus.ERROR, List.of(), detail);
    }
}
