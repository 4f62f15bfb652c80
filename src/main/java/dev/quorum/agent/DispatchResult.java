package dev.quorum.agent;

import dev.quorum.domain.enums.AgentRole;
import dev.quorum.domain.enums.AgentStatus;
import dev.quorum.domain.valueobject.Finding;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the fan-out produced: all findings from agents that answered, and one
 * status per dispatched agent.
 */
public record DispatchResult(List<Finding> findings, Map<AgentRole, AgentStatus> statuses) {

    public DispatchResult {
        findings = List.copyOf(findings);
        statuses = Collections.unmodifiableMap(statuses.isEmpty()
                ? new EnumMap<>(AgentRole.class)
                : new EnumMap<>(statuses));
    }

    public static DispatchResult empty() {
        return new DispatchResult(List.of(), Map.of());
    }

    public static DispatchResult of(Collection<AgentOutcome> outcomes) {
        List<Finding> findings = new ArrayList<>();
        Map<AgentRole, AgentStatus> statuses = new EnumMap<>(AgentRole.class);
        for (AgentOutcome outcome : outcomes) {
            findings.addAll(outcome.findings());
            statuses.put(outcome.role(), outcome.status());
        }
        return new DispatchResult(findings, statuses);
    }

    /**
     * True when at least one agent ran and none answered.
     */
    public boolean allFailed() {
        return !statuses.isEmpty() && statuses.values().stream().noneMatch(s -> s == AgentStatus.OK);
    }

    public AgentStatus statusOf(AgentRole role) {
        return statuses.get(role);
    }
}
