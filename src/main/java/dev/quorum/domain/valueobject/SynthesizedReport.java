package dev.quorum.domain.valueobject;

import dev.quorum.domain.enums.AgentRole;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deduplicated, ordered and capped findings of one run.
 *
 * @param findings     retained findings, already in report order
 * @param issuesByType counts over the full deduplicated set, one entry per role
 * @param omitted      deduplicated findings dropped by the cap
 */
public record SynthesizedReport(List<Finding> findings, Map<AgentRole, Integer> issuesByType, int omitted) {

    public SynthesizedReport {
        findings = List.copyOf(findings);
        EnumMap<AgentRole, Integer> counts = new EnumMap<>(AgentRole.class);
        for (AgentRole role : AgentRole.values()) {
            counts.put(role, issuesByType.getOrDefault(role, 0));
        }
        issuesByType = Collections.unmodifiableMap(counts);
    }

    public int issuesFound() {
        return issuesByType.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean isEmpty() {
        return issuesFound() == 0;
    }

    public List<Finding> findingsBy(AgentRole role) {
        return findings.stream().filter(f -> f.agent() == role).toList();
    }

    /** issuesByType keyed by role name, as stored. */
    public Map<String, Integer> issuesByTypeKeys() {
        Map<String, Integer> m = new LinkedHashMap<>();
        issuesByType.forEach((role, count) -> m.put(role.key(), count));
        return m;
    }
}
