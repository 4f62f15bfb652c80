package dev.quorum.domain.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * The four analysis roles. Declaration order is the dedup tie-break priority:
 * when two duplicates share a severity, the one from the earlier role is kept.
 */
public enum AgentRole {
    SECURITY, LOGIC, PERFORMANCE, STYLE;

    /** Lowercase name used in settings, issuesByType and JSON. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<AgentRole> fromKey(String key) {
        if (key == null) return Optional.empty();
        for (AgentRole role : values()) {
            if (role.key().equals(key)) return Optional.of(role);
        }
        return Optional.empty();
    }
}
