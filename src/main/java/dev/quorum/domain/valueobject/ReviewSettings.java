package dev.quorum.domain.valueobject;

import dev.quorum.domain.enums.AgentRole;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-installation switches: one flag per agent role plus autoApprove.
 * Always exactly these five keys when stored; missing agent keys mean enabled.
 */
public record ReviewSettings(boolean style, boolean security, boolean performance,
                             boolean logic, boolean autoApprove) {

    public static final String AUTO_APPROVE = "autoApprove";

    public static ReviewSettings defaults() {
        return new ReviewSettings(true, true, true, true, false);
    }

    /**
     * Lenient read of a stored map. Unknown keys are ignored, missing ones defaulted.
     */
    public static ReviewSettings fromMap(Map<String, Boolean> raw) {
        Map<String, Boolean> m = raw == null ? Map.of() : raw;
        return new ReviewSettings(
                flag(m, AgentRole.STYLE.key(), true),
                flag(m, AgentRole.SECURITY.key(), true),
                flag(m, AgentRole.PERFORMANCE.key(), true),
                flag(m, AgentRole.LOGIC.key(), true),
                flag(m, AUTO_APPROVE, false));
    }

    /**
     * Strict read of user input: rejects keys outside the known five.
     */
    public static ReviewSettings fromUserInput(Map<String, Boolean> raw) {
        if (raw != null) {
            Set<String> allowed = allowedKeys();
            List<String> unknown = raw.keySet().stream().filter(k -> !allowed.contains(k)).sorted().toList();
            if (!unknown.isEmpty()) {
                throw new IllegalArgumentException("Unknown settings keys: " + unknown);
            }
        }
        return fromMap(raw);
    }

    public boolean isEnabled(AgentRole role) {
        return switch (role) {
            case STYLE -> style;
            case SECURITY -> security;
            case PERFORMANCE -> performance;
            case LOGIC -> logic;
        };
    }

    /** Enabled roles in priority order. */
    public Set<AgentRole> enabledRoles() {
        Set<AgentRole> roles = EnumSet.noneOf(AgentRole.class);
        for (AgentRole role : AgentRole.values()) {
            if (isEnabled(role)) roles.add(role);
        }
        return roles;
    }

    public Map<String, Boolean> toMap() {
        Map<String, Boolean> m = new LinkedHashMap<>();
        for (AgentRole role : AgentRole.values()) {
            m.put(role.key(), isEnabled(role));
        }
        m.put(AUTO_APPROVE, autoApprove);
        return m;
    }

    private static Set<String> allowedKeys() {
        Set<String> keys = new java.util.HashSet<>();
        Arrays.stream(AgentRole.values()).map(AgentRole::key).forEach(keys::add);
        keys.add(AUTO_APPROVE);
        return keys;
    }

    private static boolean flag(Map<String, Boolean> m, String key, boolean fallback) {
        Boolean v = m.get(key);
        return v != null ? v : fallback;
    }
}
