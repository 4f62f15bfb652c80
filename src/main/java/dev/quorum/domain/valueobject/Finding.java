package dev.quorum.domain.valueobject;

import dev.quorum.domain.enums.AgentRole;
import dev.quorum.domain.enums.Severity;

import java.util.Locale;
import java.util.Objects;

/**
 * One issue reported by one agent. Transient: lives from response parsing until
 * the report is rendered. Lines are 1-based and inclusive.
 */
public record Finding(
        AgentRole agent,
        Severity severity,
        String file,
        int lineStart,
        int lineEnd,
        String category,
        String message,
        String suggestion
) {
    public Finding {
        Objects.requireNonNull(agent, "agent");
        Objects.requireNonNull(severity, "severity");
        if (file == null || file.isBlank()) throw new IllegalArgumentException("file required");
        file = file.trim().replace('\\', '/');
        if (lineStart < 1) lineStart = 1;
        if (lineEnd < lineStart) lineEnd = lineStart;
        category = category == null || category.isBlank()
                ? agent.key()
                : category.trim().toLowerCase(Locale.ROOT);
        message = message == null ? "" : message.trim();
        if (suggestion != null && suggestion.isBlank()) suggestion = null;
    }

    public static Finding at(AgentRole agent, Severity severity, String file, int line,
                             String category, String message) {
        return new Finding(agent, severity, file, line, line, category, message, null);
    }

    /**
     * Same file, same category and intersecting line ranges.
     */
    public boolean duplicates(Finding other) {
        return file.equals(other.file)
                && category.equals(other.category)
                && lineStart <= other.lineEnd
                && other.lineStart <= lineEnd;
    }

    public String lineDisplay() {
        return lineStart == lineEnd ? String.valueOf(lineStart) : lineStart + "-" + lineEnd;
    }
}
