package dev.quorum.domain.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Finding severity, declared from most to least severe.
 */
public enum Severity {
    HIGH, MEDIUM, LOW, INFO;

    /**
     * Lenient parse of model output. "critical" folds into HIGH; anything
     * unrecognised is empty so the caller can drop the item.
     */
    public static Optional<Severity> parse(String raw) {
        if (raw == null) return Optional.empty();
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "critical", "high" -> Optional.of(HIGH);
            case "medium" -> Optional.of(MEDIUM);
            case "low" -> Optional.of(LOW);
            case "info" -> Optional.of(INFO);
            default -> Optional.empty();
        };
    }

    public boolean isAtLeast(Severity other) {
        return this.ordinal() <= other.ordinal();
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
