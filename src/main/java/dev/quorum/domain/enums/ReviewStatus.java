package dev.quorum.domain.enums;

/**
 * Lifecycle: PENDING → COMPLETED | FAILED. Terminal states are never reopened.
 */
public enum ReviewStatus {
    PENDING, COMPLETED, FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
