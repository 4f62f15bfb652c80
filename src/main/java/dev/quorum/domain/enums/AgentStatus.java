package dev.quorum.domain.enums;

/**
 * Terminal status of one agent within a run.
 */
public enum AgentStatus {
    OK, TIMEOUT, ERROR
}
