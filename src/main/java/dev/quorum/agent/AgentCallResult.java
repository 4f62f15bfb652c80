package dev.quorum.agent;

import java.time.Duration;

/**
 * Outcome of one model call, tagged so the retry loop can branch on it
 * without exceptions.
 *
 * @param text       raw model output, present only for {@link Kind#OK}
 * @param reason     failure description, never contains the credential
 * @param retryAfter provider back-off hint for {@link Kind#TRANSIENT}, may be null
 */
public record AgentCallResult(Kind kind, String text, String reason, Duration retryAfter) {

    public enum Kind { OK, TRANSIENT, PERMANENT, TIMEOUT }

    public static AgentCallResult ok(String text) {
        return new AgentCallResult(Kind.OK, text == null ? "" : text, null, null);
    }

    public static AgentCallResult transientFailure(String reason, Duration retryAfter) {
        return new AgentCallResult(Kind.TRANSIENT, null, reason, retryAfter);
    }

    public static AgentCallResult permanent(String reason) {
        return new AgentCallResult(Kind.PERMANENT, null, reason, null);
    }

    public static AgentCallResult timeout() {
        return new AgentCallResult(Kind.TIMEOUT, null, "call timed out", null);
    }

    public boolean isRetryable() {
        return kind == Kind.TRANSIENT || kind == Kind.TIMEOUT;
    }
}
