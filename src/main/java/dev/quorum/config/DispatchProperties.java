package dev.quorum.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Timing budget for one run. callTimeout caps a single model call, runDeadline caps
 * the whole fan-out; retries back off from baseBackoff, doubling each attempt.
 */
@ConfigurationProperties(prefix = "quorum.dispatch")
public record DispatchProperties(Duration callTimeout, Duration runDeadline,
                                 Integer maxRetries, Duration baseBackoff) {
    public DispatchProperties {
        if (callTimeout == null) callTimeout = Duration.ofSeconds(30);
        if (runDeadline == null) runDeadline = Duration.ofSeconds(60);
        if (maxRetries == null || maxRetries < 0) maxRetries = 2;
        if (baseBackoff == null) baseBackoff = Duration.ofSeconds(1);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }
}
