package dev.quorum.service;

import java.time.Duration;
import java.util.Map;

/**
 * What a finished run writes onto its Review row.
 */
public record RunOutcome(boolean completed, int filesReviewed, Map<String, Integer> issuesByType,
                         String errorMessage, Duration duration) {

    public static RunOutcome completed(int filesReviewed, Map<String, Integer> issuesByType, Duration duration) {
        return new RunOutcome(true, filesReviewed, Map.copyOf(issuesByType), null, duration);
    }

    public static RunOutcome failed(int filesReviewed, String errorMessage, Duration duration) {
        return new RunOutcome(false, filesReviewed, Map.of(), errorMessage, duration);
    }
}
