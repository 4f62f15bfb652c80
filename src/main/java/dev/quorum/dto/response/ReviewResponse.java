package dev.quorum.dto.response;

import dev.quorum.domain.enums.ReviewStatus;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record ReviewResponse(
        UUID id, long installationId, String repository, int pullRequestNumber, String pullRequestTitle,
        String commitSha, ReviewStatus status, int filesReviewed, int issuesFound,
        Map<String, Integer> issuesByType, Long reviewDurationMs, String errorMessage,
        Instant createdAt, Instant completedAt
) {}
