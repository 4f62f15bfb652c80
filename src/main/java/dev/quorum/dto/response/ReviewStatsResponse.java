package dev.quorum.dto.response;

public record ReviewStatsResponse(long installationId, int days, long totalReviews,
                                  long totalIssuesFound, double avgIssuesPerReview) {}
