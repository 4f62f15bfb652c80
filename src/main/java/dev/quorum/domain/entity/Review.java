package dev.quorum.domain.entity;

import dev.quorum.domain.enums.AgentRole;
import dev.quorum.domain.enums.ReviewStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome record of one pipeline run.
 *
 * Created PENDING when dispatch begins and finalized exactly once; any second
 * transition throws. deliveryId is unique so a redelivered webhook cannot open
 * a second run.
 */
@Entity
@Table(name = "reviews", indexes = {
        @Index(name = "idx_reviews_installation", columnList = "installation_id"),
        @Index(name = "idx_reviews_repo", columnList = "repo_full_name"),
        @Index(name = "idx_reviews_created", columnList = "created_at")
})
public class Review {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "installation_id", nullable = false)
    private Installation installation;

    @Column(name = "delivery_id", unique = true, nullable = false, length = 64)
    private String deliveryId;

    @Column(name = "repo_full_name", nullable = false)
    private String repoFullName;

    @Column(name = "pr_number", nullable = false)
    private Integer prNumber;

    @Column(name = "pr_title", length = 500)
    private String prTitle;

    @Column(name = "commit_sha", nullable = false, length = 64)
    private String commitSha;

    @Column(name = "files_reviewed", nullable = false)
    private int filesReviewed;

    @Column(name = "issues_found", nullable = false)
    private int issuesFound;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "issues_by_type", columnDefinition = "jsonb", nullable = false)
    private Map<String, Integer> issuesByType;

    @Column(name = "review_duration_ms")
    private Long reviewDurationMs;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReviewStatus status;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    protected Review() {
    }

    public static Review open(Installation installation, String deliveryId, String repoFullName,
                              int prNumber, String prTitle, String commitSha) {
        Review r = new Review();
        r.id = UUID.randomUUID();
        r.installation = installation;
        r.deliveryId = deliveryId;
        r.repoFullName = repoFullName;
        r.prNumber = prNumber;
        r.prTitle = prTitle != null && prTitle.length() > 500 ? prTitle.substring(0, 500) : prTitle;
        r.commitSha = commitSha;
        r.issuesByType = new LinkedHashMap<>();
        for (AgentRole role : AgentRole.values()) r.issuesByType.put(role.key(), 0);
        r.status = ReviewStatus.PENDING;
        r.createdAt = Instant.now();
        return r;
    }

    /**
     * issuesFound is derived from the per-type counts so the two never disagree.
     */
    public void complete(int filesReviewed, Map<String, Integer> issuesByType, Duration duration) {
        requirePending();
        this.filesReviewed = filesReviewed;
        this.issuesByType = new LinkedHashMap<>(issuesByType);
        this.issuesFound = issuesByType.values().stream().mapToInt(Integer::intValue).sum();
        this.reviewDurationMs = duration.toMillis();
        this.status = ReviewStatus.COMPLETED;
        this.completedAt = Instant.now();
    }

    public void fail(int filesReviewed, String error, Duration duration) {
        requirePending();
        this.filesReviewed = filesReviewed;
        this.errorMessage = error == null || error.isBlank() ? "Review failed" : truncate(error);
        this.reviewDurationMs = duration.toMillis();
        this.status = ReviewStatus.FAILED;
        this.completedAt = Instant.now();
    }

    private void requirePending() {
        if (status.isTerminal())
            throw new IllegalStateException("Review %s already %s".formatted(id, status));
    }

    private static String truncate(String s) {
        return s.length() > 2000 ? s.substring(0, 2000) : s;
    }

    public UUID getId() {
        return id;
    }

    public Installation getInstallation() {
        return installation;
    }

    public String getDeliveryId() {
        return deliveryId;
    }

    public String getRepoFullName() {
        return repoFullName;
    }

    public Integer getPrNumber() {
        return prNumber;
    }

    public String getPrTitle() {
        return prTitle;
    }

    public String getCommitSha() {
        return commitSha;
    }

    public int getFilesReviewed() {
        return filesReviewed;
    }

    public int getIssuesFound() {
        return issuesFound;
    }

    public Map<String, Integer> getIssuesByType() {
        return Map.copyOf(issuesByType);
    }

    public Long getReviewDurationMs() {
        return reviewDurationMs;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
