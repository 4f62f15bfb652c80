package dev.quorum.service;

import dev.quorum.domain.entity.Installation;
import dev.quorum.domain.entity.Review;
import dev.quorum.dto.response.ReviewResponse;
import dev.quorum.dto.response.ReviewStatsResponse;
import dev.quorum.exception.InstallationNotFoundException;
import dev.quorum.exception.ReviewNotFoundException;
import dev.quorum.repository.InstallationRepository;
import dev.quorum.repository.ReviewRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/** Read-side service with read-only transactions. */
@Service
@Transactional(readOnly = true)
public class ReviewQueryService {

    private static final int MAX_PAGE_SIZE = 100;
    private static final int MAX_STATS_DAYS = 365;

    private final ReviewRepository reviews;
    private final InstallationRepository installations;

    public ReviewQueryService(ReviewRepository reviews, InstallationRepository installations) {
        this.reviews = reviews;
        this.installations = installations;
    }

    public ReviewResponse findById(UUID id) {
        return reviews.findById(id).map(this::toResponse).orElseThrow(() -> new ReviewNotFoundException(id));
    }

    public Page<ReviewResponse> findByRepository(String repo, int page, int size) {
        if (page < 0) throw new IllegalArgumentException("page must be >= 0");
        if (size < 1 || size > MAX_PAGE_SIZE) throw new IllegalArgumentException("size must be 1.." + MAX_PAGE_SIZE);
        PageRequest pageable = PageRequest.of(page, size);
        Page<Review> result = repo == null || repo.isBlank()
                ? reviews.findAllByOrderByCreatedAtDesc(pageable)
                : reviews.findByRepoFullNameOrderByCreatedAtDesc(repo, pageable);
        return result.map(this::toResponse);
    }

    public ReviewStatsResponse stats(long externalInstallationId, int days) {
        if (days < 1 || days > MAX_STATS_DAYS) {
            throw new IllegalArgumentException("days must be 1.." + MAX_STATS_DAYS);
        }
        Installation installation = installations.findByExternalInstallationId(externalInstallationId)
                .orElseThrow(() -> new InstallationNotFoundException(externalInstallationId));
        ReviewRepository.ReviewTotals totals = reviews.totalsSince(installation.getId(),
                Instant.now().minus(days, ChronoUnit.DAYS));
        long count = totals.getTotalReviews();
        long issues = totals.getTotalIssues();
        return new ReviewStatsResponse(externalInstallationId, days, count, issues,
                count == 0 ? 0.0 : (double) issues / count);
    }

    private ReviewResponse toResponse(Review r) {
        return new ReviewResponse(r.getId(), r.getInstallation().getExternalInstallationId(), r.getRepoFullName(),
                r.getPrNumber(), r.getPrTitle(), r.getCommitSha(), r.getStatus(), r.getFilesReviewed(),
                r.getIssuesFound(), r.getIssuesByType(), r.getReviewDurationMs(), r.getErrorMessage(),
                r.getCreatedAt(), r.getCompletedAt());
    }
}
