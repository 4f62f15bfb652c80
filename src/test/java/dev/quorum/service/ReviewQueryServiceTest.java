package dev.quorum.service;

import dev.quorum.domain.entity.Installation;
import dev.quorum.domain.entity.Review;
import dev.quorum.domain.enums.OwnerType;
import dev.quorum.dto.response.ReviewResponse;
import dev.quorum.dto.response.ReviewStatsResponse;
import dev.quorum.exception.InstallationNotFoundException;
import dev.quorum.exception.ReviewNotFoundException;
import dev.quorum.repository.InstallationRepository;
import dev.quorum.repository.ReviewRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReviewQueryServiceTest {

    @Mock private ReviewRepository reviews;
    @Mock private InstallationRepository installations;

    @InjectMocks
    private ReviewQueryService service;

    private final Installation installation = Installation.register(42L, "octo", OwnerType.USER);

    @Test
    @DisplayName("maps a review to its response")
    void findById() {
        Review review = Review.open(installation, "d-1", "octo/repo", 7, "Add login", "abc1234def");
        review.complete(1, Map.of("security", 1, "logic", 0, "performance", 0, "style", 0), Duration.ofMillis(800));
        when(reviews.findById(review.getId())).thenReturn(Optional.of(review));

        ReviewResponse response = service.findById(review.getId());

        assertThat(response.installationId()).isEqualTo(42L);
        assertThat(response.issuesFound()).isEqualTo(1);
        assertThat(response.issuesByType()).containsEntry("security", 1);
    }

    @Test
    @DisplayName("an unknown review id is not found")
    void notFound() {
        UUID id = UUID.randomUUID();
        when(reviews.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.findById(id)).isInstanceOf(ReviewNotFoundException.class);
    }

    @Test
    @DisplayName("filters by repository when one is given")
    void byRepository() {
        Review review = Review.open(installation, "d-1", "octo/repo", 7, "Add login", "abc1234def");
        when(reviews.findByRepoFullNameOrderByCreatedAtDesc(eq("octo/repo"), any()))
                .thenReturn(new PageImpl<>(List.of(review), PageRequest.of(0, 20), 1));

        Page<ReviewResponse> page = service.findByRepository("octo/repo", 0, 20);

        assertThat(page.getContent()).extracting(ReviewResponse::repository).containsExactly("octo/repo");
    }

    @Test
    @DisplayName("rejects out-of-range paging and windows")
    void rejectsBadRanges() {
        assertThatThrownBy(() -> service.findByRepository(null, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.findByRepository(null, 0, 101)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.stats(42L, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.stats(42L, 366)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("stats average issues per review in the window")
    void stats() {
        when(installations.findByExternalInstallationId(42L)).thenReturn(Optional.of(installation));
        when(reviews.totalsSince(eq(installation.getId()), any(Instant.class))).thenReturn(totals(4, 10));

        ReviewStatsResponse stats = service.stats(42L, 30);

        assertThat(stats.totalReviews()).isEqualTo(4);
        assertThat(stats.totalIssuesFound()).isEqualTo(10);
        assertThat(stats.avgIssuesPerReview()).isEqualTo(2.5);
    }

    @Test
    @DisplayName("no reviews yields a zero average, not a division error")
    void statsEmpty() {
        when(installations.findByExternalInstallationId(42L)).thenReturn(Optional.of(installation));
        when(reviews.totalsSince(eq(installation.getId()), any(Instant.class))).thenReturn(totals(0, 0));

        assertThat(service.stats(42L, 7).avgIssuesPerReview()).isZero();
    }

    @Test
    @DisplayName("stats for an unknown installation are not found")
    void statsUnknown() {
        when(installations.findByExternalInstallationId(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.stats(9L, 30)).isInstanceOf(InstallationNotFoundException.class);
    }

    private static ReviewRepository.ReviewTotals totals(long reviews, long issues) {
        return new ReviewRepository.ReviewTotals() {
            @Override
            public long getTotalReviews() {
                return reviews;
            }

            @Override
            public long getTotalIssues() {
                return issues;
            }
        };
    }
}
