package dev.quorum.repository;

import dev.quorum.domain.entity.Review;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface ReviewRepository extends JpaRepository<Review, UUID> {
    boolean existsByDeliveryId(String deliveryId);

    Page<Review> findByRepoFullNameOrderByCreatedAtDesc(String repoFullName, Pageable pageable);

    Page<Review> findAllByOrderByCreatedAtDesc(Pageable pageable);

    @Query("""
            select count(r) as totalReviews, coalesce(sum(r.issuesFound), 0) as totalIssues
            from Review r
            where r.installation.id = :installationId and r.createdAt >= :since
            """)
    ReviewTotals totalsSince(@Param("installationId") UUID installationId, @Param("since") Instant since);

    interface ReviewTotals {
        long getTotalReviews();

        long getTotalIssues();
    }
}
