package dev.quorum.service;

import dev.quorum.domain.entity.Installation;
import dev.quorum.domain.entity.Review;
import dev.quorum.domain.valueobject.PullRequestRef;
import dev.quorum.repository.InstallationRepository;
import dev.quorum.repository.ReviewRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;

/**
 * Writes the one outcome row per run. Persistence here is best-effort: failures
 * are logged and swallowed so the pull request still gets its comment.
 *
 * <p>Each write is its own short transaction; nothing is held open while agents run.
 */
@Service
public class ReviewRecorder {

    private static final Logger log = LoggerFactory.getLogger(ReviewRecorder.class);

    private final ReviewRepository reviews;
    private final InstallationRepository installations;
    private final TransactionTemplate tx;

    public ReviewRecorder(ReviewRepository reviews, InstallationRepository installations,
                          PlatformTransactionManager transactionManager) {
        this.reviews = reviews;
        this.installations = installations;
        this.tx = new TransactionTemplate(transactionManager);
    }

    public boolean alreadyRecorded(String deliveryId) {
        try {
            return reviews.existsByDeliveryId(deliveryId);
        } catch (DataAccessException e) {
            log.error("Could not check delivery {} for duplicates: {}", deliveryId, e.getMessage());
            return false;
        }
    }

    /**
     * Inserts the PENDING row. The unique delivery_id is what settles two copies of
     * one delivery racing past {@link #alreadyRecorded}: the loser gets a duplicate.
     *
     * @return the opened row, a duplicate marker, or unrecorded when the store failed
     */
    public PendingReview open(UUID installationRowId, String deliveryId, PullRequestRef pr) {
        try {
            UUID id = tx.execute(status -> {
                Installation installation = installations.getReferenceById(installationRowId);
                Review review = Review.open(installation, deliveryId, pr.repoFullName(), pr.prNumber(),
                        pr.title(), pr.commitSha());
                reviews.save(review);
                return review.getId();
            });
            return id != null ? PendingReview.opened(id) : PendingReview.unrecorded();
        } catch (DataIntegrityViolationException e) {
            log.warn("Delivery {} is already being reviewed: {}", deliveryId, e.getMostSpecificCause().getMessage());
            return PendingReview.duplicate();
        } catch (DataAccessException | TransactionException e) {
            log.error("Could not record pending review for delivery {}: {}", deliveryId, e.getMessage());
            return PendingReview.unrecorded();
        }
    }

    /**
     * Single transition out of PENDING. A missing row or a second finalize is logged, not thrown.
     */
    public void finalizeReview(UUID reviewId, RunOutcome outcome) {
        try {
            tx.executeWithoutResult(status -> {
                Review review = reviews.findById(reviewId).orElse(null);
                if (review == null) {
                    log.error("Review {} vanished before it could be finalized", reviewId);
                    return;
                }
                if (outcome.completed()) {
                    review.complete(outcome.filesReviewed(), outcome.issuesByType(), outcome.duration());
                } else {
                    review.fail(outcome.filesReviewed(), outcome.errorMessage(), outcome.duration());
                }
                reviews.save(review);
            });
            log.info("Review {} finalized as {}", reviewId, outcome.completed() ? "COMPLETED" : "FAILED");
        } catch (DataAccessException | TransactionException e) {
            log.error("Could not finalize review {}: {}", reviewId, e.getMessage());
        } catch (IllegalStateException e) {
            log.error("Review {} not finalized: {}", reviewId, e.getMessage());
        }
    }
}
