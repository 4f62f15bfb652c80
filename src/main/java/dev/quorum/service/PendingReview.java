package dev.quorum.service;

import java.util.Optional;
import java.util.UUID;

/**
 * Result of inserting the PENDING row. A run goes ahead without a row when the
 * store is unavailable, but not when another copy of the delivery already owns it.
 */
public record PendingReview(UUID reviewId, boolean duplicateDelivery) {

    public static PendingReview opened(UUID reviewId) {
        return new PendingReview(reviewId, false);
    }

    public static PendingReview unrecorded() {
        return new PendingReview(null, false);
    }

    public static PendingReview duplicate() {
        return new PendingReview(null, true);
    }

    public Optional<UUID> id() {
        return Optional.ofNullable(reviewId);
    }
}
