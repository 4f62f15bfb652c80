package dev.quorum.service;

import java.util.UUID;

/**
 * Terminal answer for one delivery. Pipeline failures are still PROCESSED: they
 * are recorded on the Review, not surfaced to GitHub.
 */
public record WebhookOutcome(Disposition disposition, String reason, UUID reviewId) {

    public enum Disposition {
        PROCESSED(200), IGNORED(200), SIGNATURE_INVALID(401), MALFORMED_PAYLOAD(422);

        private final int httpStatus;

        Disposition(int httpStatus) {
            this.httpStatus = httpStatus;
        }

        public int httpStatus() {
            return httpStatus;
        }
    }

    public static WebhookOutcome processed(UUID reviewId) {
        return new WebhookOutcome(Disposition.PROCESSED, null, reviewId);
    }

    public static WebhookOutcome ignored(String reason) {
        return new WebhookOutcome(Disposition.IGNORED, reason, null);
    }

    public static WebhookOutcome signatureInvalid() {
        return new WebhookOutcome(Disposition.SIGNATURE_INVALID, "invalid signature", null);
    }

    public static WebhookOutcome malformed(String reason) {
        return new WebhookOutcome(Disposition.MALFORMED_PAYLOAD, reason, null);
    }
}
