package dev.pekelund.loyalty.submission;

import dev.pekelund.loyalty.ledger.AwardOutcome;
import dev.pekelund.loyalty.receipts.ReceiptFields;

/**
 * Result of one receipt submission.
 *
 * @param accepted      whether points were awarded
 * @param award         the credited points; set only when accepted
 * @param receipt       the fields the decision was based on, when extraction got that far
 * @param reason        rejection classification; {@code null} when accepted
 * @param errorCode     machine-readable rejection code; {@code null} when accepted
 * @param message       user-facing explanation of the rejection
 * @param retryable     whether submitting the same image again may succeed
 */
public record SubmissionOutcome(
    boolean accepted,
    AwardOutcome award,
    ReceiptFields receipt,
    RejectionReason reason,
    String errorCode,
    String message,
    boolean retryable
) {

    public static SubmissionOutcome accepted(AwardOutcome award, ReceiptFields receipt) {
        return new SubmissionOutcome(true, award, receipt, null, null, null, false);
    }

    public static SubmissionOutcome rejected(RejectionReason reason, String errorCode, String message,
        boolean retryable, ReceiptFields receipt) {

        return new SubmissionOutcome(false, null, receipt, reason, errorCode, message, retryable);
    }
}
