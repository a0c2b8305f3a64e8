package dev.pekelund.loyalty.scanner.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.pekelund.loyalty.receipts.ReceiptFields;
import dev.pekelund.loyalty.submission.RejectionReason;
import dev.pekelund.loyalty.submission.SubmissionOutcome;
import java.math.BigDecimal;

/**
 * JSON body returned by {@code POST /submit-receipt}. Accepted submissions carry the award and the receipt
 * fields; rejected ones carry the reason, code, message and whether a retry may help.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubmissionResponse(
    boolean accepted,
    Long pointsAwarded,
    Long newBalance,
    Long newLifetimePoints,
    ReceiptView receipt,
    RejectionReason reason,
    String errorCode,
    String message,
    Boolean retryable
) {

    static SubmissionResponse from(SubmissionOutcome outcome) {
        if (outcome.accepted()) {
            return new SubmissionResponse(true, outcome.award().pointsAwarded(), outcome.award().newBalance(),
                outcome.award().newLifetimePoints(), ReceiptView.from(outcome.receipt()), null, null, null, null);
        }
        return rejected(outcome.reason(), outcome.errorCode(), outcome.message(), outcome.retryable());
    }

    static SubmissionResponse rejected(RejectionReason reason, String errorCode, String message, boolean retryable) {
        return new SubmissionResponse(false, null, null, null, null, reason, errorCode, message, retryable);
    }

    public record ReceiptView(String orderNumber, BigDecimal orderTotal, String orderDate, String orderTime) {

        static ReceiptView from(ReceiptFields fields) {
            return new ReceiptView(fields.orderNumber(), fields.orderTotal(), fields.orderDate(), fields.orderTime());
        }
    }
}
