package dev.pekelund.loyalty.ledger;

/**
 * The award transaction did not commit. Neither the ledger entry nor the balance change was applied.
 */
public class AwardFailedException extends ReceiptLedgerException {

    private final String errorCode;

    public AwardFailedException(String message, Throwable cause) {
        this("SERVER_AWARD_FAILED", message, cause);
    }

    public AwardFailedException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * @return {@code false} when resubmitting cannot succeed, e.g. the submitter has no account
     */
    public boolean isRetryable() {
        return !SubmitterNotFoundException.ERROR_CODE.equals(errorCode);
    }
}
