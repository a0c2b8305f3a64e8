package dev.pekelund.loyalty.receipts.validation;

/**
 * Deterministic checks a receipt can fail, in the order they are applied.
 */
public enum ValidationError {

    ORDER_NUMBER_FORMAT("ORDER_NUMBER_FORMAT", "The order number on the receipt is not valid."),
    ORDER_NUMBER_RANGE("ORDER_NUMBER_RANGE", "The order number on the receipt is out of range."),
    DATE_FORMAT("DATE_FORMAT_INVALID", "The receipt date could not be read."),
    TIME_FORMAT("TIME_FORMAT_INVALID", "The receipt time could not be read."),
    TIME_RANGE("TIME_RANGE_INVALID", "The receipt time is not a valid time of day."),
    TOTAL_RANGE("TOTAL_INVALID", "The receipt total must be between $1.00 and $500.00."),
    TOO_OLD("RECEIPT_TOO_OLD", "This receipt is too old. Receipts must be scanned within 30 days.");

    private final String errorCode;
    private final String message;

    ValidationError(String errorCode, String message) {
        this.errorCode = errorCode;
        this.message = message;
    }

    public String errorCode() {
        return errorCode;
    }

    public String message() {
        return message;
    }
}
