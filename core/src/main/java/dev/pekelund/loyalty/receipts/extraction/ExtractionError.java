package dev.pekelund.loyalty.receipts.extraction;

/**
 * Reasons a single extraction call can fail.
 */
public enum ExtractionError {

    NOT_THIS_VENDOR("NOT_THIS_VENDOR", "This receipt is not from our restaurant.", true),
    OBSTRUCTED("OBSTRUCTED", "Some numbers or text on the receipt are covered. Please retake the photo.", true),
    ILLEGIBLE("ILLEGIBLE", "The receipt could not be read clearly. Please retake the photo.", true),
    NO_VALID_ORDER_NUMBER("ORDER_NUMBER_INVALID", "No valid order number was found. Please retake the photo.", true),
    MALFORMED("AI_JSON_EXTRACT_FAILED", "The receipt could not be read clearly. Please retake the photo.", true),
    TIMEOUT("EXTRACTION_TIMEOUT", "Reading the receipt took too long. Please try again.", false),
    SERVICE_ERROR("SERVER_EXTRACTION_FAILED", "The receipt reader is unavailable right now. Please try again.", false);

    private final String errorCode;
    private final String message;
    private final boolean semantic;

    ExtractionError(String errorCode, String message, boolean semantic) {
        this.errorCode = errorCode;
        this.message = message;
        this.semantic = semantic;
    }

    public String errorCode() {
        return errorCode;
    }

    public String message() {
        return message;
    }

    /**
     * @return {@code true} when the failure describes the receipt itself rather than the call to read it
     */
    public boolean isSemantic() {
        return semantic;
    }
}
