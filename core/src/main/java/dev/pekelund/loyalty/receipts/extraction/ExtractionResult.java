package dev.pekelund.loyalty.receipts.extraction;

import dev.pekelund.loyalty.receipts.ReceiptFields;

/**
 * Outcome of one extraction call: either the four receipt fields or the reason they could not be read.
 *
 * @param fields the extracted fields; {@code null} on failure
 * @param error  the failure; {@code null} on success
 * @param detail free-form diagnostic detail for logs
 */
public record ExtractionResult(ReceiptFields fields, ExtractionError error, String detail) {

    public ExtractionResult {
        if ((fields == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of fields or error must be set");
        }
    }

    public static ExtractionResult success(ReceiptFields fields) {
        return new ExtractionResult(fields, null, null);
    }

    public static ExtractionResult failure(ExtractionError error, String detail) {
        return new ExtractionResult(null, error, detail);
    }

    public boolean isSuccess() {
        return fields != null;
    }
}
