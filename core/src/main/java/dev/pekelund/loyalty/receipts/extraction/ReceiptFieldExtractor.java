package dev.pekelund.loyalty.receipts.extraction;

/**
 * Reads the receipt fields out of a photo with a single call to an external vision model.
 * Implementations hold no state and never retry.
 */
public interface ReceiptFieldExtractor {

    /**
     * @param imageBytes raw image bytes in any common raster format
     * @return the extracted fields, or the reason they could not be read; never {@code null}
     */
    ExtractionResult extract(byte[] imageBytes);
}
