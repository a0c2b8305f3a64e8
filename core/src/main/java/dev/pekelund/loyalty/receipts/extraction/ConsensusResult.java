package dev.pekelund.loyalty.receipts.extraction;

import dev.pekelund.loyalty.receipts.ReceiptFields;

/**
 * Outcome of the two-sample agreement check.
 *
 * @param fields        the agreed fields; {@code null} unless both samples agreed
 * @param mismatch      {@code true} when both samples succeeded but disagreed on a field
 * @param upstreamError the extraction failure surfaced from one of the samples
 */
public record ConsensusResult(ReceiptFields fields, boolean mismatch, ExtractionError upstreamError) {

    public static ConsensusResult agreed(ReceiptFields fields) {
        return new ConsensusResult(fields, false, null);
    }

    public static ConsensusResult mismatched() {
        return new ConsensusResult(null, true, null);
    }

    public static ConsensusResult upstream(ExtractionError error) {
        return new ConsensusResult(null, false, error);
    }

    public boolean isAgreed() {
        return fields != null;
    }
}
