package dev.pekelund.loyalty.submission;

/**
 * Caller-facing classification of a rejected submission.
 */
public enum RejectionReason {

    /** The receipt could not be read with confidence, or the reader refused it. */
    UNCLEAR,

    /** A deterministic check on the extracted fields failed. */
    INVALID_FORMAT,

    /** The receipt was already paid out. */
    DUPLICATE,

    /** The submitter already earned points for the most receipts allowed today. */
    DAILY_LIMIT_REACHED,

    /** Storage was unavailable; the same image may be submitted again. */
    TRANSIENT_UNAVAILABLE,

    /** The request itself was unusable, e.g. no image was attached. */
    BAD_REQUEST
}
