package dev.pekelund.loyalty.ledger;

/**
 * The submitter has no points account to credit.
 */
public class SubmitterNotFoundException extends AwardFailedException {

    static final String ERROR_CODE = "SUBMITTER_NOT_FOUND";

    public SubmitterNotFoundException(String submitterId) {
        super(ERROR_CODE, "No points account exists for submitter " + submitterId, null);
    }
}
