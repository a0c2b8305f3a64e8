package dev.pekelund.loyalty.ledger;

/**
 * Points credited for an accepted receipt.
 *
 * @param pointsAwarded     points added by this receipt
 * @param newBalance        the submitter's balance after the credit
 * @param newLifetimePoints the submitter's lifetime points after the credit
 * @param ledgerEntryId     identifier of the ledger entry written for the receipt
 */
public record AwardOutcome(long pointsAwarded, long newBalance, long newLifetimePoints, String ledgerEntryId) {
}
