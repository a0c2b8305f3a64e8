package dev.pekelund.loyalty.ledger;

import java.time.LocalDate;

/**
 * Persistence for accepted receipts and the points balances they credit.
 */
public interface ReceiptLedgerStore {

    /**
     * Looks for any ledger entry whose two given attributes both equal the given values.
     *
     * @throws LedgerUnavailableException when the store cannot be queried
     */
    boolean existsMatching(LedgerField first, Object firstValue, LedgerField second, Object secondValue);

    /**
     * Counts the ledger entries written for the submitter on the given day, in the store's time zone.
     *
     * @throws LedgerUnavailableException when the store cannot be queried
     */
    long countAcceptedOn(String submitterId, LocalDate day);

    /**
     * Writes the entry and credits {@link LedgerEntry#pointsAwarded()} to the submitter's balance as one
     * atomic unit, adding the same amount to the submitter's lifetime points. Either all effects are applied
     * or none is.
     *
     * @return the stored entry, with its identifier and creation time assigned, and the submitter's new balance
     * @throws AwardFailedException when the transaction did not commit
     */
    RecordedAward recordAward(LedgerEntry entry);

    /**
     * @param entry             the stored ledger entry
     * @param newBalance        the submitter's balance after the credit
     * @param newLifetimePoints points the submitter has earned in total, spent or not, after the credit
     */
    record RecordedAward(LedgerEntry entry, long newBalance, long newLifetimePoints) {
    }
}
