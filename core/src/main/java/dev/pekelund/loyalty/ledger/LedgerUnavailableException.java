package dev.pekelund.loyalty.ledger;

/**
 * The ledger could not be queried. The duplicate check did not run and the submission may be retried.
 */
public class LedgerUnavailableException extends ReceiptLedgerException {

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
