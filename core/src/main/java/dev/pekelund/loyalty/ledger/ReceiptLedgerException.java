package dev.pekelund.loyalty.ledger;

/**
 * Base type for failures talking to the receipt ledger store.
 */
public class ReceiptLedgerException extends RuntimeException {

    public ReceiptLedgerException(String message) {
        super(message);
    }

    public ReceiptLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
