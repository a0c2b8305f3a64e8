package dev.pekelund.loyalty.ledger;

import dev.pekelund.loyalty.receipts.ValidatedReceipt;

/**
 * Ledger entry attributes used to recognise a receipt that has already been paid out.
 */
public enum LedgerField {

    ORDER_NUMBER("orderNumber") {
        @Override
        public Object valueFrom(ValidatedReceipt receipt) {
            return (long) receipt.orderNumber();
        }
    },
    ORDER_DATE("orderDate") {
        @Override
        public Object valueFrom(ValidatedReceipt receipt) {
            return receipt.orderDate();
        }
    },
    ORDER_TIME("orderTime") {
        @Override
        public Object valueFrom(ValidatedReceipt receipt) {
            return receipt.orderTime();
        }
    };

    private final String documentField;

    LedgerField(String documentField) {
        this.documentField = documentField;
    }

    /**
     * @return the attribute name as stored in the ledger
     */
    public String documentField() {
        return documentField;
    }

    /**
     * @return the value stored for this attribute; order numbers are stored as {@code long} so that
     * {@code 042} and {@code 42} are the same order
     */
    public abstract Object valueFrom(ValidatedReceipt receipt);
}
