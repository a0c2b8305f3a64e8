package dev.pekelund.loyalty.ledger;

import dev.pekelund.loyalty.receipts.ValidatedReceipt;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects re-submitted receipts. Any two of order number, date and time matching an accepted receipt is
 * enough to call the submission a duplicate, so one misread field cannot let a re-submission through.
 */
public class DuplicateLedger {

    private static final Logger LOGGER = LoggerFactory.getLogger(DuplicateLedger.class);

    static final List<LedgerField[]> MATCHING_PAIRS = List.of(
        new LedgerField[] {LedgerField.ORDER_NUMBER, LedgerField.ORDER_DATE},
        new LedgerField[] {LedgerField.ORDER_NUMBER, LedgerField.ORDER_TIME},
        new LedgerField[] {LedgerField.ORDER_DATE, LedgerField.ORDER_TIME});

    private final ReceiptLedgerStore store;

    public DuplicateLedger(ReceiptLedgerStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * @throws LedgerUnavailableException when the ledger cannot be queried; the caller must not treat this
     *     as "not a duplicate"
     */
    public boolean isDuplicate(ValidatedReceipt receipt) {
        for (LedgerField[] pair : MATCHING_PAIRS) {
            LedgerField first = pair[0];
            LedgerField second = pair[1];
            if (store.existsMatching(first, first.valueFrom(receipt), second, second.valueFrom(receipt))) {
                LOGGER.info("Receipt order {} on {} at {} matches an accepted receipt on {} and {}",
                    receipt.orderNumber(), receipt.orderDate(), receipt.orderTime(), first.documentField(),
                    second.documentField());
                return true;
            }
        }
        return false;
    }
}
