package dev.pekelund.loyalty.ledger;

import java.time.LocalDate;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caps the number of receipts one submitter can earn points for on a single day. A limit of zero or less
 * turns the cap off.
 */
public class DailyReceiptLimit {

    private static final Logger LOGGER = LoggerFactory.getLogger(DailyReceiptLimit.class);

    private final ReceiptLedgerStore store;
    private final int receiptsPerDay;

    public DailyReceiptLimit(ReceiptLedgerStore store, int receiptsPerDay) {
        this.store = Objects.requireNonNull(store, "store");
        this.receiptsPerDay = receiptsPerDay;
    }

    /**
     * @throws LedgerUnavailableException when the ledger cannot be queried
     */
    public boolean isReached(String submitterId, LocalDate today) {
        if (receiptsPerDay <= 0) {
            return false;
        }
        long accepted = store.countAcceptedOn(submitterId, today);
        if (accepted >= receiptsPerDay) {
            LOGGER.info("Submitter {} already has {} accepted receipts on {} (limit {})", submitterId, accepted,
                today, receiptsPerDay);
            return true;
        }
        return false;
    }
}
