package dev.pekelund.loyalty.ledger;

import dev.pekelund.loyalty.receipts.ValidatedReceipt;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an accepted receipt into a ledger entry and a points credit. Does not check for duplicates itself;
 * callers run {@link DuplicateLedger} immediately before.
 */
public class AwardRecorder {

    private static final Logger LOGGER = LoggerFactory.getLogger(AwardRecorder.class);

    static final BigDecimal POINTS_PER_DOLLAR = BigDecimal.valueOf(5);

    private final ReceiptLedgerStore store;

    public AwardRecorder(ReceiptLedgerStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * @throws AwardFailedException when the award did not commit; nothing was written in that case
     */
    public AwardOutcome recordAndAward(String submitterId, ValidatedReceipt receipt) {
        long points = pointsFor(receipt.orderTotal());
        LedgerEntry entry = new LedgerEntry(null, submitterId, receipt.orderNumber(), receipt.orderDate(),
            receipt.orderTime(), receipt.orderTotal(), points, null);

        ReceiptLedgerStore.RecordedAward recorded = store.recordAward(entry);
        LOGGER.info("Awarded {} points to {} for order {} (ledger entry {}, new balance {})", points, submitterId,
            receipt.orderNumber(), recorded.entry().id(), recorded.newBalance());
        return new AwardOutcome(points, recorded.newBalance(), recorded.newLifetimePoints(), recorded.entry().id());
    }

    /**
     * Five points per dollar, rounded down: {@code 23.45} earns {@code 117}.
     */
    public static long pointsFor(BigDecimal orderTotal) {
        return orderTotal.multiply(POINTS_PER_DOLLAR).setScale(0, RoundingMode.FLOOR).longValueExact();
    }
}
