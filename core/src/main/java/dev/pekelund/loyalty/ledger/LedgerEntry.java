package dev.pekelund.loyalty.ledger;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * A receipt that has been accepted and paid out. Written once, never updated.
 *
 * @param id            store-assigned identifier; {@code null} before the entry is written
 * @param acceptedAt    store-assigned creation time; {@code null} before the entry is written
 */
public record LedgerEntry(
    String id,
    String submitterId,
    long orderNumber,
    String orderDate,
    String orderTime,
    BigDecimal orderTotal,
    long pointsAwarded,
    Instant acceptedAt
) {

    public LedgerEntry {
        Objects.requireNonNull(submitterId, "submitterId");
        Objects.requireNonNull(orderDate, "orderDate");
        Objects.requireNonNull(orderTime, "orderTime");
        Objects.requireNonNull(orderTotal, "orderTotal");
    }

    public LedgerEntry withStoreAssigned(String assignedId, Instant assignedAt) {
        return new LedgerEntry(assignedId, submitterId, orderNumber, orderDate, orderTime, orderTotal,
            pointsAwarded, assignedAt);
    }

    public Object valueFor(LedgerField field) {
        switch (field) {
            case ORDER_NUMBER:
                return orderNumber;
            case ORDER_DATE:
                return orderDate;
            case ORDER_TIME:
                return orderTime;
            default:
                throw new IllegalArgumentException("Unknown ledger field " + field);
        }
    }

    /**
     * Description shown in the submitter's points history.
     */
    public String historyDescription() {
        return "Receipt #" + orderNumber;
    }
}
