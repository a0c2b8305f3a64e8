package dev.pekelund.loyalty.receipts;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Fields read from a receipt photo before any plausibility checks have been applied.
 *
 * @param orderNumber order number exactly as printed, leading zeros preserved
 * @param orderTotal  amount paid
 * @param orderDate   month and day as printed, expected as {@code MM/DD}
 * @param orderTime   24-hour time as printed, expected as {@code HH:MM}
 */
public record ReceiptFields(String orderNumber, BigDecimal orderTotal, String orderDate, String orderTime) {

    public ReceiptFields {
        Objects.requireNonNull(orderNumber, "orderNumber");
        Objects.requireNonNull(orderTotal, "orderTotal");
        Objects.requireNonNull(orderDate, "orderDate");
        Objects.requireNonNull(orderTime, "orderTime");
    }

    /**
     * Field-wise agreement used by the consensus check. Text fields must be identical; the total is
     * compared by value so {@code 23.45} and {@code 23.450} agree.
     */
    public boolean agreesWith(ReceiptFields other) {
        if (other == null) {
            return false;
        }
        return orderNumber.equals(other.orderNumber)
            && orderTotal.compareTo(other.orderTotal) == 0
            && orderDate.equals(other.orderDate)
            && orderTime.equals(other.orderTime);
    }
}
