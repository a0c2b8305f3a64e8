package dev.pekelund.loyalty.receipts;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Receipt fields that passed every sanity check, together with the values parsed from them.
 *
 * @param fields        the fields as extracted
 * @param orderNumber   parsed order number, between 1 and 200
 * @param purchaseDate  month/day resolved against the evaluation year, at most 30 days from it
 */
public record ValidatedReceipt(ReceiptFields fields, int orderNumber, LocalDate purchaseDate) {

    public ValidatedReceipt {
        Objects.requireNonNull(fields, "fields");
        Objects.requireNonNull(purchaseDate, "purchaseDate");
    }

    public BigDecimal orderTotal() {
        return fields.orderTotal();
    }

    public String orderDate() {
        return fields.orderDate();
    }

    public String orderTime() {
        return fields.orderTime();
    }
}
