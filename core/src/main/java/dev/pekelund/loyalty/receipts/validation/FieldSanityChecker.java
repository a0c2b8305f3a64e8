package dev.pekelund.loyalty.receipts.validation;

import dev.pekelund.loyalty.receipts.ReceiptFields;
import dev.pekelund.loyalty.receipts.ValidatedReceipt;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.MonthDay;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shape and plausibility checks for extracted receipt fields. Checks run in a fixed order and stop at the
 * first failure so the same input always reports the same error.
 *
 * <p>The order number cap here (200) is tighter than the one given to the vision model (400).
 */
public class FieldSanityChecker {

    static final int MAX_ORDER_NUMBER = 200;
    static final BigDecimal MIN_TOTAL = new BigDecimal("1.00");
    static final BigDecimal MAX_TOTAL = new BigDecimal("500.00");
    static final long MAX_AGE_DAYS = 30;

    private static final Pattern ORDER_NUMBER_PATTERN = Pattern.compile("\\d{1,3}");
    private static final Pattern DATE_PATTERN = Pattern.compile("(\\d{2})/(\\d{2})");
    private static final Pattern TIME_PATTERN = Pattern.compile("(\\d{2}):(\\d{2})");

    public ValidationResult validate(ReceiptFields fields, ZonedDateTime now) {
        if (!ORDER_NUMBER_PATTERN.matcher(fields.orderNumber()).matches()) {
            return ValidationResult.invalid(ValidationError.ORDER_NUMBER_FORMAT);
        }
        int orderNumber = Integer.parseInt(fields.orderNumber());
        if (orderNumber < 1 || orderNumber > MAX_ORDER_NUMBER) {
            return ValidationResult.invalid(ValidationError.ORDER_NUMBER_RANGE);
        }

        Matcher date = DATE_PATTERN.matcher(fields.orderDate());
        if (!date.matches()) {
            return ValidationResult.invalid(ValidationError.DATE_FORMAT);
        }
        MonthDay monthDay;
        try {
            monthDay = MonthDay.of(Integer.parseInt(date.group(1)), Integer.parseInt(date.group(2)));
        } catch (DateTimeException ex) {
            return ValidationResult.invalid(ValidationError.DATE_FORMAT);
        }

        Matcher time = TIME_PATTERN.matcher(fields.orderTime());
        if (!time.matches()) {
            return ValidationResult.invalid(ValidationError.TIME_FORMAT);
        }
        int hour = Integer.parseInt(time.group(1));
        int minute = Integer.parseInt(time.group(2));
        if (hour > 23 || minute > 59) {
            return ValidationResult.invalid(ValidationError.TIME_RANGE);
        }

        BigDecimal total = fields.orderTotal();
        if (total.compareTo(MIN_TOTAL) < 0 || total.compareTo(MAX_TOTAL) > 0) {
            return ValidationResult.invalid(ValidationError.TOTAL_RANGE);
        }

        LocalDate purchaseDate = resolvePurchaseDate(monthDay, now);
        long distance = Math.abs(ChronoUnit.DAYS.between(purchaseDate, now.toLocalDate()));
        if (distance > MAX_AGE_DAYS) {
            return ValidationResult.invalid(ValidationError.TOO_OLD);
        }

        return ValidationResult.valid(new ValidatedReceipt(fields, orderNumber, purchaseDate));
    }

    /**
     * Receipts carry no year. The current year is assumed unless that places the purchase after
     * {@code now}, in which case the receipt is from last year. February 29 resolves to February 28
     * outside leap years.
     */
    static LocalDate resolvePurchaseDate(MonthDay monthDay, ZonedDateTime now) {
        LocalDate today = now.toLocalDate();
        LocalDate candidate = monthDay.atYear(today.getYear());
        if (candidate.isAfter(today)) {
            candidate = monthDay.atYear(today.getYear() - 1);
        }
        return candidate;
    }
}
