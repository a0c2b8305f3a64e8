package dev.pekelund.loyalty.receipts.validation;

import dev.pekelund.loyalty.receipts.ValidatedReceipt;

/**
 * Outcome of {@link FieldSanityChecker#validate}.
 */
public record ValidationResult(ValidatedReceipt receipt, ValidationError error) {

    public static ValidationResult valid(ValidatedReceipt receipt) {
        return new ValidationResult(receipt, null);
    }

    public static ValidationResult invalid(ValidationError error) {
        return new ValidationResult(null, error);
    }

    public boolean isValid() {
        return receipt != null;
    }
}
