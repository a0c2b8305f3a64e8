package dev.pekelund.loyalty.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.loyalty.receipts.ReceiptFields;
import dev.pekelund.loyalty.receipts.ValidatedReceipt;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class AwardRecorderTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-20T12:00:00Z"), ZoneOffset.UTC);

    @ParameterizedTest
    @CsvSource({
        "23.45, 117",
        "1.00, 5",
        "1.19, 5",
        "19.99, 99",
        "500.00, 2500"
    })
    void awardsFivePointsPerDollarRoundedDown(String total, long expectedPoints) {
        assertThat(AwardRecorder.pointsFor(new BigDecimal(total))).isEqualTo(expectedPoints);
    }

    @Test
    void writesLedgerEntryAndCreditsBalance() {
        InMemoryReceiptLedgerStore store = new InMemoryReceiptLedgerStore(CLOCK, false);
        store.openAccount("alice", 100);

        AwardOutcome outcome = new AwardRecorder(store).recordAndAward("alice", receipt("23.45"));

        assertThat(outcome.pointsAwarded()).isEqualTo(117);
        assertThat(outcome.newBalance()).isEqualTo(217);
        assertThat(outcome.ledgerEntryId()).isNotBlank();
        assertThat(store.balanceOf("alice")).contains(217L);
        assertThat(outcome.newLifetimePoints()).isEqualTo(217);
        assertThat(store.lifetimePointsOf("alice")).contains(217L);
        assertThat(store.entries()).singleElement().satisfies(entry -> {
            assertThat(entry.id()).isEqualTo(outcome.ledgerEntryId());
            assertThat(entry.submitterId()).isEqualTo("alice");
            assertThat(entry.orderNumber()).isEqualTo(42L);
            assertThat(entry.orderDate()).isEqualTo("06/15");
            assertThat(entry.orderTime()).isEqualTo("12:30");
            assertThat(entry.orderTotal()).isEqualByComparingTo("23.45");
            assertThat(entry.pointsAwarded()).isEqualTo(117);
            assertThat(entry.acceptedAt()).isEqualTo(CLOCK.instant());
            assertThat(entry.historyDescription()).isEqualTo("Receipt #42");
        });
    }

    @Test
    void failureBetweenWritesLeavesNothingBehind() {
        InMemoryReceiptLedgerStore store = new InMemoryReceiptLedgerStore(CLOCK, false) {
            @Override
            protected void beforeBalanceIncrement(LedgerEntry staged) {
                throw new IllegalStateException("simulated crash");
            }
        };
        store.openAccount("alice", 100);

        assertThatThrownBy(() -> new AwardRecorder(store).recordAndAward("alice", receipt("23.45")))
            .isInstanceOf(AwardFailedException.class)
            .satisfies(ex -> assertThat(((AwardFailedException) ex).isRetryable()).isTrue());

        assertThat(store.entries()).isEmpty();
        assertThat(store.balanceOf("alice")).contains(100L);
        assertThat(store.lifetimePointsOf("alice")).contains(100L);
    }

    @Test
    void missingAccountIsNotRetryable() {
        InMemoryReceiptLedgerStore store = new InMemoryReceiptLedgerStore(CLOCK, false);

        assertThatThrownBy(() -> new AwardRecorder(store).recordAndAward("ghost", receipt("23.45")))
            .isInstanceOf(SubmitterNotFoundException.class)
            .satisfies(ex -> {
                AwardFailedException failure = (AwardFailedException) ex;
                assertThat(failure.getErrorCode()).isEqualTo("SUBMITTER_NOT_FOUND");
                assertThat(failure.isRetryable()).isFalse();
            });
        assertThat(store.entries()).isEmpty();
    }

    @Test
    void opensMissingAccountsWhenConfigured() {
        InMemoryReceiptLedgerStore store = new InMemoryReceiptLedgerStore(CLOCK, true);

        AwardOutcome outcome = new AwardRecorder(store).recordAndAward("newcomer", receipt("10.00"));

        assertThat(outcome.newBalance()).isEqualTo(50);
        assertThat(store.balanceOf("newcomer")).contains(50L);
    }

    private static ValidatedReceipt receipt(String total) {
        return new ValidatedReceipt(new ReceiptFields("42", new BigDecimal(total), "06/15", "12:30"), 42,
            LocalDate.of(2024, 6, 15));
    }
}
