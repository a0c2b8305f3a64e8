package dev.pekelund.loyalty.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import dev.pekelund.loyalty.receipts.ReceiptFields;
import dev.pekelund.loyalty.receipts.ValidatedReceipt;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DuplicateLedgerTest {

    private InMemoryReceiptLedgerStore store;
    private DuplicateLedger duplicateLedger;

    @BeforeEach
    void setUp() {
        store = new InMemoryReceiptLedgerStore(Clock.fixed(Instant.parse("2024-06-20T12:00:00Z"), ZoneOffset.UTC),
            true);
        duplicateLedger = new DuplicateLedger(store);
        new AwardRecorder(store).recordAndAward("alice", receipt(42, "06/15", "12:30"));
    }

    @Test
    void emptyLedgerHasNoDuplicates() {
        DuplicateLedger empty = new DuplicateLedger(
            new InMemoryReceiptLedgerStore(Clock.systemUTC(), true));

        assertThat(empty.isDuplicate(receipt(42, "06/15", "12:30"))).isFalse();
    }

    @ParameterizedTest
    @CsvSource({
        "42, 06/15, 12:30, true",
        "42, 06/15, 18:00, true",
        "42, 06/16, 12:30, true",
        "7, 06/15, 12:30, true",
        "42, 06/16, 18:00, false",
        "7, 06/15, 18:00, false",
        "7, 06/16, 12:30, false",
        "7, 06/16, 18:00, false"
    })
    void anyTwoMatchingAttributesMakeADuplicate(int orderNumber, String date, String time, boolean duplicate) {
        assertThat(duplicateLedger.isDuplicate(receipt(orderNumber, date, time))).isEqualTo(duplicate);
    }

    @Test
    void submitterDoesNotMatterForDuplicates() {
        assertThat(store.entries()).singleElement().extracting(LedgerEntry::submitterId).isEqualTo("alice");

        assertThat(duplicateLedger.isDuplicate(receipt(42, "06/15", "09:00"))).isTrue();
    }

    @Test
    void leadingZerosInOrderNumberDoNotHideDuplicates() {
        ValidatedReceipt padded = new ValidatedReceipt(
            new ReceiptFields("042", new BigDecimal("9.99"), "06/15", "20:00"), 42, LocalDate.of(2024, 6, 15));

        assertThat(duplicateLedger.isDuplicate(padded)).isTrue();
    }

    @Test
    void unavailableStoreIsNotReportedAsUnique() {
        ReceiptLedgerStore failing = mock(ReceiptLedgerStore.class);
        when(failing.existsMatching(any(), any(), any(), any()))
            .thenThrow(new LedgerUnavailableException("ledger offline", null));

        assertThatThrownBy(() -> new DuplicateLedger(failing).isDuplicate(receipt(42, "06/15", "12:30")))
            .isInstanceOf(LedgerUnavailableException.class);
    }

    static ValidatedReceipt receipt(int orderNumber, String date, String time) {
        ReceiptFields fields = new ReceiptFields(String.valueOf(orderNumber), new BigDecimal("23.45"), date, time);
        return new ValidatedReceipt(fields, orderNumber, LocalDate.of(2024, 6, 15));
    }
}
