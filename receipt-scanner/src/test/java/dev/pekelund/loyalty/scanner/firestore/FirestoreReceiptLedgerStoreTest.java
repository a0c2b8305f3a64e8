package dev.pekelund.loyalty.scanner.firestore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.api.core.ApiFutures;
import com.google.cloud.firestore.AggregateQuery;
import com.google.cloud.firestore.AggregateQuerySnapshot;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.FieldValue;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QuerySnapshot;
import com.google.cloud.firestore.Transaction;
import dev.pekelund.loyalty.ledger.AwardFailedException;
import dev.pekelund.loyalty.ledger.LedgerEntry;
import dev.pekelund.loyalty.ledger.LedgerField;
import dev.pekelund.loyalty.ledger.LedgerUnavailableException;
import dev.pekelund.loyalty.ledger.ReceiptLedgerStore.RecordedAward;
import dev.pekelund.loyalty.ledger.SubmitterNotFoundException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class FirestoreReceiptLedgerStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-20T12:00:00Z"), ZoneOffset.UTC);

    private Firestore firestore;
    private CollectionReference ledger;
    private CollectionReference users;
    private CollectionReference history;
    private Transaction transaction;
    private FirestoreReceiptLedgerStore store;

    @BeforeEach
    void setUp() {
        firestore = mock(Firestore.class);
        ledger = mock(CollectionReference.class);
        users = mock(CollectionReference.class);
        history = mock(CollectionReference.class);
        transaction = mock(Transaction.class);
        when(firestore.collection("receiptLedger")).thenReturn(ledger);
        when(firestore.collection("users")).thenReturn(users);
        when(firestore.collection("pointsTransactions")).thenReturn(history);
        store = new FirestoreReceiptLedgerStore(firestore, "receiptLedger", "users", "pointsTransactions", CLOCK);
    }

    @Test
    void existsMatchingQueriesBothFieldsWithLimit() {
        QuerySnapshot snapshot = mock(QuerySnapshot.class);
        when(snapshot.isEmpty()).thenReturn(false);
        Query limited = stubQuery("orderNumber", 42L, "orderDate", "06/15");
        when(limited.get()).thenReturn(ApiFutures.immediateFuture(snapshot));

        assertThat(store.existsMatching(LedgerField.ORDER_NUMBER, 42L, LedgerField.ORDER_DATE, "06/15")).isTrue();
    }

    @Test
    void emptySnapshotMeansNoMatch() {
        QuerySnapshot snapshot = mock(QuerySnapshot.class);
        when(snapshot.isEmpty()).thenReturn(true);
        Query limited = stubQuery("orderDate", "06/15", "orderTime", "12:30");
        when(limited.get()).thenReturn(ApiFutures.immediateFuture(snapshot));

        assertThat(store.existsMatching(LedgerField.ORDER_DATE, "06/15", LedgerField.ORDER_TIME, "12:30")).isFalse();
    }

    @Test
    void failedQueryIsUnavailable() {
        Query limited = stubQuery("orderNumber", 42L, "orderTime", "12:30");
        when(limited.get()).thenReturn(ApiFutures.immediateFailedFuture(new IllegalStateException("UNAVAILABLE")));

        assertThatThrownBy(() -> store.existsMatching(LedgerField.ORDER_NUMBER, 42L, LedgerField.ORDER_TIME,
            "12:30"))
            .isInstanceOf(LedgerUnavailableException.class);
    }

    @Test
    void recordAwardWritesEntryHistoryAndBalanceInOneTransaction() {
        DocumentReference userRef = mock(DocumentReference.class);
        DocumentReference ledgerRef = mock(DocumentReference.class);
        DocumentReference historyRef = mock(DocumentReference.class);
        when(users.document("alice")).thenReturn(userRef);
        when(ledger.document()).thenReturn(ledgerRef);
        when(history.document()).thenReturn(historyRef);
        when(ledgerRef.getId()).thenReturn("entry-1");
        DocumentSnapshot account = mock(DocumentSnapshot.class);
        when(account.exists()).thenReturn(true);
        when(account.getLong("points")).thenReturn(100L);
        when(account.getLong("lifetimePoints")).thenReturn(800L);
        when(transaction.get(userRef)).thenReturn(ApiFutures.immediateFuture(account));
        runTransactionsAgainstMock();

        RecordedAward recorded = store.recordAward(entry());

        assertThat(recorded.newBalance()).isEqualTo(217L);
        assertThat(recorded.newLifetimePoints()).isEqualTo(917L);
        assertThat(recorded.entry().id()).isEqualTo("entry-1");
        assertThat(recorded.entry().acceptedAt()).isEqualTo(CLOCK.instant());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> ledgerDocument = ArgumentCaptor.forClass(Map.class);
        verify(transaction).create(eq(ledgerRef), ledgerDocument.capture());
        assertThat(ledgerDocument.getValue())
            .containsEntry("submitterId", "alice")
            .containsEntry("orderNumber", 42L)
            .containsEntry("orderDate", "06/15")
            .containsEntry("orderTime", "12:30")
            .containsEntry("orderTotal", "23.45")
            .containsEntry("pointsAwarded", 117L)
            .containsEntry("acceptedAt", FieldValue.serverTimestamp())
            .containsEntry("acceptedDay", "2024-06-20");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> historyDocument = ArgumentCaptor.forClass(Map.class);
        verify(transaction).create(eq(historyRef), historyDocument.capture());
        assertThat(historyDocument.getValue())
            .containsEntry("userId", "alice")
            .containsEntry("type", "receipt_scan")
            .containsEntry("amount", 117L)
            .containsEntry("description", "Receipt #42")
            .containsKey("metadata");

        verify(transaction).update(userRef, Map.<String, Object>of("points", 217L, "lifetimePoints", 917L));
    }

    @Test
    void lifetimePointsStartFromBalanceWhenNeverTracked() {
        DocumentReference userRef = mock(DocumentReference.class);
        when(users.document("alice")).thenReturn(userRef);
        when(ledger.document()).thenReturn(mock(DocumentReference.class));
        when(history.document()).thenReturn(mock(DocumentReference.class));
        DocumentSnapshot account = mock(DocumentSnapshot.class);
        when(account.exists()).thenReturn(true);
        when(account.getLong("points")).thenReturn(100L);
        when(transaction.get(userRef)).thenReturn(ApiFutures.immediateFuture(account));
        runTransactionsAgainstMock();

        RecordedAward recorded = store.recordAward(entry());

        assertThat(recorded.newLifetimePoints()).isEqualTo(217L);
        verify(transaction).update(userRef, Map.<String, Object>of("points", 217L, "lifetimePoints", 217L));
    }

    @Test
    void submitterIdWithPathSeparatorIsRefusedBeforeTouchingFirestore() {
        LedgerEntry nested = new LedgerEntry(null, "a/b", 42L, "06/15", "12:30", new BigDecimal("23.45"), 117L, null);

        assertThatThrownBy(() -> store.recordAward(nested))
            .isInstanceOf(SubmitterNotFoundException.class)
            .satisfies(ex -> assertThat(((AwardFailedException) ex).isRetryable()).isFalse());
        verify(firestore, never()).runTransaction(any());
        verify(users, never()).document(any());
    }

    @Test
    void clientErrorBeforeTransactionIsAwardFailure() {
        when(users.document("alice")).thenThrow(new IllegalArgumentException("Invalid document path"));

        assertThatThrownBy(() -> store.recordAward(entry()))
            .isInstanceOf(AwardFailedException.class)
            .isNotInstanceOf(SubmitterNotFoundException.class)
            .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void countsSubmitterReceiptsForOneDay() {
        Query bySubmitter = mock(Query.class);
        Query byDay = mock(Query.class);
        AggregateQuery count = mock(AggregateQuery.class);
        AggregateQuerySnapshot snapshot = mock(AggregateQuerySnapshot.class);
        when(ledger.whereEqualTo("submitterId", "alice")).thenReturn(bySubmitter);
        when(bySubmitter.whereEqualTo("acceptedDay", "2024-06-20")).thenReturn(byDay);
        when(byDay.count()).thenReturn(count);
        when(count.get()).thenReturn(ApiFutures.immediateFuture(snapshot));
        when(snapshot.getCount()).thenReturn(3L);

        assertThat(store.countAcceptedOn("alice", LocalDate.of(2024, 6, 20))).isEqualTo(3L);
    }

    @Test
    void failedCountIsUnavailable() {
        Query bySubmitter = mock(Query.class);
        Query byDay = mock(Query.class);
        AggregateQuery count = mock(AggregateQuery.class);
        when(ledger.whereEqualTo("submitterId", "alice")).thenReturn(bySubmitter);
        when(bySubmitter.whereEqualTo("acceptedDay", "2024-06-20")).thenReturn(byDay);
        when(byDay.count()).thenReturn(count);
        when(count.get()).thenReturn(ApiFutures.immediateFailedFuture(new IllegalStateException("UNAVAILABLE")));

        assertThatThrownBy(() -> store.countAcceptedOn("alice", LocalDate.of(2024, 6, 20)))
            .isInstanceOf(LedgerUnavailableException.class);
    }

    @Test
    void missingAccountAbortsWithoutWrites() {
        DocumentReference userRef = mock(DocumentReference.class);
        when(users.document("alice")).thenReturn(userRef);
        when(ledger.document()).thenReturn(mock(DocumentReference.class));
        when(history.document()).thenReturn(mock(DocumentReference.class));
        DocumentSnapshot account = mock(DocumentSnapshot.class);
        when(account.exists()).thenReturn(false);
        when(transaction.get(userRef)).thenReturn(ApiFutures.immediateFuture(account));
        runTransactionsAgainstMock();

        assertThatThrownBy(() -> store.recordAward(entry()))
            .isInstanceOf(SubmitterNotFoundException.class);
        verify(transaction, never()).create(any(DocumentReference.class), anyMap());
    }

    @Test
    void failedCommitIsAwardFailure() {
        when(users.document("alice")).thenReturn(mock(DocumentReference.class));
        when(ledger.document()).thenReturn(mock(DocumentReference.class));
        when(history.document()).thenReturn(mock(DocumentReference.class));
        when(firestore.runTransaction(any()))
            .thenReturn(ApiFutures.immediateFailedFuture(new IllegalStateException("ABORTED")));

        assertThatThrownBy(() -> store.recordAward(entry()))
            .isInstanceOf(AwardFailedException.class)
            .isNotInstanceOf(SubmitterNotFoundException.class);
    }

    private Query stubQuery(String firstField, Object firstValue, String secondField, Object secondValue) {
        Query first = mock(Query.class);
        Query second = mock(Query.class);
        Query limited = mock(Query.class);
        when(ledger.whereEqualTo(firstField, firstValue)).thenReturn(first);
        when(first.whereEqualTo(secondField, secondValue)).thenReturn(second);
        when(second.limit(1)).thenReturn(limited);
        return limited;
    }

    @SuppressWarnings("unchecked")
    private void runTransactionsAgainstMock() {
        when(firestore.runTransaction(any())).thenAnswer(invocation -> {
            Transaction.Function<Object> function = invocation.getArgument(0);
            try {
                return ApiFutures.immediateFuture(function.updateCallback(transaction));
            } catch (Exception ex) {
                return ApiFutures.immediateFailedFuture(ex);
            }
        });
    }

    private static LedgerEntry entry() {
        return new LedgerEntry(null, "alice", 42L, "06/15", "12:30", new BigDecimal("23.45"), 117L, null);
    }
}
