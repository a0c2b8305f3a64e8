package dev.pekelund.loyalty.scanner.firestore;

import com.google.api.core.ApiFuture;
import com.google.cloud.firestore.AggregateQuerySnapshot;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.FieldValue;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QuerySnapshot;
import com.google.cloud.firestore.Transaction;
import dev.pekelund.loyalty.ledger.AwardFailedException;
import dev.pekelund.loyalty.ledger.LedgerEntry;
import dev.pekelund.loyalty.ledger.LedgerField;
import dev.pekelund.loyalty.ledger.LedgerUnavailableException;
import dev.pekelund.loyalty.ledger.ReceiptLedgerStore;
import dev.pekelund.loyalty.ledger.SubmitterNotFoundException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ledger store backed by Firestore. Ledger entries, the submitters' points balances and the points history
 * live in three collections; an award touches all three in a single transaction. Ledger documents carry the
 * day they were accepted on, in the store clock's zone, for the per-day receipt count.
 */
public class FirestoreReceiptLedgerStore implements ReceiptLedgerStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreReceiptLedgerStore.class);

    static final String POINTS_FIELD = "points";
    static final String LIFETIME_POINTS_FIELD = "lifetimePoints";
    static final String SUBMITTER_FIELD = "submitterId";
    static final String ACCEPTED_DAY_FIELD = "acceptedDay";
    static final String HISTORY_TYPE = "receipt_scan";

    private final Firestore firestore;
    private final String ledgerCollection;
    private final String usersCollection;
    private final String pointsTransactionsCollection;
    private final Clock clock;

    public FirestoreReceiptLedgerStore(Firestore firestore, String ledgerCollection, String usersCollection,
        String pointsTransactionsCollection, Clock clock) {

        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.ledgerCollection = Objects.requireNonNull(ledgerCollection, "ledgerCollection");
        this.usersCollection = Objects.requireNonNull(usersCollection, "usersCollection");
        this.pointsTransactionsCollection = Objects.requireNonNull(pointsTransactionsCollection,
            "pointsTransactionsCollection");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public boolean existsMatching(LedgerField first, Object firstValue, LedgerField second, Object secondValue) {
        try {
            QuerySnapshot snapshot = firestore.collection(ledgerCollection)
                .whereEqualTo(first.documentField(), firstValue)
                .whereEqualTo(second.documentField(), secondValue)
                .limit(1)
                .get()
                .get();
            return snapshot != null && !snapshot.isEmpty();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new LedgerUnavailableException("Interrupted while querying the receipt ledger", ex);
        } catch (ExecutionException ex) {
            LOGGER.error("Receipt ledger query on {} and {} failed", first.documentField(), second.documentField(), ex);
            throw new LedgerUnavailableException("Failed to query the receipt ledger", ex);
        } catch (RuntimeException ex) {
            LOGGER.error("Receipt ledger query on {} and {} failed", first.documentField(), second.documentField(), ex);
            throw new LedgerUnavailableException("Failed to query the receipt ledger", ex);
        }
    }

    @Override
    public long countAcceptedOn(String submitterId, LocalDate day) {
        try {
            AggregateQuerySnapshot snapshot = firestore.collection(ledgerCollection)
                .whereEqualTo(SUBMITTER_FIELD, submitterId)
                .whereEqualTo(ACCEPTED_DAY_FIELD, day.toString())
                .count()
                .get()
                .get();
            return snapshot != null ? snapshot.getCount() : 0L;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new LedgerUnavailableException("Interrupted while counting receipts for " + submitterId, ex);
        } catch (ExecutionException ex) {
            LOGGER.error("Counting receipts of {} on {} failed", submitterId, day, ex);
            throw new LedgerUnavailableException("Failed to count receipts", ex);
        } catch (RuntimeException ex) {
            LOGGER.error("Counting receipts of {} on {} failed", submitterId, day, ex);
            throw new LedgerUnavailableException("Failed to count receipts", ex);
        }
    }

    @Override
    public RecordedAward recordAward(LedgerEntry entry) {
        if (entry.submitterId().isBlank() || entry.submitterId().contains("/")) {
            throw new SubmitterNotFoundException(entry.submitterId());
        }
        try {
            DocumentReference userRef = firestore.collection(usersCollection).document(entry.submitterId());
            DocumentReference ledgerRef = firestore.collection(ledgerCollection).document();
            DocumentReference historyRef = firestore.collection(pointsTransactionsCollection).document();
            LedgerEntry stored = entry.withStoreAssigned(ledgerRef.getId(), clock.instant());

            ApiFuture<RecordedAward> result = firestore.runTransaction(transaction ->
                applyAward(transaction, userRef, ledgerRef, historyRef, stored));
            return result.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AwardFailedException("Interrupted while awarding points", ex);
        } catch (ExecutionException ex) {
            SubmitterNotFoundException missing = findCause(ex, SubmitterNotFoundException.class);
            if (missing != null) {
                throw missing;
            }
            LOGGER.error("Award transaction for {} did not commit", entry.submitterId(), ex);
            throw new AwardFailedException("Award transaction did not commit", ex);
        } catch (RuntimeException ex) {
            LOGGER.error("Award transaction for {} could not be started", entry.submitterId(), ex);
            throw new AwardFailedException("Award transaction could not be started", ex);
        }
    }

    private RecordedAward applyAward(Transaction transaction, DocumentReference userRef,
        DocumentReference ledgerRef, DocumentReference historyRef, LedgerEntry entry) throws Exception {

        DocumentSnapshot user = transaction.get(userRef).get();
        if (user == null || !user.exists()) {
            throw new SubmitterNotFoundException(entry.submitterId());
        }
        Long currentPoints = user.getLong(POINTS_FIELD);
        long balance = currentPoints != null ? currentPoints : 0L;
        // Accounts created before lifetime points were tracked start from their current balance.
        Long currentLifetime = user.getLong(LIFETIME_POINTS_FIELD);
        long newBalance = balance + entry.pointsAwarded();
        long newLifetime = (currentLifetime != null ? currentLifetime : balance) + entry.pointsAwarded();

        LocalDate acceptedDay = LocalDate.ofInstant(entry.acceptedAt(), clock.getZone());
        transaction.create(ledgerRef, toLedgerDocument(entry, acceptedDay));
        transaction.create(historyRef, toHistoryDocument(entry));
        transaction.update(userRef,
            Map.<String, Object>of(POINTS_FIELD, newBalance, LIFETIME_POINTS_FIELD, newLifetime));
        return new RecordedAward(entry, newBalance, newLifetime);
    }

    static Map<String, Object> toLedgerDocument(LedgerEntry entry, LocalDate acceptedDay) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(SUBMITTER_FIELD, entry.submitterId());
        document.put(LedgerField.ORDER_NUMBER.documentField(), entry.orderNumber());
        document.put(LedgerField.ORDER_DATE.documentField(), entry.orderDate());
        document.put(LedgerField.ORDER_TIME.documentField(), entry.orderTime());
        document.put("orderTotal", entry.orderTotal().toPlainString());
        document.put("pointsAwarded", entry.pointsAwarded());
        document.put("acceptedAt", FieldValue.serverTimestamp());
        document.put(ACCEPTED_DAY_FIELD, acceptedDay.toString());
        return document;
    }

    static Map<String, Object> toHistoryDocument(LedgerEntry entry) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("ledgerEntryId", entry.id());
        metadata.put("orderNumber", entry.orderNumber());
        metadata.put("orderTotal", entry.orderTotal().toPlainString());
        metadata.put("orderDate", entry.orderDate());
        metadata.put("orderTime", entry.orderTime());

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("userId", entry.submitterId());
        document.put("type", HISTORY_TYPE);
        document.put("amount", entry.pointsAwarded());
        document.put("description", entry.historyDescription());
        document.put("timestamp", FieldValue.serverTimestamp());
        document.put("metadata", metadata);
        return document;
    }

    private static <T extends Throwable> T findCause(Throwable throwable, Class<T> type) {
        Throwable current = throwable;
        while (current != null) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.getCause();
        }
        return null;
    }
}
