package dev.pekelund.loyalty.ledger;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ledger store held in memory, used for local runs. Each award is staged on copies of the ledger and the
 * balances and published only when all writes have been applied, so a failure part way leaves the
 * previous state untouched.
 */
public class InMemoryReceiptLedgerStore implements ReceiptLedgerStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryReceiptLedgerStore.class);

    private final Clock clock;
    private final boolean createMissingAccounts;

    private List<LedgerEntry> entries = List.of();
    private Map<String, Long> balances = Map.of();
    private Map<String, Long> lifetimePoints = Map.of();

    public InMemoryReceiptLedgerStore(Clock clock, boolean createMissingAccounts) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.createMissingAccounts = createMissingAccounts;
    }

    public synchronized void openAccount(String submitterId, long balance) {
        openAccount(submitterId, balance, balance);
    }

    public synchronized void openAccount(String submitterId, long balance, long lifetime) {
        Map<String, Long> updatedBalances = new HashMap<>(balances);
        updatedBalances.put(submitterId, balance);
        Map<String, Long> updatedLifetime = new HashMap<>(lifetimePoints);
        updatedLifetime.put(submitterId, lifetime);
        balances = Map.copyOf(updatedBalances);
        lifetimePoints = Map.copyOf(updatedLifetime);
    }

    @Override
    public synchronized boolean existsMatching(LedgerField first, Object firstValue, LedgerField second,
        Object secondValue) {

        return entries.stream().anyMatch(entry -> Objects.equals(entry.valueFor(first), firstValue)
            && Objects.equals(entry.valueFor(second), secondValue));
    }

    @Override
    public synchronized long countAcceptedOn(String submitterId, LocalDate day) {
        return entries.stream()
            .filter(entry -> entry.submitterId().equals(submitterId))
            .filter(entry -> LocalDate.ofInstant(entry.acceptedAt(), clock.getZone()).equals(day))
            .count();
    }

    @Override
    public synchronized RecordedAward recordAward(LedgerEntry entry) {
        Long currentBalance = balances.get(entry.submitterId());
        if (currentBalance == null && !createMissingAccounts) {
            throw new SubmitterNotFoundException(entry.submitterId());
        }

        LedgerEntry stored = entry.withStoreAssigned(UUID.randomUUID().toString(), clock.instant());
        try {
            List<LedgerEntry> stagedEntries = new ArrayList<>(entries);
            stagedEntries.add(stored);

            beforeBalanceIncrement(stored);

            long balance = Optional.ofNullable(currentBalance).orElse(0L);
            long newBalance = balance + stored.pointsAwarded();
            long newLifetime = lifetimePoints.getOrDefault(stored.submitterId(), balance) + stored.pointsAwarded();
            Map<String, Long> stagedBalances = new HashMap<>(balances);
            stagedBalances.put(stored.submitterId(), newBalance);
            Map<String, Long> stagedLifetime = new HashMap<>(lifetimePoints);
            stagedLifetime.put(stored.submitterId(), newLifetime);

            entries = List.copyOf(stagedEntries);
            balances = Map.copyOf(stagedBalances);
            lifetimePoints = Map.copyOf(stagedLifetime);
            return new RecordedAward(stored, newBalance, newLifetime);
        } catch (RuntimeException ex) {
            LOGGER.error("Award for {} rolled back", entry.submitterId(), ex);
            throw new AwardFailedException("Award transaction rolled back", ex);
        }
    }

    /**
     * Runs after the ledger entry is staged and before the balance is incremented.
     */
    protected void beforeBalanceIncrement(LedgerEntry staged) {
    }

    public synchronized List<LedgerEntry> entries() {
        return entries;
    }

    public synchronized Optional<Long> balanceOf(String submitterId) {
        return Optional.ofNullable(balances.get(submitterId));
    }

    public synchronized Optional<Long> lifetimePointsOf(String submitterId) {
        return Optional.ofNullable(lifetimePoints.get(submitterId));
    }
}
