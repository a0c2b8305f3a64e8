package dev.pekelund.loyalty.scanner.local;

import dev.pekelund.loyalty.ledger.InMemoryReceiptLedgerStore;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Keeps the ledger in memory for the {@code local} profile so the service runs without Firestore.
 * Unknown submitters get an account on their first accepted receipt.
 */
@Configuration
@Profile("local")
public class LocalReceiptScannerConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalReceiptScannerConfiguration.class);

    @Bean
    public InMemoryReceiptLedgerStore inMemoryReceiptLedgerStore(Clock receiptClock) {
        LOGGER.info("Using in-memory receipt ledger; awards are lost on restart");
        return new InMemoryReceiptLedgerStore(receiptClock, true);
    }
}
