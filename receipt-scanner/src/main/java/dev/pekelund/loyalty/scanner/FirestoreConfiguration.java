package dev.pekelund.loyalty.scanner;

import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import dev.pekelund.loyalty.scanner.firestore.FirestoreReceiptLedgerStore;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.util.StringUtils;

/**
 * Firestore-backed ledger for the Cloud Run deployment.
 */
@Configuration
@Profile("!local")
public class FirestoreConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreConfiguration.class);

    @Bean
    public ReceiptScannerSettings receiptScannerSettings() {
        return ReceiptScannerSettings.fromEnvironment();
    }

    @Bean
    public Firestore firestore(ReceiptScannerSettings receiptScannerSettings) {
        FirestoreOptions.Builder optionsBuilder = FirestoreOptions.getDefaultInstance().toBuilder();
        if (StringUtils.hasText(receiptScannerSettings.projectId())) {
            optionsBuilder.setProjectId(receiptScannerSettings.projectId());
        }
        if (StringUtils.hasText(receiptScannerSettings.databaseId())) {
            optionsBuilder.setDatabaseId(receiptScannerSettings.databaseId());
        }
        Firestore firestore = optionsBuilder.build().getService();
        LOGGER.info("Initialized Firestore client for project '{}' database '{}' (ledger collection '{}')",
            firestore.getOptions().getProjectId(), receiptScannerSettings.databaseId(),
            receiptScannerSettings.ledgerCollection());
        return firestore;
    }

    @Bean
    public FirestoreReceiptLedgerStore firestoreReceiptLedgerStore(Firestore firestore,
        ReceiptScannerSettings receiptScannerSettings, Clock receiptClock) {

        return new FirestoreReceiptLedgerStore(firestore, receiptScannerSettings.ledgerCollection(),
            receiptScannerSettings.usersCollection(), receiptScannerSettings.pointsTransactionsCollection(),
            receiptClock);
    }
}
