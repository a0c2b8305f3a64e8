package dev.pekelund.loyalty.scanner;

import com.google.cloud.ServiceOptions;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.springframework.util.StringUtils;

/**
 * Firestore location of the loyalty ledger, resolved from the environment of the Cloud Run service.
 */
public record ReceiptScannerSettings(
    String projectId,
    String databaseId,
    String ledgerCollection,
    String usersCollection,
    String pointsTransactionsCollection
) {

    static final String DEFAULT_DATABASE_ID = "receipts-db";
    static final String DEFAULT_LEDGER_COLLECTION = "receiptLedger";
    static final String DEFAULT_USERS_COLLECTION = "users";
    static final String DEFAULT_POINTS_TRANSACTIONS_COLLECTION = "pointsTransactions";

    private static final String DEFAULT_LOCAL_PROJECT_ID = "loyalty-local";

    public static ReceiptScannerSettings fromEnvironment() {
        return fromEnvironment(System.getenv(), ServiceOptions::getDefaultProjectId);
    }

    static ReceiptScannerSettings fromEnvironment(Map<String, String> env, Supplier<String> defaultProjectSupplier) {
        Objects.requireNonNull(env, "env");
        Objects.requireNonNull(defaultProjectSupplier, "defaultProjectSupplier");

        String projectId = firstNonEmpty(
            env.get("PROJECT_ID"),
            env.get("FIRESTORE_PROJECT_ID"),
            env.get("GOOGLE_CLOUD_PROJECT"),
            env.get("GCLOUD_PROJECT"),
            env.get("GCP_PROJECT"),
            defaultProjectSupplier.get());
        String databaseId = firstNonEmpty(
            env.get("FIRESTORE_DATABASE_ID"),
            env.get("FIRESTORE_DATABASE_NAME"),
            DEFAULT_DATABASE_ID);

        String localProjectId = env.getOrDefault("LOCAL_PROJECT_ID", DEFAULT_LOCAL_PROJECT_ID);
        if (StringUtils.hasText(localProjectId) && localProjectId.equals(projectId) && isRunningOnCloudRun(env)) {
            throw new IllegalStateException(String.format("Firestore project id resolved to local project '%s' while"
                + " running on Cloud Run. Update the deployment environment to use the production project id.",
                projectId));
        }
        if (!StringUtils.hasText(projectId)) {
            throw new IllegalStateException("Firestore project id must be configured via PROJECT_ID "
                + "or available from the Cloud environment.");
        }

        return new ReceiptScannerSettings(projectId, databaseId,
            env.getOrDefault("LOYALTY_LEDGER_COLLECTION", DEFAULT_LEDGER_COLLECTION),
            env.getOrDefault("LOYALTY_USERS_COLLECTION", DEFAULT_USERS_COLLECTION),
            env.getOrDefault("LOYALTY_POINTS_TRANSACTIONS_COLLECTION", DEFAULT_POINTS_TRANSACTIONS_COLLECTION));
    }

    private static boolean isRunningOnCloudRun(Map<String, String> env) {
        return StringUtils.hasText(env.get("K_SERVICE"));
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }
}
