package dev.pekelund.loyalty.submission;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Populates mapped diagnostic context (MDC) entries so every log line written while a submission runs
 * carries the same identifiers (submission id, submitter, stage).
 */
public final class ReceiptSubmissionMdc {

    static final String KEY_SUBMISSION_ID = "receipt.submissionId";
    static final String KEY_SUBMITTER_ID = "receipt.submitterId";
    static final String KEY_STAGE = "receipt.stage";

    private ReceiptSubmissionMdc() {
        // Utility class
    }

    public static Context open(String submissionId, String submitterId) {
        return new Context(submissionId, submitterId);
    }

    static void setStage(SubmissionStage stage) {
        if (stage == null) {
            MDC.remove(KEY_STAGE);
        } else {
            MDC.put(KEY_STAGE, stage.name());
        }
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    public static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String submissionId, String submitterId) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_SUBMISSION_ID, submissionId);
            putIfHasText(KEY_SUBMITTER_ID, submitterId);
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
