package dev.pekelund.loyalty.receipts.extraction;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the same receipt twice, independently and concurrently, and only trusts the result when both
 * reads agree on every field.
 */
public class ConsensusValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConsensusValidator.class);

    private final ReceiptFieldExtractor extractor;
    private final Executor executor;
    private final Duration timeout;

    public ConsensusValidator(ReceiptFieldExtractor extractor, Executor executor, Duration timeout) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public ConsensusResult validateByConsensus(byte[] imageBytes) {
        CompletableFuture<ExtractionResult> first = sample(imageBytes, 1);
        CompletableFuture<ExtractionResult> second = sample(imageBytes, 2);

        ExtractionResult firstResult = first.join();
        ExtractionResult secondResult = second.join();

        if (!firstResult.isSuccess() || !secondResult.isSuccess()) {
            ExtractionError error = preferredError(firstResult.error(), secondResult.error());
            LOGGER.info("Consensus extraction failed upstream with {} (sample errors: {} / {})", error,
                firstResult.error(), secondResult.error());
            return ConsensusResult.upstream(error);
        }

        if (!firstResult.fields().agreesWith(secondResult.fields())) {
            LOGGER.warn("Consensus mismatch between extraction samples: {} vs {}", firstResult.fields(),
                secondResult.fields());
            return ConsensusResult.mismatched();
        }

        LOGGER.info("Both extraction samples agreed on order number {}", firstResult.fields().orderNumber());
        return ConsensusResult.agreed(firstResult.fields());
    }

    private CompletableFuture<ExtractionResult> sample(byte[] imageBytes, int sampleNumber) {
        CompletableFuture<ExtractionResult> call;
        try {
            call = CompletableFuture.supplyAsync(() -> extractor.extract(imageBytes), executor);
        } catch (RejectedExecutionException ex) {
            LOGGER.warn("Extraction sample {} rejected by the executor: {}", sampleNumber, ex.getMessage());
            return CompletableFuture.completedFuture(
                ExtractionResult.failure(ExtractionError.SERVICE_ERROR, "Extraction capacity exhausted"));
        }
        return call.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .exceptionally(ex -> toFailure(ex, sampleNumber));
    }

    private ExtractionResult toFailure(Throwable ex, int sampleNumber) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof TimeoutException) {
            LOGGER.warn("Extraction sample {} exceeded {} ms", sampleNumber, timeout.toMillis());
            return ExtractionResult.failure(ExtractionError.TIMEOUT, "Timed out after " + timeout);
        }
        LOGGER.error("Extraction sample {} failed unexpectedly", sampleNumber, cause);
        return ExtractionResult.failure(ExtractionError.SERVICE_ERROR, cause.getMessage());
    }

    /**
     * A failure that describes the receipt wins over a transport failure; otherwise the first sample's
     * error is reported.
     */
    static ExtractionError preferredError(ExtractionError first, ExtractionError second) {
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        if (!first.isSemantic() && second.isSemantic()) {
            return second;
        }
        return first;
    }
}
