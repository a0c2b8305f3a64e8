package dev.pekelund.loyalty.receipts.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.pekelund.loyalty.receipts.ReceiptFields;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConsensusValidatorTest {

    private static final byte[] IMAGE = new byte[] {1, 2, 3};
    private static final ReceiptFields FIELDS = new ReceiptFields("42", new BigDecimal("23.45"), "06/15", "12:30");

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void agreesWhenBothSamplesMatch() {
        ReceiptFieldExtractor extractor = mock(ReceiptFieldExtractor.class);
        when(extractor.extract(any())).thenReturn(ExtractionResult.success(FIELDS));

        ConsensusResult result = validator(extractor, Duration.ofSeconds(5)).validateByConsensus(IMAGE);

        assertThat(result.isAgreed()).isTrue();
        assertThat(result.fields()).isEqualTo(FIELDS);
        verify(extractor, times(2)).extract(IMAGE);
    }

    @Test
    void totalsAreComparedByValue() {
        ReceiptFields differentScale = new ReceiptFields("42", new BigDecimal("23.450"), "06/15", "12:30");
        ReceiptFieldExtractor extractor = mock(ReceiptFieldExtractor.class);
        when(extractor.extract(any()))
            .thenReturn(ExtractionResult.success(FIELDS), ExtractionResult.success(differentScale));

        assertThat(validator(extractor, Duration.ofSeconds(5)).validateByConsensus(IMAGE).isAgreed()).isTrue();
    }

    @Test
    void anyDifferingFieldIsAMismatch() {
        ReceiptFields otherTime = new ReceiptFields("42", new BigDecimal("23.45"), "06/15", "12:31");
        ReceiptFieldExtractor extractor = mock(ReceiptFieldExtractor.class);
        when(extractor.extract(any())).thenReturn(ExtractionResult.success(FIELDS), ExtractionResult.success(otherTime));

        ConsensusResult result = validator(extractor, Duration.ofSeconds(5)).validateByConsensus(IMAGE);

        assertThat(result.isAgreed()).isFalse();
        assertThat(result.mismatch()).isTrue();
        assertThat(result.fields()).isNull();
    }

    @Test
    void propagatesUpstreamErrorWithoutComparing() {
        ReceiptFieldExtractor extractor = mock(ReceiptFieldExtractor.class);
        when(extractor.extract(any())).thenReturn(ExtractionResult.success(FIELDS),
            ExtractionResult.failure(ExtractionError.NOT_THIS_VENDOR, "other store"));

        ConsensusResult result = validator(extractor, Duration.ofSeconds(5)).validateByConsensus(IMAGE);

        assertThat(result.mismatch()).isFalse();
        assertThat(result.upstreamError()).isEqualTo(ExtractionError.NOT_THIS_VENDOR);
    }

    @Test
    void thrownExceptionBecomesServiceError() {
        ReceiptFieldExtractor extractor = mock(ReceiptFieldExtractor.class);
        when(extractor.extract(any())).thenThrow(new IllegalStateException("boom"));

        ConsensusResult result = validator(extractor, Duration.ofSeconds(5)).validateByConsensus(IMAGE);

        assertThat(result.upstreamError()).isEqualTo(ExtractionError.SERVICE_ERROR);
    }

    @Test
    void slowSampleTimesOut() {
        CountDownLatch release = new CountDownLatch(1);
        ReceiptFieldExtractor extractor = image -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return ExtractionResult.success(FIELDS);
        };

        ConsensusResult result = validator(extractor, Duration.ofMillis(100)).validateByConsensus(IMAGE);
        release.countDown();

        assertThat(result.upstreamError()).isEqualTo(ExtractionError.TIMEOUT);
    }

    @Test
    void samplesRunConcurrently() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        AtomicInteger overlapping = new AtomicInteger();
        ReceiptFieldExtractor extractor = image -> {
            bothStarted.countDown();
            try {
                if (bothStarted.await(2, TimeUnit.SECONDS)) {
                    overlapping.incrementAndGet();
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return ExtractionResult.success(FIELDS);
        };

        ConsensusResult result = validator(extractor, Duration.ofSeconds(5)).validateByConsensus(IMAGE);

        assertThat(result.isAgreed()).isTrue();
        assertThat(overlapping).hasValue(2);
    }

    @Test
    void rejectedSampleBecomesServiceErrorAfterTheOtherFinishes() {
        ReceiptFieldExtractor extractor = mock(ReceiptFieldExtractor.class);
        when(extractor.extract(any())).thenReturn(ExtractionResult.success(FIELDS));
        AtomicInteger submitted = new AtomicInteger();
        Executor acceptsOnlyOne = task -> {
            if (submitted.incrementAndGet() > 1) {
                throw new RejectedExecutionException("queue full");
            }
            task.run();
        };

        ConsensusResult result = new ConsensusValidator(extractor, acceptsOnlyOne, Duration.ofSeconds(5))
            .validateByConsensus(IMAGE);

        assertThat(result.upstreamError()).isEqualTo(ExtractionError.SERVICE_ERROR);
        verify(extractor, times(1)).extract(IMAGE);
    }

    @Test
    void semanticErrorWinsOverTransportError() {
        assertThat(ConsensusValidator.preferredError(ExtractionError.TIMEOUT, ExtractionError.ILLEGIBLE))
            .isEqualTo(ExtractionError.ILLEGIBLE);
        assertThat(ConsensusValidator.preferredError(ExtractionError.OBSTRUCTED, ExtractionError.ILLEGIBLE))
            .isEqualTo(ExtractionError.OBSTRUCTED);
        assertThat(ConsensusValidator.preferredError(null, ExtractionError.SERVICE_ERROR))
            .isEqualTo(ExtractionError.SERVICE_ERROR);
    }

    private ConsensusValidator validator(ReceiptFieldExtractor extractor, Duration timeout) {
        return new ConsensusValidator(extractor, executor, timeout);
    }
}
