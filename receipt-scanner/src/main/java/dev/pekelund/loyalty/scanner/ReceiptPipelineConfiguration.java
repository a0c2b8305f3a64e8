package dev.pekelund.loyalty.scanner;

import dev.pekelund.loyalty.ledger.AwardRecorder;
import dev.pekelund.loyalty.ledger.DailyReceiptLimit;
import dev.pekelund.loyalty.ledger.DuplicateLedger;
import dev.pekelund.loyalty.ledger.ReceiptLedgerStore;
import dev.pekelund.loyalty.receipts.extraction.ConsensusValidator;
import dev.pekelund.loyalty.receipts.extraction.ReceiptFieldExtractor;
import dev.pekelund.loyalty.receipts.validation.FieldSanityChecker;
import dev.pekelund.loyalty.submission.ReceiptSubmissionPipeline;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Assembles the submission pipeline from the extractor and ledger store beans of the active profile.
 */
@Configuration
public class ReceiptPipelineConfiguration {

    @Bean
    public Clock receiptClock(ReceiptScanProperties receiptScanProperties) {
        return Clock.system(receiptScanProperties.getZoneId());
    }

    @Bean
    public ThreadPoolTaskExecutor receiptExtractionExecutor(ReceiptScanProperties receiptScanProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(receiptScanProperties.getExtractionPoolSize());
        executor.setMaxPoolSize(receiptScanProperties.getExtractionPoolSize());
        executor.setQueueCapacity(receiptScanProperties.getExtractionPoolSize() * 4);
        executor.setThreadNamePrefix("receipt-extract-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        return executor;
    }

    @Bean
    public ConsensusValidator consensusValidator(ReceiptFieldExtractor receiptFieldExtractor,
        ThreadPoolTaskExecutor receiptExtractionExecutor, ReceiptScanProperties receiptScanProperties) {

        return new ConsensusValidator(receiptFieldExtractor, receiptExtractionExecutor,
            receiptScanProperties.getExtractionTimeout());
    }

    @Bean
    public FieldSanityChecker fieldSanityChecker() {
        return new FieldSanityChecker();
    }

    @Bean
    public DuplicateLedger duplicateLedger(ReceiptLedgerStore receiptLedgerStore) {
        return new DuplicateLedger(receiptLedgerStore);
    }

    @Bean
    public DailyReceiptLimit dailyReceiptLimit(ReceiptLedgerStore receiptLedgerStore,
        ReceiptScanProperties receiptScanProperties) {

        return new DailyReceiptLimit(receiptLedgerStore, receiptScanProperties.getDailyReceiptLimit());
    }

    @Bean
    public AwardRecorder awardRecorder(ReceiptLedgerStore receiptLedgerStore) {
        return new AwardRecorder(receiptLedgerStore);
    }

    @Bean
    public ReceiptSubmissionPipeline receiptSubmissionPipeline(ConsensusValidator consensusValidator,
        FieldSanityChecker fieldSanityChecker, DuplicateLedger duplicateLedger, DailyReceiptLimit dailyReceiptLimit,
        AwardRecorder awardRecorder, Clock receiptClock) {

        return new ReceiptSubmissionPipeline(consensusValidator, fieldSanityChecker, duplicateLedger,
            dailyReceiptLimit, awardRecorder, receiptClock);
    }
}
