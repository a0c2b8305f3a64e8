package dev.pekelund.loyalty.submission;

import dev.pekelund.loyalty.ledger.AwardFailedException;
import dev.pekelund.loyalty.ledger.AwardOutcome;
import dev.pekelund.loyalty.ledger.AwardRecorder;
import dev.pekelund.loyalty.ledger.DailyReceiptLimit;
import dev.pekelund.loyalty.ledger.DuplicateLedger;
import dev.pekelund.loyalty.ledger.LedgerUnavailableException;
import dev.pekelund.loyalty.receipts.ReceiptFields;
import dev.pekelund.loyalty.receipts.ValidatedReceipt;
import dev.pekelund.loyalty.receipts.extraction.ConsensusResult;
import dev.pekelund.loyalty.receipts.extraction.ConsensusValidator;
import dev.pekelund.loyalty.receipts.extraction.ExtractionError;
import dev.pekelund.loyalty.receipts.validation.FieldSanityChecker;
import dev.pekelund.loyalty.receipts.validation.ValidationError;
import dev.pekelund.loyalty.receipts.validation.ValidationResult;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one receipt submission through consensus extraction, sanity checks, the duplicate check, the daily
 * limit and the award, in that order, stopping at the first failure. This is the only place where stage failures are
 * translated into the caller-facing {@link RejectionReason}s.
 *
 * <p>Only the award stage writes anything, so a submission abandoned before it needs no cleanup. Nothing is
 * retried here; a caller holding a retryable rejection submits the same image again as a new run.
 */
public class ReceiptSubmissionPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptSubmissionPipeline.class);

    static final String MISMATCH_CODE = "DOUBLE_PARSE_MISMATCH";
    static final String MISMATCH_MESSAGE = "The receipt is unclear. Please take a clearer photo.";
    static final String DUPLICATE_CODE = "DUPLICATE_RECEIPT";
    static final String DUPLICATE_MESSAGE = "This receipt has already been submitted.";
    static final String DAILY_LIMIT_CODE = "DAILY_RECEIPT_LIMIT_REACHED";
    static final String DAILY_LIMIT_MESSAGE = "You have reached today's receipt limit. Please try again tomorrow.";
    static final String LEDGER_UNAVAILABLE_CODE = "SERVER_LEDGER_UNAVAILABLE";
    static final String TRANSIENT_MESSAGE = "We could not process your receipt right now. Please try again.";

    private final ConsensusValidator consensusValidator;
    private final FieldSanityChecker sanityChecker;
    private final DuplicateLedger duplicateLedger;
    private final DailyReceiptLimit dailyReceiptLimit;
    private final AwardRecorder awardRecorder;
    private final Clock clock;

    public ReceiptSubmissionPipeline(ConsensusValidator consensusValidator, FieldSanityChecker sanityChecker,
        DuplicateLedger duplicateLedger, DailyReceiptLimit dailyReceiptLimit, AwardRecorder awardRecorder,
        Clock clock) {

        this.consensusValidator = Objects.requireNonNull(consensusValidator, "consensusValidator");
        this.sanityChecker = Objects.requireNonNull(sanityChecker, "sanityChecker");
        this.duplicateLedger = Objects.requireNonNull(duplicateLedger, "duplicateLedger");
        this.dailyReceiptLimit = Objects.requireNonNull(dailyReceiptLimit, "dailyReceiptLimit");
        this.awardRecorder = Objects.requireNonNull(awardRecorder, "awardRecorder");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SubmissionOutcome submitReceipt(String submitterId, byte[] imageBytes) {
        String submissionId = UUID.randomUUID().toString();
        try (ReceiptSubmissionMdc.Context ignored = ReceiptSubmissionMdc.open(submissionId, submitterId)) {
            ReceiptSubmissionMdc.setStage(SubmissionStage.START);
            LOGGER.info("Receipt submission started ({} image bytes)", imageBytes.length);
            SubmissionOutcome outcome = run(submitterId, imageBytes);
            ReceiptSubmissionMdc.setStage(outcome.accepted() ? SubmissionStage.ACCEPTED : SubmissionStage.REJECTED);
            if (outcome.accepted()) {
                LOGGER.info("Receipt accepted: {} points, new balance {}", outcome.award().pointsAwarded(),
                    outcome.award().newBalance());
            } else {
                LOGGER.info("Receipt rejected: {} ({})", outcome.reason(), outcome.errorCode());
            }
            return outcome;
        }
    }

    private SubmissionOutcome run(String submitterId, byte[] imageBytes) {
        ReceiptSubmissionMdc.setStage(SubmissionStage.EXTRACTING);
        ConsensusResult consensus = consensusValidator.validateByConsensus(imageBytes);
        if (!consensus.isAgreed()) {
            return unclear(consensus);
        }
        ReceiptFields fields = consensus.fields();

        ReceiptSubmissionMdc.setStage(SubmissionStage.VALIDATING);
        ZonedDateTime now = ZonedDateTime.now(clock);
        ValidationResult validation = sanityChecker.validate(fields, now);
        if (!validation.isValid()) {
            ValidationError error = validation.error();
            LOGGER.info("Receipt fields {} failed check {}", fields, error);
            return SubmissionOutcome.rejected(RejectionReason.INVALID_FORMAT, error.errorCode(), error.message(),
                false, fields);
        }
        ValidatedReceipt receipt = validation.receipt();

        ReceiptSubmissionMdc.setStage(SubmissionStage.CHECKING_DUPLICATE);
        try {
            if (duplicateLedger.isDuplicate(receipt)) {
                return SubmissionOutcome.rejected(RejectionReason.DUPLICATE, DUPLICATE_CODE, DUPLICATE_MESSAGE,
                    false, fields);
            }
        } catch (LedgerUnavailableException ex) {
            LOGGER.error("Duplicate check unavailable; receipt neither accepted nor rejected as duplicate", ex);
            return ledgerUnavailable(fields);
        }

        ReceiptSubmissionMdc.setStage(SubmissionStage.CHECKING_DAILY_LIMIT);
        try {
            if (dailyReceiptLimit.isReached(submitterId, now.toLocalDate())) {
                return SubmissionOutcome.rejected(RejectionReason.DAILY_LIMIT_REACHED, DAILY_LIMIT_CODE,
                    DAILY_LIMIT_MESSAGE, false, fields);
            }
        } catch (LedgerUnavailableException ex) {
            LOGGER.error("Daily receipt count unavailable", ex);
            return ledgerUnavailable(fields);
        }

        ReceiptSubmissionMdc.setStage(SubmissionStage.AWARDING);
        try {
            AwardOutcome award = awardRecorder.recordAndAward(submitterId, receipt);
            return SubmissionOutcome.accepted(award, fields);
        } catch (AwardFailedException ex) {
            LOGGER.error("Award failed with {}", ex.getErrorCode(), ex);
            return SubmissionOutcome.rejected(RejectionReason.TRANSIENT_UNAVAILABLE, ex.getErrorCode(),
                TRANSIENT_MESSAGE, ex.isRetryable(), fields);
        }
    }

    private static SubmissionOutcome ledgerUnavailable(ReceiptFields fields) {
        return SubmissionOutcome.rejected(RejectionReason.TRANSIENT_UNAVAILABLE, LEDGER_UNAVAILABLE_CODE,
            TRANSIENT_MESSAGE, true, fields);
    }

    private SubmissionOutcome unclear(ConsensusResult consensus) {
        if (consensus.mismatch()) {
            return SubmissionOutcome.rejected(RejectionReason.UNCLEAR, MISMATCH_CODE, MISMATCH_MESSAGE, false,
                null);
        }
        ExtractionError error = consensus.upstreamError();
        return SubmissionOutcome.rejected(RejectionReason.UNCLEAR, error.errorCode(), error.message(),
            !error.isSemantic(), null);
    }
}
