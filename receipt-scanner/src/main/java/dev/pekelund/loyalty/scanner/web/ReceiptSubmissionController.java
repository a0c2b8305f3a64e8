package dev.pekelund.loyalty.scanner.web;

import dev.pekelund.loyalty.scanner.ReceiptScanProperties;
import dev.pekelund.loyalty.submission.ReceiptSubmissionPipeline;
import dev.pekelund.loyalty.submission.RejectionReason;
import dev.pekelund.loyalty.submission.SubmissionOutcome;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Receives receipt photos from the app. The submitter id is set by the authenticating gateway in front of
 * this service.
 */
@RestController
public class ReceiptSubmissionController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptSubmissionController.class);

    static final String SUBMITTER_HEADER = "X-Submitter-Id";
    static final String RETRY_AFTER_SECONDS = "30";

    private final ReceiptSubmissionPipeline pipeline;
    private final ReceiptScanProperties properties;

    public ReceiptSubmissionController(ReceiptSubmissionPipeline pipeline, ReceiptScanProperties properties) {
        this.pipeline = pipeline;
        this.properties = properties;
    }

    @PostMapping(path = "/submit-receipt", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SubmissionResponse> submitReceipt(
        @RequestHeader(value = SUBMITTER_HEADER, required = false) String submitterId,
        @RequestParam(value = "image", required = false) MultipartFile image) {

        if (!StringUtils.hasText(submitterId)) {
            LOGGER.warn("Receipt submission without {} header", SUBMITTER_HEADER);
            return badRequest(HttpStatus.BAD_REQUEST, "SUBMITTER_REQUIRED", "Please sign in to scan receipts.");
        }
        if (submitterId.contains("/")) {
            LOGGER.warn("Receipt submission with malformed {} header", SUBMITTER_HEADER);
            return badRequest(HttpStatus.BAD_REQUEST, "SUBMITTER_INVALID", "Please sign in again to scan receipts.");
        }
        if (image == null || image.isEmpty()) {
            return badRequest(HttpStatus.BAD_REQUEST, "NO_IMAGE", "No receipt photo was attached.");
        }
        if (image.getSize() > properties.getMaxImageSize().toBytes()) {
            LOGGER.info("Rejecting {} byte receipt image from {}", image.getSize(), submitterId);
            return ReceiptUploadExceptionHandler.imageTooLarge(properties);
        }

        byte[] imageBytes;
        try {
            imageBytes = image.getBytes();
        } catch (IOException ex) {
            LOGGER.warn("Could not read uploaded receipt image", ex);
            return badRequest(HttpStatus.BAD_REQUEST, "NO_IMAGE", "The receipt photo could not be read.");
        }

        SubmissionOutcome outcome = pipeline.submitReceipt(submitterId.trim(), imageBytes);
        return toResponse(outcome);
    }

    private ResponseEntity<SubmissionResponse> toResponse(SubmissionOutcome outcome) {
        SubmissionResponse body = SubmissionResponse.from(outcome);
        if (outcome.accepted()) {
            return ResponseEntity.ok(body);
        }
        switch (outcome.reason()) {
            case DUPLICATE:
                return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
            case DAILY_LIMIT_REACHED:
                return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(body);
            case TRANSIENT_UNAVAILABLE:
                ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE);
                if (outcome.retryable()) {
                    builder.header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
                }
                return builder.body(body);
            case BAD_REQUEST:
                return ResponseEntity.badRequest().body(body);
            default:
                return ResponseEntity.unprocessableEntity().body(body);
        }
    }

    private static ResponseEntity<SubmissionResponse> badRequest(HttpStatus status, String errorCode, String message) {
        return ResponseEntity.status(status)
            .body(SubmissionResponse.rejected(RejectionReason.BAD_REQUEST, errorCode, message, false));
    }
}
