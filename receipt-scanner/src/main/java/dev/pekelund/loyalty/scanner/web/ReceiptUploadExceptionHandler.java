package dev.pekelund.loyalty.scanner.web;

import dev.pekelund.loyalty.scanner.ReceiptScanProperties;
import dev.pekelund.loyalty.submission.RejectionReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/**
 * Answers uploads rejected while the multipart request is parsed, before any controller is selected.
 */
@RestControllerAdvice
public class ReceiptUploadExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptUploadExceptionHandler.class);

    static final String IMAGE_TOO_LARGE_CODE = "IMAGE_TOO_LARGE";

    private final ReceiptScanProperties properties;

    public ReceiptUploadExceptionHandler(ReceiptScanProperties properties) {
        this.properties = properties;
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<SubmissionResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        LOGGER.info("Multipart upload exceeded the container limit: {}", ex.getMessage());
        return imageTooLarge(properties);
    }

    static ResponseEntity<SubmissionResponse> imageTooLarge(ReceiptScanProperties properties) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
            .body(SubmissionResponse.rejected(RejectionReason.BAD_REQUEST, IMAGE_TOO_LARGE_CODE,
                "The receipt photo is larger than " + properties.getMaxImageSize().toMegabytes() + " MB.", false));
    }
}
