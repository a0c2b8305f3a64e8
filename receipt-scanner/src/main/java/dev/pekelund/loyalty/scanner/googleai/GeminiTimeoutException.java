package dev.pekelund.loyalty.scanner.googleai;

/**
 * Gemini did not answer within the configured read timeout.
 */
public class GeminiTimeoutException extends GeminiRequestException {

    public GeminiTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
