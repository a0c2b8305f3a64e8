package dev.pekelund.loyalty.scanner.googleai;

/**
 * The Gemini call failed or returned nothing usable.
 */
public class GeminiRequestException extends RuntimeException {

    public GeminiRequestException(String message) {
        super(message);
    }

    public GeminiRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
