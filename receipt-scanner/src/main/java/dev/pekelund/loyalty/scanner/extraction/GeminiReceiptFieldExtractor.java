package dev.pekelund.loyalty.scanner.extraction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.loyalty.receipts.ReceiptFields;
import dev.pekelund.loyalty.receipts.extraction.ExtractionError;
import dev.pekelund.loyalty.receipts.extraction.ExtractionResult;
import dev.pekelund.loyalty.receipts.extraction.ReceiptFieldExtractor;
import dev.pekelund.loyalty.scanner.googleai.GeminiTimeoutException;
import dev.pekelund.loyalty.scanner.googleai.GoogleAiGeminiChatOptions;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.util.StringUtils;

/**
 * Reads the four receipt fields from a photo with a Gemini vision model. The instruction is fixed for the
 * deployment; only the image varies between calls.
 */
public class GeminiReceiptFieldExtractor implements ReceiptFieldExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiReceiptFieldExtractor.class);

    /** Upper bound given to the model; the sanity checker applies a tighter one. */
    static final int PROMPT_MAX_ORDER_NUMBER = 400;

    private static final Map<String, ExtractionError> ERROR_CODES = Map.of(
        "NOT_THIS_VENDOR", ExtractionError.NOT_THIS_VENDOR,
        "OBSTRUCTED", ExtractionError.OBSTRUCTED,
        "ILLEGIBLE", ExtractionError.ILLEGIBLE,
        "NO_VALID_ORDER_NUMBER", ExtractionError.NO_VALID_ORDER_NUMBER);

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final GoogleAiGeminiChatOptions chatOptions;
    private final String instruction;

    public GeminiReceiptFieldExtractor(ChatModel chatModel, ObjectMapper objectMapper,
        GoogleAiGeminiChatOptions chatOptions, String vendorName, String orderNumberAnchor) {

        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.chatOptions = chatOptions;
        this.instruction = buildInstruction(vendorName, orderNumberAnchor);
    }

    @Override
    public ExtractionResult extract(byte[] imageBytes) {
        ReceiptImageType imageType = ReceiptImageType.detect(imageBytes);
        UserMessage message = UserMessage.builder()
            .text(instruction)
            .media(List.of(new Media(imageType.mimeType(), new ByteArrayResource(imageBytes))))
            .build();

        String response;
        try {
            ChatResponse chatResponse = chatModel.call(new Prompt(List.of(message), chatOptions));
            response = chatResponse.getResult().getOutput().getText();
        } catch (GeminiTimeoutException ex) {
            LOGGER.warn("Gemini did not answer in time", ex);
            return ExtractionResult.failure(ExtractionError.TIMEOUT, ex.getMessage());
        } catch (RuntimeException ex) {
            LOGGER.error("Gemini extraction call failed", ex);
            return ExtractionResult.failure(ExtractionError.SERVICE_ERROR, ex.getMessage());
        }

        LOGGER.debug("Gemini raw response: {}", response);
        return interpret(response);
    }

    ExtractionResult interpret(String response) {
        if (!StringUtils.hasText(response)) {
            return ExtractionResult.failure(ExtractionError.MALFORMED, "Empty response");
        }
        String json = outermostObject(sanitiseResponse(response));
        if (json == null) {
            LOGGER.warn("No JSON object found in Gemini response");
            return ExtractionResult.failure(ExtractionError.MALFORMED, "No JSON object in response");
        }

        ExtractedReceipt payload;
        try {
            payload = objectMapper.readValue(json, ExtractedReceipt.class);
        } catch (JsonProcessingException ex) {
            LOGGER.warn("Failed to parse Gemini response: {}", ex.getOriginalMessage());
            return ExtractionResult.failure(ExtractionError.MALFORMED, ex.getOriginalMessage());
        }

        if (StringUtils.hasText(payload.error())) {
            String code = payload.error().trim().toUpperCase(Locale.ROOT);
            ExtractionError error = ERROR_CODES.getOrDefault(code, ExtractionError.ILLEGIBLE);
            LOGGER.info("Gemini declined the receipt with '{}' ({})", payload.error(), error);
            return ExtractionResult.failure(error, payload.error());
        }
        if (!StringUtils.hasText(payload.orderNumber())) {
            return ExtractionResult.failure(ExtractionError.NO_VALID_ORDER_NUMBER, "orderNumber missing");
        }
        if (!StringUtils.hasText(payload.orderTotal()) || !StringUtils.hasText(payload.orderDate())
            || !StringUtils.hasText(payload.orderTime())) {
            return ExtractionResult.failure(ExtractionError.MALFORMED, "Missing receipt field in " + json);
        }

        BigDecimal total;
        try {
            total = new BigDecimal(payload.orderTotal().trim().replace("$", "").replace(",", ""));
        } catch (NumberFormatException ex) {
            return ExtractionResult.failure(ExtractionError.MALFORMED, "Unreadable total " + payload.orderTotal());
        }

        return ExtractionResult.success(new ReceiptFields(payload.orderNumber().trim(), total,
            payload.orderDate().trim(), payload.orderTime().trim()));
    }

    private String sanitiseResponse(String response) {
        String trimmed = response.trim();
        if (trimmed.startsWith("```") && trimmed.endsWith("```") && trimmed.length() >= 6) {
            int firstBreak = trimmed.indexOf('\n');
            if (firstBreak > 0) {
                trimmed = trimmed.substring(firstBreak + 1, trimmed.length() - 3).trim();
            } else {
                trimmed = trimmed.substring(3, trimmed.length() - 3).trim();
            }
        }
        return trimmed;
    }

    private static String outermostObject(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return text.substring(start, end + 1);
    }

    static String buildInstruction(String vendorName, String orderNumberAnchor) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You read customer receipts from ").append(vendorName).append(".\n");
        prompt.append("First check that the heading \"").append(vendorName)
            .append("\" is visible on the receipt. If it is not, answer {\"error\": \"NOT_THIS_VENDOR\"}.\n");
        prompt.append("If any number or text on the receipt appears covered, cut off or hidden, answer ")
            .append("{\"error\": \"OBSTRUCTED\"}.\n");
        prompt.append("If the photo is too blurry or faded to read any field with confidence, answer ")
            .append("{\"error\": \"ILLEGIBLE\"}. Never guess a value.\n");
        prompt.append("The order number is the number printed immediately beneath the words \"")
            .append(orderNumberAnchor).append("\". On receipts where a black box with white text sits beneath \"")
            .append(orderNumberAnchor).append("\", the order number is the larger number inside that box; ")
            .append("ignore the smaller number printed elsewhere on that receipt.\n");
        prompt.append("The order number has at most 3 digits and is never greater than ")
            .append(PROMPT_MAX_ORDER_NUMBER).append(". If no such number is visible, answer ")
            .append("{\"error\": \"NO_VALID_ORDER_NUMBER\"}.\n");
        prompt.append("Write the date as MM/DD without the year. The time is printed on the same line as the date, ")
            .append("to its right; write it as HH:MM in 24-hour time.\n");
        prompt.append("Otherwise answer with exactly these fields:\n");
        prompt.append("{\"orderNumber\": \"string, digits as printed\", \"orderTotal\": number with two decimals, ")
            .append("\"orderDate\": \"MM/DD\", \"orderTime\": \"HH:MM\"}\n");
        prompt.append("Return only the JSON object, without code fences or commentary.");
        return prompt.toString();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExtractedReceipt(String orderNumber, String orderTotal, String orderDate, String orderTime, String error) {
    }
}
