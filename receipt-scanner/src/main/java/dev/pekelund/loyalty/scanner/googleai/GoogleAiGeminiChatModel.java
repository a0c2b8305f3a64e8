package dev.pekelund.loyalty.scanner.googleai;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.util.Assert;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link ChatModel} backed by Google AI Studio's Gemini {@code generateContent} endpoint, authenticated with
 * an API key. Media attached to user messages is sent inline as base64 {@code inline_data} parts, which is
 * how receipt photos reach the model.
 */
public class GoogleAiGeminiChatModel implements ChatModel {

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    private static final Logger LOGGER = LoggerFactory.getLogger(GoogleAiGeminiChatModel.class);

    private final RestClient restClient;
    private final String apiKey;
    private final GoogleAiGeminiChatOptions defaultOptions;
    private final ObservationRegistry observationRegistry;

    public GoogleAiGeminiChatModel(RestClient restClient, String apiKey, GoogleAiGeminiChatOptions defaultOptions,
        ObservationRegistry observationRegistry) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.apiKey = apiKey;
        this.defaultOptions = defaultOptions != null ? defaultOptions : GoogleAiGeminiChatOptions.builder().build();
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
    }

    /**
     * @throws GeminiTimeoutException when the read timeout elapses before Gemini answers
     * @throws GeminiRequestException for any other transport, HTTP or empty-response failure
     */
    @Override
    public ChatResponse call(Prompt prompt) {
        Assert.notNull(prompt, "Prompt must not be null");
        GoogleAiGeminiChatOptions options = resolveOptions(prompt.getOptions());
        String modelName = StringUtils.hasText(options.getModel()) ? options.getModel() : defaultOptions.getModel();
        if (!StringUtils.hasText(modelName)) {
            throw new IllegalStateException("Gemini model name must be configured");
        }

        GenerateContentRequest request = buildRequest(prompt.getInstructions(), options);
        Observation observation = Observation.start("google.ai.gemini.call", observationRegistry)
            .highCardinalityKeyValue("model", Optional.ofNullable(modelName).orElse("(unset)"));
        try (Observation.Scope scope = observation.openScope()) {
            LOGGER.info("Calling Google AI Gemini model '{}' with {} part(s)", modelName,
                request.contents().stream().mapToInt(content -> content.parts().size()).sum());
            GenerateContentResponse response = execute(modelName, request);
            String content = extractContent(response);
            return new ChatResponse(List.of(new Generation(new AssistantMessage(content))));
        } catch (RuntimeException ex) {
            observation.error(ex);
            throw ex;
        } finally {
            observation.stop();
        }
    }

    @Override
    public ChatOptions getDefaultOptions() {
        return defaultOptions;
    }

    private GoogleAiGeminiChatOptions resolveOptions(ChatOptions promptOptions) {
        if (promptOptions instanceof GoogleAiGeminiChatOptions geminiOptions) {
            return defaultOptions.merge(geminiOptions);
        }
        return defaultOptions;
    }

    private GenerateContentRequest buildRequest(List<Message> messages, GoogleAiGeminiChatOptions options) {
        if (CollectionUtils.isEmpty(messages)) {
            throw new IllegalArgumentException("Prompt must contain at least one message");
        }
        List<Part> userParts = new ArrayList<>();
        List<Part> systemParts = new ArrayList<>();
        for (Message message : messages) {
            if (message instanceof SystemMessage) {
                systemParts.add(Part.text(message.getText()));
                continue;
            }
            if (StringUtils.hasText(message.getText())) {
                userParts.add(Part.text(message.getText()));
            }
            if (message instanceof UserMessage userMessage) {
                for (Media media : userMessage.getMedia()) {
                    userParts.add(Part.inline(media.getMimeType().toString(), encode(media.getData())));
                }
            }
        }

        Content systemInstruction = systemParts.isEmpty() ? null : new Content(null, systemParts);
        GenerationConfig generationConfig = new GenerationConfig(options.getTemperature(), options.getTopP(),
            options.getTopK(), options.getMaxTokens(), options.getPresencePenalty(), options.getFrequencyPenalty(),
            CollectionUtils.isEmpty(options.getStopSequences()) ? null : options.getStopSequences(),
            options.getResponseMimeType());
        return new GenerateContentRequest(List.of(new Content("user", userParts)), systemInstruction,
            generationConfig);
    }

    private static String encode(Object data) {
        if (data instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (data instanceof String encoded) {
            return encoded;
        }
        throw new IllegalArgumentException("Unsupported media payload " + (data != null ? data.getClass() : null));
    }

    private GenerateContentResponse execute(String modelName, GenerateContentRequest request) {
        try {
            return restClient.post()
                .uri(uriBuilder -> uriBuilder
                    .path("/models/{model}:generateContent")
                    .queryParam("key", apiKey)
                    .build(modelName))
                .body(request)
                .retrieve()
                .body(GenerateContentResponse.class);
        } catch (ResourceAccessException ex) {
            if (ex.getCause() instanceof SocketTimeoutException) {
                throw new GeminiTimeoutException("Google AI Gemini request timed out", ex);
            }
            throw new GeminiRequestException("Google AI Gemini request failed", ex);
        } catch (RestClientResponseException ex) {
            LOGGER.error("Google AI Gemini call failed with status {} and body {}", ex.getStatusCode(),
                ex.getResponseBodyAsString());
            throw new GeminiRequestException("Google AI Gemini request failed with status " + ex.getStatusCode(), ex);
        } catch (RestClientException ex) {
            throw new GeminiRequestException("Google AI Gemini request failed", ex);
        }
    }

    private String extractContent(GenerateContentResponse response) {
        if (response == null || CollectionUtils.isEmpty(response.candidates())) {
            throw new GeminiRequestException("Gemini response did not contain any candidates (feedback: "
                + (response != null ? response.promptFeedback() : null) + ")");
        }
        String text = response.candidates().stream()
            .filter(candidate -> candidate != null && candidate.content() != null
                && candidate.content().parts() != null)
            .flatMap(candidate -> candidate.content().parts().stream())
            .map(Part::text)
            .filter(StringUtils::hasText)
            .collect(Collectors.joining());
        if (!StringUtils.hasText(text)) {
            throw new GeminiRequestException("Gemini response did not contain any text parts");
        }
        return text;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record GenerateContentRequest(List<Content> contents, Content systemInstruction,
        GenerationConfig generationConfig) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Content(String role, List<Part> parts) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Part(String text, @JsonProperty("inline_data") InlineData inlineData) {

        static Part text(String value) {
            return new Part(value != null ? value : "", null);
        }

        static Part inline(String mimeType, String base64Data) {
            return new Part(null, new InlineData(mimeType, base64Data));
        }
    }

    record InlineData(@JsonProperty("mime_type") String mimeType, String data) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record GenerationConfig(Double temperature, Double topP, Integer topK, Integer maxOutputTokens,
        Double presencePenalty, Double frequencyPenalty, List<String> stopSequences, String responseMimeType) {
    }

    record GenerateContentResponse(List<Candidate> candidates, Object promptFeedback) {
    }

    record Candidate(Content content, String finishReason) {
    }
}
