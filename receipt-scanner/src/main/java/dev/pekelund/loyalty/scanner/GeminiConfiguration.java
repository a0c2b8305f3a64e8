package dev.pekelund.loyalty.scanner;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.loyalty.scanner.extraction.GeminiReceiptFieldExtractor;
import dev.pekelund.loyalty.scanner.googleai.GoogleAiGeminiChatModel;
import dev.pekelund.loyalty.scanner.googleai.GoogleAiGeminiChatOptions;
import io.micrometer.observation.ObservationRegistry;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Wires the Gemini vision model used to read receipts.
 */
@Configuration
public class GeminiConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiConfiguration.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        return mapper;
    }

    @Bean
    public GoogleAiGeminiChatOptions receiptGeminiChatOptions(Environment environment) {
        String modelName = environment.getProperty("google.ai.gemini.model", "gemini-2.0-flash");
        Double temperature = environment.getProperty("google.ai.gemini.temperature", Double.class);
        Double topP = environment.getProperty("google.ai.gemini.top-p", Double.class);
        Integer topK = environment.getProperty("google.ai.gemini.top-k", Integer.class);
        Integer maxOutputTokens = environment.getProperty("google.ai.gemini.max-output-tokens", Integer.class);
        Double presencePenalty = environment.getProperty("google.ai.gemini.presence-penalty", Double.class);
        Double frequencyPenalty = environment.getProperty("google.ai.gemini.frequency-penalty", Double.class);
        String[] stopSequences = environment.getProperty("google.ai.gemini.stop-sequences", String[].class,
            new String[0]);
        LOGGER.info("Configured Google AI Gemini chat settings - model: {}, temperature: {}, topP: {}, topK: {},"
            + " maxOutputTokens: {}, presencePenalty: {}, frequencyPenalty: {}, stopSequences: {}", modelName,
            temperature, topP, topK, maxOutputTokens, presencePenalty, frequencyPenalty,
            Arrays.toString(stopSequences));
        return GoogleAiGeminiChatOptions.builder()
            .model(modelName)
            .temperature(temperature)
            .topP(topP)
            .topK(topK)
            .maxTokens(maxOutputTokens)
            .presencePenalty(presencePenalty)
            .frequencyPenalty(frequencyPenalty)
            .stopSequences(List.of(stopSequences))
            .responseMimeType(GoogleAiGeminiChatOptions.JSON_MIME_TYPE)
            .build();
    }

    @Bean
    public GoogleAiGeminiChatModel googleAiGeminiChatModel(Environment environment,
        GoogleAiGeminiChatOptions receiptGeminiChatOptions, ReceiptScanProperties receiptScanProperties,
        ObjectProvider<ObservationRegistry> observationRegistry) {

        String apiKey = environment.getProperty("AI_STUDIO_API_KEY");
        if (!StringUtils.hasText(apiKey)) {
            throw new IllegalStateException("Google AI Studio API key must be configured (AI_STUDIO_API_KEY)");
        }

        Duration timeout = receiptScanProperties.getExtractionTimeout();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);

        String baseUrl = environment.getProperty("google.ai.gemini.base-url", GoogleAiGeminiChatModel.DEFAULT_BASE_URL);
        RestClient restClient = RestClient.builder()
            .requestFactory(requestFactory)
            .baseUrl(baseUrl)
            .build();

        GoogleAiGeminiChatModel chatModel = new GoogleAiGeminiChatModel(restClient, apiKey, receiptGeminiChatOptions,
            observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP));
        LOGGER.info("Google AI Gemini ChatModel default options: {}", chatModel.getDefaultOptions());
        return chatModel;
    }

    @Bean
    public GeminiReceiptFieldExtractor geminiReceiptFieldExtractor(GoogleAiGeminiChatModel chatModel,
        ObjectMapper objectMapper, GoogleAiGeminiChatOptions receiptGeminiChatOptions,
        ReceiptScanProperties receiptScanProperties) {

        return new GeminiReceiptFieldExtractor(chatModel, objectMapper, receiptGeminiChatOptions,
            receiptScanProperties.getVendorName(), receiptScanProperties.getOrderNumberAnchor());
    }
}
