package dev.contentscanner.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.contentscanner.exception.ProviderException;
import dev.contentscanner.model.AggregateResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * Summary client backed by the Anthropic Messages API.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.summary.provider", havingValue = "claude")
public class ClaudeSummaryClient implements SummaryClient {

    static final String MESSAGES_PATH = "/v1/messages";
    private static final String API_VERSION = "2023-06-01";

    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final int maxTokens;

    public ClaudeSummaryClient(
            @Value("${app.ai.claude.api-key}") String apiKey,
            @Value("${app.ai.claude.model:claude-3-opus-20240229}") String model,
            @Value("${app.ai.claude.base-url:https://api.anthropic.com}") String baseUrl,
            @Value("${app.ai.claude.max-tokens:200}") int maxTokens) {
        this.apiKey = apiKey;
        this.model = model;
        this.maxTokens = maxTokens;
        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("anthropic-version", API_VERSION)
                .build();

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Claude API key is missing! Summaries will be skipped.");
        } else {
            log.info("Claude summaries enabled with model: {}", model);
        }
    }

    @Override
    public Mono<String> summarize(AggregateResult result) {
        if (!isEnabled()) {
            return Mono.error(ProviderException.providerError("Claude API key is not configured"));
        }

        ClaudeRequest request = new ClaudeRequest(model, maxTokens,
                List.of(new ClaudeRequest.Message("user", buildPrompt(result))));

        return webClient.post()
                .uri(MESSAGES_PATH)
                .header("x-api-key", apiKey)
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> Mono.just(
                        ProviderException.providerError("Claude returned HTTP " + response.statusCode().value())))
                .bodyToMono(ClaudeResponse.class)
                .map(this::extractText)
                .onErrorMap(WebClientRequestException.class,
                        e -> ProviderException.providerError("Network error while calling Claude: " + e.getMessage(), e));
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    String buildPrompt(AggregateResult result) {
        return String.format("""
                You are an AI content safety assistant.

                Given the following moderation results, produce a short summary
                for a non-technical reviewer.

                Requirements:
                - Be concise (3-5 sentences)
                - Mention any WARNING or REJECTED categories
                - Clearly state whether the content appears safe for campaign use

                Overall status: %s
                Overall risk score: %s
                Media analyzed: %d, pre-cleared: %d, failed: %d

                Category risk scores (0 = no risk, 1 = certain):
                %s
                """,
                result.status(),
                result.overallScore() == null ? "no data" : SummaryPrompts.formatScore(result.overallScore()),
                result.analyzed(), result.skipped(), result.errored(),
                SummaryPrompts.describeCategories(result));
    }

    private String extractText(ClaudeResponse response) {
        if (response == null || response.content() == null || response.content().isEmpty()) {
            throw ProviderException.providerError("Claude returned no content");
        }
        String text = response.content().get(0).text();
        if (text == null || text.isBlank()) {
            throw ProviderException.providerError("Claude returned an empty summary");
        }
        return text.trim();
    }

    // Request DTOs
    record ClaudeRequest(
            String model,
            @JsonProperty("max_tokens") int maxTokens,
            List<Message> messages) {
        record Message(String role, String content) {
        }
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ClaudeResponse(List<Block> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Block(String type, String text) {
        }
    }
}
