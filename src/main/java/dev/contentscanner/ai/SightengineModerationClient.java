package dev.contentscanner.ai;

import com.fasterxml.jackson.databind.JsonNode;
import dev.contentscanner.exception.ProviderException;
import dev.contentscanner.model.Media;
import dev.contentscanner.model.MediaType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Moderation client for the Sightengine REST API.
 * Images go through check.json, videos through the synchronous video endpoint.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.moderation.provider", havingValue = "sightengine")
public class SightengineModerationClient implements ModerationClient {

    static final String IMAGE_PATH = "/1.0/check.json";
    static final String VIDEO_PATH = "/1.0/video/check-sync.json";
    // Probabilities of absence: "none" in the nudity-2.x model, "safe" in the v1 nudity model
    private static final Set<String> NO_RISK_FIELDS = Set.of("none", "safe");

    // Our category name -> Sightengine model name
    static final Map<String, String> CATEGORY_MODELS;

    static {
        Map<String, String> models = new LinkedHashMap<>();
        models.put("adult_content", "nudity");
        models.put("violence", "violence");
        models.put("weapons", "weapon");
        models.put("medical", "medical");
        models.put("spoof_fake", "spoof");
        CATEGORY_MODELS = Collections.unmodifiableMap(models);
    }

    private final WebClient webClient;
    private final String apiUser;
    private final String apiSecret;
    private final String models;

    public SightengineModerationClient(
            @Value("${app.ai.sightengine.api-user}") String apiUser,
            @Value("${app.ai.sightengine.api-secret}") String apiSecret,
            @Value("${app.ai.sightengine.base-url:https://api.sightengine.com}") String baseUrl) {
        if (apiUser == null || apiUser.isBlank() || apiSecret == null || apiSecret.isBlank()) {
            throw new IllegalStateException("Sightengine credentials are not configured");
        }
        this.apiUser = apiUser;
        this.apiSecret = apiSecret;
        this.models = String.join(",", CATEGORY_MODELS.values());
        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .codecs(config -> config.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();
        log.info("Sightengine moderation enabled (models: {})", models);
    }

    @Override
    public String getName() {
        return "sightengine";
    }

    @Override
    public Mono<Map<String, Double>> analyze(Media media) {
        boolean video = media.type() == MediaType.VIDEO;

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path(video ? VIDEO_PATH : IMAGE_PATH)
                        .queryParam(video ? "stream_url" : "url", media.url())
                        .queryParam("models", models)
                        .queryParam("api_user", apiUser)
                        .queryParam("api_secret", apiSecret)
                        .build())
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> httpError(response.statusCode().value(), body)))
                .bodyToMono(JsonNode.class)
                .switchIfEmpty(Mono.error(() -> ProviderException.providerError("Sightengine returned an empty body")))
                .map(payload -> video ? extractVideoScores(payload) : extractImageScores(payload))
                .onErrorMap(WebClientRequestException.class,
                        e -> ProviderException.providerError("Network error while calling Sightengine: " + e.getMessage(), e));
    }

    Map<String, Double> extractImageScores(JsonNode payload) {
        checkStatus(payload);
        Map<String, Double> scores = new LinkedHashMap<>();
        CATEGORY_MODELS.forEach((category, model) -> scores.put(category, maxRisk(payload.get(model))));
        return scores;
    }

    Map<String, Double> extractVideoScores(JsonNode payload) {
        checkStatus(payload);
        JsonNode frames = payload.path("data").path("frames");
        if (!frames.isArray()) {
            throw ProviderException.providerError("Sightengine video response has no frames");
        }
        Map<String, Double> scores = new LinkedHashMap<>();
        CATEGORY_MODELS.forEach((category, model) -> {
            Double worst = null;
            for (JsonNode frame : frames) {
                Double risk = maxRisk(frame.get(model));
                if (risk != null && (worst == null || risk > worst)) {
                    worst = risk;
                }
            }
            scores.put(category, worst);
        });
        return scores;
    }

    private void checkStatus(JsonNode payload) {
        if ("success".equals(payload.path("status").asText())) {
            return;
        }
        JsonNode error = payload.path("error");
        String type = error.path("type").asText("");
        String message = error.path("message").asText(payload.toString());
        if ("media_error".equals(type)) {
            throw ProviderException.invalidMedia("Sightengine rejected media: " + message);
        }
        throw ProviderException.providerError("Sightengine API error: " + message);
    }

    /**
     * Highest probability found anywhere in a model block, or null when the block is absent.
     * "none" and "safe" entries are the probability of absence and are not risk.
     */
    private Double maxRisk(JsonNode modelBlock) {
        if (modelBlock == null || modelBlock.isNull() || modelBlock.isMissingNode()) {
            return null;
        }
        if (modelBlock.isNumber()) {
            return clamp(modelBlock.asDouble());
        }
        Double max = null;
        Iterator<Map.Entry<String, JsonNode>> fields = modelBlock.isObject()
                ? modelBlock.fields()
                : Collections.emptyIterator();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (NO_RISK_FIELDS.contains(field.getKey())) {
                continue;
            }
            Double candidate = maxRisk(field.getValue());
            if (candidate != null && (max == null || candidate > max)) {
                max = candidate;
            }
        }
        return max;
    }

    private double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private ProviderException httpError(int status, String body) {
        if (status == 400) {
            return ProviderException.invalidMedia("Sightengine returned HTTP 400: " + abbreviate(body));
        }
        return ProviderException.providerError("Sightengine returned HTTP " + status);
    }

    private String abbreviate(String body) {
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
