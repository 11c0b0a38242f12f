package dev.contentscanner.ai;

import dev.contentscanner.model.Media;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Offline moderation client returning fixed low-risk scores.
 * Used for local runs when no provider credentials are configured.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.moderation.provider", havingValue = "fake", matchIfMissing = true)
public class FakeModerationClient implements ModerationClient {

    private static final Map<String, Double> FIXED_SCORES;

    static {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("adult_content", 0.01);
        scores.put("violence", 0.02);
        scores.put("weapons", 0.0);
        scores.put("medical", 0.0);
        scores.put("spoof_fake", 0.15);
        FIXED_SCORES = Collections.unmodifiableMap(scores);
    }

    public FakeModerationClient() {
        log.info("Moderation provider not configured - using fake moderation client");
    }

    @Override
    public String getName() {
        return "fake";
    }

    @Override
    public Mono<Map<String, Double>> analyze(Media media) {
        return Mono.just(new LinkedHashMap<>(FIXED_SCORES));
    }
}
