package dev.contentscanner.ai;

import dev.contentscanner.model.Media;
import dev.contentscanner.model.MediaType;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class FakeModerationClientTest {

    private final FakeModerationClient client = new FakeModerationClient();

    @Test
    void returnsFixedLowRiskScores() {
        StepVerifier.create(client.analyze(Media.pending("m1", MediaType.IMAGE, "https://cdn.example.com/a.jpg")))
                .assertNext(scores -> {
                    assertThat(scores).containsOnlyKeys("adult_content", "violence", "weapons", "medical", "spoof_fake");
                    assertThat(scores.values()).allMatch(score -> score < 0.3);
                })
                .verifyComplete();
        assertThat(client.getName()).isEqualTo("fake");
    }
}
