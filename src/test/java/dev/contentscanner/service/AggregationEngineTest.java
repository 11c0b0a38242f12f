package dev.contentscanner.service;

import dev.contentscanner.config.AnalysisConfig;
import dev.contentscanner.model.AggregateResult;
import dev.contentscanner.model.ErrorKind;
import dev.contentscanner.model.Job;
import dev.contentscanner.model.JobStatus;
import dev.contentscanner.model.Media;
import dev.contentscanner.model.MediaError;
import dev.contentscanner.model.MediaResult;
import dev.contentscanner.model.MediaType;
import dev.contentscanner.model.Post;
import dev.contentscanner.model.PostResult;
import dev.contentscanner.model.SafetyStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static dev.contentscanner.support.StubModerationClient.scores;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AggregationEngineTest {

    private final AtomicInteger ids = new AtomicInteger();
    private ScoreClassifier classifier;
    private AggregationEngine engine;

    @BeforeEach
    void setUp() {
        classifier = new ScoreClassifier(new AnalysisConfig());
        engine = new AggregationEngine(classifier);
    }

    @Nested
    @DisplayName("Post aggregation")
    class PostAggregation {

        @Test
        @DisplayName("should average only the media that reported a category")
        void shouldAverageOnlyReportingMedia() {
            Post post = post("p1",
                    scored(scores("nudity", 0.2, "violence", 0.6)),
                    scored(scores("nudity", 0.4)));

            PostResult result = engine.aggregatePost(post);

            assertThat(result.categories().get("nudity")).isCloseTo(0.3, within(1e-9));
            assertThat(result.categories().get("violence")).isCloseTo(0.6, within(1e-9));
            assertThat(result.status()).isEqualTo(SafetyStatus.WARNING);
            assertThat(result.analyzed()).isEqualTo(2);
        }

        @Test
        @DisplayName("should not count errored media as zero scores")
        void shouldNotCountErrorsAsZeros() {
            Post post = post("p1",
                    scored(scores("violence", 0.8)),
                    errored(ErrorKind.PROVIDER_ERROR));

            PostResult result = engine.aggregatePost(post);

            assertThat(result.categories().get("violence")).isCloseTo(0.8, within(1e-9));
            assertThat(result.status()).isEqualTo(SafetyStatus.REJECTED);
            assertThat(result.analyzed()).isEqualTo(1);
            assertThat(result.errored()).isEqualTo(1);
        }

        @Test
        @DisplayName("should keep a reported-but-missing category as null")
        void shouldKeepMissingCategoryAsNull() {
            Map<String, Double> partial = new HashMap<>();
            partial.put("medical", null);
            partial.put("violence", 0.1);

            PostResult result = engine.aggregatePost(post("p1", scored(partial)));

            assertThat(result.categories()).containsKey("medical");
            assertThat(result.categories().get("medical")).isNull();
            assertThat(result.status()).isEqualTo(SafetyStatus.SAFE);
        }

        @Test
        @DisplayName("should be ERRORED when every media failed")
        void shouldBeErroredWhenAllFailed() {
            PostResult result = engine.aggregatePost(post("p1",
                    errored(ErrorKind.TIMEOUT), errored(ErrorKind.INVALID_MEDIA)));

            assertThat(result.status()).isEqualTo(SafetyStatus.ERRORED);
            assertThat(result.categories()).isEmpty();
            assertThat(result.errored()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Campaign aggregation")
    class CampaignAggregation {

        @Test
        @DisplayName("should weigh every post equally regardless of media count")
        void shouldWeighPostsEqually() {
            Job job = job(
                    post("p1", scored(scores("violence", 0.9)), scored(scores("violence", 0.9)),
                            scored(scores("violence", 0.9))),
                    post("p2", scored(scores("violence", 0.1))));

            AggregateResult result = engine.aggregate(job);

            assertThat(result.categories().get("violence")).isCloseTo(0.5, within(1e-9));
            assertThat(result.categoryStatuses()).containsEntry("violence", SafetyStatus.WARNING);
            assertThat(result.status()).isEqualTo(SafetyStatus.REJECTED);
            assertThat(result.analyzed()).isEqualTo(4);
        }

        @Test
        @DisplayName("should leave posts without scores out of the campaign mean")
        void shouldSkipPostsWithoutScores() {
            Job job = job(
                    post("p1", scored(scores("violence", 0.4))),
                    post("p2", errored(ErrorKind.PROVIDER_ERROR)));

            AggregateResult result = engine.aggregate(job);

            assertThat(result.categories().get("violence")).isCloseTo(0.4, within(1e-9));
            assertThat(result.status()).isEqualTo(SafetyStatus.WARNING);
            assertThat(result.errored()).isEqualTo(1);
            assertThat(result.posts()).extracting(PostResult::status)
                    .containsExactly(SafetyStatus.WARNING, SafetyStatus.ERRORED);
        }

        @Test
        @DisplayName("should report no categories and ERRORED when nothing was scored")
        void shouldReportErroredWhenNothingScored() {
            Job job = job(
                    post("p1", errored(ErrorKind.TIMEOUT)),
                    post("p2", errored(ErrorKind.PROVIDER_ERROR), errored(ErrorKind.INVALID_MEDIA)));

            AggregateResult result = engine.aggregate(job);

            assertThat(result.categories()).isEmpty();
            assertThat(result.categoryStatuses()).isEmpty();
            assertThat(result.status()).isEqualTo(SafetyStatus.ERRORED);
            assertThat(result.errored()).isEqualTo(3);
            assertThat(result.hasUsableScores()).isFalse();
        }

        @Test
        @DisplayName("should count known-safe media as skipped and SAFE")
        void shouldCountSkippedMedia() {
            Job job = job(post("p1",
                    media().withResult(MediaResult.knownSafe("fp-safe")),
                    scored(scores("nudity", 0.05))));

            AggregateResult result = engine.aggregate(job);

            assertThat(result.skipped()).isEqualTo(1);
            assertThat(result.analyzed()).isEqualTo(1);
            assertThat(result.status()).isEqualTo(SafetyStatus.SAFE);
            assertThat(result.total()).isEqualTo(2);
        }

        @Test
        @DisplayName("should keep a category that no post could score as null")
        void shouldKeepUnscoredCategoryAsNull() {
            Map<String, Double> partial = new HashMap<>();
            partial.put("weapons", null);
            partial.put("nudity", 0.1);

            AggregateResult result = engine.aggregate(job(post("p1", scored(partial))));

            assertThat(result.categories()).containsEntry("weapons", null);
            assertThat(result.categoryStatuses()).doesNotContainKey("weapons");
        }

        @Test
        @DisplayName("should average the overall score over scored categories and explain the unscored ones")
        void shouldComputeOverallScoreOverScoredCategories() {
            Map<String, Double> partial = new HashMap<>();
            partial.put("weapons", null);
            partial.put("nudity", 0.2);
            partial.put("violence", 0.4);

            AggregateResult result = engine.aggregate(job(
                    post("p1", scored(partial)),
                    post("p2", scored(scores("nudity", 0.2)))));

            assertThat(result.overallScore()).isCloseTo(0.3, within(1e-9));
            assertThat(result.explanations())
                    .containsEntry("weapons", AggregationEngine.NO_DATA_EXPLANATION)
                    .doesNotContainKeys("nudity", "violence");
        }

        @Test
        @DisplayName("should leave the overall score null when no category has a score")
        void shouldLeaveOverallScoreNullWithoutScores() {
            Map<String, Double> empty = new HashMap<>();
            empty.put("weapons", null);

            AggregateResult unscored = engine.aggregate(job(post("p1", scored(empty))));
            AggregateResult failed = engine.aggregate(job(post("p1", errored(ErrorKind.TIMEOUT))));

            assertThat(unscored.overallScore()).isNull();
            assertThat(unscored.explanations()).containsEntry("weapons", AggregationEngine.NO_DATA_EXPLANATION);
            assertThat(failed.overallScore()).isNull();
            assertThat(failed.categories()).isEmpty();
            assertThat(failed.explanations()).isEmpty();
        }

        @Test
        @DisplayName("should explain a flagged spoof score")
        void shouldExplainSpoof() {
            AggregateResult result = engine.aggregate(job(post("p1", scored(scores("spoof_fake", 0.5)))));

            assertThat(result.explanations())
                    .containsEntry("spoof_fake", AggregationEngine.SPOOF_EXPLANATION);
        }

        @Test
        @DisplayName("should not explain a safe spoof score")
        void shouldNotExplainSafeSpoof() {
            AggregateResult result = engine.aggregate(job(post("p1", scored(scores("spoof_fake", 0.1)))));

            assertThat(result.explanations()).isEmpty();
        }

        @Test
        @DisplayName("should be deterministic and leave the job untouched")
        void shouldBePure() {
            Job job = job(
                    post("p1", scored(scores("nudity", 0.2, "violence", 0.4)), errored(ErrorKind.TIMEOUT)),
                    post("p2", scored(scores("nudity", 0.6))));
            Job before = job.toBuilder().posts(List.copyOf(job.getPosts())).build();

            AggregateResult first = engine.aggregate(job);
            AggregateResult second = engine.aggregate(job);

            assertThat(first).isEqualTo(second);
            assertThat(job).isEqualTo(before);
        }
    }

    private Job job(Post... posts) {
        return Job.builder()
                .jobId("job_test")
                .campaignId("camp")
                .creatorId("creator")
                .status(JobStatus.IN_PROGRESS)
                .posts(List.of(posts))
                .build();
    }

    private Post post(String postId, Media... media) {
        return new Post(postId, List.of(media));
    }

    private Media media() {
        int id = ids.incrementAndGet();
        return Media.pending("m" + id, MediaType.IMAGE, "https://cdn.example.com/" + id + ".jpg");
    }

    private Media scored(Map<String, Double> scores) {
        return media().withResult(new MediaResult(scores, classifier.classifyAll(scores), "fp-" + ids.get(), false));
    }

    private Media errored(ErrorKind kind) {
        return media().withError(new MediaError(kind, kind.name().toLowerCase()));
    }
}
