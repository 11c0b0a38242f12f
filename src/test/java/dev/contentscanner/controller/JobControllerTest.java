package dev.contentscanner.controller;

import dev.contentscanner.dto.CampaignRequest;
import dev.contentscanner.dto.JobCreateResponse;
import dev.contentscanner.exception.DispatchException;
import dev.contentscanner.exception.JobNotFoundException;
import dev.contentscanner.exception.ValidationException;
import dev.contentscanner.model.AggregateResult;
import dev.contentscanner.model.Job;
import dev.contentscanner.model.JobStatus;
import dev.contentscanner.model.MediaType;
import dev.contentscanner.model.SafetyStatus;
import dev.contentscanner.service.JobOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobControllerTest {

    private static final String JOBS = "/v1/content-analysis/jobs";

    @Mock
    private JobOrchestrator jobOrchestrator;

    private WebTestClient webTestClient;

    private final CampaignRequest request = new CampaignRequest("camp_1", "creator_1", List.of(
            new CampaignRequest.PostItem("p1", List.of(
                    new CampaignRequest.MediaItem("m1", MediaType.IMAGE, "https://cdn.example.com/a.jpg")))));

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient.bindToController(new JobController(jobOrchestrator))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("should accept a campaign and return the pending job id")
    void shouldAcceptCampaign() {
        when(jobOrchestrator.submit(any(CampaignRequest.class))).thenReturn(Mono.just("job_abc"));

        webTestClient.post().uri(JOBS)
                .bodyValue(request)
                .exchange()
                .expectStatus().isAccepted()
                .expectBody(JobCreateResponse.class)
                .value(response -> {
                    assertThat(response.jobId()).isEqualTo("job_abc");
                    assertThat(response.status()).isEqualTo(JobStatus.PENDING);
                });
    }

    @Test
    @DisplayName("should return 400 for an invalid campaign")
    void shouldRejectInvalidCampaign() {
        when(jobOrchestrator.submit(any(CampaignRequest.class)))
                .thenReturn(Mono.error(new ValidationException("Campaign must contain at least one post")));

        webTestClient.post().uri(JOBS)
                .bodyValue(request)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("validation_error")
                .jsonPath("$.message").isEqualTo("Campaign must contain at least one post");
    }

    @Test
    @DisplayName("should return 400 for media with a malformed url")
    void shouldRejectMalformedUrl() {
        CampaignRequest badUrl = new CampaignRequest("camp_1", "creator_1", List.of(
                new CampaignRequest.PostItem("p1", List.of(
                        new CampaignRequest.MediaItem("m1", MediaType.IMAGE, "not a url")))));
        when(jobOrchestrator.submit(any(CampaignRequest.class)))
                .thenReturn(Mono.error(new ValidationException("Media m1 has an invalid url: not a url")));

        webTestClient.post().uri(JOBS)
                .bodyValue(badUrl)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("validation_error")
                .jsonPath("$.message").isEqualTo("Media m1 has an invalid url: not a url");
    }

    @Test
    @DisplayName("should return 503 when the job cannot be enqueued")
    void shouldReportDispatchFailure() {
        when(jobOrchestrator.submit(any(CampaignRequest.class)))
                .thenReturn(Mono.error(new DispatchException("broker unavailable")));

        webTestClient.post().uri(JOBS)
                .bodyValue(request)
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error").isEqualTo("dispatch_failure");
    }

    @Test
    @DisplayName("should return the job snapshot")
    void shouldReturnJob() {
        Job job = Job.builder()
                .jobId("job_abc")
                .campaignId("camp_1")
                .creatorId("creator_1")
                .status(JobStatus.COMPLETED)
                .summary("Content appears safe for campaign use.")
                .createdAt(Instant.now())
                .updatedAt(Instant.now())
                .build();
        when(jobOrchestrator.getStatus("job_abc")).thenReturn(Mono.just(job));

        webTestClient.get().uri(JOBS + "/job_abc")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("COMPLETED")
                .jsonPath("$.summary").isEqualTo("Content appears safe for campaign use.");
    }

    @Test
    @DisplayName("should serialize a category without a score as an explicit null")
    void shouldSerializeNullCategoryScore() {
        Map<String, Double> categories = new LinkedHashMap<>();
        categories.put("violence", 0.1);
        categories.put("weapons", null);
        AggregateResult results = new AggregateResult(categories, 0.1, Map.of("violence", SafetyStatus.SAFE),
                Map.of("weapons", "No valid data available"), SafetyStatus.SAFE, 1, 0, 0, null);
        Job job = Job.builder()
                .jobId("job_abc")
                .campaignId("camp_1")
                .creatorId("creator_1")
                .status(JobStatus.COMPLETED)
                .results(results)
                .createdAt(Instant.now())
                .updatedAt(Instant.now())
                .build();
        when(jobOrchestrator.getStatus("job_abc")).thenReturn(Mono.just(job));

        webTestClient.get().uri(JOBS + "/job_abc")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.results.categories.violence").isEqualTo(0.1)
                .jsonPath("$.results.categories.weapons").isEmpty()
                .jsonPath("$.results.categories").value(value ->
                        assertThat((Map<String, Object>) value).containsEntry("weapons", null));
    }

    @Test
    @DisplayName("should return 404 for an unknown job")
    void shouldReturnNotFound() {
        when(jobOrchestrator.getStatus("job_missing")).thenReturn(Mono.error(new JobNotFoundException("job_missing")));

        webTestClient.get().uri(JOBS + "/job_missing")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("not_found")
                .jsonPath("$.status").isEqualTo(404);
    }

    @Test
    @DisplayName("should accept a reprocess request")
    void shouldAcceptReprocess() {
        when(jobOrchestrator.reprocess("job_abc")).thenReturn(Mono.empty());

        webTestClient.post().uri(JOBS + "/job_abc/reprocess")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody(JobCreateResponse.class)
                .value(response -> assertThat(response.jobId()).isEqualTo("job_abc"));
    }

    @Test
    @DisplayName("should return 404 when reprocessing an unknown job")
    void shouldRejectReprocessOfUnknownJob() {
        when(jobOrchestrator.reprocess("job_missing")).thenReturn(Mono.error(new JobNotFoundException("job_missing")));

        webTestClient.post().uri(JOBS + "/job_missing/reprocess")
                .exchange()
                .expectStatus().isNotFound();
    }
}
