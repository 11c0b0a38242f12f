package dev.contentscanner.controller;

import dev.contentscanner.dto.CampaignRequest;
import dev.contentscanner.dto.JobCreateResponse;
import dev.contentscanner.model.Job;
import dev.contentscanner.model.JobStatus;
import dev.contentscanner.service.JobOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Async content analysis endpoints. No analysis runs in the request path.
 */
@Slf4j
@RestController
@RequestMapping("/v1/content-analysis/jobs")
@RequiredArgsConstructor
public class JobController {

    private final JobOrchestrator jobOrchestrator;

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<JobCreateResponse> createJob(@RequestBody CampaignRequest request) {
        return jobOrchestrator.submit(request)
                .map(jobId -> new JobCreateResponse(jobId, JobStatus.PENDING));
    }

    @GetMapping("/{jobId}")
    public Mono<Job> getJob(@PathVariable String jobId) {
        return jobOrchestrator.getStatus(jobId);
    }

    @PostMapping("/{jobId}/reprocess")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<JobCreateResponse> reprocessJob(@PathVariable String jobId) {
        log.info("Reprocess requested for job {}", jobId);
        return jobOrchestrator.reprocess(jobId)
                .thenReturn(new JobCreateResponse(jobId, JobStatus.PENDING));
    }
}
