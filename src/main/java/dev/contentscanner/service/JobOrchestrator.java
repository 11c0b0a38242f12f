package dev.contentscanner.service;

import dev.contentscanner.dto.CampaignRequest;
import dev.contentscanner.exception.DispatchException;
import dev.contentscanner.exception.JobNotFoundException;
import dev.contentscanner.exception.ValidationException;
import dev.contentscanner.exception.VersionConflictException;
import dev.contentscanner.metrics.AnalysisMetrics;
import dev.contentscanner.model.AggregateResult;
import dev.contentscanner.model.ErrorKind;
import dev.contentscanner.model.Job;
import dev.contentscanner.model.JobStatus;
import dev.contentscanner.model.Media;
import dev.contentscanner.model.MediaError;
import dev.contentscanner.model.Post;
import dev.contentscanner.model.SafetyStatus;
import dev.contentscanner.queue.WorkQueue;
import dev.contentscanner.queue.WorkUnit;
import dev.contentscanner.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Owns the job lifecycle: PENDING -> IN_PROGRESS -> COMPLETED | COMPLETED_WITH_WARNINGS | FAILED.
 * <p>
 * Every state change is a guarded transition applied with a conditional update
 * against the repository, retried on version conflicts. The terminal transition
 * happens in the same update that records the last media outcome, so exactly one
 * writer aggregates and summarizes a job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobOrchestrator {

    private static final int MAX_CONFLICT_RETRIES = 10;
    private static final Duration CONFLICT_BACKOFF = Duration.ofMillis(5);
    private static final Set<String> HTTP_SCHEMES = Set.of("http", "https");

    private final JobRepository jobRepository;
    private final WorkQueue workQueue;
    private final MediaWorker mediaWorker;
    private final AggregationEngine aggregationEngine;
    private final SummaryService summaryService;
    private final AnalysisMetrics metrics;

    /**
     * Validate the campaign, create a PENDING job and dispatch one work unit per media item.
     * Completes as soon as the units are enqueued, without waiting for analysis.
     *
     * @return Mono with the new job id; fails with {@link ValidationException} or {@link DispatchException}
     */
    public Mono<String> submit(CampaignRequest request) {
        return Mono.fromCallable(() -> {
                    validate(request);
                    Job job = jobRepository.create(newJob(request));
                    metrics.recordJobSubmitted();
                    log.info("Created job {} for campaign {} ({} posts, {} media)",
                            job.getJobId(), job.getCampaignId(), job.getPosts().size(), job.getMediaCount());
                    return job.getJobId();
                })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(jobId -> dispatch(jobId).thenReturn(jobId));
    }

    /**
     * Current snapshot of a job.
     *
     * @return Mono with the job; fails with {@link JobNotFoundException}
     */
    public Mono<Job> getStatus(String jobId) {
        return Mono.fromCallable(() -> jobRepository.get(jobId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Reset a job to PENDING, dropping every outcome and result, then dispatch it again.
     * A PENDING job is only dispatched. Outcomes from earlier attempts are ignored once reset.
     */
    public Mono<Void> reprocess(String jobId) {
        return transition(jobId,
                job -> job.getStatus() != JobStatus.PENDING,
                job -> {
                    job.clearOutcomes();
                    job.setStatus(JobStatus.PENDING);
                    job.setAttempt(job.getAttempt() + 1);
                    job.setUpdatedAt(Instant.now());
                    return job;
                })
                .doOnNext(reset -> reset.ifPresent(job -> {
                    metrics.recordJobSubmitted();
                    log.info("Job {} reset to PENDING for reprocessing (attempt {})", jobId, job.getAttempt());
                }))
                .then(dispatch(jobId));
    }

    /**
     * Queue handler: analyze one media item and record its outcome.
     * Redelivered, stale or unknown units are acknowledged without effect.
     */
    public Mono<Void> handle(WorkUnit unit) {
        return getStatus(unit.jobId())
                .flatMap(job -> {
                    if (!accepts(job, unit)) {
                        log.debug("Ignoring work unit {} (job status {}, attempt {})",
                                unit.idempotencyKey(), job.getStatus(), job.getAttempt());
                        return Mono.empty();
                    }
                    Optional<Media> media = job.findMedia(unit.postId(), unit.mediaId());
                    if (media.isEmpty()) {
                        log.warn("Work unit {} references unknown media", unit.idempotencyKey());
                        return Mono.empty();
                    }
                    if (media.get().isResolved()) {
                        log.debug("Media already resolved for {}, redelivery is a no-op", unit.idempotencyKey());
                        return Mono.empty();
                    }
                    return mediaWorker.process(media.get())
                            .flatMap(resolved -> recordOutcome(unit, resolved));
                })
                .onErrorResume(JobNotFoundException.class, e -> {
                    log.warn("Dropping work unit {}: {}", unit.idempotencyKey(), e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    /**
     * Queue dead-letter handler: resolve the media of a unit whose deliveries are used up
     * with a {@link ErrorKind#DELIVERY_FAILURE}, so the job can still reach a terminal state.
     */
    public Mono<Void> abandon(WorkUnit unit, Throwable cause) {
        return getStatus(unit.jobId())
                .flatMap(job -> {
                    Optional<Media> media = job.findMedia(unit.postId(), unit.mediaId())
                            .filter(found -> !found.isResolved());
                    if (!accepts(job, unit) || media.isEmpty()) {
                        return Mono.empty();
                    }
                    log.error("Work unit {} abandoned after {} deliveries", unit.idempotencyKey(), unit.delivery() + 1);
                    metrics.recordMediaErrored(ErrorKind.DELIVERY_FAILURE);
                    MediaError error = new MediaError(ErrorKind.DELIVERY_FAILURE, String.format(
                            "Abandoned after %d deliveries: %s", unit.delivery() + 1, cause.getMessage()));
                    return recordOutcome(unit, media.get().withError(error));
                })
                .onErrorResume(JobNotFoundException.class, e -> Mono.empty())
                .then();
    }

    /**
     * Give up on a PENDING or IN_PROGRESS job: every unresolved media gets a
     * {@link ErrorKind#DELIVERY_FAILURE} and the job is finished with what was recorded.
     */
    public Mono<Void> expire(String jobId, String reason) {
        return transition(jobId,
                job -> !job.getStatus().isTerminal(),
                job -> {
                    resolveRemaining(job, new MediaError(ErrorKind.DELIVERY_FAILURE, reason));
                    finish(job);
                    if (job.getStatus() == JobStatus.FAILED) {
                        job.setError(reason);
                    }
                    return job;
                })
                .doOnNext(expired -> expired.ifPresent(job ->
                        log.warn("Job {} expired after {} attempt(s): {}", jobId, job.getAttempt() + 1, reason)))
                .flatMap(expired -> expired.map(this::onTerminal).orElseGet(Mono::empty));
    }

    // ---------------------------------------------------------------------
    // Dispatch
    // ---------------------------------------------------------------------

    private Mono<Void> dispatch(String jobId) {
        return transition(jobId,
                job -> job.getStatus() == JobStatus.PENDING,
                job -> {
                    job.setStatus(JobStatus.IN_PROGRESS);
                    job.setUpdatedAt(Instant.now());
                    return job;
                })
                .flatMap(started -> started.map(this::publishAll).orElseGet(Mono::empty));
    }

    private Mono<Void> publishAll(Job job) {
        List<WorkUnit> units = job.getPosts().stream()
                .flatMap(post -> post.media().stream()
                        .map(media -> WorkUnit.of(job.getJobId(), post.postId(), media.mediaId(), job.getAttempt())))
                .toList();

        return Flux.fromIterable(units)
                .concatMap(unit -> workQueue.publish(unit)
                        .then(Mono.<DispatchFailure>empty())
                        .onErrorResume(e -> Mono.just(new DispatchFailure(unit, e))))
                .collectList()
                .flatMap(failures -> {
                    if (failures.isEmpty()) {
                        log.info("Dispatched {} work units for job {}", units.size(), job.getJobId());
                        return Mono.<Void>empty();
                    }
                    if (failures.size() == units.size()) {
                        Throwable cause = failures.get(0).cause();
                        return failDispatch(job, cause)
                                .then(Mono.error(new DispatchException(
                                        "Failed to enqueue analysis job " + job.getJobId(), cause)));
                    }
                    log.warn("Job {}: {} of {} work units could not be enqueued",
                            job.getJobId(), failures.size(), units.size());
                    return Flux.fromIterable(failures)
                            .concatMap(failure -> recordOutcome(failure.unit(),
                                    dispatchError(job, failure)))
                            .then();
                });
    }

    private Media dispatchError(Job job, DispatchFailure failure) {
        Media media = job.findMedia(failure.unit().postId(), failure.unit().mediaId()).orElseThrow();
        metrics.recordMediaErrored(ErrorKind.DISPATCH_FAILURE);
        return media.withError(new MediaError(ErrorKind.DISPATCH_FAILURE, failure.cause().getMessage()));
    }

    private Mono<Void> failDispatch(Job dispatched, Throwable cause) {
        log.error("Job {}: no work unit could be enqueued: {}", dispatched.getJobId(), cause.getMessage());
        return transition(dispatched.getJobId(),
                job -> job.getStatus() == JobStatus.IN_PROGRESS && job.getAttempt() == dispatched.getAttempt(),
                job -> {
                    resolveRemaining(job, new MediaError(ErrorKind.DISPATCH_FAILURE, cause.getMessage()));
                    finish(job);
                    job.setError("Failed to enqueue analysis job: " + cause.getMessage());
                    return job;
                })
                .flatMap(failed -> failed.map(this::onTerminal).orElseGet(Mono::empty));
    }

    // ---------------------------------------------------------------------
    // Outcomes and terminal transition
    // ---------------------------------------------------------------------

    private Mono<Void> recordOutcome(WorkUnit unit, Media resolved) {
        return transition(unit.jobId(),
                job -> accepts(job, unit) && job.findMedia(unit.postId(), unit.mediaId())
                        .map(media -> !media.isResolved())
                        .orElse(false),
                job -> {
                    job.replaceMedia(unit.postId(), resolved);
                    job.setUpdatedAt(Instant.now());
                    if (job.isFullyResolved()) {
                        finish(job);
                    }
                    return job;
                })
                .flatMap(updated -> updated
                        .filter(job -> job.getStatus().isTerminal())
                        .map(this::onTerminal)
                        .orElseGet(Mono::empty));
    }

    private void resolveRemaining(Job job, MediaError error) {
        for (Post post : job.getPosts()) {
            for (Media media : post.media()) {
                if (!media.isResolved()) {
                    job.replaceMedia(post.postId(), media.withError(error));
                }
            }
        }
    }

    private void finish(Job job) {
        AggregateResult results = aggregationEngine.aggregate(job);
        JobStatus status = terminalStatus(results);
        job.setResults(results);
        job.setStatus(status);
        job.setUpdatedAt(Instant.now());
        if (status == JobStatus.FAILED && job.getError() == null) {
            job.setError(String.format("All %d media item(s) failed analysis", results.errored()));
        }
    }

    /**
     * FAILED when nothing could be scored, COMPLETED when everything scored SAFE,
     * COMPLETED_WITH_WARNINGS otherwise.
     */
    static JobStatus terminalStatus(AggregateResult results) {
        if (!results.hasUsableScores()) {
            return JobStatus.FAILED;
        }
        if (results.errored() == 0 && results.status() == SafetyStatus.SAFE) {
            return JobStatus.COMPLETED;
        }
        return JobStatus.COMPLETED_WITH_WARNINGS;
    }

    private Mono<Void> onTerminal(Job job) {
        AggregateResult results = job.getResults();
        metrics.recordJobFinished(job.getStatus());
        log.info("Job {} finished with status {} (analyzed: {}, skipped: {}, errored: {})",
                job.getJobId(), job.getStatus(), results.analyzed(), results.skipped(), results.errored());

        return summaryService.summarize(results)
                .flatMap(summary -> summary
                        .map(text -> attachSummary(job, text))
                        .orElseGet(Mono::empty));
    }

    private Mono<Void> attachSummary(Job finished, String text) {
        return transition(finished.getJobId(),
                job -> job.getAttempt() == finished.getAttempt()
                        && job.getStatus().isTerminal()
                        && job.getSummary() == null,
                job -> {
                    job.setSummary(text);
                    job.setUpdatedAt(Instant.now());
                    return job;
                })
                .then();
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private boolean accepts(Job job, WorkUnit unit) {
        return job.getStatus() == JobStatus.IN_PROGRESS && job.getAttempt() == unit.attempt();
    }

    /**
     * Read the job, check the guard, and apply the mutation with a conditional update.
     * Re-reads and retries on version conflicts.
     *
     * @return the updated job, or empty when the guard rejected the current state
     */
    private Mono<Optional<Job>> transition(String jobId, Predicate<Job> guard, UnaryOperator<Job> mutation) {
        return Mono.fromCallable(() -> {
                    Job current = jobRepository.get(jobId);
                    if (!guard.test(current)) {
                        return Optional.<Job>empty();
                    }
                    return Optional.of(jobRepository.conditionalUpdate(jobId, current.getVersion(), mutation));
                })
                .subscribeOn(Schedulers.boundedElastic())
                .doOnError(VersionConflictException.class, e -> {
                    metrics.recordVersionConflict();
                    log.debug("{} - retrying", e.getMessage());
                })
                .retryWhen(Retry.backoff(MAX_CONFLICT_RETRIES, CONFLICT_BACKOFF)
                        .filter(VersionConflictException.class::isInstance)
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    private Job newJob(CampaignRequest request) {
        Instant now = Instant.now();
        List<Post> posts = request.posts().stream()
                .map(post -> new Post(post.postId(), post.media().stream()
                        .map(media -> Media.pending(media.mediaId(), media.type(), media.url().trim()))
                        .toList()))
                .toList();
        return Job.builder()
                .jobId("job_" + UUID.randomUUID().toString().replace("-", ""))
                .campaignId(request.campaignId())
                .creatorId(request.creatorId())
                .status(JobStatus.PENDING)
                .attempt(0)
                .posts(posts)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private void validate(CampaignRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        requireText(request.campaignId(), "campaign_id");
        requireText(request.creatorId(), "creator_id");
        if (request.posts() == null || request.posts().isEmpty()) {
            throw new ValidationException("Campaign must contain at least one post");
        }
        Set<String> postIds = new HashSet<>();
        for (CampaignRequest.PostItem post : request.posts()) {
            if (post == null) {
                throw new ValidationException("Post entries must not be null");
            }
            requireText(post.postId(), "post_id");
            if (!postIds.add(post.postId())) {
                throw new ValidationException("Duplicate post_id: " + post.postId());
            }
            if (post.media() == null || post.media().isEmpty()) {
                throw new ValidationException("Post " + post.postId() + " must contain at least one media item");
            }
            Set<String> mediaIds = new HashSet<>();
            for (CampaignRequest.MediaItem media : post.media()) {
                if (media == null) {
                    throw new ValidationException("Media entries of post " + post.postId() + " must not be null");
                }
                requireText(media.mediaId(), "media_id");
                if (!mediaIds.add(media.mediaId())) {
                    throw new ValidationException("Duplicate media_id " + media.mediaId() + " in post " + post.postId());
                }
                if (media.type() == null) {
                    throw new ValidationException("Media " + media.mediaId() + " must have a type (image or video)");
                }
                requireText(media.url(), "url");
                requireHttpUrl(media);
            }
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }

    private static void requireHttpUrl(CampaignRequest.MediaItem media) {
        String url = media.url().trim();
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new ValidationException("Media " + media.mediaId() + " has an invalid url: " + url);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !HTTP_SCHEMES.contains(scheme.toLowerCase(Locale.ROOT)) || uri.getHost() == null) {
            throw new ValidationException("Media " + media.mediaId() + " url must be an absolute http(s) URL: " + url);
        }
    }

    private record DispatchFailure(WorkUnit unit, Throwable cause) {
    }
}
