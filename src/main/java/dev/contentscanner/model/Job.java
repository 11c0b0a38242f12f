package dev.contentscanner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Analysis job for one campaign. Only the orchestrator mutates it, always on a
 * fresh copy read from the repository and written back with a conditional update.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Job {
    private String jobId;
    private String campaignId;
    private String creatorId;
    private JobStatus status;

    // Incremented by reprocess; work units from an older attempt are ignored
    private int attempt;

    @Builder.Default
    private List<Post> posts = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;

    private AggregateResult results;
    private String summary;
    private String error;

    // Optimistic concurrency token, owned by the repository
    private long version;

    @JsonIgnore
    public List<Media> getAllMedia() {
        return posts.stream()
                .flatMap(post -> post.media().stream())
                .toList();
    }

    @JsonIgnore
    public int getMediaCount() {
        return posts.stream().mapToInt(post -> post.media().size()).sum();
    }

    @JsonIgnore
    public int getResolvedCount() {
        return (int) getAllMedia().stream().filter(Media::isResolved).count();
    }

    @JsonIgnore
    public boolean isFullyResolved() {
        return getResolvedCount() == getMediaCount();
    }

    public Optional<Media> findMedia(String postId, String mediaId) {
        return posts.stream()
                .filter(post -> post.postId().equals(postId))
                .flatMap(post -> post.media().stream())
                .filter(media -> media.mediaId().equals(mediaId))
                .findFirst();
    }

    /**
     * Replace one media item, keeping post and media order.
     */
    public void replaceMedia(String postId, Media updated) {
        List<Post> copy = new ArrayList<>(posts.size());
        for (Post post : posts) {
            if (!post.postId().equals(postId)) {
                copy.add(post);
                continue;
            }
            List<Media> media = post.media().stream()
                    .map(existing -> existing.mediaId().equals(updated.mediaId()) ? updated : existing)
                    .toList();
            copy.add(new Post(post.postId(), media));
        }
        this.posts = copy;
    }

    /**
     * Drop every media outcome and derived result. Used when a job is reprocessed.
     */
    public void clearOutcomes() {
        this.posts = posts.stream()
                .map(post -> new Post(post.postId(), post.media().stream().map(Media::cleared).toList()))
                .toList();
        this.results = null;
        this.summary = null;
        this.error = null;
    }
}
