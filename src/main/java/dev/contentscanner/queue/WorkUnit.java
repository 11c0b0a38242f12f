package dev.contentscanner.queue;

/**
 * One dispatched request to analyze a single media item.
 *
 * @param attempt  job attempt the unit was dispatched for
 * @param delivery how many times the queue has handed this unit to a handler before
 */
public record WorkUnit(String jobId, String postId, String mediaId, int attempt, int delivery) {

    public static WorkUnit of(String jobId, String postId, String mediaId, int attempt) {
        return new WorkUnit(jobId, postId, mediaId, attempt, 0);
    }

    public WorkUnit redelivered() {
        return new WorkUnit(jobId, postId, mediaId, attempt, delivery + 1);
    }

    public String idempotencyKey() {
        return jobId + ":" + postId + ":" + mediaId + ":" + attempt;
    }
}
