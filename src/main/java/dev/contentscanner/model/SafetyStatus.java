package dev.contentscanner.model;

/**
 * Moderation verdict for a category, a media item, a post or a whole campaign.
 * <p>
 * {@link #ERRORED} is reserved for posts and campaigns that have no usable
 * media result at all; it never ranks against the other values.
 */
public enum SafetyStatus {
    SAFE(0),
    WARNING(1),
    REJECTED(2),
    ERRORED(-1);

    private final int severity;

    SafetyStatus(int severity) {
        this.severity = severity;
    }

    public int getSeverity() {
        return severity;
    }

    /**
     * Return the more severe of two statuses. ERRORED loses against any real verdict.
     */
    public static SafetyStatus worst(SafetyStatus a, SafetyStatus b) {
        if (a == null || a == ERRORED) {
            return b;
        }
        if (b == null || b == ERRORED) {
            return a;
        }
        return a.severity >= b.severity ? a : b;
    }
}
