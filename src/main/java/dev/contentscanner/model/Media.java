package dev.contentscanner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A media item of a post. Carries at most one outcome: a result or an error.
 */
public record Media(
        String mediaId,
        MediaType type,
        String url,
        MediaResult result,
        MediaError error) {

    public Media {
        if (result != null && error != null) {
            throw new IllegalArgumentException("Media " + mediaId + " cannot have both a result and an error");
        }
    }

    public static Media pending(String mediaId, MediaType type, String url) {
        return new Media(mediaId, type, url, null, null);
    }

    @JsonIgnore
    public boolean isResolved() {
        return result != null || error != null;
    }

    public Media withResult(MediaResult mediaResult) {
        return new Media(mediaId, type, url, mediaResult, null);
    }

    public Media withError(MediaError mediaError) {
        return new Media(mediaId, type, url, null, mediaError);
    }

    public Media cleared() {
        return pending(mediaId, type, url);
    }
}
