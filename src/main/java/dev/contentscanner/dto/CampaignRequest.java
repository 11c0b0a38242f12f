package dev.contentscanner.dto;

import dev.contentscanner.model.MediaType;

import java.util.List;

/**
 * Submission payload: a campaign made of posts made of media items.
 */
public record CampaignRequest(
        String campaignId,
        String creatorId,
        List<PostItem> posts) {

    public record PostItem(String postId, List<MediaItem> media) {
    }

    public record MediaItem(String mediaId, MediaType type, String url) {
    }
}
