package dev.contentscanner.model;

import java.util.List;

public record Post(String postId, List<Media> media) {

    public Post {
        media = media == null ? List.of() : List.copyOf(media);
    }
}
