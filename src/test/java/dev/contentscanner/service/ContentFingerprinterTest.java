package dev.contentscanner.service;

import dev.contentscanner.model.Media;
import dev.contentscanner.model.MediaType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentFingerprinterTest {

    private final ContentFingerprinter fingerprinter = new ContentFingerprinter();

    @Test
    void sameReferenceGivesSameFingerprint() {
        String first = fingerprinter.fingerprint(Media.pending("m1", MediaType.IMAGE, "https://cdn.example.com/a.jpg"));
        String second = fingerprinter.fingerprint(Media.pending("other", MediaType.IMAGE, " https://cdn.example.com/a.jpg "));

        assertThat(first).isEqualTo(second).hasSize(64);
    }

    @Test
    void typeIsPartOfTheFingerprint() {
        String image = fingerprinter.fingerprint(Media.pending("m1", MediaType.IMAGE, "https://cdn.example.com/a"));
        String video = fingerprinter.fingerprint(Media.pending("m1", MediaType.VIDEO, "https://cdn.example.com/a"));

        assertThat(image).isNotEqualTo(video);
    }

    @Test
    void rejectsMediaWithoutUrl() {
        assertThatThrownBy(() -> fingerprinter.fingerprint(Media.pending("m1", MediaType.IMAGE, " ")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no url");
    }

    @Test
    void rejectsMediaWithoutType() {
        assertThatThrownBy(() -> fingerprinter.fingerprint(Media.pending("m1", null, "https://cdn.example.com/a")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no type");
    }
}
