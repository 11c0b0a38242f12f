package dev.contentscanner.service;

import dev.contentscanner.model.Media;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives the content fingerprint used as result cache key.
 * Identical media type and URL always give the same fingerprint.
 */
@Component
public class ContentFingerprinter {

    public String fingerprint(Media media) {
        if (media.type() == null) {
            throw new IllegalArgumentException("Media " + media.mediaId() + " has no type");
        }
        if (media.url() == null || media.url().isBlank()) {
            throw new IllegalArgumentException("Media " + media.mediaId() + " has no url");
        }
        String canonical = media.type().getValue() + "|" + media.url().trim();
        return sha256(canonical);
    }

    private String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
