package com.datasheetrag.ingest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SHA-256 content hashes used as the re-ingestion signal ({@code file_hash}).
 */
public final class ContentHasher {
    private static final Logger log = LoggerFactory.getLogger(ContentHasher.class);
    public static final String UNKNOWN = "unknown";

    private ContentHasher() {
    }

    /**
     * Hashes the file's bytes, or returns {@value #UNKNOWN} when the file cannot be read.
     */
    public static String hashFile(Path path) {
        MessageDigest digest = sha256();
        byte[] buffer = new byte[8192];
        try (InputStream in = Files.newInputStream(path)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to calculate hash for {}: {}", path, e.toString());
            return UNKNOWN;
        }
    }

    public static String hashText(String text) {
        byte[] bytes = (text == null ? "" : text).getBytes(StandardCharsets.UTF_8);
        return HexFormat.of().formatHex(sha256().digest(bytes));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
