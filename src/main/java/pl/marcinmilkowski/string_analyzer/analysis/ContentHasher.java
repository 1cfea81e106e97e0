package pl.marcinmilkowski.string_analyzer.analysis;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 content hash used both as record id and as the dedup key.
 */
public final class ContentHasher {

    private static final HexFormat HEX = HexFormat.of();

    private ContentHasher() {}

    /**
     * Hash the UTF-8 bytes of a value.
     *
     * @return 64 lowercase hex characters
     */
    public static String sha256Hex(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HEX.formatHex(md.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
