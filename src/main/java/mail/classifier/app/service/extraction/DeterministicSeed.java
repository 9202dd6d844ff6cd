package mail.classifier.app.service.extraction;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Seeds and correlation hashes derived from SHA-256.
 */
public final class DeterministicSeed {

    private DeterministicSeed() {
    }

    /**
     * First 32 bits of SHA-256(externalId + text) as an unsigned value.
     * Identical (id, text) pairs always yield the same seed.
     */
    public static long of(String externalId, String text) {
        String hex = sha256Hex((externalId == null ? "" : externalId) + (text == null ? "" : text));
        return Long.parseLong(hex.substring(0, 8), 16);
    }

    /** Eight hex characters, used to correlate log lines without logging content. */
    public static String shortHash(String text) {
        return sha256Hex(text == null ? "" : text).substring(0, 8);
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
