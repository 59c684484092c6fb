package ai.attackframework.tools.configstore.utils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 content hashing used for change detection of serialized configs.
 */
public final class ContentHash {

    private ContentHash() {}

    /**
     * Returns the lowercase hex SHA-256 of the UTF-8 bytes of {@code s}.
     *
     * @param s text to hash (null treated as empty)
     * @return 64-character hex digest
     */
    public static String sha256(String s) {
        String text = s == null ? "" : s;
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256.
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
