package de.mirkosertic.mcp.codeindex.index;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 fingerprints of text content, used as document hash and for change detection.
 */
public final class ContentFingerprinter {

    private ContentFingerprinter() {
    }

    /**
     * @return the 64 character lowercase hex SHA-256 digest of the UTF-8 encoded content
     */
    public static String fingerprint(final String content) {
        final MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not supported by this JVM", e);
        }
        final byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
        final StringBuilder hexString = new StringBuilder(hash.length * 2);
        for (final byte b : hash) {
            final String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
