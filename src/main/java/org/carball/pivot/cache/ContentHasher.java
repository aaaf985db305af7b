package org.carball.pivot.cache;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes build cache keys. Each component is prefixed with its byte length so that
 * different splits of the same concatenated text never collide.
 */
public final class ContentHasher {

    private ContentHasher() {
    }

    public static String hash(String renderedSource, String profileId, String toolchainVersion, String targetTriple) {
        MessageDigest digest = newDigest();
        update(digest, renderedSource);
        update(digest, profileId);
        update(digest, toolchainVersion);
        update(digest, targetTriple);
        return HexFormat.of().formatHex(digest.digest());
    }

    private static void update(MessageDigest digest, String component) {
        byte[] bytes = (component == null ? "" : component).getBytes(StandardCharsets.UTF_8);
        digest.update(ByteBuffer.allocate(Long.BYTES).putLong(bytes.length).array());
        digest.update(bytes);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
