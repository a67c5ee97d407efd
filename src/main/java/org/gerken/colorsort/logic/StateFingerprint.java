package org.gerken.colorsort.logic;

import org.gerken.colorsort.model.Layout;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Computes order-independent fingerprints of layouts for visited-state detection.
 *
 * The fingerprint is the MD5 digest of the layout's canonical form, in which the
 * flasks are sorted, so layouts that differ only by flask order share a fingerprint.
 * Equal fingerprints are treated as equal states; a collision would make the search
 * skip a state it has not seen.
 */
public final class StateFingerprint {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private StateFingerprint() {
    }

    /**
     * Computes the fingerprint of a layout.
     *
     * @param layout the layout
     * @return 32 lowercase hex characters
     */
    public static String of(Layout layout) {
        byte[] digest = newDigest().digest(layout.canonicalForm().getBytes(StandardCharsets.UTF_8));
        char[] result = new char[digest.length * 2];
        for (int i = 0; i < digest.length; i++) {
            result[2 * i] = HEX[(digest[i] >> 4) & 0xF];
            result[2 * i + 1] = HEX[digest[i] & 0xF];
        }
        return new String(result);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            // Every Java platform is required to provide MD5
            throw new IllegalStateException("MD5 digest not available", e);
        }
    }
}
