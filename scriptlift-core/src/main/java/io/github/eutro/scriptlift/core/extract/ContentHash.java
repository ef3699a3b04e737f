package io.github.eutro.scriptlift.core.extract;

import io.github.eutro.scriptlift.core.script.ScriptObject;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Cache keys for script contents.
 */
public final class ContentHash {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private ContentHash() {
    }

    /**
     * Hash the contents of a script: its text if it has any, its identity otherwise.
     *
     * @param script The script.
     * @param text   The text of the script, or null.
     * @return The key.
     */
    public static String of(ScriptObject script, @Nullable String text) {
        return text != null ? "text:" + sha256(text) : of(ExtractionCascade.identityOf(script), null);
    }

    /**
     * Hash the contents of a script whose identity has already been read.
     *
     * @param identity The identity of the script.
     * @param text     The text of the script, or null.
     * @return The key.
     */
    public static String of(String identity, @Nullable String text) {
        return text != null ? "text:" + sha256(text) : "id:" + sha256(identity);
    }

    /**
     * Compute the lowercase hex SHA-256 of the UTF-8 encoding of a string.
     *
     * @param s The string.
     * @return The hash.
     */
    public static String sha256(String s) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to support SHA-256
            throw new AssertionError(e);
        }
        byte[] hash = digest.digest(s.getBytes(StandardCharsets.UTF_8));
        char[] out = new char[hash.length * 2];
        for (int i = 0; i < hash.length; i++) {
            out[i * 2] = HEX[(hash[i] >> 4) & 0xF];
            out[i * 2 + 1] = HEX[hash[i] & 0xF];
        }
        return new String(out);
    }
}
