package br.edu.ifba.kgraph.utils;

import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic SHA-256 digests for graph identifiers.
 */
public final class HashUtil {

    /**
     * Length of the hex prefix used for entity and relationship ids.
     */
    public static final int SHORT_ID_LENGTH = 16;

    private HashUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Computes the SHA-256 hash of a string.
     *
     * @param input the input string
     * @return lowercase hex-encoded hash (64 chars)
     */
    @NotNull
    public static String sha256Hex(@NotNull String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));

            StringBuilder hexString = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Returns the first {@value #SHORT_ID_LENGTH} hex chars of the SHA-256 hash.
     */
    @NotNull
    public static String shortId(@NotNull String input) {
        return sha256Hex(input).substring(0, SHORT_ID_LENGTH);
    }
}
