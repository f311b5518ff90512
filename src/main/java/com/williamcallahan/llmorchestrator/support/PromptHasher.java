package com.williamcallahan.llmorchestrator.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Produces stable SHA-256 fingerprints for prompts and cache keys.
 *
 * <p>Prompts are normalized before hashing (line endings unified, trailing whitespace on each line
 * removed, leading and trailing blank space trimmed) so that cosmetic differences do not defeat
 * the response cache.</p>
 */
public final class PromptHasher {

    private static final Pattern WINDOWS_LINE_ENDING = Pattern.compile("\\r\\n?");
    private static final Pattern TRAILING_LINE_WHITESPACE = Pattern.compile("[ \\t]+\\n");
    private static final String FIELD_SEPARATOR = "\u001f";

    private PromptHasher() {}

    /**
     * Normalizes prompt text so equivalent prompts hash identically.
     *
     * @param prompt raw prompt text
     * @return normalized prompt
     */
    public static String normalize(String prompt) {
        if (prompt == null) {
            return "";
        }
        String unifiedLineEndings = WINDOWS_LINE_ENDING.matcher(prompt).replaceAll("\n");
        return TRAILING_LINE_WHITESPACE.matcher(unifiedLineEndings).replaceAll("\n").strip();
    }

    /**
     * Hashes the normalized prompt together with the output-affecting parameters.
     *
     * @param prompt raw prompt text
     * @param parameterFingerprint canonical rendering of the generation parameters
     * @return lowercase hex SHA-256 digest
     */
    public static String promptHash(String prompt, String parameterFingerprint) {
        return sha256(normalize(prompt) + FIELD_SEPARATOR + parameterFingerprint);
    }

    /**
     * Hashes arbitrary key parts joined by a separator that cannot appear in normal text.
     *
     * @param parts key components in a fixed order
     * @return lowercase hex SHA-256 digest
     */
    public static String hashParts(String... parts) {
        return sha256(String.join(FIELD_SEPARATOR, parts));
    }

    /**
     * Generates a SHA-256 hash for text content.
     *
     * @param text the text to hash
     * @return hexadecimal string representation of the hash
     */
    public static String sha256(String text) {
        try {
            MessageDigest messageDigest = MessageDigest.getInstance("SHA-256");
            byte[] digest = messageDigest.digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException noAlgorithm) {
            throw new IllegalStateException("SHA-256 is not available", noAlgorithm);
        }
    }
}
