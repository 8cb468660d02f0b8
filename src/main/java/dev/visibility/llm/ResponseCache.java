package dev.visibility.llm;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Content-addressed store for LLM responses.
 */
public interface ResponseCache {

    Optional<LlmResponse> get(String key);

    void put(String key, LlmResponse response);

    /**
     * Drop entries past their TTL.
     *
     * @return number of entries removed
     */
    int evictExpired();

    void clear();

    int size();

    static String keyFor(String model, String prompt) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((model + ":" + prompt).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
