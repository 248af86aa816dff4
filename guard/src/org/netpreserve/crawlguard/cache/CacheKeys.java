package org.netpreserve.crawlguard.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.crawlguard.util.Json;

import java.io.UncheckedIOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Key derivation for the response cache. All keys are lowercase hex SHA-256 digests.
 */
final class CacheKeys {
    static final int PROMPT_HASH_LENGTH = 16;
    static final int SIMILARITY_PREFIX_LENGTH = 8;

    private CacheKeys() {
    }

    /**
     * Identifies a request independent of the model answering it. A null or empty context is the same as none.
     */
    static String requestKey(String content, @Nullable Object context) {
        String material = content;
        String canonicalContext = canonicalContext(context);
        if (canonicalContext != null) {
            material += '\u0000' + canonicalContext;
        }
        return sha256(material);
    }

    static String entryKey(String requestKey, String model) {
        return sha256(requestKey + '\u0000' + model);
    }

    static String promptHash(String content) {
        return sha256(content).substring(0, PROMPT_HASH_LENGTH);
    }

    private static @Nullable String canonicalContext(@Nullable Object context) {
        if (context == null) return null;
        JsonNode tree = context instanceof JsonNode node ? node : Json.mapper().valueToTree(context);
        if (tree.isNull() || tree.isMissingNode() || (tree.isContainerNode() && tree.isEmpty())) return null;
        try {
            return Json.mapper().writeValueAsString(Json.canonical(tree));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String sha256(String text) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
    }
}
