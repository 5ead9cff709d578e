package dev.workflow.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;

/**
 * Key-order independent JSON normalization and hashing.
 * Object keys are sorted at every depth; array order is kept.
 */
public final class CanonicalJson {

    public static final String HASH_PREFIX = "sha256:";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CanonicalJson() {}

    /**
     * Return a deep copy of {@code value} whose object keys are in natural string order.
     */
    public static JsonNode canonicalize(JsonNode value) {
        if (value == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (value.isObject()) {
            List<String> keys = new ArrayList<>();
            value.fieldNames().forEachRemaining(keys::add);
            Collections.sort(keys);

            ObjectNode sorted = JsonNodeFactory.instance.objectNode();
            for (String key : keys) {
                sorted.set(key, canonicalize(value.get(key)));
            }
            return sorted;
        }
        if (value.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode();
            value.forEach(item -> copy.add(canonicalize(item)));
            return copy;
        }
        return value.deepCopy();
    }

    /**
     * Compact serialization. Callers pass canonicalized trees; key order is whatever the tree holds.
     */
    public static String serialize(JsonNode canonical) {
        try {
            return MAPPER.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize canonical JSON", e);
        }
    }

    /**
     * {@code sha256:<lowercase hex>} of the canonical serialization of {@code value}.
     */
    public static String hash(JsonNode value) {
        return HASH_PREFIX + sha256Hex(serialize(canonicalize(value)));
    }

    public static String sha256Hex(String input) {
        return HexFormat.of().formatHex(sha256(input));
    }

    static byte[] sha256(String input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Accept a hash bare or prefixed; blank input normalizes to the empty string.
     */
    public static String normalizeHash(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        String trimmed = value.trim();
        return trimmed.startsWith(HASH_PREFIX) ? trimmed : HASH_PREFIX + trimmed;
    }
}
