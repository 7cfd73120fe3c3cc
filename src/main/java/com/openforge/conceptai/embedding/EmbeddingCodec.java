package com.openforge.conceptai.embedding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Durable encoding of embedding vectors.
 *
 * Current format: raw float32, little-endian, 4 bytes per component.
 *
 * Legacy format: the UTF-8 text of a JSON number array, e.g. {@code [0.12,-0.5]}.
 * The binary migration copied these rows into the BLOB column unchanged, so
 * both formats share one column.  Decoding tries binary first; a payload that
 * is framed like a JSON array, has a length that is not a multiple of 4, or
 * yields non-finite floats is not accepted as binary and goes to the legacy
 * parser instead.
 */
public final class EmbeddingCodec {

    private static final ObjectMapper JSON = new ObjectMapper();

    private EmbeddingCodec() {
    }

    public static byte[] encode(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float v : vector) {
            buffer.putFloat(v);
        }
        return buffer.array();
    }

    /**
     * @throws DecodeException when the payload is neither valid binary nor a legacy JSON array
     */
    public static DecodedVector decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new DecodeException("empty embedding payload");
        }
        float[] binary = decodeBinary(payload);
        if (binary != null) {
            return new DecodedVector(binary, false);
        }
        return new DecodedVector(decodeLegacyJson(payload), true);
    }

    /** Parses the legacy JSON text encoding. */
    public static float[] decodeLegacyJson(byte[] payload) {
        JsonNode node;
        try {
            node = JSON.readTree(new String(payload, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new DecodeException("payload is neither float32 binary nor a JSON array", e);
        }
        if (node == null || !node.isArray()) {
            throw new DecodeException("legacy payload is not a JSON array");
        }
        float[] vector = new float[node.size()];
        for (int i = 0; i < node.size(); i++) {
            JsonNode element = node.get(i);
            if (!element.isNumber()) {
                throw new DecodeException("legacy payload element %d is not a number".formatted(i));
            }
            vector[i] = element.floatValue();
        }
        return vector;
    }

    /** Legacy JSON text of a vector; used by tests and by tooling that seeds old rows. */
    public static byte[] encodeLegacyJson(float[] vector) {
        try {
            return JSON.writeValueAsBytes(vector);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write legacy embedding", e);
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private static float[] decodeBinary(byte[] payload) {
        if (payload.length % Float.BYTES != 0 || looksLikeJsonArray(payload)) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        float[] vector = new float[payload.length / Float.BYTES];
        for (int i = 0; i < vector.length; i++) {
            float v = buffer.getFloat();
            if (!Float.isFinite(v)) {
                return null;
            }
            vector[i] = v;
        }
        return vector;
    }

    private static boolean looksLikeJsonArray(byte[] payload) {
        int start = 0;
        int end   = payload.length - 1;
        while (start <= end && isAsciiWhitespace(payload[start])) start++;
        while (end >= start && isAsciiWhitespace(payload[end])) end--;
        return start < end && payload[start] == '[' && payload[end] == ']';
    }

    private static boolean isAsciiWhitespace(byte b) {
        return b == ' ' || b == '\n' || b == '\r' || b == '\t';
    }

    // ── Result & exception ───────────────────────────────────────────────────

    /**
     * @param legacy true when the payload was the JSON text encoding and should be rewritten
     */
    public record DecodedVector(float[] values, boolean legacy) {
    }

    /** Unreadable stored embedding.  Never surfaced past the orchestrator or the index. */
    public static class DecodeException extends RuntimeException {
        public DecodeException(String message) { super(message); }
        public DecodeException(String message, Throwable cause) { super(message, cause); }
    }
}
