// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import io.ethrpc.core.InternalApi;
import io.ethrpc.core.error.JsonCodecException;

/**
 * An arbitrary JSON value: request params, a call result, or error data.
 *
 * <p>The engine never looks inside these values. Typed data goes in through
 * {@link #of(Object)} and comes out through {@link #as(Class)}, both backed
 * by {@link JsonRpcCodec#MAPPER}. Values are immutable.
 */
public final class JsonValue {

    /** The JSON {@code null} literal. */
    public static final JsonValue NULL = new JsonValue(NullNode.getInstance());

    private final JsonNode node;

    private JsonValue(final JsonNode node) {
        this.node = node;
    }

    /**
     * Serializes {@code data} with the shared mapper.
     *
     * @throws JsonCodecException if Jackson cannot serialize the value
     */
    public static JsonValue of(final Object data) {
        if (data == null) {
            return NULL;
        }
        if (data instanceof JsonValue value) {
            return value;
        }
        try {
            return fromNode(JsonRpcCodec.MAPPER.valueToTree(data));
        } catch (IllegalArgumentException e) {
            throw new JsonCodecException("Unable to serialize " + data.getClass().getName() + " to JSON", e);
        }
    }

    /**
     * Parses a JSON document.
     *
     * @throws JsonCodecException if {@code json} is not valid JSON
     */
    public static JsonValue parse(final String json) {
        return fromNode(JsonRpcCodec.readTree(json));
    }

    @InternalApi
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static JsonValue fromNode(final JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NULL;
        }
        return new JsonValue(node.deepCopy());
    }

    /**
     * Converts this value to {@code type}. A JSON {@code null} converts to
     * {@code null} for every type except {@code JsonValue} itself.
     *
     * @throws JsonCodecException if the value does not have the expected shape
     */
    public <T> T as(final Class<T> type) {
        return as(JsonRpcCodec.MAPPER.constructType(type));
    }

    public <T> T as(final TypeReference<T> type) {
        return as(JsonRpcCodec.MAPPER.getTypeFactory().constructType(type));
    }

    @SuppressWarnings("unchecked")
    <T> T as(final JavaType type) {
        if (type.getRawClass() == JsonValue.class) {
            return (T) this;
        }
        if (node.isNull()) {
            return null;
        }
        try {
            return JsonRpcCodec.MAPPER.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new JsonCodecException("Unable to decode " + abbreviate() + " as " + type.toCanonical(), e);
        }
    }

    public boolean isNull() {
        return node.isNull();
    }

    /**
     * Returns the underlying tree. The returned node must not be modified.
     */
    @InternalApi
    @com.fasterxml.jackson.annotation.JsonValue
    public JsonNode node() {
        return node;
    }

    /**
     * Returns the compact JSON text of this value.
     */
    public String toJson() {
        return node.toString();
    }

    private String abbreviate() {
        final String json = toJson();
        return json.length() <= 64 ? json : json.substring(0, 61) + "...";
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof JsonValue other && node.equals(other.node);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(node);
    }

    @Override
    public String toString() {
        return toJson();
    }
}
