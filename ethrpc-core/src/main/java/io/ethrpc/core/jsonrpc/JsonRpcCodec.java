// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.jspecify.annotations.Nullable;

import io.ethrpc.core.error.BatchCorrelationException;
import io.ethrpc.core.error.JsonCodecException;
import io.ethrpc.core.error.RpcException;

/**
 * Reads and writes JSON-RPC envelopes.
 *
 * <p>All methods are stateless and thread-safe. Parsing rejects objects with
 * duplicate keys and ignores unknown keys.
 */
public final class JsonRpcCodec {

    /**
     * Mapper shared by every envelope and {@link JsonValue} conversion.
     * Must not be reconfigured.
     */
    public static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private JsonRpcCodec() {
        // Utility class
    }

    /**
     * Serializes a request, notification or response.
     *
     * @throws JsonCodecException if serialization fails
     */
    public static String write(final Object envelope) {
        try {
            return MAPPER.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new JsonCodecException("Failed to serialize " + envelope.getClass().getSimpleName(), e);
        }
    }

    /**
     * Serializes requests as a JSON array, even for a single request.
     */
    public static String writeBatch(final List<JsonRpcRequest> requests) {
        return write(requests);
    }

    /**
     * Joins already serialized envelopes into a JSON array without
     * re-parsing them.
     */
    public static String join(final List<String> serialized) {
        return "[" + String.join(",", serialized) + "]";
    }

    /**
     * Parses a single response object.
     *
     * @throws JsonCodecException if the body is not a well-formed response
     */
    public static JsonRpcResponse readResponse(final String body) {
        return toResponse(readTree(body));
    }

    /**
     * Parses the reply to a batch request.
     *
     * <p>Nodes answer a batch they cannot process at all (e.g. one that
     * exceeds their batch limit) with a single error object instead of an
     * array; that error applies to the whole batch.
     *
     * @throws JsonCodecException        if the body is not well-formed
     * @throws RpcException              if the node answered with a single
     *                                   error object
     * @throws BatchCorrelationException if the node answered with a single
     *                                   successful response
     */
    public static List<JsonRpcResponse> readBatchResponse(final String body) {
        final JsonNode root = readTree(body);
        if (root.isArray()) {
            final List<JsonRpcResponse> responses = new ArrayList<>(root.size());
            for (JsonNode element : root) {
                responses.add(toResponse(element));
            }
            return responses;
        }
        final JsonRpcResponse single = toResponse(root);
        if (single.hasError()) {
            throw new RpcException(single.error(), single.id());
        }
        throw new BatchCorrelationException("expected an array of responses but got a single response");
    }

    /**
     * Parses a single request object.
     *
     * @throws JsonCodecException if the body is not a well-formed request
     */
    public static JsonRpcRequest readRequest(final String body) {
        return toRequest(readTree(body));
    }

    /**
     * Parses a JSON array of requests.
     *
     * @throws JsonCodecException if the body is not an array of well-formed
     *                            requests
     */
    public static List<JsonRpcRequest> readBatchRequest(final String body) {
        final JsonNode root = readTree(body);
        if (!root.isArray()) {
            throw new JsonCodecException("Expected a JSON array of requests");
        }
        final List<JsonRpcRequest> requests = new ArrayList<>(root.size());
        for (JsonNode element : root) {
            requests.add(toRequest(element));
        }
        return requests;
    }

    /**
     * Parses {@code json} into a tree.
     *
     * @throws JsonCodecException if {@code json} is empty or not valid JSON
     */
    public static JsonNode readTree(final String json) {
        if (json == null || json.isBlank()) {
            throw new JsonCodecException("Empty JSON document");
        }
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new JsonCodecException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    static JsonRpcResponse toResponse(final JsonNode node) {
        if (!node.isObject()) {
            throw new JsonCodecException("Expected a JSON RPC response object but got " + node.getNodeType());
        }
        readVersion(node);
        final Id id = readId(node.get("id"));
        final JsonNode resultNode = node.get("result");
        final JsonNode errorNode = node.get("error");
        final JsonRpcError error = errorNode == null || errorNode.isNull() ? null : readError(errorNode);
        if (resultNode != null) {
            return new JsonRpcResponse(JsonRpc.VERSION, JsonValue.fromNode(resultNode), error, id);
        }
        if (error == null) {
            throw new JsonCodecException("JSON RPC response is missing both 'result' and 'error'");
        }
        return new JsonRpcResponse(JsonRpc.VERSION, null, error, id);
    }

    private static JsonRpcRequest toRequest(final JsonNode node) {
        if (!node.isObject()) {
            throw new JsonCodecException("Expected a JSON RPC request object but got " + node.getNodeType());
        }
        readVersion(node);
        final JsonNode method = node.get("method");
        if (method == null || !method.isTextual()) {
            throw new JsonCodecException("JSON RPC request is missing a string 'method'");
        }
        final Id id = readId(node.get("id"));
        if (id == null) {
            throw new JsonCodecException("JSON RPC request is missing 'id'");
        }
        return new JsonRpcRequest(JsonRpc.VERSION, method.asText(), JsonValue.fromNode(node.get("params")), id);
    }

    private static void readVersion(final JsonNode node) {
        final JsonNode version = node.get("jsonrpc");
        if (version == null) {
            throw new JsonCodecException("JSON RPC envelope is missing 'jsonrpc'");
        }
        if (!version.isTextual() || !JsonRpc.VERSION.equals(version.asText())) {
            throw new JsonCodecException("Unsupported JSON RPC version " + version);
        }
    }

    private static @Nullable Id readId(final @Nullable JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new JsonCodecException("Unsupported JSON RPC id " + node);
        }
        final long value = node.asLong();
        if (value < 0 || value > Id.MAX_VALUE) {
            throw new JsonCodecException("JSON RPC id out of range: " + value);
        }
        return Id.of(value);
    }

    private static JsonRpcError readError(final JsonNode node) {
        if (!node.isObject()) {
            throw new JsonCodecException("Expected a JSON RPC error object but got " + node.getNodeType());
        }
        try {
            return MAPPER.treeToValue(node, JsonRpcError.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new JsonCodecException("Malformed JSON RPC error object: " + node, e);
        }
    }
}
