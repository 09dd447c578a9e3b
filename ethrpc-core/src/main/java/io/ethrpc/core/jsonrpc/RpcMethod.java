// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import java.util.Objects;
import java.util.function.Function;

import com.fasterxml.jackson.core.type.TypeReference;

import io.ethrpc.core.error.JsonCodecException;

/**
 * Describes one JSON-RPC method: its wire name and how its params and result
 * map to JSON.
 *
 * <p>Descriptors are immutable and usually held in constants:
 *
 * <pre>{@code
 * RpcMethod<Empty, String> CLIENT_VERSION = RpcMethod.of("web3_clientVersion", String.class);
 *
 * RpcMethod<Empty, BigInteger> BLOCK_NUMBER = RpcMethod.of("eth_blockNumber", String.class)
 *         .withResult(Quantity::decode, Quantity::encode);
 * }</pre>
 *
 * <p>Two descriptors may share a wire name only if they are interchangeable
 * on the wire.
 *
 * @param <P> the params shape
 * @param <R> the result shape
 */
public interface RpcMethod<P, R> {

    /**
     * Returns the wire name, e.g. {@code eth_blockNumber}. Never changes.
     */
    String name();

    /**
     * @throws JsonCodecException if the params cannot be serialized
     */
    JsonValue encodeParams(P params);

    /**
     * @throws JsonCodecException if the value does not have the params shape
     */
    P decodeParams(JsonValue params);

    /**
     * @throws JsonCodecException if the result cannot be serialized
     */
    JsonValue encodeResult(R result);

    /**
     * @throws JsonCodecException if the value does not have the result shape
     */
    R decodeResult(JsonValue result);

    /**
     * Returns a descriptor with the same name and params that converts the
     * result through {@code decoder} and back through {@code encoder}.
     *
     * <p>A JSON {@code null} result stays {@code null}; the functions only
     * see non-null values.
     */
    default <T> RpcMethod<P, T> withResult(
            final Function<? super R, ? extends T> decoder,
            final Function<? super T, ? extends R> encoder) {
        return new MappedResultMethod<>(this, decoder, encoder);
    }

    /**
     * Creates a method taking no parameters ({@code "params": []}).
     */
    static <R> RpcMethod<Empty, R> of(final String name, final Class<R> result) {
        return of(name, Empty.class, result);
    }

    static <P, R> RpcMethod<P, R> of(final String name, final Class<P> params, final Class<R> result) {
        return new JacksonMethod<>(
                name,
                JsonRpcCodec.MAPPER.constructType(params),
                JsonRpcCodec.MAPPER.constructType(result));
    }

    static <P, R> RpcMethod<P, R> of(final String name, final Class<P> params, final TypeReference<R> result) {
        return new JacksonMethod<>(
                name,
                JsonRpcCodec.MAPPER.constructType(params),
                JsonRpcCodec.MAPPER.getTypeFactory().constructType(result));
    }

    static <P, R> RpcMethod<P, R> of(
            final String name, final TypeReference<P> params, final TypeReference<R> result) {
        return new JacksonMethod<>(
                name,
                JsonRpcCodec.MAPPER.getTypeFactory().constructType(params),
                JsonRpcCodec.MAPPER.getTypeFactory().constructType(result));
    }

    /**
     * Creates an untyped method: params and result are passed through as
     * plain JSON values. Useful for node-specific methods without a
     * dedicated descriptor.
     */
    static RpcMethod<JsonValue, JsonValue> raw(final String name) {
        return of(name, JsonValue.class, JsonValue.class);
    }

    /**
     * Checks a wire name; used by implementations.
     */
    static String requireName(final String name) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("method name must not be blank");
        }
        return name;
    }
}
