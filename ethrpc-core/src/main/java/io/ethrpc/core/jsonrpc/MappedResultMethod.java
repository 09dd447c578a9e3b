// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import java.util.Objects;
import java.util.function.Function;

import io.ethrpc.core.error.JsonCodecException;

/**
 * Decorates a method with a conversion of its result, see
 * {@link RpcMethod#withResult(Function, Function)}.
 */
final class MappedResultMethod<P, R, T> implements RpcMethod<P, T> {

    private final RpcMethod<P, R> delegate;
    private final Function<? super R, ? extends T> decoder;
    private final Function<? super T, ? extends R> encoder;

    MappedResultMethod(
            final RpcMethod<P, R> delegate,
            final Function<? super R, ? extends T> decoder,
            final Function<? super T, ? extends R> encoder) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public JsonValue encodeParams(final P params) {
        return delegate.encodeParams(params);
    }

    @Override
    public P decodeParams(final JsonValue params) {
        return delegate.decodeParams(params);
    }

    @Override
    public JsonValue encodeResult(final T result) {
        if (result == null) {
            return JsonValue.NULL;
        }
        return delegate.encodeResult(encoder.apply(result));
    }

    @Override
    public T decodeResult(final JsonValue result) {
        final R raw = delegate.decodeResult(result);
        if (raw == null) {
            return null;
        }
        try {
            return decoder.apply(raw);
        } catch (IllegalArgumentException e) {
            throw new JsonCodecException("Unable to convert result of " + name() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return delegate.toString();
    }
}
