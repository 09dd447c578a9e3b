// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import java.util.Objects;

import com.fasterxml.jackson.databind.JavaType;

/**
 * {@link RpcMethod} whose params and result are mapped by Jackson.
 */
final class JacksonMethod<P, R> implements RpcMethod<P, R> {

    private final String name;
    private final JavaType paramsType;
    private final JavaType resultType;

    JacksonMethod(final String name, final JavaType paramsType, final JavaType resultType) {
        this.name = RpcMethod.requireName(name);
        this.paramsType = Objects.requireNonNull(paramsType, "paramsType");
        this.resultType = Objects.requireNonNull(resultType, "resultType");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public JsonValue encodeParams(final P params) {
        return JsonValue.of(params);
    }

    @Override
    public P decodeParams(final JsonValue params) {
        return params.as(paramsType);
    }

    @Override
    public JsonValue encodeResult(final R result) {
        return JsonValue.of(result);
    }

    @Override
    public R decodeResult(final JsonValue result) {
        return result.as(resultType);
    }

    @Override
    public String toString() {
        return "RpcMethod[" + name + ": " + paramsType.toCanonical() + " -> " + resultType.toCanonical() + "]";
    }
}
