// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * A JSON-RPC error code, classified by the ranges JSON-RPC 2.0 reserves.
 *
 * <p>Classification is total: every {@code int} maps to exactly one
 * {@link Kind}, and {@link #code()} always returns the integer the code was
 * created from.
 *
 * <pre>{@code
 * ErrorCode.of(-32601).kind();  // METHOD_NOT_FOUND
 * ErrorCode.of(-32050).kind();  // SERVER_ERROR
 * ErrorCode.of(-32768).kind();  // RESERVED
 * ErrorCode.of(3).kind();       // OTHER (e.g. geth's "execution reverted")
 * }</pre>
 */
public final class ErrorCode {

    public enum Kind {
        /** {@code -32700}: invalid JSON was received. */
        PARSE_ERROR,
        /** {@code -32600}: the JSON sent is not a valid request object. */
        INVALID_REQUEST,
        /** {@code -32601}: the method does not exist or is not available. */
        METHOD_NOT_FOUND,
        /** {@code -32602}: invalid method parameters. */
        INVALID_PARAMS,
        /** {@code -32603}: internal JSON-RPC error. */
        INTERNAL_ERROR,
        /** {@code -32099..-32000}: implementation-defined server errors. */
        SERVER_ERROR,
        /** Any other code in {@code -32768..-32000}. */
        RESERVED,
        /** Everything outside the reserved range. */
        OTHER
    }

    public static final ErrorCode PARSE_ERROR = new ErrorCode(Kind.PARSE_ERROR, -32700);
    public static final ErrorCode INVALID_REQUEST = new ErrorCode(Kind.INVALID_REQUEST, -32600);
    public static final ErrorCode METHOD_NOT_FOUND = new ErrorCode(Kind.METHOD_NOT_FOUND, -32601);
    public static final ErrorCode INVALID_PARAMS = new ErrorCode(Kind.INVALID_PARAMS, -32602);
    public static final ErrorCode INTERNAL_ERROR = new ErrorCode(Kind.INTERNAL_ERROR, -32603);

    private static final int RESERVED_MIN = -32768;
    private static final int RESERVED_MAX = -32000;
    private static final int SERVER_ERROR_MIN = -32099;

    private final Kind kind;
    private final int code;

    private ErrorCode(final Kind kind, final int code) {
        this.kind = kind;
        this.code = code;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ErrorCode of(final int code) {
        return switch (code) {
            case -32700 -> PARSE_ERROR;
            case -32600 -> INVALID_REQUEST;
            case -32601 -> METHOD_NOT_FOUND;
            case -32602 -> INVALID_PARAMS;
            case -32603 -> INTERNAL_ERROR;
            default -> classify(code);
        };
    }

    private static ErrorCode classify(final int code) {
        if (code >= SERVER_ERROR_MIN && code <= RESERVED_MAX) {
            return new ErrorCode(Kind.SERVER_ERROR, code);
        }
        if (code >= RESERVED_MIN && code <= RESERVED_MAX) {
            return new ErrorCode(Kind.RESERVED, code);
        }
        return new ErrorCode(Kind.OTHER, code);
    }

    public Kind kind() {
        return kind;
    }

    @com.fasterxml.jackson.annotation.JsonValue
    public int code() {
        return code;
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof ErrorCode other && code == other.code;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(code);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case PARSE_ERROR -> "parse error";
            case INVALID_REQUEST -> "invalid request";
            case METHOD_NOT_FOUND -> "method not found";
            case INVALID_PARAMS -> "invalid params";
            case INTERNAL_ERROR -> "internal error";
            case SERVER_ERROR -> "server error (" + code + ")";
            case RESERVED -> "reserved (" + code + ")";
            case OTHER -> Integer.toString(code);
        };
    }
}
