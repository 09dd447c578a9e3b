// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Params of a method that takes no arguments. Encodes as {@code []} and only
 * decodes from an empty array.
 */
public enum Empty {
    INSTANCE;

    @com.fasterxml.jackson.annotation.JsonValue
    List<Object> toJson() {
        return List.of();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static Empty fromJson(final List<Object> values) {
        if (values != null && !values.isEmpty()) {
            throw new IllegalArgumentException("expected empty params but got " + values.size() + " values");
        }
        return INSTANCE;
    }
}
