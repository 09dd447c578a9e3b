// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.Test;

import io.ethrpc.core.error.JsonCodecException;

class JsonValueTest {

    record Block(String hash, String number) {
    }

    @Test
    void bindsObjectsToRecords() {
        JsonValue value = JsonValue.parse("{\"hash\":\"0xabc\",\"number\":\"0x1\",\"miner\":\"0x0\"}");

        Block block = value.as(Block.class);

        assertEquals(new Block("0xabc", "0x1"), block);
    }

    @Test
    void bindsGenericTypes() {
        JsonValue value = JsonValue.of(List.of(Map.of("a", 1), Map.of("a", 2)));

        List<Map<String, Integer>> decoded = value.as(new TypeReference<List<Map<String, Integer>>>() {
        });

        assertEquals(2, decoded.get(1).get("a"));
    }

    @Test
    void nullConvertsToNullExceptForJsonValue() {
        JsonValue value = JsonValue.parse("null");

        assertTrue(value.isNull());
        assertSame(JsonValue.NULL, value);
        assertNull(value.as(String.class));
        assertSame(JsonValue.NULL, value.as(JsonValue.class));
    }

    @Test
    void shapeMismatchIsCodecError() {
        JsonValue value = JsonValue.parse("{\"hash\":1}");

        JsonCodecException ex = assertThrows(JsonCodecException.class, () -> value.as(Integer.class));
        assertTrue(ex.getMessage().contains("java.lang.Integer"));
    }

    @Test
    void invalidJsonIsCodecError() {
        assertThrows(JsonCodecException.class, () -> JsonValue.parse("{not json"));
        assertThrows(JsonCodecException.class, () -> JsonValue.parse(""));
    }

    @Test
    void equalityFollowsJsonContent() {
        assertEquals(JsonValue.parse("{\"a\":[1,2]}"), JsonValue.of(Map.of("a", List.of(1, 2))));
        assertEquals("{\"a\":[1,2]}", JsonValue.of(Map.of("a", List.of(1, 2))).toJson());
    }
}
