// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.ethrpc.core.error.JsonCodecException;
import io.ethrpc.core.jsonrpc.Empty;
import io.ethrpc.core.jsonrpc.JsonValue;

class EthTest {

    private static final String ADDRESS = "0x00000000219ab540356cbb839cbe05303d7705fa";

    @Test
    void accountQueryIsPositional() {
        JsonValue params = Eth.GET_BALANCE.encodeParams(new Eth.AccountQuery(ADDRESS, BlockSpec.LATEST));

        assertEquals("[\"" + ADDRESS + "\",\"latest\"]", params.toJson());
    }

    @Test
    void blockQueryEncodesNumberAsQuantity() {
        JsonValue params = Eth.GET_BLOCK_BY_NUMBER.encodeParams(new Eth.BlockQuery(BlockSpec.number(436), true));

        assertEquals("[\"0x1b4\",true]", params.toJson());
    }

    @Test
    void callOmitsUnsetFields() {
        JsonValue params = Eth.CALL.encodeParams(
                new Eth.CallQuery(Eth.Call.of(ADDRESS, "0x06fdde03"), BlockSpec.FINALIZED));

        assertEquals("[{\"to\":\"" + ADDRESS + "\",\"data\":\"0x06fdde03\"},\"finalized\"]", params.toJson());
    }

    @Test
    void callCarriesStateOverridesAsThirdParam() {
        JsonValue overrides = JsonValue.parse("{\"" + ADDRESS + "\":{\"balance\":\"0xde0b6b3a7640000\"}}");

        JsonValue params = Eth.CALL.encodeParams(
                new Eth.CallQuery(Eth.Call.of(ADDRESS, "0x"), BlockSpec.LATEST, overrides));

        assertEquals(3, params.node().size());
        assertEquals("latest", params.node().get(1).asText());
        assertEquals("0xde0b6b3a7640000", params.node().get(2).get(ADDRESS).get("balance").asText());
    }

    @Test
    void logFilterRange() {
        JsonValue params = Eth.GET_LOGS.encodeParams(new Eth.LogQuery(
                Eth.LogFilter.range(BlockSpec.number(1), BlockSpec.LATEST, ADDRESS)));

        assertEquals("[{\"fromBlock\":\"0x1\",\"toBlock\":\"latest\",\"address\":[\"" + ADDRESS + "\"]}]",
                params.toJson());
    }

    @Test
    void transactionQuery() {
        JsonValue params = Eth.GET_TRANSACTION_BY_HASH.encodeParams(new Eth.TransactionQuery("0xabc"));

        assertEquals("[\"0xabc\"]", params.toJson());
    }

    @Test
    void noParamMethodsSendEmptyArray() {
        assertEquals("[]", Eth.CHAIN_ID.encodeParams(Empty.INSTANCE).toJson());
        assertEquals("eth_chainId", Eth.CHAIN_ID.name());
    }

    @Test
    void quantityResultsDecodeToBigInteger() {
        assertEquals(BigInteger.valueOf(1), Eth.CHAIN_ID.decodeResult(JsonValue.of("0x1")));
        assertEquals(JsonValue.of("0x2a"), Eth.BLOCK_NUMBER.encodeResult(BigInteger.valueOf(42)));
    }

    @Test
    void malformedQuantityResultIsCodecError() {
        assertThrows(JsonCodecException.class, () -> Eth.GAS_PRICE.decodeResult(JsonValue.of("42")));
    }

    @Test
    void unknownBlockIsNull() {
        JsonValue block = Eth.GET_BLOCK_BY_HASH.decodeResult(JsonValue.NULL);

        assertTrue(block == null || block.isNull());
    }

    @Test
    void logsDecodeToList() {
        List<JsonValue> logs = Eth.GET_LOGS.decodeResult(JsonValue.parse("[{\"logIndex\":\"0x0\"},{\"logIndex\":\"0x1\"}]"));

        assertEquals(2, logs.size());
        assertEquals("0x1", logs.get(1).node().get("logIndex").asText());
    }

    @Test
    void blockSpecParsesWireForm() {
        assertEquals(BlockSpec.number(436), BlockSpec.parse("0x1b4"));
        assertEquals(BlockSpec.SAFE, BlockSpec.parse("safe"));
        assertEquals("0x0", BlockSpec.number(0).toRpcValue());
        assertThrows(IllegalArgumentException.class, () -> BlockSpec.number(-1));
        assertThrows(IllegalArgumentException.class, () -> BlockSpec.parse(" "));
    }
}
