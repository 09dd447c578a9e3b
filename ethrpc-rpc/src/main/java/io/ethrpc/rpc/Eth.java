// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.rpc;

import java.math.BigInteger;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.type.TypeReference;
import org.jspecify.annotations.Nullable;

import io.ethrpc.core.jsonrpc.Empty;
import io.ethrpc.core.jsonrpc.JsonValue;
import io.ethrpc.core.jsonrpc.RpcMethod;

/**
 * Descriptors of commonly used {@code eth_} methods.
 *
 * <p>
 * Quantities are decoded to {@link BigInteger}; blocks, transactions and logs
 * are returned as {@link JsonValue} so callers can bind them to their own
 * types with {@link JsonValue#as(Class)}. Lookups of unknown blocks or
 * transactions yield {@link JsonValue#NULL}.
 *
 * <pre>{@code
 * BigInteger balance = client.call(Eth.GET_BALANCE, new Eth.AccountQuery(address, BlockSpec.LATEST));
 * JsonValue block = client.call(Eth.GET_BLOCK_BY_NUMBER, new Eth.BlockQuery(BlockSpec.number(1), false));
 * }</pre>
 */
public final class Eth {

    public static final RpcMethod<Empty, BigInteger> BLOCK_NUMBER = quantity("eth_blockNumber");

    public static final RpcMethod<Empty, BigInteger> CHAIN_ID = quantity("eth_chainId");

    public static final RpcMethod<Empty, BigInteger> GAS_PRICE = quantity("eth_gasPrice");

    public static final RpcMethod<AccountQuery, BigInteger> GET_BALANCE =
            RpcMethod.of("eth_getBalance", AccountQuery.class, String.class)
                    .withResult(Quantity::decode, Quantity::encode);

    /** Returns the deployed bytecode as hex, {@code 0x} for accounts without code. */
    public static final RpcMethod<AccountQuery, String> GET_CODE =
            RpcMethod.of("eth_getCode", AccountQuery.class, String.class);

    public static final RpcMethod<BlockQuery, JsonValue> GET_BLOCK_BY_NUMBER =
            RpcMethod.of("eth_getBlockByNumber", BlockQuery.class, JsonValue.class);

    public static final RpcMethod<BlockHashQuery, JsonValue> GET_BLOCK_BY_HASH =
            RpcMethod.of("eth_getBlockByHash", BlockHashQuery.class, JsonValue.class);

    public static final RpcMethod<TransactionQuery, JsonValue> GET_TRANSACTION_BY_HASH =
            RpcMethod.of("eth_getTransactionByHash", TransactionQuery.class, JsonValue.class);

    /** Executes a message call without creating a transaction; returns the output as hex. */
    public static final RpcMethod<CallQuery, String> CALL =
            RpcMethod.of("eth_call", CallQuery.class, String.class);

    public static final RpcMethod<LogQuery, List<JsonValue>> GET_LOGS =
            RpcMethod.of("eth_getLogs", LogQuery.class, new TypeReference<List<JsonValue>>() {
            });

    private Eth() {
    }

    private static RpcMethod<Empty, BigInteger> quantity(final String name) {
        return RpcMethod.of(name, String.class).withResult(Quantity::decode, Quantity::encode);
    }

    /**
     * Params {@code [address, block]}.
     */
    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    @JsonPropertyOrder({"address", "block"})
    public record AccountQuery(String address, BlockSpec block) {
    }

    /**
     * Params {@code [block, hydrated]}; {@code hydrated} selects full
     * transaction objects instead of hashes.
     */
    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    @JsonPropertyOrder({"block", "hydrated"})
    public record BlockQuery(BlockSpec block, boolean hydrated) {
    }

    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    @JsonPropertyOrder({"hash", "hydrated"})
    public record BlockHashQuery(String hash, boolean hydrated) {
    }

    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    public record TransactionQuery(String hash) {
    }

    /**
     * Params {@code [call, block]}, or {@code [call, block, stateOverrides]}
     * when overrides are set. Overrides map addresses to the balance, nonce,
     * code or storage to assume for the duration of the call.
     */
    public record CallQuery(Call call, BlockSpec block, @Nullable JsonValue stateOverrides) {

        public CallQuery(final Call call, final BlockSpec block) {
            this(call, block, null);
        }

        @com.fasterxml.jackson.annotation.JsonValue
        public List<Object> toParams() {
            return stateOverrides == null ? List.of(call, block) : List.of(call, block, stateOverrides);
        }
    }

    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    public record LogQuery(LogFilter filter) {
    }

    /**
     * The call object of {@code eth_call}. Quantities are hex strings; unset
     * fields are omitted.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Call(
            @Nullable String from,
            String to,
            @Nullable String gas,
            @Nullable String gasPrice,
            @Nullable String value,
            @Nullable String data) {

        public static Call of(final String to, final String data) {
            return new Call(null, to, null, null, null, data);
        }
    }

    /**
     * The filter object of {@code eth_getLogs}. Unset fields are omitted.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record LogFilter(
            @Nullable BlockSpec fromBlock,
            @Nullable BlockSpec toBlock,
            @Nullable List<String> address,
            @Nullable List<String> topics,
            @Nullable String blockHash) {

        public static LogFilter range(final BlockSpec fromBlock, final BlockSpec toBlock, final String address) {
            return new LogFilter(fromBlock, toBlock, List.of(address), null, null);
        }
    }
}
