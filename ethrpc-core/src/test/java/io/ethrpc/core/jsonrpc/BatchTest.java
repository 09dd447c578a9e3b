// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;

import io.ethrpc.core.error.BatchCorrelationException;
import io.ethrpc.core.error.JsonCodecException;
import io.ethrpc.core.error.RpcException;

class BatchTest {

    private static final RpcMethod<Long, Long> SQUARE = RpcMethod.of("test_square", Long.class, Long.class);
    private static final RpcMethod<Empty, String> CLIENT_VERSION = RpcMethod.of("web3_clientVersion", String.class);

    /**
     * Answers test_square with params squared, reordering batch replies with
     * the given seed.
     */
    private static RoundTrip<String, String> shuffledSquares(final long seed) {
        return body -> {
            List<JsonRpcResponse> responses = new ArrayList<>();
            for (JsonRpcRequest request : JsonRpcCodec.readBatchRequest(body)) {
                long n = request.params().as(Long.class);
                responses.add(JsonRpcResponse.success(JsonValue.of(n * n), request.id()));
            }
            Collections.shuffle(responses, new Random(seed));
            return JsonRpcCodec.write(responses);
        };
    }

    private static Batch squares(final long count) {
        Batch batch = Batch.create();
        for (long i = 0; i < count; i++) {
            batch.add(SQUARE, i);
        }
        return batch;
    }

    @Test
    void resultsFollowSubmissionOrderWhateverTheReplyOrder() {
        for (long seed = 0; seed < 20; seed++) {
            List<Object> values = JsonRpc.batch(squares(10), JsonRpc.overText(shuffledSquares(seed)));

            assertEquals(List.of(0L, 1L, 4L, 9L, 16L, 25L, 36L, 49L, 64L, 81L), values);
        }
    }

    @Test
    void handlesReceiveTheirOwnResults() {
        TestNode node = new TestNode()
                .result("web3_clientVersion", "Geth/v1")
                .error("eth_chainId", -32601, "not here")
                .reverseBatches();
        Batch batch = Batch.create();
        BatchHandle<String> version = batch.add(CLIENT_VERSION);
        BatchHandle<String> chainId = batch.add(RpcMethod.of("eth_chainId", String.class));

        List<BatchResult<?>> results = JsonRpc.tryBatch(batch, JsonRpc.overText(node));

        assertEquals(2, results.size());
        assertEquals("Geth/v1", version.get());
        assertTrue(version.result().success());
        assertFalse(chainId.result().success());
        assertEquals(-32601, chainId.result().error().code().code());
        assertThrows(RpcException.class, chainId::get);
        assertEquals("Geth/v1", results.get(0).data());
        assertFalse(results.get(1).success());
    }

    @Test
    void valuesThrowFirstErrorInSubmissionOrder() {
        TestNode node = new TestNode()
                .result("web3_clientVersion", "Geth")
                .error("a_first", -32000, "first")
                .error("b_second", -32001, "second");
        Batch batch = Batch.create();
        batch.add(CLIENT_VERSION);
        batch.add(RpcMethod.of("a_first", String.class));
        batch.add(RpcMethod.of("b_second", String.class));

        RpcException ex = assertThrows(RpcException.class, () -> JsonRpc.batch(batch, JsonRpc.overText(node)));

        assertEquals(-32000, ex.code());
    }

    @Test
    void emptyBatchSkipsRoundTrip() {
        List<BatchResult<?>> results = JsonRpc.tryBatch(Batch.create(), requests -> {
            throw new AssertionError("round trip must not be invoked");
        });

        assertTrue(results.isEmpty());
    }

    @Test
    void singleCallBatchIsSentAsArray() {
        TestNode node = new TestNode().result("web3_clientVersion", "Geth");
        Batch batch = Batch.create();
        BatchHandle<String> handle = batch.add(CLIENT_VERSION);

        JsonRpc.tryBatch(batch, JsonRpc.overText(node));

        assertTrue(node.received().get(0).startsWith("["));
        assertEquals("Geth", handle.get());
    }

    @Test
    void idsAreAllocatedInSubmissionOrder() {
        List<JsonRpcRequest> seen = new ArrayList<>();
        JsonRpc.tryBatch(squares(5), requests -> {
            seen.addAll(requests);
            List<JsonRpcResponse> responses = new ArrayList<>();
            for (JsonRpcRequest request : requests) {
                responses.add(JsonRpcResponse.success(JsonValue.of(0), request.id()));
            }
            return responses;
        });

        for (int i = 1; i < seen.size(); i++) {
            assertTrue(seen.get(i - 1).id().compareTo(seen.get(i).id()) < 0);
            assertEquals((long) i, seen.get(i).params().as(Long.class));
        }
    }

    @Test
    void missingResponseIsCorrelationError() {
        TestNode node = new TestNode().echo("test_square").tamperBatch(responses -> responses.subList(1, responses.size()));

        assertThrows(BatchCorrelationException.class, () -> JsonRpc.tryBatch(squares(3), JsonRpc.overText(node)));
    }

    @Test
    void extraResponseIsCorrelationError() {
        TestNode node = new TestNode().echo("test_square").tamperBatch(responses -> {
            List<JsonRpcResponse> more = new ArrayList<>(responses);
            more.add(responses.get(0));
            return more;
        });

        assertThrows(BatchCorrelationException.class, () -> JsonRpc.tryBatch(squares(3), JsonRpc.overText(node)));
    }

    @Test
    void duplicatedIdIsCorrelationError() {
        TestNode node = new TestNode().echo("test_square").tamperBatch(responses -> {
            List<JsonRpcResponse> copy = new ArrayList<>(responses);
            copy.set(2, responses.get(0));
            return copy;
        });

        assertThrows(BatchCorrelationException.class, () -> JsonRpc.tryBatch(squares(3), JsonRpc.overText(node)));
    }

    @Test
    void foreignIdIsCorrelationError() {
        TestNode node = new TestNode().echo("test_square").tamperBatch(responses -> {
            List<JsonRpcResponse> copy = new ArrayList<>(responses);
            copy.set(1, JsonRpcResponse.success(JsonValue.of(1), Id.of(Id.MAX_VALUE)));
            return copy;
        });

        BatchCorrelationException ex = assertThrows(BatchCorrelationException.class,
                () -> JsonRpc.tryBatch(squares(3), JsonRpc.overText(node)));
        assertTrue(ex.getMessage().startsWith(BatchCorrelationException.MESSAGE));
    }

    @Test
    void undecodableElementFailsWholeBatchAndLeavesHandlesOpen() {
        TestNode node = new TestNode().result("test_square", "not a number");
        Batch batch = Batch.create();
        BatchHandle<Long> first = batch.add(SQUARE, 1L);
        batch.add(SQUARE, 2L);

        assertThrows(JsonCodecException.class, () -> JsonRpc.tryBatch(batch, JsonRpc.overText(node)));
        assertFalse(first.isComplete());
    }

    @Test
    void wholeBatchErrorObjectIsRpcError() {
        RpcException ex = assertThrows(RpcException.class, () -> JsonRpc.tryBatch(squares(2), JsonRpc.overText(
                body -> "{\"jsonrpc\":\"2.0\",\"error\":{\"code\":-32600,\"message\":\"too many\"},\"id\":null}")));

        assertEquals(ErrorCode.INVALID_REQUEST, ex.errorCode());
    }

    @Test
    void batchCanOnlyRunOnce() {
        TestNode node = new TestNode().echo("test_square");
        Batch batch = squares(2);
        JsonRpc.tryBatch(batch, JsonRpc.overText(node));

        assertThrows(IllegalStateException.class, () -> JsonRpc.tryBatch(batch, JsonRpc.overText(node)));
        assertThrows(IllegalStateException.class, () -> batch.add(SQUARE, 3L));
    }

    @Test
    void handleBeforeExecutionThrows() {
        BatchHandle<Long> handle = Batch.create().add(SQUARE, 1L);

        assertFalse(handle.isComplete());
        assertThrows(IllegalStateException.class, handle::result);
    }

    @Test
    void homogeneousHelpers() {
        List<BatchResult<Long>> results = JsonRpc.tryBatchAll(SQUARE, List.of(3L, 4L), JsonRpc.overText(shuffledSquares(7)));
        List<Long> values = JsonRpc.batchAll(SQUARE, List.of(5L, 6L, 7L), JsonRpc.overText(shuffledSquares(3)));

        assertEquals(9L, results.get(0).data());
        assertEquals(16L, results.get(1).data());
        assertEquals(List.of(25L, 36L, 49L), values);
    }

    @Test
    void nullResultInBatchIsSuccess() {
        TestNode node = new TestNode().result("web3_clientVersion", JsonValue.NULL);
        Batch batch = Batch.create();
        BatchHandle<String> handle = batch.add(CLIENT_VERSION);

        JsonRpc.tryBatch(batch, JsonRpc.overText(node));

        assertTrue(handle.result().success());
        assertNull(handle.get());
    }

    @Test
    void asyncBatchCompletesHandles() throws Exception {
        Batch batch = squares(4);

        CompletableFuture<List<Object>> values = JsonRpc.batchAsync(batch, JsonRpc.overTextAsync(
                body -> CompletableFuture.supplyAsync(() -> shuffledSquares(11).roundtrip(body))));

        assertEquals(List.of(0L, 1L, 4L, 9L), values.get());
    }
}
