// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.ethrpc.core.error.BatchCorrelationException;

class BatchCorrelatorTest {

    private static JsonRpcResponse ok(final long id) {
        return JsonRpcResponse.success(JsonValue.of(id), Id.of(id));
    }

    @Test
    void reordersToRequestOrder() {
        List<JsonRpcResponse> correlated = BatchCorrelator.correlate(
                List.of(Id.of(3), Id.of(4), Id.of(9)),
                List.of(ok(9), ok(3), ok(4)));

        assertEquals(List.of(ok(3), ok(4), ok(9)), correlated);
    }

    @Test
    void responseWithoutIdNeverMatches() {
        JsonRpcResponse anonymous = JsonRpcResponse.failure(new JsonRpcError(ErrorCode.PARSE_ERROR, "parse error"), null);

        assertThrows(BatchCorrelationException.class,
                () -> BatchCorrelator.correlate(List.of(Id.of(1), Id.of(2)), List.of(ok(2), anonymous)));
    }

    @Test
    void countMismatchIsReported() {
        BatchCorrelationException ex = assertThrows(BatchCorrelationException.class,
                () -> BatchCorrelator.correlate(List.of(Id.of(1), Id.of(2)), List.of(ok(1))));

        assertEquals(BatchCorrelationException.MESSAGE + ": sent 2 requests but received 1 responses", ex.getMessage());
    }

    @Test
    void idsWrappedPastMaxStillCorrelate() {
        Id last = Id.of(Id.MAX_VALUE);
        JsonRpcResponse beforeWrap = JsonRpcResponse.success(JsonValue.of("last"), last);

        List<JsonRpcResponse> correlated = BatchCorrelator.correlate(
                List.of(last, Id.of(0), Id.of(1)),
                List.of(ok(1), beforeWrap, ok(0)));

        assertEquals(List.of(beforeWrap, ok(0), ok(1)), correlated);
    }

    @Test
    void foreignIdInUnsortedBatchIsReported() {
        assertThrows(BatchCorrelationException.class,
                () -> BatchCorrelator.correlate(List.of(Id.of(5), Id.of(2)), List.of(ok(2), ok(7))));
    }

    @Test
    void rejectsDuplicateRequestIds() {
        assertThrows(IllegalArgumentException.class,
                () -> BatchCorrelator.correlate(List.of(Id.of(2), Id.of(2)), List.of(ok(2), ok(2))));
    }
}
