// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.jsonrpc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import io.ethrpc.core.InternalApi;
import io.ethrpc.core.error.BatchCorrelationException;

/**
 * Matches the responses of a batch to its requests.
 *
 * <p>Nodes may answer batch elements in any order. Sorting both the request
 * ids and the responses by id and comparing pairwise restores request order
 * and detects missing, extra or unexpected ids in a single pass. Request ids
 * need not be sorted, so a batch whose ids wrapped past
 * {@link Id#MAX_VALUE} still correlates.
 */
@InternalApi
public final class BatchCorrelator {

    private static final Comparator<JsonRpcResponse> BY_ID = Comparator.comparing(
            JsonRpcResponse::id, Comparator.nullsFirst(Comparator.naturalOrder()));

    private BatchCorrelator() {
        // Utility class
    }

    /**
     * Returns {@code responses} reordered to line up with {@code ids}.
     *
     * @param ids       the distinct request ids, in request order
     * @param responses the responses in the order the node sent them
     * @return a new list where element {@code i} answers {@code ids.get(i)}
     * @throws BatchCorrelationException if the counts differ or any id does
     *                                   not match
     * @throws IllegalArgumentException  if {@code ids} contains duplicates
     */
    public static List<JsonRpcResponse> correlate(final List<Id> ids, final List<JsonRpcResponse> responses) {
        if (ids.size() != responses.size()) {
            throw new BatchCorrelationException(
                    "sent " + ids.size() + " requests but received " + responses.size() + " responses");
        }
        final List<Integer> order = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparing((Integer position) -> ids.get(position)));
        final List<JsonRpcResponse> sorted = new ArrayList<>(responses);
        sorted.sort(BY_ID);

        final JsonRpcResponse[] correlated = new JsonRpcResponse[ids.size()];
        Id previous = null;
        for (int k = 0; k < order.size(); k++) {
            final int position = order.get(k);
            final Id expected = ids.get(position);
            if (expected.equals(previous)) {
                throw new IllegalArgumentException("duplicate request id " + expected + " in " + ids);
            }
            previous = expected;
            final Id actual = sorted.get(k).id();
            if (!expected.equals(actual)) {
                throw new BatchCorrelationException("expected response with id " + expected + " but got " + actual);
            }
            correlated[position] = sorted.get(k);
        }
        return Arrays.asList(correlated);
    }
}
