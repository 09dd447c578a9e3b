// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core.error;

/**
 * Thrown when a batch response does not structurally match the batch request:
 * the number of responses differs, a response carries no id, or the ids do
 * not pair up with the ones that were sent.
 *
 * <p>This is a protocol violation by the peer, not a rejection of any single
 * call, so it applies to every call of the batch.
 */
public final class BatchCorrelationException extends EthRpcException {

    public static final String MESSAGE = "JSON RPC batch responses do not match requests";

    public BatchCorrelationException(final String detail) {
        super(MESSAGE + ": " + detail);
    }

    private BatchCorrelationException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Override
    BatchCorrelationException duplicate() {
        return new BatchCorrelationException(getMessage(), getCause());
    }
}
