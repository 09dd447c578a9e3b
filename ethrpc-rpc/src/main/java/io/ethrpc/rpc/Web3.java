// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.rpc;

import io.ethrpc.core.jsonrpc.Empty;
import io.ethrpc.core.jsonrpc.RpcMethod;

/**
 * Descriptors of the {@code web3_} namespace.
 */
public final class Web3 {

    /** Returns the node's client version string. */
    public static final RpcMethod<Empty, String> CLIENT_VERSION = RpcMethod.of("web3_clientVersion", String.class);

    private Web3() {
    }
}
