// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.rpc;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identifies a block in method params: either a named tag like
 * {@code latest} or a block number.
 */
public sealed interface BlockSpec permits BlockSpec.Named, BlockSpec.Number {

    /**
     * The most recent block in the canonical chain.
     */
    BlockSpec LATEST = new Named("latest");

    /**
     * The pending state (block being mined).
     */
    BlockSpec PENDING = new Named("pending");

    /**
     * The genesis block.
     */
    BlockSpec EARLIEST = new Named("earliest");

    /**
     * The most recent block considered safe from reorgs.
     */
    BlockSpec SAFE = new Named("safe");

    /**
     * The most recent finalized block.
     */
    BlockSpec FINALIZED = new Named("finalized");

    static BlockSpec number(final long blockNumber) {
        return new Number(blockNumber);
    }

    /**
     * Parses the wire form: a quantity or a tag name.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static BlockSpec parse(final String value) {
        if (value != null && value.startsWith("0x")) {
            return new Number(Quantity.decodeLong(value));
        }
        return new Named(value);
    }

    @JsonValue
    String toRpcValue();

    record Named(String name) implements BlockSpec {
        public Named {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Block tag name cannot be null or blank");
            }
        }

        @Override
        @JsonValue
        public String toRpcValue() {
            return name;
        }
    }

    record Number(long blockNumber) implements BlockSpec {
        public Number {
            if (blockNumber < 0) {
                throw new IllegalArgumentException("Block number cannot be negative: " + blockNumber);
            }
        }

        @Override
        @JsonValue
        public String toRpcValue() {
            return Quantity.encode(blockNumber);
        }
    }
}
