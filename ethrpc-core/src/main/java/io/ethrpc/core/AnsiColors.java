// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core;

/**
 * ANSI color palette for debug output.
 *
 * <p>Colors are disabled unless running in a TTY or {@code FORCE_COLOR=true}
 * is set, in which case every constant is the empty string.
 *
 * <ul>
 * <li><b>TEAL</b> - success</li>
 * <li><b>CORAL</b> - failures</li>
 * <li><b>INDIGO</b> - single round trips</li>
 * <li><b>AMBER</b> - batches and buffered flushes</li>
 * <li><b>SLATE</b> - metadata such as durations</li>
 * </ul>
 *
 * @see LogFormatter
 */
public final class AnsiColors {

    static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    /** Clears all formatting. */
    public static final String RESET = ansi("0");

    public static final String TEAL = ansi("38;5;44");

    public static final String CORAL = ansi("38;5;204");

    public static final String INDIGO = ansi("38;5;99");

    public static final String AMBER = ansi("38;5;214");

    public static final String SLATE = ansi("38;5;247");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }
}
