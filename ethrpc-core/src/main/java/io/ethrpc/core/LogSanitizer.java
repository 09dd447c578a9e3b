// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Keeps secrets and oversized payloads out of debug output.
 *
 * <p>
 * JSON-RPC payloads are redacted structurally: the params of
 * {@code personal_*} requests (which carry passphrases and keys positionally)
 * and the values of {@code privateKey}, {@code password} and
 * {@code passphrase} members anywhere in the document. Free text gets the
 * member rule only. Everything is cut to {@value #MAX_LENGTH} characters.
 */
public final class LogSanitizer {

    static final int MAX_LENGTH = 2000;
    static final String TRUNCATED = "...(truncated)";
    static final String REDACTED = "***[REDACTED]***";

    private static final String SECRET_METHOD_PREFIX = "personal_";
    private static final Set<String> SECRET_MEMBERS = Set.of("privateKey", "password", "passphrase");
    private static final Pattern SECRET_MEMBER_TEXT =
            Pattern.compile("\"(privateKey|password|passphrase)\"\\s*:\\s*\"[^\"]*\"");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LogSanitizer() {
    }

    /**
     * Sanitizes a free-form log line.
     */
    public static String sanitize(final String line) {
        if (line == null) {
            return "null";
        }
        return truncate(SECRET_MEMBER_TEXT.matcher(line).replaceAll("\"$1\":\"" + REDACTED + "\""));
    }

    /**
     * Sanitizes a request or response body. Input that is not JSON is treated
     * as free text.
     */
    public static String sanitizePayload(final String json) {
        if (json == null) {
            return "null";
        }
        final JsonNode tree;
        try {
            tree = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            return sanitize(json);
        }
        if (tree == null || !tree.isContainerNode()) {
            return sanitize(json);
        }
        redact(tree);
        return truncate(tree.toString());
    }

    private static void redact(final JsonNode node) {
        if (node.isArray()) {
            for (JsonNode element : node) {
                redact(element);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        final ObjectNode object = (ObjectNode) node;
        final JsonNode method = object.get("method");
        if (method != null && method.asText().startsWith(SECRET_METHOD_PREFIX) && object.has("params")) {
            object.set("params", TextNode.valueOf(REDACTED));
        }
        final List<String> names = new ArrayList<>();
        for (Iterator<String> it = object.fieldNames(); it.hasNext();) {
            names.add(it.next());
        }
        for (String name : names) {
            if (SECRET_MEMBERS.contains(name)) {
                object.set(name, TextNode.valueOf(REDACTED));
            } else {
                redact(object.get(name));
            }
        }
    }

    private static String truncate(final String text) {
        if (text.length() <= MAX_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_LENGTH - TRUNCATED.length()) + TRUNCATED;
    }
}
