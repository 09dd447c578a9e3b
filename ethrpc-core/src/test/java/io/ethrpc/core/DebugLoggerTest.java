// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ethrpc.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DebugLoggerTest {

    private final Logger debugLogger = (Logger) LoggerFactory.getLogger(DebugLogger.LOGGER_NAME);
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        appender = new ListAppender<>();
        appender.start();
        debugLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        EthRpcDebug.setEnabled(false);
        debugLogger.detachAppender(appender);
    }

    @Test
    void silentWhenDisabled() {
        EthRpcDebug.setEnabled(false);

        DebugLogger.logRpc("[RPC] method=%s", "eth_chainId");
        DebugLogger.logBatch("[BATCH] size=%d", 2);
        DebugLogger.log("hello");

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void logsFormattedMessageWhenEnabled() {
        EthRpcDebug.setEnabled(true);

        DebugLogger.logRpc("[RPC] method=%s id=%d", "eth_chainId", 7);

        assertEquals(1, appender.list.size());
        assertEquals("[RPC] method=eth_chainId id=7", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void togglesAreIndependent() {
        EthRpcDebug.setEnabled(false);
        EthRpcDebug.setBatchLogging(true);

        DebugLogger.logRpc("[RPC] method=eth_chainId");
        DebugLogger.logBatch("[BATCH] size=2");

        assertEquals(1, appender.list.size());
        assertTrue(appender.list.get(0).getFormattedMessage().startsWith("[BATCH]"));
        assertFalse(EthRpcDebug.isRpcLoggingEnabled());
    }

    @Test
    void sanitizesBeforeLogging() {
        EthRpcDebug.setEnabled(true);

        DebugLogger.log("params=[{\"privateKey\":\"0x%s\"}]", "ab".repeat(32));

        String message = appender.list.get(0).getFormattedMessage();
        assertTrue(message.contains(LogSanitizer.REDACTED));
        assertFalse(message.contains("abab"));
    }

    @Test
    void payloadChannelIsSeparate() {
        EthRpcDebug.setEnabled(false);
        EthRpcDebug.setRpcLogging(true);

        DebugLogger.logPayload("[HTTP-SEND]", "{\"method\":\"eth_chainId\"}");
        assertTrue(appender.list.isEmpty());

        EthRpcDebug.setPayloadLogging(true);
        DebugLogger.logPayload("[HTTP-SEND]", "{\"method\":\"personal_sign\",\"params\":[\"0xdead\",\"0xabc\"]}");

        assertEquals(1, appender.list.size());
        assertEquals("[HTTP-SEND] {\"method\":\"personal_sign\",\"params\":\"***[REDACTED]***\"}",
                appender.list.get(0).getFormattedMessage());
    }
}
