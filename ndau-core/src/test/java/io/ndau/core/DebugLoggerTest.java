// SPDX-License-Identifier: MIT OR Apache-2.0
package io.ndau.core;

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

    private final Logger logger = (Logger) LoggerFactory.getLogger("io.ndau.debug");
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void reset() {
        NdauDebug.setEnabled(false);
        logger.detachAndStopAllAppenders();
    }

    @Test
    void doesNotLogWhenDisabled() {
        DebugLogger.logKeys("should not appear");
        DebugLogger.logAddress("should not appear");

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void channelsAreIndependent() {
        NdauDebug.setAddressLogging(true);

        DebugLogger.logKeys("key message");
        DebugLogger.logAddress("address %s", "ndaexample");

        assertEquals(1, appender.list.size());
        assertEquals("address ndaexample", appender.list.get(0).getFormattedMessage());
        assertTrue(NdauDebug.isEnabled());
        assertFalse(NdauDebug.isKeyLoggingEnabled());
    }

    @Test
    void logsSanitizedMessagesWhenEnabled() {
        NdauDebug.setEnabled(true);
        DebugLogger.logKeys("parsed %s", "npvta8jaftcjebc56pvxgs8w2448");

        assertEquals(1, appender.list.size());
        assertEquals("parsed npvt***[REDACTED]***", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void messageWithoutArgumentsIsNotFormatted() {
        NdauDebug.setKeyLogging(true);
        DebugLogger.logKeys("100% done");

        assertEquals("100% done", appender.list.get(0).getFormattedMessage());
    }
}
