package com.argus.common.logging;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogLevelTest {

    @Test
    void normalize_aliasesAndFallback() {
        assertEquals(LogLevel.WARN, LogLevel.normalize("warning"));
        assertEquals(LogLevel.ERROR, LogLevel.normalize(" FATAL "));
        assertEquals(LogLevel.SILENT, LogLevel.normalize("off"));
        assertEquals(LogLevel.INFO, LogLevel.normalize(null));
        assertEquals(LogLevel.DEBUG, LogLevel.normalize("bogus", LogLevel.DEBUG));
    }

    @Test
    void toSlf4jLevel_mapsSilentToOff() {
        assertEquals("OFF", LogLevel.SILENT.toSlf4jLevel());
        assertEquals("WARN", LogLevel.WARN.toSlf4jLevel());
    }
}
