package me.go_gradually.voicelive.infrastructure.tracing;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;

class LoggingTraceAdapterTest {

    @Test
    void format_writesEventSessionAndSortedAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("turns", 3);
        attributes.put("reason", "CLIENT_ENDED");

        assertEquals("trace.session_closed sessionId=s1 reason=CLIENT_ENDED turns=3",
                LoggingTraceAdapter.format("s1", "session_closed", attributes));
    }

    @Test
    void logTrace_acceptsMissingAttributes() {
        LoggingTraceAdapter adapter = new LoggingTraceAdapter();

        assertDoesNotThrow(() -> adapter.logTrace("s1", "session_started", null));
        assertEquals("trace.session_started sessionId=s1", LoggingTraceAdapter.format("s1", "session_started", null));
    }
}
