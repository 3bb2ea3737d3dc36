package me.go_gradually.voicelive.infrastructure.tracing;

import me.go_gradually.voicelive.application.tracing.port.TracingPort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes conversation traces to the application log, one line per event with sorted attributes.
 */
@Component
public class LoggingTraceAdapter implements TracingPort {
    private static final Logger log = Logger.getLogger(LoggingTraceAdapter.class.getName());

    @Override
    public void logTrace(String sessionId, String event, Map<String, Object> attributes) {
        if (!log.isLoggable(Level.INFO)) {
            return;
        }
        log.info(format(sessionId, event, attributes));
    }

    static String format(String sessionId, String event, Map<String, Object> attributes) {
        StringBuilder line = new StringBuilder("trace.").append(event).append(" sessionId=").append(sessionId);
        if (attributes != null) {
            new TreeMap<>(attributes).forEach((key, value) -> line.append(' ').append(key).append('=').append(value));
        }
        return line.toString();
    }
}
