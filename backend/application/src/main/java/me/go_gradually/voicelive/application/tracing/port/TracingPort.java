package me.go_gradually.voicelive.application.tracing.port;

import java.util.Map;

public interface TracingPort {
    void logTrace(String sessionId, String event, Map<String, Object> attributes);
}
