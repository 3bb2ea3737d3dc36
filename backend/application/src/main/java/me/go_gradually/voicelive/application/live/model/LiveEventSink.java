package me.go_gradually.voicelive.application.live.model;

import java.util.Map;

/**
 * Outbound side of one client connection. Returns false once the connection can no longer accept messages.
 */
public interface LiveEventSink {
    boolean sendEvent(String type, Map<String, Object> payload);

    boolean sendAudio(byte[] audio);
}
