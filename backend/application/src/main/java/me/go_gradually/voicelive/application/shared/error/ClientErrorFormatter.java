package me.go_gradually.voicelive.application.shared.error;

import java.util.LinkedHashMap;
import java.util.Map;

public class ClientErrorFormatter {
    static final String INTERNAL_CODE = "INTERNAL_ERROR";
    static final String BAD_REQUEST_CODE = "BAD_REQUEST";
    private static final int STACK_EXCERPT_FRAMES = 5;
    private static final Map<String, String> REDACTED_MESSAGES = Map.of(
            "CONNECTION_ERROR", "Could not reach the voice service",
            "SETUP_ERROR", "The voice service did not become ready",
            "INVALID_AUDIO", "Audio frame was rejected",
            "TRANSCRIPTION_FAILED", "Speech could not be transcribed",
            "UNKNOWN_SESSION", "No active session",
            "SESSION_ID_REUSED", "Session cannot be restarted",
            BAD_REQUEST_CODE, "Invalid message",
            INTERNAL_CODE, "Something went wrong"
    );

    private final ErrorDisclosurePolicy policy;

    public ClientErrorFormatter(ErrorDisclosurePolicy policy) {
        this.policy = policy;
    }

    public static String codeOf(Throwable error) {
        if (error instanceof VoiceLiveException voiceLiveException) {
            return voiceLiveException.code();
        }
        if (error instanceof IllegalArgumentException) {
            return BAD_REQUEST_CODE;
        }
        return INTERNAL_CODE;
    }

    public Map<String, Object> format(Throwable error) {
        String code = codeOf(error);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("code", code);
        if (policy.productionErrors()) {
            payload.put("message", REDACTED_MESSAGES.getOrDefault(code, REDACTED_MESSAGES.get(INTERNAL_CODE)));
            return payload;
        }
        String message = error == null ? null : error.getMessage();
        payload.put("message", message == null || message.isBlank() ? REDACTED_MESSAGES.get(INTERNAL_CODE) : message);
        if (error != null) {
            payload.put("detail", stackExcerpt(error));
        }
        return payload;
    }

    private static String stackExcerpt(Throwable error) {
        StringBuilder builder = new StringBuilder(error.getClass().getName());
        StackTraceElement[] frames = error.getStackTrace();
        for (int i = 0; i < Math.min(STACK_EXCERPT_FRAMES, frames.length); i++) {
            builder.append("\n  at ").append(frames[i]);
        }
        return builder.toString();
    }
}
