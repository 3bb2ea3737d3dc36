package me.go_gradually.voicelive.application.live.model;

import java.util.Map;

public record ToolCall(String id, String name, Map<String, Object> args) {
    public ToolCall {
        args = args == null ? Map.of() : args;
    }
}
