package me.go_gradually.voicelive.application.live.model;

public record UpstreamOpenCommand(String sessionId) {
}
