package me.go_gradually.voicelive.application.interruption.model;

public record ResponderReply(String text, String acknowledgment, boolean usedContext) {
    public String spokenText() {
        return acknowledgment + text;
    }
}
