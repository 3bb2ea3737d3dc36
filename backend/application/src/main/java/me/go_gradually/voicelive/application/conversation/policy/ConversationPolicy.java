package me.go_gradually.voicelive.application.conversation.policy;

public interface ConversationPolicy {
    int interruptionStackCapacity();

    long adaptiveWindowSeconds();

    int adaptiveSampleCap();

    long directiveTtlSeconds();

    int historyMessages();
}
