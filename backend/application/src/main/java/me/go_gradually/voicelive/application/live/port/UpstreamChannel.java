package me.go_gradually.voicelive.application.live.port;

import me.go_gradually.voicelive.application.live.model.UpstreamSetup;

import java.util.concurrent.CompletableFuture;

public interface UpstreamChannel {
    /**
     * Sends the setup message. The future completes when the upstream acknowledges it.
     */
    CompletableFuture<Void> setup(UpstreamSetup setup);

    void sendAudio(byte[] frame);

    void sendTurnComplete();

    /**
     * Speaks the given text as the model, used for prompts the engine decides on its own.
     */
    void sendModelText(String text);

    void sendUserText(String text);

    void sendToolResponse(String callId, String name, String result);

    boolean isOpen();

    void close();
}
