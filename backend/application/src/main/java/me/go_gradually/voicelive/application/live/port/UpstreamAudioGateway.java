package me.go_gradually.voicelive.application.live.port;

import me.go_gradually.voicelive.application.live.model.UpstreamOpenCommand;

import java.util.concurrent.CompletableFuture;

public interface UpstreamAudioGateway {
    /**
     * Opens the transport. The future completes once the channel is connected, before setup.
     */
    CompletableFuture<UpstreamChannel> connect(UpstreamOpenCommand command, UpstreamEventListener listener);
}
