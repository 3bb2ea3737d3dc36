package me.go_gradually.voicelive.application.live.port;

import me.go_gradually.voicelive.application.live.model.ToolCall;
import me.go_gradually.voicelive.domain.live.UsageCounters;

public interface UpstreamEventListener {
    void onAudioChunk(byte[] audio);

    void onText(String text);

    void onToolCall(ToolCall call);

    void onUsage(UsageCounters.UsageReport report);

    void onTurnComplete();

    void onInterrupted();

    void onClosed(int statusCode, String reason);

    void onError(Throwable error);
}
