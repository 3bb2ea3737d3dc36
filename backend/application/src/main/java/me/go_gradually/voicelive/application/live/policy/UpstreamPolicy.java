package me.go_gradually.voicelive.application.live.policy;

public interface UpstreamPolicy {
    long upstreamConnectTimeoutMs();

    long upstreamSetupTimeoutMs();

    long upstreamPrimingSettleMs();

    String upstreamVoiceName();

    double upstreamTemperature();

    int upstreamMaxOutputTokens();

    double upstreamVadSilenceSeconds();
}
