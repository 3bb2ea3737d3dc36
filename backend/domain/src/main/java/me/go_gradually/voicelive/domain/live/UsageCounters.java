package me.go_gradually.voicelive.domain.live;

/**
 * Token usage accumulated over a session.
 */
public final class UsageCounters {
    private long totalTokens;
    private long promptTokens;
    private long candidatesTokens;
    private long audioInputTokens;
    private long audioOutputTokens;
    private long textInputTokens;
    private long textOutputTokens;
    private int turns;

    public synchronized void merge(UsageReport report) {
        if (report == null) {
            return;
        }
        totalTokens += report.totalTokens();
        promptTokens += report.promptTokens();
        candidatesTokens += report.candidatesTokens();
        audioInputTokens += report.audioInputTokens();
        audioOutputTokens += report.audioOutputTokens();
        textInputTokens += report.textInputTokens();
        textOutputTokens += report.textOutputTokens();
    }

    public synchronized void countTurn() {
        turns++;
    }

    public synchronized UsageReport snapshot() {
        return new UsageReport(totalTokens, promptTokens, candidatesTokens,
                audioInputTokens, audioOutputTokens, textInputTokens, textOutputTokens);
    }

    public synchronized int turns() {
        return turns;
    }

    public record UsageReport(long totalTokens,
                              long promptTokens,
                              long candidatesTokens,
                              long audioInputTokens,
                              long audioOutputTokens,
                              long textInputTokens,
                              long textOutputTokens) {
        public static UsageReport empty() {
            return new UsageReport(0, 0, 0, 0, 0, 0, 0);
        }
    }
}
