package me.go_gradually.voicelive.domain.adaptive;

import me.go_gradually.voicelive.domain.interruption.InterruptionEvent;
import me.go_gradually.voicelive.domain.interruption.InterruptionType;
import me.go_gradually.voicelive.domain.quality.Issue;
import me.go_gradually.voicelive.domain.quality.IssueType;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-session rolling statistics turned into behaviour adaptations.
 */
public class AdaptiveProfileManager {
    static final double FRUSTRATION_HANDOFF_THRESHOLD = 0.7;
    static final double FRUSTRATION_SIMPLE_THRESHOLD = 0.5;
    static final double INTERRUPTION_FRUSTRATION_BUMP = 0.2;

    private final AdaptiveSettings settings;
    private final Clock clock;
    private final Deque<TimedIssue> issues = new ArrayDeque<>();
    private final Deque<InterruptionEvent> interruptions = new ArrayDeque<>();
    private final Map<AdaptationDirective, ActiveDirective> activeDirectives = new EnumMap<>(AdaptationDirective.class);

    private NoiseEnvironment noiseEnvironment = NoiseEnvironment.LOW;
    private SpeechClarity speechClarity = SpeechClarity.HIGH;
    private PauseFrequency pauseFrequency = PauseFrequency.RARE;
    private InterruptionStyle interruptionStyle = InterruptionStyle.NORMAL;
    private double frustrationLevel;
    private int attemptCount;

    public AdaptiveProfileManager(AdaptiveSettings settings, Clock clock) {
        this.settings = settings == null ? AdaptiveSettings.defaults() : settings;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public synchronized void recordIssue(Issue issue) {
        if (issue == null) {
            return;
        }
        Instant now = clock.instant();
        issues.addLast(new TimedIssue(issue, now));
        attemptCount++;
        prune(now);
        recompute();
    }

    public synchronized void recordInterruption(InterruptionEvent event) {
        if (event == null) {
            return;
        }
        interruptions.addLast(event);
        prune(clock.instant());
        recompute();
    }

    /**
     * Expires stale directives, then returns directives that became active by this call.
     * A directive that is already active is never returned twice.
     */
    public synchronized List<AdaptationDirective> adapt() {
        Instant now = clock.instant();
        activeDirectives.values().removeIf(active -> active.isExpired(now, settings.directiveTtl()));
        prune(now);
        recompute();

        List<AdaptationDirective> emitted = new ArrayList<>();
        if (noiseEnvironment == NoiseEnvironment.HIGH) {
            activate(AdaptationDirective.SUGGEST_TEXT_INPUT, now, emitted);
        }
        if (speechClarity == SpeechClarity.LOW) {
            activate(AdaptationDirective.SWITCH_TO_HYBRID_MODE, now, emitted);
        }
        if (pauseFrequency == PauseFrequency.FREQUENT) {
            activate(AdaptationDirective.INCREASE_SILENCE_THRESHOLD, now, emitted);
        }
        if (frustrationLevel > FRUSTRATION_HANDOFF_THRESHOLD) {
            activate(AdaptationDirective.OFFER_ALTERNATIVE, now, emitted);
        }
        if (interruptionStyle == InterruptionStyle.FREQUENT) {
            activate(AdaptationDirective.USE_CONCISE_RESPONSES, now, emitted);
        }
        if (interruptionStyle == InterruptionStyle.CLARIFICATION_SEEKER) {
            activate(AdaptationDirective.USE_DETAILED_RESPONSES, now, emitted);
        }
        return emitted;
    }

    public synchronized ResponseSettings responseSettings() {
        if (interruptionStyle == InterruptionStyle.FREQUENT) {
            return new ResponseSettings(ResponseStyle.CONCISE, 50);
        }
        if (interruptionStyle == InterruptionStyle.CLARIFICATION_SEEKER) {
            return new ResponseSettings(ResponseStyle.DETAILED, 150);
        }
        if (frustrationLevel > FRUSTRATION_SIMPLE_THRESHOLD) {
            return new ResponseSettings(ResponseStyle.SIMPLE, 80);
        }
        return ResponseSettings.normal();
    }

    public synchronized double qualityScore() {
        if (issues.isEmpty()) {
            return 1.0;
        }
        double score = 1.0 - issues.size() * 0.05 - frustrationLevel * 0.3;
        if (noiseEnvironment == NoiseEnvironment.HIGH) {
            score -= 0.2;
        }
        if (speechClarity == SpeechClarity.LOW) {
            score -= 0.2;
        }
        return clamp(score);
    }

    public synchronized boolean isActive(AdaptationDirective directive) {
        return activeDirectives.containsKey(directive);
    }

    public synchronized AdaptiveProfile profile() {
        return new AdaptiveProfile(
                noiseEnvironment,
                speechClarity,
                pauseFrequency,
                interruptionStyle,
                frustrationLevel,
                attemptCount,
                issues.size(),
                interruptions.size(),
                new ArrayList<>(activeDirectives.values())
        );
    }

    public synchronized double frustrationLevel() {
        return frustrationLevel;
    }

    public synchronized int attemptCount() {
        return attemptCount;
    }

    public synchronized void reset() {
        issues.clear();
        interruptions.clear();
        activeDirectives.clear();
        attemptCount = 0;
        recompute();
    }

    private void activate(AdaptationDirective directive, Instant now, List<AdaptationDirective> emitted) {
        if (activeDirectives.containsKey(directive)) {
            return;
        }
        activeDirectives.put(directive, new ActiveDirective(directive, now));
        emitted.add(directive);
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(settings.window());
        while (!issues.isEmpty() && issues.peekFirst().at().isBefore(cutoff)) {
            issues.removeFirst();
        }
        while (issues.size() > settings.sampleCap()) {
            issues.removeFirst();
        }
        while (!interruptions.isEmpty() && interruptions.peekFirst().occurredAt().isBefore(cutoff)) {
            interruptions.removeFirst();
        }
        while (interruptions.size() > settings.sampleCap()) {
            interruptions.removeFirst();
        }
    }

    private void recompute() {
        Map<IssueType, Integer> issueCounts = new EnumMap<>(IssueType.class);
        double frustration = 0.0;
        for (TimedIssue timed : issues) {
            issueCounts.merge(timed.issue().type(), 1, Integer::sum);
            frustration += timed.issue().severity().frustrationWeight();
        }
        Map<InterruptionType, Integer> interruptionCounts = new EnumMap<>(InterruptionType.class);
        for (InterruptionEvent event : interruptions) {
            interruptionCounts.merge(event.type(), 1, Integer::sum);
        }

        int noise = issueCounts.getOrDefault(IssueType.BACKGROUND_NOISE, 0);
        noiseEnvironment = noise >= 3 ? NoiseEnvironment.HIGH : noise >= 2 ? NoiseEnvironment.MEDIUM : NoiseEnvironment.LOW;

        int lowConfidence = issueCounts.getOrDefault(IssueType.LOW_CONFIDENCE, 0);
        int incoherent = issueCounts.getOrDefault(IssueType.INCOHERENT_SPEECH, 0);
        if (lowConfidence >= 3 || incoherent >= 2) {
            speechClarity = SpeechClarity.LOW;
        } else if (lowConfidence >= 2) {
            speechClarity = SpeechClarity.MEDIUM;
        } else {
            speechClarity = SpeechClarity.HIGH;
        }

        int pauses = issueCounts.getOrDefault(IssueType.LONG_PAUSE, 0);
        pauseFrequency = pauses >= 4 ? PauseFrequency.FREQUENT : pauses >= 2 ? PauseFrequency.NORMAL : PauseFrequency.RARE;

        if (interruptionCounts.getOrDefault(InterruptionType.URGENT, 0) >= 3) {
            interruptionStyle = InterruptionStyle.URGENT;
        } else if (interruptions.size() >= 5) {
            interruptionStyle = InterruptionStyle.FREQUENT;
        } else if (interruptionCounts.getOrDefault(InterruptionType.CLARIFICATION, 0) >= 3) {
            interruptionStyle = InterruptionStyle.CLARIFICATION_SEEKER;
        } else {
            interruptionStyle = InterruptionStyle.NORMAL;
        }

        if (interruptions.size() >= 5) {
            frustration += INTERRUPTION_FRUSTRATION_BUMP;
        }
        frustrationLevel = clamp(frustration);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private record TimedIssue(Issue issue, Instant at) {
    }
}
