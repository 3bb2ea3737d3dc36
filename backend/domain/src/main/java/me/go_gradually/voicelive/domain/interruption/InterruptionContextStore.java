package me.go_gradually.voicelive.domain.interruption;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Bounded stack of recently interrupted replies, newest last.
 */
public class InterruptionContextStore {
    public static final int DEFAULT_CAPACITY = 3;

    private final int capacity;
    private final Deque<InterruptionContext> contexts = new ArrayDeque<>();

    public InterruptionContextStore() {
        this(DEFAULT_CAPACITY);
    }

    public InterruptionContextStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    public synchronized InterruptionContext save(InterruptionEvent event, String lastAiResponse) {
        InterruptionContext context = InterruptionContext.from(event, lastAiResponse);
        contexts.addLast(context);
        while (contexts.size() > capacity) {
            contexts.removeFirst();
        }
        return context;
    }

    public synchronized InterruptionContext lastInterruptibleContext() {
        Iterator<InterruptionContext> iterator = contexts.descendingIterator();
        while (iterator.hasNext()) {
            InterruptionContext context = iterator.next();
            if (context.canResume()) {
                return context;
            }
        }
        return null;
    }

    public synchronized InterruptionContext latest() {
        return contexts.peekLast();
    }

    public synchronized List<InterruptionContext> contexts() {
        return List.copyOf(contexts);
    }

    public synchronized int size() {
        return contexts.size();
    }

    public synchronized int capacity() {
        return capacity;
    }

    public synchronized void clear() {
        contexts.clear();
    }

    public synchronized InterruptionPattern pattern() {
        if (contexts.isEmpty()) {
            return InterruptionPattern.empty();
        }
        List<InterruptionContext> entries = new ArrayList<>(contexts);
        return new InterruptionPattern(frequency(entries.size()), mostCommonType(entries), trend(entries));
    }

    private static InterruptionPattern.Frequency frequency(int count) {
        if (count >= 3) {
            return InterruptionPattern.Frequency.HIGH;
        }
        if (count >= 2) {
            return InterruptionPattern.Frequency.MEDIUM;
        }
        return InterruptionPattern.Frequency.LOW;
    }

    private static InterruptionType mostCommonType(List<InterruptionContext> entries) {
        Map<InterruptionType, Integer> counts = new EnumMap<>(InterruptionType.class);
        InterruptionType best = null;
        int bestCount = 0;
        for (InterruptionContext entry : entries) {
            int count = counts.merge(entry.type(), 1, Integer::sum);
            if (count > bestCount) {
                best = entry.type();
                bestCount = count;
            }
        }
        return best;
    }

    // 최근 간격이 이전 간격보다 짧아지면 증가 추세로 본다.
    private static InterruptionPattern.Trend trend(List<InterruptionContext> entries) {
        if (entries.size() < 3) {
            return InterruptionPattern.Trend.STABLE;
        }
        int last = entries.size() - 1;
        long recent = Duration.between(entries.get(last - 1).timestamp(), entries.get(last).timestamp()).toMillis();
        long older = Duration.between(entries.get(last - 2).timestamp(), entries.get(last - 1).timestamp()).toMillis();
        if (recent < older * 0.7) {
            return InterruptionPattern.Trend.INCREASING;
        }
        if (recent > older * 1.5) {
            return InterruptionPattern.Trend.DECREASING;
        }
        return InterruptionPattern.Trend.STABLE;
    }
}
