package com.contextkit.core.working;

import com.contextkit.core.source.WorkingStateSource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local working memory: a bounded window of recent turns plus a
 * key/value map of live state.
 */
@Slf4j
public class InMemoryWorkingState implements WorkingStateSource {

    static final String NO_LIVE_STATE = "[No live state]";

    private final int capacity;
    private final Deque<String> turns = new ArrayDeque<>();
    private final Map<String, String> state = new ConcurrentHashMap<>();

    public InMemoryWorkingState(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public void recordTurn(String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        synchronized (turns) {
            turns.addLast(text.strip());
            while (turns.size() > capacity) {
                turns.removeFirst();
            }
        }
    }

    public void putState(String key, String value) {
        if (value == null) {
            state.remove(key);
        } else {
            state.put(key, value);
        }
        log.debug("[WORKING_MEMORY] State updated | key={}", key);
    }

    public void removeState(String key) {
        state.remove(key);
    }

    public void clear() {
        synchronized (turns) {
            turns.clear();
        }
        state.clear();
    }

    public int turnCount() {
        synchronized (turns) {
            return turns.size();
        }
    }

    @Override
    public List<String> getRecentConversations(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        synchronized (turns) {
            List<String> all = new ArrayList<>(turns);
            int from = Math.max(0, all.size() - limit);
            return List.copyOf(all.subList(from, all.size()));
        }
    }

    @Override
    public String getStateSnapshot() {
        if (state.isEmpty()) {
            return NO_LIVE_STATE;
        }
        List<String> lines = new ArrayList<>();
        new TreeMap<>(state).forEach((key, value) -> lines.add(key + ": " + value));
        return String.join("\n", lines);
    }
}
