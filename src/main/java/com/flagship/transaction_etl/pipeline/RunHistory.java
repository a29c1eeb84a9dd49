package com.flagship.transaction_etl.pipeline;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * In-memory record of the most recent run summaries, newest first.
 */
@Component
public class RunHistory {

    private final int capacity;
    private final Deque<RunSummary> summaries = new ArrayDeque<>();

    public RunHistory(@Value("${pipeline.history.size:20}") int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("pipeline.history.size must be positive, was " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void record(RunSummary summary) {
        summaries.addFirst(summary);
        while (summaries.size() > capacity) {
            summaries.removeLast();
        }
    }

    public synchronized List<RunSummary> recent() {
        return List.copyOf(summaries);
    }

    public synchronized Optional<RunSummary> latest() {
        return Optional.ofNullable(summaries.peekFirst());
    }
}
