package com.qa.trust.engine;

import com.qa.trust.model.TestOutcome;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Bounded, chronological outcome history of one test. Adding beyond capacity evicts the
 * oldest outcome. Not thread-safe; owners serialize access per project.
 */
public class OutcomeWindow {

    private final int capacity;
    private final Deque<TestOutcome> outcomes;

    public OutcomeWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Window capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.outcomes = new ArrayDeque<>(capacity);
    }

    public void add(TestOutcome outcome) {
        if (outcomes.size() == capacity) {
            outcomes.removeFirst();
        }
        outcomes.addLast(outcome);
    }

    public int size() {
        return outcomes.size();
    }

    public int passes() {
        return (int) outcomes.stream().filter(o -> o == TestOutcome.PASSED).count();
    }

    public int failures() {
        return (int) outcomes.stream().filter(TestOutcome::isFailure).count();
    }

    public TestOutcome last() {
        return outcomes.peekLast();
    }

    /**
     * Whether the window shows genuinely inconsistent behavior: enough runs, with at least
     * one pass and one failure.
     */
    public boolean isFlakinessEligible(int minRuns) {
        return size() >= minRuns && passes() > 0 && failures() > 0;
    }

    /**
     * 1 - |passes - failures| / size: 1.0 for an even split, 0 when all outcomes agree.
     */
    public double flakinessScore() {
        if (outcomes.isEmpty()) {
            return 0.0;
        }
        return 1.0 - (double) Math.abs(passes() - failures()) / size();
    }

    /**
     * The most recent {@code length} outcomes as letters, oldest first.
     */
    public String pattern(int length) {
        StringBuilder sb = new StringBuilder();
        int skip = Math.max(0, outcomes.size() - length);
        Iterator<TestOutcome> it = outcomes.iterator();
        int i = 0;
        while (it.hasNext()) {
            TestOutcome outcome = it.next();
            if (i++ >= skip) {
                sb.append(outcome.getLetter());
            }
        }
        return sb.toString();
    }
}
