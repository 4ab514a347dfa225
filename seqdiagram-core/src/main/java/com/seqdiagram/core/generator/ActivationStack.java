package com.seqdiagram.core.generator;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Open asynchronous activations, keyed by participant name.
 *
 * <p>The participant pushed on {@link #push(String)} is the one returned by the
 * matching {@link #pop()}, so activation and deactivation always name the same actor.
 */
public class ActivationStack {

    private final Deque<String> open = new ArrayDeque<>();
    private int opened;

    public void push(String participant) {
        open.push(participant);
        opened++;
    }

    /**
     * Closes the most recent activation.
     *
     * @return its participant, or empty if nothing is open
     */
    public Optional<String> pop() {
        return Optional.ofNullable(open.poll());
    }

    public int depth() {
        return open.size();
    }

    public boolean isEmpty() {
        return open.isEmpty();
    }

    /**
     * @return number of activations opened during the run
     */
    public int totalOpened() {
        return opened;
    }
}
