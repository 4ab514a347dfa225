package com.seqdiagram.core.generator;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Stack of loop contexts currently being walked.
 *
 * <p>Each entry gets an identifier {@code loop_<n>}, with {@code n} increasing over
 * the whole run. Identifiers are bookkeeping only and never reach the diagram.
 */
public class LoopStack {

    private final Deque<String> loops = new ArrayDeque<>();
    private int counter;

    /**
     * Enters a loop.
     *
     * @return identifier of the new loop context
     */
    public String push() {
        String loopId = "loop_" + counter++;
        loops.push(loopId);
        return loopId;
    }

    /**
     * Leaves the innermost loop.
     *
     * @return identifier of the loop left
     * @throws IllegalStateException if no loop is open
     */
    public String pop() {
        if (loops.isEmpty()) {
            throw new IllegalStateException("No open loop to leave");
        }
        return loops.pop();
    }

    public Optional<String> current() {
        return Optional.ofNullable(loops.peek());
    }

    public int depth() {
        return loops.size();
    }

    public int totalEntered() {
        return counter;
    }
}
