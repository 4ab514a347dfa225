package com.seqdiagram.core.generator;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Insertion-ordered set of diagram participants.
 *
 * <p>Names are compared by exact string identity after trimming: {@code order} and
 * {@code order.lines} are two participants. Blank names are ignored.
 */
public class ParticipantRegistry {

    private final Set<String> participants = new LinkedHashSet<>();

    /**
     * Registers a participant. Registering the same name twice has no effect.
     *
     * @param name participant name, may be null or blank (ignored)
     * @return true if the name was newly added
     */
    public boolean register(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        return participants.add(name.trim());
    }

    public boolean contains(String name) {
        return name != null && participants.contains(name.trim());
    }

    public int size() {
        return participants.size();
    }

    /**
     * @return registered names in first-registration order, unmodifiable
     */
    public Set<String> participants() {
        return Collections.unmodifiableSet(participants);
    }
}
