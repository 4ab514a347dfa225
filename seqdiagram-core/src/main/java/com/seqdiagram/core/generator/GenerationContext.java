package com.seqdiagram.core.generator;

import com.seqdiagram.core.config.DiagramConfig;

import java.util.Objects;

/**
 * All mutable state of one generation run.
 *
 * <p>A new context is created for every call to
 * {@link SequenceDiagramGenerator#generate(String)}; nothing is shared between runs.
 */
public class GenerationContext {

    private final DiagramConfig config;
    private final DiagramWriter writer;
    private final ParticipantRegistry participants = new ParticipantRegistry();
    private final ActivationStack activations = new ActivationStack();
    private final LoopStack loops = new LoopStack();

    /**
     * @param config generator configuration
     */
    public GenerationContext(DiagramConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.writer = new DiagramWriter(config.notation().indentWidth(), 1);
    }

    /**
     * Opens an activation for a participant and writes {@code activate <participant>}.
     *
     * @param participant activated participant
     */
    public void beginAsync(String participant) {
        activations.push(participant);
        writer.line("activate " + participant);
    }

    /**
     * Closes the most recent activation and writes {@code deactivate <participant>}.
     * Does nothing when no activation is open.
     */
    public void endAsync() {
        activations.pop().ifPresent(participant -> writer.line("deactivate " + participant));
    }

    /**
     * Closes activations until only {@code depth} remain open.
     *
     * @param depth activation depth to return to
     */
    public void endAsyncUntil(int depth) {
        while (activations.depth() > depth) {
            endAsync();
        }
    }

    public DiagramConfig config() {
        return config;
    }

    public DiagramWriter writer() {
        return writer;
    }

    public ParticipantRegistry participants() {
        return participants;
    }

    public ActivationStack activations() {
        return activations;
    }

    public LoopStack loops() {
        return loops;
    }
}
