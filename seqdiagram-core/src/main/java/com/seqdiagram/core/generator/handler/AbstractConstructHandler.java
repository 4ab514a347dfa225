package com.seqdiagram.core.generator.handler;

import com.github.javaparser.ast.Node;
import com.seqdiagram.core.config.DiagramConfig;
import com.seqdiagram.core.generator.DiagramWriter;
import com.seqdiagram.core.generator.GenerationContext;
import com.seqdiagram.core.generator.NodeDispatcher;
import com.seqdiagram.core.parser.SourceText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Base class for construct handlers, holding the run state and the dispatcher used
 * for recursion.
 *
 * @param <T> handled node type
 */
public abstract class AbstractConstructHandler<T extends Node> implements ConstructHandler<T> {

    /**
     * Logger named after the concrete handler class.
     */
    protected final Logger log;

    protected final GenerationContext context;
    protected final NodeDispatcher dispatcher;

    protected AbstractConstructHandler(GenerationContext context, NodeDispatcher dispatcher) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.log = LoggerFactory.getLogger(getClass());
    }

    protected DiagramWriter writer() {
        return context.writer();
    }

    protected DiagramConfig config() {
        return context.config();
    }

    /**
     * Literal source text of a node, flattened to one line for use in a block label.
     *
     * @param node labelled node
     * @return single-line label text
     */
    protected String label(Node node) {
        return SourceText.escapeLineBreaks(SourceText.of(node));
    }
}
