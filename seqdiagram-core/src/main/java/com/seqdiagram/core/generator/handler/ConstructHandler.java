package com.seqdiagram.core.generator.handler;

import com.github.javaparser.ast.Node;

/**
 * Emits the diagram text for one kind of syntax construct.
 *
 * <p>A handler writes its own lines and recurses into its own sub-bodies through the
 * {@link com.seqdiagram.core.generator.NodeDispatcher}; the dispatcher never descends
 * into a handled node by itself. Whatever depth a handler enters, it must leave.
 *
 * @param <T> handled node type
 */
public interface ConstructHandler<T extends Node> {

    /**
     * Emits diagram text for a construct.
     *
     * @param node the construct
     * @param caller participant owning the analyzed method
     */
    void handle(T node, String caller);
}
