package com.seqdiagram.core.generator.handler;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.Statement;
import com.seqdiagram.core.generator.GenerationContext;
import com.seqdiagram.core.generator.NodeDispatcher;

/**
 * Common shape of the loop handlers: one {@code loop <label>} block around the body,
 * with a loop context pushed for the duration of the walk.
 *
 * @param <T> loop statement type
 */
public abstract class AbstractLoopHandler<T extends Node> extends AbstractConstructHandler<T> {

    protected AbstractLoopHandler(GenerationContext context, NodeDispatcher dispatcher) {
        super(context, dispatcher);
    }

    @Override
    public final void handle(T loop, String caller) {
        String loopId = context.loops().push();
        log.debug("Entering {} at depth {}", loopId, context.loops().depth());

        writer().open("loop " + loopLabel(loop));
        dispatcher.visit(body(loop), caller);
        writer().close();

        context.loops().pop();
    }

    /**
     * @param loop loop statement
     * @return text after {@code loop }
     */
    protected abstract String loopLabel(T loop);

    /**
     * @param loop loop statement
     * @return the repeated statement
     */
    protected abstract Statement body(T loop);
}
