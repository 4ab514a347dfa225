package com.seqdiagram.core.generator.handler;

import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.seqdiagram.core.generator.GenerationContext;
import com.seqdiagram.core.generator.NodeDispatcher;

/**
 * {@code for (init; condition; update)}, labelled with the condition. Initializer and
 * update expressions are not walked.
 */
public class ForLoopHandler extends AbstractLoopHandler<ForStmt> {

    public ForLoopHandler(GenerationContext context, NodeDispatcher dispatcher) {
        super(context, dispatcher);
    }

    @Override
    protected String loopLabel(ForStmt loop) {
        return loop.getCompare()
            .map(this::label)
            .orElse(config().fallbacks().loopCondition());
    }

    @Override
    protected Statement body(ForStmt loop) {
        return loop.getBody();
    }
}
