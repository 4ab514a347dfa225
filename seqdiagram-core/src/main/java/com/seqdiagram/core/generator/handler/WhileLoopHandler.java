package com.seqdiagram.core.generator.handler;

import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.seqdiagram.core.generator.GenerationContext;
import com.seqdiagram.core.generator.NodeDispatcher;

/**
 * {@code while (condition)}, labelled {@code while condition}.
 */
public class WhileLoopHandler extends AbstractLoopHandler<WhileStmt> {

    public WhileLoopHandler(GenerationContext context, NodeDispatcher dispatcher) {
        super(context, dispatcher);
    }

    @Override
    protected String loopLabel(WhileStmt loop) {
        return "while " + label(loop.getCondition());
    }

    @Override
    protected Statement body(WhileStmt loop) {
        return loop.getBody();
    }
}
