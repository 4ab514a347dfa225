package com.seqdiagram.core.generator.handler;

import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.seqdiagram.core.generator.GenerationContext;
import com.seqdiagram.core.generator.NodeDispatcher;

/**
 * {@code for (Item item : source)}, labelled {@code for each item in source}.
 */
public class ForEachLoopHandler extends AbstractLoopHandler<ForEachStmt> {

    public ForEachLoopHandler(GenerationContext context, NodeDispatcher dispatcher) {
        super(context, dispatcher);
    }

    @Override
    protected String loopLabel(ForEachStmt loop) {
        String item = loop.getVariable().getVariables().isEmpty()
            ? label(loop.getVariable())
            : loop.getVariable().getVariable(0).getNameAsString();
        return "for each " + item + " in " + label(loop.getIterable());
    }

    @Override
    protected Statement body(ForEachStmt loop) {
        return loop.getBody();
    }
}
