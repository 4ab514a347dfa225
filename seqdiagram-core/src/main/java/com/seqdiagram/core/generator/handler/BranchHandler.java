package com.seqdiagram.core.generator.handler;

import com.github.javaparser.ast.stmt.IfStmt;
import com.seqdiagram.core.generator.GenerationContext;
import com.seqdiagram.core.generator.NodeDispatcher;

/**
 * Handles {@code if / else} as one {@code alt} block.
 *
 * <p>The then-branch and the else-branch share the block, separated by {@code else}.
 * An {@code else if} is dispatched as a branch of its own, so every link of a chain
 * nests one level deeper.
 */
public class BranchHandler extends AbstractConstructHandler<IfStmt> {

    public BranchHandler(GenerationContext context, NodeDispatcher dispatcher) {
        super(context, dispatcher);
    }

    @Override
    public void handle(IfStmt ifStmt, String caller) {
        writer().open("alt " + label(ifStmt.getCondition()));

        dispatcher.visit(ifStmt.getThenStmt(), caller);

        ifStmt.getElseStmt().ifPresent(elseStmt -> {
            writer().line("else");
            dispatcher.visit(elseStmt, caller);
        });

        writer().close();
    }
}
