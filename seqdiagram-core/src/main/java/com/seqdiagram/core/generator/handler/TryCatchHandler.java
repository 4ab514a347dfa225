package com.seqdiagram.core.generator.handler;

import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.TryStmt;
import com.seqdiagram.core.config.DiagramConfig;
import com.seqdiagram.core.generator.GenerationContext;
import com.seqdiagram.core.generator.NodeDispatcher;

/**
 * Handles {@code try / catch / finally}.
 *
 * <p>Every part becomes its own group, opened and closed independently:
 * {@code group try}, one {@code group catch <type> as <binding>} per catch clause in
 * source order, and {@code group finally} when present. Resources of a
 * try-with-resources are walked inside the try group, before its body.
 */
public class TryCatchHandler extends AbstractConstructHandler<TryStmt> {

    public TryCatchHandler(GenerationContext context, NodeDispatcher dispatcher) {
        super(context, dispatcher);
    }

    @Override
    public void handle(TryStmt tryStmt, String caller) {
        writer().open("group try");
        for (Expression resource : tryStmt.getResources()) {
            dispatcher.visit(resource, caller);
        }
        dispatcher.visit(tryStmt.getTryBlock(), caller);
        writer().close();

        for (CatchClause catchClause : tryStmt.getCatchClauses()) {
            writer().open("group catch " + catchHeading(catchClause.getParameter()));
            dispatcher.visit(catchClause.getBody(), caller);
            writer().close();
        }

        tryStmt.getFinallyBlock().ifPresent(finallyBlock -> {
            writer().open("group finally");
            dispatcher.visit(finallyBlock, caller);
            writer().close();
        });
    }

    private String catchHeading(Parameter parameter) {
        DiagramConfig.FallbackSettings fallbacks = config().fallbacks();
        String type = label(parameter.getType()).trim();
        String binding = parameter.getNameAsString();
        if (type.isEmpty()) {
            type = fallbacks.catchType();
        }
        if (binding == null || binding.isBlank()) {
            binding = fallbacks.catchBinding();
        }
        return type + " as " + binding;
    }
}
