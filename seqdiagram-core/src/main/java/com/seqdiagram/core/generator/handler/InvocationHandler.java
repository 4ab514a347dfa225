package com.seqdiagram.core.generator.handler;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.seqdiagram.core.generator.GenerationContext;
import com.seqdiagram.core.generator.NodeDispatcher;
import com.seqdiagram.core.parser.SourceText;

import java.util.Optional;

/**
 * Handles {@code receiver.name(args)} calls.
 *
 * <p>Emits one message line from the caller to the receiver. Calls whose name ends with
 * the configured async suffix use the {@code ->>} arrow and activate the receiver right
 * after the message. A return line follows when the call is the value of an assignment
 * (labelled with the assignment target) or is returned directly (labelled with the
 * return placeholder). Calls without an explicit receiver produce nothing.
 *
 * <p>Neither the receiver nor the arguments are descended into. A receiver spanning
 * several lines, such as a wrapped fluent chain, is flattened like the arguments.
 */
public class InvocationHandler extends AbstractConstructHandler<MethodCallExpr> {

    private static final String SYNC_ARROW = "->";
    private static final String ASYNC_ARROW = "->>";
    private static final String SYNC_RETURN_ARROW = "-->";
    private static final String ASYNC_RETURN_ARROW = "-->>";

    public InvocationHandler(GenerationContext context, NodeDispatcher dispatcher) {
        super(context, dispatcher);
    }

    @Override
    public void handle(MethodCallExpr call, String caller) {
        Optional<Expression> scope = call.getScope();
        if (scope.isEmpty()) {
            log.debug("Skipping call without receiver: {}", call.getNameAsString());
            return;
        }

        String receiver = SourceText.escapeLineBreaks(SourceText.of(scope.get()).trim());
        String methodName = call.getNameAsString();
        String arguments = SourceText.joinArguments(call.getArguments());
        boolean async = config().async().isAsyncCall(methodName);

        context.participants().register(receiver);

        writer().line(caller + " " + (async ? ASYNC_ARROW : SYNC_ARROW)
            + " \"" + receiver + "\": " + methodName + "(" + arguments + ")");

        if (async) {
            context.beginAsync(receiver);
        }

        returnLabel(call).ifPresent(value -> writer().line(
            receiver + " " + (async ? ASYNC_RETURN_ARROW : SYNC_RETURN_ARROW) + " " + caller + ": " + value));
    }

    /**
     * Determines the label of the return line, if the call's immediate parent asks for one.
     */
    private Optional<String> returnLabel(MethodCallExpr call) {
        Node parent = call.getParentNode().orElse(null);
        if (parent instanceof AssignExpr assignment && assignment.getValue() == call) {
            return Optional.of(SourceText.escapeLineBreaks(SourceText.of(assignment.getTarget())));
        }
        if (parent instanceof ReturnStmt) {
            return Optional.of(config().fallbacks().returnPlaceholder());
        }
        return Optional.empty();
    }
}
