package com.seqdiagram.core.generator.handler;

import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.seqdiagram.core.generator.GenerationContext;
import com.seqdiagram.core.generator.NodeDispatcher;
import com.seqdiagram.core.parser.SourceText;

/**
 * Handles {@code new Type(args)}: registers the type and emits a creation message.
 * Construction never gets a return line, and anonymous class bodies are not walked.
 */
public class CreationHandler extends AbstractConstructHandler<ObjectCreationExpr> {

    public CreationHandler(GenerationContext context, NodeDispatcher dispatcher) {
        super(context, dispatcher);
    }

    @Override
    public void handle(ObjectCreationExpr creation, String caller) {
        String type = label(creation.getType()).trim();
        String arguments = SourceText.joinArguments(creation.getArguments());

        context.participants().register(type);
        writer().line(caller + " -> \"" + type + "\" **: new(" + arguments + ")");
    }
}
