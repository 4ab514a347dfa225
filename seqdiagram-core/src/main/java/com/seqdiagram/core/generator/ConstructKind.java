package com.seqdiagram.core.generator;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;

/**
 * The closed set of syntax constructs that produce diagram output.
 *
 * <p>Every node maps to exactly one kind; anything not listed is {@link #OTHER} and is
 * walked through without output.
 */
public enum ConstructKind {
    /** {@code receiver.name(args)} */
    INVOCATION,
    /** {@code new Type(args)} */
    CREATION,
    /** {@code if / else} */
    BRANCH,
    /** {@code switch} statement */
    SWITCH,
    /** classic {@code for} */
    FOR_LOOP,
    /** enhanced {@code for} */
    FOREACH_LOOP,
    /** {@code while} */
    WHILE_LOOP,
    /** {@code try / catch / finally} */
    TRY,
    /** Everything else. */
    OTHER;

    /**
     * Classifies a syntax node.
     *
     * @param node node to classify
     * @return its construct kind, never null
     */
    public static ConstructKind classify(Node node) {
        if (node instanceof MethodCallExpr) {
            return INVOCATION;
        }
        if (node instanceof ObjectCreationExpr) {
            return CREATION;
        }
        if (node instanceof IfStmt) {
            return BRANCH;
        }
        if (node instanceof SwitchStmt) {
            return SWITCH;
        }
        if (node instanceof ForStmt) {
            return FOR_LOOP;
        }
        if (node instanceof ForEachStmt) {
            return FOREACH_LOOP;
        }
        if (node instanceof WhileStmt) {
            return WHILE_LOOP;
        }
        if (node instanceof TryStmt) {
            return TRY;
        }
        return OTHER;
    }
}
