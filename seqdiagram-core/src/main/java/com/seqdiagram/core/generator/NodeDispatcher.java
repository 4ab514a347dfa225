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
import com.seqdiagram.core.generator.handler.BranchHandler;
import com.seqdiagram.core.generator.handler.CreationHandler;
import com.seqdiagram.core.generator.handler.ForEachLoopHandler;
import com.seqdiagram.core.generator.handler.ForLoopHandler;
import com.seqdiagram.core.generator.handler.InvocationHandler;
import com.seqdiagram.core.generator.handler.SwitchHandler;
import com.seqdiagram.core.generator.handler.TryCatchHandler;
import com.seqdiagram.core.generator.handler.WhileLoopHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recursive walk over a syntax tree, routing each node to the handler of its
 * {@link ConstructKind}.
 *
 * <p>Handlers own the recursion into their sub-bodies and call back into
 * {@link #visit(Node, String)}. Nodes of kind {@link ConstructKind#OTHER} produce no
 * output; their children are walked instead, so a call inside a variable initializer
 * or an expression statement is still found. Each node is visited at most once.
 *
 * <p>The {@code caller} passed down is the participant owning the analyzed method and
 * stays the same for the whole walk of that method.
 */
public class NodeDispatcher {

    private final InvocationHandler invocations;
    private final CreationHandler creations;
    private final BranchHandler branches;
    private final SwitchHandler switches;
    private final ForLoopHandler forLoops;
    private final ForEachLoopHandler forEachLoops;
    private final WhileLoopHandler whileLoops;
    private final TryCatchHandler tryCatches;

    /**
     * @param context state of the current generation run
     */
    public NodeDispatcher(GenerationContext context) {
        Objects.requireNonNull(context, "context must not be null");
        this.invocations = new InvocationHandler(context, this);
        this.creations = new CreationHandler(context, this);
        this.branches = new BranchHandler(context, this);
        this.switches = new SwitchHandler(context, this);
        this.forLoops = new ForLoopHandler(context, this);
        this.forEachLoops = new ForEachLoopHandler(context, this);
        this.whileLoops = new WhileLoopHandler(context, this);
        this.tryCatches = new TryCatchHandler(context, this);
    }

    /**
     * Visits one node: dispatches it if it is a recognized construct, otherwise walks
     * its children.
     *
     * @param node node to visit
     * @param caller active calling participant
     */
    public void visit(Node node, String caller) {
        switch (ConstructKind.classify(node)) {
            case INVOCATION -> invocations.handle((MethodCallExpr) node, caller);
            case CREATION -> creations.handle((ObjectCreationExpr) node, caller);
            case BRANCH -> branches.handle((IfStmt) node, caller);
            case SWITCH -> switches.handle((SwitchStmt) node, caller);
            case FOR_LOOP -> forLoops.handle((ForStmt) node, caller);
            case FOREACH_LOOP -> forEachLoops.handle((ForEachStmt) node, caller);
            case WHILE_LOOP -> whileLoops.handle((WhileStmt) node, caller);
            case TRY -> tryCatches.handle((TryStmt) node, caller);
            case OTHER -> walkChildren(node, caller);
            default -> throw new IllegalStateException("Unhandled construct kind for " + node.getClass());
        }
    }

    /**
     * Visits every child of a node in source order.
     *
     * @param node parent node
     * @param caller active calling participant
     */
    public void walkChildren(Node node, String caller) {
        List<Node> children = new ArrayList<>(node.getChildNodes());
        children.sort(Node.NODE_BY_BEGIN_POSITION);
        for (Node child : children) {
            visit(child, caller);
        }
    }
}
