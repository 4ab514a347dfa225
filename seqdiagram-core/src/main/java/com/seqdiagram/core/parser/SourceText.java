package com.seqdiagram.core.parser;

import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.Node;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Helpers for turning syntax nodes back into the text the author wrote.
 *
 * <p>{@link Node#toString()} pretty-prints (so {@code x>0} would become {@code x > 0});
 * the diagram must instead show literal source text. The token range of a node is
 * used for that, falling back to the pretty-printed form for synthesized nodes
 * that carry no tokens.
 */
public final class SourceText {

    private static final String ESCAPED_LINE_BREAK = "\\n";

    private SourceText() {
        // Utility class
    }

    /**
     * Returns the literal source text of a node.
     *
     * @param node syntax node
     * @return text as written in the source, or empty string for null
     */
    public static String of(Node node) {
        if (node == null) {
            return "";
        }
        return node.getTokenRange()
            .map(TokenRange::toString)
            .orElseGet(node::toString);
    }

    /**
     * Joins the literal texts of several nodes with {@code ", "}, escaping line breaks
     * inside each so the result fits on one physical line.
     *
     * @param nodes argument nodes
     * @return comma-joined single-line text
     */
    public static String joinArguments(List<? extends Node> nodes) {
        return nodes.stream()
            .map(SourceText::of)
            .map(SourceText::escapeLineBreaks)
            .collect(Collectors.joining(", "));
    }

    /**
     * Replaces every line break ({@code \r\n}, {@code \n}, {@code \r}) with the
     * two-character marker {@code \n}.
     *
     * @param text text possibly spanning several lines
     * @return single-line text
     */
    public static String escapeLineBreaks(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\r\n", ESCAPED_LINE_BREAK)
            .replace("\n", ESCAPED_LINE_BREAK)
            .replace("\r", ESCAPED_LINE_BREAK);
    }
}
