package com.seqdiagram.core.generator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Body line buffer with a nesting depth.
 *
 * <p>Each emitted line is prefixed with {@code indentWidth * depth} spaces. The depth
 * starts at {@code baseDepth} (the level just inside the start/end markers) and may
 * never drop below it; an unbalanced exit is a programming error and fails fast.
 */
public class DiagramWriter {

    static final String BLOCK_END = "end";

    private final List<String> lines = new ArrayList<>();
    private final int indentWidth;
    private final int baseDepth;
    private int depth;

    /**
     * @param indentWidth spaces per nesting level
     * @param baseDepth depth of top-level body lines
     */
    public DiagramWriter(int indentWidth, int baseDepth) {
        if (indentWidth < 0 || baseDepth < 0) {
            throw new IllegalArgumentException("indentWidth and baseDepth must not be negative");
        }
        this.indentWidth = indentWidth;
        this.baseDepth = baseDepth;
        this.depth = baseDepth;
    }

    /**
     * Appends one line at the current depth.
     *
     * @param text line content without indentation
     */
    public void line(String text) {
        lines.add(" ".repeat(indentWidth * depth) + text);
    }

    /**
     * Writes a block header and enters the block.
     *
     * @param header opening line, e.g. {@code alt x>0}
     */
    public void open(String header) {
        line(header);
        indent();
    }

    /**
     * Leaves the current block and writes its terminator.
     */
    public void close() {
        outdent();
        line(BLOCK_END);
    }

    public void indent() {
        depth++;
    }

    /**
     * @throws IllegalStateException if the depth would drop below the base depth
     */
    public void outdent() {
        if (depth <= baseDepth) {
            throw new IllegalStateException("Unbalanced scope exit at depth " + depth);
        }
        depth--;
    }

    public int depth() {
        return depth;
    }

    /**
     * @return emitted lines in order, unmodifiable
     */
    public List<String> lines() {
        return Collections.unmodifiableList(lines);
    }
}
