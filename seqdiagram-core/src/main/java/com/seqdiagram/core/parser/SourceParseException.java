package com.seqdiagram.core.parser;

import com.github.javaparser.Problem;

import java.util.List;

/**
 * Thrown when source text cannot be turned into a syntax tree.
 *
 * <p>This is an input-contract violation, not a diagram generation error.
 */
public class SourceParseException extends RuntimeException {

    private final transient List<Problem> problems;

    /**
     * @param message summary message
     * @param problems problems reported by JavaParser
     */
    public SourceParseException(String message, List<Problem> problems) {
        super(describe(message, problems));
        this.problems = problems == null ? List.of() : List.copyOf(problems);
    }

    /**
     * @return problems reported by JavaParser, never null
     */
    public List<Problem> getProblems() {
        return problems;
    }

    private static String describe(String message, List<Problem> problems) {
        if (problems == null || problems.isEmpty()) {
            return message;
        }
        return message + ": " + problems.get(0).getMessage();
    }
}
