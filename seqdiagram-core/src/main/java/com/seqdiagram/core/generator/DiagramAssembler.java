package com.seqdiagram.core.generator;

import com.seqdiagram.core.config.DiagramConfig;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Assembles the final document: start marker, participant header, body, end marker.
 *
 * <p>Layout:
 * <pre>
 * &#64;startuml
 *   participant "OrderService"
 *   participant "repository"
 *
 *   note over OrderService: place(Order order)
 *   ...
 * &#64;enduml
 * </pre>
 * Lines are separated by {@code \n} regardless of platform.
 */
public class DiagramAssembler {

    private static final String NEWLINE = "\n";

    private final DiagramConfig.NotationSettings notation;

    public DiagramAssembler(DiagramConfig.NotationSettings notation) {
        this.notation = Objects.requireNonNull(notation, "notation must not be null");
    }

    /**
     * @param participants participant names in header order
     * @param body indented body lines
     * @return complete diagram text
     */
    public String assemble(Collection<String> participants, List<String> body) {
        StringBuilder sb = new StringBuilder();
        String headerIndent = " ".repeat(notation.indentWidth());

        sb.append(notation.startMarker()).append(NEWLINE);
        for (String participant : participants) {
            sb.append(headerIndent).append("participant \"").append(participant).append('"').append(NEWLINE);
        }
        sb.append(NEWLINE);
        for (String line : body) {
            sb.append(line).append(NEWLINE);
        }
        sb.append(notation.endMarker()).append(NEWLINE);

        return sb.toString();
    }
}
