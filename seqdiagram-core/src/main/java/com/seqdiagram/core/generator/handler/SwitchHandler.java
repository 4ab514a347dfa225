package com.seqdiagram.core.generator.handler;

import com.github.javaparser.ast.expr.PatternExpr;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.seqdiagram.core.generator.GenerationContext;
import com.seqdiagram.core.generator.NodeDispatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Handles a {@code switch} statement as one {@code alt [selector]} block with a
 * {@code case} separator per section.
 *
 * <p>A section is a run of entries sharing statements: a colon-style entry without
 * statements falls through and joins the next one. Only simple labels (constants,
 * {@code null}) are listed. A section whose labels are all type patterns or
 * {@code default} is skipped entirely, statements included.
 */
public class SwitchHandler extends AbstractConstructHandler<SwitchStmt> {

    public SwitchHandler(GenerationContext context, NodeDispatcher dispatcher) {
        super(context, dispatcher);
    }

    @Override
    public void handle(SwitchStmt switchStmt, String caller) {
        writer().open("alt [" + label(switchStmt.getSelector()) + "]");

        List<String> sectionLabels = new ArrayList<>();
        List<SwitchEntry> entries = switchStmt.getEntries();
        for (int i = 0; i < entries.size(); i++) {
            SwitchEntry entry = entries.get(i);
            sectionLabels.addAll(simpleLabels(entry));

            boolean fallsThrough = entry.getType() == SwitchEntry.Type.STATEMENT_GROUP
                && entry.getStatements().isEmpty()
                && i < entries.size() - 1;
            if (fallsThrough) {
                continue;
            }

            if (sectionLabels.isEmpty()) {
                log.debug("Skipping switch section without simple labels at {}", entry.getBegin().orElse(null));
            } else {
                writeSection(sectionLabels, entry.getStatements(), caller);
            }
            sectionLabels.clear();
        }

        writer().close();
    }

    private void writeSection(List<String> labels, List<Statement> statements, String caller) {
        writer().line("case " + String.join(", ", labels));
        writer().indent();
        for (Statement statement : statements) {
            dispatcher.visit(statement, caller);
        }
        writer().outdent();
    }

    private List<String> simpleLabels(SwitchEntry entry) {
        return entry.getLabels().stream()
            .filter(label -> !(label instanceof PatternExpr))
            .map(this::label)
            .collect(Collectors.toList());
    }
}
