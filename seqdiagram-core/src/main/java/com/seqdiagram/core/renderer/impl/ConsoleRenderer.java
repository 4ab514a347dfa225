package com.seqdiagram.core.renderer.impl;

import com.seqdiagram.core.generator.GeneratedDiagram;
import com.seqdiagram.core.renderer.OutputRenderer;
import com.seqdiagram.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Echoes the diagram text to standard output.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.header} - Print a {@code Diagram: <file name>} line before the
 *       content ("true"/"false", default: "false")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedDiagram diagram, RenderContext context) {
        boolean showHeader = Boolean.parseBoolean(context.getSettingOrDefault("console.header", "false"));

        logger.debug("Rendering diagram '{}' to console", diagram.name());

        if (showHeader) {
            System.out.println("Diagram: " + diagram.fileName());
        }
        // content already ends with a newline
        System.out.print(diagram.content());
        System.out.flush();
    }
}
