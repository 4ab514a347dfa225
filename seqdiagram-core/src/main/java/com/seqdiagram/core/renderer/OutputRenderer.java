package com.seqdiagram.core.renderer;

import com.seqdiagram.core.generator.GeneratedDiagram;

/**
 * Destination for a generated diagram.
 *
 * <p>The CLI runs the console renderer and the filesystem renderer in sequence, so the
 * diagram is both echoed and persisted.
 *
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer, lowercase (e.g. "filesystem", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the diagram to the target destination.
     *
     * @param diagram the generated diagram
     * @param context rendering context with output path and settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedDiagram diagram, RenderContext context);
}
