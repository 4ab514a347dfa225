package com.seqdiagram.core.renderer.impl;

import com.seqdiagram.core.generator.GeneratedDiagram;
import com.seqdiagram.core.renderer.OutputRenderer;
import com.seqdiagram.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes the diagram to the file named by {@link RenderContext#outputPath()}.
 *
 * <p>Missing parent directories are created; an existing file is overwritten.
 * Content is written as UTF-8.
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedDiagram diagram, RenderContext context) {
        Path targetPath = Paths.get(context.outputPath());
        logger.debug("Writing diagram '{}' to: {}", diagram.name(), targetPath);

        try {
            Path parentDir = targetPath.toAbsolutePath().getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }

            Files.writeString(targetPath, diagram.content(), StandardCharsets.UTF_8);
            logger.info("Wrote file: {} ({} bytes)", targetPath, diagram.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + targetPath, e);
        }
    }
}
