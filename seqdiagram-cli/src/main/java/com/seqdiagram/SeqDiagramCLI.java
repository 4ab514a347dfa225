package com.seqdiagram;

import ch.qos.logback.classic.Level;
import com.seqdiagram.core.config.ConfigLoader;
import com.seqdiagram.core.config.DiagramConfig;
import com.seqdiagram.core.generator.GeneratedDiagram;
import com.seqdiagram.core.generator.SequenceDiagramGenerator;
import com.seqdiagram.core.renderer.OutputRenderer;
import com.seqdiagram.core.renderer.RenderContext;
import com.seqdiagram.core.renderer.impl.ConsoleRenderer;
import com.seqdiagram.core.renderer.impl.FileSystemRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Main CLI entry point for SeqDiagram.
 *
 * <p>Reads one Java source file, generates a PlantUML sequence diagram of its methods,
 * echoes the diagram to the console and writes it to the output file.
 *
 * <p><b>Options:</b>
 * <ul>
 *   <li>{@code -c, --config} - Configuration file (default: seqdiagram.yaml)</li>
 *   <li>{@code --header} - Print the diagram file name before the echoed diagram</li>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all log output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * seqdiagram src/main/java/com/example/OrderService.java docs/order-service.puml
 * seqdiagram OrderService.java out.puml -c custom.yaml -v
 * }</pre>
 */
@Command(
    name = "seqdiagram",
    mixinStandardHelpOptions = true,
    version = "SeqDiagram 1.0.0-SNAPSHOT",
    description = "Generates a PlantUML sequence diagram from Java source code"
)
public class SeqDiagramCLI implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SeqDiagramCLI.class);

    @Parameters(index = "0", description = "Java source file to analyze")
    private Path inputPath;

    @Parameters(index = "1", description = "Output file for the PlantUML diagram")
    private Path outputPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: seqdiagram.yaml)"
    )
    private Path configPath = Paths.get("seqdiagram.yaml");

    @Option(names = {"--header"}, description = "Print the diagram file name before the echoed diagram")
    private boolean header;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public Integer call() throws IOException {
        configureLogging();

        DiagramConfig config = ConfigLoader.load(configPath);
        log.debug("Reading source file: {}", inputPath);
        String source = Files.readString(inputPath, StandardCharsets.UTF_8);

        GeneratedDiagram diagram = new SequenceDiagramGenerator(config).generate(source);

        RenderContext context = new RenderContext(outputPath.toString(),
            Map.of("console.header", String.valueOf(header)));
        List<OutputRenderer> renderers = List.of(new ConsoleRenderer(), new FileSystemRenderer());
        for (OutputRenderer renderer : renderers) {
            log.debug("Running renderer: {}", renderer.getId());
            renderer.render(diagram, context);
        }

        System.out.println("Diagram has been written to " + outputPath + ". Application finished.");
        return 0;
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new SeqDiagramCLI()).execute(args);
        System.exit(exitCode);
    }
}
