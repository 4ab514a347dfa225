package com.seqdiagram.core.generator;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.type.Type;
import com.seqdiagram.core.config.DiagramConfig;
import com.seqdiagram.core.parser.SourceParser;
import com.seqdiagram.core.parser.SourceText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Generates a PlantUML sequence diagram from the methods of one Java compilation unit.
 *
 * <p>Every method declaration of the unit is analyzed in source order, each one
 * contributing:
 * <ol>
 *   <li>a {@code note over <Owner>: name(params)} line, the owner being the enclosing type</li>
 *   <li>an activation of the owner if the method is asynchronous (annotated {@code @Async}
 *       or returning a future type, see {@link DiagramConfig.AsyncSettings})</li>
 *   <li>the lines of its body, produced by the {@link NodeDispatcher}</li>
 *   <li>deactivations for every activation still open at method exit</li>
 * </ol>
 * All methods share one participant registry; the header lists participants in the
 * order they were first met.
 *
 * <p>Each {@code generate} call uses a fresh {@link GenerationContext}, so the same
 * input always yields byte-identical output and one generator instance can be reused.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SequenceDiagramGenerator generator = new SequenceDiagramGenerator(DiagramConfig.defaults());
 * GeneratedDiagram diagram = generator.generate(Files.readString(path));
 * }</pre>
 */
public class SequenceDiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(SequenceDiagramGenerator.class);

    private static final String FILE_EXTENSION = "puml";
    private static final String DEFAULT_DIAGRAM_NAME = "sequence";

    private final DiagramConfig config;
    private final SourceParser parser;
    private final DiagramAssembler assembler;

    public SequenceDiagramGenerator(DiagramConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.parser = new SourceParser(config.parser());
        this.assembler = new DiagramAssembler(config.notation());
    }

    public SequenceDiagramGenerator() {
        this(DiagramConfig.defaults());
    }

    /**
     * Parses Java source text and generates its diagram.
     *
     * @param sourceCode source of one compilation unit
     * @return generated diagram
     * @throws com.seqdiagram.core.parser.SourceParseException if no syntax tree can be built
     */
    public GeneratedDiagram generate(String sourceCode) {
        return generate(parser.parse(sourceCode));
    }

    /**
     * Generates the diagram of an already parsed compilation unit. The unit is not modified.
     *
     * @param unit parsed compilation unit
     * @return generated diagram
     */
    public GeneratedDiagram generate(CompilationUnit unit) {
        Objects.requireNonNull(unit, "unit must not be null");

        GenerationContext context = new GenerationContext(config);
        NodeDispatcher dispatcher = new NodeDispatcher(context);

        List<MethodDeclaration> methods = unit.findAll(MethodDeclaration.class);
        log.debug("Analyzing {} method(s)", methods.size());
        for (MethodDeclaration method : methods) {
            analyzeMethod(method, context, dispatcher);
        }

        String content = assembler.assemble(context.participants().participants(), context.writer().lines());
        String name = diagramName(unit);

        log.info("Generated sequence diagram '{}': {} participant(s), {} line(s), {} loop(s), {} activation(s)",
            name, context.participants().size(), context.writer().lines().size(),
            context.loops().totalEntered(), context.activations().totalOpened());

        return new GeneratedDiagram(name, content, FILE_EXTENSION);
    }

    private void analyzeMethod(MethodDeclaration method, GenerationContext context, NodeDispatcher dispatcher) {
        String owner = ownerName(method);
        context.participants().register(owner);

        log.debug("Analyzing method {}.{}", owner, method.getNameAsString());
        context.writer().line("note over " + owner + ": " + method.getNameAsString() + "(" + parameters(method) + ")");

        int activationDepth = context.activations().depth();
        if (isAsync(method)) {
            context.beginAsync(owner);
        }

        method.getBody().ifPresent(body -> dispatcher.walkChildren(body, owner));

        context.endAsyncUntil(activationDepth);
    }

    private String ownerName(MethodDeclaration method) {
        Optional<Node> current = method.getParentNode();
        while (current.isPresent()) {
            Node node = current.get();
            if (node instanceof TypeDeclaration<?> type) {
                return type.getNameAsString();
            }
            current = node.getParentNode();
        }
        return config.fallbacks().unknownOwner();
    }

    private static String parameters(MethodDeclaration method) {
        return method.getParameters().stream()
            .map(SequenceDiagramGenerator::parameter)
            .collect(Collectors.joining(", "));
    }

    private static String parameter(Parameter parameter) {
        String type = SourceText.of(parameter.getType()) + (parameter.isVarArgs() ? "..." : "");
        return SourceText.escapeLineBreaks(type) + " " + parameter.getNameAsString();
    }

    private boolean isAsync(MethodDeclaration method) {
        DiagramConfig.AsyncSettings async = config.async();
        for (AnnotationExpr annotation : method.getAnnotations()) {
            if (async.annotations().contains(annotation.getName().getIdentifier())) {
                return true;
            }
        }
        Type returnType = method.getType();
        return returnType.isClassOrInterfaceType()
            && async.returnTypes().contains(returnType.asClassOrInterfaceType().getName().getIdentifier());
    }

    private static String diagramName(CompilationUnit unit) {
        return unit.getTypes().stream()
            .findFirst()
            .map(TypeDeclaration::getNameAsString)
            .orElse(DEFAULT_DIAGRAM_NAME);
    }
}
