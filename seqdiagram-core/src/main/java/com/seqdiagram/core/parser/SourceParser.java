package com.seqdiagram.core.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ParserConfiguration.LanguageLevel;
import com.github.javaparser.ast.CompilationUnit;
import com.seqdiagram.core.config.DiagramConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Parses Java source text into a JavaParser {@link CompilationUnit}.
 *
 * <p>JavaParser is lenient: source with syntax errors often still yields a partial tree
 * together with a list of problems. Such partial trees are returned as they are (the
 * problems are logged at WARN). Only when no tree at all can be built is a
 * {@link SourceParseException} thrown.
 *
 * <p>Token ranges are kept so that {@link SourceText} can reproduce the literal text of
 * every node.
 */
public class SourceParser {

    private static final Logger log = LoggerFactory.getLogger(SourceParser.class);

    private final JavaParser javaParser;

    /**
     * Creates a parser with the language level from the given settings.
     *
     * <p>Besides the {@code JAVA_*} constants, the aliases {@code BLEEDING_EDGE},
     * {@code CURRENT} and {@code POPULAR} are accepted. An unknown name is logged and
     * replaced by {@code BLEEDING_EDGE}.
     *
     * @param settings parser settings
     */
    public SourceParser(DiagramConfig.ParserSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        ParserConfiguration configuration = new ParserConfiguration()
            .setLanguageLevel(resolveLanguageLevel(settings.languageLevel()))
            .setStoreTokens(true);
        this.javaParser = new JavaParser(configuration);
    }

    /**
     * Creates a parser with default settings.
     */
    public SourceParser() {
        this(DiagramConfig.ParserSettings.defaults());
    }

    /**
     * Parses one compilation unit.
     *
     * @param sourceCode Java source text
     * @return the (possibly partial) syntax tree
     * @throws SourceParseException if JavaParser could not build any tree
     */
    public CompilationUnit parse(String sourceCode) {
        Objects.requireNonNull(sourceCode, "sourceCode must not be null");

        ParseResult<CompilationUnit> result = javaParser.parse(stripByteOrderMark(sourceCode));

        if (result.getResult().isEmpty()) {
            throw new SourceParseException("Source could not be parsed", result.getProblems());
        }

        if (!result.isSuccessful()) {
            log.warn("Source parsed with {} problem(s), continuing with partial tree",
                result.getProblems().size());
            result.getProblems().forEach(problem -> log.warn("  - {}", problem.getVerboseMessage()));
        }

        return result.getResult().get();
    }

    /**
     * Maps a configured language level name to a JavaParser language level.
     *
     * @param name constant or alias name, case-insensitive
     * @return the matching language level, {@code BLEEDING_EDGE} if unknown
     */
    static LanguageLevel resolveLanguageLevel(String name) {
        String normalized = name == null ? "" : name.trim().toUpperCase(Locale.ROOT);
        // aliases are static fields, not enum constants
        return switch (normalized) {
            case "BLEEDING_EDGE" -> LanguageLevel.BLEEDING_EDGE;
            case "CURRENT" -> LanguageLevel.CURRENT;
            case "POPULAR" -> LanguageLevel.POPULAR;
            default -> languageLevelConstant(normalized);
        };
    }

    private static LanguageLevel languageLevelConstant(String name) {
        try {
            return LanguageLevel.valueOf(name);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown language level: '{}'. Using BLEEDING_EDGE.", name);
            return LanguageLevel.BLEEDING_EDGE;
        }
    }

    private static String stripByteOrderMark(String sourceCode) {
        return sourceCode.startsWith("\uFEFF") ? sourceCode.substring(1) : sourceCode;
    }
}
