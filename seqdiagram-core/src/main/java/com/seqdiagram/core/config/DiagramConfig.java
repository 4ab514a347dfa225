package com.seqdiagram.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration for sequence diagram generation.
 *
 * <p>Loaded from {@code seqdiagram.yaml}. Every section and every field is optional;
 * anything left out falls back to the values of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * notation:
 *   startMarker: "@startuml"
 *   endMarker: "@enduml"
 *   indentWidth: 2
 *
 * async:
 *   callSuffix: Async
 *   annotations: [Async]
 *   returnTypes: [CompletableFuture, CompletionStage, Future]
 *
 * fallbacks:
 *   catchType: Exception
 *   catchBinding: ex
 *   returnPlaceholder: return value
 *   unknownOwner: UnknownClass
 *   loopCondition: "true"
 *
 * parser:
 *   languageLevel: BLEEDING_EDGE
 * }</pre>
 *
 * @param notation markers and indentation of the emitted text
 * @param async rules that classify methods and calls as asynchronous
 * @param fallbacks text substituted when the syntax tree omits a detail
 * @param parser JavaParser settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DiagramConfig(
    @JsonProperty("notation") NotationSettings notation,
    @JsonProperty("async") AsyncSettings async,
    @JsonProperty("fallbacks") FallbackSettings fallbacks,
    @JsonProperty("parser") ParserSettings parser
) {
    /**
     * Compact constructor replacing absent sections with their defaults.
     */
    public DiagramConfig {
        if (notation == null) {
            notation = NotationSettings.defaults();
        }
        if (async == null) {
            async = AsyncSettings.defaults();
        }
        if (fallbacks == null) {
            fallbacks = FallbackSettings.defaults();
        }
        if (parser == null) {
            parser = ParserSettings.defaults();
        }
    }

    /**
     * Creates the default configuration (PlantUML markers, two-space indent,
     * {@code Async} naming convention).
     *
     * @return default configuration
     */
    public static DiagramConfig defaults() {
        return new DiagramConfig(null, null, null, null);
    }

    /**
     * Diagram notation settings.
     *
     * @param startMarker first line of the document
     * @param endMarker last line of the document
     * @param indentWidth spaces per nesting level
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NotationSettings(
        @JsonProperty("startMarker") String startMarker,
        @JsonProperty("endMarker") String endMarker,
        @JsonProperty("indentWidth") int indentWidth
    ) {
        public NotationSettings {
            if (startMarker == null || startMarker.isBlank()) {
                startMarker = "@startuml";
            }
            if (endMarker == null || endMarker.isBlank()) {
                endMarker = "@enduml";
            }
            if (indentWidth <= 0) {
                indentWidth = 2;
            }
        }

        public static NotationSettings defaults() {
            return new NotationSettings(null, null, 0);
        }
    }

    /**
     * Asynchronous classification settings.
     *
     * <p>A call is asynchronous when its method name ends with {@code callSuffix}.
     * A method is asynchronous when it carries one of {@code annotations} or
     * its return type's simple name is one of {@code returnTypes}.
     *
     * @param callSuffix method-name suffix marking asynchronous calls
     * @param annotations simple annotation names marking asynchronous methods
     * @param returnTypes simple return type names marking asynchronous methods
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AsyncSettings(
        @JsonProperty("callSuffix") String callSuffix,
        @JsonProperty("annotations") List<String> annotations,
        @JsonProperty("returnTypes") List<String> returnTypes
    ) {
        public AsyncSettings {
            if (callSuffix == null || callSuffix.isBlank()) {
                callSuffix = "Async";
            }
            annotations = annotations == null ? List.of("Async") : List.copyOf(annotations);
            returnTypes = returnTypes == null
                ? List.of("CompletableFuture", "CompletionStage", "Future")
                : List.copyOf(returnTypes);
        }

        public static AsyncSettings defaults() {
            return new AsyncSettings(null, null, null);
        }

        /**
         * Checks whether a called method name follows the asynchronous naming convention.
         *
         * @param methodName simple method name
         * @return true if the name ends with the configured suffix
         */
        public boolean isAsyncCall(String methodName) {
            return methodName != null && methodName.endsWith(callSuffix);
        }
    }

    /**
     * Default texts substituted for details missing from the syntax tree.
     *
     * @param catchType exception type used when a catch clause names none
     * @param catchBinding variable name used when a catch clause binds none
     * @param returnPlaceholder return-line label for calls returned directly
     * @param unknownOwner participant name for methods outside any type
     * @param loopCondition loop label for a {@code for} without condition
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FallbackSettings(
        @JsonProperty("catchType") String catchType,
        @JsonProperty("catchBinding") String catchBinding,
        @JsonProperty("returnPlaceholder") String returnPlaceholder,
        @JsonProperty("unknownOwner") String unknownOwner,
        @JsonProperty("loopCondition") String loopCondition
    ) {
        public FallbackSettings {
            catchType = orDefault(catchType, "Exception");
            catchBinding = orDefault(catchBinding, "ex");
            returnPlaceholder = orDefault(returnPlaceholder, "return value");
            unknownOwner = orDefault(unknownOwner, "UnknownClass");
            loopCondition = orDefault(loopCondition, "true");
        }

        public static FallbackSettings defaults() {
            return new FallbackSettings(null, null, null, null, null);
        }

        private static String orDefault(String value, String fallback) {
            return value == null || value.isBlank() ? fallback : value;
        }
    }

    /**
     * JavaParser settings.
     *
     * @param languageLevel name of a {@code ParserConfiguration.LanguageLevel} constant, or one of
     *        the aliases {@code BLEEDING_EDGE}, {@code CURRENT}, {@code POPULAR}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ParserSettings(
        @JsonProperty("languageLevel") String languageLevel
    ) {
        public ParserSettings {
            if (languageLevel == null || languageLevel.isBlank()) {
                languageLevel = "BLEEDING_EDGE";
            }
        }

        public static ParserSettings defaults() {
            return new ParserSettings(null);
        }
    }
}
