package com.seqdiagram.core.generator;

import com.seqdiagram.core.config.DiagramConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for {@link SequenceDiagramGenerator}: Java source in, PlantUML text out.
 */
class SequenceDiagramGeneratorTest {

    private SequenceDiagramGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new SequenceDiagramGenerator();
    }

    @Test
    void generate_withBranchOfSyncAndAsyncCalls_producesExpectedDiagram() {
        // Given
        String source = """
            class Foo {
                void handle(int x) {
                    if (x>0) {
                        bar.Do(x);
                    } else {
                        baz.DoAsync(x);
                    }
                }
            }
            """;

        // When
        GeneratedDiagram diagram = generator.generate(source);

        // Then
        assertThat(diagram.content()).isEqualTo(document(
            "@startuml",
            "  participant \"Foo\"",
            "  participant \"bar\"",
            "  participant \"baz\"",
            "",
            "  note over Foo: handle(int x)",
            "  alt x>0",
            "    Foo -> \"bar\": Do(x)",
            "    else",
            "    Foo ->> \"baz\": DoAsync(x)",
            "    activate baz",
            "  end",
            "  deactivate baz",
            "@enduml"
        ));
        assertThat(diagram.name()).isEqualTo("Foo");
        assertThat(diagram.fileExtension()).isEqualTo("puml");
    }

    @Test
    void generate_withForLoop_emitsLoopBlockAroundCall() {
        // Given
        String source = """
            class Foo {
                void fill(int n) {
                    for(int i=0;i<n;i++){ list.Add(i); }
                }
            }
            """;

        // When
        List<String> body = bodyOf(generator.generate(source));

        // Then
        assertThat(body).containsExactly(
            "  note over Foo: fill(int n)",
            "  loop i<n",
            "    Foo -> \"list\": Add(i)",
            "  end"
        );
    }

    @Test
    void generate_withNestedForLoops_indentsInnerLoopOneLevelDeeper() {
        // Given
        String source = """
            class Foo {
                void fill(int n, int m) {
                    for (int i = 0; i<n; i++) {
                        for (int j = 0; j<m; j++) {
                            grid.Set(i, j);
                        }
                    }
                }
            }
            """;

        // When
        List<String> body = bodyOf(generator.generate(source));

        // Then
        assertThat(body).containsExactly(
            "  note over Foo: fill(int n, int m)",
            "  loop i<n",
            "    loop j<m",
            "      Foo -> \"grid\": Set(i, j)",
            "    end",
            "  end"
        );
    }

    @Test
    void generate_withForEachWhileAndEndlessFor_labelsEachLoop() {
        // Given
        String source = """
            class Poller {
                void run(List<Order> orders) {
                    for (Order o : orders) {
                        repo.Save(o);
                    }
                    while (queue.HasNext()) {
                        queue.Next();
                    }
                    for (;;) {
                        clock.Tick();
                    }
                }
            }
            """;

        // When
        List<String> body = bodyOf(generator.generate(source));

        // Then
        assertThat(body).containsExactly(
            "  note over Poller: run(List<Order> orders)",
            "  loop for each o in orders",
            "    Poller -> \"repo\": Save(o)",
            "  end",
            "  loop while queue.HasNext()",
            "    Poller -> \"queue\": Next()",
            "  end",
            "  loop true",
            "    Poller -> \"clock\": Tick()",
            "  end"
        );
    }

    @Test
    void generate_withTryTwoCatchesAndFinally_emitsOneGroupPerPart() {
        // Given
        String source = """
            class Foo {
                void save(Order order) {
                    try {
                        repo.Save(order);
                    } catch (IOException e) {
                        log.Error(e);
                    } catch (RuntimeException ex) {
                        metrics.Fail();
                    } finally {
                        lock.Release();
                    }
                }
            }
            """;

        // When
        List<String> body = bodyOf(generator.generate(source));

        // Then
        assertThat(body).containsExactly(
            "  note over Foo: save(Order order)",
            "  group try",
            "    Foo -> \"repo\": Save(order)",
            "  end",
            "  group catch IOException as e",
            "    Foo -> \"log\": Error(e)",
            "  end",
            "  group catch RuntimeException as ex",
            "    Foo -> \"metrics\": Fail()",
            "  end",
            "  group finally",
            "    Foo -> \"lock\": Release()",
            "  end"
        );
        assertThat(body.stream().filter(line -> line.trim().startsWith("group "))).hasSize(4);
    }

    @Test
    void generate_withTryWithResourcesAndNoFinally_walksResourcesInsideTryGroup() {
        // Given
        String source = """
            class Reader {
                void read(Path path) {
                    try (var in = files.Open(path)) {
                        parser.Read(in);
                    } catch (IOException | UncheckedIOException e) {
                    }
                }
            }
            """;

        // When
        List<String> body = bodyOf(generator.generate(source));

        // Then
        assertThat(body).containsExactly(
            "  note over Reader: read(Path path)",
            "  group try",
            "    Reader -> \"files\": Open(path)",
            "    Reader -> \"parser\": Read(in)",
            "  end",
            "  group catch IOException | UncheckedIOException as e",
            "  end"
        );
    }

    @Test
    void generate_withClassicSwitch_mergesFallThroughLabelsAndSkipsDefault() {
        // Given
        String source = """
            class Router {
                void route(Status status, Order order) {
                    switch (status) {
                        case NEW:
                        case PENDING:
                            queue.Push(order);
                            break;
                        case DONE:
                            archive.Store(order);
                            break;
                        default:
                            audit.Unknown(status);
                    }
                }
            }
            """;

        // When
        GeneratedDiagram diagram = generator.generate(source);

        // Then
        assertThat(bodyOf(diagram)).containsExactly(
            "  note over Router: route(Status status, Order order)",
            "  alt [status]",
            "    case NEW, PENDING",
            "      Router -> \"queue\": Push(order)",
            "    case DONE",
            "      Router -> \"archive\": Store(order)",
            "  end"
        );
        assertThat(diagram.content()).doesNotContain("audit");
    }

    @Test
    void generate_withPatternSwitch_skipsPatternSectionsWithTheirStatements() {
        // Given
        String source = """
            class Painter {
                void paint(Object shape) {
                    switch (shape) {
                        case Circle c -> shapes.Round(c);
                        case "x" -> shapes.Cross();
                        default -> fallback.Draw(shape);
                    }
                }
            }
            """;

        // When
        GeneratedDiagram diagram = generator.generate(source);

        // Then
        assertThat(bodyOf(diagram)).containsExactly(
            "  note over Painter: paint(Object shape)",
            "  alt [shape]",
            "    case \"x\"",
            "      Painter -> \"shapes\": Cross()",
            "  end"
        );
        assertThat(diagram.content()).doesNotContain("Round").doesNotContain("fallback");
    }

    @Test
    void generate_withAssignmentReturnAndInitializer_emitsReturnLinesOnlyForAssignmentAndReturn() {
        // Given
        String source = """
            class Foo {
                String load(long id) {
                    result = repo.Find(id);
                    Order order = repo.Get(id);
                    repo.Touch(id);
                    return repo.Name(id);
                }
            }
            """;

        // When
        List<String> body = bodyOf(generator.generate(source));

        // Then
        assertThat(body).containsExactly(
            "  note over Foo: load(long id)",
            "  Foo -> \"repo\": Find(id)",
            "  repo --> Foo: result",
            "  Foo -> \"repo\": Get(id)",
            "  Foo -> \"repo\": Touch(id)",
            "  Foo -> \"repo\": Name(id)",
            "  repo --> Foo: return value"
        );
    }

    @Test
    void generate_withAsyncAnnotatedMethod_activatesOwnerForWholeMethod() {
        // Given
        String source = """
            class Notifier {
                @Async
                void notify(Order order) {
                    mailer.Send(order);
                }
            }
            """;

        // When
        List<String> body = bodyOf(generator.generate(source));

        // Then
        assertThat(body).containsExactly(
            "  note over Notifier: notify(Order order)",
            "  activate Notifier",
            "  Notifier -> \"mailer\": Send(order)",
            "  deactivate Notifier"
        );
    }

    @Test
    void generate_withFutureReturningMethodAndAsyncCall_unwindsActivationsInReverseOrder() {
        // Given
        String source = """
            class Worker {
                CompletableFuture<Void> process(Job job) {
                    return pool.RunAsync(job);
                }
            }
            """;

        // When
        List<String> body = bodyOf(generator.generate(source));

        // Then
        assertThat(body).containsExactly(
            "  note over Worker: process(Job job)",
            "  activate Worker",
            "  Worker ->> \"pool\": RunAsync(job)",
            "  activate pool",
            "  pool -->> Worker: return value",
            "  deactivate pool",
            "  deactivate Worker"
        );
    }

    @Test
    void generate_withElseIfChain_nestsEveryLink() {
        // Given
        String source = """
            class Foo {
                void pick(boolean a, boolean b) {
                    if (a) {
                        x.A();
                    } else if (b) {
                        y.B();
                    } else {
                        z.C();
                    }
                }
            }
            """;

        // When
        List<String> body = bodyOf(generator.generate(source));

        // Then
        assertThat(body).containsExactly(
            "  note over Foo: pick(boolean a, boolean b)",
            "  alt a",
            "    Foo -> \"x\": A()",
            "    else",
            "    alt b",
            "      Foo -> \"y\": B()",
            "      else",
            "      Foo -> \"z\": C()",
            "    end",
            "  end"
        );
    }

    @Test
    void generate_withObjectCreation_emitsCreationLineAndRegistersType() {
        // Given
        String source = """
            class Factory {
                void build(long id) {
                    Order order = new Order(id, "new");
                }
            }
            """;

        // When
        GeneratedDiagram diagram = generator.generate(source);

        // Then
        assertThat(bodyOf(diagram)).containsExactly(
            "  note over Factory: build(long id)",
            "  Factory -> \"Order\" **: new(id, \"new\")"
        );
        assertThat(diagram.content()).contains("  participant \"Order\"\n");
    }

    @Test
    void generate_withUnscopedCallsAndNestedArguments_emitsOnlyOuterScopedCall() {
        // Given
        String source = """
            class Foo {
                void run(int x) {
                    helper(x);
                    repo.Save(build(x), other.Value());
                }
            }
            """;

        // When
        GeneratedDiagram diagram = generator.generate(source);

        // Then
        assertThat(bodyOf(diagram)).containsExactly(
            "  note over Foo: run(int x)",
            "  Foo -> \"repo\": Save(build(x), other.Value())"
        );
        assertThat(diagram.content()).doesNotContain("participant \"other\"");
    }

    @Test
    void generate_withMultiLineArgument_escapesLineBreak() {
        // Given
        String source = "class Foo {\n"
            + "    void run() {\n"
            + "        repo.Save(List.of(a,\n"
            + "            b));\n"
            + "    }\n"
            + "}\n";

        // When
        List<String> body = bodyOf(generator.generate(source));

        // Then
        assertThat(body).contains("  Foo -> \"repo\": Save(List.of(a,\\n            b))");
        assertThat(body).allSatisfy(line -> assertThat(line).doesNotContain("\n"));
    }

    @Test
    void generate_withReceiverSpanningLines_keepsEveryDiagramLineOnOnePhysicalLine() {
        // Given
        String source = """
            class Foo {
                void build(int x) {
                    builder
                        .step()
                        .finishAsync(x);
                }
            }
            """;

        // When
        GeneratedDiagram diagram = generator.generate(source);

        // Then
        assertThat(diagram.content()).isEqualTo(document(
            "@startuml",
            "  participant \"Foo\"",
            "  participant \"builder\\n            .step()\"",
            "",
            "  note over Foo: build(int x)",
            "  Foo ->> \"builder\\n            .step()\": finishAsync(x)",
            "  activate builder\\n            .step()",
            "  deactivate builder\\n            .step()",
            "@enduml"
        ));
    }

    @Test
    void generate_withCreatedTypeSpanningLines_flattensParticipantName() {
        // Given
        String source = """
            class Foo {
                void build() {
                    Object map = new HashMap<String,
                        Integer>();
                }
            }
            """;

        // When
        GeneratedDiagram diagram = generator.generate(source);

        // Then
        assertThat(diagram.content()).contains("  participant \"HashMap<String,\\n            Integer>\"\n");
        assertThat(bodyOf(diagram)).containsExactly(
            "  note over Foo: build()",
            "  Foo -> \"HashMap<String,\\n            Integer>\" **: new()"
        );
    }

    @Test
    void generate_withSeveralMethodsAndTypes_listsParticipantsInFirstSeenOrder() {
        // Given
        String source = """
            class Alpha {
                void one() {
                    zeta.Call();
                    beta.Call();
                }
            }
            class Beta {
                void two() {
                    zeta.Call();
                    alpha.Call();
                }
            }
            interface Gamma {
                void three();
            }
            """;

        // When
        GeneratedDiagram diagram = generator.generate(source);

        // Then
        assertThat(diagram.content()).startsWith(document(
            "@startuml",
            "  participant \"Alpha\"",
            "  participant \"zeta\"",
            "  participant \"beta\"",
            "  participant \"Beta\"",
            "  participant \"alpha\"",
            "  participant \"Gamma\"",
            ""
        ));
        assertThat(diagram.content()).contains("  note over Gamma: three()\n");
        assertThat(diagram.name()).isEqualTo("Alpha");
    }

    @Test
    void generate_calledTwiceWithSameInput_returnsIdenticalContent() {
        // Given
        String source = """
            class Foo {
                void run(List<String> items) {
                    for (String item : items) {
                        if (item.isEmpty()) {
                            cache.EvictAsync(item);
                        }
                    }
                }
            }
            """;

        // When
        String first = generator.generate(source).content();
        String second = generator.generate(source).content();

        // Then
        assertThat(second).isEqualTo(first);
    }

    @Test
    void generate_withMixedBlocks_balancesOpenersAndTerminators() {
        // Given
        String source = """
            class Mixer {
                void mix(List<Item> items, int mode) {
                    for (Item item : items) {
                        try {
                            switch (mode) {
                                case 1:
                                    if (item.ok()) { sink.Put(item); } else { sink.Drop(item); }
                                    break;
                                case 2:
                                    while (item.more()) { item.Step(); }
                            }
                        } catch (Exception e) {
                            errors.Add(e);
                        } finally {
                            counter.Inc();
                        }
                    }
                }
            }
            """;

        // When
        List<String> body = bodyOf(generator.generate(source));

        // Then
        long openers = body.stream().map(String::trim)
            .filter(line -> line.startsWith("alt ") || line.startsWith("loop ") || line.startsWith("group "))
            .count();
        long terminators = body.stream().map(String::trim).filter("end"::equals).count();
        assertThat(openers).isEqualTo(7);
        assertThat(terminators).isEqualTo(openers);
    }

    @Test
    void generate_withNoMethods_producesHeaderOnlyDocument() {
        // When
        GeneratedDiagram diagram = generator.generate("interface Marker { }");

        // Then
        assertThat(diagram.content()).isEqualTo("@startuml\n\n@enduml\n");
        assertThat(diagram.name()).isEqualTo("Marker");
    }

    @Test
    void generate_withCustomNotation_usesMarkersAndIndentWidth() {
        // Given
        DiagramConfig config = new DiagramConfig(
            new DiagramConfig.NotationSettings("@startuml seq", "@enduml", 4), null, null, null);
        String source = """
            class Foo {
                void run(boolean a) {
                    if (a) { bar.Do(); }
                }
            }
            """;

        // When
        GeneratedDiagram diagram = new SequenceDiagramGenerator(config).generate(source);

        // Then
        assertThat(diagram.content()).isEqualTo(document(
            "@startuml seq",
            "    participant \"Foo\"",
            "    participant \"bar\"",
            "",
            "    note over Foo: run(boolean a)",
            "    alt a",
            "        Foo -> \"bar\": Do()",
            "    end",
            "@enduml"
        ));
    }

    @Test
    void generate_withCustomAsyncSuffix_treatsMatchingCallsAsAsync() {
        // Given
        DiagramConfig config = new DiagramConfig(null,
            new DiagramConfig.AsyncSettings("Later", List.of(), List.of()), null, null);
        String source = """
            class Foo {
                void run() {
                    bus.PublishLater(event);
                    bus.PublishAsync(event);
                }
            }
            """;

        // When
        List<String> body = bodyOf(new SequenceDiagramGenerator(config).generate(source));

        // Then
        assertThat(body).containsExactly(
            "  note over Foo: run()",
            "  Foo ->> \"bus\": PublishLater(event)",
            "  activate bus",
            "  Foo -> \"bus\": PublishAsync(event)",
            "  deactivate bus"
        );
    }

    @Test
    void generate_withNullSource_throwsNullPointerException() {
        assertThatThrownBy(() -> generator.generate((String) null))
            .isInstanceOf(NullPointerException.class);
    }

    private static String document(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    /**
     * Returns the body lines: everything between the blank separator line and the end marker.
     */
    private static List<String> bodyOf(GeneratedDiagram diagram) {
        List<String> lines = Arrays.asList(diagram.content().split("\n"));
        int separator = lines.indexOf("");
        return lines.subList(separator + 1, lines.size() - 1);
    }
}
