package com.eventstorming.dispatch.cli;

import com.eventstorming.core.config.EventStormingProperties;
import com.eventstorming.core.flow.FlowRequest;
import com.eventstorming.core.flow.FlowTrace;
import com.eventstorming.core.model.ElementDraft;
import com.eventstorming.core.model.ElementPatch;
import com.eventstorming.core.model.ElementType;
import com.eventstorming.core.model.NotFoundException;
import com.eventstorming.core.model.OperationResult;
import com.eventstorming.core.model.WorkshopSummary;
import com.eventstorming.core.persistence.WorkshopJson;
import com.eventstorming.core.query.ElementFilter;
import com.eventstorming.core.query.Page;
import com.eventstorming.core.query.PageRequest;
import com.eventstorming.core.service.WorkshopService;
import com.eventstorming.dispatch.render.ElementViews;
import com.eventstorming.dispatch.render.JsonRenderer;
import com.eventstorming.dispatch.render.MarkdownRenderer;
import com.eventstorming.dispatch.render.RendererRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.eventstorming.core.WorkshopFixtures.element;
import static com.eventstorming.core.WorkshopFixtures.workshop;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests for the CLI command structure.
 * These tests exercise picocli directly without Spring context, with a mocked
 * {@link WorkshopService} and the real renderers.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private final ObjectMapper mapper = WorkshopJson.objectMapper();
    private WorkshopService service;
    private RendererRegistry renderers;

    @BeforeEach
    void setUp() {
        service = mock(WorkshopService.class);
        renderers = new RendererRegistry(List.of(
                new MarkdownRenderer(new EventStormingProperties()),
                new JsonRenderer(mapper, new ElementViews(mapper))));
    }

    /**
     * Custom picocli IFactory that builds every workshop command with the mocked service.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            public <K> K create(Class<K> cls) throws Exception {
                if (WorkshopCommandSupport.class.isAssignableFrom(cls)) {
                    return cls.getConstructor(WorkshopService.class, RendererRegistry.class)
                            .newInstance(service, renderers);
                }
                // Default: use picocli's default factory for other classes
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new EventStormingCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("create", "list", "show", "add", "update", "delete", "context", "assign",
                    "search", "timeline", "contexts", "stats", "flow", "export", "import", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "' subcommand");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("EventStorming 0.1.0"));
        }

        @Test
        @DisplayName("no subcommand prints the banner and usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("EVENTSTORMING v0.1.0"));
            assertTrue(result.output().contains("Usage:"));
        }
    }

    // =====================================================================
    //  Mutation commands
    // =====================================================================

    @Nested
    @DisplayName("Mutation commands")
    class MutationTests {

        @Test
        @DisplayName("add parses the type and options into a draft")
        void addElement() {
            when(service.addElement(eq("w-1"), any())).thenReturn(
                    OperationResult.created("e-1", "Event 'Order Placed' added successfully at position 0"));

            CliResult result = execute("add", "w-1", "EVENT", "Order Placed", "--notes", "first",
                    "--triggered-by", "c1,c2", "--context", "ctx-1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("added successfully"));
            var captor = ArgumentCaptor.forClass(ElementDraft.class);
            verify(service).addElement(eq("w-1"), captor.capture());
            ElementDraft draft = captor.getValue();
            assertEquals(ElementType.EVENT, draft.type());
            assertEquals("first", draft.notes());
            assertEquals(List.of("c1", "c2"), draft.triggeredBy());
            assertEquals("ctx-1", draft.boundedContextId());
            assertNull(draft.position());
        }

        @Test
        @DisplayName("an unknown element type is a usage error")
        void unknownType() {
            CliResult result = execute("add", "w-1", "saga", "Order Saga");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Unknown element type: saga"));
            verifyNoInteractions(service);
        }

        @Test
        @DisplayName("a failed mutation exits non-zero")
        void failedMutation() {
            when(service.deleteElement("w-1", "nope")).thenReturn(OperationResult.failure("Element not found: nope"));

            CliResult result = execute("delete", "w-1", "nope");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Element not found: nope"));
        }

        @Test
        @DisplayName("update without fields does not call the service")
        void emptyUpdate() {
            CliResult result = execute("update", "w-1", "e-1");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Nothing to update"));
            verify(service, never()).updateElement(anyString(), anyString(), any());
        }

        @Test
        @DisplayName("update passes the context sentinel through")
        void updateClearsContext() {
            when(service.updateElement(eq("w-1"), eq("e-1"), any()))
                    .thenReturn(OperationResult.updated("e-1", List.of("bounded_context_id")));

            CliResult result = execute("update", "w-1", "e-1", "--context", "null", "--format", "json");

            assertEquals(0, result.exitCode());
            var captor = ArgumentCaptor.forClass(ElementPatch.class);
            verify(service).updateElement(eq("w-1"), eq("e-1"), captor.capture());
            assertEquals(ElementPatch.CLEAR_CONTEXT, captor.getValue().boundedContextId());
            assertTrue(result.output().contains("\"updated_fields\""));
        }

        @Test
        @DisplayName("assign forwards every element id")
        void assign() {
            when(service.assignToContext("w-1", "ctx-1", List.of("e1", "e2"))).thenReturn(
                    OperationResult.assigned("ctx-1", "Assigned 2 element(s) to 'Sales'", List.of("e1", "e2"), List.of()));

            CliResult result = execute("assign", "w-1", "ctx-1", "e1", "e2");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Assigned 2 element(s) to 'Sales'"));
        }
    }

    // =====================================================================
    //  Query commands
    // =====================================================================

    @Nested
    @DisplayName("Query commands")
    class QueryTests {

        @Test
        @DisplayName("search --format json prints a parseable document")
        void searchJson() throws Exception {
            var ws = workshop("w-1", "Checkout");
            var evt = element(ws, "e1", ElementType.EVENT, "Order Placed", 0);
            when(service.search(eq("w-1"), eq("order"), any(), any()))
                    .thenReturn(Page.of(List.of(evt), PageRequest.firstPage()));

            CliResult result = execute("search", "w-1", "order", "--format", "json", "--type", "event");

            assertEquals(0, result.exitCode());
            JsonNode out = mapper.readTree(result.output());
            assertEquals("e1", out.at("/matches/0/id").asText());
            var filter = ArgumentCaptor.forClass(ElementFilter.class);
            verify(service).search(eq("w-1"), eq("order"), filter.capture(), any());
            assertEquals(ElementType.EVENT, filter.getValue().type());
        }

        @Test
        @DisplayName("unknown workshop prints an error with a suggestion")
        void notFound() {
            when(service.statistics("nope")).thenThrow(new NotFoundException(NotFoundException.Kind.WORKSHOP, "nope"));

            CliResult result = execute("stats", "nope");

            assertEquals(WorkshopCommandSupport.EXIT_NOT_FOUND, result.exitCode());
            assertTrue(result.output().contains("Workshop not found: nope"));
            assertTrue(result.output().contains("eventstorming list"));
        }

        @Test
        @DisplayName("invalid paging is reported without calling the service")
        void invalidPaging() {
            CliResult result = execute("timeline", "w-1", "--page-size", "500");

            assertEquals(WorkshopCommandSupport.EXIT_INVALID, result.exitCode());
            assertTrue(result.output().contains("Page size must be between 1 and 200"));
            verifyNoInteractions(service);
        }

        @Test
        @DisplayName("flow passes depth and budget options")
        void flowOptions() {
            when(service.traceFlow(eq("w-1"), any())).thenReturn(
                    new FlowTrace("Checkout", "e1", List.of(), 1, 0, 10, false));

            CliResult result = execute("flow", "w-1", "--start", "e1", "--max-depth", "3", "--max-elements", "10");

            assertEquals(0, result.exitCode());
            var captor = ArgumentCaptor.forClass(FlowRequest.class);
            verify(service).traceFlow(eq("w-1"), captor.capture());
            assertEquals(new FlowRequest("e1", 3, 10), captor.getValue());
            assertTrue(result.output().contains("Event Flow Visualization: Checkout"));
        }

        @Test
        @DisplayName("list shows workshop summaries")
        void list() {
            when(service.listWorkshops()).thenReturn(List.of(
                    new WorkshopSummary("w-1", "Checkout", "E-commerce", "t0", "t1", 4, 1)));

            CliResult result = execute("list");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("**Checkout** `w-1` (E-commerce): 4 elements, 1 contexts"));
        }
    }

    // =====================================================================
    //  Export / import
    // =====================================================================

    @Nested
    @DisplayName("Export and import")
    class TransferTests {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("export --output writes the document to a file")
        void exportToFile() throws Exception {
            when(service.exportWorkshop("w-1", false)).thenReturn("{\"metadata\": {}}");
            Path file = tempDir.resolve("w-1.json");

            CliResult result = execute("export", "w-1", "--no-include-metadata", "--output", file.toString());

            assertEquals(0, result.exitCode());
            assertEquals("{\"metadata\": {}}", Files.readString(file));
            verify(service).exportWorkshop("w-1", false);
        }

        @Test
        @DisplayName("export keeps full metadata unless --no-include-metadata is given")
        void exportIncludesMetadataByDefault() {
            when(service.exportWorkshop("w-1", true)).thenReturn("{\"metadata\": {\"id\": \"w-1\"}}");

            CliResult result = execute("export", "w-1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("\"id\": \"w-1\""));
            verify(service).exportWorkshop("w-1", true);
            verify(service, never()).exportWorkshop("w-1", false);
        }

        @Test
        @DisplayName("import reads the file and applies the new name")
        void importFromFile() throws Exception {
            Path file = tempDir.resolve("in.json");
            Files.writeString(file, "{\"metadata\": {\"name\": \"X\"}}");
            when(service.importWorkshop(anyString(), eq("Copy")))
                    .thenReturn(OperationResult.created("w-2", "Workshop 'Copy' imported successfully"));

            CliResult result = execute("import", file.toString(), "--name", "Copy");

            assertEquals(0, result.exitCode());
            verify(service).importWorkshop("{\"metadata\": {\"name\": \"X\"}}", "Copy");
        }

        @Test
        @DisplayName("missing import file is a storage error")
        void missingFile() {
            CliResult result = execute("import", tempDir.resolve("absent.json").toString());
            assertEquals(WorkshopCommandSupport.EXIT_STORAGE, result.exitCode());
            assertTrue(result.output().contains("Failed to read import data"));
        }
    }
}
