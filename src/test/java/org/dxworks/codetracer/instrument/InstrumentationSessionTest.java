package org.dxworks.codetracer.instrument;

import org.dxworks.codetracer.CodetracerConfig;
import org.dxworks.codetracer.LanguageRegistry;
import org.dxworks.codetracer.model.ExecutionTree;
import org.dxworks.codetracer.patch.HeaderZonePolicy;
import org.dxworks.codetracer.patch.LineNormalizer;
import org.dxworks.codetracer.source.FunctionSourceExtractor;
import org.dxworks.codetracer.source.ProjectFiles;
import org.dxworks.codetracer.tree.ExecutionTreeBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InstrumentationSessionTest {

    private static final String SERVICE = """
        function a() {
          return b();
        }

        function b() {
          return 2;
        }
        """;

    @TempDir
    Path root;

    private ProjectFiles files;
    private ExecutionTree tree;
    private final Map<String, String> rewrites = new HashMap<>();
    private final List<RewriteRequest> requests = new ArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(root.resolve("service.js"), SERVICE, StandardCharsets.UTF_8);
        CodetracerConfig config = CodetracerConfig.defaults();
        files = new ProjectFiles(root, config);
        tree = new ExecutionTreeBuilder(files, LanguageRegistry.create(config)).build("service.js", "a");

        rewrites.put("a", "const { trace } = require('handit');\n\nfunction a() {\n  trace('a');\n  return b();\n}");
        rewrites.put("b", "function b() {\n  trace('b');\n  return 2;\n}");
    }

    @Test
    void acceptedChangesAreWrittenOncePerFile() throws IOException {
        InstrumentationSession session = session(this::fakeRewrite);

        SessionResult result = session.run(List.of("service.js:a", "service.js:b"), change -> ReviewDecision.ACCEPT);

        assertEquals(2, result.accepted.size());
        assertFalse(result.stopped);
        assertEquals(2, session.getPending().size());

        ApplyReport report = session.applyAll();

        assertEquals(Map.of("service.js", 2), report.getAppliedChanges());
        assertFalse(report.hasFailures());
        assertEquals(List.of("handit_service.js"), report.getGeneratedFiles());
        assertEquals(TracingServiceFile.JAVASCRIPT_CONTENT,
                Files.readString(root.resolve("handit_service.js"), StandardCharsets.UTF_8));
        assertTrue(session.getPending().isEmpty());
        assertEquals("""
            const { trace } = require('handit');
            function a() {
              trace('a');
              return b();
            }

            function b() {
              trace('b');
              return 2;
            }
            """, read());
    }

    @Test
    void requestCarriesTheFunctionAndTheGraph() {
        session(this::fakeRewrite).run(List.of("service.js:a", "service.js:b"), change -> ReviewDecision.SKIP);

        assertEquals(2, requests.size());
        RewriteRequest entry = requests.get(0);
        assertTrue(entry.isEntryPoint);
        assertEquals("a", entry.targetFunction.name);
        assertEquals("service.js", entry.targetFunction.file);
        assertEquals(1, entry.targetFunction.line);
        assertEquals("function a() {\n  return b();\n}", entry.originalCode);
        assertSame(tree, entry.fullNodeGraph);
        assertFalse(requests.get(1).isEntryPoint);
        assertEquals(5, requests.get(1).targetFunction.line);
    }

    @Test
    void skippedChangesAreNotWritten() throws IOException {
        InstrumentationSession session = session(this::fakeRewrite);

        SessionResult result = session.run(List.of("service.js:a", "service.js:b"),
                change -> change.node.name.equals("b") ? ReviewDecision.ACCEPT : ReviewDecision.SKIP);
        session.applyAll();

        assertEquals(List.of("service.js:a"), result.skipped);
        assertEquals(SERVICE.replace("  return 2;", "  trace('b');\n  return 2;"), read());
    }

    @Test
    void stopEndsTheRunAndDiscardsTheCurrentChange() throws IOException {
        InstrumentationSession session = session(this::fakeRewrite);

        SessionResult result = session.run(List.of("service.js:a", "service.js:b"), change -> ReviewDecision.STOP);

        assertTrue(result.stopped);
        assertEquals(List.of("service.js:a"), result.skipped);
        assertEquals(1, requests.size());
        assertTrue(session.getPending().isEmpty());
        ApplyReport report = session.applyAll();
        assertEquals(0, report.totalApplied());
        assertTrue(report.getGeneratedFiles().isEmpty());
        assertFalse(Files.exists(root.resolve("handit_service.js")));
        assertEquals(SERVICE, read());
    }

    @Test
    void unknownFailingAndUnchangedNodes() {
        rewrites.remove("b");
        InstrumentationSession session = session(request -> {
            if (request.targetFunction.name.equals("a")) {
                throw new IOException("service unavailable");
            }
            return fakeRewrite(request);
        });

        SessionResult result = session.run(List.of("service.js:missing", "service.js:a", "service.js:b"),
                change -> ReviewDecision.ACCEPT);

        assertEquals(List.of("service.js:missing", "service.js:a"), result.skipped);
        assertEquals(List.of("service.js:b"), result.unchanged);
        assertTrue(result.accepted.isEmpty());
    }

    @Test
    void reviewingANodeAgainReplacesItsChange() {
        InstrumentationSession session = session(this::fakeRewrite);

        session.run(List.of("service.js:b"), change -> ReviewDecision.ACCEPT);
        session.run(List.of("service.js:b"), change -> ReviewDecision.ACCEPT);

        assertEquals(1, session.getPending().size());
    }

    @Test
    void missingFileIsReportedAsFailure() throws IOException {
        InstrumentationSession session = session(this::fakeRewrite);
        session.run(List.of("service.js:b"), change -> ReviewDecision.ACCEPT);
        Files.delete(root.resolve("service.js"));

        ApplyReport report = session.applyAll();

        assertTrue(report.hasFailures());
        assertTrue(report.getFailures().containsKey("service.js"));
        assertEquals(0, report.totalApplied());
        assertFalse(Files.exists(root.resolve("handit_service.js")));
    }

    private InstrumentationSession session(RewriteService service) {
        CodetracerConfig config = CodetracerConfig.defaults();
        return new InstrumentationSession(tree, files,
                new FunctionSourceExtractor(files, LanguageRegistry.create(config)),
                service,
                new LineNormalizer(new HeaderZonePolicy(config.getInstrumentationMarkers())));
    }

    private RewriteResponse fakeRewrite(RewriteRequest request) {
        requests.add(request);
        String code = rewrites.get(request.targetFunction.name);
        return code == null ? RewriteResponse.noChange() : new RewriteResponse(code, true);
    }

    private String read() throws IOException {
        return Files.readString(root.resolve("service.js"), StandardCharsets.UTF_8);
    }
}
