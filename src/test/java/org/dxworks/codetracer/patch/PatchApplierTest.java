package org.dxworks.codetracer.patch;

import org.dxworks.codetracer.model.ExecutionNode;
import org.dxworks.codetracer.model.NodeKind;
import org.dxworks.codetracer.model.SourceLocation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatchApplierTest {

    private static final String SERVICE = """
        "use strict";

        function a() {
          return 1;
        }

        function b() {
          return 2;
        }
        """;

    private static final String INSTRUMENTED_SERVICE = """
        "use strict";
        const { trace } = require('handit');

        function a() {
          trace();
          return 1;
        }

        function b() {
          trace();
          return 2;
        }
        """;

    private final LineNormalizer normalizer = new LineNormalizer(new HeaderZonePolicy(List.of("handit")));
    private final DiffEngine engine = new DiffEngine();
    private final PatchApplier applier = new PatchApplier();

    @Test
    void changesApplyInAnyOrder() {
        PendingChange a = traced("a", 3, "  return 1;");
        PendingChange b = traced("b", 7, "  return 2;");

        PatchApplier.Result forward = applier.apply(SERVICE, List.of(a, b));
        PatchApplier.Result backward = applier.apply(SERVICE, List.of(b, a));

        assertEquals(INSTRUMENTED_SERVICE, forward.content);
        assertEquals(INSTRUMENTED_SERVICE, backward.content);
        assertEquals(2, forward.applied.size());
        // the shared import goes in once
        assertEquals(1, forward.headerLinesInserted);
        assertTrue(forward.skipped.isEmpty());
    }

    @Test
    void headerAlreadyInFileIsNotRepeated() {
        String content = "const { trace } = require('handit');\n" + SERVICE.replace("\"use strict\";\n", "");

        PatchApplier.Result result = applier.apply(content, List.of(traced("a", 3, "  return 1;")));

        assertEquals(0, result.headerLinesInserted);
        assertEquals(1, result.content.split("require\\('handit'\\)", -1).length - 1);
    }

    @Test
    void multiLineConfigCallIsInsertedWhole() {
        String content = """
            const express = require('express');
            const app = express();
            app.use(express.json());


            app.post('/x', async (req, res) => {
              res.json({ ok: true });
            });
            """;
        PendingChange change = change("app.js", "POST /x", 6,
                "app.post('/x', async (req, res) => {\n  res.json({ ok: true });\n});",
                """
                const { config, startTracing } = require('@handit.ai/node');
                config({
                  apiKey: process.env.HANDIT_API_KEY
                });

                app.post('/x', async (req, res) => {
                  startTracing();
                  res.json({ ok: true });
                });""");

        assertEquals(List.of(
                "const { config, startTracing } = require('@handit.ai/node');",
                "config({\n  apiKey: process.env.HANDIT_API_KEY\n});"), change.delta.headerAdditions());

        PatchApplier.Result result = applier.apply(content, List.of(change));

        assertEquals("""
            const { config, startTracing } = require('@handit.ai/node');
            config({
              apiKey: process.env.HANDIT_API_KEY
            });
            const express = require('express');
            const app = express();
            app.use(express.json());


            app.post('/x', async (req, res) => {
              startTracing();
              res.json({ ok: true });
            });
            """, result.content);
        assertEquals(4, result.headerLinesInserted);
    }

    @Test
    void configCallAlreadyInFileIsNotRepeated() {
        String content = """
            const { config } = require('@handit.ai/node');
            config({
                apiKey: process.env.HANDIT_API_KEY
            });

            function a() {
              return 1;
            }
            """;
        PendingChange change = change("service.js", "a", 6,
                "function a() {\n  return 1;\n}",
                "const { config } = require('@handit.ai/node');\nconfig({\n  apiKey: process.env.HANDIT_API_KEY\n});\n\n"
                        + "function a() {\n  config.trace();\n  return 1;\n}");

        PatchApplier.Result result = applier.apply(content, List.of(change));

        // indentation differs, the statement still matches
        assertEquals(0, result.headerLinesInserted);
        assertEquals(1, result.content.split("config\\(\\{", -1).length - 1);
        assertTrue(result.content.contains("  config.trace();\n  return 1;"));
    }

    @Test
    void commentedOutHeaderDoesNotCountAsPresent() {
        String content = "// const { trace } = require('handit');\n" + SERVICE.replace("\"use strict\";\n", "");

        PatchApplier.Result result = applier.apply(content, List.of(traced("a", 3, "  return 1;")));

        assertEquals(1, result.headerLinesInserted);
        assertTrue(result.content.startsWith("const { trace } = require('handit');\n// const { trace }"));
    }

    @Test
    void functionOnFirstLineStillGetsItsHeader() {
        String content = "function a() {\n  return 1;\n}\n";

        PatchApplier.Result result = applier.apply(content, List.of(traced("a", 1, "  return 1;")));

        assertEquals(1, result.applied.size());
        assertEquals("const { trace } = require('handit');\nfunction a() {\n  trace();\n  return 1;\n}\n", result.content);
    }

    @Test
    void pythonHeaderGoesBelowShebangAndFutureImports() {
        String content = """
            #!/usr/bin/env python
            # -*- coding: utf-8 -*-
            from __future__ import annotations

            def f(x):
                return x
            """;
        PendingChange change = change("app.py", "f", 5,
                "def f(x):\n    return x",
                "import handit\n\n@handit.trace\ndef f(x):\n    return x");

        PatchApplier.Result result = applier.apply(content, List.of(change));

        assertEquals("""
            #!/usr/bin/env python
            # -*- coding: utf-8 -*-
            from __future__ import annotations
            import handit

            @handit.trace
            def f(x):
                return x
            """, result.content);
    }

    @Test
    void headerInsertionIndexSkipsLeadingDirectives() {
        assertEquals(0, PatchApplier.headerInsertionIndex(List.of("import os", "")));
        assertEquals(1, PatchApplier.headerInsertionIndex(List.of("#!/usr/bin/env node", "const a = 1;")));
        assertEquals(1, PatchApplier.headerInsertionIndex(List.of("'use strict'", "")));
        assertEquals(2, PatchApplier.headerInsertionIndex(List.of("# coding: latin-1", "from __future__ import division\r", "x = 1")));
    }

    @Test
    void staleChangeIsSkipped() {
        String edited = SERVICE.replace("return 1;", "return 10;");

        PatchApplier.Result result = applier.apply(edited, List.of(traced("a", 3, "  return 1;")));

        assertEquals(edited, result.content);
        assertTrue(result.applied.isEmpty());
        assertEquals(1, result.skipped.size());
        assertEquals(0, result.headerLinesInserted);
    }

    @Test
    void overlappingChangeIsSkipped() {
        String content = """
            function outer() {
              function inner() {
                return 1;
              }
              return inner();
            }
            """;
        PendingChange outer = change("nested.js", "outer", 1,
                "function outer() {\n  function inner() {\n    return 1;\n  }\n  return inner();\n}",
                "function outer() {\n  log('outer');\n  function inner() {\n    return 1;\n  }\n  return inner();\n}");
        PendingChange inner = change("nested.js", "inner", 2,
                "  function inner() {\n    return 1;\n  }",
                "  function inner() {\n    log('inner');\n    return 1;\n  }");

        PatchApplier.Result result = applier.apply(content, List.of(outer, inner));

        assertEquals(List.of(inner), result.applied);
        assertEquals(1, result.skipped.size());
        assertTrue(result.skipped.get(0).contains("nested.js:outer"));
        assertTrue(result.content.contains("log('inner');"));
        assertFalse(result.content.contains("log('outer');"));
    }

    @Test
    void unchangedDeltaLeavesContentAlone() {
        PendingChange noop = change("service.js", "a", 3,
                "function a() {\n  return 1;\n}", "function a() {\n  return 1;\n}");

        PatchApplier.Result result = applier.apply(SERVICE, List.of(noop));

        assertEquals(SERVICE, result.content);
        assertTrue(result.applied.isEmpty());
    }

    @Test
    void batchWritesFileAndKeepsByteOrderMark(@TempDir Path root) throws IOException {
        Path file = root.resolve("service.js");
        Files.writeString(file, "\uFEFF" + SERVICE, StandardCharsets.UTF_8);

        PatchApplier.Result result = applier.applyBatch(file, List.of(traced("b", 7, "  return 2;")));

        assertEquals(1, result.applied.size());
        String written = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(written.startsWith("\uFEFF\"use strict\";\nconst { trace } = require('handit');"));
        assertTrue(written.contains("function b() {\n  trace();\n  return 2;\n}"));
    }

    @Test
    void batchOnMissingFileFails(@TempDir Path root) {
        assertThrows(IllegalArgumentException.class,
                () -> applier.applyBatch(root.resolve("gone.js"), List.of(traced("a", 3, "  return 1;"))));
    }

    private PendingChange traced(String name, int startLine, String returnLine) {
        String original = "function " + name + "() {\n" + returnLine + "\n}";
        String rewritten = "const { trace } = require('handit');\n\nfunction " + name + "() {\n  trace();\n"
                + returnLine + "\n}";
        return change("service.js", name, startLine, original, rewritten);
    }

    private PendingChange change(String file, String name, int startLine, String original, String rewritten) {
        NormalizedCodeBlock originalBlock = normalizer.normalize(original, startLine);
        NormalizedCodeBlock rewrittenBlock = normalizer.normalize(rewritten, startLine);
        int endLine = startLine + original.split("\n", -1).length - 1;
        ExecutionNode node = new ExecutionNode(name, new SourceLocation(file, startLine), endLine, NodeKind.FUNCTION, null);
        return new PendingChange(node, originalBlock, engine.diff(originalBlock, rewrittenBlock));
    }
}
