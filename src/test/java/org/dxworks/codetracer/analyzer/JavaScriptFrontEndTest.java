package org.dxworks.codetracer.analyzer;

import org.dxworks.codetracer.CodetracerConfig;
import org.dxworks.codetracer.model.AssignmentBinding;
import org.dxworks.codetracer.model.CallKind;
import org.dxworks.codetracer.model.CallSite;
import org.dxworks.codetracer.model.FunctionDefinition;
import org.dxworks.codetracer.model.ImportBinding;
import org.dxworks.codetracer.model.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class JavaScriptFrontEndTest {

    private final JavaScriptFrontEnd frontEnd = new JavaScriptFrontEnd(CodetracerConfig.defaults().getRouteMethods());

    @Test
    void routeRegistrationWinsOverSameNamedFunction() {
        String source = """
            const express = require('express');
            const app = express();

            function process(input) {
              return input;
            }

            app.post('/process', upload.single('file'), async (req, res) => {
              const out = process(req.body);
              res.json(out);
            });
            """;

        FunctionDefinition definition = frontEnd.findDefinition("/process", source, "server.js").orElseThrow();
        assertEquals(NodeKind.ENDPOINT, definition.kind);
        assertEquals(8, definition.startLine);
        assertEquals(11, definition.endLine);
        assertTrue(definition.metadata.isAsync);
        assertTrue(definition.metadata.isEndpoint);
        assertEquals(List.of("req", "res"), definition.metadata.parameters);

        // the path without its leading slash names the same route
        assertEquals(8, frontEnd.findDefinition("process", source, "server.js").orElseThrow().startLine);
    }

    @Test
    void exportedFunctionDeclarationCoversExportKeyword() {
        String source = """
            import fs from 'fs';

            export async function load(path, retries = 2, ...rest) {
              return fs.readFile(path);
            }
            """;

        FunctionDefinition definition = frontEnd.findDefinition("load", source, "loader.js").orElseThrow();
        assertEquals(NodeKind.FUNCTION, definition.kind);
        assertEquals(3, definition.startLine);
        assertEquals(5, definition.endLine);
        assertTrue(definition.metadata.isExported);
        assertTrue(definition.metadata.isAsync);
        assertEquals(List.of("path", "retries", "...rest"), definition.metadata.parameters);
    }

    @Test
    void variableBoundToArrowFunction() {
        String source = """
            const helper = 1;
            const handle = (event) => {
              return helper + event;
            };
            var legacy = function (a, { b, c }) {
              return a;
            };
            """;

        FunctionDefinition arrow = frontEnd.findDefinition("handle", source, "h.js").orElseThrow();
        assertEquals(2, arrow.startLine);
        assertEquals(4, arrow.endLine);
        assertFalse(arrow.metadata.isAsync);
        assertEquals(List.of("event"), arrow.metadata.parameters);

        FunctionDefinition legacy = frontEnd.findDefinition("legacy", source, "h.js").orElseThrow();
        assertEquals(5, legacy.startLine);
        assertEquals(List.of("a", "{ b, c }"), legacy.metadata.parameters);

        // not a function
        assertTrue(frontEnd.findDefinition("helper", source, "h.js").isEmpty());
    }

    @Test
    void commonJsExportAssignment() {
        String source = """
            module.exports.render = function (view) {
              return compile(view);
            };
            """;

        FunctionDefinition definition = frontEnd.findDefinition("render", source, "view.js").orElseThrow();
        assertTrue(definition.metadata.isExported);
        assertEquals(1, definition.startLine);
        assertEquals(3, definition.endLine);
        assertEquals(List.of("compile"), names(frontEnd.findCallsWithin("render", source)));
    }

    @Test
    void classMethodsAndFieldFunctions() {
        String source = """
            class OrderService {
              async save(order) {
                this.validate(order);
                return repository.insert(order);
              }

              validate = (order) => {
                check(order);
              };
            }
            """;

        FunctionDefinition save = frontEnd.findDefinition("save", source, "orders.js").orElseThrow();
        assertEquals(NodeKind.METHOD, save.kind);
        assertTrue(save.metadata.isMethod);
        assertTrue(save.metadata.isAsync);
        assertEquals(2, save.startLine);
        assertEquals(5, save.endLine);

        FunctionDefinition validate = frontEnd.findDefinition("validate", source, "orders.js").orElseThrow();
        assertEquals(NodeKind.METHOD, validate.kind);
        assertEquals(7, validate.startLine);
    }

    @Test
    void callsAreClassifiedByCalleeShape() {
        String source = """
            function run(input) {
              prepare(input);
              client.send(input);
              this.flush();
              const item = new Item(input);
              items.filter(x => x.ok).map(x => x.id);
            }
            """;

        List<CallSite> calls = frontEnd.findCallsWithin("run", source);
        assertEquals(List.of("prepare", "send", "flush", "map", "filter"), names(calls));

        CallSite prepare = calls.get(0);
        assertEquals(CallKind.FUNCTION, prepare.kind);
        assertEquals(2, prepare.line);
        assertNull(prepare.receiver);

        CallSite send = calls.get(1);
        assertEquals(CallKind.METHOD, send.kind);
        assertEquals("client", send.receiver);
        assertEquals(3, send.line);

        assertEquals("this", calls.get(2).receiver);
        // receiver of a chained call is not an identifier
        assertNull(calls.get(3).receiver);
        assertEquals("items", calls.get(4).receiver);
    }

    @Test
    void callsOfUnknownTargetAreEmpty() {
        assertTrue(frontEnd.findCallsWithin("missing", "function other() { a(); }").isEmpty());
        assertEquals(Optional.empty(), frontEnd.findDefinition("missing", "function other() {}", "x.js"));
    }

    @Test
    void routeHandlerPassedByReference() {
        String source = """
            app.get('/health', healthCheck);
            router.delete('/items/:id', controller.remove);
            """;

        List<CallSite> health = frontEnd.findCallsWithin("/health", source);
        assertEquals(1, health.size());
        assertEquals("healthCheck", health.get(0).name);
        assertTrue(health.get(0).handlerReference);
        assertEquals(CallKind.FUNCTION, health.get(0).kind);

        List<CallSite> remove = frontEnd.findCallsWithin("/items/:id", source);
        assertEquals(1, remove.size());
        assertEquals("remove", remove.get(0).name);
        assertEquals("controller", remove.get(0).receiver);
        assertTrue(remove.get(0).handlerReference);
    }

    @Test
    void toleratesBrokenSyntax() {
        String source = """
            function ok() {
              helper();
            }

            function broken( {
              return ;;; }}}
            """;

        assertEquals(List.of("helper"), names(frontEnd.findCallsWithin("ok", source)));
    }

    @Test
    void importsFromEsModulesAndRequire() {
        String source = """
            import Service from './service';
            import { parse, format as fmt } from '../utils/text';
            import * as db from './db';
            const path = require('path');
            const { summarize, clean: sanitize } = require('./summarizer');
            const Client = require('./client').Client;
            """;

        List<String> bindings = frontEnd.findImports(source).stream()
                .map(ImportBinding::toString)
                .collect(Collectors.toList());

        assertEquals(List.of(
                "Service <- ./service#default",
                "parse <- ../utils/text#parse",
                "fmt <- ../utils/text#format",
                "db <- ./db",
                "path <- path",
                "summarize <- ./summarizer#summarize",
                "sanitize <- ./summarizer#clean",
                "Client <- ./client#Client"), bindings);
    }

    @Test
    void constructorAssignments() {
        String source = """
            const repo = new Repository(db);
            let cache;
            cache = new lru.Cache(10);
            const plain = build();
            """;

        List<AssignmentBinding> assignments = frontEnd.findAssignments(source);
        assertEquals(2, assignments.size());
        assertEquals("repo", assignments.get(0).variable);
        assertEquals("Repository", assignments.get(0).constructorName);
        assertEquals(1, assignments.get(0).line);
        assertEquals("cache", assignments.get(1).variable);
        assertEquals("Cache", assignments.get(1).constructorName);
    }

    @Test
    void relativeModulesMapToFileCandidates() {
        ImportBinding relative = new ImportBinding("svc", "../services/user", null);
        assertEquals(List.of(
                "src/services/user.js",
                "src/services/user.ts",
                "src/services/user.jsx",
                "src/services/user.tsx",
                "src/services/user.mjs",
                "src/services/user.cjs",
                "src/services/user/index.js",
                "src/services/user/index.ts",
                "src/services/user/index.jsx",
                "src/services/user/index.tsx"),
                frontEnd.moduleCandidates(relative, "src/routes/users.js"));

        ImportBinding withExtension = new ImportBinding("util", "./util.js", null);
        assertEquals(List.of("lib/util.js", "lib/util.ts", "lib/util.tsx"),
                frontEnd.moduleCandidates(withExtension, "lib/index.ts"));

        assertTrue(frontEnd.moduleCandidates(new ImportBinding("express", "express", null), "server.js").isEmpty());
        assertTrue(frontEnd.moduleCandidates(new ImportBinding("x", "../../x", null), "a.js").isEmpty());
    }

    private static List<String> names(List<CallSite> calls) {
        return calls.stream().map(c -> c.name).collect(Collectors.toList());
    }
}
