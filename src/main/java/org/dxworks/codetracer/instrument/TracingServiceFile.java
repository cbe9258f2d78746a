package org.dxworks.codetracer.instrument;

import org.dxworks.codetracer.Language;
import org.dxworks.codetracer.LanguageDetector;
import org.dxworks.codetracer.source.ProjectFiles;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The module instrumented code imports its tracer from ({@code require('./handit_service')},
 * {@code from handit_service import tracker}). One is written at the project root per language
 * of the instrumented files; an existing file is left alone.
 */
public class TracingServiceFile {
    static final String JAVASCRIPT_FILE = "handit_service.js";
    static final String PYTHON_FILE = "handit_service.py";

    static final String JAVASCRIPT_CONTENT = """
            /**
             * Handit.ai service initialization.
             * This file creates the Handit.ai configuration for tracing your agent.
             */
            const { config, startTracing, trackNode, endTracing } = require('@handit.ai/node');

            config({
                apiKey: process.env.HANDIT_API_KEY
            });

            module.exports = {
              startTracing,
              trackNode,
              endTracing
            };
            """;

    static final String PYTHON_CONTENT = """
            \"""
            Handit.ai service initialization.
            Import the shared tracker from here: from handit_service import tracker
            \"""
            import os
            from dotenv import load_dotenv
            from handit import HanditTracker

            load_dotenv()

            tracker = HanditTracker()
            tracker.config(api_key=os.getenv("HANDIT_API_KEY"))
            """;

    private final ProjectFiles files;

    public TracingServiceFile(ProjectFiles files) {
        this.files = files;
    }

    /**
     * Writes the service module for every language among {@code instrumentedFiles}.
     *
     * @return project-relative names of the files created
     */
    public List<String> writeFor(Collection<String> instrumentedFiles) throws IOException {
        Set<Language> languages = EnumSet.noneOf(Language.class);
        for (String file : instrumentedFiles) {
            LanguageDetector.detectLanguage(file).ifPresent(languages::add);
        }

        List<String> created = new ArrayList<>();
        if (languages.contains(Language.JAVASCRIPT) || languages.contains(Language.TYPESCRIPT)
                || languages.contains(Language.TSX)) {
            writeIfAbsent(JAVASCRIPT_FILE, JAVASCRIPT_CONTENT, created);
        }
        if (languages.contains(Language.PYTHON)) {
            writeIfAbsent(PYTHON_FILE, PYTHON_CONTENT, created);
        }
        return created;
    }

    private void writeIfAbsent(String fileName, String content, List<String> created) throws IOException {
        Path path = files.resolve(fileName);
        if (Files.exists(path)) {
            return;
        }
        Files.writeString(path, content, StandardCharsets.UTF_8);
        System.out.println("Created " + fileName);
        created.add(fileName);
    }
}
