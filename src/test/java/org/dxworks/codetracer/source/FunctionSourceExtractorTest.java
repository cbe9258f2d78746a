package org.dxworks.codetracer.source;

import org.dxworks.codetracer.CodetracerConfig;
import org.dxworks.codetracer.LanguageRegistry;
import org.dxworks.codetracer.model.ExecutionNode;
import org.dxworks.codetracer.model.NodeKind;
import org.dxworks.codetracer.model.SourceLocation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FunctionSourceExtractorTest {

    @Test
    void extractsTheCurrentDefinition(@TempDir Path root) throws IOException {
        ProjectFilesTest.write(root, "util.js", """
            // added after the tree was built
            const x = 1;

            function double(n) {
              return n * 2;
            }
            """);
        ProjectFiles files = new ProjectFiles(root, CodetracerConfig.defaults());
        FunctionSourceExtractor extractor = new FunctionSourceExtractor(files, LanguageRegistry.create(CodetracerConfig.defaults()));

        // recorded before the two leading lines were added
        ExecutionNode node = new ExecutionNode("double", new SourceLocation("util.js", 2), 4, NodeKind.FUNCTION, null);
        FunctionSourceExtractor.Extract extract = extractor.extract(node);

        assertEquals(4, extract.startLine);
        assertEquals(6, extract.endLine);
        assertEquals("function double(n) {\n  return n * 2;\n}", extract.code);
    }

    @Test
    void fallsBackToRecordedRange(@TempDir Path root) throws IOException {
        ProjectFilesTest.write(root, "dynamic.js", "line1\nline2\nline3\n");
        ProjectFiles files = new ProjectFiles(root, CodetracerConfig.defaults());
        FunctionSourceExtractor extractor = new FunctionSourceExtractor(files, LanguageRegistry.create(CodetracerConfig.defaults()));

        ExecutionNode node = new ExecutionNode("gone", new SourceLocation("dynamic.js", 2), 3, NodeKind.FUNCTION, null);

        assertEquals("line2\nline3", extractor.extract(node).code);
    }

    @Test
    void sliceClampsToTheFile() {
        assertEquals("b\nc", FunctionSourceExtractor.slice("a\nb\nc", 2, 10));
        assertEquals("", FunctionSourceExtractor.slice("a\nb", 5, 6));
        assertEquals("a\r", FunctionSourceExtractor.slice("a\r\nb\r\n", 1, 1));
    }
}
