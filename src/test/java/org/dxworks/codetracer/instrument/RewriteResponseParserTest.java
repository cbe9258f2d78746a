package org.dxworks.codetracer.instrument;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RewriteResponseParserTest {

    private final RewriteResponseParser parser = new RewriteResponseParser(new ObjectMapper());

    @Test
    void readsCodeWhenChangesAreRequired() {
        RewriteResponse response = parser.parse("{\"code\": \"def f():\\n    pass\", \"requiredChanges\": true}");

        assertTrue(response.requiredChanges);
        assertEquals("def f():\n    pass", response.code);
    }

    @Test
    void fencedPayloadAndFencedCodeAreUnwrapped() {
        String raw = """
            ```json
            {"code": "```python\\nimport handit\\n```", "requiredChanges": true}
            ```
            """;

        RewriteResponse response = parser.parse(raw);

        assertTrue(response.requiredChanges);
        assertEquals("import handit", response.code);
    }

    @Test
    void anythingElseMeansNoChange() {
        assertFalse(parser.parse(null).requiredChanges);
        assertFalse(parser.parse("   ").requiredChanges);
        assertFalse(parser.parse("Sure! Here is your code").requiredChanges);
        assertFalse(parser.parse("[1, 2]").requiredChanges);
        assertFalse(parser.parse("{\"code\": \"x\"}").requiredChanges);
        assertFalse(parser.parse("{\"code\": \"x\", \"requiredChanges\": \"yes\"}").requiredChanges);
        assertFalse(parser.parse("{\"code\": \"x\", \"requiredChanges\": false}").requiredChanges);
        assertFalse(parser.parse("{\"code\": 42, \"requiredChanges\": true}").requiredChanges);
    }

    @Test
    void unfenceLeavesPlainTextAlone() {
        assertEquals("a\nb", RewriteResponseParser.unfence("```\na\nb\n```"));
        assertEquals("no fences", RewriteResponseParser.unfence("no fences"));
    }
}
