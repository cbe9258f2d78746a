package org.dxworks.codetracer.instrument;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the service's {@code {"code": ..., "requiredChanges": ...}} answer. Anything that is not
 * such an object, markdown fences aside, means no change.
 */
public class RewriteResponseParser {
    private static final Pattern FENCED = Pattern.compile("^```[\\w-]*\\s*\\n(.*?)\\n?```\\s*$", Pattern.DOTALL);

    private final ObjectMapper mapper;

    public RewriteResponseParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public RewriteResponse parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return RewriteResponse.noChange();
        }

        JsonNode json;
        try {
            json = mapper.readTree(unfence(raw.strip()));
        } catch (JsonProcessingException e) {
            System.err.println("Warning: Rewrite response is not JSON, treating it as no change: " + e.getOriginalMessage());
            return RewriteResponse.noChange();
        }
        if (json == null || !json.isObject()) {
            return RewriteResponse.noChange();
        }

        JsonNode requiredChanges = json.get("requiredChanges");
        JsonNode code = json.get("code");
        if (requiredChanges == null || !requiredChanges.isBoolean() || !requiredChanges.booleanValue()) {
            return RewriteResponse.noChange();
        }
        if (code == null || !code.isTextual()) {
            System.err.println("Warning: Rewrite response asks for changes but has no code");
            return RewriteResponse.noChange();
        }
        return new RewriteResponse(unfence(code.textValue()), true);
    }

    static String unfence(String text) {
        Matcher matcher = FENCED.matcher(text.strip());
        return matcher.matches() ? matcher.group(1) : text;
    }
}
