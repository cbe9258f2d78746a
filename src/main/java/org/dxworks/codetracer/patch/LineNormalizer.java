package org.dxworks.codetracer.patch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Numbers the lines of a code fragment so an original and a rewritten version of the same
 * function can be compared line by line. Header lines are numbered from 1, the body from the
 * function's start line. The two zones are numbered independently, so a function on line 1
 * can still carry a header. Every input line appears exactly once, text untouched.
 */
public class LineNormalizer {
    private final HeaderZonePolicy headerZonePolicy;

    public LineNormalizer(HeaderZonePolicy headerZonePolicy) {
        this.headerZonePolicy = headerZonePolicy;
    }

    public NormalizedCodeBlock normalize(String code, int functionStartLine) {
        if (functionStartLine < 1) {
            throw new IllegalArgumentException("Function start line must be positive, got " + functionStartLine);
        }
        if (code == null) {
            return NormalizedCodeBlock.invalid(functionStartLine, "no code");
        }

        // '\r' stays part of the line so CRLF files round-trip unchanged
        List<String> texts = Arrays.asList(code.split("\n", -1));
        int headerLength = headerZonePolicy.headerLength(texts);

        List<NormalizedLine> lines = new ArrayList<>(texts.size());
        for (int i = 0; i < headerLength; i++) {
            lines.add(new NormalizedLine(i + 1, texts.get(i), Zone.HEADER));
        }
        for (int i = headerLength; i < texts.size(); i++) {
            lines.add(new NormalizedLine(functionStartLine + i - headerLength, texts.get(i), Zone.BODY));
        }
        return NormalizedCodeBlock.of(lines, functionStartLine);
    }
}
