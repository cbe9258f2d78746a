package org.dxworks.codetracer.patch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A code fragment as numbered lines: header lines from 1, body lines from the function's
 * start line. Numbers are unique within a zone; a header line and a body line may share one.
 * A block that could not be split cleanly is invalid and carries the reason.
 */
public class NormalizedCodeBlock {
    private final List<NormalizedLine> lines;
    private final int functionStartLine;
    private final String violation;

    private NormalizedCodeBlock(List<NormalizedLine> lines, int functionStartLine, String violation) {
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
        this.functionStartLine = functionStartLine;
        this.violation = violation;
    }

    /**
     * @throws IllegalArgumentException when a header line follows a body line, or line numbers
     *                                  do not strictly increase within a zone
     */
    public static NormalizedCodeBlock of(List<NormalizedLine> lines, int functionStartLine) {
        Map<Zone, Integer> previous = new EnumMap<>(Zone.class);
        boolean inBody = false;
        for (NormalizedLine line : lines) {
            if (line.zone == Zone.HEADER && inBody) {
                throw new IllegalArgumentException("Header line " + line.lineNumber + " follows the body");
            }
            inBody |= line.zone == Zone.BODY;
            int last = previous.getOrDefault(line.zone, 0);
            if (line.lineNumber <= last) {
                throw new IllegalArgumentException("Line numbers must be strictly increasing within the "
                        + line.zone + " zone, got " + line.lineNumber + " after " + last);
            }
            previous.put(line.zone, line.lineNumber);
        }
        return new NormalizedCodeBlock(lines, functionStartLine, null);
    }

    public static NormalizedCodeBlock invalid(int functionStartLine, String violation) {
        return new NormalizedCodeBlock(List.of(), functionStartLine, violation);
    }

    public boolean isValid() {
        return violation == null;
    }

    public String getViolation() {
        return violation;
    }

    public int getFunctionStartLine() {
        return functionStartLine;
    }

    public List<NormalizedLine> getLines() {
        return lines;
    }

    public List<NormalizedLine> headerLines() {
        return lines.stream().filter(l -> l.zone == Zone.HEADER).collect(Collectors.toList());
    }

    public List<NormalizedLine> bodyLines() {
        return lines.stream().filter(l -> l.zone == Zone.BODY).collect(Collectors.toList());
    }

    public List<String> bodyTexts() {
        return bodyLines().stream().map(l -> l.text).collect(Collectors.toList());
    }

    /**
     * Last line of the body, or {@code functionStartLine - 1} for an empty body.
     */
    public int bodyEndLine() {
        return functionStartLine + bodyLines().size() - 1;
    }

    /**
     * The original text, lines joined with '\n'.
     */
    public String text() {
        return lines.stream().map(l -> l.text).collect(Collectors.joining("\n"));
    }
}
