package org.dxworks.codetracer.patch;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Line-level difference between an original function and its rewrite.
 */
public class StructuredDelta {
    private static final StructuredDelta EMPTY = new StructuredDelta(List.of(), List.of(), List.of());

    public final List<DeltaEntry> additions;
    public final List<DeltaEntry> removals;
    public final List<DeltaEntry> merged;

    public StructuredDelta(List<DeltaEntry> additions, List<DeltaEntry> removals, List<DeltaEntry> merged) {
        this.additions = List.copyOf(additions);
        this.removals = List.copyOf(removals);
        this.merged = List.copyOf(merged);
    }

    public static StructuredDelta empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return additions.isEmpty() && removals.isEmpty();
    }

    /**
     * Lines that replace the function in the file, in order.
     */
    public List<String> replacementBody() {
        return merged.stream()
                .filter(e -> e.zone == Zone.BODY && e.tag != ChangeTag.REMOVE)
                .map(e -> e.content)
                .collect(Collectors.toList());
    }

    /**
     * Header statements the rewrite introduced, in order. A statement spanning several lines
     * comes back whole, its lines joined with '\n'.
     */
    public List<String> headerAdditions() {
        List<String> lines = merged.stream()
                .filter(e -> e.zone == Zone.HEADER && e.tag == ChangeTag.ADD)
                .map(e -> e.content)
                .collect(Collectors.toList());
        List<String> statements = new ArrayList<>();
        int index = 0;
        while (index < lines.size()) {
            int end = HeaderZonePolicy.statementEnd(lines, index);
            String statement = String.join("\n", lines.subList(index, end));
            if (!statement.isBlank()) {
                statements.add(statement);
            }
            index = end;
        }
        return statements;
    }
}
