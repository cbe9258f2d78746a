package org.dxworks.codetracer.patch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Set-membership diff: a rewritten line is new when its exact text appears nowhere in the
 * original, an original line is removed when its text appears nowhere in the rewrite.
 * Instrumentation edits wrap code rather than move it, so no sequence alignment is done.
 * <p>
 * Header lines are compared as whole statements: a multi-line configuration call is either
 * new in every line or kept in every line, even when one of its lines (a closing {@code });})
 * also occurs in the function body.
 */
public class DiffEngine {

    public StructuredDelta diff(NormalizedCodeBlock original, NormalizedCodeBlock modified) {
        if (!original.isValid() || !modified.isValid()) {
            return StructuredDelta.empty();
        }

        Set<String> originalTexts = texts(original.getLines());
        Set<String> modifiedTexts = texts(modified.getLines());
        Set<String> originalStatements = statementTexts(original.headerLines());
        Set<String> modifiedStatements = statementTexts(modified.headerLines());

        List<DeltaEntry> additions = new ArrayList<>();
        List<DeltaEntry> merged = new ArrayList<>();
        for (List<NormalizedLine> statement : statements(modified.headerLines())) {
            boolean kept = present(statement, originalStatements, originalTexts);
            for (NormalizedLine line : statement) {
                tag(line, kept, additions, merged);
            }
        }
        for (NormalizedLine line : modified.bodyLines()) {
            tag(line, originalTexts.contains(line.text), additions, merged);
        }

        List<DeltaEntry> removals = new ArrayList<>();
        for (List<NormalizedLine> statement : statements(original.headerLines())) {
            if (!present(statement, modifiedStatements, modifiedTexts)) {
                for (NormalizedLine line : statement) {
                    removals.add(new DeltaEntry(line.lineNumber, line.text, ChangeTag.REMOVE, line.zone));
                }
            }
        }
        for (NormalizedLine line : original.bodyLines()) {
            if (!modifiedTexts.contains(line.text)) {
                removals.add(new DeltaEntry(line.lineNumber, line.text, ChangeTag.REMOVE, line.zone));
            }
        }

        // removals are shown where they would sit among the rewritten lines of their zone
        Map<Zone, Integer> removedBefore = new EnumMap<>(Zone.class);
        for (DeltaEntry removal : removals) {
            int addedBefore = 0;
            for (DeltaEntry addition : additions) {
                if (addition.zone == removal.zone && addition.line <= removal.line) {
                    addedBefore++;
                }
            }
            int removed = removedBefore.getOrDefault(removal.zone, 0);
            merged.add(new DeltaEntry(removal.line + addedBefore - removed, removal.content, ChangeTag.REMOVE, removal.zone));
            removedBefore.put(removal.zone, removed + 1);
        }

        // stable: header before body, rewritten lines keep their relative order, removals go first on ties
        merged.sort(Comparator.comparingInt((DeltaEntry e) -> e.zone.ordinal())
                .thenComparingInt(e -> e.line)
                .thenComparingInt(e -> e.tag == ChangeTag.REMOVE ? 0 : 1));

        return new StructuredDelta(additions, removals, merged);
    }

    private static void tag(NormalizedLine line, boolean kept, List<DeltaEntry> additions, List<DeltaEntry> merged) {
        if (kept) {
            merged.add(new DeltaEntry(line.lineNumber, line.text, ChangeTag.KEEP, line.zone));
        } else {
            DeltaEntry addition = new DeltaEntry(line.lineNumber, line.text, ChangeTag.ADD, line.zone);
            additions.add(addition);
            merged.add(addition);
        }
    }

    // blank separator lines are matched like body lines, statements only against statements
    private static boolean present(List<NormalizedLine> statement, Set<String> statements, Set<String> lineTexts) {
        if (statement.size() == 1 && statement.get(0).text.isBlank()) {
            return lineTexts.contains(statement.get(0).text);
        }
        return statements.contains(join(statement));
    }

    private static List<List<NormalizedLine>> statements(List<NormalizedLine> header) {
        List<String> texts = header.stream().map(l -> l.text).collect(Collectors.toList());
        List<List<NormalizedLine>> statements = new ArrayList<>();
        int index = 0;
        while (index < texts.size()) {
            int end = HeaderZonePolicy.statementEnd(texts, index);
            statements.add(header.subList(index, end));
            index = end;
        }
        return statements;
    }

    private static Set<String> statementTexts(List<NormalizedLine> header) {
        Set<String> texts = new HashSet<>();
        for (List<NormalizedLine> statement : statements(header)) {
            texts.add(join(statement));
        }
        return texts;
    }

    private static String join(List<NormalizedLine> statement) {
        return statement.stream().map(l -> l.text).collect(Collectors.joining("\n"));
    }

    private static Set<String> texts(List<NormalizedLine> lines) {
        Set<String> texts = new HashSet<>();
        for (NormalizedLine line : lines) {
            texts.add(line.text);
        }
        return texts;
    }
}
