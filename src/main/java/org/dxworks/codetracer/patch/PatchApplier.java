package org.dxworks.codetracer.patch;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Writes accepted function rewrites back into their file in one pass. Functions are replaced
 * from the bottom of the file up, so line numbers of functions not yet replaced stay valid;
 * instrumentation header statements go in once, at the top, after all functions are replaced.
 * A header statement counts as present when its lines already appear, in order, among the
 * file's code lines; commented-out copies do not count.
 */
public class PatchApplier {
    private static final String BOM = "\uFEFF";
    private static final Pattern ENCODING_COMMENT = Pattern.compile("^#.*coding[:=]\\s*[-\\w.]+.*$");
    private static final Pattern FUTURE_IMPORT = Pattern.compile("^from\\s+__future__\\s+import\\s.*$");
    private static final Pattern USE_STRICT = Pattern.compile("^\\s*(['\"])use strict\\1;?\\s*$");

    public static class Result {
        public final String content;
        public final List<PendingChange> applied;
        public final List<String> skipped;
        public final int headerLinesInserted;

        Result(String content, List<PendingChange> applied, List<String> skipped, int headerLinesInserted) {
            this.content = content;
            this.applied = List.copyOf(applied);
            this.skipped = List.copyOf(skipped);
            this.headerLinesInserted = headerLinesInserted;
        }
    }

    /**
     * Applies every change to the file and writes it once.
     *
     * @throws IllegalArgumentException when the file does not exist
     * @throws IOException when the file cannot be read or written
     */
    public Result applyBatch(Path filePath, List<PendingChange> changes) throws IOException {
        if (!Files.isRegularFile(filePath)) {
            throw new IllegalArgumentException("Cannot apply changes, file does not exist: " + filePath);
        }

        String content = Files.readString(filePath, StandardCharsets.UTF_8);
        boolean bom = content.startsWith(BOM);
        if (bom) {
            content = content.substring(1);
        }

        Result result = apply(content, changes);
        for (String reason : result.skipped) {
            System.err.println("Warning: " + filePath + ": " + reason);
        }
        if (!result.content.equals(content)) {
            Files.writeString(filePath, bom ? BOM + result.content : result.content, StandardCharsets.UTF_8);
            System.out.println("Applied " + result.applied.size() + " change(s) to " + filePath);
        }
        return result;
    }

    /**
     * Applies the changes to file content without touching the disk.
     */
    public Result apply(String content, List<PendingChange> changes) {
        List<String> lines = new ArrayList<>(List.of(content.split("\n", -1)));
        List<PendingChange> ordered = new ArrayList<>(changes);
        ordered.sort(Comparator.comparingInt(PendingChange::startLine).reversed());

        List<PendingChange> applied = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        int lowestReplacedLine = Integer.MAX_VALUE;

        for (PendingChange change : ordered) {
            if (change.delta.isEmpty()) {
                continue;
            }
            int start = change.startLine();
            int end = change.endLine();
            if (end >= lowestReplacedLine) {
                skipped.add(change.node.id + " overlaps a function already replaced in this batch");
                continue;
            }
            if (end > lines.size() || !lines.subList(start - 1, end).equals(change.originalBody())) {
                skipped.add(change.node.id + " no longer matches lines " + start + ".." + end + ", file changed since the diff");
                continue;
            }

            List<String> replacement = change.delta.replacementBody();
            List<String> updated = new ArrayList<>(lines.size() + replacement.size());
            updated.addAll(lines.subList(0, start - 1));
            updated.addAll(replacement);
            updated.addAll(lines.subList(end, lines.size()));
            lines = updated;

            lowestReplacedLine = start;
            applied.add(change);
        }

        int inserted = insertHeader(lines, headerStatementsOf(applied));
        return new Result(String.join("\n", lines), applied, skipped, inserted);
    }

    private static Set<String> headerStatementsOf(List<PendingChange> applied) {
        List<PendingChange> topDown = new ArrayList<>(applied);
        topDown.sort(Comparator.comparingInt(PendingChange::startLine));
        Set<String> header = new LinkedHashSet<>();
        for (PendingChange change : topDown) {
            header.addAll(change.delta.headerAdditions());
        }
        return header;
    }

    /**
     * Inserts each statement not already in the file, all of its lines together.
     *
     * @return number of lines inserted
     */
    private static int insertHeader(List<String> lines, Set<String> statements) {
        List<String> code = new ArrayList<>();
        for (String line : lines) {
            String stripped = line.strip();
            if (!stripped.isEmpty() && !isComment(stripped)) {
                code.add(stripped);
            }
        }
        List<String> missing = new ArrayList<>();
        for (String statement : statements) {
            List<String> statementLines = List.of(statement.split("\n", -1));
            List<String> stripped = new ArrayList<>();
            for (String line : statementLines) {
                if (!line.isBlank()) {
                    stripped.add(line.strip());
                }
            }
            if (Collections.indexOfSubList(code, stripped) < 0) {
                missing.addAll(statementLines);
            }
        }
        if (missing.isEmpty()) {
            return 0;
        }
        lines.addAll(headerInsertionIndex(lines), missing);
        return missing.size();
    }

    private static boolean isComment(String stripped) {
        return stripped.startsWith("//") || stripped.startsWith("#")
                || stripped.startsWith("/*") || stripped.startsWith("*");
    }

    /**
     * Below a shebang, an encoding declaration, {@code from __future__} imports and a
     * {@code "use strict"} directive; these must stay first in the file.
     */
    static int headerInsertionIndex(List<String> lines) {
        int index = 0;
        if (index < lines.size() && lines.get(index).startsWith("#!")) {
            index++;
        }
        if (index < lines.size() && index <= 1 && ENCODING_COMMENT.matcher(lines.get(index).strip()).matches()) {
            index++;
        }
        while (index < lines.size()
                && (FUTURE_IMPORT.matcher(lines.get(index).strip()).matches() || USE_STRICT.matcher(lines.get(index).strip()).matches())) {
            index++;
        }
        return index;
    }
}
