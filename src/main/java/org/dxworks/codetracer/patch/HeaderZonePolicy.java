package org.dxworks.codetracer.patch;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Recognizes the import and configuration statements of the instrumentation library that a
 * rewrite places above the function. A statement belongs to the header only when it names one
 * of the configured markers; other imports stay in the body.
 */
public class HeaderZonePolicy {
    private static final Pattern IMPORT_STATEMENT = Pattern.compile(
            "^(import\\s.*|from\\s+\\S+\\s+import\\s.*|(const|let|var)\\s+.+=\\s*require\\(.*)$", Pattern.DOTALL);
    // handit.config({...}), tracker = Handit(api_key=...), const tracker = handit.init(...)
    private static final Pattern CONFIG_STATEMENT = Pattern.compile(
            "^((const|let|var)\\s+)?[A-Za-z_$][\\w$.]*\\s*(=\\s*(await\\s+)?(new\\s+)?[A-Za-z_$][\\w$.]*\\s*)?\\(.*$", Pattern.DOTALL);

    private final List<String> markers;

    public HeaderZonePolicy(List<String> markers) {
        if (markers.isEmpty()) {
            throw new IllegalArgumentException("At least one instrumentation marker is required");
        }
        this.markers = markers.stream().map(m -> m.toLowerCase(Locale.ROOT)).toList();
    }

    /**
     * Number of leading lines forming the header zone: header statements (possibly spanning
     * several lines) and the blank lines around them. Zero when the code starts with anything else.
     */
    public int headerLength(List<String> lines) {
        int index = 0;
        int headerEnd = 0;
        while (index < lines.size()) {
            String line = lines.get(index);
            if (line.isBlank()) {
                index++;
                continue;
            }
            if (Character.isWhitespace(line.charAt(0))) {
                break;
            }
            int end = statementEnd(lines, index);
            String statement = String.join("\n", lines.subList(index, end));
            if (!isHeaderStatement(statement)) {
                break;
            }
            index = end;
            headerEnd = end;
        }
        if (headerEnd == 0) {
            return 0;
        }
        // blank lines separating the header from the function belong to the header
        while (headerEnd < lines.size() && lines.get(headerEnd).isBlank()) {
            headerEnd++;
        }
        return headerEnd;
    }

    public boolean isHeaderStatement(String statement) {
        String trimmed = statement.strip();
        if (!mentionsMarker(trimmed)) {
            return false;
        }
        if (IMPORT_STATEMENT.matcher(trimmed).matches()) {
            return true;
        }
        // a call taking a callback is code, e.g. a route registration
        return CONFIG_STATEMENT.matcher(trimmed).matches()
                && !trimmed.contains("=>")
                && !trimmed.contains("function");
    }

    private boolean mentionsMarker(String statement) {
        String lower = statement.toLowerCase(Locale.ROOT);
        for (String marker : markers) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Index after the last line of the statement starting at {@code start}: brackets must balance
     * and a trailing backslash continues the line.
     */
    static int statementEnd(List<String> lines, int start) {
        int depth = 0;
        int index = start;
        while (index < lines.size()) {
            String line = lines.get(index);
            depth += bracketBalance(line);
            index++;
            boolean continued = line.stripTrailing().endsWith("\\");
            if (depth <= 0 && !continued) {
                break;
            }
        }
        return index;
    }

    private static int bracketBalance(String line) {
        int balance = 0;
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '\'', '"', '`' -> quote = c;
                case '(', '[', '{' -> balance++;
                case ')', ']', '}' -> balance--;
                case '#' -> {
                    return balance;
                }
                default -> {
                }
            }
        }
        return balance;
    }
}
