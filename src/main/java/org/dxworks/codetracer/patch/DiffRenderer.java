package org.dxworks.codetracer.patch;

/**
 * Plain-text view of a delta for console review.
 */
public class DiffRenderer {

    public String render(StructuredDelta delta) {
        StringBuilder out = new StringBuilder();
        int width = 3;
        for (DeltaEntry entry : delta.merged) {
            width = Math.max(width, String.valueOf(entry.line).length());
        }
        for (DeltaEntry entry : delta.merged) {
            out.append(String.format("%" + width + "d: %s %s", entry.line, entry.tag.getSymbol(), entry.content.stripTrailing()))
                    .append('\n');
        }
        out.append(summary(delta)).append('\n');
        return out.toString();
    }

    public String summary(StructuredDelta delta) {
        return "+" + delta.additions.size() + " -" + delta.removals.size();
    }
}
