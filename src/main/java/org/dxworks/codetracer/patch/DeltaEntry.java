package org.dxworks.codetracer.patch;

/**
 * One line of a structured delta. For removals {@code line} is the line in the original block;
 * inside {@link StructuredDelta#merged} it is the display position.
 */
public class DeltaEntry {
    public final int line;
    public final String content;
    public final ChangeTag tag;
    public final Zone zone;

    public DeltaEntry(int line, String content, ChangeTag tag, Zone zone) {
        this.line = line;
        this.content = content;
        this.tag = tag;
        this.zone = zone;
    }

    @Override
    public String toString() {
        return line + ":" + tag.getSymbol() + content;
    }
}
