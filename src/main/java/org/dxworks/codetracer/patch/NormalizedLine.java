package org.dxworks.codetracer.patch;

import java.util.Objects;

public class NormalizedLine {
    public final int lineNumber;
    public final String text;
    public final Zone zone;

    public NormalizedLine(int lineNumber, String text, Zone zone) {
        this.lineNumber = lineNumber;
        this.text = text;
        this.zone = zone;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalizedLine)) return false;
        NormalizedLine that = (NormalizedLine) o;
        return lineNumber == that.lineNumber && text.equals(that.text) && zone == that.zone;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lineNumber, text, zone);
    }

    @Override
    public String toString() {
        return lineNumber + ": " + text;
    }
}
