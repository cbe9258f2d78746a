package org.dxworks.codetracer.model;

import java.util.Objects;

/**
 * A 1-based line in a project-relative file.
 */
public class SourceLocation {
    public final String file;
    public final int line;

    public SourceLocation(String file, int line) {
        if (line < 1) {
            throw new IllegalArgumentException("Line numbers are 1-based, got " + line + " for " + file);
        }
        this.file = file;
        this.line = line;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && Objects.equals(file, that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line);
    }

    @Override
    public String toString() {
        return file + ":" + line;
    }
}
