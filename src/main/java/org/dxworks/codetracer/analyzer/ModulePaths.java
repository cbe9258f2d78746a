package org.dxworks.codetracer.analyzer;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Path arithmetic on project-relative, '/'-separated paths.
 */
public class ModulePaths {

    private ModulePaths() {
    }

    public static String directoryOf(String file) {
        int slash = file.lastIndexOf('/');
        return slash < 0 ? "" : file.substring(0, slash);
    }

    public static String join(String directory, String relative) {
        if (directory == null || directory.isEmpty()) return relative;
        if (relative.isEmpty()) return directory;
        return directory + "/" + relative;
    }

    /**
     * Collapses "." and ".." segments. Returns null when the path climbs above the project root.
     */
    public static String normalize(String path) {
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.replace('\\', '/').split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) continue;
            if ("..".equals(segment)) {
                if (segments.isEmpty()) return null;
                segments.removeLast();
            } else {
                segments.addLast(segment);
            }
        }
        return String.join("/", segments);
    }
}
