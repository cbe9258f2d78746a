package org.dxworks.codetracer.source;

import org.dxworks.codetracer.CodetracerConfig;
import org.dxworks.codetracer.LanguageDetector;
import org.eclipse.jgit.ignore.FastIgnoreRule;
import org.eclipse.jgit.ignore.IgnoreNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads the files of one project. Paths handed in and out are project-relative and
 * '/'-separated. Listing honours the configured excluded directories and the gitignore-style
 * rules of a {@code .ignore} file at the project root.
 */
public class ProjectFiles {
    static final String IGNORE_FILE = ".ignore";

    private final Path root;
    private final int maxFileLines;
    private final Set<String> excludedDirectories;

    public ProjectFiles(Path root, CodetracerConfig config) {
        this.root = root.toAbsolutePath().normalize();
        this.maxFileLines = config.getMaxFileLines();
        this.excludedDirectories = config.getExcludedDirectories();
    }

    /**
     * Every supported source file under the root, sorted.
     */
    public List<String> list() throws IOException {
        IgnoreNode ignorer = compileIgnoreRules();
        try (Stream<Path> stream = Files.walk(root)) {
            return stream.filter(Files::isRegularFile)
                    .map(this::relativize)
                    .filter(p -> accepts(ignorer, p))
                    .filter(p -> LanguageDetector.detectLanguage(p).isPresent())
                    .filter(p -> withinMaxLines(resolve(p), maxFileLines))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    public Path resolve(String relativePath) {
        return root.resolve(relativePath);
    }

    public String read(String relativePath) throws IOException {
        String content = Files.readString(resolve(relativePath), StandardCharsets.UTF_8);
        // Remove BOM if present
        if (content.startsWith("\uFEFF")) {
            content = content.substring(1);
        }
        return content;
    }

    public String relativize(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        String relative = absolute.startsWith(root) ? root.relativize(absolute).toString() : path.toString();
        return relative.replace('\\', '/');
    }

    private IgnoreNode compileIgnoreRules() throws IOException {
        List<FastIgnoreRule> rules = new ArrayList<>();
        for (String directory : excludedDirectories) {
            rules.add(new FastIgnoreRule(directory + "/"));
        }
        IgnoreNode ignorer = new IgnoreNode(rules);
        Path ignoreFile = root.resolve(IGNORE_FILE);
        if (Files.isRegularFile(ignoreFile)) {
            try (InputStream in = Files.newInputStream(ignoreFile)) {
                ignorer.parse(ignoreFile.toString(), in);
            }
        }
        return ignorer;
    }

    // a file inside an ignored directory stays ignored, as in git
    private static boolean accepts(IgnoreNode ignorer, String relativePath) {
        int slash = relativePath.indexOf('/');
        while (slash >= 0) {
            if (Boolean.TRUE.equals(ignorer.checkIgnored(relativePath.substring(0, slash), true))) {
                return false;
            }
            slash = relativePath.indexOf('/', slash + 1);
        }
        return !Boolean.TRUE.equals(ignorer.checkIgnored(relativePath, false));
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | java.io.UncheckedIOException e) {
            // reported when the file is read
            return true;
        }
    }
}
