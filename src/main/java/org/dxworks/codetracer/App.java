package org.dxworks.codetracer;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.codetracer.instrument.ApplyReport;
import org.dxworks.codetracer.instrument.ChangeReviewer;
import org.dxworks.codetracer.instrument.InstrumentationSession;
import org.dxworks.codetracer.instrument.ProcessRewriteService;
import org.dxworks.codetracer.instrument.ReviewDecision;
import org.dxworks.codetracer.instrument.SessionResult;
import org.dxworks.codetracer.model.ExecutionTree;
import org.dxworks.codetracer.patch.DiffRenderer;
import org.dxworks.codetracer.patch.HeaderZonePolicy;
import org.dxworks.codetracer.patch.LineNormalizer;
import org.dxworks.codetracer.source.FunctionSourceExtractor;
import org.dxworks.codetracer.source.ProjectFiles;
import org.dxworks.codetracer.tree.ExecutionTreeBuilder;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        int exitCode = run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args) throws IOException {
        if (args.length < 4) {
            printUsage();
            return 2;
        }

        String command = args[0];
        if (!"tree".equals(command) && !"instrument".equals(command)) {
            System.err.println("Error: Unknown command: " + command);
            printUsage();
            return 2;
        }

        Path root = Paths.get(args[1]);
        if (!Files.isDirectory(root)) {
            System.err.println("Error: Project root does not exist: " + root);
            return 1;
        }
        Path entryPath = root.resolve(args[2]);
        if (!Files.isRegularFile(entryPath)) {
            System.err.println("Error: Entry file does not exist: " + entryPath);
            return 1;
        }

        CodetracerConfig config = CodetracerConfig.load();
        ProjectFiles files = new ProjectFiles(root, config);
        LanguageRegistry languages = LanguageRegistry.create(config);
        String entryFile = files.relativize(entryPath);
        String entryFunction = args[3];
        List<String> options = Arrays.asList(args).subList(4, args.length);

        if ("tree".equals(command)) {
            return runTree(files, languages, entryFile, entryFunction, options);
        }
        return runInstrument(config, files, languages, entryFile, entryFunction, options);
    }

    private static int runTree(ProjectFiles files, LanguageRegistry languages,
                               String entryFile, String entryFunction, List<String> options) throws IOException {
        ExecutionTree tree = new ExecutionTreeBuilder(files, languages).build(entryFile, entryFunction);
        String json = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(tree);

        if (options.isEmpty()) {
            System.out.println(json);
        } else {
            Path output = Paths.get(options.get(0));
            if (output.getParent() != null) {
                Files.createDirectories(output.getParent());
            }
            Files.writeString(output, json + "\n", StandardCharsets.UTF_8);
            System.out.println("Execution tree written to: " + output.toAbsolutePath());
        }
        return 0;
    }

    private static int runInstrument(CodetracerConfig config, ProjectFiles files, LanguageRegistry languages,
                                     String entryFile, String entryFunction, List<String> options) throws IOException {
        if (!config.hasRewriteCommand()) {
            System.err.println("Error: No rewriteCommand configured in codetracer-config.yml");
            return 2;
        }

        List<String> selected = null;
        boolean autoAccept = false;
        for (int i = 0; i < options.size(); i++) {
            String option = options.get(i);
            if ("--yes".equals(option)) {
                autoAccept = true;
            } else if ("--select".equals(option) && i + 1 < options.size()) {
                selected = new ArrayList<>();
                for (String id : options.get(++i).split(",")) {
                    if (!id.isBlank()) {
                        selected.add(id.trim());
                    }
                }
            } else {
                System.err.println("Error: Unknown option: " + option);
                printUsage();
                return 2;
            }
        }

        ExecutionTree tree = new ExecutionTreeBuilder(files, languages).build(entryFile, entryFunction);
        if (selected == null) {
            selected = new ArrayList<>(tree.nodes.keySet());
        }

        InstrumentationSession session = new InstrumentationSession(
                tree,
                files,
                new FunctionSourceExtractor(files, languages),
                new ProcessRewriteService(config.getRewriteCommand(), config.getRewriteTimeoutSeconds(), MAPPER),
                new LineNormalizer(new HeaderZonePolicy(config.getInstrumentationMarkers())));

        ChangeReviewer reviewer = autoAccept ? change -> ReviewDecision.ACCEPT : consoleReviewer();
        SessionResult result = session.run(selected, reviewer);
        ApplyReport report = session.applyAll();

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Instrumentation complete" + (result.stopped ? " (stopped early)" : "") + "!");
        System.out.println("Accepted: " + result.accepted.size()
                + ", skipped: " + result.skipped.size()
                + ", unchanged: " + result.unchanged.size());
        System.out.println("Changes applied: " + report.totalApplied());
        for (String generated : report.getGeneratedFiles()) {
            System.out.println("Created: " + generated);
        }
        for (String skipped : report.getSkippedChanges()) {
            System.out.println("Not applied: " + skipped);
        }
        for (Map.Entry<String, String> failure : report.getFailures().entrySet()) {
            System.out.println("Failed: " + failure.getKey() + ": " + failure.getValue());
        }
        System.out.println("=".repeat(60));
        return report.hasFailures() ? 1 : 0;
    }

    private static ChangeReviewer consoleReviewer() {
        DiffRenderer renderer = new DiffRenderer();
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        return change -> {
            System.out.println("\n" + change.node.id + " (" + change.getFile() + ":" + change.startLine() + ")");
            System.out.print(renderer.render(change.delta));
            System.out.print("Apply this change? [y]es/[n]o/[q]uit: ");
            System.out.flush();
            try {
                String answer = in.readLine();
                if (answer == null) {
                    return ReviewDecision.STOP;
                }
                answer = answer.trim().toLowerCase(Locale.ROOT);
                if (answer.startsWith("y")) {
                    return ReviewDecision.ACCEPT;
                }
                return answer.startsWith("q") ? ReviewDecision.STOP : ReviewDecision.SKIP;
            } catch (IOException e) {
                System.err.println("Error reading answer: " + e.getMessage());
                return ReviewDecision.STOP;
            }
        };
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar codetracer.jar <command> <project-root> <entry-file> <entry-function> [options]");
        System.err.println("  tree       [output.json]             Build the execution tree, print or write it as JSON");
        System.err.println("  instrument [--select id,...] [--yes] Rewrite the selected functions (all by default)");
        System.err.println("Supported languages: JavaScript, TypeScript, Python");
    }
}
