package org.dxworks.codetracer.instrument;

import org.dxworks.codetracer.model.ExecutionNode;
import org.dxworks.codetracer.model.ExecutionTree;
import org.dxworks.codetracer.patch.DiffEngine;
import org.dxworks.codetracer.patch.LineNormalizer;
import org.dxworks.codetracer.patch.NormalizedCodeBlock;
import org.dxworks.codetracer.patch.PatchApplier;
import org.dxworks.codetracer.patch.PendingChange;
import org.dxworks.codetracer.patch.StructuredDelta;
import org.dxworks.codetracer.source.FunctionSourceExtractor;
import org.dxworks.codetracer.source.ProjectFiles;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Instruments selected nodes of a tree one at a time: each function is rewritten, diffed
 * against its original and offered for review. Accepted changes are queued and written
 * with {@link #applyAll()}, one batch per file.
 */
public class InstrumentationSession {
    private final ExecutionTree tree;
    private final ProjectFiles files;
    private final FunctionSourceExtractor extractor;
    private final RewriteService rewriteService;
    private final LineNormalizer normalizer;
    private final DiffEngine diffEngine = new DiffEngine();
    private final PatchApplier patchApplier = new PatchApplier();
    private final TracingServiceFile tracingServiceFile;

    private final List<PendingChange> pending = new ArrayList<>();

    public InstrumentationSession(ExecutionTree tree,
                                  ProjectFiles files,
                                  FunctionSourceExtractor extractor,
                                  RewriteService rewriteService,
                                  LineNormalizer normalizer) {
        this.tree = tree;
        this.files = files;
        this.extractor = extractor;
        this.rewriteService = rewriteService;
        this.normalizer = normalizer;
        this.tracingServiceFile = new TracingServiceFile(files);
    }

    /**
     * Rewrites one function and diffs the result. Empty when the rewrite needs no change, cannot
     * be normalized, or produces the same lines.
     */
    public Optional<PendingChange> prepare(ExecutionNode node) throws IOException {
        FunctionSourceExtractor.Extract extract = extractor.extract(node);
        NormalizedCodeBlock original = normalizer.normalize(extract.code, extract.startLine);
        if (!original.isValid()) {
            System.err.println("Warning: Could not normalize " + node.id + ": " + original.getViolation());
            return Optional.empty();
        }

        RewriteResponse response = rewriteService.rewrite(RewriteRequest.of(node, extract.startLine, extract.code, tree));
        if (!response.requiredChanges) {
            return Optional.empty();
        }

        NormalizedCodeBlock modified = normalizer.normalize(response.code, extract.startLine);
        if (!modified.isValid()) {
            System.err.println("Warning: Rewrite of " + node.id + " discarded: " + modified.getViolation());
            return Optional.empty();
        }

        StructuredDelta delta = diffEngine.diff(original, modified);
        if (delta.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PendingChange(node, original, delta));
    }

    /**
     * Prepares and reviews the given nodes in order. A node that fails is skipped; STOP ends the
     * run and keeps what was accepted before it.
     */
    public SessionResult run(List<String> selectedIds, ChangeReviewer reviewer) {
        SessionResult result = new SessionResult();
        for (String id : selectedIds) {
            Optional<ExecutionNode> node = tree.node(id);
            if (node.isEmpty()) {
                System.err.println("Warning: " + id + " is not part of the execution tree");
                result.skipped.add(id);
                continue;
            }

            System.out.println("Instrumenting " + id);
            Optional<PendingChange> change;
            try {
                change = prepare(node.get());
            } catch (IOException | RuntimeException e) {
                System.err.println("Warning: Could not instrument " + id + ": " + e.getMessage());
                result.skipped.add(id);
                continue;
            }
            if (change.isEmpty()) {
                result.unchanged.add(id);
                continue;
            }

            ReviewDecision decision = reviewer.review(change.get());
            if (decision == ReviewDecision.ACCEPT) {
                queue(change.get());
                result.accepted.add(change.get());
            } else if (decision == ReviewDecision.SKIP) {
                result.skipped.add(id);
            } else {
                result.skipped.add(id);
                result.stopped = true;
                break;
            }
        }
        return result;
    }

    private void queue(PendingChange change) {
        // a node reviewed again replaces its earlier change
        pending.removeIf(p -> p.node.id.equals(change.node.id));
        pending.add(change);
    }

    public List<PendingChange> getPending() {
        return Collections.unmodifiableList(pending);
    }

    /**
     * Writes every queued change, one batch per file, and empties the queue. When anything was
     * applied the tracing service module the inserted imports point at is created as well.
     */
    public ApplyReport applyAll() {
        Map<String, List<PendingChange>> byFile = new TreeMap<>();
        for (PendingChange change : pending) {
            byFile.computeIfAbsent(change.getFile(), f -> new ArrayList<>()).add(change);
        }

        ApplyReport report = new ApplyReport();
        for (Map.Entry<String, List<PendingChange>> entry : byFile.entrySet()) {
            String file = entry.getKey();
            try {
                PatchApplier.Result result = patchApplier.applyBatch(files.resolve(file), entry.getValue());
                report.applied(file, result.applied.size(), result.skipped);
            } catch (IOException | IllegalArgumentException e) {
                System.err.println("Error applying changes to " + file + ": " + e.getMessage());
                report.failed(file, e.getMessage());
            }
        }
        writeTracingService(report);
        pending.clear();
        return report;
    }

    private void writeTracingService(ApplyReport report) {
        List<String> instrumented = new ArrayList<>();
        report.getAppliedChanges().forEach((file, count) -> {
            if (count > 0) {
                instrumented.add(file);
            }
        });
        if (instrumented.isEmpty()) {
            return;
        }
        try {
            tracingServiceFile.writeFor(instrumented).forEach(report::generated);
        } catch (IOException e) {
            System.err.println("Error writing the tracing service module: " + e.getMessage());
            report.failed(TracingServiceFile.JAVASCRIPT_FILE + "/" + TracingServiceFile.PYTHON_FILE, e.getMessage());
        }
    }
}
