package org.dxworks.codetracer.instrument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-file outcome of applying queued changes. A failed file does not stop the others.
 */
public class ApplyReport {
    private final Map<String, Integer> appliedChanges = new LinkedHashMap<>();
    private final Map<String, String> failures = new LinkedHashMap<>();
    private final List<String> skippedChanges = new ArrayList<>();
    private final List<String> generatedFiles = new ArrayList<>();

    void applied(String file, int changes, List<String> skipped) {
        appliedChanges.put(file, changes);
        skippedChanges.addAll(skipped);
    }

    void failed(String file, String reason) {
        failures.put(file, reason);
    }

    void generated(String file) {
        generatedFiles.add(file);
    }

    public Map<String, Integer> getAppliedChanges() {
        return Collections.unmodifiableMap(appliedChanges);
    }

    public Map<String, String> getFailures() {
        return Collections.unmodifiableMap(failures);
    }

    public List<String> getSkippedChanges() {
        return Collections.unmodifiableList(skippedChanges);
    }

    public List<String> getGeneratedFiles() {
        return Collections.unmodifiableList(generatedFiles);
    }

    public int totalApplied() {
        return appliedChanges.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
