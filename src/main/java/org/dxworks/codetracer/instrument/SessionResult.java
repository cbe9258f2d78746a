package org.dxworks.codetracer.instrument;

import org.dxworks.codetracer.patch.PendingChange;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one review run, by node id.
 */
public class SessionResult {
    public final List<PendingChange> accepted = new ArrayList<>();
    public final List<String> skipped = new ArrayList<>();
    /** Nodes the rewrite left as they were. */
    public final List<String> unchanged = new ArrayList<>();
    public boolean stopped;
}
