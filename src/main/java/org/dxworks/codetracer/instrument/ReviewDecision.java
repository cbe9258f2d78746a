package org.dxworks.codetracer.instrument;

public enum ReviewDecision {
    ACCEPT,
    SKIP,
    /** Discard this change and prepare no more; changes accepted so far stay queued. */
    STOP
}
