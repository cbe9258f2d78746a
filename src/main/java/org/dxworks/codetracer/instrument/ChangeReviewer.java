package org.dxworks.codetracer.instrument;

import org.dxworks.codetracer.patch.PendingChange;

@FunctionalInterface
public interface ChangeReviewer {

    ReviewDecision review(PendingChange change);
}
