package org.dxworks.codetracer.instrument;

import java.io.IOException;

/**
 * Produces an instrumented version of one function. Implementations report an unusable answer
 * as {@link RewriteResponse#noChange()} and a failed exchange as an exception; they never retry.
 */
public interface RewriteService {

    RewriteResponse rewrite(RewriteRequest request) throws IOException;
}
