package org.dxworks.codetracer.instrument;

public class RewriteResponse {
    private static final RewriteResponse NO_CHANGE = new RewriteResponse("", false);

    public final String code;
    public final boolean requiredChanges;

    public RewriteResponse(String code, boolean requiredChanges) {
        this.code = code;
        this.requiredChanges = requiredChanges;
    }

    public static RewriteResponse noChange() {
        return NO_CHANGE;
    }
}
