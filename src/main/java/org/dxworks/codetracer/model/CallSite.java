package org.dxworks.codetracer.model;

/**
 * A call expression found lexically inside a function.
 * {@code receiver} is only set for method calls whose object is a plain identifier.
 */
public class CallSite {
    public String name;
    public int line;
    public CallKind kind;
    public String receiver;
    /** Set for a route handler passed by reference ({@code app.get('/x', handleX)}), not an actual call. */
    public boolean handlerReference;

    public CallSite(String name, int line, CallKind kind, String receiver) {
        this.name = name;
        this.line = line;
        this.kind = kind;
        this.receiver = receiver;
    }

    public static CallSite function(String name, int line) {
        return new CallSite(name, line, CallKind.FUNCTION, null);
    }

    public static CallSite method(String name, int line, String receiver) {
        return new CallSite(name, line, CallKind.METHOD, receiver);
    }

    public static CallSite handlerReference(String name, int line) {
        CallSite site = new CallSite(name, line, CallKind.FUNCTION, null);
        site.handlerReference = true;
        return site;
    }

    public boolean isMethodCall() {
        return kind == CallKind.METHOD;
    }

    @Override
    public String toString() {
        return (receiver != null ? receiver + "." : "") + name + "()@" + line;
    }
}
