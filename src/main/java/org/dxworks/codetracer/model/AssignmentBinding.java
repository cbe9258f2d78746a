package org.dxworks.codetracer.model;

/**
 * {@code variable = ClassName(...)} or {@code variable = new ClassName(...)}.
 */
public class AssignmentBinding {
    public String variable;
    public String constructorName;
    public int line;

    public AssignmentBinding(String variable, String constructorName, int line) {
        this.variable = variable;
        this.constructorName = constructorName;
        this.line = line;
    }
}
