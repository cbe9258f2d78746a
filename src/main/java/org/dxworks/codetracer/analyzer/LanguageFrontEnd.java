package org.dxworks.codetracer.analyzer;

import org.dxworks.codetracer.model.AssignmentBinding;
import org.dxworks.codetracer.model.CallSite;
import org.dxworks.codetracer.model.FunctionDefinition;
import org.dxworks.codetracer.model.ImportBinding;

import java.util.List;
import java.util.Optional;

/**
 * Answers the questions call-graph construction asks about one source file of a language.
 * Implementations must not throw on malformed source; they return what they could find.
 */
public interface LanguageFrontEnd {

    /**
     * Locates the definition of {@code name}: a route whose literal path matches it first,
     * then a named function, then a variable bound to a function, then a class member.
     */
    Optional<FunctionDefinition> findDefinition(String name, String sourceCode, String filePath);

    /**
     * Calls that occur lexically inside the definition of {@code targetName}, in document order.
     * Empty when the target cannot be found.
     */
    List<CallSite> findCallsWithin(String targetName, String sourceCode);

    List<ImportBinding> findImports(String sourceCode);

    List<AssignmentBinding> findAssignments(String sourceCode);

    /**
     * Project-relative paths an import could refer to, most likely first. Paths are not
     * checked for existence.
     */
    List<String> moduleCandidates(ImportBinding binding, String importingFile);
}
