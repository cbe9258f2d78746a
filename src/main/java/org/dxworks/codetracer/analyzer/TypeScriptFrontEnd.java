package org.dxworks.codetracer.analyzer;

import org.dxworks.codetracer.Language;
import org.treesitter.TSNode;

import java.util.Set;

import static org.dxworks.codetracer.analyzer.TreeSitterHelper.*;

/**
 * TypeScript and TSX share the JavaScript lookups. The grammars differ in how class
 * properties and typed parameters are shaped.
 */
public class TypeScriptFrontEnd extends JavaScriptFrontEnd {

    public TypeScriptFrontEnd(Language language, Set<String> routeMethods) {
        super(language, routeMethods);
        if (language != Language.TYPESCRIPT && language != Language.TSX) {
            throw new IllegalArgumentException("Not a TypeScript dialect: " + language);
        }
    }

    @Override
    protected String classFieldType() {
        return "public_field_definition";
    }

    @Override
    protected String classFieldNameField() {
        return "name";
    }

    @Override
    protected String parameterName(String source, TSNode param) {
        // required_parameter / optional_parameter wrap the pattern with its type annotation
        if (isNodeTypeOneOf(param, "required_parameter", "optional_parameter")) {
            TSNode pattern = getChildByFieldName(param, "pattern");
            if (isNodeTypeOneOf(pattern, NT_THIS)) {
                return null;
            }
            return super.parameterName(source, pattern);
        }
        return super.parameterName(source, param);
    }
}
