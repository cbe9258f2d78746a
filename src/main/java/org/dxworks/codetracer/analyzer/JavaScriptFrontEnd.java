package org.dxworks.codetracer.analyzer;

import org.dxworks.codetracer.Language;
import org.dxworks.codetracer.model.AssignmentBinding;
import org.dxworks.codetracer.model.CallSite;
import org.dxworks.codetracer.model.FunctionDefinition;
import org.dxworks.codetracer.model.ImportBinding;
import org.dxworks.codetracer.model.NodeKind;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static org.dxworks.codetracer.analyzer.TreeSitterHelper.*;

public class JavaScriptFrontEnd implements LanguageFrontEnd {
    // Node type constants
    protected static final String NT_IDENTIFIER = "identifier";
    protected static final String NT_MEMBER_EXPRESSION = "member_expression";
    protected static final String NT_CALL_EXPRESSION = "call_expression";
    protected static final String NT_NEW_EXPRESSION = "new_expression";
    protected static final String NT_EXPORT_STATEMENT = "export_statement";
    protected static final String NT_EXPRESSION_STATEMENT = "expression_statement";
    protected static final String NT_VARIABLE_DECLARATOR = "variable_declarator";
    protected static final String NT_METHOD_DEFINITION = "method_definition";
    protected static final String NT_OBJECT_PATTERN = "object_pattern";
    protected static final String NT_ARRAY_PATTERN = "array_pattern";
    protected static final String NT_THIS = "this";

    private static final String[] FUNCTION_DECLARATION_TYPES = {"function_declaration", "generator_function_declaration"};
    private static final String[] FUNCTION_VALUE_TYPES = {"arrow_function", "function_expression", "function", "generator_function"};
    private static final String[] DECLARATION_TYPES = {"lexical_declaration", "variable_declaration"};
    private static final String[] MODULE_EXTENSIONS = {".js", ".ts", ".jsx", ".tsx", ".mjs", ".cjs"};
    private static final String[] INDEX_EXTENSIONS = {".js", ".ts", ".jsx", ".tsx"};

    private final Language language;
    private final Set<String> routeMethods;

    public JavaScriptFrontEnd(Set<String> routeMethods) {
        this(Language.JAVASCRIPT, routeMethods);
    }

    protected JavaScriptFrontEnd(Language language, Set<String> routeMethods) {
        this.language = language;
        this.routeMethods = routeMethods;
    }

    /**
     * A definition found in the syntax tree. {@code outer} spans the lines that belong to it,
     * {@code function} is the node whose calls belong to it (null when a route only names its handler).
     */
    protected static class LocatedFunction {
        final String name;
        final TSNode outer;
        final TSNode function;
        final NodeKind kind;
        final boolean exported;
        TSNode handlerReference;

        LocatedFunction(String name, TSNode outer, TSNode function, NodeKind kind, boolean exported) {
            this.name = name;
            this.outer = outer;
            this.function = function;
            this.kind = kind;
            this.exported = exported;
        }
    }

    protected TSNode parse(String sourceCode) {
        return TreeSitterParsers.parse(language, sourceCode);
    }

    @Override
    public Optional<FunctionDefinition> findDefinition(String name, String sourceCode, String filePath) {
        TSNode root = parse(sourceCode);
        LocatedFunction located = locate(name, root, sourceCode);
        if (located == null) {
            return Optional.empty();
        }
        return Optional.of(toDefinition(sourceCode, located));
    }

    @Override
    public List<CallSite> findCallsWithin(String targetName, String sourceCode) {
        TSNode root = parse(sourceCode);
        LocatedFunction located = locate(targetName, root, sourceCode);
        List<CallSite> calls = new ArrayList<>();
        if (located == null) {
            return calls;
        }

        if (located.handlerReference != null) {
            CallSite reference = handlerReferenceSite(sourceCode, located.handlerReference);
            if (reference != null) {
                calls.add(reference);
            }
        }
        if (located.function != null) {
            for (TSNode callExpr : findAllDescendants(located.function, NT_CALL_EXPRESSION)) {
                CallSite site = toCallSite(sourceCode, callExpr);
                if (site != null) {
                    calls.add(site);
                }
            }
        }
        return calls;
    }

    private LocatedFunction locate(String name, TSNode root, String source) {
        LocatedFunction located = findRouteRegistration(name, root, source);
        if (located == null) located = findFunctionDeclaration(name, root, source);
        if (located == null) located = findFunctionVariable(name, root, source);
        if (located == null) located = findCommonJsExport(name, root, source);
        if (located == null) located = findClassMember(name, root, source);
        return located;
    }

    /**
     * {@code app.post('/process-document', upload.single('image'), async (req, res) => {...})}:
     * the route path names a pseudo function whose body is the last argument.
     */
    private LocatedFunction findRouteRegistration(String name, TSNode root, String source) {
        for (TSNode callExpr : findAllDescendants(root, NT_CALL_EXPRESSION)) {
            TSNode callee = getChildByFieldName(callExpr, "function");
            if (!isNodeTypeOneOf(callee, NT_MEMBER_EXPRESSION)) continue;

            String verb = getNodeText(source, getChildByFieldName(callee, "property"));
            if (verb == null || !routeMethods.contains(verb.toLowerCase(Locale.ROOT))) continue;

            List<TSNode> args = argumentsOf(callExpr);
            if (args.size() < 2) continue;
            if (!routePathMatches(stringLiteralValue(source, args.get(0)), name)) continue;

            TSNode handler = args.get(args.size() - 1);
            TSNode outer = callExpr;
            TSNode parent = callExpr.getParent();
            if (isNodeTypeOneOf(parent, NT_EXPRESSION_STATEMENT)) {
                outer = parent;
            }

            if (isNodeTypeOneOf(handler, FUNCTION_VALUE_TYPES)) {
                return new LocatedFunction(name, outer, handler, NodeKind.ENDPOINT, false);
            }
            LocatedFunction located = new LocatedFunction(name, outer, null, NodeKind.ENDPOINT, false);
            if (isNodeTypeOneOf(handler, NT_IDENTIFIER, NT_MEMBER_EXPRESSION)) {
                located.handlerReference = handler;
            }
            return located;
        }
        return null;
    }

    static boolean routePathMatches(String routePath, String target) {
        if (routePath == null || target == null) return false;
        if (routePath.equals(target)) return true;
        String path = stripLeadingSlash(routePath);
        return !path.isEmpty() && path.equals(stripLeadingSlash(target));
    }

    private static String stripLeadingSlash(String value) {
        return value.startsWith("/") ? value.substring(1) : value;
    }

    private LocatedFunction findFunctionDeclaration(String name, TSNode root, String source) {
        for (TSNode decl : findAllDescendantsOfTypes(root, FUNCTION_DECLARATION_TYPES)) {
            if (!name.equals(getNodeText(source, getChildByFieldName(decl, "name")))) continue;

            TSNode parent = decl.getParent();
            boolean exported = isNodeTypeOneOf(parent, NT_EXPORT_STATEMENT);
            return new LocatedFunction(name, exported ? parent : decl, decl, NodeKind.FUNCTION, exported);
        }
        return null;
    }

    /**
     * {@code const name = async (a, b) => {...}} and {@code var name = function () {...}}.
     */
    private LocatedFunction findFunctionVariable(String name, TSNode root, String source) {
        for (TSNode declarator : findAllDescendants(root, NT_VARIABLE_DECLARATOR)) {
            TSNode nameNode = getChildByFieldName(declarator, "name");
            if (!isNodeTypeOneOf(nameNode, NT_IDENTIFIER) || !name.equals(getNodeText(source, nameNode))) continue;

            TSNode value = getChildByFieldName(declarator, "value");
            if (!isNodeTypeOneOf(value, FUNCTION_VALUE_TYPES)) continue;

            TSNode outer = declarator;
            TSNode declaration = declarator.getParent();
            if (isNodeTypeOneOf(declaration, DECLARATION_TYPES)) {
                outer = declaration;
            }
            TSNode exportNode = outer.getParent();
            boolean exported = isNodeTypeOneOf(exportNode, NT_EXPORT_STATEMENT);
            if (exported) {
                outer = exportNode;
            }
            return new LocatedFunction(name, outer, value, NodeKind.FUNCTION, exported);
        }
        return null;
    }

    /**
     * {@code module.exports.name = function () {...}} and {@code exports.name = () => {...}}.
     */
    private LocatedFunction findCommonJsExport(String name, TSNode root, String source) {
        for (TSNode assignment : findAllDescendants(root, "assignment_expression")) {
            TSNode left = getChildByFieldName(assignment, "left");
            TSNode right = getChildByFieldName(assignment, "right");
            if (!isNodeTypeOneOf(left, NT_MEMBER_EXPRESSION) || !isNodeTypeOneOf(right, FUNCTION_VALUE_TYPES)) continue;
            if (!name.equals(getNodeText(source, getChildByFieldName(left, "property")))) continue;

            String target = getNodeText(source, getChildByFieldName(left, "object"));
            if (!"exports".equals(target) && !"module.exports".equals(target)) continue;

            TSNode outer = assignment;
            if (isNodeTypeOneOf(assignment.getParent(), NT_EXPRESSION_STATEMENT)) {
                outer = assignment.getParent();
            }
            return new LocatedFunction(name, outer, right, NodeKind.FUNCTION, true);
        }
        return null;
    }

    private LocatedFunction findClassMember(String name, TSNode root, String source) {
        for (TSNode method : findAllDescendants(root, NT_METHOD_DEFINITION)) {
            if (name.equals(memberName(source, getChildByFieldName(method, "name")))) {
                return new LocatedFunction(name, method, method, NodeKind.METHOD, false);
            }
        }
        // class properties holding functions: handle = async (req) => {...}
        for (TSNode field : findAllDescendants(root, classFieldType())) {
            TSNode value = getChildByFieldName(field, "value");
            if (!isNodeTypeOneOf(value, FUNCTION_VALUE_TYPES)) continue;
            if (name.equals(memberName(source, getChildByFieldName(field, classFieldNameField())))) {
                return new LocatedFunction(name, field, value, NodeKind.METHOD, false);
            }
        }
        return null;
    }

    protected String classFieldType() {
        return "field_definition";
    }

    protected String classFieldNameField() {
        return "property";
    }

    private static String memberName(String source, TSNode nameNode) {
        String text = getNodeText(source, nameNode);
        if (text != null && text.startsWith("#")) {
            return text.substring(1);
        }
        return text;
    }

    private FunctionDefinition toDefinition(String source, LocatedFunction located) {
        FunctionDefinition definition = new FunctionDefinition();
        definition.name = located.name;
        definition.startLine = startLine(located.outer);
        definition.endLine = endLine(located.outer);
        definition.kind = located.kind;
        definition.metadata.isExported = located.exported;
        definition.metadata.isMethod = located.kind == NodeKind.METHOD;
        definition.metadata.isEndpoint = located.kind == NodeKind.ENDPOINT;
        if (located.function != null) {
            definition.metadata.isAsync = hasChildToken(located.function, "async");
            definition.metadata.parameters.addAll(parameterNames(source, located.function));
        }
        return definition;
    }

    protected List<String> parameterNames(String source, TSNode function) {
        List<String> names = new ArrayList<>();
        // arrow functions with a single bare parameter: x => ...
        TSNode single = getChildByFieldName(function, "parameter");
        if (!isMissing(single)) {
            names.add(getNodeText(source, single));
            return names;
        }
        for (TSNode param : namedChildren(getChildByFieldName(function, "parameters"))) {
            String paramName = parameterName(source, param);
            if (paramName != null && !paramName.isEmpty()) {
                names.add(paramName);
            }
        }
        return names;
    }

    protected String parameterName(String source, TSNode param) {
        if (isMissing(param)) return null;
        switch (param.getType()) {
            case NT_IDENTIFIER:
                return getNodeText(source, param);
            case "assignment_pattern":
                return parameterName(source, getChildByFieldName(param, "left"));
            case "rest_pattern":
                TSNode restName = param.getNamedChildCount() > 0 ? param.getNamedChild(0) : null;
                String rest = parameterName(source, restName);
                return rest != null ? "..." + rest : null;
            case NT_OBJECT_PATTERN:
            case NT_ARRAY_PATTERN:
                return getNodeText(source, param).replaceAll("\\s+", " ").trim();
            default:
                return null;
        }
    }

    private CallSite toCallSite(String source, TSNode callExpr) {
        TSNode callee = getChildByFieldName(callExpr, "function");
        if (isMissing(callee)) return null;
        int line = startLine(callExpr);

        if (NT_IDENTIFIER.equals(callee.getType())) {
            String name = getNodeText(source, callee);
            return isValidIdentifier(name) ? CallSite.function(name, line) : null;
        }
        if (NT_MEMBER_EXPRESSION.equals(callee.getType())) {
            String name = memberName(source, getChildByFieldName(callee, "property"));
            if (!isValidIdentifier(name)) return null;
            return CallSite.method(name, line, receiverOf(source, callee));
        }
        return null;
    }

    private CallSite handlerReferenceSite(String source, TSNode handler) {
        int line = startLine(handler);
        if (NT_IDENTIFIER.equals(handler.getType())) {
            CallSite site = CallSite.handlerReference(getNodeText(source, handler), line);
            return isValidIdentifier(site.name) ? site : null;
        }
        // controller.list passed by reference
        String name = memberName(source, getChildByFieldName(handler, "property"));
        if (!isValidIdentifier(name)) return null;
        CallSite site = CallSite.method(name, line, receiverOf(source, handler));
        site.handlerReference = true;
        return site;
    }

    private static String receiverOf(String source, TSNode memberExpr) {
        TSNode object = getChildByFieldName(memberExpr, "object");
        if (isNodeTypeOneOf(object, NT_IDENTIFIER, NT_THIS)) {
            return getNodeText(source, object);
        }
        return null;
    }

    private static List<TSNode> argumentsOf(TSNode callExpr) {
        List<TSNode> args = new ArrayList<>();
        for (TSNode arg : namedChildren(getChildByFieldName(callExpr, "arguments"))) {
            if (!"comment".equals(arg.getType())) {
                args.add(arg);
            }
        }
        return args;
    }

    @Override
    public List<ImportBinding> findImports(String sourceCode) {
        TSNode root = parse(sourceCode);
        List<ImportBinding> bindings = new ArrayList<>();

        for (TSNode stmt : findAllDescendants(root, "import_statement")) {
            String module = stringLiteralValue(sourceCode, getChildByFieldName(stmt, "source"));
            if (module == null) continue;
            for (TSNode part : namedChildren(findFirstChild(stmt, "import_clause"))) {
                switch (part.getType()) {
                    case NT_IDENTIFIER:
                        bindings.add(new ImportBinding(getNodeText(sourceCode, part), module, "default"));
                        break;
                    case "namespace_import":
                        TSNode alias = findFirstChild(part, NT_IDENTIFIER);
                        if (alias != null) {
                            bindings.add(new ImportBinding(getNodeText(sourceCode, alias), module, null));
                        }
                        break;
                    case "named_imports":
                        for (TSNode specifier : findAllChildren(part, "import_specifier")) {
                            String importedName = getNodeText(sourceCode, getChildByFieldName(specifier, "name"));
                            String localName = getNodeText(sourceCode, getChildByFieldName(specifier, "alias"));
                            if (importedName == null) continue;
                            bindings.add(new ImportBinding(localName != null ? localName : importedName, module, importedName));
                        }
                        break;
                    default:
                        break;
                }
            }
        }

        // CommonJS: const x = require('./x'), const { a, b: c } = require('./x'), const Y = require('./x').Y
        for (TSNode declarator : findAllDescendants(root, NT_VARIABLE_DECLARATOR)) {
            TSNode value = getChildByFieldName(declarator, "value");
            String importedName = null;
            if (isNodeTypeOneOf(value, NT_MEMBER_EXPRESSION)) {
                importedName = getNodeText(sourceCode, getChildByFieldName(value, "property"));
                value = getChildByFieldName(value, "object");
            }
            String module = requiredModule(sourceCode, value);
            if (module == null) continue;

            TSNode nameNode = getChildByFieldName(declarator, "name");
            if (isNodeTypeOneOf(nameNode, NT_IDENTIFIER)) {
                bindings.add(new ImportBinding(getNodeText(sourceCode, nameNode), module, importedName));
            } else if (isNodeTypeOneOf(nameNode, NT_OBJECT_PATTERN)) {
                for (TSNode property : namedChildren(nameNode)) {
                    if ("shorthand_property_identifier_pattern".equals(property.getType())) {
                        String propertyName = getNodeText(sourceCode, property);
                        bindings.add(new ImportBinding(propertyName, module, propertyName));
                    } else if ("pair_pattern".equals(property.getType())) {
                        String key = getNodeText(sourceCode, getChildByFieldName(property, "key"));
                        TSNode local = getChildByFieldName(property, "value");
                        if (key != null && isNodeTypeOneOf(local, NT_IDENTIFIER)) {
                            bindings.add(new ImportBinding(getNodeText(sourceCode, local), module, key));
                        }
                    }
                }
            }
        }
        return bindings;
    }

    private static String requiredModule(String source, TSNode value) {
        if (!isNodeTypeOneOf(value, NT_CALL_EXPRESSION)) return null;
        TSNode callee = getChildByFieldName(value, "function");
        if (!isNodeTypeOneOf(callee, NT_IDENTIFIER) || !"require".equals(getNodeText(source, callee))) return null;
        List<TSNode> args = argumentsOf(value);
        return args.isEmpty() ? null : stringLiteralValue(source, args.get(0));
    }

    @Override
    public List<AssignmentBinding> findAssignments(String sourceCode) {
        TSNode root = parse(sourceCode);
        List<AssignmentBinding> bindings = new ArrayList<>();

        for (TSNode declarator : findAllDescendants(root, NT_VARIABLE_DECLARATOR)) {
            TSNode nameNode = getChildByFieldName(declarator, "name");
            String constructorName = constructorName(sourceCode, getChildByFieldName(declarator, "value"));
            if (constructorName != null && isNodeTypeOneOf(nameNode, NT_IDENTIFIER)) {
                bindings.add(new AssignmentBinding(getNodeText(sourceCode, nameNode), constructorName, startLine(declarator)));
            }
        }
        for (TSNode assignment : findAllDescendants(root, "assignment_expression")) {
            TSNode left = getChildByFieldName(assignment, "left");
            String constructorName = constructorName(sourceCode, getChildByFieldName(assignment, "right"));
            if (constructorName != null && isNodeTypeOneOf(left, NT_IDENTIFIER)) {
                bindings.add(new AssignmentBinding(getNodeText(sourceCode, left), constructorName, startLine(assignment)));
            }
        }
        return bindings;
    }

    private static String constructorName(String source, TSNode value) {
        if (isNodeTypeOneOf(value, "await_expression") && value.getNamedChildCount() > 0) {
            value = value.getNamedChild(0);
        }
        if (!isNodeTypeOneOf(value, NT_NEW_EXPRESSION)) return null;
        TSNode constructor = getChildByFieldName(value, "constructor");
        if (isNodeTypeOneOf(constructor, NT_IDENTIFIER)) {
            return getNodeText(source, constructor);
        }
        if (isNodeTypeOneOf(constructor, NT_MEMBER_EXPRESSION)) {
            return getNodeText(source, getChildByFieldName(constructor, "property"));
        }
        return null;
    }

    @Override
    public List<String> moduleCandidates(ImportBinding binding, String importingFile) {
        List<String> candidates = new ArrayList<>();
        String module = binding.module;
        // bare specifiers are packages from node_modules, never project files
        if (module == null || !module.startsWith(".")) {
            return candidates;
        }
        String base = ModulePaths.normalize(ModulePaths.join(ModulePaths.directoryOf(importingFile), module));
        if (base == null || base.isEmpty()) {
            return candidates;
        }

        for (String extension : MODULE_EXTENSIONS) {
            if (base.endsWith(extension)) {
                candidates.add(base);
                // TypeScript sources import their compiled name: './util.js' means util.ts
                String stem = base.substring(0, base.length() - extension.length());
                candidates.add(stem + ".ts");
                candidates.add(stem + ".tsx");
                return candidates;
            }
        }
        for (String extension : MODULE_EXTENSIONS) {
            candidates.add(base + extension);
        }
        for (String extension : INDEX_EXTENSIONS) {
            candidates.add(base + "/index" + extension);
        }
        return candidates;
    }
}
