package org.dxworks.codetracer.analyzer;

import org.dxworks.codetracer.Language;
import org.dxworks.codetracer.model.AssignmentBinding;
import org.dxworks.codetracer.model.CallSite;
import org.dxworks.codetracer.model.FunctionDefinition;
import org.dxworks.codetracer.model.ImportBinding;
import org.dxworks.codetracer.model.NodeKind;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static org.dxworks.codetracer.analyzer.TreeSitterHelper.*;

/**
 * Python front-end. Routes are FastAPI/Flask style decorators
 * ({@code @app.post("/process")}, {@code @bp.route("/x", methods=["GET"])}).
 */
public class PythonFrontEnd implements LanguageFrontEnd {
    private static final String NT_FUNCTION_DEFINITION = "function_definition";
    private static final String NT_CLASS_DEFINITION = "class_definition";
    private static final String NT_DECORATED_DEFINITION = "decorated_definition";
    private static final String NT_IDENTIFIER = "identifier";
    private static final String NT_ATTRIBUTE = "attribute";
    private static final String NT_CALL = "call";
    private static final String NT_DOTTED_NAME = "dotted_name";
    private static final String NT_ALIASED_IMPORT = "aliased_import";

    private static final Set<String> EXTRA_ROUTE_DECORATORS = Set.of("route", "api_route", "websocket");

    private final Set<String> routeMethods;

    public PythonFrontEnd(Set<String> routeMethods) {
        this.routeMethods = routeMethods;
    }

    private static class LocatedFunction {
        final TSNode outer;
        final TSNode function;
        final NodeKind kind;

        LocatedFunction(TSNode outer, TSNode function, NodeKind kind) {
            this.outer = outer;
            this.function = function;
            this.kind = kind;
        }
    }

    @Override
    public Optional<FunctionDefinition> findDefinition(String name, String sourceCode, String filePath) {
        TSNode root = TreeSitterParsers.parse(Language.PYTHON, sourceCode);
        LocatedFunction located = locate(name, root, sourceCode);
        if (located == null) {
            return Optional.empty();
        }

        FunctionDefinition definition = new FunctionDefinition();
        definition.name = name;
        definition.startLine = startLine(located.outer);
        definition.endLine = endLine(located.outer);
        definition.kind = located.kind;
        definition.metadata.isAsync = hasChildToken(located.function, "async");
        definition.metadata.isMethod = located.kind == NodeKind.METHOD;
        definition.metadata.isEndpoint = located.kind == NodeKind.ENDPOINT;
        String functionName = getNodeText(sourceCode, getChildByFieldName(located.function, "name"));
        definition.metadata.isExported = isTopLevel(located.function)
                && functionName != null && !functionName.startsWith("_");
        definition.metadata.parameters.addAll(parameterNames(sourceCode, located.function));
        return Optional.of(definition);
    }

    @Override
    public List<CallSite> findCallsWithin(String targetName, String sourceCode) {
        TSNode root = TreeSitterParsers.parse(Language.PYTHON, sourceCode);
        LocatedFunction located = locate(targetName, root, sourceCode);
        List<CallSite> calls = new ArrayList<>();
        if (located == null) {
            return calls;
        }

        // only the def itself: decorator calls are not part of the body
        for (TSNode call : findAllDescendants(located.function, NT_CALL)) {
            TSNode callee = getChildByFieldName(call, "function");
            int line = startLine(call);
            if (isNodeTypeOneOf(callee, NT_IDENTIFIER)) {
                calls.add(CallSite.function(getNodeText(sourceCode, callee), line));
            } else if (isNodeTypeOneOf(callee, NT_ATTRIBUTE)) {
                String name = getNodeText(sourceCode, getChildByFieldName(callee, "attribute"));
                if (!isValidIdentifier(name)) continue;
                TSNode object = getChildByFieldName(callee, "object");
                String receiver = isNodeTypeOneOf(object, NT_IDENTIFIER) ? getNodeText(sourceCode, object) : null;
                calls.add(CallSite.method(name, line, receiver));
            }
        }
        return calls;
    }

    private LocatedFunction locate(String name, TSNode root, String source) {
        LocatedFunction route = findRouteHandler(name, root, source);
        if (route != null) {
            return route;
        }

        for (TSNode function : findAllDescendants(root, NT_FUNCTION_DEFINITION)) {
            if (!name.equals(getNodeText(source, getChildByFieldName(function, "name")))) continue;

            TSNode outer = function;
            if (isNodeTypeOneOf(function.getParent(), NT_DECORATED_DEFINITION)) {
                outer = function.getParent();
            }
            TSNode scope = findAncestor(function, NT_FUNCTION_DEFINITION, NT_CLASS_DEFINITION);
            NodeKind kind = isNodeTypeOneOf(scope, NT_CLASS_DEFINITION) ? NodeKind.METHOD : NodeKind.FUNCTION;
            return new LocatedFunction(outer, function, kind);
        }
        return null;
    }

    private LocatedFunction findRouteHandler(String name, TSNode root, String source) {
        for (TSNode decorated : findAllDescendants(root, NT_DECORATED_DEFINITION)) {
            TSNode function = getChildByFieldName(decorated, "definition");
            if (!isNodeTypeOneOf(function, NT_FUNCTION_DEFINITION)) continue;

            for (TSNode decorator : findAllChildren(decorated, "decorator")) {
                TSNode call = decorator.getNamedChildCount() > 0 ? decorator.getNamedChild(0) : null;
                if (!isNodeTypeOneOf(call, NT_CALL)) continue;

                TSNode callee = getChildByFieldName(call, "function");
                if (!isNodeTypeOneOf(callee, NT_ATTRIBUTE)) continue;
                String verb = getNodeText(source, getChildByFieldName(callee, "attribute"));
                if (verb == null) continue;
                verb = verb.toLowerCase(Locale.ROOT);
                if (!routeMethods.contains(verb) && !EXTRA_ROUTE_DECORATORS.contains(verb)) continue;

                TSNode firstArg = null;
                for (TSNode arg : namedChildren(getChildByFieldName(call, "arguments"))) {
                    if (!"comment".equals(arg.getType())) {
                        firstArg = arg;
                        break;
                    }
                }
                if (JavaScriptFrontEnd.routePathMatches(stringLiteralValue(source, firstArg), name)) {
                    return new LocatedFunction(decorated, function, NodeKind.ENDPOINT);
                }
            }
        }
        return null;
    }

    private static boolean isTopLevel(TSNode function) {
        return findAncestor(function, NT_FUNCTION_DEFINITION, NT_CLASS_DEFINITION) == null;
    }

    private List<String> parameterNames(String source, TSNode function) {
        List<String> names = new ArrayList<>();
        for (TSNode param : namedChildren(getChildByFieldName(function, "parameters"))) {
            String paramName = null;
            switch (param.getType()) {
                case NT_IDENTIFIER:
                    paramName = getNodeText(source, param);
                    break;
                case "typed_parameter":
                    TSNode inner = param.getNamedChildCount() > 0 ? param.getNamedChild(0) : null;
                    if (isNodeTypeOneOf(inner, NT_IDENTIFIER)) {
                        paramName = getNodeText(source, inner);
                    } else if (isNodeTypeOneOf(inner, "list_splat_pattern", "dictionary_splat_pattern")) {
                        paramName = getNodeText(source, inner);
                    }
                    break;
                case "default_parameter":
                case "typed_default_parameter":
                    paramName = getNodeText(source, getChildByFieldName(param, "name"));
                    break;
                case "list_splat_pattern":
                case "dictionary_splat_pattern":
                    paramName = getNodeText(source, param);
                    break;
                default:
                    break;
            }
            if (paramName != null && !paramName.isEmpty()) {
                names.add(paramName);
            }
        }
        return names;
    }

    @Override
    public List<ImportBinding> findImports(String sourceCode) {
        TSNode root = TreeSitterParsers.parse(Language.PYTHON, sourceCode);
        List<ImportBinding> bindings = new ArrayList<>();

        for (TSNode stmt : findAllDescendants(root, "import_from_statement")) {
            String module = getNodeText(sourceCode, getChildByFieldName(stmt, "module_name"));
            if (module == null) continue;
            for (TSNode imported : childrenByFieldName(stmt, "name")) {
                if (isNodeTypeOneOf(imported, NT_DOTTED_NAME)) {
                    String name = getNodeText(sourceCode, imported);
                    bindings.add(new ImportBinding(name, module, name));
                } else if (isNodeTypeOneOf(imported, NT_ALIASED_IMPORT)) {
                    String name = getNodeText(sourceCode, getChildByFieldName(imported, "name"));
                    String alias = getNodeText(sourceCode, getChildByFieldName(imported, "alias"));
                    bindings.add(new ImportBinding(alias != null ? alias : name, module, name));
                }
            }
        }

        for (TSNode stmt : findAllDescendants(root, "import_statement")) {
            for (TSNode imported : childrenByFieldName(stmt, "name")) {
                if (isNodeTypeOneOf(imported, NT_DOTTED_NAME)) {
                    String module = getNodeText(sourceCode, imported);
                    bindings.add(new ImportBinding(module, module, null));
                } else if (isNodeTypeOneOf(imported, NT_ALIASED_IMPORT)) {
                    String module = getNodeText(sourceCode, getChildByFieldName(imported, "name"));
                    String alias = getNodeText(sourceCode, getChildByFieldName(imported, "alias"));
                    bindings.add(new ImportBinding(alias != null ? alias : module, module, null));
                }
            }
        }
        return bindings;
    }

    private static List<TSNode> childrenByFieldName(TSNode parent, String fieldName) {
        List<TSNode> result = new ArrayList<>();
        for (int i = 0; i < parent.getChildCount(); i++) {
            if (fieldName.equals(parent.getFieldNameForChild(i))) {
                result.add(parent.getChild(i));
            }
        }
        return result;
    }

    @Override
    public List<AssignmentBinding> findAssignments(String sourceCode) {
        TSNode root = TreeSitterParsers.parse(Language.PYTHON, sourceCode);
        List<AssignmentBinding> bindings = new ArrayList<>();
        for (TSNode assignment : findAllDescendants(root, "assignment")) {
            TSNode left = getChildByFieldName(assignment, "left");
            TSNode right = getChildByFieldName(assignment, "right");
            if (!isNodeTypeOneOf(left, NT_IDENTIFIER) || !isNodeTypeOneOf(right, NT_CALL)) continue;

            TSNode callee = getChildByFieldName(right, "function");
            String constructorName = null;
            if (isNodeTypeOneOf(callee, NT_IDENTIFIER)) {
                constructorName = getNodeText(sourceCode, callee);
            } else if (isNodeTypeOneOf(callee, NT_ATTRIBUTE)) {
                constructorName = getNodeText(sourceCode, getChildByFieldName(callee, "attribute"));
            }
            if (constructorName != null) {
                bindings.add(new AssignmentBinding(getNodeText(sourceCode, left), constructorName, startLine(assignment)));
            }
        }
        return bindings;
    }

    /**
     * {@code from services.user import X} maps to services/user.py or services/user/__init__.py,
     * tried from the project root and from the importing file's directory. Leading dots climb
     * from the importing file's package instead.
     */
    @Override
    public List<String> moduleCandidates(ImportBinding binding, String importingFile) {
        String module = binding.module;
        if (module == null || module.isEmpty()) {
            return new ArrayList<>();
        }

        int dots = 0;
        while (dots < module.length() && module.charAt(dots) == '.') {
            dots++;
        }
        String modulePath = module.substring(dots).replace('.', '/');

        List<String> bases = new ArrayList<>();
        if (dots > 0) {
            String directory = ModulePaths.directoryOf(importingFile);
            for (int i = 1; i < dots; i++) {
                directory = directory + "/..";
            }
            bases.add(ModulePaths.join(directory, modulePath));
        } else {
            bases.add(modulePath);
            bases.add(ModulePaths.join(ModulePaths.directoryOf(importingFile), modulePath));
        }

        Set<String> candidates = new LinkedHashSet<>();
        for (String base : bases) {
            String normalized = ModulePaths.normalize(base);
            if (normalized == null) continue;
            boolean submodule = binding.importedName != null && !binding.importedName.contains(".");
            if (modulePath.isEmpty()) {
                // from . import name: a sibling module or the package itself
                if (submodule) {
                    candidates.add(ModulePaths.join(normalized, binding.importedName + ".py"));
                }
                candidates.add(ModulePaths.join(normalized, "__init__.py"));
                continue;
            }
            candidates.add(normalized + ".py");
            candidates.add(normalized + "/__init__.py");
            // from pkg import submodule
            if (submodule) {
                candidates.add(ModulePaths.join(normalized, binding.importedName + ".py"));
            }
        }
        return new ArrayList<>(candidates);
    }
}
