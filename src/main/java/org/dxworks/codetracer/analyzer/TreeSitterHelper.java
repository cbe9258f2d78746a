package org.dxworks.codetracer.analyzer;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class TreeSitterHelper {

    public static boolean isMissing(TSNode node) {
        return node == null || node.isNull();
    }

    public static String getNodeText(String source, TSNode node) {
        return getNodeText(source.getBytes(StandardCharsets.UTF_8), node);
    }

    /**
     * Tree-sitter reports UTF-8 byte offsets, so slicing goes through the encoded source
     * rather than the UTF-16 string.
     */
    public static String getNodeText(byte[] sourceBytes, TSNode node) {
        if (isMissing(node)) return null;
        int startByte = Math.max(0, node.getStartByte());
        int endByte = Math.min(sourceBytes.length, node.getEndByte());
        if (startByte >= endByte) return "";
        return new String(sourceBytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    /** 1-based line of the first character of the node. */
    public static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /** 1-based line of the last character of the node. */
    public static int endLine(TSNode node) {
        int row = node.getEndPoint().getRow();
        // a node ending at column 0 stops right after the previous line's newline
        if (node.getEndPoint().getColumn() == 0 && row > node.getStartPoint().getRow()) {
            row--;
        }
        return row + 1;
    }

    public static TSNode findFirstChild(TSNode parent, String nodeType) {
        if (isMissing(parent)) return null;
        int count = parent.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getNamedChild(i);
            if (!isMissing(child) && nodeType.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    public static List<TSNode> findAllChildren(TSNode parent, String nodeType) {
        List<TSNode> result = new ArrayList<>();
        if (isMissing(parent)) return result;
        int count = parent.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getNamedChild(i);
            if (!isMissing(child) && nodeType.equals(child.getType())) {
                result.add(child);
            }
        }
        return result;
    }

    public static List<TSNode> namedChildren(TSNode parent) {
        List<TSNode> result = new ArrayList<>();
        if (isMissing(parent)) return result;
        for (int i = 0; i < parent.getNamedChildCount(); i++) {
            TSNode child = parent.getNamedChild(i);
            if (!isMissing(child)) result.add(child);
        }
        return result;
    }

    /**
     * Pre-order (document order) walk collecting every descendant of the given types.
     */
    public static List<TSNode> findAllDescendantsOfTypes(TSNode root, String... types) {
        List<TSNode> result = new ArrayList<>();
        if (isMissing(root)) return result;
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (isMissing(node)) continue;
            if (isTypeOneOf(node.getType(), types)) result.add(node);
            for (int i = node.getNamedChildCount() - 1; i >= 0; i--) {
                TSNode child = node.getNamedChild(i);
                if (!isMissing(child)) stack.push(child);
            }
        }
        return result;
    }

    public static List<TSNode> findAllDescendants(TSNode root, String nodeType) {
        return findAllDescendantsOfTypes(root, nodeType);
    }

    public static TSNode getChildByFieldName(TSNode parent, String fieldName) {
        if (isMissing(parent)) return null;
        // getFieldNameForChild expects the index among all children, anonymous tokens included
        for (int i = 0; i < parent.getChildCount(); i++) {
            String fn = parent.getFieldNameForChild(i);
            if (fieldName.equals(fn)) return parent.getChild(i);
        }
        return null;
    }

    /**
     * True when an anonymous token such as {@code async} or {@code *} is a direct child of the node.
     */
    public static boolean hasChildToken(TSNode parent, String tokenType) {
        if (isMissing(parent)) return false;
        for (int i = 0; i < parent.getChildCount(); i++) {
            TSNode child = parent.getChild(i);
            if (!isMissing(child) && !child.isNamed() && tokenType.equals(child.getType())) {
                return true;
            }
        }
        return false;
    }

    public static boolean isTypeOneOf(String type, String... types) {
        if (type == null) return false;
        for (String t : types) if (type.equals(t)) return true;
        return false;
    }

    public static boolean isNodeTypeOneOf(TSNode node, String... types) {
        if (isMissing(node)) return false;
        return isTypeOneOf(node.getType(), types);
    }

    /** Nearest ancestor of one of the given types, or null. */
    public static TSNode findAncestor(TSNode node, String... types) {
        if (isMissing(node)) return null;
        TSNode current = node.getParent();
        while (!isMissing(current)) {
            if (isTypeOneOf(current.getType(), types)) return current;
            current = current.getParent();
        }
        return null;
    }

    /**
     * Value of a string literal node without its quotes and prefixes; null for anything else
     * (template strings with substitutions included).
     */
    public static String stringLiteralValue(String source, TSNode node) {
        if (isMissing(node) || !"string".equals(node.getType())) return null;
        String text = getNodeText(source, node);
        if (text == null) return null;
        int start = 0;
        while (start < text.length() && Character.isLetter(text.charAt(start))) {
            start++; // python prefixes: r"", f"", b""
        }
        text = text.substring(start);
        for (String quote : new String[]{"\"\"\"", "'''", "\"", "'"}) {
            if (text.length() >= 2 * quote.length() && text.startsWith(quote) && text.endsWith(quote)) {
                return text.substring(quote.length(), text.length() - quote.length());
            }
        }
        return null;
    }

    public static boolean isValidIdentifier(String name) {
        return name != null && name.matches("[a-zA-Z_$][a-zA-Z0-9_$]*");
    }
}
