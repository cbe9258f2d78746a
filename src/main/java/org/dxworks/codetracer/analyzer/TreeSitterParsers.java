package org.dxworks.codetracer.analyzer;

import org.dxworks.codetracer.Language;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterPython;
import org.treesitter.TreeSitterTsx;
import org.treesitter.TreeSitterTypescript;

import java.util.EnumMap;
import java.util.Map;

/**
 * Parses source text into a tree-sitter syntax tree. Tree-sitter never rejects input:
 * unsupported syntax shows up as ERROR nodes and the rest of the file stays usable.
 */
public class TreeSitterParsers {

    private static final Map<Language, TSLanguage> TREE_SITTER_LANGUAGES = new EnumMap<>(Language.class);

    static {
        TREE_SITTER_LANGUAGES.put(Language.JAVASCRIPT, new TreeSitterJavascript());
        TREE_SITTER_LANGUAGES.put(Language.TYPESCRIPT, new TreeSitterTypescript());
        TREE_SITTER_LANGUAGES.put(Language.TSX, new TreeSitterTsx());
        TREE_SITTER_LANGUAGES.put(Language.PYTHON, new TreeSitterPython());
    }

    private TreeSitterParsers() {
    }

    public static TSNode parse(Language language, String sourceCode) {
        TSLanguage tsLanguage = TREE_SITTER_LANGUAGES.get(language);
        if (tsLanguage == null) {
            throw new IllegalArgumentException("No Tree-sitter language available for: " + language);
        }

        // TSParser is not thread-safe, one per parse
        TSParser parser = new TSParser();
        parser.setLanguage(tsLanguage);
        TSTree tree = parser.parseString(null, sourceCode);
        return tree.getRootNode();
    }
}
