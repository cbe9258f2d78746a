package org.dxworks.codetracer;

public enum Language {
    JAVASCRIPT("javascript", ".js", ".jsx", ".mjs", ".cjs"),
    TYPESCRIPT("typescript", ".ts", ".mts", ".cts"),
    TSX("tsx", ".tsx"),
    PYTHON("python", ".py");

    private final String name;
    private final String[] extensions;

    Language(String name, String... extensions) {
        this.name = name;
        this.extensions = extensions;
    }

    public String getName() {
        return name;
    }

    public boolean matchesFileName(String fileName) {
        for (String extension : extensions) {
            if (fileName.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }
}
