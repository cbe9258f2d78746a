package org.dxworks.codetracer.model;

/**
 * A name brought into a file by an import statement or a {@code require} call.
 * For {@code from pkg.mod import Name as Alias} the local name is {@code Alias},
 * the module {@code pkg.mod} and the imported name {@code Name}. Whole-module
 * imports leave {@code importedName} null.
 */
public class ImportBinding {
    public String localName;
    public String module;
    public String importedName;

    public ImportBinding(String localName, String module, String importedName) {
        this.localName = localName;
        this.module = module;
        this.importedName = importedName;
    }

    @Override
    public String toString() {
        return localName + " <- " + module + (importedName != null ? "#" + importedName : "");
    }
}
