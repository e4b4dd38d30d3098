package org.declgraph.test.utils;

import org.declgraph.analyzer.oracle.SourceModule;
import org.declgraph.analyzer.oracle.SymbolFlag;
import org.declgraph.analyzer.oracle.SyntaxKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A source module of a {@link FakeProgram}, with builders for the import and export
 * statements the declaration graph understands.
 */
public final class FakeModule extends FakeNode implements SourceModule {

    private final String fileName;
    private final FakeSymbol moduleSymbol;
    private final Map<String, FakeSymbol> exports = new LinkedHashMap<>();
    private FakeSymbol exportStar;

    FakeModule(String fileName) {
        super(SyntaxKind.SOURCE_MODULE, fileName);
        this.fileName = fileName;
        this.moduleSymbol = new FakeSymbol("\"" + fileName + "\"");
        moduleSymbol.addDeclaration(this);
    }

    @Override
    public String fileName() {
        return fileName;
    }

    /**
     * @return the symbol standing for the whole module, as a namespace import sees it.
     */
    public FakeSymbol moduleSymbol() {
        return moduleSymbol;
    }

    /**
     * Adds {@code symbol} to the export table, as {@code export interface Name} would.
     */
    public FakeModule export(String name, FakeSymbol symbol) {
        exports.put(name, symbol);
        return this;
    }

    /**
     * Declares a new symbol and exports it under its own name.
     */
    public FakeNode declareExported(SyntaxKind kind, String name) {
        FakeNode declaration = declare(kind, name);
        export(name, declaration.symbol());
        return declaration;
    }

    /**
     * {@code export { propertyName as name } from "specifier";}
     *
     * @return the alias symbol the statement declares.
     */
    public FakeSymbol reExport(String propertyName, String name, String specifier) {
        FakeNode exportDeclaration = add(new FakeNode(SyntaxKind.EXPORT_DECLARATION,
                "export { " + specifierText(propertyName, name) + " } from '" + specifier + "';"));
        exportDeclaration.moduleSpecifier = specifier;

        FakeSymbol alias = new FakeSymbol(name).flag(SymbolFlag.ALIAS);
        alias.addDeclaration(specifierNode(exportDeclaration, SyntaxKind.EXPORT_SPECIFIER, propertyName, name));
        exports.put(name, alias);
        return alias;
    }

    /**
     * {@code export { name };} for a symbol declared or imported elsewhere in this module.
     */
    public FakeSymbol exportLocal(String name, FakeSymbol target) {
        FakeNode exportDeclaration = add(new FakeNode(SyntaxKind.EXPORT_DECLARATION, "export { " + name + " };"));

        FakeSymbol alias = new FakeSymbol(name).aliasOf(target);
        alias.addDeclaration(specifierNode(exportDeclaration, SyntaxKind.EXPORT_SPECIFIER, name, name));
        exports.put(name, alias);
        return alias;
    }

    /**
     * {@code export * as name from "specifier";}
     */
    public FakeSymbol reExportNamespace(String name, String specifier) {
        FakeNode exportDeclaration = add(new FakeNode(SyntaxKind.EXPORT_DECLARATION,
                "export * as " + name + " from '" + specifier + "';"));
        exportDeclaration.moduleSpecifier = specifier;

        FakeNode namespaceExport = exportDeclaration.add(new FakeNode(SyntaxKind.NAMESPACE_EXPORT, "* as " + name));
        namespaceExport.add(new FakeNode(SyntaxKind.IDENTIFIER, name));
        FakeSymbol alias = new FakeSymbol(name).flag(SymbolFlag.ALIAS);
        alias.addDeclaration(namespaceExport);
        exports.put(name, alias);
        return alias;
    }

    /**
     * {@code export * from "specifier";}
     */
    public FakeModule exportStar(String specifier) {
        FakeNode exportDeclaration = add(new FakeNode(SyntaxKind.EXPORT_DECLARATION,
                "export * from '" + specifier + "';"));
        exportDeclaration.moduleSpecifier = specifier;

        if (exportStar == null) {
            exportStar = new FakeSymbol("__export").flag(SymbolFlag.EXPORT_STAR);
        }
        exportStar.addDeclaration(exportDeclaration);
        return this;
    }

    /**
     * {@code import { propertyName as localName } from "specifier";}
     *
     * @return the local alias, resolving to {@code target}.
     */
    public FakeSymbol importNamed(String propertyName, String localName, String specifier, FakeSymbol target) {
        FakeNode importDeclaration = add(new FakeNode(SyntaxKind.IMPORT_DECLARATION,
                "import { " + specifierText(propertyName, localName) + " } from '" + specifier + "';"));
        importDeclaration.moduleSpecifier = specifier;

        FakeSymbol alias = new FakeSymbol(localName).aliasOf(target);
        alias.addDeclaration(specifierNode(importDeclaration, SyntaxKind.IMPORT_SPECIFIER, propertyName, localName));
        return alias;
    }

    /**
     * {@code import * as localName from "specifier";}
     */
    public FakeSymbol importNamespace(String localName, String specifier, FakeModule target) {
        FakeNode importDeclaration = add(new FakeNode(SyntaxKind.IMPORT_DECLARATION,
                "import * as " + localName + " from '" + specifier + "';"));
        importDeclaration.moduleSpecifier = specifier;

        FakeNode namespaceImport = importDeclaration.add(new FakeNode(SyntaxKind.NAMESPACE_IMPORT, "* as " + localName));
        namespaceImport.add(new FakeNode(SyntaxKind.IDENTIFIER, localName));
        FakeSymbol alias = new FakeSymbol(localName).aliasOf(target.moduleSymbol());
        alias.addDeclaration(namespaceImport);
        return alias;
    }

    List<FakeSymbol> exports() {
        List<FakeSymbol> result = new ArrayList<>(exports.values());
        if (exportStar != null) {
            result.add(exportStar);
        }
        return result;
    }

    private static FakeNode specifierNode(FakeNode declaration, SyntaxKind kind, String propertyName, String name) {
        FakeNode specifier = declaration.add(new FakeNode(kind, specifierText(propertyName, name)));
        specifier.add(new FakeNode(SyntaxKind.IDENTIFIER, propertyName));
        if (!propertyName.equals(name)) {
            specifier.add(new FakeNode(SyntaxKind.KEYWORD, "as"));
            specifier.add(new FakeNode(SyntaxKind.IDENTIFIER, name));
        }
        return specifier;
    }

    private static String specifierText(String propertyName, String name) {
        return propertyName.equals(name) ? name : propertyName + " as " + name;
    }
}
