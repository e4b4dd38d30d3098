package org.declgraph.analyzer;

import org.declgraph.analyzer.metadata.PackageMetadataProvider;
import org.declgraph.analyzer.oracle.SourceModule;
import org.declgraph.analyzer.oracle.Symbol;
import org.declgraph.analyzer.oracle.SymbolFlag;
import org.declgraph.analyzer.oracle.SyntaxKind;
import org.declgraph.analyzer.oracle.SyntaxNode;
import org.declgraph.analyzer.oracle.TypeResolutionOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds and caches the {@link SymbolNode}, {@link DeclarationNode} and {@link ModuleEntry}
 * objects of one analysis run.
 *
 * <p>The table is agnostic of any particular entry point: it does not track whether a given
 * symbol node is exported. All four caches only ever grow, since the analyzed program is
 * immutable for the lifetime of a run. One table is bound to one oracle; independent runs
 * use independent tables.</p>
 *
 * <p>Not thread-safe.</p>
 */
public class SymbolTable {

    private static final Logger LOG = LoggerFactory.getLogger(SymbolTable.class);

    private final TypeResolutionOracle oracle;
    private final PackageMetadataProvider packageMetadata;

    /**
     * Followed symbol to symbol node. {@link SymbolNode#followedSymbol()} is always a key,
     * but further keys may map to the same node when they share an import identity.
     */
    private final Map<Symbol, SymbolNode> symbolNodesBySymbol = new HashMap<>();
    private final Map<SyntaxNode, DeclarationNode> declarationNodesBySyntax = new HashMap<>();
    /** Only imported symbol nodes are registered here. */
    private final Map<ImportIdentity, SymbolNode> symbolNodesByImport = new HashMap<>();
    private final Map<SourceModule, ModuleEntry> moduleEntriesBySource = new HashMap<>();

    /**
     * Creates a symbol table for one analysis run.
     *
     * @param oracle          The type resolution oracle of the analyzed program.
     * @param packageMetadata Decides whether imported symbols are expanded or kept nominal.
     */
    public SymbolTable(TypeResolutionOracle oracle, PackageMetadataProvider packageMetadata) {
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.packageMetadata = Objects.requireNonNull(packageMetadata, "packageMetadata");
    }

    // === Module resolution ===

    /**
     * Returns the module entry for a source module, resolving all of its direct exports the
     * first time the module is seen.
     *
     * @param sourceModule    The module to resolve.
     * @param moduleSpecifier The specifier the module was reached through, or null for an entry
     *                        point. A non-relative specifier marks the module as the entry point
     *                        of an external package.
     * @return the memoized module entry.
     * @throws AnalysisException      if an export uses a construct that cannot be represented.
     * @throws InternalErrorException if the oracle contradicts itself.
     */
    public ModuleEntry fetchModuleEntry(SourceModule sourceModule, String moduleSpecifier) {
        // m1 may "export * from 'm2'" and "export * from 'm3'" while both of those
        // "export * from 'm4'", so never process a module twice.
        ModuleEntry moduleEntry = moduleEntriesBySource.get(sourceModule);
        if (moduleEntry != null) {
            return moduleEntry;
        }

        // Matches "@scope/pkg" or "lodash/has" but not "../folder/LocalFile"
        boolean external = moduleSpecifier != null && !isRelativeModuleSpecifier(moduleSpecifier);
        moduleEntry = new ModuleEntry(sourceModule, external ? moduleSpecifier : null);
        // Registered before its exports are collected so that star-export cycles terminate
        moduleEntriesBySource.put(sourceModule, moduleEntry);
        LOG.debug("Resolving module {}{}", sourceModule.fileName(),
                external ? " as external package " + moduleSpecifier : "");

        if (external) {
            collectExternalExports(moduleEntry, moduleSpecifier);
        } else {
            for (Symbol exportedSymbol : oracle.ownExportsOf(sourceModule)) {
                if (exportedSymbol.hasFlag(SymbolFlag.EXPORT_STAR)) {
                    // Every "export * from '...'" of the module hangs off this one symbol
                    for (SyntaxNode exportStarDeclaration : exportedSymbol.declarations()) {
                        collectExportsFromExportStar(moduleEntry, exportStarDeclaration);
                    }
                } else {
                    collectExport(moduleEntry, exportedSymbol);
                }
            }
        }
        return moduleEntry;
    }

    /**
     * Looks up an exported name in a module, falling back to its wildcard re-exports
     * depth-first. Each module is visited at most once per lookup, so cyclic
     * {@code export *} graphs terminate.
     *
     * @param exportName The exported name.
     * @param moduleEntry The module to start from.
     * @return the symbol node, or empty if no reachable module exports the name.
     */
    public Optional<SymbolNode> lookupExport(String exportName, ModuleEntry moduleEntry) {
        return Optional.ofNullable(tryGetExportOfModule(exportName, moduleEntry, new HashSet<>()));
    }

    private void collectExternalExports(ModuleEntry moduleEntry, String modulePath) {
        for (Symbol exportedSymbol : oracle.exportsOf(moduleEntry.sourceModule())) {
            ImportIdentity importIdentity = new ImportIdentity(exportedSymbol.name(), modulePath);
            Symbol followedSymbol = followAliases(exportedSymbol);

            SymbolNode symbolNode = fetchSymbolNode(followedSymbol, true, importIdentity);
            if (symbolNode == null) {
                throw new AnalysisException("Unsupported export: " + exportedSymbol.name());
            }
            moduleEntry.bindExport(exportedSymbol.name(), symbolNode);
        }
    }

    private void collectExport(ModuleEntry moduleEntry, Symbol exportedSymbol) {
        Symbol current = exportedSymbol;
        Set<Symbol> visitedAliases = new HashSet<>();

        while (true) {
            checkAliasVisited(current, visitedAliases);

            // Is this an import/export that must be followed to find the real declaration?
            for (SyntaxNode declaration : current.declarations()) {
                SyntaxNode exportDeclaration = findFirstParent(declaration, SyntaxKind.EXPORT_DECLARATION);
                if (exportDeclaration == null) {
                    continue;
                }
                if (declaration.kind() != SyntaxKind.EXPORT_SPECIFIER) {
                    throw new AnalysisException("Unimplemented export declaration kind: " + declaration.text());
                }
                // For "export { A as B } from './file-a'" the name to look up is A
                String exportName = specifierPropertyName(declaration);

                ModuleEntry specifierModule = fetchSpecifierModuleEntry(exportDeclaration);
                if (specifierModule != null) {
                    moduleEntry.bindExport(exportedSymbol.name(), getExportOfModule(exportName, specifierModule));
                    return;
                }
            }

            // "import { A } from 'pkg'; export { A };" exports whatever the package exports as A
            SyntaxNode externalImport = tryFindExternalImport(current);
            if (externalImport != null) {
                SymbolNode importedSymbol = fetchExternalImport(externalImport, current);
                if (importedSymbol != null) {
                    moduleEntry.bindExport(exportedSymbol.name(), importedSymbol);
                }
                return;
            }

            Symbol aliasTarget = immediateAliasTarget(current);
            if (aliasTarget == null) {
                break;
            }
            current = aliasTarget;
        }

        // Otherwise it is an ordinary declaration
        SymbolNode symbolNode = fetchSymbolNode(current, true, null);
        if (symbolNode != null) {
            moduleEntry.bindExport(exportedSymbol.name(), symbolNode);
        }
    }

    private void collectExportsFromExportStar(ModuleEntry moduleEntry, SyntaxNode exportStarDeclaration) {
        if (exportStarDeclaration.kind() != SyntaxKind.EXPORT_DECLARATION) {
            LOG.warn("Ignoring export-star declaration of unexpected kind {} in {}",
                    exportStarDeclaration.kind(), moduleEntry);
            return;
        }
        ModuleEntry starExportedModule = fetchSpecifierModuleEntry(exportStarDeclaration);
        if (starExportedModule != null) {
            LOG.debug("{} re-exports everything from {}", moduleEntry, starExportedModule);
            moduleEntry.addStarExportedModule(starExportedModule);
        }
    }

    private SymbolNode getExportOfModule(String exportName, ModuleEntry moduleEntry) {
        SymbolNode symbolNode = tryGetExportOfModule(exportName, moduleEntry, new HashSet<>());
        if (symbolNode == null) {
            throw new InternalErrorException("Unable to analyze the export \"" + exportName + "\" of " + moduleEntry);
        }
        return symbolNode;
    }

    private SymbolNode tryGetExportOfModule(String exportName, ModuleEntry moduleEntry,
                                            Set<ModuleEntry> visitedModules) {
        if (!visitedModules.add(moduleEntry)) {
            return null;
        }

        SymbolNode symbolNode = moduleEntry.exportedSymbols().get(exportName);
        if (symbolNode != null) {
            return symbolNode;
        }

        for (ModuleEntry starExportedModule : moduleEntry.starExportedModules()) {
            symbolNode = tryGetExportOfModule(exportName, starExportedModule, visitedModules);
            if (symbolNode != null) {
                return symbolNode;
            }
        }
        return null;
    }

    /**
     * Resolves the module named by an import or export declaration.
     *
     * @return the module entry, or null if the declaration has no module specifier.
     */
    private ModuleEntry fetchSpecifierModuleEntry(SyntaxNode importOrExportDeclaration) {
        // "./SomeLocalFile" or "external-package/entry/point"
        String moduleSpecifier = oracle.moduleSpecifierOf(importOrExportDeclaration).orElse(null);
        if (moduleSpecifier == null) {
            return null;
        }

        SourceModule declaringModule = oracle.sourceModuleOf(importOrExportDeclaration);
        // The oracle reported this specifier itself, so it must be able to resolve it
        SourceModule targetModule = oracle.resolveSpecifier(declaringModule, moduleSpecifier)
                .orElseThrow(() -> new InternalErrorException("Unable to resolve the module specifier \""
                        + moduleSpecifier + "\" declared in " + declaringModule.fileName()));

        return fetchModuleEntry(targetModule, moduleSpecifier);
    }

    // === Analysis ===

    /**
     * Ensures the given symbol node is analyzed: starting from its root, builds the complete
     * declaration tree and records the symbols each declaration references. If the symbol is
     * not imported, every non-imported symbol it references is analyzed as well, so that
     * forgotten exports are expanded too.
     *
     * <p>Referenced symbols of an imported symbol are resolved but never expanded; their
     * shape belongs to their own package.</p>
     *
     * @param symbolNode The symbol node to analyze. No-op if it is already analyzed.
     */
    public void analyze(SymbolNode symbolNode) {
        if (symbolNode.isAnalyzed()) {
            return;
        }

        if (symbolNode.isNominal()) {
            symbolNode.notifyAnalyzed();
            return;
        }

        SymbolNode rootSymbol = symbolNode.rootSymbol();
        LOG.trace("Analyzing {}", rootSymbol);

        for (DeclarationNode declaration : rootSymbol.declarations()) {
            analyzeChildTree(declaration.syntaxNode(), declaration);
        }
        rootSymbol.notifyAnalyzed();

        if (!symbolNode.isImported()) {
            List<SymbolNode> referencedSymbols = new ArrayList<>();
            rootSymbol.forEachDeclarationRecursive(declaration -> referencedSymbols.addAll(declaration.referencedSymbols()));
            for (SymbolNode referencedSymbol : referencedSymbols) {
                if (!referencedSymbol.isImported()) {
                    analyze(referencedSymbol);
                }
            }
        }
    }

    /**
     * Looks up the symbol node for an oracle symbol without constructing anything.
     *
     * @param symbol An alias-followed symbol.
     * @return the symbol node, or empty if none was built yet or the symbol is never represented.
     */
    public Optional<SymbolNode> tryGetSymbolNode(Symbol symbol) {
        return Optional.ofNullable(fetchSymbolNode(symbol, false, null));
    }

    /**
     * Finds the declaration node built for a syntax node that is an immediate child
     * declaration of {@code parentDeclaration}.
     *
     * @param node              A declaration-bearing syntax node.
     * @param parentDeclaration Its expected parent; its symbol must already be analyzed.
     * @return the child declaration node.
     * @throws InternalErrorException if the parent was not analyzed, no declaration node exists
     *                                for {@code node}, or it is attached to a different parent.
     */
    public DeclarationNode getChildDeclarationNode(SyntaxNode node, DeclarationNode parentDeclaration) {
        if (!parentDeclaration.symbolNode().isAnalyzed()) {
            throw new InternalErrorException("getChildDeclarationNode() cannot be used for the symbol "
                    + parentDeclaration.symbolNode().localName() + ", which was not analyzed");
        }

        DeclarationNode childDeclaration = declarationNodesBySyntax.get(node);
        if (childDeclaration == null) {
            throw new InternalErrorException("Child declaration not found for the node " + node.text());
        }
        if (childDeclaration.parent() != parentDeclaration) {
            throw new InternalErrorException("The declaration found for " + node.text()
                    + " is not attached to the parent declaration " + parentDeclaration);
        }
        return childDeclaration;
    }

    private void analyzeChildTree(SyntaxNode node, DeclarationNode governingDeclaration) {
        switch (node.kind()) {
            case DOC_COMMENT:
                // Documentation tags parse as type references but declare nothing
                return;

            case TYPE_REFERENCE:
            case EXPRESSION_WITH_TYPE_ARGUMENTS:
            case COMPUTED_PROPERTY_NAME: {
                // For "a.b.C" only the leading identifier needs to be resolved
                SyntaxNode identifier = oracle.firstIdentifierIn(node).orElse(null);
                if (identifier == null) {
                    break;
                }
                Symbol symbol = oracle.identityOf(identifier)
                        .orElseThrow(() -> new InternalErrorException("Symbol not found for identifier: " + identifier.text()));

                SymbolNode referencedSymbol = fetchReferencedSymbolNode(symbol);
                if (referencedSymbol != null) {
                    governingDeclaration.notifyReferencedSymbol(referencedSymbol);
                }
                break;
            }

            default:
                break;
        }

        // Does this node declare a new symbol?
        DeclarationNode newGoverningDeclaration = fetchDeclarationNode(node);

        for (SyntaxNode childNode : oracle.childrenOf(node)) {
            analyzeChildTree(childNode, newGoverningDeclaration != null ? newGoverningDeclaration : governingDeclaration);
        }
    }

    private DeclarationNode fetchDeclarationNode(SyntaxNode node) {
        if (!oracle.isDeclarationBearing(node.kind())) {
            return null;
        }

        Symbol symbol = oracle.identityOf(node)
                .orElseThrow(() -> new InternalErrorException("Unable to find the symbol for node " + node.text()));
        if (fetchSymbolNode(symbol, true, null) == null) {
            return null;
        }

        DeclarationNode declarationNode = declarationNodesBySyntax.get(node);
        if (declarationNode == null) {
            throw new InternalErrorException("Unable to find the constructed declaration node for " + node.text());
        }
        return declarationNode;
    }

    // === Symbol construction ===

    private SymbolNode fetchSymbolNode(Symbol followedSymbol, boolean addIfMissing, ImportIdentity importIdentity) {
        // Constructs that are never represented
        if (followedSymbol.hasFlag(SymbolFlag.TYPE_PARAMETER)
                || followedSymbol.hasFlag(SymbolFlag.TYPE_LITERAL)
                || followedSymbol.hasFlag(SymbolFlag.TRANSIENT)) {
            return null;
        }
        if (oracle.isAmbient(followedSymbol)) {
            return null;
        }

        SymbolNode symbolNode = symbolNodesBySymbol.get(followedSymbol);

        if (symbolNode == null && importIdentity != null) {
            symbolNode = symbolNodesByImport.get(importIdentity);
            if (symbolNode != null) {
                // Another symbol already stands for this import (e.g. a second copy of the same
                // package), so alias this one to it
                symbolNodesBySymbol.put(followedSymbol, symbolNode);
            }
        }

        if (symbolNode == null) {
            if (!addIfMissing) {
                return null;
            }
            symbolNode = createSymbolNode(followedSymbol, importIdentity);
        }

        // A package's exports are registered when its module entry is fetched, which happens
        // before anything reached through an import of that package is analyzed.
        if (importIdentity != null && !symbolNode.isImported()) {
            throw new InternalErrorException("The symbol " + symbolNode.localName()
                    + " is being imported after it was already registered as non-imported");
        }
        return symbolNode;
    }

    private SymbolNode createSymbolNode(Symbol followedSymbol, ImportIdentity importIdentity) {
        List<SyntaxNode> declarations = followedSymbol.declarations();
        if (declarations.isEmpty()) {
            throw new InternalErrorException("Followed a symbol with no declarations: " + followedSymbol.name());
        }

        // A whole module only gets a symbol node so that references like "ns.Member" can be
        // emitted; it never becomes the root of a declaration tree.
        boolean nominal = declarations.size() == 1 && declarations.get(0).kind() == SyntaxKind.SOURCE_MODULE;

        if (importIdentity != null && !nominal) {
            // Symbols from packages without documentation metadata are kept, but their
            // parents and children are not processed
            String fileName = oracle.sourceModuleOf(declarations.get(0)).fileName();
            nominal = !packageMetadata.supportsDocumentationMetadata(fileName);
        }

        SymbolNode parentSymbol = null;
        if (!nominal) {
            for (SyntaxNode declaration : declarations) {
                if (!oracle.isDeclarationBearing(declaration.kind())) {
                    throw new InternalErrorException("The \"" + followedSymbol.name() + "\" symbol uses the construct "
                            + declaration.kind() + ", which may be an unimplemented language feature");
                }
            }

            // All merged declarations agree on whether a parent exists and on the parent's
            // symbol (though the parent declarations themselves may differ, e.g. merged
            // namespaces containing merged interfaces), so the first one decides.
            SyntaxNode arbitraryParentDeclaration = tryFindFirstDeclarationParent(declarations.get(0));
            if (arbitraryParentDeclaration != null) {
                Symbol parentOracleSymbol = oracle.identityOf(arbitraryParentDeclaration)
                        .orElseThrow(() -> new InternalErrorException(
                                "Unable to find the symbol for the parent of " + followedSymbol.name()));
                parentSymbol = fetchSymbolNode(parentOracleSymbol, true, null);
                if (parentSymbol == null) {
                    throw new InternalErrorException("Unable to construct a parent symbol node for " + followedSymbol.name());
                }
            }
        }

        SymbolNode symbolNode = new SymbolNode(followedSymbol.name(), followedSymbol, importIdentity, parentSymbol, nominal);
        symbolNodesBySymbol.put(followedSymbol, symbolNode);
        if (importIdentity != null) {
            symbolNodesByImport.put(importIdentity, symbolNode);
        }
        LOG.trace("Created symbol node {} (nominal={})", symbolNode, nominal);

        // Wire each declaration to its corresponding parent declaration
        for (SyntaxNode declaration : declarations) {
            DeclarationNode parentDeclaration = null;
            if (parentSymbol != null) {
                SyntaxNode parentSyntax = tryFindFirstDeclarationParent(declaration);
                if (parentSyntax == null) {
                    throw new InternalErrorException("Missing parent declaration for " + declaration.text());
                }
                parentDeclaration = declarationNodesBySyntax.get(parentSyntax);
                if (parentDeclaration == null) {
                    throw new InternalErrorException("Missing parent declaration node for " + declaration.text());
                }
            }
            declarationNodesBySyntax.put(declaration, new DeclarationNode(declaration, symbolNode, parentDeclaration));
        }

        if (nominal) {
            symbolNode.notifyAnalyzed();
        }
        return symbolNode;
    }

    // === Alias following ===

    /**
     * Resolves the symbol named by a type reference. Aliases are followed without import
     * context, except that a chain passing through an import of an external package resolves
     * to the node that package's module entry exports under the imported name. That node is
     * the same whichever of the package's symbols happened to be analyzed first.
     */
    private SymbolNode fetchReferencedSymbolNode(Symbol symbol) {
        Symbol current = symbol;
        Set<Symbol> visitedAliases = new HashSet<>();
        while (true) {
            checkAliasVisited(current, visitedAliases);

            SyntaxNode externalImport = tryFindExternalImport(current);
            if (externalImport != null) {
                return fetchExternalImport(externalImport, current);
            }

            Symbol aliasTarget = immediateAliasTarget(current);
            if (aliasTarget == null) {
                return fetchSymbolNode(current, true, null);
            }
            current = aliasTarget;
        }
    }

    private Symbol followAliases(Symbol symbol) {
        Symbol current = symbol;
        Set<Symbol> visitedAliases = new HashSet<>();
        while (true) {
            checkAliasVisited(current, visitedAliases);
            Symbol aliasTarget = immediateAliasTarget(current);
            if (aliasTarget == null) {
                return current;
            }
            current = aliasTarget;
        }
    }

    /**
     * @return the next symbol of an alias chain, or null at the end of the chain.
     */
    private Symbol immediateAliasTarget(Symbol symbol) {
        if (!symbol.hasFlag(SymbolFlag.ALIAS)) {
            return null;
        }
        Symbol aliasTarget = oracle.aliasTargetOf(symbol);
        if (aliasTarget == null || aliasTarget.equals(symbol)) {
            return null;
        }
        return aliasTarget;
    }

    private static void checkAliasVisited(Symbol symbol, Set<Symbol> visitedAliases) {
        if (!visitedAliases.add(symbol)) {
            throw new InternalErrorException("Circular alias chain through the symbol " + symbol.name());
        }
    }

    /**
     * If the symbol is declared by an import statement with a non-relative specifier, returns
     * its import specifier, namespace import or import clause.
     */
    private SyntaxNode tryFindExternalImport(Symbol symbol) {
        if (!symbol.hasFlag(SymbolFlag.ALIAS)) {
            return null;
        }
        for (SyntaxNode declaration : symbol.declarations()) {
            SyntaxNode importDeclaration = findFirstParent(declaration, SyntaxKind.IMPORT_DECLARATION);
            if (importDeclaration == null) {
                continue;
            }
            String moduleSpecifier = oracle.moduleSpecifierOf(importDeclaration).orElse(null);
            if (moduleSpecifier != null && !isRelativeModuleSpecifier(moduleSpecifier)) {
                return declaration;
            }
        }
        return null;
    }

    private SymbolNode fetchExternalImport(SyntaxNode importedName, Symbol importSymbol) {
        SyntaxNode importDeclaration = findFirstParent(importedName, SyntaxKind.IMPORT_DECLARATION);
        String exportName;
        switch (importedName.kind()) {
            case IMPORT_SPECIFIER:
                // "import { A as B } from 'pkg'" imports A
                exportName = specifierPropertyName(importedName);
                break;
            case IMPORT_CLAUSE:
                exportName = "default";
                break;
            case NAMESPACE_IMPORT: {
                // The package as a whole is never exported by name; it stays a nominal reference
                String moduleSpecifier = oracle.moduleSpecifierOf(importDeclaration).orElseThrow();
                return fetchSymbolNode(followAliases(importSymbol), true, new ImportIdentity("*", moduleSpecifier));
            }
            default:
                throw new AnalysisException("Unimplemented import declaration kind: " + importedName.text());
        }
        return getExportOfModule(exportName, fetchSpecifierModuleEntry(importDeclaration));
    }

    // === Syntax helpers ===

    /**
     * Returns the name an import or export specifier refers to in the other module: the
     * property name before {@code as} if present, otherwise the only name.
     */
    private String specifierPropertyName(SyntaxNode specifier) {
        for (SyntaxNode child : oracle.childrenOf(specifier)) {
            if (child.kind() == SyntaxKind.IDENTIFIER) {
                return child.text().trim();
            }
        }
        throw new AnalysisException("Unable to determine the name of the specifier: " + specifier.text());
    }

    private SyntaxNode findFirstParent(SyntaxNode node, SyntaxKind kindToMatch) {
        SyntaxNode current = oracle.parentOf(node).orElse(null);
        while (current != null) {
            if (current.kind() == kindToMatch) {
                return current;
            }
            current = oracle.parentOf(current).orElse(null);
        }
        return null;
    }

    /**
     * Returns the nearest ancestor that is declaration-bearing, or null if there is none.
     */
    private SyntaxNode tryFindFirstDeclarationParent(SyntaxNode node) {
        SyntaxNode current = oracle.parentOf(node).orElse(null);
        while (current != null) {
            if (oracle.isDeclarationBearing(current.kind())) {
                return current;
            }
            current = oracle.parentOf(current).orElse(null);
        }
        return null;
    }

    private static boolean isRelativeModuleSpecifier(String moduleSpecifier) {
        return moduleSpecifier.equals(".")
                || moduleSpecifier.equals("..")
                || moduleSpecifier.startsWith("./")
                || moduleSpecifier.startsWith("../")
                || moduleSpecifier.startsWith(".\\")
                || moduleSpecifier.startsWith("..\\")
                || moduleSpecifier.startsWith("/")
                || moduleSpecifier.matches("^[A-Za-z]:[\\\\/].*");
    }
}
