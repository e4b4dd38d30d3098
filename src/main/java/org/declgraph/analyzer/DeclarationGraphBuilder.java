package org.declgraph.analyzer;

import org.declgraph.analyzer.metadata.PackageMetadataManager;
import org.declgraph.analyzer.metadata.PackageMetadataProvider;
import org.declgraph.analyzer.oracle.SourceModule;
import org.declgraph.analyzer.oracle.TypeResolutionOracle;
import org.declgraph.config.AnalyzerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Drives one analysis run: resolves an entry point, analyzes everything it exports and
 * collects the forgotten exports.
 *
 * <p>The underlying {@link SymbolTable} is shared by all {@link #build(SourceModule)} calls of
 * one builder, so building several entry points of the same program reuses the work.</p>
 */
public class DeclarationGraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(DeclarationGraphBuilder.class);

    private final SymbolTable symbolTable;
    private final AnalyzerSettings settings;

    /**
     * Creates a builder that looks up package metadata on the file system.
     */
    public DeclarationGraphBuilder(TypeResolutionOracle oracle, AnalyzerSettings settings) {
        this(oracle, settings, new PackageMetadataManager(settings));
    }

    public DeclarationGraphBuilder(TypeResolutionOracle oracle, AnalyzerSettings settings,
                                   PackageMetadataProvider packageMetadata) {
        this.symbolTable = new SymbolTable(oracle, packageMetadata);
        this.settings = settings;
    }

    public SymbolTable symbolTable() {
        return symbolTable;
    }

    /**
     * Builds the declaration graph of an entry point.
     *
     * @param entryPoint The root module of the public API.
     * @return the analyzed graph.
     * @throws AnalysisException      if an export cannot be represented.
     * @throws InternalErrorException if the oracle contradicts itself.
     */
    public DeclarationGraph build(SourceModule entryPoint) {
        ModuleEntry entryModule = symbolTable.fetchModuleEntry(entryPoint, null);

        Map<String, SymbolNode> exports = new LinkedHashMap<>();
        collectAllExports(entryModule, exports, new HashSet<>());
        LOG.debug("Entry point {} exports {} names", entryModule, exports.size());

        for (SymbolNode exportedSymbol : exports.values()) {
            symbolTable.analyze(exportedSymbol);
        }

        List<SymbolNode> forgottenExports = findForgottenExports(exports.values());
        if (settings.reportForgottenExports()) {
            for (SymbolNode forgottenExport : forgottenExports) {
                LOG.warn("{} is referenced by the public API of {} but is not exported", forgottenExport, entryModule);
            }
        }

        return new DeclarationGraph(entryModule,
                Collections.unmodifiableSortedMap(new TreeMap<>(exports)),
                Collections.unmodifiableList(forgottenExports));
    }

    /**
     * Direct exports win over wildcard ones; among wildcard re-exports the first module to
     * export a name wins.
     */
    private void collectAllExports(ModuleEntry moduleEntry, Map<String, SymbolNode> exports,
                                   Set<ModuleEntry> visitedModules) {
        if (!visitedModules.add(moduleEntry)) {
            return;
        }
        for (Map.Entry<String, SymbolNode> export : moduleEntry.exportedSymbols().entrySet()) {
            exports.putIfAbsent(export.getKey(), export.getValue());
        }
        for (ModuleEntry starExportedModule : moduleEntry.starExportedModules()) {
            collectAllExports(starExportedModule, exports, visitedModules);
        }
    }

    private List<SymbolNode> findForgottenExports(Iterable<SymbolNode> exportedSymbols) {
        Set<SymbolNode> exportedRoots = new HashSet<>();
        Deque<SymbolNode> pending = new ArrayDeque<>();
        for (SymbolNode exportedSymbol : exportedSymbols) {
            SymbolNode exportedRoot = exportedSymbol.rootSymbol();
            // The internals of another package are that package's concern
            if (exportedRoots.add(exportedRoot) && !exportedRoot.isImported()) {
                pending.add(exportedRoot);
            }
        }

        Set<SymbolNode> visited = new HashSet<>(exportedRoots);
        Set<SymbolNode> forgotten = new LinkedHashSet<>();
        while (!pending.isEmpty()) {
            SymbolNode rootSymbol = pending.poll();
            List<SymbolNode> referenced = new ArrayList<>();
            rootSymbol.forEachDeclarationRecursive(declaration -> referenced.addAll(declaration.referencedSymbols()));

            for (SymbolNode referencedSymbol : referenced) {
                SymbolNode referencedRoot = referencedSymbol.rootSymbol();
                if (referencedRoot.isImported() || referencedRoot.isNominal() || !visited.add(referencedRoot)) {
                    continue;
                }
                forgotten.add(referencedRoot);
                pending.add(referencedRoot);
            }
        }
        return new ArrayList<>(forgotten);
    }
}
