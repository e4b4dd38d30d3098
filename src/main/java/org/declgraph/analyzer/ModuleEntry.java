package org.declgraph.analyzer;

import org.declgraph.analyzer.oracle.SourceModule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Holds the export surface of one source module as seen by the {@link SymbolTable}.
 * Each module has its directly exported names and the modules it wildcard-re-exports
 * ({@code export * from "..."}).
 */
public final class ModuleEntry {

    private final SourceModule sourceModule;
    private final String externalModulePath;
    private final Map<String, SymbolNode> exportedSymbols = new LinkedHashMap<>();
    private final Set<ModuleEntry> starExportedModules = new LinkedHashSet<>();

    ModuleEntry(SourceModule sourceModule, String externalModulePath) {
        this.sourceModule = sourceModule;
        this.externalModulePath = externalModulePath;
    }

    public SourceModule sourceModule() {
        return sourceModule;
    }

    /**
     * @return the non-relative specifier if this module is the entry point of an external
     *         package (e.g. {@code "@scope/pkg"}), otherwise null.
     */
    public String externalModulePath() {
        return externalModulePath;
    }

    public boolean isExternal() {
        return externalModulePath != null;
    }

    /**
     * Exported name to symbol node. Names reachable only through
     * {@link #starExportedModules()} are not included.
     */
    public Map<String, SymbolNode> exportedSymbols() {
        return Collections.unmodifiableMap(exportedSymbols);
    }

    /**
     * Modules re-exported by {@code export * from "..."}, in declaration order.
     */
    public Set<ModuleEntry> starExportedModules() {
        return Collections.unmodifiableSet(starExportedModules);
    }

    void bindExport(String exportName, SymbolNode symbolNode) {
        exportedSymbols.put(exportName, symbolNode);
    }

    void addStarExportedModule(ModuleEntry moduleEntry) {
        starExportedModules.add(moduleEntry);
    }

    @Override
    public String toString() {
        return externalModulePath != null ? externalModulePath : sourceModule.fileName();
    }
}
