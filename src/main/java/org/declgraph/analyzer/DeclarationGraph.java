package org.declgraph.analyzer;

import java.util.List;
import java.util.SortedMap;

/**
 * The declaration graph of one entry point, ready for report generation.
 *
 * @param entryPoint       The resolved entry point module.
 * @param exportedSymbols  Every name the entry point exports, including names reached through
 *                         {@code export *}, sorted by name. All of them are analyzed.
 * @param forgottenExports Local root symbols referenced by the public API without being exported,
 *                         in discovery order.
 */
public record DeclarationGraph(ModuleEntry entryPoint,
                               SortedMap<String, SymbolNode> exportedSymbols,
                               List<SymbolNode> forgottenExports) {
}
