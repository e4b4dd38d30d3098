package org.declgraph.analyzer.oracle;

import java.util.List;
import java.util.Optional;

/**
 * The type-resolution service the declaration graph is built on top of.
 *
 * <p>All methods are side-effect-free queries. The graph treats the answers as ground truth
 * and assumes they are deterministic for the lifetime of one analysis run.</p>
 */
public interface TypeResolutionOracle {

    /**
     * Returns the symbol a node declares, or the symbol an identifier refers to.
     *
     * @param node a declaration or an identifier
     * @return the symbol, or empty if the node has none
     */
    Optional<Symbol> identityOf(SyntaxNode node);

    /**
     * Follows one alias step.
     *
     * @param symbol the symbol to follow
     * @return the symbol the alias stands for, or {@code symbol} itself if it is terminal
     */
    Symbol aliasTargetOf(Symbol symbol);

    /**
     * Returns the complete export surface of a module as the type checker sees it,
     * with every wildcard re-export already expanded.
     */
    List<Symbol> exportsOf(SourceModule module);

    /**
     * Returns the module's own export table. All {@code export * from "..."} statements are
     * reported as a single symbol flagged {@link SymbolFlag#EXPORT_STAR}.
     */
    List<Symbol> ownExportsOf(SourceModule module);

    /**
     * Resolves an import or export specifier against the module that declares it.
     *
     * @param baseModule the declaring module
     * @param specifier  the specifier text, without quotes
     * @return the target module, or empty if it cannot be resolved
     */
    Optional<SourceModule> resolveSpecifier(SourceModule baseModule, String specifier);

    /**
     * @param declaration an import or export declaration
     * @return its module specifier without quotes, or empty if it has none
     */
    Optional<String> moduleSpecifierOf(SyntaxNode declaration);

    List<SyntaxNode> childrenOf(SyntaxNode node);

    Optional<SyntaxNode> parentOf(SyntaxNode node);

    SourceModule sourceModuleOf(SyntaxNode node);

    /**
     * @return true if the symbol is declared without a defining body (a global or foreign
     *         declaration)
     */
    boolean isAmbient(Symbol symbol);

    default boolean isDeclarationBearing(SyntaxKind kind) {
        return kind.isDeclarationBearing();
    }

    /**
     * Finds the leading identifier of a node, searching the node itself first and then its
     * descendants depth-first. For {@code a.b.C} this is {@code a}.
     */
    default Optional<SyntaxNode> firstIdentifierIn(SyntaxNode node) {
        if (node.kind() == SyntaxKind.IDENTIFIER) {
            return Optional.of(node);
        }
        for (SyntaxNode child : childrenOf(node)) {
            Optional<SyntaxNode> identifier = firstIdentifierIn(child);
            if (identifier.isPresent()) {
                return identifier;
            }
        }
        return Optional.empty();
    }
}
