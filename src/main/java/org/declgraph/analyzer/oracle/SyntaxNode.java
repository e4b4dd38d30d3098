package org.declgraph.analyzer.oracle;

/**
 * An opaque handle to one node of a parsed source module.
 * Structural queries (parent, children, owning module) go through the
 * {@link TypeResolutionOracle}.
 */
public interface SyntaxNode {

    /**
     * @return the kind of this node.
     */
    SyntaxKind kind();

    /**
     * @return the source text covered by this node.
     */
    String text();
}
