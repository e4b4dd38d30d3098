package org.declgraph.analyzer.oracle;

/**
 * The root syntax node of one source module.
 */
public interface SourceModule extends SyntaxNode {

    /**
     * @return the resolved path of the file this module was parsed from.
     */
    String fileName();
}
