package org.declgraph.analyzer.oracle;

import java.util.List;
import java.util.Set;

/**
 * The oracle's identity for a declared name, after merging every declaration that
 * co-declares it. Instances are compared with {@code equals}; an oracle must hand out the
 * same handle (or an equal one) for the same identity.
 */
public interface Symbol {

    String name();

    Set<SymbolFlag> flags();

    /**
     * @return every syntactic declaration of this symbol, in source order. Merged declarations
     *         (for example an interface declared twice) yield more than one entry.
     */
    List<SyntaxNode> declarations();

    default boolean hasFlag(SymbolFlag flag) {
        return flags().contains(flag);
    }
}
