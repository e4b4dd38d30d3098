package org.declgraph.analyzer.oracle;

/**
 * Classification flags the oracle attaches to a {@link Symbol}.
 */
public enum SymbolFlag {
    /** The symbol stands for another symbol (an import, a re-export or a rename). */
    ALIAS,
    /** The aggregate entry holding every {@code export * from "..."} of a module. */
    EXPORT_STAR,
    TYPE_PARAMETER,
    /** An anonymous structural type. */
    TYPE_LITERAL,
    /** A compiler-synthesized construct with no source of its own. */
    TRANSIENT
}
