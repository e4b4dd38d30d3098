package org.declgraph.analyzer;

/**
 * Identifies one export of one external package, independent of how many local aliases
 * import it. Used as a map key so those aliases collapse into a single {@link SymbolNode}.
 *
 * @param exportName The name as exported by the package ({@code "*"} for a namespace import,
 *                   {@code "default"} for a default import).
 * @param modulePath The non-relative specifier the package was imported with, e.g. {@code "lodash/has"}.
 */
public record ImportIdentity(String exportName, String modulePath) {

    @Override
    public String toString() {
        return modulePath + ":" + exportName;
    }
}
