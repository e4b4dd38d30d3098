package org.declgraph.analyzer.metadata;

/**
 * Tells whether the package a file belongs to ships the documentation metadata the
 * declaration graph relies on. Symbols imported from packages that do not are kept
 * nominal: referenced, but never expanded.
 */
@FunctionalInterface
public interface PackageMetadataProvider {

    /**
     * @param fileName the path of a file identifying the package (any file inside it)
     * @return true if the enclosing package supports documentation metadata
     */
    boolean supportsDocumentationMetadata(String fileName);
}
