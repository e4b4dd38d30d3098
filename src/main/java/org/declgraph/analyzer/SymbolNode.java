package org.declgraph.analyzer;

import org.declgraph.analyzer.oracle.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * The canonical node for one name after aliases have been followed.
 *
 * <p>A symbol node owns one {@link DeclarationNode} per merged syntactic declaration. It
 * may have a parent symbol node (lexical nesting, e.g. an interface inside a namespace);
 * analysis always happens at the granularity of the outermost ancestor, the root.</p>
 *
 * <p>Instances are created exclusively by {@link SymbolTable}.</p>
 */
public final class SymbolNode {

    /**
     * Analysis progress of a root symbol node. Only moves forward.
     */
    enum AnalysisState {
        PENDING,
        ANALYZED
    }

    private final String localName;
    private final Symbol followedSymbol;
    private final ImportIdentity importIdentity;
    private final SymbolNode parentSymbol;
    private final SymbolNode rootSymbol;
    private final boolean nominal;
    private final List<DeclarationNode> declarations = new ArrayList<>();

    private AnalysisState analysisState = AnalysisState.PENDING;

    SymbolNode(String localName, Symbol followedSymbol, ImportIdentity importIdentity,
               SymbolNode parentSymbol, boolean nominal) {
        this.localName = localName;
        this.followedSymbol = followedSymbol;
        this.importIdentity = importIdentity;
        this.parentSymbol = parentSymbol;
        this.rootSymbol = parentSymbol != null ? parentSymbol.rootSymbol : this;
        this.nominal = nominal;
    }

    public String localName() {
        return localName;
    }

    /**
     * @return the oracle symbol this node was created for. Further symbols may map to the same
     *         node (see {@link ImportIdentity}), but this one always does.
     */
    public Symbol followedSymbol() {
        return followedSymbol;
    }

    /**
     * @return the import identity if this symbol was reached through an external package,
     *         otherwise null.
     */
    public ImportIdentity importIdentity() {
        return importIdentity;
    }

    public boolean isImported() {
        return importIdentity != null;
    }

    /**
     * @return the lexically enclosing symbol node, or null for a root.
     */
    public SymbolNode parentSymbol() {
        return parentSymbol;
    }

    public SymbolNode rootSymbol() {
        return rootSymbol;
    }

    public boolean isRoot() {
        return parentSymbol == null;
    }

    /**
     * A nominal symbol is an opaque reference target: it is never expanded, so its
     * declarations have no children and no referenced symbols.
     */
    public boolean isNominal() {
        return nominal;
    }

    /**
     * @return true once the root of this symbol's tree has been fully analyzed.
     */
    public boolean isAnalyzed() {
        return rootSymbol.analysisState == AnalysisState.ANALYZED;
    }

    public List<DeclarationNode> declarations() {
        return Collections.unmodifiableList(declarations);
    }

    /**
     * Visits every declaration of this symbol and all of their descendants, parents first.
     */
    public void forEachDeclarationRecursive(Consumer<DeclarationNode> action) {
        for (DeclarationNode declaration : declarations) {
            declaration.forEachDeclarationRecursive(action);
        }
    }

    void notifyDeclarationAttach(DeclarationNode declaration) {
        if (isAnalyzed()) {
            throw new InternalErrorException(
                    "Cannot attach a declaration to the already analyzed symbol " + localName);
        }
        declarations.add(declaration);
    }

    void notifyAnalyzed() {
        if (parentSymbol != null) {
            throw new InternalErrorException(
                    "notifyAnalyzed() called for " + localName + ", which is not a root symbol");
        }
        analysisState = AnalysisState.ANALYZED;
    }

    @Override
    public String toString() {
        return importIdentity != null ? localName + " (" + importIdentity + ")" : localName;
    }
}
