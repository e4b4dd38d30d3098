package org.declgraph.analyzer;

import org.declgraph.analyzer.oracle.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * One syntactic declaration site of a {@link SymbolNode}.
 *
 * <p>The parent link mirrors lexical nesting and is fixed at construction. The set of
 * referenced symbols grows while the owning root is analyzed and is frozen afterwards.</p>
 */
public final class DeclarationNode {

    private final SyntaxNode syntaxNode;
    private final SymbolNode symbolNode;
    private final DeclarationNode parent;
    private final List<DeclarationNode> children = new ArrayList<>();
    private final Set<SymbolNode> referencedSymbols = new LinkedHashSet<>();

    DeclarationNode(SyntaxNode syntaxNode, SymbolNode symbolNode, DeclarationNode parent) {
        this.syntaxNode = syntaxNode;
        this.symbolNode = symbolNode;
        this.parent = parent;

        symbolNode.notifyDeclarationAttach(this);
        if (parent != null) {
            parent.children.add(this);
        }
    }

    public SyntaxNode syntaxNode() {
        return syntaxNode;
    }

    public SymbolNode symbolNode() {
        return symbolNode;
    }

    /**
     * @return the enclosing declaration, or null for a declaration of a root symbol.
     */
    public DeclarationNode parent() {
        return parent;
    }

    public List<DeclarationNode> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Symbols referenced from this declaration's own syntax, excluding the syntax of child
     * declarations (those record their own references).
     */
    public Set<SymbolNode> referencedSymbols() {
        return Collections.unmodifiableSet(referencedSymbols);
    }

    public void forEachDeclarationRecursive(Consumer<DeclarationNode> action) {
        action.accept(this);
        for (DeclarationNode child : children) {
            child.forEachDeclarationRecursive(action);
        }
    }

    void notifyReferencedSymbol(SymbolNode referencedSymbol) {
        if (symbolNode.isAnalyzed()) {
            throw new InternalErrorException(
                    "notifyReferencedSymbol() called after analysis of " + symbolNode.localName()
                            + " is already complete");
        }
        referencedSymbols.add(referencedSymbol);
    }

    @Override
    public String toString() {
        return syntaxNode.kind() + " " + symbolNode.localName();
    }
}
