package org.declgraph.test.utils;

import org.declgraph.analyzer.oracle.SourceModule;
import org.declgraph.analyzer.oracle.Symbol;
import org.declgraph.analyzer.oracle.SymbolFlag;
import org.declgraph.analyzer.oracle.SyntaxNode;
import org.declgraph.analyzer.oracle.TypeResolutionOracle;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An in-memory {@link TypeResolutionOracle} over hand-built modules.
 *
 * <p>Specifiers resolve through {@link #register(String, FakeModule)} (valid from every
 * module) or {@link #register(FakeModule, String, FakeModule)} (valid from one base module,
 * taking precedence).</p>
 */
public final class FakeProgram implements TypeResolutionOracle {

    private final Map<String, FakeModule> modulesBySpecifier = new HashMap<>();
    private final Map<FakeModule, Map<String, FakeModule>> modulesByBaseAndSpecifier = new HashMap<>();
    private int resolveSpecifierCalls;

    public FakeModule module(String fileName) {
        return new FakeModule(fileName);
    }

    public FakeProgram register(String specifier, FakeModule target) {
        modulesBySpecifier.put(specifier, target);
        return this;
    }

    public FakeProgram register(FakeModule base, String specifier, FakeModule target) {
        modulesByBaseAndSpecifier.computeIfAbsent(base, k -> new HashMap<>()).put(specifier, target);
        return this;
    }

    public int resolveSpecifierCalls() {
        return resolveSpecifierCalls;
    }

    @Override
    public Optional<Symbol> identityOf(SyntaxNode node) {
        return Optional.ofNullable(((FakeNode) node).symbol);
    }

    @Override
    public Symbol aliasTargetOf(Symbol symbol) {
        FakeSymbol target = ((FakeSymbol) symbol).aliasTarget();
        return target != null ? target : symbol;
    }

    @Override
    public List<Symbol> exportsOf(SourceModule module) {
        return ((FakeModule) module).exports().stream()
                .filter(symbol -> !symbol.hasFlag(SymbolFlag.EXPORT_STAR))
                .collect(Collectors.toList());
    }

    @Override
    public List<Symbol> ownExportsOf(SourceModule module) {
        return List.copyOf(((FakeModule) module).exports());
    }

    @Override
    public Optional<SourceModule> resolveSpecifier(SourceModule baseModule, String specifier) {
        resolveSpecifierCalls++;
        FakeModule target = modulesByBaseAndSpecifier.getOrDefault((FakeModule) baseModule, Map.of()).get(specifier);
        if (target == null) {
            target = modulesBySpecifier.get(specifier);
        }
        return Optional.ofNullable(target);
    }

    @Override
    public Optional<String> moduleSpecifierOf(SyntaxNode declaration) {
        return Optional.ofNullable(((FakeNode) declaration).moduleSpecifier);
    }

    @Override
    public List<SyntaxNode> childrenOf(SyntaxNode node) {
        return ((FakeNode) node).children();
    }

    @Override
    public Optional<SyntaxNode> parentOf(SyntaxNode node) {
        return Optional.ofNullable(((FakeNode) node).parent());
    }

    @Override
    public SourceModule sourceModuleOf(SyntaxNode node) {
        FakeNode current = (FakeNode) node;
        while (!(current instanceof FakeModule)) {
            current = current.parent();
            if (current == null) {
                throw new IllegalStateException("Node is not attached to a module: " + node);
            }
        }
        return (FakeModule) current;
    }

    @Override
    public boolean isAmbient(Symbol symbol) {
        return ((FakeSymbol) symbol).isAmbient();
    }
}
