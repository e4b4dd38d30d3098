package org.declgraph.analyzer.oracle;

/**
 * The syntax node kinds the declaration graph distinguishes.
 *
 * <p>Kinds flagged as declaration-bearing introduce a {@code DeclarationNode} when they are
 * encountered; everything else is structure that analysis walks through.</p>
 */
public enum SyntaxKind {
    /** A whole source module. Only ever represented by nominal symbols. */
    SOURCE_MODULE(false),

    CLASS_DECLARATION(true),
    CONSTRUCTOR(true),
    CONSTRUCT_SIGNATURE(true),
    ENUM_DECLARATION(true),
    ENUM_MEMBER(true),
    FUNCTION_DECLARATION(true),
    INDEX_SIGNATURE(true),
    INTERFACE_DECLARATION(true),
    METHOD_DECLARATION(true),
    METHOD_SIGNATURE(true),
    /** A namespace declaration. */
    MODULE_DECLARATION(true),
    PROPERTY_DECLARATION(true),
    PROPERTY_SIGNATURE(true),
    TYPE_ALIAS_DECLARATION(true),
    VARIABLE_DECLARATION(true),

    IMPORT_DECLARATION(false),
    /** The default-import binding of an import statement. */
    IMPORT_CLAUSE(false),
    IMPORT_SPECIFIER(false),
    NAMESPACE_IMPORT(false),
    EXPORT_DECLARATION(false),
    EXPORT_SPECIFIER(false),
    /** {@code export * as ns from "..."}. */
    NAMESPACE_EXPORT(false),
    EXPORT_ASSIGNMENT(false),

    TYPE_REFERENCE(false),
    /** A type expression in an {@code extends} or {@code implements} clause. */
    EXPRESSION_WITH_TYPE_ARGUMENTS(false),
    COMPUTED_PROPERTY_NAME(false),
    HERITAGE_CLAUSE(false),
    TYPE_LITERAL(false),
    TYPE_PARAMETER(false),
    PARAMETER(false),
    QUALIFIED_NAME(false),
    IDENTIFIER(false),
    STRING_LITERAL(false),
    DOC_COMMENT(false),
    KEYWORD(false),
    BLOCK(false),
    OTHER(false);

    private final boolean declarationBearing;

    SyntaxKind(boolean declarationBearing) {
        this.declarationBearing = declarationBearing;
    }

    /**
     * @return true if nodes of this kind introduce a declaration of their own.
     */
    public boolean isDeclarationBearing() {
        return declarationBearing;
    }
}
