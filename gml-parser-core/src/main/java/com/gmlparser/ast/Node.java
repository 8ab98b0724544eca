package com.gmlparser.ast;

/**
 * Base interface for all GML AST nodes
 */
public sealed interface Node permits
    Program,
    Statement,
    Expression,
    SwitchCase,
    CatchClause,
    Finalizer,
    VariableDeclarator,
    TemplateStringText,
    Property,
    ConstructorParentClause,
    EnumMember,
    Comment,
    Whitespace {

    String type();
    Location start();
    Location end();
}
