package com.gmlparser.grammar;

/**
 * Every rule context the parser can produce. Labeled alternatives of one grammar rule
 * (for example all expression forms) report the rule they belong to through {@link #ruleName()}.
 */
public enum ParseNodeKind {
    PROGRAM("program"),
    STATEMENT_LIST("statementList"),
    STATEMENT("statement"),
    BLOCK("block"),
    OPEN_BLOCK("openBlock"),
    CLOSE_BLOCK("closeBlock"),
    EMPTY_STATEMENT("emptyStatement"),
    EOS("eos"),

    IF_STATEMENT("ifStatement"),
    DO_STATEMENT("iterationStatement"),
    WHILE_STATEMENT("iterationStatement"),
    FOR_STATEMENT("iterationStatement"),
    REPEAT_STATEMENT("iterationStatement"),
    WITH_STATEMENT("withStatement"),
    SWITCH_STATEMENT("switchStatement"),
    CASE_BLOCK("caseBlock"),
    CASE_CLAUSES("caseClauses"),
    CASE_CLAUSE("caseClause"),
    DEFAULT_CLAUSE("defaultClause"),
    CONTINUE_STATEMENT("continueStatement"),
    BREAK_STATEMENT("breakStatement"),
    EXIT_STATEMENT("exitStatement"),
    THROW_STATEMENT("throwStatement"),
    TRY_STATEMENT("tryStatement"),
    CATCH_PRODUCTION("catchProduction"),
    FINALLY_PRODUCTION("finallyProduction"),
    RETURN_STATEMENT("returnStatement"),
    DELETE_STATEMENT("deleteStatement"),
    LITERAL_STATEMENT("literalStatement"),
    IDENTIFIER_STATEMENT("identifierStatement"),

    ASSIGNMENT_EXPRESSION("assignmentExpression"),
    ASSIGNMENT_OPERATOR("assignmentOperator"),
    VARIABLE_DECLARATION_LIST("variableDeclarationList"),
    VAR_MODIFIER("varModifier"),
    VARIABLE_DECLARATION("variableDeclaration"),
    GLOBAL_VAR_STATEMENT("globalVarStatement"),

    LVALUE_EXPRESSION("lValueExpression"),
    IDENTIFIER_LVALUE("lValueStartExpression"),
    NEW_LVALUE("lValueStartExpression"),
    MEMBER_INDEX_LVALUE("lValueChainOperator"),
    MEMBER_DOT_LVALUE("lValueChainOperator"),
    CALL_LVALUE("lValueChainOperator"),
    MEMBER_INDEX_LVALUE_FINAL("lValueFinalOperator"),
    MEMBER_DOT_LVALUE_FINAL("lValueFinalOperator"),
    CALLABLE_EXPRESSION("callableExpression"),
    CALL_STATEMENT("callStatement"),
    PRE_INC_DEC_STATEMENT("incDecStatement"),
    POST_INC_DEC_STATEMENT("incDecStatement"),
    NEW_EXPRESSION("newExpression"),
    EXPRESSION_SEQUENCE("expressionSequence"),

    // Not yet resolved to a labeled alternative
    EXPRESSION("expression"),
    BINARY_EXPRESSION("expression"),
    TERNARY_EXPRESSION("expression"),
    NOT_EXPRESSION("expression"),
    UNARY_PLUS_EXPRESSION("expression"),
    UNARY_MINUS_EXPRESSION("expression"),
    BIT_NOT_EXPRESSION("expression"),
    INC_DEC_EXPRESSION("expression"),
    VARIABLE_EXPRESSION("expression"),
    CALL_EXPRESSION("expression"),
    FUNCTION_EXPRESSION("expression"),
    PARENTHESIZED_EXPRESSION("expression"),
    LITERAL_EXPRESSION("expression"),
    MEMBER_DOT_EXPRESSION("expression"),
    MEMBER_INDEX_EXPRESSION("expression"),

    ACCESSOR("accessor"),
    ARGUMENTS("arguments"),
    ARGUMENT_LIST("argumentList"),
    ARGUMENT("argument"),
    TRAILING_COMMA("trailingComma"),

    LITERAL("literal"),
    TEMPLATE_STRING_LITERAL("templateStringLiteral"),
    TEMPLATE_STRING_ATOM("templateStringAtom"),
    ARRAY_LITERAL("arrayLiteral"),
    ELEMENT_LIST("elementList"),
    STRUCT_LITERAL("structLiteral"),
    PROPERTY_ASSIGNMENT("propertyAssignment"),
    PROPERTY_IDENTIFIER("propertyIdentifier"),

    FUNCTION_DECLARATION("functionDeclaration"),
    CONSTRUCTOR_CLAUSE("constructorClause"),
    PARAMETER_LIST("parameterList"),
    PARAMETER_ARGUMENT("parameterArgument"),
    IDENTIFIER("identifier"),

    ENUMERATOR_DECLARATION("enumeratorDeclaration"),
    ENUMERATOR_LIST("enumeratorList"),
    ENUMERATOR("enumerator"),
    MACRO_STATEMENT("macroStatement"),
    MACRO_TOKEN("macroToken"),
    DEFINE_STATEMENT("defineStatement"),
    REGION_STATEMENT("regionStatement");

    private final String ruleName;

    ParseNodeKind(String ruleName) {
        this.ruleName = ruleName;
    }

    public String ruleName() {
        return ruleName;
    }
}
