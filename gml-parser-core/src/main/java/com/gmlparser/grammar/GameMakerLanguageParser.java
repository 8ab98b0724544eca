package com.gmlparser.grammar;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent recognizer for GML. Produces a {@link ParseNode} tree shaped after
 * the grammar rules; the AST builder turns that tree into the AST.
 *
 * <p>There is no error recovery: the first mismatch is reported to the registered
 * {@link SyntaxErrorListener}s and a {@link RecognitionException} ends the parse.</p>
 */
public class GameMakerLanguageParser implements Recognizer {
    public static final int DEFAULT_MAX_NESTING_DEPTH = 512;
    public static final String NESTING_DEPTH_EXCEEDED = "maximum nesting depth exceeded";

    private static final Set<TokenType> BINARY_OPERATOR_TOKENS = EnumSet.of(
        TokenType.MULTIPLY, TokenType.DIVIDE, TokenType.INTEGER_DIVIDE, TokenType.MODULUS,
        TokenType.PLUS, TokenType.MINUS, TokenType.LEFT_SHIFT, TokenType.RIGHT_SHIFT,
        TokenType.BIT_AND, TokenType.BIT_XOR, TokenType.BIT_OR,
        TokenType.LESS_THAN, TokenType.LESS_THAN_EQUALS, TokenType.GREATER_THAN, TokenType.GREATER_THAN_EQUALS,
        TokenType.EQUALS, TokenType.NOT_EQUALS, TokenType.AND, TokenType.OR, TokenType.NULL_COALESCE
    );

    private static final Set<TokenType> OPENING_TOKENS = EnumSet.of(
        TokenType.OPEN_BRACE, TokenType.OPEN_PAREN, TokenType.OPEN_BRACKET,
        TokenType.LIST_ACCESSOR, TokenType.MAP_ACCESSOR, TokenType.GRID_ACCESSOR,
        TokenType.ARRAY_ACCESSOR, TokenType.STRUCT_ACCESSOR, TokenType.TEMPLATE_STRING_START_EXPRESSION
    );

    private static final Set<TokenType> CLOSING_TOKENS = EnumSet.of(
        TokenType.CLOSE_BRACE, TokenType.CLOSE_PAREN, TokenType.CLOSE_BRACKET,
        TokenType.TEMPLATE_STRING_END_EXPRESSION
    );

    private static final Set<TokenType> LITERAL_TOKENS = EnumSet.of(
        TokenType.INTEGER_LITERAL, TokenType.DECIMAL_LITERAL, TokenType.HEX_INTEGER_LITERAL,
        TokenType.BINARY_LITERAL, TokenType.STRING_LITERAL, TokenType.VERBATIM_STRING_LITERAL,
        TokenType.BOOLEAN_LITERAL, TokenType.UNDEFINED_LITERAL, TokenType.NOONE_LITERAL
    );

    private final List<Token> tokens;
    private final List<SyntaxErrorListener> listeners = new ArrayList<>();
    private final int maxNestingDepth;

    private int current = 0;
    private int depth = 0;
    private ParseNode ctx;

    public GameMakerLanguageParser(List<Token> tokens) {
        this(tokens, DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * @param tokens the full lexer output; hidden tokens are skipped
     */
    public GameMakerLanguageParser(List<Token> tokens, int maxNestingDepth) {
        List<Token> significant = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (!token.isHidden()) {
                significant.add(token);
            }
        }
        if (significant.isEmpty() || !significant.get(significant.size() - 1).isEof()) {
            throw new IllegalArgumentException("Token stream must end with EOF");
        }
        this.tokens = significant;
        this.maxNestingDepth = maxNestingDepth;
    }

    @Override
    public List<String> getRuleInvocationStack() {
        List<String> stack = new ArrayList<>();
        for (ParseNode node = ctx; node != null; node = node.parent()) {
            stack.add(node.ruleName());
        }
        return stack;
    }

    @Override
    public ParseNode getContext() {
        return ctx;
    }

    @Override
    public void addErrorListener(SyntaxErrorListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeErrorListeners() {
        listeners.clear();
    }

    // ========================================================================
    // Program and statements
    // ========================================================================

    public ParseNode program() {
        current = 0;
        depth = 0;
        ctx = null;
        ParseNode node = enterRule(ParseNodeKind.PROGRAM);
        if (startsStatement()) {
            statementList();
        }
        match(TokenType.EOF, "<EOF>");
        exitRule(node);
        return node;
    }

    private void statementList() {
        ParseNode node = enterRule(ParseNodeKind.STATEMENT_LIST);
        do {
            statement();
        } while (startsStatement());
        exitRule(node);
    }

    private void statement() {
        ParseNode node = enterRule(ParseNodeKind.STATEMENT);
        boolean empty = false;
        switch (peek().type()) {
            case OPEN_BRACE -> block();
            case SEMICOLON -> {
                emptyStatement();
                empty = true;
            }
            case IF -> ifStatement();
            case VAR, STATIC -> variableDeclarationList();
            case DO -> doStatement();
            case WHILE -> whileStatement();
            case FOR -> forStatement();
            case REPEAT -> repeatStatement();
            case WITH -> withStatement();
            case SWITCH -> switchStatement();
            case CONTINUE -> keywordStatement(ParseNodeKind.CONTINUE_STATEMENT);
            case BREAK -> keywordStatement(ParseNodeKind.BREAK_STATEMENT);
            case EXIT -> keywordStatement(ParseNodeKind.EXIT_STATEMENT);
            case RETURN -> returnStatement();
            case THROW -> throwStatement();
            case TRY -> tryStatement();
            case DELETE -> deleteStatement();
            case MACRO -> macroStatement();
            case DEFINE -> defineStatement();
            case REGION, END_REGION -> regionStatement();
            case ENUM -> enumeratorDeclaration();
            case GLOBALVAR -> globalVarStatement();
            case FUNCTION -> functionDeclaration();
            case PLUS_PLUS, MINUS_MINUS -> preIncDecStatement();
            case OPEN_PAREN -> parenthesizedCallStatement();
            case IDENTIFIER, CONSTRUCTOR, NEW -> lValueStatement();
            default -> {
                if (!startsLiteral(peek().type())) {
                    throw unexpected("a statement");
                }
                literalStatement();
            }
        }
        if (!empty && check(TokenType.SEMICOLON)) {
            ParseNode eos = enterRule(ParseNodeKind.EOS);
            consume();
            exitRule(eos);
        }
        exitRule(node);
    }

    private void block() {
        ParseNode node = enterRule(ParseNodeKind.BLOCK);
        openBlock();
        if (startsStatement()) {
            statementList();
        }
        closeBlock();
        exitRule(node);
    }

    private void openBlock() {
        ParseNode node = enterRule(ParseNodeKind.OPEN_BLOCK);
        match(TokenType.OPEN_BRACE, "'{'");
        exitRule(node);
    }

    private void closeBlock() {
        ParseNode node = enterRule(ParseNodeKind.CLOSE_BLOCK);
        match(TokenType.CLOSE_BRACE, "'}'");
        exitRule(node);
    }

    private void emptyStatement() {
        ParseNode node = enterRule(ParseNodeKind.EMPTY_STATEMENT);
        consume();
        exitRule(node);
    }

    private void keywordStatement(ParseNodeKind kind) {
        ParseNode node = enterRule(kind);
        consume();
        exitRule(node);
    }

    private void ifStatement() {
        ParseNode node = enterRule(ParseNodeKind.IF_STATEMENT);
        match(TokenType.IF, "'if'");
        expression();
        if (check(TokenType.THEN)) {
            consume();
        }
        statement();
        if (check(TokenType.ELSE)) {
            consume();
            statement();
        }
        exitRule(node);
    }

    private void doStatement() {
        ParseNode node = enterRule(ParseNodeKind.DO_STATEMENT);
        match(TokenType.DO, "'do'");
        statement();
        match(TokenType.UNTIL, "'until'");
        expression();
        exitRule(node);
    }

    private void whileStatement() {
        ParseNode node = enterRule(ParseNodeKind.WHILE_STATEMENT);
        match(TokenType.WHILE, "'while'");
        expression();
        statement();
        exitRule(node);
    }

    private void forStatement() {
        ParseNode node = enterRule(ParseNodeKind.FOR_STATEMENT);
        match(TokenType.FOR, "'for'");
        match(TokenType.OPEN_PAREN, "'('");
        if (check(TokenType.VAR) || check(TokenType.STATIC)) {
            variableDeclarationList();
        } else if (!check(TokenType.SEMICOLON)) {
            assignmentExpression();
        }
        match(TokenType.SEMICOLON, "';'");
        if (!check(TokenType.SEMICOLON)) {
            expression();
        }
        match(TokenType.SEMICOLON, "';'");
        if (!check(TokenType.CLOSE_PAREN)) {
            statement();
        }
        match(TokenType.CLOSE_PAREN, "')'");
        statement();
        exitRule(node);
    }

    private void repeatStatement() {
        ParseNode node = enterRule(ParseNodeKind.REPEAT_STATEMENT);
        match(TokenType.REPEAT, "'repeat'");
        expression();
        statement();
        exitRule(node);
    }

    private void withStatement() {
        ParseNode node = enterRule(ParseNodeKind.WITH_STATEMENT);
        match(TokenType.WITH, "'with'");
        expression();
        statement();
        exitRule(node);
    }

    private void switchStatement() {
        ParseNode node = enterRule(ParseNodeKind.SWITCH_STATEMENT);
        match(TokenType.SWITCH, "'switch'");
        expression();
        caseBlock();
        exitRule(node);
    }

    private void caseBlock() {
        ParseNode node = enterRule(ParseNodeKind.CASE_BLOCK);
        openBlock();
        if (check(TokenType.CASE)) {
            caseClauses();
        }
        if (check(TokenType.DEFAULT)) {
            defaultClause();
            if (check(TokenType.CASE)) {
                caseClauses();
            }
        }
        closeBlock();
        exitRule(node);
    }

    private void caseClauses() {
        ParseNode node = enterRule(ParseNodeKind.CASE_CLAUSES);
        while (check(TokenType.CASE)) {
            ParseNode clause = enterRule(ParseNodeKind.CASE_CLAUSE);
            consume();
            expression();
            match(TokenType.COLON, "':'");
            if (startsStatement()) {
                statementList();
            }
            exitRule(clause);
        }
        exitRule(node);
    }

    private void defaultClause() {
        ParseNode node = enterRule(ParseNodeKind.DEFAULT_CLAUSE);
        match(TokenType.DEFAULT, "'default'");
        match(TokenType.COLON, "':'");
        if (startsStatement()) {
            statementList();
        }
        exitRule(node);
    }

    private void returnStatement() {
        ParseNode node = enterRule(ParseNodeKind.RETURN_STATEMENT);
        match(TokenType.RETURN, "'return'");
        if (startsExpression(peek().type())) {
            expression();
        }
        exitRule(node);
    }

    private void throwStatement() {
        ParseNode node = enterRule(ParseNodeKind.THROW_STATEMENT);
        match(TokenType.THROW, "'throw'");
        expression();
        exitRule(node);
    }

    private void deleteStatement() {
        ParseNode node = enterRule(ParseNodeKind.DELETE_STATEMENT);
        match(TokenType.DELETE, "'delete'");
        expression();
        exitRule(node);
    }

    private void tryStatement() {
        ParseNode node = enterRule(ParseNodeKind.TRY_STATEMENT);
        match(TokenType.TRY, "'try'");
        statement();
        if (check(TokenType.CATCH)) {
            catchProduction();
            if (check(TokenType.FINALLY)) {
                finallyProduction();
            }
        } else {
            finallyProduction();
        }
        exitRule(node);
    }

    private void catchProduction() {
        ParseNode node = enterRule(ParseNodeKind.CATCH_PRODUCTION);
        match(TokenType.CATCH, "'catch'");
        if (check(TokenType.OPEN_PAREN)) {
            consume();
            if (isIdentifierToken(peek())) {
                identifier();
            }
            match(TokenType.CLOSE_PAREN, "')'");
        }
        statement();
        exitRule(node);
    }

    private void finallyProduction() {
        ParseNode node = enterRule(ParseNodeKind.FINALLY_PRODUCTION);
        match(TokenType.FINALLY, "'finally'");
        statement();
        exitRule(node);
    }

    private void literalStatement() {
        ParseNode node = enterRule(ParseNodeKind.LITERAL_STATEMENT);
        literal();
        exitRule(node);
    }

    private void identifierStatement() {
        ParseNode node = enterRule(ParseNodeKind.IDENTIFIER_STATEMENT);
        identifier();
        exitRule(node);
    }

    // ========================================================================
    // Declarations
    // ========================================================================

    private void variableDeclarationList() {
        ParseNode node = enterRule(ParseNodeKind.VARIABLE_DECLARATION_LIST);
        ParseNode modifier = enterRule(ParseNodeKind.VAR_MODIFIER);
        if (check(TokenType.STATIC)) {
            consume();
        } else {
            match(TokenType.VAR, "'var'");
            while (check(TokenType.VAR)) {
                consume();
            }
        }
        exitRule(modifier);
        variableDeclaration();
        while (check(TokenType.COMMA)) {
            consume();
            variableDeclaration();
        }
        exitRule(node);
    }

    private void variableDeclaration() {
        ParseNode node = enterRule(ParseNodeKind.VARIABLE_DECLARATION);
        identifier();
        if (check(TokenType.ASSIGN)) {
            consume();
            expression();
        }
        exitRule(node);
    }

    private void globalVarStatement() {
        ParseNode node = enterRule(ParseNodeKind.GLOBAL_VAR_STATEMENT);
        match(TokenType.GLOBALVAR, "'globalvar'");
        identifier();
        while (check(TokenType.COMMA)) {
            consume();
            identifier();
        }
        exitRule(node);
    }

    private void functionDeclaration() {
        ParseNode node = enterRule(ParseNodeKind.FUNCTION_DECLARATION);
        match(TokenType.FUNCTION, "'function'");
        if (check(TokenType.IDENTIFIER)) {
            consume();
        }
        parameterList();
        if (check(TokenType.COLON) || check(TokenType.CONSTRUCTOR)) {
            constructorClause();
        }
        block();
        exitRule(node);
    }

    private void constructorClause() {
        ParseNode node = enterRule(ParseNodeKind.CONSTRUCTOR_CLAUSE);
        if (check(TokenType.COLON)) {
            consume();
            match(TokenType.IDENTIFIER, "an identifier");
            arguments();
        }
        match(TokenType.CONSTRUCTOR, "'constructor'");
        exitRule(node);
    }

    private void parameterList() {
        ParseNode node = enterRule(ParseNodeKind.PARAMETER_LIST);
        match(TokenType.OPEN_PAREN, "'('");
        if (isIdentifierToken(peek())) {
            parameterArgument();
            while (check(TokenType.COMMA)) {
                consume();
                if (!isIdentifierToken(peek())) {
                    break;
                }
                parameterArgument();
            }
        }
        match(TokenType.CLOSE_PAREN, "')'");
        exitRule(node);
    }

    private void parameterArgument() {
        ParseNode node = enterRule(ParseNodeKind.PARAMETER_ARGUMENT);
        identifier();
        if (check(TokenType.ASSIGN)) {
            consume();
            expression();
        }
        exitRule(node);
    }

    private void enumeratorDeclaration() {
        ParseNode node = enterRule(ParseNodeKind.ENUMERATOR_DECLARATION);
        match(TokenType.ENUM, "'enum'");
        identifier();
        openBlock();
        if (isIdentifierToken(peek())) {
            ParseNode list = enterRule(ParseNodeKind.ENUMERATOR_LIST);
            enumerator();
            while (check(TokenType.COMMA)) {
                consume();
                if (!isIdentifierToken(peek())) {
                    break;
                }
                enumerator();
            }
            exitRule(list);
        }
        closeBlock();
        exitRule(node);
    }

    private void enumerator() {
        ParseNode node = enterRule(ParseNodeKind.ENUMERATOR);
        identifier();
        if (check(TokenType.ASSIGN)) {
            consume();
            expression();
        }
        exitRule(node);
    }

    /**
     * {@code #macro NAME tokens...} runs to the end of the line. A trailing {@code \}
     * continues the body on the next line.
     */
    private void macroStatement() {
        ParseNode node = enterRule(ParseNodeKind.MACRO_STATEMENT);
        match(TokenType.MACRO, "'#macro'");
        identifier();
        int macroLine = previous().line();
        while (!check(TokenType.EOF) && peek().line() == macroLine) {
            Token token = peek();
            ParseNode macroToken = enterRule(ParseNodeKind.MACRO_TOKEN);
            consume();
            exitRule(macroToken);
            if (token.type() == TokenType.BACKSLASH && peek().line() > macroLine) {
                macroLine = peek().line();
            }
        }
        exitRule(node);
    }

    private void defineStatement() {
        ParseNode node = enterRule(ParseNodeKind.DEFINE_STATEMENT);
        match(TokenType.DEFINE, "'#define'");
        if (check(TokenType.REGION_CHARACTERS)) {
            consume();
        }
        exitRule(node);
    }

    private void regionStatement() {
        ParseNode node = enterRule(ParseNodeKind.REGION_STATEMENT);
        consume();
        if (check(TokenType.REGION_CHARACTERS)) {
            consume();
        }
        exitRule(node);
    }

    // ========================================================================
    // Assignments, l-values and calls
    // ========================================================================

    /**
     * Statement starting with an identifier or {@code new}: an assignment, a call,
     * a postfix increment or a bare identifier.
     */
    private void lValueStatement() {
        if (isIdentifierToken(peek()) && !continuesLValue(peek(1).type())) {
            identifierStatement();
            return;
        }
        ParseNode target = lValueOrCall();
        if (target.kind() == ParseNodeKind.CALL_STATEMENT) {
            return;
        }
        if (peek().type().isAssignmentOperator()) {
            ParseNode assignment = enterOuterRule(target, ParseNodeKind.ASSIGNMENT_EXPRESSION);
            assignmentOperator();
            expression();
            exitRule(assignment);
            return;
        }
        if (check(TokenType.PLUS_PLUS) || check(TokenType.MINUS_MINUS)) {
            ParseNode incDec = enterOuterRule(target, ParseNodeKind.POST_INC_DEC_STATEMENT);
            consume();
            exitRule(incDec);
            return;
        }
        throw unexpected("an assignment operator, '++', '--' or arguments");
    }

    private void assignmentExpression() {
        ParseNode node = enterRule(ParseNodeKind.ASSIGNMENT_EXPRESSION);
        lValueExpression();
        assignmentOperator();
        expression();
        exitRule(node);
    }

    private void assignmentOperator() {
        ParseNode node = enterRule(ParseNodeKind.ASSIGNMENT_OPERATOR);
        if (!peek().type().isAssignmentOperator()) {
            throw unexpected("an assignment operator");
        }
        consume();
        exitRule(node);
    }

    private void preIncDecStatement() {
        ParseNode node = enterRule(ParseNodeKind.PRE_INC_DEC_STATEMENT);
        consume();
        lValueExpression();
        exitRule(node);
    }

    private void lValueExpression() {
        ParseNode target = lValueOrCall();
        if (target.kind() == ParseNodeKind.CALL_STATEMENT) {
            if (ctx.kind() == ParseNodeKind.PRE_INC_DEC_STATEMENT) {
                throw invalidIncDecTarget(target.getStart());
            }
            throw unexpected("an assignable expression");
        }
    }

    /**
     * Reports a non-addressable {@code ++}/{@code --} operand from inside an
     * {@code incDecStatement} so the error names the misuse.
     */
    private RecognitionException invalidIncDecTarget(Token operandStart) {
        enterRule(ParseNodeKind.LVALUE_EXPRESSION);
        return report(operandStart, "mismatched input '" + operandStart.text() + "' expecting an assignable expression");
    }

    /**
     * Parses a start expression followed by any dot, index and call operators, then
     * decides the shape: an {@code lValueExpression} when the chain ends in a dot or
     * index, a (nested) {@code callStatement} when it ends in calls.
     */
    private ParseNode lValueOrCall() {
        ParseNode lvalue = enterRule(ParseNodeKind.LVALUE_EXPRESSION);
        if (check(TokenType.NEW)) {
            ParseNode start = enterRule(ParseNodeKind.NEW_LVALUE);
            newExpression();
            exitRule(start);
        } else if (isIdentifierToken(peek())) {
            ParseNode start = enterRule(ParseNodeKind.IDENTIFIER_LVALUE);
            identifier();
            exitRule(start);
        } else {
            throw unexpected("an identifier or 'new'");
        }
        while (startsChainOperator()) {
            chainOperator();
        }
        exitRule(lvalue);
        return shapeChain(lvalue);
    }

    private void chainOperator() {
        if (check(TokenType.DOT)) {
            ParseNode node = enterRule(ParseNodeKind.MEMBER_DOT_LVALUE);
            consume();
            identifier();
            exitRule(node);
        } else if (check(TokenType.OPEN_PAREN)) {
            ParseNode node = enterRule(ParseNodeKind.CALL_LVALUE);
            arguments();
            exitRule(node);
        } else {
            ParseNode node = enterRule(ParseNodeKind.MEMBER_INDEX_LVALUE);
            accessor();
            expressionSequence();
            match(TokenType.CLOSE_BRACKET, "']'");
            exitRule(node);
        }
    }

    private ParseNode shapeChain(ParseNode lvalue) {
        List<ParseTree> children = lvalue.mutableChildren();
        int trailingCalls = 0;
        for (int i = children.size() - 1; i >= 1; i--) {
            if (((ParseNode) children.get(i)).kind() != ParseNodeKind.CALL_LVALUE) {
                break;
            }
            trailingCalls++;
        }
        int lastLValueOperator = children.size() - 1 - trailingCalls;
        List<ParseNode> calls = new ArrayList<>();
        for (int i = 0; i < trailingCalls; i++) {
            calls.add((ParseNode) children.remove(lastLValueOperator + 1));
        }

        ParseNode last = (ParseNode) children.get(lastLValueOperator);
        if (lastLValueOperator >= 1) {
            last.setKind(last.kind() == ParseNodeKind.MEMBER_DOT_LVALUE
                ? ParseNodeKind.MEMBER_DOT_LVALUE_FINAL
                : last.kind() == ParseNodeKind.MEMBER_INDEX_LVALUE
                    ? ParseNodeKind.MEMBER_INDEX_LVALUE_FINAL
                    : last.kind());
        }
        lvalue.setStop(last.getStop());
        if (calls.isEmpty()) {
            return lvalue;
        }

        ParseNode parent = lvalue.parent();
        ParseNode callable = new ParseNode(ParseNodeKind.CALLABLE_EXPRESSION, null);
        callable.setStart(lvalue.getStart());
        callable.setStop(lvalue.getStop());
        ParseNode call = new ParseNode(ParseNodeKind.CALL_STATEMENT, parent);
        parent.replaceChild(lvalue, call);
        adopt(call, callable);
        adopt(callable, lvalue);
        attachArguments(call, calls.get(0));

        for (int i = 1; i < calls.size(); i++) {
            ParseNode outer = new ParseNode(ParseNodeKind.CALL_STATEMENT, parent);
            parent.replaceChild(call, outer);
            adopt(outer, call);
            attachArguments(outer, calls.get(i));
            call = outer;
        }
        return call;
    }

    private static void adopt(ParseNode parent, ParseNode child) {
        parent.addChild(child);
        child.setParent(parent);
        if (parent.getStart() == null) {
            parent.setStart(child.getStart());
        }
        parent.setStop(child.getStop());
    }

    private static void attachArguments(ParseNode call, ParseNode callOperator) {
        adopt(call, callOperator.child(ParseNodeKind.ARGUMENTS));
    }

    /**
     * {@code (expr)(args)} at statement level.
     */
    private void parenthesizedCallStatement() {
        ParseNode callable = enterRule(ParseNodeKind.CALLABLE_EXPRESSION);
        match(TokenType.OPEN_PAREN, "'('");
        expression();
        match(TokenType.CLOSE_PAREN, "')'");
        exitRule(callable);
        if (check(TokenType.PLUS_PLUS) || check(TokenType.MINUS_MINUS)) {
            enterOuterRule(callable, ParseNodeKind.POST_INC_DEC_STATEMENT);
            throw invalidIncDecTarget(callable.getStart());
        }
        ParseNode call = enterOuterRule(callable, ParseNodeKind.CALL_STATEMENT);
        arguments();
        exitRule(call);
        while (check(TokenType.OPEN_PAREN)) {
            call = enterOuterRule(call, ParseNodeKind.CALL_STATEMENT);
            arguments();
            exitRule(call);
        }
    }

    private void newExpression() {
        ParseNode node = enterRule(ParseNodeKind.NEW_EXPRESSION);
        match(TokenType.NEW, "'new'");
        if (isIdentifierToken(peek())) {
            identifier();
        }
        arguments();
        exitRule(node);
    }

    private void accessor() {
        ParseNode node = enterRule(ParseNodeKind.ACCESSOR);
        if (!peek().type().isAccessor()) {
            throw unexpected("'['");
        }
        consume();
        exitRule(node);
    }

    private void expressionSequence() {
        ParseNode node = enterRule(ParseNodeKind.EXPRESSION_SEQUENCE);
        expression();
        while (check(TokenType.COMMA)) {
            consume();
            expression();
        }
        exitRule(node);
    }

    private void arguments() {
        ParseNode node = enterRule(ParseNodeKind.ARGUMENTS);
        match(TokenType.OPEN_PAREN, "'('");
        if (!check(TokenType.CLOSE_PAREN) && !(check(TokenType.COMMA) && peek(1).type() == TokenType.CLOSE_PAREN)) {
            argumentList();
        }
        if (check(TokenType.COMMA)) {
            ParseNode trailing = enterRule(ParseNodeKind.TRAILING_COMMA);
            consume();
            exitRule(trailing);
        }
        match(TokenType.CLOSE_PAREN, "')'");
        exitRule(node);
    }

    private void argumentList() {
        ParseNode node = enterRule(ParseNodeKind.ARGUMENT_LIST);
        if (check(TokenType.COMMA)) {
            consume();
        }
        argument();
        while (check(TokenType.COMMA) && peek(1).type() != TokenType.CLOSE_PAREN) {
            consume();
            argument();
        }
        exitRule(node);
    }

    private void argument() {
        ParseNode node = enterRule(ParseNodeKind.ARGUMENT);
        if (!check(TokenType.COMMA) && !check(TokenType.CLOSE_PAREN)) {
            expression();
        }
        exitRule(node);
    }

    private void identifier() {
        ParseNode node = enterRule(ParseNodeKind.IDENTIFIER);
        if (!isIdentifierToken(peek())) {
            throw unexpected("an identifier");
        }
        consume();
        exitRule(node);
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private ParseNode expression() {
        ParseNode test = binaryExpression(0);
        if (!check(TokenType.QUESTION_MARK)) {
            return test;
        }
        ParseNode node = enterOuterRule(test, ParseNodeKind.TERNARY_EXPRESSION);
        consume();
        expression();
        match(TokenType.COLON, "':'");
        expression();
        exitRule(node);
        return node;
    }

    /**
     * Precedence climbing over {@link OperatorTable}. Left-associative operators parse
     * their right operand one level tighter; right-associative ones at the same level.
     */
    private ParseNode binaryExpression(int minPrecedence) {
        ParseNode left = unaryExpression();
        while (true) {
            OperatorTable.Operator operator = binaryOperator(peek());
            if (operator == null || operator.precedence() < minPrecedence) {
                return left;
            }
            ParseNode node = enterOuterRule(left, ParseNodeKind.BINARY_EXPRESSION);
            consume();
            binaryExpression(operator.isRightAssociative() ? operator.precedence() : operator.precedence() + 1);
            exitRule(node);
            left = node;
        }
    }

    private ParseNode unaryExpression() {
        ParseNode node = enterRule(ParseNodeKind.EXPRESSION);
        switch (peek().type()) {
            case MINUS -> unaryOperand(node, ParseNodeKind.UNARY_MINUS_EXPRESSION);
            case PLUS -> unaryOperand(node, ParseNodeKind.UNARY_PLUS_EXPRESSION);
            case BIT_NOT -> unaryOperand(node, ParseNodeKind.BIT_NOT_EXPRESSION);
            case NOT -> unaryOperand(node, ParseNodeKind.NOT_EXPRESSION);
            case PLUS_PLUS, MINUS_MINUS -> {
                node.setKind(ParseNodeKind.INC_DEC_EXPRESSION);
                preIncDecStatement();
            }
            default -> primaryExpression(node);
        }
        exitRule(node);
        if (node.kind() == ParseNodeKind.PARENTHESIZED_EXPRESSION || node.kind() == ParseNodeKind.LITERAL_EXPRESSION) {
            return postfixOnValue(node);
        }
        return node;
    }

    private void unaryOperand(ParseNode node, ParseNodeKind kind) {
        node.setKind(kind);
        consume();
        unaryExpression();
    }

    private void primaryExpression(ParseNode node) {
        TokenType type = peek().type();
        if (startsLiteral(type) || type == TokenType.OPEN_BRACE) {
            node.setKind(ParseNodeKind.LITERAL_EXPRESSION);
            literal();
        } else if (type == TokenType.OPEN_PAREN) {
            node.setKind(ParseNodeKind.PARENTHESIZED_EXPRESSION);
            consume();
            expression();
            match(TokenType.CLOSE_PAREN, "')'");
        } else if (type == TokenType.FUNCTION) {
            node.setKind(ParseNodeKind.FUNCTION_EXPRESSION);
            functionDeclaration();
        } else if (type == TokenType.IDENTIFIER || type == TokenType.CONSTRUCTOR || type == TokenType.NEW) {
            ParseNode target = lValueOrCall();
            if (target.kind() == ParseNodeKind.CALL_STATEMENT) {
                node.setKind(ParseNodeKind.CALL_EXPRESSION);
            } else if (check(TokenType.PLUS_PLUS) || check(TokenType.MINUS_MINUS)) {
                node.setKind(ParseNodeKind.INC_DEC_EXPRESSION);
                ParseNode incDec = enterOuterRule(target, ParseNodeKind.POST_INC_DEC_STATEMENT);
                consume();
                exitRule(incDec);
            } else {
                node.setKind(ParseNodeKind.VARIABLE_EXPRESSION);
            }
        } else {
            throw unexpected("an expression");
        }
    }

    /**
     * Member access and calls applied to a parenthesized expression or a literal,
     * e.g. {@code (a + b).x}, {@code [1, 2][0]} or {@code (fn)(1)}.
     */
    private ParseNode postfixOnValue(ParseNode value) {
        ParseNode result = value;
        while (true) {
            if (check(TokenType.DOT)) {
                ParseNode node = enterOuterRule(result, ParseNodeKind.MEMBER_DOT_EXPRESSION);
                consume();
                identifier();
                exitRule(node);
                result = node;
            } else if (peek().type().isAccessor()) {
                ParseNode node = enterOuterRule(result, ParseNodeKind.MEMBER_INDEX_EXPRESSION);
                accessor();
                expressionSequence();
                match(TokenType.CLOSE_BRACKET, "']'");
                exitRule(node);
                result = node;
            } else if (check(TokenType.OPEN_PAREN) && result.kind() == ParseNodeKind.PARENTHESIZED_EXPRESSION) {
                result.setKind(ParseNodeKind.CALLABLE_EXPRESSION);
                ParseNode call = enterOuterRule(result, ParseNodeKind.CALL_STATEMENT);
                arguments();
                exitRule(call);
                ParseNode expression = enterOuterRule(call, ParseNodeKind.CALL_EXPRESSION);
                exitRule(expression);
                result = expression;
            } else if (check(TokenType.OPEN_PAREN) && result.kind() == ParseNodeKind.CALL_EXPRESSION) {
                ParseNode outer = result.parent();
                ctx = result;
                ParseNode call = enterOuterRule(result.child(ParseNodeKind.CALL_STATEMENT), ParseNodeKind.CALL_STATEMENT);
                arguments();
                exitRule(call);
                result.setStop(call.getStop());
                ctx = outer;
            } else {
                return result;
            }
        }
    }

    private void literal() {
        ParseNode node = enterRule(ParseNodeKind.LITERAL);
        TokenType type = peek().type();
        if (type == TokenType.OPEN_BRACKET) {
            arrayLiteral();
        } else if (type == TokenType.OPEN_BRACE) {
            structLiteral();
        } else if (type == TokenType.TEMPLATE_STRING_START) {
            templateStringLiteral();
        } else if (LITERAL_TOKENS.contains(type)) {
            consume();
        } else {
            throw unexpected("a literal");
        }
        exitRule(node);
    }

    private void arrayLiteral() {
        ParseNode node = enterRule(ParseNodeKind.ARRAY_LITERAL);
        match(TokenType.OPEN_BRACKET, "'['");
        ParseNode elements = enterRule(ParseNodeKind.ELEMENT_LIST);
        while (!check(TokenType.CLOSE_BRACKET)) {
            if (check(TokenType.COMMA)) {
                consume();
            } else {
                expression();
            }
        }
        exitRule(elements);
        match(TokenType.CLOSE_BRACKET, "']'");
        exitRule(node);
    }

    private void structLiteral() {
        ParseNode node = enterRule(ParseNodeKind.STRUCT_LITERAL);
        openBlock();
        if (!check(TokenType.CLOSE_BRACE)) {
            propertyAssignment();
            while (check(TokenType.COMMA)) {
                consume();
                if (check(TokenType.CLOSE_BRACE)) {
                    break;
                }
                propertyAssignment();
            }
        }
        closeBlock();
        exitRule(node);
    }

    private void propertyAssignment() {
        ParseNode node = enterRule(ParseNodeKind.PROPERTY_ASSIGNMENT);
        ParseNode name = enterRule(ParseNodeKind.PROPERTY_IDENTIFIER);
        TokenType type = peek().type();
        if (type != TokenType.IDENTIFIER && type != TokenType.CONSTRUCTOR
            && type != TokenType.NOONE_LITERAL && type != TokenType.STRING_LITERAL) {
            throw unexpected("a property name");
        }
        consume();
        exitRule(name);
        match(TokenType.COLON, "':'");
        expression();
        exitRule(node);
    }

    private void templateStringLiteral() {
        ParseNode node = enterRule(ParseNodeKind.TEMPLATE_STRING_LITERAL);
        match(TokenType.TEMPLATE_STRING_START, "'$\"'");
        while (check(TokenType.TEMPLATE_STRING_TEXT) || check(TokenType.TEMPLATE_STRING_START_EXPRESSION)) {
            ParseNode atom = enterRule(ParseNodeKind.TEMPLATE_STRING_ATOM);
            if (check(TokenType.TEMPLATE_STRING_TEXT)) {
                consume();
            } else {
                consume();
                expression();
                match(TokenType.TEMPLATE_STRING_END_EXPRESSION, "'}'");
            }
            exitRule(atom);
        }
        match(TokenType.TEMPLATE_STRING_END, "'\"'");
        exitRule(node);
    }

    // ========================================================================
    // Lookahead predicates
    // ========================================================================

    private boolean startsStatement() {
        return switch (peek().type()) {
            case OPEN_BRACE, SEMICOLON, IF, VAR, STATIC, DO, WHILE, FOR, REPEAT, WITH, SWITCH,
                 CONTINUE, BREAK, EXIT, RETURN, THROW, TRY, DELETE, MACRO, DEFINE, REGION, END_REGION,
                 ENUM, GLOBALVAR, FUNCTION, PLUS_PLUS, MINUS_MINUS, OPEN_PAREN, IDENTIFIER, CONSTRUCTOR, NEW -> true;
            default -> startsLiteral(peek().type());
        };
    }

    private static boolean startsLiteral(TokenType type) {
        return LITERAL_TOKENS.contains(type) || type == TokenType.OPEN_BRACKET || type == TokenType.TEMPLATE_STRING_START;
    }

    private static boolean startsExpression(TokenType type) {
        return switch (type) {
            case IDENTIFIER, CONSTRUCTOR, NEW, OPEN_PAREN, OPEN_BRACE, FUNCTION,
                 MINUS, PLUS, NOT, BIT_NOT, PLUS_PLUS, MINUS_MINUS -> true;
            default -> startsLiteral(type);
        };
    }

    private boolean startsChainOperator() {
        TokenType type = peek().type();
        return type == TokenType.DOT || type == TokenType.OPEN_PAREN || type.isAccessor();
    }

    private static boolean continuesLValue(TokenType type) {
        return type == TokenType.DOT || type == TokenType.OPEN_PAREN || type.isAccessor()
            || type.isAssignmentOperator() || type == TokenType.PLUS_PLUS || type == TokenType.MINUS_MINUS;
    }

    private static boolean isIdentifierToken(Token token) {
        return token.type() == TokenType.IDENTIFIER || token.type() == TokenType.CONSTRUCTOR;
    }

    private static OperatorTable.Operator binaryOperator(Token token) {
        if (!BINARY_OPERATOR_TOKENS.contains(token.type())) {
            return null;
        }
        OperatorTable.Operator operator = OperatorTable.lookup(token.text());
        return operator != null && operator.isBinary() ? operator : null;
    }

    // ========================================================================
    // Rule context bookkeeping
    // ========================================================================

    private ParseNode enterRule(ParseNodeKind kind) {
        ParseNode node = new ParseNode(kind, ctx);
        node.setStart(peek());
        if (ctx != null) {
            ctx.addChild(node);
        }
        ctx = node;
        return node;
    }

    /**
     * Wraps an already-parsed node in a new rule context, as left-recursive alternatives
     * ({@code expression op expression}) require.
     */
    private ParseNode enterOuterRule(ParseNode inner, ParseNodeKind kind) {
        ParseNode parent = inner.parent();
        ParseNode node = new ParseNode(kind, parent);
        node.setStart(inner.getStart());
        if (parent != null) {
            parent.replaceChild(inner, node);
        }
        node.addChild(inner);
        inner.setParent(node);
        ctx = node;
        return node;
    }

    private void exitRule(ParseNode node) {
        Token last = previous();
        Token start = node.getStart();
        boolean matched = last != null && start != null && last.startIndex() >= start.startIndex();
        node.setStop(matched ? last : null);
        ctx = node.parent();
    }

    // ========================================================================
    // Token access
    // ========================================================================

    private Token peek() {
        return tokens.get(current);
    }

    private Token peek(int offset) {
        int index = Math.min(current + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private Token previous() {
        return current > 0 ? tokens.get(current - 1) : null;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    /**
     * Also tracks bracket nesting: braces, parentheses, brackets and template
     * interpolations each open one level.
     */
    private Token consume() {
        Token token = peek();
        if (OPENING_TOKENS.contains(token.type())) {
            if (++depth > maxNestingDepth) {
                throw report(token, NESTING_DEPTH_EXCEEDED);
            }
        } else if (CLOSING_TOKENS.contains(token.type())) {
            depth--;
        }
        ctx.addChild(new TerminalNode(token));
        if (!token.isEof()) {
            current++;
        }
        return token;
    }

    private Token match(TokenType type, String expected) {
        if (check(type)) {
            return consume();
        }
        throw unexpected(expected);
    }

    private RecognitionException unexpected(String expected) {
        Token token = peek();
        String message = token.isEof()
            ? "mismatched input '" + Token.EOF_TEXT + "' expecting " + expected
            : "mismatched input '" + token.text() + "' expecting " + expected;
        return report(token, message);
    }

    private RecognitionException report(Token token, String message) {
        for (SyntaxErrorListener listener : List.copyOf(listeners)) {
            listener.syntaxError(this, token, token.line(), token.column(), message);
        }
        return new RecognitionException(message, token, token.line(), token.column());
    }
}
