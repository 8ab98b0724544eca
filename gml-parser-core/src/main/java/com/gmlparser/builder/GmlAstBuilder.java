package com.gmlparser.builder;

import com.gmlparser.ast.ArrayExpression;
import com.gmlparser.ast.AssignmentExpression;
import com.gmlparser.ast.BlockStatement;
import com.gmlparser.ast.BreakStatement;
import com.gmlparser.ast.CallExpression;
import com.gmlparser.ast.CatchClause;
import com.gmlparser.ast.ConstructorDeclaration;
import com.gmlparser.ast.ConstructorParentClause;
import com.gmlparser.ast.ContinueStatement;
import com.gmlparser.ast.DefaultParameter;
import com.gmlparser.ast.DefineStatement;
import com.gmlparser.ast.DeleteStatement;
import com.gmlparser.ast.DoUntilStatement;
import com.gmlparser.ast.EndRegionStatement;
import com.gmlparser.ast.EnumDeclaration;
import com.gmlparser.ast.EnumMember;
import com.gmlparser.ast.ExitStatement;
import com.gmlparser.ast.Expression;
import com.gmlparser.ast.ExpressionStatement;
import com.gmlparser.ast.Finalizer;
import com.gmlparser.ast.ForStatement;
import com.gmlparser.ast.FunctionDeclaration;
import com.gmlparser.ast.GlobalVarStatement;
import com.gmlparser.ast.Identifier;
import com.gmlparser.ast.IdentifierStatement;
import com.gmlparser.ast.IfStatement;
import com.gmlparser.ast.IncDecExpression;
import com.gmlparser.ast.Literal;
import com.gmlparser.ast.MacroDeclaration;
import com.gmlparser.ast.MemberDotExpression;
import com.gmlparser.ast.MemberIndexExpression;
import com.gmlparser.ast.MissingOptionalArgument;
import com.gmlparser.ast.NewExpression;
import com.gmlparser.ast.Node;
import com.gmlparser.ast.ParenthesizedExpression;
import com.gmlparser.ast.Program;
import com.gmlparser.ast.Property;
import com.gmlparser.ast.RegionStatement;
import com.gmlparser.ast.RepeatStatement;
import com.gmlparser.ast.ReturnStatement;
import com.gmlparser.ast.Span;
import com.gmlparser.ast.Statement;
import com.gmlparser.ast.StructExpression;
import com.gmlparser.ast.SwitchCase;
import com.gmlparser.ast.SwitchStatement;
import com.gmlparser.ast.TemplateStringExpression;
import com.gmlparser.ast.TemplateStringText;
import com.gmlparser.ast.TernaryExpression;
import com.gmlparser.ast.ThrowStatement;
import com.gmlparser.ast.TryStatement;
import com.gmlparser.ast.UnaryExpression;
import com.gmlparser.ast.VariableDeclaration;
import com.gmlparser.ast.VariableDeclarator;
import com.gmlparser.ast.WhileStatement;
import com.gmlparser.ast.WithStatement;
import com.gmlparser.diagnostics.AstBuildException;
import com.gmlparser.grammar.ParseNode;
import com.gmlparser.grammar.ParseNodeKind;
import com.gmlparser.grammar.ParseTree;
import com.gmlparser.grammar.TerminalNode;
import com.gmlparser.grammar.Token;
import com.gmlparser.grammar.TokenType;
import com.gmlparser.scope.GlobalIdentifierRegistry;
import com.gmlparser.scope.IdentifierRole;
import com.gmlparser.scope.IdentifierScopeCoordinator;
import com.gmlparser.scope.RoleKind;
import com.gmlparser.scope.ScopeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the parse tree produced by {@link com.gmlparser.grammar.GameMakerLanguageParser}
 * into the AST.
 *
 * <p>One builder serves one parse: it owns the scope stack, the role stack and the set of
 * global names for that source file. Locations come from {@link Spans}, scopes and roles
 * from the {@link IdentifierScopeCoordinator}, and binary operator chains are handed to the
 * {@link BinaryExpressionResolver}.</p>
 *
 * <p>A parse tree that does not have the shape the parser guarantees fails with an
 * {@link AstBuildException} instead of producing a partial node.</p>
 */
public class GmlAstBuilder {
    private static final Logger log = LoggerFactory.getLogger(GmlAstBuilder.class);

    /**
     * Priority order in which a {@code statement} context's child is recognized.
     */
    private static final List<ParseNodeKind> STATEMENT_PROBE_ORDER = List.of(
        ParseNodeKind.BLOCK,
        ParseNodeKind.IF_STATEMENT,
        ParseNodeKind.VARIABLE_DECLARATION_LIST,
        ParseNodeKind.ASSIGNMENT_EXPRESSION,
        ParseNodeKind.CALL_STATEMENT,
        ParseNodeKind.DO_STATEMENT,
        ParseNodeKind.WHILE_STATEMENT,
        ParseNodeKind.FOR_STATEMENT,
        ParseNodeKind.REPEAT_STATEMENT,
        ParseNodeKind.FUNCTION_DECLARATION,
        ParseNodeKind.SWITCH_STATEMENT,
        ParseNodeKind.ENUMERATOR_DECLARATION,
        ParseNodeKind.PRE_INC_DEC_STATEMENT,
        ParseNodeKind.POST_INC_DEC_STATEMENT,
        ParseNodeKind.RETURN_STATEMENT,
        ParseNodeKind.EXIT_STATEMENT,
        ParseNodeKind.WITH_STATEMENT,
        ParseNodeKind.CONTINUE_STATEMENT,
        ParseNodeKind.BREAK_STATEMENT,
        ParseNodeKind.THROW_STATEMENT,
        ParseNodeKind.TRY_STATEMENT,
        ParseNodeKind.GLOBAL_VAR_STATEMENT,
        ParseNodeKind.MACRO_STATEMENT,
        ParseNodeKind.DEFINE_STATEMENT,
        ParseNodeKind.REGION_STATEMENT,
        ParseNodeKind.DELETE_STATEMENT,
        ParseNodeKind.LITERAL_STATEMENT,
        ParseNodeKind.IDENTIFIER_STATEMENT
    );

    private static final Pattern DEFINE_REGION = Pattern.compile("^\\s*region\\b(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEFINE_END_REGION =
        Pattern.compile("^\\s*(?:end\\s*region|endregion)\\b(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEFINE_MACRO_NAME = Pattern.compile("^\\s*[A-Za-z_][A-Za-z0-9_]*\\b");

    private final IdentifierScopeCoordinator scopes;
    private final GlobalIdentifierRegistry globals;
    private final BinaryExpressionResolver binaryExpressions;

    public GmlAstBuilder(IdentifierScopeCoordinator scopes, GlobalIdentifierRegistry globals) {
        this.scopes = scopes;
        this.globals = globals;
        this.binaryExpressions = new BinaryExpressionResolver(this::expression);
    }

    public Program build(ParseNode ctx) {
        requireKind(ctx, ParseNodeKind.PROGRAM);
        List<Statement> body = scopes.withScope(ScopeKind.PROGRAM, () -> statementList(ctx.child(ParseNodeKind.STATEMENT_LIST)));
        return new Program(Spans.of(ctx), body, List.of());
    }

    // ========================================================================
    // Dispatch
    // ========================================================================

    /**
     * Builds the node for any rule context that maps to a single AST node. May return
     * {@code null} for contexts that produce nothing (empty statements, blank defines).
     */
    public Node visit(ParseNode ctx) {
        return switch (ctx.kind()) {
            case STATEMENT -> statement(ctx);
            case BLOCK -> block(ctx);
            case IF_STATEMENT -> ifStatement(ctx);
            case DO_STATEMENT -> new DoUntilStatement(Spans.of(ctx),
                statement(requireChild(ctx, ParseNodeKind.STATEMENT)), expression(firstExpression(ctx)));
            case WHILE_STATEMENT -> new WhileStatement(Spans.of(ctx),
                expression(firstExpression(ctx)), statement(requireChild(ctx, ParseNodeKind.STATEMENT)));
            case REPEAT_STATEMENT -> new RepeatStatement(Spans.of(ctx),
                expression(firstExpression(ctx)), statement(requireChild(ctx, ParseNodeKind.STATEMENT)));
            case FOR_STATEMENT -> forStatement(ctx);
            case WITH_STATEMENT -> withStatement(ctx);
            case SWITCH_STATEMENT -> switchStatement(ctx);
            case CONTINUE_STATEMENT -> new ContinueStatement(Spans.of(ctx));
            case BREAK_STATEMENT -> new BreakStatement(Spans.of(ctx));
            case EXIT_STATEMENT -> new ExitStatement(Spans.of(ctx));
            case THROW_STATEMENT -> new ThrowStatement(Spans.of(ctx), expression(firstExpression(ctx)));
            case TRY_STATEMENT -> tryStatement(ctx);
            case RETURN_STATEMENT -> returnStatement(ctx);
            case DELETE_STATEMENT -> new DeleteStatement(Spans.of(ctx), "delete", expression(firstExpression(ctx)));
            case LITERAL_STATEMENT -> new ExpressionStatement(Spans.of(ctx),
                literal(requireChild(ctx, ParseNodeKind.LITERAL)));
            case IDENTIFIER_STATEMENT -> new IdentifierStatement(Spans.of(ctx),
                identifier(requireChild(ctx, ParseNodeKind.IDENTIFIER)));
            case ASSIGNMENT_EXPRESSION -> assignmentExpression(ctx);
            case VARIABLE_DECLARATION_LIST -> variableDeclarationList(ctx);
            case GLOBAL_VAR_STATEMENT -> globalVarStatement(ctx);
            case FUNCTION_DECLARATION -> functionDeclaration(ctx);
            case ENUMERATOR_DECLARATION -> enumeratorDeclaration(ctx);
            case MACRO_STATEMENT -> macroStatement(ctx);
            case DEFINE_STATEMENT -> defineStatement(ctx);
            case REGION_STATEMENT -> regionStatement(ctx);
            case PRE_INC_DEC_STATEMENT, POST_INC_DEC_STATEMENT -> incDec(ctx);
            case LVALUE_EXPRESSION -> lValueExpression(ctx);
            case CALL_STATEMENT -> callStatement(ctx);
            case CALLABLE_EXPRESSION -> callableExpression(ctx);
            case NEW_EXPRESSION -> newExpression(ctx);
            case BINARY_EXPRESSION -> binaryExpressions.handle(ctx, false);
            case TERNARY_EXPRESSION -> ternaryExpression(ctx);
            case NOT_EXPRESSION -> unaryExpression(ctx, "!");
            case UNARY_PLUS_EXPRESSION -> unaryExpression(ctx, "+");
            case UNARY_MINUS_EXPRESSION -> unaryExpression(ctx, "-");
            case BIT_NOT_EXPRESSION -> unaryExpression(ctx, "~");
            case INC_DEC_EXPRESSION -> incDec(requireOneOf(ctx,
                ParseNodeKind.PRE_INC_DEC_STATEMENT, ParseNodeKind.POST_INC_DEC_STATEMENT));
            case VARIABLE_EXPRESSION -> lValueExpression(requireChild(ctx, ParseNodeKind.LVALUE_EXPRESSION));
            case CALL_EXPRESSION -> callStatement(requireChild(ctx, ParseNodeKind.CALL_STATEMENT));
            case FUNCTION_EXPRESSION -> functionDeclaration(requireChild(ctx, ParseNodeKind.FUNCTION_DECLARATION));
            case PARENTHESIZED_EXPRESSION -> new ParenthesizedExpression(Spans.of(ctx),
                expression(firstExpression(ctx)), false);
            case LITERAL_EXPRESSION -> literal(requireChild(ctx, ParseNodeKind.LITERAL));
            case MEMBER_DOT_EXPRESSION -> memberDotExpression(ctx);
            case MEMBER_INDEX_EXPRESSION -> new MemberIndexExpression(Spans.of(ctx),
                expression(firstExpression(ctx)),
                expressionSequence(requireChild(ctx, ParseNodeKind.EXPRESSION_SEQUENCE)),
                requireChild(ctx, ParseNodeKind.ACCESSOR).getText());
            case LITERAL -> literal(ctx);
            case IDENTIFIER -> identifier(ctx);
            default -> throw new AstBuildException("No AST node for " + ctx.kind() + " at line " + ctx.getStart().line());
        };
    }

    Expression expression(ParseNode ctx) {
        Node node = visit(ctx);
        if (node instanceof Expression expression) {
            return expression;
        }
        throw new AstBuildException("Expected an expression for " + ctx.kind() + " at line "
            + ctx.getStart().line() + ", got " + (node == null ? "nothing" : node.type()));
    }

    static boolean isExpression(ParseNode ctx) {
        return "expression".equals(ctx.ruleName());
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private List<Statement> statementList(ParseNode ctx) {
        List<Statement> statements = new ArrayList<>();
        if (ctx == null) {
            return statements;
        }
        for (ParseNode child : ctx.children(ParseNodeKind.STATEMENT)) {
            Statement statement = statement(child);
            if (statement != null) {
                statements.add(statement);
            }
        }
        return statements;
    }

    /**
     * @return the statement, or {@code null} for an empty statement or a define with no name
     */
    private Statement statement(ParseNode ctx) {
        if (ctx.child(ParseNodeKind.EMPTY_STATEMENT) != null) {
            return null;
        }
        for (ParseNodeKind kind : STATEMENT_PROBE_ORDER) {
            ParseNode child = ctx.child(kind);
            if (child != null) {
                return asStatement(visit(child), child);
            }
        }
        throw new AstBuildException("Unrecognized statement at line " + ctx.getStart().line() + ": " + ctx);
    }

    private static Statement asStatement(Node node, ParseNode ctx) {
        if (node == null || node instanceof Statement) {
            return (Statement) node;
        }
        if (node instanceof IncDecExpression incDec) {
            return incDec.toStatement();
        }
        if (node instanceof Expression expression) {
            return new ExpressionStatement(Spans.of(ctx), expression);
        }
        throw new AstBuildException(node.type() + " cannot stand as a statement at line " + ctx.getStart().line());
    }

    private BlockStatement block(ParseNode ctx) {
        return new BlockStatement(Spans.of(ctx), statementList(ctx.child(ParseNodeKind.STATEMENT_LIST)));
    }

    private IfStatement ifStatement(ParseNode ctx) {
        Expression test = expression(firstExpression(ctx));
        List<ParseNode> branches = ctx.children(ParseNodeKind.STATEMENT);
        if (branches.isEmpty()) {
            throw new AstBuildException("if statement without a body at line " + ctx.getStart().line());
        }
        Statement consequent = statement(branches.get(0));
        Statement alternate = branches.size() > 1 ? statement(branches.get(1)) : null;
        return new IfStatement(Spans.of(ctx), test, consequent, alternate);
    }

    /**
     * {@code for (init; test; update) body}: the semicolons split the header, so each part is
     * found by its position relative to them.
     */
    private ForStatement forStatement(ParseNode ctx) {
        Statement init = null;
        Expression test = null;
        List<ParseNode> trailing = new ArrayList<>(2);
        int semicolons = 0;
        for (ParseTree child : ctx.children()) {
            if (child instanceof TerminalNode terminal) {
                if (terminal.type() == TokenType.SEMICOLON) {
                    semicolons++;
                }
                continue;
            }
            ParseNode node = (ParseNode) child;
            if (semicolons == 0) {
                init = asStatement(visit(node), node);
            } else if (semicolons == 1 && isExpression(node)) {
                test = expression(node);
            } else if (node.kind() == ParseNodeKind.STATEMENT) {
                trailing.add(node);
            }
        }
        if (trailing.isEmpty()) {
            throw new AstBuildException("for statement without a body at line " + ctx.getStart().line());
        }
        Statement update = trailing.size() > 1 ? statement(trailing.get(0)) : null;
        Statement body = statement(trailing.get(trailing.size() - 1));
        return new ForStatement(Spans.of(ctx), init, test, update, body);
    }

    private WithStatement withStatement(ParseNode ctx) {
        Expression test = expression(firstExpression(ctx));
        Statement body = scopes.withScope(ScopeKind.WITH, () -> statement(requireChild(ctx, ParseNodeKind.STATEMENT)));
        return new WithStatement(Spans.of(ctx), test, body);
    }

    private SwitchStatement switchStatement(ParseNode ctx) {
        Expression discriminant = expression(firstExpression(ctx));
        List<SwitchCase> cases = new ArrayList<>();
        for (ParseNode part : requireChild(ctx, ParseNodeKind.CASE_BLOCK).nodeChildren()) {
            if (part.kind() == ParseNodeKind.CASE_CLAUSES) {
                for (ParseNode clause : part.children(ParseNodeKind.CASE_CLAUSE)) {
                    cases.add(new SwitchCase(Spans.of(clause), expression(firstExpression(clause)), caseBody(clause)));
                }
            } else if (part.kind() == ParseNodeKind.DEFAULT_CLAUSE) {
                cases.add(new SwitchCase(Spans.of(part), null, caseBody(part)));
            }
        }
        return new SwitchStatement(Spans.of(ctx), discriminant, cases);
    }

    private List<Statement> caseBody(ParseNode clause) {
        ParseNode statements = clause.child(ParseNodeKind.STATEMENT_LIST);
        return statements != null ? statementList(statements) : null;
    }

    private TryStatement tryStatement(ParseNode ctx) {
        CatchClause handler = null;
        Finalizer finalizer = null;
        ParseNode catchCtx = ctx.child(ParseNodeKind.CATCH_PRODUCTION);
        if (catchCtx != null) {
            handler = catchClause(catchCtx);
        }
        ParseNode finallyCtx = ctx.child(ParseNodeKind.FINALLY_PRODUCTION);
        if (finallyCtx != null) {
            finalizer = new Finalizer(Spans.of(finallyCtx), statement(requireChild(finallyCtx, ParseNodeKind.STATEMENT)));
        }
        Statement block = statement(requireChild(ctx, ParseNodeKind.STATEMENT));
        return new TryStatement(Spans.of(ctx), block, handler, finalizer);
    }

    private CatchClause catchClause(ParseNode ctx) {
        Identifier[] param = new Identifier[1];
        Statement body = scopes.withScope(ScopeKind.CATCH, () -> {
            ParseNode identifierCtx = ctx.child(ParseNodeKind.IDENTIFIER);
            if (identifierCtx != null) {
                param[0] = scopes.withRole(IdentifierRole.declaration(RoleKind.PARAMETER), () -> identifier(identifierCtx));
            }
            return statement(requireChild(ctx, ParseNodeKind.STATEMENT));
        });
        return new CatchClause(Spans.of(ctx), param[0], body);
    }

    private ReturnStatement returnStatement(ParseNode ctx) {
        ParseNode argument = optionalExpression(ctx);
        return new ReturnStatement(Spans.of(ctx), argument != null ? expression(argument) : null);
    }

    // ========================================================================
    // Declarations and assignments
    // ========================================================================

    private AssignmentExpression assignmentExpression(ParseNode ctx) {
        String operator = requireChild(ctx, ParseNodeKind.ASSIGNMENT_OPERATOR).getText();
        if (":=".equals(operator)) {
            operator = "=";
        }
        Expression left = lValueExpression(requireChild(ctx, ParseNodeKind.LVALUE_EXPRESSION));
        Expression right = expression(firstExpression(ctx));
        return new AssignmentExpression(Spans.of(ctx), operator, left, right);
    }

    private VariableDeclaration variableDeclarationList(ParseNode ctx) {
        List<VariableDeclarator> declarations = new ArrayList<>();
        for (ParseNode declaration : ctx.children(ParseNodeKind.VARIABLE_DECLARATION)) {
            declarations.add(variableDeclaration(declaration));
        }
        ParseNode modifier = requireChild(ctx, ParseNodeKind.VAR_MODIFIER);
        String kind = modifier.token(TokenType.STATIC) != null ? "static" : "var";
        return new VariableDeclaration(Spans.of(ctx), declarations, kind);
    }

    /**
     * The initializer is built before the name is declared, so {@code var x = x + 1} reads
     * the outer {@code x}.
     */
    private VariableDeclarator variableDeclaration(ParseNode ctx) {
        ParseNode initCtx = optionalExpression(ctx);
        Expression init = initCtx != null ? expression(initCtx) : null;
        Identifier id = scopes.withRole(IdentifierRole.declaration(RoleKind.VARIABLE),
            () -> identifier(requireChild(ctx, ParseNodeKind.IDENTIFIER)));
        return new VariableDeclarator(Spans.of(ctx), id, init);
    }

    private GlobalVarStatement globalVarStatement(ParseNode ctx) {
        List<VariableDeclarator> declarations = new ArrayList<>();
        for (ParseNode identifierCtx : ctx.children(ParseNodeKind.IDENTIFIER)) {
            Identifier id = scopes.withRole(IdentifierRole.globalDeclaration(RoleKind.VARIABLE),
                () -> identifier(identifierCtx));
            globals.markGlobalIdentifier(id);
            declarations.add(new VariableDeclarator(Spans.of(identifierCtx), id, null));
        }
        return new GlobalVarStatement(Spans.of(ctx), declarations, "globalvar");
    }

    private Statement functionDeclaration(ParseNode ctx) {
        String id = null;
        Span idLocation = null;
        Token name = ctx.token(TokenType.IDENTIFIER);
        if (name != null) {
            id = name.text();
            idLocation = Spans.identifierLocation(name);
        }

        ParseNode parameterList = requireChild(ctx, ParseNodeKind.PARAMETER_LIST);
        List<ParseNode> parameterCtxs = parameterList.children(ParseNodeKind.PARAMETER_ARGUMENT);
        boolean hasTrailingComma = hasTrailingComma(parameterList.tokens(TokenType.COMMA).size(), parameterCtxs.size());

        List<Expression> params = new ArrayList<>();
        BlockStatement body = scopes.withScope(ScopeKind.FUNCTION, () -> {
            for (ParseNode parameter : parameterCtxs) {
                params.add(parameterArgument(parameter));
            }
            return block(requireChild(ctx, ParseNodeKind.BLOCK));
        });

        ParseNode constructorClause = ctx.child(ParseNodeKind.CONSTRUCTOR_CLAUSE);
        if (constructorClause != null) {
            return new ConstructorDeclaration(Spans.of(ctx), id, idLocation, params,
                constructorParent(constructorClause), body, hasTrailingComma);
        }
        return new FunctionDeclaration(Spans.of(ctx), id, idLocation, params, body, hasTrailingComma);
    }

    private Expression parameterArgument(ParseNode ctx) {
        Identifier left = scopes.withRole(IdentifierRole.declaration(RoleKind.PARAMETER),
            () -> identifier(requireChild(ctx, ParseNodeKind.IDENTIFIER)));
        ParseNode defaultValue = optionalExpression(ctx);
        if (defaultValue == null) {
            return left;
        }
        return new DefaultParameter(Spans.of(ctx), left, expression(defaultValue));
    }

    /**
     * {@code : Parent(args) constructor}. A bare {@code constructor} has no parent clause.
     * A trailing comma in the parent's arguments is recorded as a flag rather than a
     * missing argument.
     */
    private ConstructorParentClause constructorParent(ParseNode ctx) {
        Token parent = ctx.token(TokenType.IDENTIFIER);
        String id = null;
        if (parent != null) {
            id = parent.text();
            recordTypeReference(parent);
        }

        List<Expression> params = new ArrayList<>();
        boolean hasTrailingComma = false;
        ParseNode argumentsCtx = ctx.child(ParseNodeKind.ARGUMENTS);
        if (argumentsCtx != null) {
            params = arguments(argumentsCtx);
            hasTrailingComma = argumentsCtx.child(ParseNodeKind.TRAILING_COMMA) != null;
            if (hasTrailingComma && !params.isEmpty()
                && params.get(params.size() - 1) instanceof MissingOptionalArgument) {
                params.remove(params.size() - 1);
            }
        }

        if (id == null && params.isEmpty()) {
            return null;
        }
        return new ConstructorParentClause(Spans.of(ctx), id, params, hasTrailingComma);
    }

    /**
     * The parent constructor's name stays a plain string in the AST, but the scope tracker
     * still sees it as a reference to a type.
     */
    private void recordTypeReference(Token token) {
        if (!scopes.isEnabled()) {
            return;
        }
        Identifier reference = new Identifier(Spans.of(token), token.text());
        scopes.withRole(IdentifierRole.reference(RoleKind.TYPE), () -> {
            scopes.applyCurrentRole(reference);
            return reference;
        });
    }

    private EnumDeclaration enumeratorDeclaration(ParseNode ctx) {
        Identifier name = scopes.withRole(IdentifierRole.declaration(RoleKind.ENUM),
            () -> identifier(requireChild(ctx, ParseNodeKind.IDENTIFIER)));
        List<EnumMember> members = new ArrayList<>();
        boolean hasTrailingComma = false;
        ParseNode list = ctx.child(ParseNodeKind.ENUMERATOR_LIST);
        if (list != null) {
            for (ParseNode enumerator : list.children(ParseNodeKind.ENUMERATOR)) {
                members.add(enumerator(enumerator));
            }
            hasTrailingComma = hasTrailingComma(list.tokens(TokenType.COMMA).size(), members.size());
        }
        return new EnumDeclaration(Spans.of(ctx), name, members, hasTrailingComma);
    }

    private EnumMember enumerator(ParseNode ctx) {
        Expression initializer = null;
        String initializerText = null;
        ParseNode initializerCtx = optionalExpression(ctx);
        if (initializerCtx != null) {
            initializer = expression(initializerCtx);
            if (!(initializer instanceof Literal)) {
                initializerText = initializerCtx.getText().trim();
            }
        }
        Identifier name = scopes.withRole(IdentifierRole.declaration(RoleKind.ENUM_MEMBER),
            () -> identifier(requireChild(ctx, ParseNodeKind.IDENTIFIER)));
        return new EnumMember(Spans.of(ctx), name, initializer, initializerText);
    }

    private MacroDeclaration macroStatement(ParseNode ctx) {
        Identifier name = scopes.withRole(IdentifierRole.globalDeclaration(RoleKind.MACRO),
            () -> identifier(requireChild(ctx, ParseNodeKind.IDENTIFIER)));
        globals.markGlobalIdentifier(name);
        List<String> tokens = new ArrayList<>();
        for (ParseNode token : ctx.children(ParseNodeKind.MACRO_TOKEN)) {
            tokens.add(token.getText());
        }
        return new MacroDeclaration(Spans.of(ctx), name, tokens);
    }

    /**
     * {@code #define} is legacy syntax; its text is mapped onto the directive it stands in
     * for. Returns {@code null} when the text names nothing.
     */
    private DefineStatement defineStatement(ParseNode ctx) {
        Token characters = ctx.token(TokenType.REGION_CHARACTERS);
        String rawText = characters != null ? characters.text() : "";
        if (rawText.trim().isEmpty()) {
            return null;
        }

        Matcher region = DEFINE_REGION.matcher(rawText);
        if (region.matches()) {
            return new DefineStatement(Spans.of(ctx), rawText, "#region", region.group(1));
        }
        Matcher endRegion = DEFINE_END_REGION.matcher(rawText);
        if (endRegion.matches()) {
            return new DefineStatement(Spans.of(ctx), rawText, "#endregion", endRegion.group(1));
        }
        if (DEFINE_MACRO_NAME.matcher(rawText).lookingAt()) {
            return new DefineStatement(Spans.of(ctx), rawText, "#macro", rawText);
        }
        log.debug("Dropping #define with unrecognized text '{}' at line {}", rawText, ctx.getStart().line());
        return null;
    }

    private Statement regionStatement(ParseNode ctx) {
        Token characters = ctx.token(TokenType.REGION_CHARACTERS);
        String name = characters != null ? characters.text() : null;
        if (ctx.token(TokenType.REGION) != null) {
            return new RegionStatement(Spans.of(ctx), name);
        }
        return new EndRegionStatement(Spans.of(ctx), name);
    }

    // ========================================================================
    // L-values, calls and increments
    // ========================================================================

    /**
     * Builds the chain left to right: the start expression, then each dot, index or call
     * operator applied to everything before it.
     */
    private Expression lValueExpression(ParseNode ctx) {
        List<ParseNode> parts = ctx.nodeChildren();
        if (parts.isEmpty()) {
            throw new AstBuildException("Empty l-value at line " + ctx.getStart().line());
        }
        Expression object = lValueStart(parts.get(0));
        for (ParseNode operator : parts.subList(1, parts.size())) {
            Expression link = chainLink(operator, object);
            if (link == null) {
                log.debug("Skipping {} in l-value chain at line {}", operator.kind(), operator.getStart().line());
                continue;
            }
            object = link;
        }
        return object;
    }

    private Expression lValueStart(ParseNode ctx) {
        return switch (ctx.kind()) {
            case IDENTIFIER_LVALUE -> identifier(requireChild(ctx, ParseNodeKind.IDENTIFIER));
            case NEW_LVALUE -> newExpression(requireChild(ctx, ParseNodeKind.NEW_EXPRESSION));
            default -> throw new AstBuildException("Unexpected l-value start " + ctx.kind() + " at line "
                + ctx.getStart().line());
        };
    }

    /**
     * One chain operator applied to {@code object}. The link spans from the object's start
     * to the operator's end, so it always encloses its object.
     *
     * @return the link, or {@code null} for a context that is not a chain operator
     */
    private Expression chainLink(ParseNode operator, Expression object) {
        Span span = Spans.between(object.start(), Spans.of(operator).end());
        return switch (operator.kind()) {
            case MEMBER_DOT_LVALUE, MEMBER_DOT_LVALUE_FINAL -> new MemberDotExpression(span, object,
                propertyIdentifier(requireChild(operator, ParseNodeKind.IDENTIFIER)));
            case MEMBER_INDEX_LVALUE, MEMBER_INDEX_LVALUE_FINAL -> new MemberIndexExpression(span, object,
                expressionSequence(requireChild(operator, ParseNodeKind.EXPRESSION_SEQUENCE)),
                requireChild(operator, ParseNodeKind.ACCESSOR).getText());
            case CALL_LVALUE -> new CallExpression(span, object,
                arguments(requireChild(operator, ParseNodeKind.ARGUMENTS)));
            default -> null;
        };
    }

    private CallExpression callStatement(ParseNode ctx) {
        ParseNode inner = ctx.child(ParseNodeKind.CALL_STATEMENT);
        Expression object = inner != null
            ? callStatement(inner)
            : callableExpression(requireChild(ctx, ParseNodeKind.CALLABLE_EXPRESSION));
        return new CallExpression(Spans.of(ctx), object, arguments(requireChild(ctx, ParseNodeKind.ARGUMENTS)));
    }

    /**
     * The callee of a call: an l-value chain, or a parenthesized expression as in
     * {@code (handler)(event)}.
     */
    private Expression callableExpression(ParseNode ctx) {
        ParseNode lValue = ctx.child(ParseNodeKind.LVALUE_EXPRESSION);
        if (lValue != null) {
            return lValueExpression(lValue);
        }
        return new ParenthesizedExpression(Spans.of(ctx), expression(firstExpression(ctx)), false);
    }

    private NewExpression newExpression(ParseNode ctx) {
        ParseNode typeName = ctx.child(ParseNodeKind.IDENTIFIER);
        Identifier expression = typeName == null ? null
            : scopes.withRole(IdentifierRole.reference(RoleKind.TYPE), () -> identifier(typeName));
        return new NewExpression(Spans.of(ctx), expression, arguments(requireChild(ctx, ParseNodeKind.ARGUMENTS)));
    }

    /**
     * Always the expression form; statement positions retag it with
     * {@link IncDecExpression#toStatement()}.
     */
    private IncDecExpression incDec(ParseNode ctx) {
        Token operator = ctx.token(TokenType.PLUS_PLUS);
        if (operator == null) {
            operator = ctx.token(TokenType.MINUS_MINUS);
        }
        if (operator == null) {
            throw new AstBuildException("Increment without an operator at line " + ctx.getStart().line());
        }
        boolean prefix = ctx.kind() == ParseNodeKind.PRE_INC_DEC_STATEMENT;
        Expression argument = lValueExpression(requireChild(ctx, ParseNodeKind.LVALUE_EXPRESSION));
        return new IncDecExpression(Spans.of(ctx), operator.text(), prefix, argument);
    }

    /**
     * Call arguments. A leading comma, an empty slot between commas and a trailing comma
     * each produce a {@link MissingOptionalArgument} at their own position.
     */
    private List<Expression> arguments(ParseNode ctx) {
        List<Expression> arguments = new ArrayList<>();
        ParseNode list = ctx.child(ParseNodeKind.ARGUMENT_LIST);
        if (list != null) {
            List<ParseTree> children = list.children();
            if (!children.isEmpty() && children.get(0) instanceof TerminalNode leadingComma) {
                arguments.add(new MissingOptionalArgument(Spans.of(leadingComma.token())));
            }
            for (ParseNode argument : list.children(ParseNodeKind.ARGUMENT)) {
                ParseNode value = optionalExpression(argument);
                arguments.add(value != null ? expression(value) : new MissingOptionalArgument(Spans.of(argument)));
            }
        }
        ParseNode trailingComma = ctx.child(ParseNodeKind.TRAILING_COMMA);
        if (trailingComma != null) {
            arguments.add(new MissingOptionalArgument(Spans.of(trailingComma)));
        }
        return arguments;
    }

    private List<Expression> expressionSequence(ParseNode ctx) {
        List<Expression> expressions = new ArrayList<>();
        for (ParseNode child : ctx.nodeChildren()) {
            if (isExpression(child)) {
                expressions.add(expression(child));
            }
        }
        return expressions;
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private TernaryExpression ternaryExpression(ParseNode ctx) {
        List<ParseNode> parts = expressionChildren(ctx);
        if (parts.size() != 3) {
            throw new AstBuildException("Ternary expression with " + parts.size() + " operands at line "
                + ctx.getStart().line());
        }
        return new TernaryExpression(Spans.of(ctx),
            expression(parts.get(0)), expression(parts.get(1)), expression(parts.get(2)));
    }

    private UnaryExpression unaryExpression(ParseNode ctx, String operator) {
        return new UnaryExpression(Spans.of(ctx), operator, true, expression(firstExpression(ctx)));
    }

    /**
     * {@code (expr).name}. The node starts where its object starts.
     */
    private MemberDotExpression memberDotExpression(ParseNode ctx) {
        Expression object = expression(firstExpression(ctx));
        Identifier property = propertyIdentifier(requireChild(ctx, ParseNodeKind.IDENTIFIER));
        Span span = Spans.of(ctx);
        return new MemberDotExpression(Spans.between(object.start(), span.end()), object, property);
    }

    private Identifier propertyIdentifier(ParseNode ctx) {
        return scopes.withRole(IdentifierRole.reference(RoleKind.PROPERTY), () -> identifier(ctx));
    }

    private Identifier identifier(ParseNode ctx) {
        Identifier node = new Identifier(Spans.of(ctx), ctx.getText());
        globals.applyGlobalIdentifiersToNode(node);
        scopes.applyCurrentRole(node);
        return node;
    }

    // ========================================================================
    // Literals
    // ========================================================================

    private Expression literal(ParseNode ctx) {
        ParseNode structured = ctx.nodeChildren().isEmpty() ? null : ctx.nodeChildren().get(0);
        if (structured == null) {
            return new Literal(Spans.of(ctx), ctx.getText());
        }
        return switch (structured.kind()) {
            case ARRAY_LITERAL -> arrayLiteral(structured);
            case STRUCT_LITERAL -> structLiteral(structured);
            case TEMPLATE_STRING_LITERAL -> templateStringLiteral(structured);
            default -> throw new AstBuildException("Unexpected literal " + structured.kind() + " at line "
                + structured.getStart().line());
        };
    }

    private ArrayExpression arrayLiteral(ParseNode ctx) {
        ParseNode elementList = requireChild(ctx, ParseNodeKind.ELEMENT_LIST);
        List<Expression> elements = expressionSequence(elementList);
        boolean hasTrailingComma = hasTrailingComma(elementList.tokens(TokenType.COMMA).size(), elements.size());
        return new ArrayExpression(Spans.of(ctx), elements, hasTrailingComma);
    }

    private StructExpression structLiteral(ParseNode ctx) {
        List<ParseNode> assignments = ctx.children(ParseNodeKind.PROPERTY_ASSIGNMENT);
        List<Property> properties = scopes.withScope(ScopeKind.STRUCT, () -> {
            List<Property> built = new ArrayList<>(assignments.size());
            for (ParseNode assignment : assignments) {
                built.add(new Property(Spans.of(assignment),
                    requireChild(assignment, ParseNodeKind.PROPERTY_IDENTIFIER).getText(),
                    expression(firstExpression(assignment))));
            }
            return built;
        });
        boolean hasTrailingComma = hasTrailingComma(ctx.tokens(TokenType.COMMA).size(), properties.size());
        return new StructExpression(Spans.of(ctx), properties, hasTrailingComma);
    }

    private TemplateStringExpression templateStringLiteral(ParseNode ctx) {
        List<Node> atoms = new ArrayList<>();
        for (ParseNode atom : ctx.children(ParseNodeKind.TEMPLATE_STRING_ATOM)) {
            Token text = atom.token(TokenType.TEMPLATE_STRING_TEXT);
            if (text != null) {
                atoms.add(new TemplateStringText(Spans.of(text), text.text()));
            } else {
                atoms.add(expression(firstExpression(atom)));
            }
        }
        return new TemplateStringExpression(Spans.of(ctx), atoms);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static boolean hasTrailingComma(int commas, int items) {
        return commas > 0 && commas == items;
    }

    private static List<ParseNode> expressionChildren(ParseNode ctx) {
        List<ParseNode> expressions = new ArrayList<>();
        for (ParseNode child : ctx.nodeChildren()) {
            if (isExpression(child)) {
                expressions.add(child);
            }
        }
        return expressions;
    }

    private static ParseNode optionalExpression(ParseNode ctx) {
        for (ParseNode child : ctx.nodeChildren()) {
            if (isExpression(child)) {
                return child;
            }
        }
        return null;
    }

    private static ParseNode firstExpression(ParseNode ctx) {
        ParseNode expression = optionalExpression(ctx);
        if (expression == null) {
            throw new AstBuildException("Missing expression in " + ctx.kind() + " at line " + ctx.getStart().line());
        }
        return expression;
    }

    private static ParseNode requireChild(ParseNode ctx, ParseNodeKind kind) {
        ParseNode child = ctx.child(kind);
        if (child == null) {
            throw new AstBuildException("Missing " + kind + " in " + ctx.kind() + " at line " + ctx.getStart().line());
        }
        return child;
    }

    private static ParseNode requireOneOf(ParseNode ctx, ParseNodeKind first, ParseNodeKind second) {
        ParseNode child = ctx.child(first);
        return child != null ? child : requireChild(ctx, second);
    }

    private static void requireKind(ParseNode ctx, ParseNodeKind kind) {
        if (ctx == null || ctx.kind() != kind) {
            throw new AstBuildException("Expected a " + kind + " context but got " + (ctx == null ? "null" : ctx.kind()));
        }
    }
}
