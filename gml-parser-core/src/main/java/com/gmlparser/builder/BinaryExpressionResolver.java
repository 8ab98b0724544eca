package com.gmlparser.builder;

import com.gmlparser.ast.BinaryExpression;
import com.gmlparser.ast.Expression;
import com.gmlparser.ast.Location;
import com.gmlparser.ast.ParenthesizedExpression;
import com.gmlparser.ast.Span;
import com.gmlparser.diagnostics.AstBuildException;
import com.gmlparser.grammar.OperatorTable;
import com.gmlparser.grammar.ParseNode;
import com.gmlparser.grammar.ParseNodeKind;
import com.gmlparser.grammar.ParseTree;
import com.gmlparser.grammar.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Builds {@link BinaryExpression} trees from nested binary parse contexts.
 *
 * <p>Operands that are binary contexts themselves are resolved here, one level down and
 * marked embedded; every other operand goes back through the builder. An embedded node whose
 * operands would regroup when printed without parentheses is wrapped in a synthetic
 * {@link ParenthesizedExpression}, so printers never have to re-derive grouping.</p>
 */
public class BinaryExpressionResolver {
    private static final Logger log = LoggerFactory.getLogger(BinaryExpressionResolver.class);

    private final Function<ParseNode, Expression> visitor;

    public BinaryExpressionResolver(Function<ParseNode, Expression> visitor) {
        this.visitor = visitor;
    }

    /**
     * @return the expression, or {@code null} for a context with no operands
     */
    public Expression handle(ParseNode ctx, boolean embedded) {
        List<ParseNode> operands = operands(ctx);
        switch (operands.size()) {
            case 0:
                log.debug("Binary expression without operands: {}", ctx);
                return null;
            case 1:
                return visitor.apply(operands.get(0));
            case 2:
                break;
            default:
                log.debug("Folding {} operands of binary expression at line {}", operands.size(), ctx.getStart().line());
                return fold(ctx, operands, embedded);
        }

        String operator = operatorText(ctx);
        Expression left = resolve(operands.get(0));
        Expression right = resolve(operands.get(1));
        Span span = Spans.of(ctx);
        BinaryExpression node = new BinaryExpression(span, operator, left, right);

        if (embedded && needsParentheses(operator, left, right)) {
            return new ParenthesizedExpression(Spans.copyOf(span), node, true);
        }
        return node;
    }

    /**
     * Builds {@code ((a op b) op c) ...}, pairing each operand with the operator token before
     * it; operands without one reuse the last operator seen.
     */
    private Expression fold(ParseNode ctx, List<ParseNode> operands, boolean embedded) {
        List<String> operators = operatorTexts(ctx);
        if (operators.isEmpty()) {
            throw noOperator(ctx);
        }
        Location start = Spans.of(operands.get(0)).start();
        Expression result = resolve(operands.get(0));
        for (int i = 1; i < operands.size(); i++) {
            String operator = operators.get(Math.min(i - 1, operators.size() - 1));
            Expression right = resolve(operands.get(i));
            Span span = Spans.between(start, Spans.of(operands.get(i)).end());
            BinaryExpression node = new BinaryExpression(span, operator, result, right);
            boolean nested = i < operands.size() - 1 || embedded;
            result = nested && needsParentheses(operator, result, right)
                ? new ParenthesizedExpression(Spans.copyOf(span), node, true)
                : node;
        }
        return result;
    }

    /**
     * Left-associative operators need grouping when an operand binds strictly looser,
     * right-associative ones when it binds looser or the same. Anything that is not a
     * binary expression never does.
     */
    static boolean needsParentheses(String operator, Expression left, Expression right) {
        OperatorTable.Operator current = OperatorTable.lookup(operator);
        if (current == null) {
            return false;
        }
        return needsParentheses(current, left) || needsParentheses(current, right);
    }

    private static boolean needsParentheses(OperatorTable.Operator current, Expression operand) {
        if (!(operand instanceof BinaryExpression binary)) {
            return false;
        }
        int precedence = OperatorTable.precedenceOf(binary.operator());
        return current.isRightAssociative()
            ? precedence <= current.precedence()
            : precedence < current.precedence();
    }

    private Expression resolve(ParseNode operand) {
        if (operand.kind() == ParseNodeKind.BINARY_EXPRESSION) {
            return handle(operand, true);
        }
        return visitor.apply(operand);
    }

    private static List<ParseNode> operands(ParseNode ctx) {
        List<ParseNode> operands = new ArrayList<>(2);
        for (ParseNode child : ctx.nodeChildren()) {
            if (GmlAstBuilder.isExpression(child)) {
                operands.add(child);
            }
        }
        return operands;
    }

    private static List<String> operatorTexts(ParseNode ctx) {
        List<String> operators = new ArrayList<>();
        for (ParseTree child : ctx.children()) {
            if (child instanceof TerminalNode terminal) {
                operators.add(terminal.getText());
            }
        }
        return operators;
    }

    private static String operatorText(ParseNode ctx) {
        List<String> operators = operatorTexts(ctx);
        if (operators.isEmpty()) {
            throw noOperator(ctx);
        }
        return operators.get(0);
    }

    private static AstBuildException noOperator(ParseNode ctx) {
        return new AstBuildException("Binary expression at line " + ctx.getStart().line() + " has no operator");
    }
}
