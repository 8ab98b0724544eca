package com.gmlparser.grammar;

/**
 * Hand-built parse trees for shapes the parser itself never produces.
 */
public final class ParseTrees {

    private ParseTrees() {
    }

    public static Token token(TokenType type, String text, int index) {
        return new Token(type, text, 1, index, index, index + text.length() - 1);
    }

    public static TerminalNode terminal(TokenType type, String text, int index) {
        return new TerminalNode(token(type, text, index));
    }

    /**
     * Adopts {@code children} in order; start and stop come from the first and last child.
     */
    public static ParseNode node(ParseNodeKind kind, ParseTree... children) {
        ParseNode node = new ParseNode(kind, null);
        for (ParseTree child : children) {
            node.addChild(child);
            if (child instanceof ParseNode nested) {
                nested.setParent(node);
            }
        }
        if (children.length > 0) {
            node.setStart(children[0].getStart());
            node.setStop(children[children.length - 1].getStop());
        }
        return node;
    }

    public static ParseNode integerLiteral(String text, int index) {
        return node(ParseNodeKind.LITERAL_EXPRESSION,
            node(ParseNodeKind.LITERAL, terminal(TokenType.INTEGER_LITERAL, text, index)));
    }
}
