package com.gmlparser.grammar;

public record TerminalNode(Token token) implements ParseTree {

    @Override
    public Token getStart() {
        return token;
    }

    @Override
    public Token getStop() {
        return token;
    }

    @Override
    public String getText() {
        return token.text();
    }

    public TokenType type() {
        return token.type();
    }
}
