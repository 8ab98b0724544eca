package com.gmlparser.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A rule context in the parse tree. Children are kept in source order and mix
 * nested rule contexts with matched tokens.
 *
 * <p>The mutators are package-private: only the parser reshapes the tree while it
 * resolves left-recursive and labeled alternatives.</p>
 */
public final class ParseNode implements ParseTree {
    private ParseNodeKind kind;
    private ParseNode parent;
    private final List<ParseTree> children = new ArrayList<>();
    private Token start;
    private Token stop;

    ParseNode(ParseNodeKind kind, ParseNode parent) {
        this.kind = kind;
        this.parent = parent;
    }

    public ParseNodeKind kind() {
        return kind;
    }

    public String ruleName() {
        return kind.ruleName();
    }

    public ParseNode parent() {
        return parent;
    }

    public List<ParseTree> children() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public Token getStart() {
        return start;
    }

    /**
     * Last token consumed by this rule, or {@code null} when the rule matched nothing.
     */
    @Override
    public Token getStop() {
        return stop;
    }

    @Override
    public String getText() {
        StringBuilder sb = new StringBuilder();
        for (ParseTree child : children) {
            sb.append(child.getText());
        }
        return sb.toString();
    }

    // ========================================================================
    // Child lookup
    // ========================================================================

    public ParseNode child(ParseNodeKind childKind) {
        for (ParseTree child : children) {
            if (child instanceof ParseNode node && node.kind == childKind) {
                return node;
            }
        }
        return null;
    }

    public List<ParseNode> children(ParseNodeKind childKind) {
        List<ParseNode> result = new ArrayList<>();
        for (ParseTree child : children) {
            if (child instanceof ParseNode node && node.kind == childKind) {
                result.add(node);
            }
        }
        return result;
    }

    public List<ParseNode> nodeChildren() {
        List<ParseNode> result = new ArrayList<>();
        for (ParseTree child : children) {
            if (child instanceof ParseNode node) {
                result.add(node);
            }
        }
        return result;
    }

    public Token token(TokenType type) {
        for (ParseTree child : children) {
            if (child instanceof TerminalNode terminal && terminal.type() == type) {
                return terminal.token();
            }
        }
        return null;
    }

    public List<Token> tokens(TokenType type) {
        List<Token> result = new ArrayList<>();
        for (ParseTree child : children) {
            if (child instanceof TerminalNode terminal && terminal.type() == type) {
                result.add(terminal.token());
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return kind + "[" + getText() + "]";
    }

    // ========================================================================
    // Parser-side mutation
    // ========================================================================

    void setKind(ParseNodeKind kind) {
        this.kind = kind;
    }

    void setParent(ParseNode parent) {
        this.parent = parent;
    }

    void setStart(Token start) {
        this.start = start;
    }

    void setStop(Token stop) {
        this.stop = stop;
    }

    void addChild(ParseTree child) {
        children.add(child);
    }

    void removeChild(ParseTree child) {
        children.remove(child);
    }

    void replaceChild(ParseTree oldChild, ParseTree newChild) {
        int index = children.indexOf(oldChild);
        if (index < 0) {
            throw new IllegalStateException("Not a child of " + kind + ": " + oldChild);
        }
        children.set(index, newChild);
    }

    List<ParseTree> mutableChildren() {
        return children;
    }
}
