package com.gmlparser.ast;

/**
 * A comment from the hidden channel. Comments are not part of the statement tree; they are
 * collected in source order and merged by position downstream.
 *
 * <p>The trailing fields are filled in as the hidden-token classifier sees later tokens,
 * hence the setters.</p>
 */
public abstract sealed class Comment implements Node permits CommentLine, CommentBlock {
    private final Location start;
    private final Location end;
    private final String value;
    private String leadingWS = "";
    private String trailingWS = "";
    private String leadingChar = "";
    private String trailingChar = "";
    private boolean isTopComment;
    private boolean isBottomComment;

    protected Comment(Location start, Location end, String value) {
        this.start = start;
        this.end = end;
        this.value = value;
    }

    @Override
    public Location start() {
        return start;
    }

    @Override
    public Location end() {
        return end;
    }

    /**
     * Comment text without its delimiters.
     */
    public String value() {
        return value;
    }

    public String leadingWS() {
        return leadingWS;
    }

    public void setLeadingWS(String leadingWS) {
        this.leadingWS = leadingWS;
    }

    public String trailingWS() {
        return trailingWS;
    }

    public void setTrailingWS(String trailingWS) {
        this.trailingWS = trailingWS;
    }

    public String leadingChar() {
        return leadingChar;
    }

    public void setLeadingChar(String leadingChar) {
        this.leadingChar = leadingChar;
    }

    public String trailingChar() {
        return trailingChar;
    }

    public void setTrailingChar(String trailingChar) {
        this.trailingChar = trailingChar;
    }

    public boolean isTopComment() {
        return isTopComment;
    }

    public void setTopComment(boolean topComment) {
        isTopComment = topComment;
    }

    public boolean isBottomComment() {
        return isBottomComment;
    }

    public void setBottomComment(boolean bottomComment) {
        isBottomComment = bottomComment;
    }

    @Override
    public String toString() {
        return type() + "[" + value + "]";
    }
}
