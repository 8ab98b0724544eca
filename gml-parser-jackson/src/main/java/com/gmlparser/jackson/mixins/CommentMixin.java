package com.gmlparser.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.gmlparser.ast.Location;

/**
 * Comment fields, shared by line and block comments. The classifier's annotations
 * are read back through the setters. The type annotation repeats {@link NodeMixin}'s,
 * since a class takes only one mix-in.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonPropertyOrder({"start", "end", "value", "lineCount", "leadingWS", "trailingWS", "leadingChar", "trailingChar",
    "isTopComment", "isBottomComment"})
public abstract class CommentMixin {

    @JsonProperty("start")
    abstract Location start();

    @JsonProperty("end")
    abstract Location end();

    @JsonProperty("value")
    abstract String value();

    @JsonProperty("leadingWS")
    abstract String leadingWS();

    @JsonProperty("leadingWS")
    abstract void setLeadingWS(String leadingWS);

    @JsonProperty("trailingWS")
    abstract String trailingWS();

    @JsonProperty("trailingWS")
    abstract void setTrailingWS(String trailingWS);

    @JsonProperty("leadingChar")
    abstract String leadingChar();

    @JsonProperty("leadingChar")
    abstract void setLeadingChar(String leadingChar);

    @JsonProperty("trailingChar")
    abstract String trailingChar();

    @JsonProperty("trailingChar")
    abstract void setTrailingChar(String trailingChar);

    @JsonProperty("isTopComment")
    abstract boolean isTopComment();

    @JsonProperty("isTopComment")
    abstract void setTopComment(boolean topComment);

    @JsonProperty("isBottomComment")
    abstract boolean isBottomComment();

    @JsonProperty("isBottomComment")
    abstract void setBottomComment(boolean bottomComment);

    public abstract static class LineMixin extends CommentMixin {
        @JsonCreator
        LineMixin(@JsonProperty("start") Location start,
                  @JsonProperty("end") Location end,
                  @JsonProperty("value") String value) {
        }
    }

    public abstract static class BlockMixin extends CommentMixin {
        @JsonCreator
        BlockMixin(@JsonProperty("start") Location start,
                   @JsonProperty("end") Location end,
                   @JsonProperty("value") String value,
                   @JsonProperty("lineCount") int lineCount) {
        }

        @JsonProperty("lineCount")
        abstract int lineCount();
    }
}
