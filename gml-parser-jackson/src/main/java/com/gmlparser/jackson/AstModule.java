package com.gmlparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.gmlparser.ast.*;
import com.gmlparser.jackson.mixins.CommentMixin;
import com.gmlparser.jackson.mixins.IdentifierMixin;
import com.gmlparser.jackson.mixins.LocationMixin;
import com.gmlparser.jackson.mixins.NodeMixin;

import java.util.List;

/**
 * Jackson module that configures serialization/deserialization for the GML AST.
 *
 * This module handles:
 * - Polymorphic node types via the "type" property (see NodeMixin)
 * - Locations as {line, index} objects
 * - The hand-written classes (Identifier, Location, comments) that have no record components
 * - Nullable fields that downstream printers expect to see as explicit nulls
 */
public class AstModule extends SimpleModule {

    // Every concrete node kind; the type id is the simple class name, same as Node.type()
    static final List<Class<? extends Node>> NODE_TYPES = List.of(
        Program.class,
        ArrayExpression.class, AssignmentExpression.class, BinaryExpression.class, BlockStatement.class,
        BreakStatement.class, CallExpression.class, CatchClause.class, CommentBlock.class, CommentLine.class,
        ConstructorDeclaration.class, ConstructorParentClause.class, ContinueStatement.class,
        DefaultParameter.class, DefineStatement.class, DeleteStatement.class, DoUntilStatement.class,
        EndRegionStatement.class, EnumDeclaration.class, EnumMember.class, ExitStatement.class,
        ExpressionStatement.class, Finalizer.class, ForStatement.class, FunctionDeclaration.class,
        GlobalVarStatement.class, Identifier.class, IdentifierStatement.class, IfStatement.class,
        IncDecExpression.class, IncDecStatement.class, Literal.class, MacroDeclaration.class,
        MemberDotExpression.class, MemberIndexExpression.class, MissingOptionalArgument.class,
        NewExpression.class, ParenthesizedExpression.class, Property.class, RegionStatement.class,
        RepeatStatement.class, ReturnStatement.class, StructExpression.class, SwitchCase.class,
        SwitchStatement.class, TemplateStringExpression.class, TemplateStringText.class,
        TernaryExpression.class, ThrowStatement.class, TryStatement.class, UnaryExpression.class,
        VariableDeclaration.class, VariableDeclarator.class, WhileStatement.class, Whitespace.class,
        WithStatement.class
    );

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.gmlparser", "gml-parser-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Polymorphic type handling
        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        for (Class<? extends Node> type : NODE_TYPES) {
            context.registerSubtypes(new NamedType(type, type.getSimpleName()));
        }

        context.setMixInAnnotations(Location.class, LocationMixin.class);
        context.setMixInAnnotations(Identifier.class, IdentifierMixin.class);
        context.setMixInAnnotations(Comment.class, CommentMixin.class);
        context.setMixInAnnotations(CommentLine.class, CommentMixin.LineMixin.class);
        context.setMixInAnnotations(CommentBlock.class, CommentMixin.BlockMixin.class);
        context.setMixInAnnotations(Whitespace.class, WhitespaceMixin.class);

        // Null fields that are written anyway
        context.setMixInAnnotations(IfStatement.class, IfStatementMixin.class);
        context.setMixInAnnotations(SwitchCase.class, SwitchCaseMixin.class);
        context.setMixInAnnotations(ReturnStatement.class, ReturnStatementMixin.class);
        context.setMixInAnnotations(VariableDeclarator.class, VariableDeclaratorMixin.class);
        context.setMixInAnnotations(ForStatement.class, ForStatementMixin.class);
        context.setMixInAnnotations(TryStatement.class, TryStatementMixin.class);
        context.setMixInAnnotations(FunctionDeclaration.class, FunctionIdMixin.class);
        context.setMixInAnnotations(ConstructorDeclaration.class, FunctionIdMixin.class);
    }

    // ==================== Serialization Mixins ====================

    // Keep the "is" prefix; bean naming would shorten it to "newline"
    private abstract static class WhitespaceMixin {
        @JsonProperty("isNewline")
        abstract boolean isNewline();
    }

    // Mixin for IfStatement - alternate should be included even when null
    private abstract static class IfStatementMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Statement alternate();
    }

    // null test marks the default clause
    private abstract static class SwitchCaseMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression test();
    }

    private abstract static class ReturnStatementMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression argument();
    }

    private abstract static class VariableDeclaratorMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression init();
    }

    // Mixin for ForStatement - init, test, update should be included even when null
    private abstract static class ForStatementMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Statement init();

        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression test();

        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Statement update();
    }

    private abstract static class TryStatementMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract CatchClause handler();

        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Finalizer finalizer();
    }

    // Anonymous functions and constructors keep an explicit null id
    private abstract static class FunctionIdMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract String id();
    }
}
