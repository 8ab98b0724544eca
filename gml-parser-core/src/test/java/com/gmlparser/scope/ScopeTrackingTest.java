package com.gmlparser.scope;

import com.gmlparser.GmlParser;
import com.gmlparser.ParseResult;
import com.gmlparser.ParserOptions;
import com.gmlparser.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ScopeTrackingTest {

    private static final ParserOptions TRACKING = ParserOptions.defaults().withScopeTracking(true);

    private static ParseResult.Success track(String source) {
        ParseResult result = GmlParser.tryParse(source, TRACKING);
        return assertInstanceOf(ParseResult.Success.class, result);
    }

    private static List<Statement> body(String source) {
        return track(source).program().body();
    }

    @Test
    void testDeclarationAndResolvedReference() {
        List<Statement> body = body("var a = 1;\nb = a;");
        Identifier declared = ((VariableDeclaration) body.get(0)).declarations().get(0).id();
        AssignmentExpression assignment = (AssignmentExpression) body.get(1);
        Identifier target = (Identifier) assignment.left();
        Identifier used = (Identifier) assignment.right();

        assertEquals("scope-0", declared.scopeId());
        assertEquals(List.of("identifier", "declaration", "variable"), declared.classifications());
        assertEquals(new DeclarationRef("scope-0", new Location(1, 4), new Location(1, 4)), declared.declaration());

        assertEquals(List.of("identifier", "reference", "variable"), used.classifications());
        assertEquals(declared.declaration(), used.declaration());

        assertEquals(List.of("identifier", "reference"), target.classifications(), "unresolved name gets no kind");
        assertNull(target.declaration());
    }

    @Test
    void testDeclarationRefIsACopy() {
        List<Statement> body = body("var a = 1;");
        Identifier declared = ((VariableDeclaration) body.get(0)).declarations().get(0).id();
        assertNotSame(declared.start(), declared.declaration().start());
    }

    @Test
    void testParametersAreScopedToTheirFunction() {
        FunctionDeclaration function = (FunctionDeclaration) body("function f(p) { return p; }").get(0);
        Identifier param = (Identifier) function.params().get(0);
        Identifier use = (Identifier) ((ReturnStatement) function.body().body().get(0)).argument();

        assertEquals("scope-1", param.scopeId());
        assertEquals(List.of("identifier", "declaration", "parameter"), param.classifications());
        assertEquals(List.of("identifier", "reference", "parameter"), use.classifications());
        assertEquals("scope-1", use.declaration().scopeId());
    }

    @Test
    void testDefaultParameterValueIsAReference() {
        FunctionDeclaration function = (FunctionDeclaration) body("var d = 1;\nfunction f(p = d) {}").get(1);
        DefaultParameter param = (DefaultParameter) function.params().get(0);
        assertTrue(param.left().classifications().contains("parameter"));
        Identifier value = (Identifier) param.right();
        assertEquals(List.of("identifier", "reference", "variable"), value.classifications());
        assertEquals("scope-0", value.declaration().scopeId());
    }

    @Test
    @DisplayName("Locals of a function do not resolve outside it")
    void testFunctionLocalsDoNotLeak() {
        List<Statement> body = body("function f() { var local = 1; }\nx = local;");
        Identifier use = (Identifier) ((AssignmentExpression) body.get(1)).right();
        assertEquals("scope-0", use.scopeId());
        assertNull(use.declaration());
        assertEquals(List.of("identifier", "reference"), use.classifications());
    }

    @Test
    void testGlobalVarMarksEarlierAndLaterUses() {
        List<Statement> body = body("x = score;\nglobalvar score;\ny = score;");
        Identifier before = (Identifier) ((AssignmentExpression) body.get(0)).right();
        Identifier declared = ((GlobalVarStatement) body.get(1)).declarations().get(0).id();
        Identifier after = (Identifier) ((AssignmentExpression) body.get(2)).right();

        assertTrue(before.isGlobalIdentifier());
        assertTrue(declared.isGlobalIdentifier());
        assertTrue(after.isGlobalIdentifier());

        assertEquals(List.of("identifier", "declaration", "variable", "global"), declared.classifications());
        assertNull(before.declaration(), "the declaration comes later in source order");
        assertEquals(List.of("identifier", "reference", "variable", "global"), after.classifications());
        assertEquals("scope-0", after.declaration().scopeId());
    }

    @Test
    void testGlobalVarInsideFunctionLandsOnProgramScope() {
        List<Statement> body = body("function f() { globalvar lives; }\nx = lives;");
        FunctionDeclaration function = (FunctionDeclaration) body.get(0);
        Identifier declared = ((GlobalVarStatement) function.body().body().get(0)).declarations().get(0).id();
        assertEquals("scope-0", declared.scopeId());
        assertEquals("scope-0", declared.declaration().scopeId());
    }

    @Test
    void testMacroReference() {
        List<Statement> body = body("#macro MAX 10\nx = MAX;");
        Identifier use = (Identifier) ((AssignmentExpression) body.get(1)).right();
        assertTrue(use.classifications().contains("macro"));
        assertTrue(use.classifications().contains("global"));
        assertEquals("scope-0", use.declaration().scopeId());
    }

    @Test
    void testCatchParameter() {
        TryStatement statement = (TryStatement) body("try { } catch (err) { show(err); }").get(0);
        Identifier param = statement.handler().param();
        assertEquals("scope-1", param.scopeId());
        assertTrue(param.classifications().contains("parameter"));

        CallExpression call = (CallExpression) ((BlockStatement) statement.handler().body()).body().get(0);
        Identifier use = (Identifier) call.arguments().get(0);
        assertEquals("scope-1", use.declaration().scopeId());
        assertNull(((Identifier) call.object()).declaration());
    }

    @Test
    void testEnumClassifications() {
        List<Statement> body = body("enum Color { Red, Green }\nc = Color.Red;");
        EnumDeclaration declaration = (EnumDeclaration) body.get(0);
        assertEquals(List.of("identifier", "declaration", "enum"), declaration.name().classifications());
        assertEquals(List.of("identifier", "declaration", "enum-member"),
            declaration.members().get(0).name().classifications());

        MemberDotExpression member = (MemberDotExpression) ((AssignmentExpression) body.get(1)).right();
        assertEquals(List.of("identifier", "reference", "enum"), ((Identifier) member.object()).classifications());
        assertTrue(((Identifier) member.property()).classifications().contains("property"));
    }

    @Test
    void testStructLiteralOpensScope() {
        StructExpression struct = (StructExpression) ((AssignmentExpression) body("s = { v: n };").get(0)).right();
        assertEquals("scope-1", ((Identifier) struct.properties().get(0).value()).scopeId());
    }

    @Test
    void testNewExpressionReferencesType() {
        NewExpression expression = (NewExpression) ((AssignmentExpression) body("p = new Point();").get(0)).right();
        assertEquals(List.of("identifier", "reference", "type"), expression.expression().classifications());
    }

    @Test
    void testExportedOccurrences() {
        List<ScopeOccurrences> scopes = track("var a = 1;\na += 1;\nfunction g(q) { return q + a; }").scopes();
        assertEquals(2, scopes.size());

        ScopeOccurrences program = scopes.get(0);
        assertEquals("scope-0", program.scopeId());
        assertEquals(ScopeKind.PROGRAM, program.scopeKind());
        Map<String, ScopeOccurrences.IdentifierOccurrences> programNames = byName(program);
        assertEquals(1, programNames.get("a").declarations().size());
        assertEquals(1, programNames.get("a").references().size());

        ScopeOccurrences function = scopes.get(1);
        assertEquals(ScopeKind.FUNCTION, function.scopeKind());
        Map<String, ScopeOccurrences.IdentifierOccurrences> functionNames = byName(function);
        assertEquals(1, functionNames.get("q").declarations().size());
        assertEquals(1, functionNames.get("q").references().size());
        assertTrue(functionNames.get("a").declarations().isEmpty());
        Occurrence outer = functionNames.get("a").references().get(0);
        assertEquals(Occurrence.Kind.REFERENCE, outer.kind());
        assertEquals("scope-0", outer.declaration().scopeId());
    }

    @Test
    void testConstructorParentIsRecordedAsTypeReference() {
        List<ScopeOccurrences> scopes = track("function Child() : Base() constructor {}").scopes();
        Map<String, ScopeOccurrences.IdentifierOccurrences> names = byName(scopes.get(0));
        Occurrence parent = names.get("Base").references().get(0);
        assertTrue(parent.classifications().contains("type"));
        ConstructorDeclaration constructor = (ConstructorDeclaration) track("function Child() : Base() constructor {}")
            .program().body().get(0);
        assertEquals("Base", constructor.parent().id());
    }

    @Test
    void testTrackingOffLeavesIdentifiersBare() {
        ParseResult.Success result = assertInstanceOf(ParseResult.Success.class, GmlParser.tryParse("var a = 1;\nb = a;"));
        Identifier used = (Identifier) ((AssignmentExpression) result.program().body().get(1)).right();
        assertNull(used.scopeId());
        assertNull(used.classifications());
        assertNull(used.declaration());
        assertTrue(result.scopes().isEmpty());
    }

    @Test
    void testGlobalFlagsDoNotNeedTracking() {
        List<Statement> body = GmlParser.parse("x = score;\nglobalvar score;").body();
        assertTrue(((Identifier) ((AssignmentExpression) body.get(0)).right()).isGlobalIdentifier());
    }

    // ==================== ScopeTracker ====================

    @Test
    void testExportWithoutReferencesSkipsReferenceOnlyNames() {
        ScopeTracker tracker = new ScopeTracker(true);
        tracker.withScope(ScopeKind.PROGRAM, () -> {
            tracker.declare("a", id("a"), IdentifierRole.declaration(RoleKind.VARIABLE));
            tracker.reference("a", id("a"), IdentifierRole.reference(null));
            tracker.reference("b", id("b"), IdentifierRole.reference(null));
            return null;
        });

        assertEquals(List.of("a", "b"), List.copyOf(byName(tracker.exportOccurrences().get(0)).keySet()));
        Map<String, ScopeOccurrences.IdentifierOccurrences> declaredOnly = byName(tracker.exportOccurrences(false).get(0));
        assertEquals(List.of("a"), List.copyOf(declaredOnly.keySet()));
        assertTrue(declaredOnly.get("a").references().isEmpty());
    }

    @Test
    void testScopeIsPoppedWhenBodyThrows() {
        ScopeTracker tracker = new ScopeTracker(true);
        tracker.withScope(ScopeKind.PROGRAM, () -> {
            assertThrows(IllegalStateException.class, () -> tracker.withScope(ScopeKind.FUNCTION, () -> {
                throw new IllegalStateException("boom");
            }));
            assertEquals("scope-0", tracker.currentScopeId());
            return null;
        });
        assertNull(tracker.currentScopeId());
    }

    @Test
    void testUnknownScopeOverrideIsRejected() {
        ScopeTracker tracker = new ScopeTracker(true);
        IdentifierRole.Declaration role = new IdentifierRole.Declaration(RoleKind.VARIABLE, List.of(), "scope-9");
        tracker.withScope(ScopeKind.PROGRAM, () -> {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> tracker.declare("a", id("a"), role));
            assertTrue(e.getMessage().contains("scope-9"));
            return null;
        });
    }

    @Test
    void testDisabledTrackerRecordsNothing() {
        ScopeTracker tracker = ScopeTracker.disabled();
        Identifier node = id("a");
        String result = tracker.withScope(ScopeKind.PROGRAM, () -> {
            tracker.declare("a", node, IdentifierRole.declaration(RoleKind.VARIABLE));
            return tracker.currentScopeId();
        });
        assertNull(result);
        assertNull(node.classifications());
        assertTrue(tracker.exportOccurrences().isEmpty());
    }

    private static Identifier id(String name) {
        return new Identifier(new Location(1, 0), new Location(1, name.length() - 1), name);
    }

    private static Map<String, ScopeOccurrences.IdentifierOccurrences> byName(ScopeOccurrences scope) {
        Map<String, ScopeOccurrences.IdentifierOccurrences> names = new LinkedHashMap<>();
        for (ScopeOccurrences.IdentifierOccurrences identifier : scope.identifiers()) {
            names.put(identifier.name(), identifier);
        }
        return names;
    }
}
