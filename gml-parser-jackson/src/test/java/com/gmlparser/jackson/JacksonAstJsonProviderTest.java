package com.gmlparser.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gmlparser.GmlParser;
import com.gmlparser.ParserOptions;
import com.gmlparser.ast.*;
import com.gmlparser.json.AstJsonException;
import com.gmlparser.json.AstJsonProvider;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    private final JacksonAstJsonProvider provider = new JacksonAstJsonProvider();
    private final ObjectMapper mapper = provider.getObjectMapper();

    private JsonNode toTree(String source) throws Exception {
        return toTree(GmlParser.parse(source));
    }

    private JsonNode toTree(Node node) throws Exception {
        return mapper.readTree(provider.getSerializer().serialize(node));
    }

    // ==================== Discovery ====================

    @Test
    void testProviderIsDiscovered() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        AstJsonProvider found = AstJsonProvider.getProvider();
        assertInstanceOf(JacksonAstJsonProvider.class, found);
        assertEquals("Jackson", found.getName());
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider("jackson"));
    }

    @Test
    void testUnknownProviderName() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> AstJsonProvider.getProvider("gson"));
        assertTrue(e.getMessage().contains("gson"));
    }

    // ==================== Wire shape ====================

    @Test
    void testTypeIsWrittenFirst() throws Exception {
        JsonNode program = toTree("x = 1;");
        assertEquals("type", program.fieldNames().next());
        assertEquals("Program", program.get("type").asText());
        assertEquals("type", program.get("body").get(0).fieldNames().next());
    }

    @Test
    void testProgramShape() throws Exception {
        JsonNode program = toTree("x = 1;");
        assertEquals(1, program.get("start").get("line").asInt());
        assertEquals(0, program.get("start").get("index").asInt());
        assertEquals(5, program.get("end").get("index").asInt());
        assertTrue(program.get("comments").isArray());
        assertEquals(0, program.get("comments").size());

        JsonNode assignment = program.get("body").get(0);
        assertEquals("AssignmentExpression", assignment.get("type").asText());
        assertEquals("=", assignment.get("operator").asText());
        assertEquals("Literal", assignment.get("right").get("type").asText());
        assertEquals("1", assignment.get("right").get("value").asText());
    }

    @Test
    void testIdentifierShape() throws Exception {
        JsonNode id = toTree("x = 1;").get("body").get(0).get("left");
        assertEquals("Identifier", id.get("type").asText());
        assertEquals("x", id.get("name").asText());
        assertFalse(id.get("isGlobalIdentifier").asBoolean());
        assertTrue(id.has("declaration"), "declaration is written even when null");
        assertTrue(id.get("declaration").isNull());
        assertFalse(id.has("scopeId"));
        assertFalse(id.has("classifications"));
    }

    @Test
    void testScopeMetadataIsWritten() throws Exception {
        Program program = GmlParser.parse("var a = 1;\nb = a;", ParserOptions.defaults().withScopeTracking(true));
        JsonNode used = toTree(program).get("body").get(1).get("right");
        assertEquals("scope-0", used.get("scopeId").asText());
        assertEquals("reference", used.get("classifications").get(1).asText());
        JsonNode declaration = used.get("declaration");
        assertEquals("scope-0", declaration.get("scopeId").asText());
        assertEquals(4, declaration.get("start").get("index").asInt());
    }

    @Test
    void testNullsThatAreAlwaysWritten() throws Exception {
        JsonNode body = toTree("if (a) b = 1;\nreturn;\nvar c;\nf = function() {};\nfor (;;) {}").get("body");

        assertTrue(body.get(0).get("alternate").isNull());
        assertTrue(body.get(1).get("argument").isNull());
        assertTrue(body.get(2).get("declarations").get(0).get("init").isNull());

        JsonNode function = body.get(3).get("right");
        assertTrue(function.get("id").isNull());
        assertFalse(function.has("idLocation"));

        JsonNode loop = body.get(4);
        assertTrue(loop.get("init").isNull());
        assertTrue(loop.get("test").isNull());
        assertTrue(loop.get("update").isNull());
    }

    @Test
    void testSwitchDefaultHasNullTest() throws Exception {
        JsonNode cases = toTree("switch (x) { default: y = 1; }").get("body").get(0).get("cases");
        assertTrue(cases.get(0).get("test").isNull());
    }

    @Test
    void testCommentShape() throws Exception {
        JsonNode comments = toTree("// hi\nx = 1; /* a\nb */").get("comments");
        assertEquals(2, comments.size());

        JsonNode line = comments.get(0);
        assertEquals("CommentLine", line.get("type").asText());
        assertEquals(" hi", line.get("value").asText());
        assertTrue(line.get("isTopComment").asBoolean());
        assertFalse(line.get("isBottomComment").asBoolean());
        assertEquals("\n", line.get("trailingWS").asText());
        assertFalse(line.has("lineCount"));

        JsonNode block = comments.get(1);
        assertEquals("CommentBlock", block.get("type").asText());
        assertEquals(2, block.get("lineCount").asInt());
        assertEquals(";", block.get("leadingChar").asText());
        assertTrue(block.get("isBottomComment").asBoolean());
    }

    @Test
    void testPrettyOutputIsTheSameTree() throws Exception {
        Program program = GmlParser.parse("x = [1, 2];");
        String compact = provider.getSerializer().serialize(program);
        String pretty = provider.getSerializer().serializePretty(program);
        assertTrue(pretty.contains("\n"));
        assertEquals(mapper.readTree(compact), mapper.readTree(pretty));
    }

    // ==================== Reading ====================

    @Test
    void testProgramReadsBack() throws Exception {
        String source = String.join("\n",
            "// setup",
            "#macro SPEED 4",
            "enum State { Idle, Run = 2, }",
            "function move(dx, dy = 0) {",
            "    var pos = { x: dx, y: dy };",
            "    if (pos.x > SPEED) { pos.x = SPEED; } else { pos.y++; }",
            "    return $\"{pos.x},{pos.y}\";",
            "}",
            "function Player() : Entity(1, ) constructor {}",
            "try { list[| 0] = move(, 2); } catch (e) { show(e); } finally { done = true; }",
            "switch (state) { case State.Idle: break; default: exit; }",
            "/* end */");
        Program program = GmlParser.parse(source, ParserOptions.defaults().withScopeTracking(true));

        String json = provider.getSerializer().serialize(program);
        Program copy = provider.getDeserializer().deserializeProgram(json);

        assertEquals(program.body().size(), copy.body().size());
        assertEquals(mapper.readTree(json), toTree(copy));

        FunctionDeclaration move = (FunctionDeclaration) copy.body().get(2);
        assertEquals("move", move.id());
        assertInstanceOf(DefaultParameter.class, move.params().get(1));
        Identifier dx = (Identifier) move.params().get(0);
        assertEquals(List.of("identifier", "declaration", "parameter"), dx.classifications());

        MacroDeclaration macro = (MacroDeclaration) copy.body().get(0);
        assertTrue(macro.name().isGlobalIdentifier());

        CommentBlock last = (CommentBlock) copy.comments().get(1);
        assertEquals(" end ", last.value());
        assertTrue(last.isBottomComment());
    }

    @Test
    void testSingleNodeReadsBack() {
        Identifier id = new Identifier(new Location(2, 10), new Location(2, 12), "foo");
        id.setGlobalIdentifier(true);
        String json = provider.getSerializer().serialize(id);

        Identifier copy = provider.getDeserializer().deserialize(json, Identifier.class);
        assertEquals("foo", copy.name());
        assertTrue(copy.isGlobalIdentifier());
        assertEquals(new Location(2, 10), copy.start());
        assertNull(copy.declaration());
    }

    @Test
    void testUnknownPropertiesAreIgnored() {
        String json = "{\"type\":\"Literal\",\"start\":{\"line\":1,\"index\":0},\"end\":{\"line\":1,\"index\":1},"
            + "\"value\":\"42\",\"printerHint\":true}";
        Literal literal = provider.getDeserializer().deserialize(json, Literal.class);
        assertEquals("42", literal.value());
    }

    @Test
    void testMalformedJson() {
        AstJsonException e = assertThrows(AstJsonException.class,
            () -> provider.getDeserializer().deserializeProgram("{\"type\": \"Program\", "));
        assertTrue(e.getMessage().startsWith("Failed to deserialize Program"));
        assertNotNull(e.getCause());
    }

    @Test
    void testUnknownNodeType() {
        assertThrows(AstJsonException.class,
            () -> provider.getDeserializer().deserializeProgram("{\"type\": \"Banana\"}"));
    }
}
