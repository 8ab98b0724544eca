package com.gmlparser.sanitize;

import com.gmlparser.ast.DeclarationRef;
import com.gmlparser.ast.Identifier;
import com.gmlparser.ast.Literal;
import com.gmlparser.ast.Location;
import com.gmlparser.ast.Node;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LocationRemapperTest {

    @Test
    void testRecordsAreRemapped() {
        Literal literal = new Literal(new Location(1, 4), new Location(1, 10), "\"text\"");
        assertTrue(LocationRemapper.remap(literal, IndexMapper.of(List.of(5))));
        assertEquals(4, literal.start().index());
        assertEquals(9, literal.end().index());
        assertEquals(Integer.valueOf(1), literal.start().line(), "lines are not touched");
    }

    @Test
    void testSharedLocationIsRemappedOnce() {
        Location shared = new Location(1, 10);
        List<Node> nodes = List.of(new Literal(shared, shared, "1"), new Literal(shared, new Location(1, 12), "2"));
        assertTrue(LocationRemapper.remap(nodes, IndexMapper.of(List.of(5))));
        assertEquals(9, shared.index());
    }

    @Test
    void testClassFieldsAndNestedRecordsAreWalked() throws ReflectiveOperationException {
        Identifier id = new Identifier(new Location(1, 0), new Location(1, 2), "abc");
        id.setClassifications(List.of("identifier", "declaration"));
        id.setDeclaration(new DeclarationRef("scope-0", new Location(1, 0), new Location(1, 2)));
        assertEquals(4, LocationRemapper.collectLocations(id).size());
    }

    @Test
    void testIdentityMapperLeavesTreeAlone() {
        Literal literal = new Literal(new Location(1, 4), new Location(1, 10), "1");
        assertFalse(LocationRemapper.remap(literal, IndexMapper.identity()));
        assertFalse(LocationRemapper.remap(null, IndexMapper.of(List.of(1))));
        assertEquals(10, literal.end().index());
    }
}
