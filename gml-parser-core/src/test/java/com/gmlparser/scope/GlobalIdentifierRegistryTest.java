package com.gmlparser.scope;

import com.gmlparser.ast.Identifier;
import com.gmlparser.ast.Location;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class GlobalIdentifierRegistryTest {

    private static Identifier id(String name) {
        return new Identifier(new Location(1, 0), new Location(1, 0), name);
    }

    @Test
    void testMarkingFlagsEarlierIdentifiers() {
        GlobalIdentifierRegistry registry = new GlobalIdentifierRegistry();
        Identifier early = id("score");
        Identifier other = id("lives");
        registry.applyGlobalIdentifiersToNode(early);
        registry.applyGlobalIdentifiersToNode(other);
        assertFalse(early.isGlobalIdentifier());

        registry.markGlobalIdentifier(id("score"));

        assertTrue(early.isGlobalIdentifier());
        assertFalse(other.isGlobalIdentifier());
        assertTrue(registry.isGlobal("score"));
        assertEquals(Set.of("score"), registry.globalNames());
    }

    @Test
    void testLaterIdentifiersAreFlaggedOnRegistration() {
        GlobalIdentifierRegistry registry = new GlobalIdentifierRegistry();
        registry.markGlobalIdentifier(id("MAX"));
        Identifier later = id("MAX");
        registry.applyGlobalIdentifiersToNode(later);
        registry.applyGlobalIdentifiersToNode(later);
        assertTrue(later.isGlobalIdentifier());
    }

    @Test
    void testRegistrationIsIdempotentPerInstance() {
        GlobalIdentifierRegistry registry = new GlobalIdentifierRegistry();
        Identifier first = id("i");
        registry.applyGlobalIdentifiersToNode(first);
        registry.applyGlobalIdentifiersToNode(first);
        registry.applyGlobalIdentifiersToNode(id("i"));
        assertEquals(2, registry.pendingCount("i"));
    }

    @Test
    void testGlobalNamesAreNotRetained() {
        GlobalIdentifierRegistry registry = new GlobalIdentifierRegistry();
        registry.applyGlobalIdentifiersToNode(id("g"));
        registry.markGlobalIdentifier(id("g"));
        registry.applyGlobalIdentifiersToNode(id("g"));
        assertEquals(0, registry.pendingCount("g"));
    }

    @Test
    void testRepeatedNameScalesLinearly() {
        GlobalIdentifierRegistry registry = new GlobalIdentifierRegistry();
        int count = 200_000;
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            for (int i = 0; i < count; i++) {
                registry.applyGlobalIdentifiersToNode(id("i"));
            }
        });
        assertEquals(count, registry.pendingCount("i"));
        Identifier declared = id("i");
        registry.markGlobalIdentifier(declared);
        assertTrue(declared.isGlobalIdentifier());
        assertEquals(0, registry.pendingCount("i"));
    }

    @Test
    void testBlankNamesAreIgnored() {
        GlobalIdentifierRegistry registry = new GlobalIdentifierRegistry();
        registry.markGlobalIdentifier(id(""));
        registry.markGlobalIdentifier(null);
        assertTrue(registry.globalNames().isEmpty());
    }
}
