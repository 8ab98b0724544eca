package com.gmlparser.sanitize;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IndexMapperTest {

    @Test
    void testSingleInsertion() {
        IndexMapper mapper = IndexMapper.of(List.of(7));
        assertFalse(mapper.isIdentity());
        assertEquals(6, mapper.map(6));
        assertEquals(6, mapper.map(7), "the inserted character maps onto its original");
        assertEquals(7, mapper.map(8));
        assertEquals(20, mapper.map(21));
    }

    @Test
    void testMultipleInsertions() {
        IndexMapper mapper = IndexMapper.of(List.of(22, 7));
        assertEquals(7, mapper.map(8));
        assertEquals(20, mapper.map(22));
        assertEquals(21, mapper.map(23));
        assertEquals(21, mapper.applyAsInt(23));
    }

    @Test
    void testNullsAndDuplicatesAreIgnored() {
        IndexMapper mapper = IndexMapper.of(Arrays.asList(null, 3, 3));
        assertEquals(2, mapper.map(3));
        assertEquals(3, mapper.map(4));
        assertEquals("IndexMapper[3]", mapper.toString());
    }

    @Test
    void testIdentity() {
        assertTrue(IndexMapper.of(null).isIdentity());
        assertTrue(IndexMapper.of(List.of()).isIdentity());
        assertTrue(IndexMapper.of(Arrays.asList((Integer) null)).isIdentity());
        assertSame(IndexMapper.identity(), IndexMapper.of(null));
        assertEquals(42, IndexMapper.identity().map(42));
    }
}
