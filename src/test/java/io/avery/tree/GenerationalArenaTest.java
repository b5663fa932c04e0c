package io.avery.tree;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GenerationalArenaTest {
    @Test
    void testInsertAndGet() {
        GenerationalArena<String> arena = new GenerationalArena<>();
        Index a = arena.insert("a");
        Index b = arena.insert("b");
        assertEquals("a", arena.get(a));
        assertEquals("b", arena.get(b));
        assertEquals(2, arena.size());
        assertEquals(GenerationalArena.DEFAULT_CAPACITY, arena.capacity());
    }
    
    @Test
    void testRemoveAdvancesGeneration() {
        GenerationalArena<String> arena = new GenerationalArena<>(1);
        Index a = arena.insert("a");
        assertEquals("a", arena.remove(a));
        assertNull(arena.remove(a));
        assertNull(arena.get(a));
        assertFalse(arena.contains(a));
        assertEquals(0, arena.size());
        
        Index b = arena.insert("b");
        assertEquals(a.slot(), b.slot());
        assertTrue(b.generation() > a.generation());
        assertNull(arena.get(a));
        assertEquals("b", arena.get(b));
    }
    
    @Test
    void testGrowthKeepsHandles() {
        GenerationalArena<Integer> arena = new GenerationalArena<>(2);
        List<Index> handles = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            handles.add(arena.insert(i));
        }
        assertEquals(128, arena.capacity());
        for (int i = 0; i < handles.size(); i++) {
            assertEquals(Integer.valueOf(i), arena.get(handles.get(i)));
        }
    }
    
    @Test
    void testTryInsertWhenFull() {
        GenerationalArena<String> arena = new GenerationalArena<>(1);
        assertTrue(arena.tryInsert("a").isInserted());
        Insertion<String> rejected = arena.tryInsert("b");
        assertEquals(new Insertion.Rejected<>("b"), rejected);
        assertEquals(1, arena.capacity());
        
        arena.reserve(3);
        assertEquals(4, arena.capacity());
        Insertion<String> inserted = arena.tryInsert(rejected.rejectedValue());
        assertTrue(inserted.isInserted());
        assertEquals("b", arena.get(inserted.index()));
    }
    
    @Test
    void testClearInvalidatesHandles() {
        GenerationalArena<Integer> arena = new GenerationalArena<>(8);
        Set<Index> old = new HashSet<>();
        for (int i = 0; i < 5; i++) {
            old.add(arena.insert(i));
        }
        arena.clear();
        assertEquals(0, arena.size());
        assertEquals(8, arena.capacity());
        for (Index index : old) {
            assertNull(arena.get(index));
        }
        for (int i = 0; i < 8; i++) {
            assertFalse(old.contains(arena.insert(i)));
        }
        assertEquals(8, arena.capacity());
    }
    
    @Test
    void testGetPair() {
        GenerationalArena<String> arena = new GenerationalArena<>();
        Index a = arena.insert("a");
        Index b = arena.insert("b");
        assertEquals(new GenerationalArena.Pair<>("a", "b"), arena.getPair(a, b));
        arena.remove(b);
        assertEquals(new GenerationalArena.Pair<>("a", null), arena.getPair(a, b));
        assertThrows(IllegalArgumentException.class, () -> arena.getPair(a, a));
    }
    
    @Test
    void testForeignHandles() {
        GenerationalArena<String> arena = new GenerationalArena<>(2);
        arena.insert("a");
        assertNull(arena.get(new Index(-1, 0)));
        assertNull(arena.get(new Index(2, 0)));
        assertNull(arena.get(new Index(1, 0)));
        assertNull(arena.get(new Index(0, 7)));
    }
    
    @Test
    void testIllegalSizes() {
        assertThrows(IllegalArgumentException.class, () -> new GenerationalArena<>(-1));
        assertEquals(1, new GenerationalArena<>(0).capacity());
        GenerationalArena<String> arena = new GenerationalArena<>();
        assertThrows(IllegalArgumentException.class, () -> arena.reserve(-1));
        arena.reserve(0);
        assertEquals(GenerationalArena.DEFAULT_CAPACITY, arena.capacity());
        assertThrows(NullPointerException.class, () -> arena.insert(null));
    }
}
