package io.github.cyfko.typemap;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TypeMapTest {

    record Value(int value) {}

    static final class Age implements Key<Value> {
        private Age() {}
    }

    static final class Height implements Key<Value> {
        private Height() {}
    }

    static final class Counter implements Key<Integer> {
        private Counter() {}
    }

    static final class Names implements Key<List<String>> {
        private Names() {}
    }

    @Test
    void testAgeScenario() {
        TypeMap map = new TypeMap();

        assertEquals(Optional.empty(), map.insert(Age.class, new Value(42)));
        assertEquals(Optional.of(new Value(42)), map.get(Age.class));
        assertEquals(Optional.of(new Value(42)), map.insert(Age.class, new Value(7)));
        assertEquals(Optional.of(new Value(7)), map.remove(Age.class));
        assertEquals(Optional.empty(), map.get(Age.class));
    }

    @Test
    void testFreshMapReportsAbsence() {
        TypeMap map = new TypeMap();

        assertTrue(map.get(Age.class).isEmpty());
        assertTrue(map.getMut(Age.class).isEmpty());
        assertFalse(map.contains(Age.class));
        assertTrue(map.remove(Age.class).isEmpty());
        assertTrue(map.isEmpty());
        assertEquals(0, map.size());
    }

    @Test
    void testGetReturnsStoredInstance() {
        TypeMap map = new TypeMap();
        List<String> names = new ArrayList<>(List.of("ada"));

        map.insert(Names.class, names);

        assertSame(names, map.get(Names.class).orElseThrow());
        assertTrue(map.contains(Names.class));
    }

    @Test
    void testOverwriteReturnsPrevious() {
        TypeMap map = new TypeMap();
        map.insert(Counter.class, 1);

        assertEquals(Optional.of(1), map.insert(Counter.class, 2));
        assertEquals(Optional.of(2), map.get(Counter.class));
        assertEquals(1, map.size());
    }

    @Test
    void testRemoveLeavesSlotVacant() {
        TypeMap map = new TypeMap();
        map.insert(Age.class, new Value(3));

        assertEquals(Optional.of(new Value(3)), map.remove(Age.class));
        assertFalse(map.contains(Age.class));
        assertTrue(map.get(Age.class).isEmpty());
        assertTrue(map.remove(Age.class).isEmpty());
    }

    @Test
    void testKeysSharingValueTypeAreIndependent() {
        TypeMap map = new TypeMap();
        map.insert(Age.class, new Value(30));

        assertFalse(map.contains(Height.class));
        assertTrue(map.get(Height.class).isEmpty());

        map.insert(Height.class, new Value(180));
        map.remove(Age.class);

        assertEquals(Optional.of(new Value(180)), map.get(Height.class));
        assertTrue(map.get(Age.class).isEmpty());
    }

    @Test
    void testMutationThroughGetMutIsVisible() {
        TypeMap map = new TypeMap();
        map.insert(Counter.class, 1);

        map.getMut(Counter.class).orElseThrow().update(c -> c + 1);
        assertEquals(Optional.of(2), map.get(Counter.class));

        assertEquals(2, map.getMut(Counter.class).orElseThrow().set(10));
        assertEquals(Optional.of(10), map.get(Counter.class));
    }

    @Test
    void testMutableValueChangedInPlace() {
        TypeMap map = new TypeMap();
        map.insert(Names.class, new ArrayList<>());

        map.getMut(Names.class).orElseThrow().get().add("grace");

        assertEquals(List.of("grace"), map.get(Names.class).orElseThrow());
    }

    @Test
    void testSizeAndClear() {
        TypeMap map = new TypeMap();
        map.insert(Age.class, new Value(1));
        map.insert(Height.class, new Value(2));
        map.insert(Counter.class, 3);

        assertEquals(3, map.size());
        assertFalse(map.isEmpty());

        map.clear();

        assertTrue(map.isEmpty());
        assertFalse(map.contains(Counter.class));
    }

    @Test
    void testCopyIsShallow() {
        TypeMap original = new TypeMap();
        List<String> names = new ArrayList<>();
        original.insert(Names.class, names);
        original.insert(Counter.class, 1);

        TypeMap copy = new TypeMap(original);
        copy.insert(Counter.class, 2);
        copy.remove(Names.class);

        assertEquals(Optional.of(1), original.get(Counter.class));
        assertSame(names, original.get(Names.class).orElseThrow());
        assertFalse(copy.contains(Names.class));
    }

    @Test
    void testNullsRejected() {
        TypeMap map = new TypeMap();

        assertThrows(NullPointerException.class, () -> map.insert(Age.class, null));
        assertThrows(NullPointerException.class, () -> map.get(null));
        assertThrows(NullPointerException.class, () -> new TypeMap(null));
        assertTrue(map.isEmpty());
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void testRawTypeMisuseRejectedOnInsert() {
        TypeMap map = new TypeMap();
        Class raw = Age.class;

        assertThrows(ClassCastException.class, () -> map.insert(raw, "not a value"));
        assertFalse(map.contains(Age.class));
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void testNonKeyClassRejected() {
        TypeMap map = new TypeMap();
        Class raw = String.class;

        assertThrows(IllegalArgumentException.class, () -> map.get(raw));
    }

    @Test
    @SuppressWarnings("deprecation")
    void testDeprecatedAliases() {
        TypeMap map = new TypeMap();
        map.insert(Counter.class, 5);

        assertEquals(Optional.of(5), map.find(Counter.class));
        map.findMut(Counter.class).orElseThrow().set(6);
        assertEquals(Optional.of(6), map.get(Counter.class));
    }

    @Test
    void testToStringNamesKeys() {
        TypeMap map = new TypeMap();
        assertEquals("TypeMap{}", map.toString());

        map.insert(Age.class, new Value(42));
        assertEquals("TypeMap{Age=Value[value=42]}", map.toString());
    }
}
