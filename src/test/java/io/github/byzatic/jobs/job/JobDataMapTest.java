package io.github.byzatic.jobs.job;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JobDataMapTest {

    @Test
    void readsInstantFromSupportedRepresentations() {
        Instant t = Instant.parse("2025-08-08T11:00:00Z");
        JobDataMap map = new JobDataMap();
        map.put("instant", t);
        map.put("date", Date.from(t));
        map.put("millis", t.toEpochMilli());

        assertEquals(Optional.of(t), map.getInstant("instant"));
        assertEquals(Optional.of(t), map.getInstant("date"));
        assertEquals(Optional.of(t), map.getInstant("millis"));
        assertEquals(Optional.empty(), map.getInstant("absent"));
    }

    @Test
    void rejectsValuesOfWrongType() {
        JobDataMap map = new JobDataMap();
        map.put("text", "2025-08-08");
        map.put("number", 42);

        assertThrows(ClassCastException.class, () -> map.getInstant("text"));
        assertThrows(ClassCastException.class, () -> map.getString("number"));
        assertThrows(NumberFormatException.class, () -> map.getLong("text"));
    }

    @Test
    void parsesLongFromNumberOrString() {
        JobDataMap map = new JobDataMap();
        map.put("int", 5);
        map.put("string", " 1500 ");

        assertEquals(Optional.of(5L), map.getLong("int"));
        assertEquals(Optional.of(1500L), map.getLong("string"));
        assertEquals(Optional.empty(), map.getLong("absent"));
    }

    @Test
    void rejectsFractionalNumbersInsteadOfTruncating() {
        JobDataMap map = new JobDataMap();
        map.put("fraction", 1.5d);
        map.put("whole", 2.0d);
        map.put("fractionString", "1.5");

        assertThrows(NumberFormatException.class, () -> map.getLong("fraction"));
        assertThrows(NumberFormatException.class, () -> map.getLong("fractionString"));
        assertEquals(Optional.of(2L), map.getLong("whole"));
    }

    @Test
    void mutationsMarkMapDirty() {
        JobDataMap map = new JobDataMap(Map.of("a", "1"));
        assertFalse(map.isDirty());

        map.put("b", "2");
        assertTrue(map.isDirty());

        map.clearDirtyFlag();
        assertNull(map.remove("absent"));
        assertFalse(map.isDirty());

        map.remove("a");
        assertTrue(map.isDirty());
    }

    @Test
    void skipsNullEntriesOfInitialMap() {
        Map<String, Object> initial = new HashMap<>();
        initial.put("kept", "value");
        initial.put("dropped", null);

        JobDataMap map = new JobDataMap(initial);

        assertEquals(1, map.size());
        assertFalse(map.containsKey("dropped"));
    }

    @Test
    void putAllOverridesAndSnapshotIsDetached() {
        JobDataMap base = new JobDataMap(Map.of("k", "base", "only", "base"));
        JobDataMap over = new JobDataMap(Map.of("k", "over"));

        base.putAll(over);
        Map<String, Object> snapshot = base.snapshot();
        base.put("later", "x");

        assertEquals("over", base.getString("k"));
        assertEquals("base", base.getString("only"));
        assertFalse(snapshot.containsKey("later"));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("y", "z"));
    }

    @Test
    void rejectsNullKeysAndValues() {
        JobDataMap map = new JobDataMap();
        assertThrows(NullPointerException.class, () -> map.put(null, "v"));
        assertThrows(NullPointerException.class, () -> map.put("k", null));
    }
}
