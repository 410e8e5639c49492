package org.scharp.hypercube;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Unit tests for {@link ProvenanceLog} and {@link ProvenanceEntry}. */
public class ProvenanceLogTest {

    @Test
    void testCreated() {
        ProvenanceLog log = ProvenanceLog.created();
        assertEquals(1, log.size());
        assertEquals(Operation.CREATE, log.get(0).operation());
        assertEquals("Object created", log.get(0).description());
        assertNull(log.get(0).parameters());
        assertSame(log.get(0), log.last());
    }

    @Test
    void testAppend() {
        ProvenanceLog created = ProvenanceLog.created();
        ProvenanceLog flipped = created.append("Flipped upside-down", Operation.FLIP_UP_DOWN, null);
        ProvenanceLog rotated = flipped.append("Rotated counterclockwise 3 times", Operation.ROTATE_90, 3);

        // The original logs are unchanged.
        assertEquals(1, created.size());
        assertEquals(2, flipped.size());
        assertEquals(3, rotated.size());

        // The new log extends the old one.
        assertEquals(flipped.entries(), rotated.entries().subList(0, 2));
        assertEquals(3, rotated.last().parameters());

        List<Operation> operations = new ArrayList<>();
        for (ProvenanceEntry entry : rotated) {
            operations.add(entry.operation());
        }
        assertThat(operations, contains(Operation.CREATE, Operation.FLIP_UP_DOWN, Operation.ROTATE_90));

        assertThrows(UnsupportedOperationException.class, () -> rotated.entries().clear());

        Exception exception = assertThrows(
            NullPointerException.class,
            () -> created.append(null, Operation.MEAN, null));
        assertEquals("description must not be null", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> created.append("Reduced", null, null));
        assertEquals("operation must not be null", exception.getMessage());
    }

    @Test
    void testOf() {
        ProvenanceEntry create = new ProvenanceEntry("Object created", Operation.CREATE, null);
        ProvenanceEntry mean = new ProvenanceEntry("Reduced to spatial mean", Operation.MEAN, null);

        ProvenanceLog log = ProvenanceLog.of(List.of(create, mean));
        assertEquals(2, log.size());
        assertEquals(ProvenanceLog.created().append("Reduced to spatial mean", Operation.MEAN, null), log);

        // The list is copied.
        List<ProvenanceEntry> entries = new ArrayList<>(List.of(create));
        ProvenanceLog copied = ProvenanceLog.of(entries);
        entries.add(mean);
        assertEquals(1, copied.size());

        Exception exception = assertThrows(IllegalArgumentException.class, () -> ProvenanceLog.of(List.of()));
        assertEquals("entries must not be empty", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> ProvenanceLog.of(List.of(mean, create)));
        assertEquals("the first entry must be a CREATE entry", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> ProvenanceLog.of(null));
        assertEquals("entries must not be null", exception.getMessage());

        assertThrows(NullPointerException.class, () -> ProvenanceLog.of(Arrays.asList(create, null)));
    }

    @Test
    void testEquals() {
        ProvenanceLog log1 = ProvenanceLog.created().append("Selected bands", Operation.SELECT_BANDS, List.of(1, 3));
        ProvenanceLog log2 = ProvenanceLog.created().append("Selected bands", Operation.SELECT_BANDS, List.of(1, 3));
        ProvenanceLog log3 = ProvenanceLog.created().append("Selected bands", Operation.SELECT_BANDS, List.of(1, 2));

        assertEquals(log1, log2);
        assertEquals(log1.hashCode(), log2.hashCode());
        assertNotEquals(log1, log3);
        assertNotEquals(log1, ProvenanceLog.created());

        assertEquals(new ProvenanceEntry("a", Operation.MAP, "q"), new ProvenanceEntry("a", Operation.MAP, "q"));
        assertNotEquals(new ProvenanceEntry("a", Operation.MAP, "q"), new ProvenanceEntry("b", Operation.MAP, "q"));
        assertNotEquals(new ProvenanceEntry("a", Operation.MAP, "q"), new ProvenanceEntry("a", Operation.MEAN, "q"));
    }

    @Test
    void testToString() {
        assertEquals("ROTATE_90: Rotated counterclockwise 1 times 1",
            new ProvenanceEntry("Rotated counterclockwise 1 times", Operation.ROTATE_90, 1).toString());
        assertEquals("[CREATE: Object created]", ProvenanceLog.created().toString());
    }
}
