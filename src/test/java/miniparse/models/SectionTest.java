package miniparse.models;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SectionTest {

    @Test
    void getValueByKey_firstDuplicateWins() {
        var section = new Section(List.of(new Entry("k", "a"), new Entry("k", "b")));

        assertEquals(Optional.of("a"), section.getValueByKey("k"));
        assertEquals(2, section.size());
        assertEquals("b", section.getEntries().get(1).getValue());
    }

    @Test
    void getValueByKey_missingKey() {
        var section = new Section(List.of(new Entry("key1", "value1")));

        assertTrue(section.getValueByKey("i do not exist").isEmpty());
        assertTrue(section.getValueByKey(null).isEmpty());
    }

    @Test
    void entries_areCopiedAndUnmodifiable() {
        var source = new ArrayList<Entry>();
        source.add(new Entry("key1", "value1"));
        var section = new Section(source);
        source.add(new Entry("key2", "value2"));

        assertEquals(1, section.size());
        assertThrows(UnsupportedOperationException.class, () -> section.getEntries().add(new Entry("x", "y")));
    }

    @Test
    void toString_rendersOneEntryPerLine() {
        var section = new Section(List.of(new Entry("key1", "value1"), new Entry("key2", "value2")));

        assertEquals("key1 = value1\nkey2 = value2", section.toString());
        assertEquals("", Section.empty().toString());
        assertTrue(Section.empty().isEmpty());
    }

    @Test
    void entry_rejectsNullParts() {
        assertThrows(NullPointerException.class, () -> new Entry(null, "value"));
        assertThrows(NullPointerException.class, () -> new Entry("key", null));
    }
}
