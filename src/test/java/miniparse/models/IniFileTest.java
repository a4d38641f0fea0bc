package miniparse.models;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IniFileTest {

    @Test
    void getters_returnOptionals() {
        var section = new Section(List.of(new Entry("key1", "value21")));
        var file = new IniFile(null, Map.of("section1", section));

        assertTrue(file.getGlobalSection().isEmpty());
        assertEquals(section, file.getSectionByName("section1").orElseThrow());
        assertFalse(file.getSectionByName("i do not exist").isPresent());
    }

    @Test
    void sections_keepDeclarationOrderAndAreUnmodifiable() {
        var sections = new LinkedHashMap<String, Section>();
        sections.put("b", Section.empty());
        sections.put("a", Section.empty());
        var file = new IniFile(Section.empty(), sections);
        sections.put("c", Section.empty());

        assertEquals(List.of("b", "a"), List.copyOf(file.getSections().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> file.getSections().remove("a"));
    }

    @Test
    void sectionId_distinguishesGlobalFromNamed() {
        assertTrue(SectionId.global().isGlobal());
        assertTrue(SectionId.global().getName().isEmpty());
        assertFalse(SectionId.named("x").isGlobal());
        assertEquals("x", SectionId.named("x").getName().orElseThrow());
        assertEquals(SectionId.named("x"), SectionId.named("x"));
        assertEquals("Named(x)", SectionId.named("x").toString());
    }
}
