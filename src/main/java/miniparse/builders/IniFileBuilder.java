package miniparse.builders;

import lombok.NonNull;
import miniparse.models.IniFile;
import miniparse.models.Section;
import miniparse.models.SectionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

public class IniFileBuilder {

    private static final Logger log = LoggerFactory.getLogger(IniFileBuilder.class);

    private Section globalSection;
    private final Map<String, Section> sections = new LinkedHashMap<>();
    private boolean built;

    public IniFileBuilder newSection(@NonNull String name, @NonNull Section section) {
        ensureNotBuilt();
        Section replaced = sections.put(name, section);
        if (replaced != null) {
            log.debug("Section [{}] declared again, dropping {} earlier entries", name, replaced.size());
        }
        return this;
    }

    public IniFileBuilder setGlobalSection(@NonNull Section section) {
        ensureNotBuilt();
        globalSection = section;
        return this;
    }

    /**
     * Drops an empty global section, keeps named sections even when empty.
     */
    public IniFileBuilder flush(@NonNull BuiltSection builtSection) {
        ensureNotBuilt();
        SectionId id = builtSection.getId();
        Section section = builtSection.getSection();
        log.debug("Adding section {}: {} entries", id, section.size());

        if (id.isGlobal()) {
            return section.isEmpty() ? this : setGlobalSection(section);
        }
        return newSection(id.getName().orElseThrow(), section);
    }

    public IniFile build() {
        ensureNotBuilt();
        built = true;
        return new IniFile(globalSection, sections);
    }

    private void ensureNotBuilt() {
        if (built) {
            throw new IllegalStateException("Ini file builder has already been built.");
        }
    }
}
