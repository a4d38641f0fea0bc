package miniparse.models;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@ToString
@EqualsAndHashCode
public final class IniFile {

    private final Section globalSection;
    private final Map<String, Section> sections;

    public IniFile(Section globalSection, @NonNull Map<String, Section> sections) {
        this.globalSection = globalSection;
        this.sections = Collections.unmodifiableMap(new LinkedHashMap<>(sections));
    }

    public Optional<Section> getGlobalSection() {
        return Optional.ofNullable(globalSection);
    }

    public Optional<Section> getSectionByName(String name) {
        return Optional.ofNullable(sections.get(name));
    }

    public Map<String, Section> getSections() {
        return sections;
    }
}
