package miniparse.builders;

import lombok.Getter;
import lombok.NonNull;
import miniparse.models.Entry;
import miniparse.models.Section;
import miniparse.models.SectionId;

import java.util.ArrayList;
import java.util.List;

public class SectionBuilder {

    @Getter
    private final SectionId id;
    private final List<Entry> entries = new ArrayList<>();
    private boolean built;

    public SectionBuilder() {
        this(SectionId.global());
    }

    public SectionBuilder(@NonNull SectionId id) {
        this.id = id;
    }

    public SectionBuilder addEntry(@NonNull Entry entry) {
        ensureNotBuilt();
        entries.add(entry);
        return this;
    }

    public SectionBuilder addKeyValuePair(String key, String value) {
        return addEntry(new Entry(key, value));
    }

    public BuiltSection build() {
        ensureNotBuilt();
        built = true;
        return new BuiltSection(id, new Section(entries));
    }

    private void ensureNotBuilt() {
        if (built) {
            throw new IllegalStateException("Section builder for " + id + " has already been built.");
        }
    }
}
