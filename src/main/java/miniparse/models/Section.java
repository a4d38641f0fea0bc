package miniparse.models;

import lombok.EqualsAndHashCode;
import lombok.NonNull;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;

@EqualsAndHashCode
public final class Section {

    private static final Section EMPTY = new Section(Collections.emptyList());

    private final List<Entry> entries;

    public Section(@NonNull List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static Section empty() {
        return EMPTY;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    // first match wins, later duplicates are only reachable through getEntries()
    public Optional<String> getValueByKey(String key) {
        return entries.stream()
                .filter(entry -> entry.getKey().equals(key))
                .map(Entry::getValue)
                .findFirst();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner("\n");
        for (Entry entry : entries) {
            joiner.add(entry.toString());
        }
        return joiner.toString();
    }
}
