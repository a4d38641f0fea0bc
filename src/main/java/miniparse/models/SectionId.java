package miniparse.models;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class SectionId {

    private static final SectionId GLOBAL = new SectionId(null);

    private final String name;

    public static SectionId global() {
        return GLOBAL;
    }

    public static SectionId named(@NonNull String name) {
        return new SectionId(name);
    }

    public boolean isGlobal() {
        return name == null;
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    @Override
    public String toString() {
        return isGlobal() ? "Global" : "Named(" + name + ")";
    }
}
