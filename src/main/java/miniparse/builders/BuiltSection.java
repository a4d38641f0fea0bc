package miniparse.builders;

import lombok.NonNull;
import lombok.Value;
import miniparse.models.Section;
import miniparse.models.SectionId;

@Value
public class BuiltSection {
    @NonNull
    SectionId id;
    @NonNull
    Section section;
}
