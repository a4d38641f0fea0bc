package miniparse.models;

import lombok.NonNull;
import lombok.Value;

@Value
public class Entry {
    @NonNull
    String key;
    @NonNull
    String value;

    @Override
    public String toString() {
        return key + " = " + value;
    }
}
