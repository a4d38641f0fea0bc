package miniparse;

import lombok.Getter;

import java.util.regex.Matcher;

public final class ClassifiedLine {

    @Getter
    private final LineKind kind;
    @Getter
    private final String text;
    private final Matcher match;

    private ClassifiedLine(LineKind kind, String text, Matcher match) {
        this.kind = kind;
        this.text = text;
        this.match = match;
    }

    static ClassifiedLine blank() {
        return new ClassifiedLine(LineKind.BLANK, "", null);
    }

    static ClassifiedLine keyValue(String text, Matcher match) {
        return new ClassifiedLine(LineKind.KEY_VALUE, text, match);
    }

    static ClassifiedLine sectionHeader(String text, Matcher match) {
        return new ClassifiedLine(LineKind.SECTION_HEADER, text, match);
    }

    static ClassifiedLine unparsable(String text) {
        return new ClassifiedLine(LineKind.UNPARSABLE, text, null);
    }

    public String key() {
        return group(LineClassifier.KEY_GROUP, LineKind.KEY_VALUE);
    }

    public String value() {
        return group(LineClassifier.VALUE_GROUP, LineKind.KEY_VALUE);
    }

    public String sectionName() {
        return group(LineClassifier.SECTION_NAME_GROUP, LineKind.SECTION_HEADER);
    }

    private String group(String name, LineKind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Line '" + text + "' is " + kind + ", not " + expected);
        }
        String captured;
        try {
            captured = match.group(name);
        } catch (IllegalArgumentException e) {
            throw new GrammarDefectException(name, e);
        }
        if (captured == null) {
            throw new GrammarDefectException(name);
        }
        return captured;
    }
}
