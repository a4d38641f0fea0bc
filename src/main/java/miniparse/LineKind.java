package miniparse;

public enum LineKind {
    BLANK,
    KEY_VALUE,
    SECTION_HEADER,
    UNPARSABLE
}
