package miniparse;

import lombok.NonNull;
import org.apache.commons.lang3.StringUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

public class LineClassifier {

    public static final String KEY_GROUP = "key";
    public static final String VALUE_GROUP = "value";
    public static final String SECTION_NAME_GROUP = "sectionName";

    static final Pattern KEY_VALUE_PATTERN = Pattern.compile(
            "^\\s*(?<" + KEY_GROUP + ">[^=\\s]+)\\s*=\\s*(?<" + VALUE_GROUP + ">[^=\\s]+)\\s*$",
            Pattern.UNICODE_CHARACTER_CLASS);
    // name runs from the first '[' to the last ']'
    static final Pattern SECTION_HEADER_PATTERN = Pattern.compile(
            "^\\[(?<" + SECTION_NAME_GROUP + ">.+)]$", Pattern.UNIX_LINES);

    private static final Pattern SURROUNDING_WHITESPACE = Pattern.compile("^\\s+|\\s+$",
            Pattern.UNICODE_CHARACTER_CLASS);

    private final Pattern keyValuePattern;
    private final Pattern sectionHeaderPattern;

    public LineClassifier() {
        this(KEY_VALUE_PATTERN, SECTION_HEADER_PATTERN);
    }

    LineClassifier(@NonNull Pattern keyValuePattern, @NonNull Pattern sectionHeaderPattern) {
        this.keyValuePattern = keyValuePattern;
        this.sectionHeaderPattern = sectionHeaderPattern;
    }

    public ClassifiedLine classify(@NonNull String line) {
        if (strip(line).isEmpty()) {
            return ClassifiedLine.blank();
        }

        Matcher keyValue = keyValuePattern.matcher(line);
        if (keyValue.matches()) {
            return ClassifiedLine.keyValue(line, keyValue);
        }

        Matcher sectionHeader = sectionHeaderPattern.matcher(line);
        if (sectionHeader.matches()) {
            return ClassifiedLine.sectionHeader(line, sectionHeader);
        }

        return ClassifiedLine.unparsable(line);
    }

    static Stream<String> lines(String text) {
        return StringUtils.defaultString(text).lines().map(LineClassifier::strip);
    }

    // same whitespace as \s in the key-value pattern, wider than String.strip
    static String strip(String line) {
        return SURROUNDING_WHITESPACE.matcher(line).replaceAll("");
    }
}
