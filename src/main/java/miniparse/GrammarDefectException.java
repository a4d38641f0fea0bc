package miniparse;

import lombok.Getter;

/**
 * A pattern matched but its named group could not be read. Never caused by the input.
 */
@Getter
public class GrammarDefectException extends IllegalStateException {

    private final String groupName;

    public GrammarDefectException(String groupName) {
        super(message(groupName));
        this.groupName = groupName;
    }

    public GrammarDefectException(String groupName, Throwable cause) {
        super(message(groupName), cause);
        this.groupName = groupName;
    }

    private static String message(String groupName) {
        return "Regex match, but the named group '" + groupName
                + "' was not found: did the capture group name change?";
    }
}
