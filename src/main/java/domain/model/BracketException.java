package domain.model;

/**
 * Unbalanced delimiters: stray or unterminated block comments, or a closing bracket with
 * nothing open.
 */
public class BracketException extends SqlfmtException {

    private final String delimiter;

    public BracketException(String delimiter, String message) {
        super(ErrorCode.BRACKET, message);
        this.delimiter = delimiter == null ? "" : delimiter;
    }

    public static BracketException strayCommentClose() {
        return new BracketException("*/", "Encountered */ without a preceding /*");
    }

    public static BracketException unterminatedComment() {
        return new BracketException("/*", "Unterminated multiline comment (/* without matching */)");
    }

    public static BracketException unmatchedClose(String bracket) {
        return new BracketException(bracket,
                "Encountered closing bracket '" + bracket + "' without a matching opening bracket");
    }

    public String getDelimiter() {
        return delimiter;
    }
}
