package domain.model;

/**
 * No lexer rule matched. Keeps the offset and up to 40 chars of the text found there.
 */
public class ParsingException extends SqlfmtException {

    private static final int SNIPPET_LENGTH = 40;

    private final int position;
    private final String snippet;

    public ParsingException(int position, String remaining) {
        this(position, remaining, snippet(remaining));
    }

    private ParsingException(int position, String remaining, String snippet) {
        super(ErrorCode.PARSING, "Could not parse SQL at position " + position + ": '" + snippet + "'");
        this.position = position;
        this.snippet = snippet;
    }

    private static String snippet(String remaining) {
        if (remaining == null) return "";
        return remaining.length() <= SNIPPET_LENGTH ? remaining : remaining.substring(0, SNIPPET_LENGTH);
    }

    public int getPosition() {
        return position;
    }

    public String getSnippet() {
        return snippet;
    }
}
