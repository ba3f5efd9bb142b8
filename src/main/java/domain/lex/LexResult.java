package domain.lex;

/**
 * One lexer match: the action, the leading whitespace, the token text and the total number of
 * chars consumed (prefix + text).
 */
public final class LexResult {

    private final LexAction action;
    private final String prefix;
    private final String text;
    private final int length;

    public LexResult(LexAction action, String prefix, String text) {
        this(action, prefix, text, prefix.length() + text.length());
    }

    public LexResult(LexAction action, String prefix, String text, int length) {
        this.action = action;
        this.prefix = prefix;
        this.text = text;
        this.length = length;
    }

    public LexAction getAction() {
        return action;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getText() {
        return text;
    }

    public int getLength() {
        return length;
    }

    @Override
    public String toString() {
        return "LexResult{" + action + ", prefix='" + prefix + "', text='" + text + "', length=" + length + "}";
    }
}
