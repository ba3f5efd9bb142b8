package domain.token;

import java.util.Objects;

/**
 * Immutable lexed token.
 *
 * <p>{@code prefix} is the whitespace that preceded the token on its line (never a newline);
 * {@code spos}/{@code epos} are char offsets into the source, {@code epos} exclusive.</p>
 */
public final class Token {

    private final TokenType type;
    private final String prefix;
    private final String text;
    private final int spos;
    private final int epos;

    public Token(TokenType type, String prefix, String text, int spos, int epos) {
        this.type = Objects.requireNonNull(type, "type");
        this.prefix = prefix == null ? "" : prefix;
        this.text = text == null ? "" : text;
        this.spos = spos;
        this.epos = epos;
    }

    public TokenType getType() {
        return type;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getText() {
        return text;
    }

    public int getSpos() {
        return spos;
    }

    public int getEpos() {
        return epos;
    }

    /** Same token re-kinded; used when a keyword falls back to a name. */
    public Token withType(TokenType newType) {
        return new Token(newType, prefix, text, spos, epos);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token t = (Token) o;
        return spos == t.spos && epos == t.epos && type == t.type
                && prefix.equals(t.prefix) && text.equals(t.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, prefix, text, spos, epos);
    }

    @Override
    public String toString() {
        return type + "('" + text + "')";
    }
}
