package domain.lex;

import domain.token.TokenType;

import java.util.Objects;

/**
 * What the analyzer should do with a lexer match.
 *
 * <p>Two wrappers refine the base action: a <em>reserved</em> keyword degrades to a plain
 * name right after a {@code .}, and a <em>top-level</em> keyword degrades to a name inside
 * any bracket.</p>
 */
public final class LexAction {

    public enum Kind {
        ADD_NODE,
        ADD_COMMENT,
        NEWLINE,
        SEMICOLON,
        SET_OPERATOR,
        /** {@code as} inside a function definition header. */
        DDL_AS,
        /** {@code >} that is either a type-bracket close or a comparison. */
        CLOSING_ANGLE,
        /** {@code array<}, {@code struct<}, ... split into a name and a bracket. */
        ANGLE_TYPE_OPEN,
        /** {@code end}, which closes a {@code case} or is just a name. */
        STATEMENT_END,
        JINJA_BLOCK_START,
        JINJA_BLOCK_KEYWORD,
        JINJA_BLOCK_END,
        JINJA_EXPRESSION,
        /** Keyword directly followed by {@code (}; only the keyword is consumed. */
        KEYWORD_BEFORE_PAREN,
        /** Enter another lex state without consuming input. */
        LEX_RULESET
    }

    private final Kind kind;
    private final TokenType type;
    private final LexState state;
    private final boolean reserved;
    private final boolean topLevelOnly;

    private LexAction(Kind kind, TokenType type, LexState state, boolean reserved, boolean topLevelOnly) {
        this.kind = kind;
        this.type = type;
        this.state = state;
        this.reserved = reserved;
        this.topLevelOnly = topLevelOnly;
    }

    public static LexAction of(Kind kind) {
        return new LexAction(kind, null, null, false, false);
    }

    public static LexAction add(TokenType type) {
        return new LexAction(Kind.ADD_NODE, type, null, false, false);
    }

    public static LexAction beforeParen(TokenType type) {
        return new LexAction(Kind.KEYWORD_BEFORE_PAREN, type, null, false, false);
    }

    /** Jinja block start; {@code dataState} is the passthrough state its body is lexed in, or null. */
    public static LexAction blockStart(LexState dataState) {
        return new LexAction(Kind.JINJA_BLOCK_START, TokenType.JINJA_BLOCK_START, dataState, false, false);
    }

    public static LexAction ruleset(LexState state) {
        return new LexAction(Kind.LEX_RULESET, null, state, false, false);
    }

    /** Same action, but a name when it directly follows a dot ({@code t.select}). */
    public LexAction reserved() {
        return new LexAction(kind, type, state, true, topLevelOnly);
    }

    /** Same action, but a name when any bracket is open. */
    public LexAction topLevelOnly() {
        return new LexAction(kind, type, state, reserved, true);
    }

    public Kind getKind() {
        return kind;
    }

    public TokenType getType() {
        return type;
    }

    public LexState getState() {
        return state;
    }

    public boolean isReserved() {
        return reserved;
    }

    public boolean isTopLevelOnly() {
        return topLevelOnly;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LexAction)) return false;
        LexAction that = (LexAction) o;
        return kind == that.kind
                && type == that.type
                && state == that.state
                && reserved == that.reserved
                && topLevelOnly == that.topLevelOnly;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, type, state, reserved, topLevelOnly);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (type != null) sb.append('(').append(type).append(')');
        if (state != null) sb.append('[').append(state).append(']');
        if (reserved) sb.append(" reserved");
        if (topLevelOnly) sb.append(" top-level");
        return sb.toString();
    }
}
