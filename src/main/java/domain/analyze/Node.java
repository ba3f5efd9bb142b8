package domain.analyze;

import domain.token.Token;
import domain.token.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A token decorated with its predecessor, its open bracket and template-block stacks, and its
 * normalized prefix and value.
 *
 * <p>Nodes are created once by {@link NodeManager} and appended to the query's arena. Only the
 * template reflow stage rewrites {@link #setValue(String)}, and only the dedent stage truncates
 * the bracket stack.</p>
 */
public final class Node {

    private final int index;
    private final Token token;
    private final Node previous;
    private final String prefix;
    private String value;
    private List<Node> openBrackets;
    private final List<Node> openJinjaBlocks;
    private final int formattingDisabled;

    Node(int index, Token token, Node previous, String prefix, String value,
         List<Node> openBrackets, List<Node> openJinjaBlocks, int formattingDisabled) {
        this.index = index;
        this.token = token;
        this.previous = previous;
        this.prefix = prefix;
        this.value = value;
        this.openBrackets = Collections.unmodifiableList(openBrackets);
        this.openJinjaBlocks = Collections.unmodifiableList(openJinjaBlocks);
        this.formattingDisabled = formattingDisabled;
    }

    /**
     * Newline the formatter appends when it cuts a line after {@code previous}. It carries the
     * predecessor's stacks unchanged.
     */
    public static Node newlineAfter(Node previous) {
        int pos = (previous == null) ? 0 : previous.getToken().getEpos();
        Token token = new Token(TokenType.NEWLINE, "", "\n", pos, pos);
        List<Node> brackets = (previous == null) ? Collections.<Node>emptyList() : previous.openBrackets;
        List<Node> blocks = (previous == null) ? Collections.<Node>emptyList() : previous.openJinjaBlocks;
        return new Node(-1, token, previous, "", "\n", brackets, blocks, 0);
    }

    /** Position in the query's node arena, or -1 for a newline added while formatting. */
    public int getIndex() {
        return index;
    }

    public Token getToken() {
        return token;
    }

    public TokenType getType() {
        return token.getType();
    }

    public Node getPrevious() {
        return previous;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public List<Node> getOpenBrackets() {
        return openBrackets;
    }

    public List<Node> getOpenJinjaBlocks() {
        return openJinjaBlocks;
    }

    public Depth depth() {
        return new Depth(openBrackets.size(), openJinjaBlocks.size());
    }

    /** Drops open brackets beyond {@code sqlDepth}; never adds any. */
    public void dedentTo(int sqlDepth) {
        if (sqlDepth < openBrackets.size()) {
            openBrackets = Collections.unmodifiableList(new ArrayList<>(openBrackets.subList(0, sqlDepth)));
        }
    }

    public boolean isFormattingDisabled() {
        return formattingDisabled > 0;
    }

    int getFormattingDisabledCount() {
        return formattingDisabled;
    }

    /** Normalized prefix plus value. */
    public String render() {
        return prefix + value;
    }

    public int length() {
        return prefix.length() + value.length();
    }

    // ---- kind helpers ----

    public boolean is(TokenType type) {
        return token.getType() == type;
    }

    public boolean isNewline() {
        return is(TokenType.NEWLINE);
    }

    public boolean isComma() {
        return is(TokenType.COMMA);
    }

    public boolean isUntermKeyword() {
        return is(TokenType.UNTERM_KEYWORD);
    }

    public boolean isBooleanOperator() {
        return is(TokenType.BOOLEAN_OPERATOR);
    }

    public boolean isSemicolon() {
        return is(TokenType.SEMICOLON);
    }

    public boolean isSetOperator() {
        return is(TokenType.SET_OPERATOR);
    }

    public boolean isOpeningBracket() {
        return getType().isOpeningBracket();
    }

    public boolean isClosingBracket() {
        return getType().isClosingBracket();
    }

    public boolean isOpeningJinjaBlock() {
        return is(TokenType.JINJA_BLOCK_START) || is(TokenType.JINJA_BLOCK_KEYWORD);
    }

    public boolean isClosingJinjaBlock() {
        return is(TokenType.JINJA_BLOCK_END);
    }

    public boolean isJinja() {
        return getType().isJinja();
    }

    public boolean isMultilineJinja() {
        return isJinja() && value.indexOf('\n') >= 0;
    }

    public boolean dividesQueries() {
        return getType().dividesQueries();
    }

    // ---- context helpers ----

    /** Nearest predecessor that sets SQL context (newlines and template statements skipped). */
    public Node previousSqlNode() {
        Node n = previous;
        while (n != null && n.getType().doesNotSetPrevSqlContext()) {
            n = n.previous;
        }
        return n;
    }

    /** {@code *} used as multiplication rather than as a select-list star. */
    public boolean isMultiplicationStar() {
        if (!is(TokenType.STAR)) return false;
        Node prev = previousSqlNode();
        if (prev == null) return false;
        switch (prev.getType()) {
            case UNTERM_KEYWORD:
            case COMMA:
            case DOT:
            case BRACKET_OPEN:
            case STATEMENT_START:
                return false;
            default:
                return true;
        }
    }

    /** Index brackets ({@code a[0]}) and a call on a closed type bracket ({@code array<int>(...)}). */
    public boolean isBracketOperator() {
        if (!is(TokenType.BRACKET_OPEN)) return false;
        Node prev = previousSqlNode();
        if (prev == null) return false;
        if ("[".equals(value)) {
            return prev.is(TokenType.NAME) || prev.is(TokenType.QUOTED_NAME) || prev.is(TokenType.BRACKET_CLOSE);
        }
        return "(".equals(value) && prev.is(TokenType.BRACKET_CLOSE) && prev.getValue().contains(">");
    }

    public boolean isOperator() {
        return getType().isAlwaysOperator() || isMultiplicationStar() || isBracketOperator();
    }

    /** The {@code and} of {@code between x and y}. */
    public boolean isTheAndAfterBetween() {
        if (!isBooleanOperator() || !"and".equals(value)) return false;
        Depth mine = depth();
        for (Node n = previous; n != null; n = n.previous) {
            int cmp = n.depth().compareTo(mine);
            if (cmp < 0) return false;
            if (cmp == 0) {
                if (n.is(TokenType.WORD_OPERATOR) && n.getValue().endsWith("between")) return true;
                if (n.isBooleanOperator()) return false;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "Node{" + index + " " + getType() + " '" + value + "' depth=" + depth() + "}";
    }
}
