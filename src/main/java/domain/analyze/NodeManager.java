package domain.analyze;

import domain.token.Token;
import domain.token.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Turns tokens into nodes: computes each node's bracket and template-block stacks from its
 * predecessor, its canonical leading whitespace and its normalized value.
 *
 * <p>Everything here is a pure function of the token and the predecessor chain; the manager
 * itself only carries the case-sensitivity flag.</p>
 */
public final class NodeManager {

    private final boolean caseSensitiveNames;

    public NodeManager(boolean caseSensitiveNames) {
        this.caseSensitiveNames = caseSensitiveNames;
    }

    public boolean isCaseSensitiveNames() {
        return caseSensitiveNames;
    }

    public Node createNode(int index, Token token, Node previous) {
        List<Node> brackets = openBracketsAfter(previous);
        List<Node> blocks = openJinjaBlocksAfter(previous);
        TokenType type = token.getType();

        if (type == TokenType.SEMICOLON) {
            // a statement separator closes everything its statement left open
            brackets = Collections.emptyList();
            blocks = Collections.emptyList();
        } else if (type.isClosingBracket()) {
            brackets = closeBracket(brackets);
        } else if ((type == TokenType.UNTERM_KEYWORD && !isLateral(token.getText()))
                || type == TokenType.SET_OPERATOR) {
            if (!brackets.isEmpty() && brackets.get(brackets.size() - 1).isUntermKeyword()) {
                brackets = new ArrayList<>(brackets.subList(0, brackets.size() - 1));
            }
        } else if (type == TokenType.JINJA_BLOCK_END && !blocks.isEmpty()) {
            Node block = blocks.get(blocks.size() - 1);
            blocks = new ArrayList<>(blocks.subList(0, blocks.size() - 1));
            brackets = block.getOpenBrackets();
        }

        return new Node(index, token, previous, computePrefix(token, previous), standardizeValue(token),
                brackets, blocks, disabledCount(token, previous));
    }

    /**
     * Bracket stack that a node following {@code previous} starts from: the predecessor's stack
     * plus the predecessor itself when it opens a bracket or a clause.
     */
    public static List<Node> openBracketsAfter(Node previous) {
        if (previous == null || previous.isSemicolon()) return Collections.emptyList();
        List<Node> brackets = previous.getOpenBrackets();
        if (previous.isOpeningBracket() || (previous.isUntermKeyword() && !isLateral(previous.getValue()))) {
            List<Node> copy = new ArrayList<>(brackets);
            copy.add(previous);
            return copy;
        }
        return brackets;
    }

    static List<Node> openJinjaBlocksAfter(Node previous) {
        if (previous == null || previous.isSemicolon()) return Collections.emptyList();
        List<Node> blocks = previous.getOpenJinjaBlocks();
        if (previous.isOpeningJinjaBlock()) {
            List<Node> copy = new ArrayList<>(blocks);
            copy.add(previous);
            return copy;
        }
        return blocks;
    }

    /** Pops down through and including the nearest opening bracket; an empty stack stays empty. */
    private static List<Node> closeBracket(List<Node> brackets) {
        for (int i = brackets.size() - 1; i >= 0; i--) {
            if (brackets.get(i).isOpeningBracket()) {
                return new ArrayList<>(brackets.subList(0, i));
            }
        }
        return Collections.emptyList();
    }

    private static boolean isLateral(String text) {
        return "lateral".equalsIgnoreCase(text.trim());
    }

    private static int disabledCount(Token token, Node previous) {
        int count = 0;
        if (previous != null) {
            count = previous.getFormattingDisabledCount();
            if ((previous.is(TokenType.FMT_ON) || previous.is(TokenType.DATA)) && count > 0) {
                count--;
            }
        }
        if (token.getType() == TokenType.FMT_OFF || token.getType() == TokenType.DATA) {
            count++;
        }
        return count;
    }

    // ---- whitespace ----

    String computePrefix(Token token, Node previous) {
        TokenType type = token.getType();
        if (previous == null) return "";
        if (type.isNeverPrecededBySpace()) return "";

        if (type.isJinja() && !previous.isNewline()) {
            return preservedSpace(token);
        }
        if (previous.isJinja()) {
            return preservedSpace(token);
        }
        if (type.isJinja()) {
            type = TokenType.NAME;
        }

        Node prev = sqlContext(previous);
        TokenType prevType = (prev == null) ? null : prev.getType();

        if (prevType == TokenType.DOT) return "";
        if (prevType == TokenType.BRACKET_OPEN && type.isPrecededBySpaceExceptAfterOpenBracket()) return "";
        if (type == TokenType.DOUBLE_COLON || prevType == TokenType.DOUBLE_COLON) return "";
        if (prevType == TokenType.COLON && isNameLike(type)) return "";
        if (prevType == TokenType.BRACKET_OPEN && isNameLike(type)) return "";
        if (isUnarySign(prev) && isSignOperand(type)) return "";
        if (type == TokenType.BRACKET_OPEN && prev != null) {
            if ((prevType == TokenType.NAME || prevType == TokenType.QUOTED_NAME)
                    && !"filter".equals(prev.getValue())) {
                return "";
            }
            if (prevType == TokenType.STATEMENT_END) return "";
            if (isBracketOperatorAfter(token.getText(), prev)) return "";
        }
        return " ";
    }

    /** Walks back over newlines and template statements to the token that sets SQL context. */
    private static Node sqlContext(Node previous) {
        Node n = previous;
        while (n != null && n.getType().doesNotSetPrevSqlContext()) {
            n = n.getPrevious();
        }
        return n;
    }

    private static String preservedSpace(Token token) {
        return token.getPrefix().isEmpty() ? "" : " ";
    }

    private static boolean isNameLike(TokenType type) {
        return type == TokenType.NAME || type == TokenType.QUOTED_NAME
                || type == TokenType.STAR || type == TokenType.NUMBER;
    }

    private static boolean isSignOperand(TokenType type) {
        return type == TokenType.NUMBER || type == TokenType.NAME || type == TokenType.QUOTED_NAME
                || type == TokenType.DOT || type == TokenType.BRACKET_OPEN;
    }

    /** A {@code +}/{@code -} in a position where no left operand can precede it. */
    private static boolean isUnarySign(Node sign) {
        if (sign == null || !sign.is(TokenType.OPERATOR)) return false;
        String v = sign.getValue();
        if (!"-".equals(v) && !"+".equals(v)) return false;
        Node before = sign.previousSqlNode();
        if (before == null) return true;
        switch (before.getType()) {
            case OPERATOR:
            case WORD_OPERATOR:
            case ON:
            case BOOLEAN_OPERATOR:
            case UNTERM_KEYWORD:
            case SET_OPERATOR:
            case COMMA:
            case BRACKET_OPEN:
            case STATEMENT_START:
            case COLON:
            case DOUBLE_COLON:
            case SEMICOLON:
            case STAR:
                return true;
            default:
                return false;
        }
    }

    private static boolean isBracketOperatorAfter(String bracket, Node prev) {
        if ("[".equals(bracket)) {
            return prev.is(TokenType.BRACKET_CLOSE);
        }
        return "(".equals(bracket) && prev.is(TokenType.BRACKET_CLOSE) && prev.getValue().contains(">");
    }

    // ---- values ----

    String standardizeValue(Token token) {
        TokenType type = token.getType();
        String text = token.getText();
        if (type.isAlwaysLowercased()) {
            return collapseWhitespace(text.toLowerCase(Locale.ROOT));
        }
        if (type == TokenType.NAME && !caseSensitiveNames && isPlainIdentifier(text)) {
            return text.toLowerCase(Locale.ROOT);
        }
        return text;
    }

    private static boolean isPlainIdentifier(String text) {
        if (text.isEmpty()) return false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean word = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '_' || c >= 0x80;
            if (!word) return false;
        }
        return true;
    }

    static String collapseWhitespace(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean space = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                space = true;
                continue;
            }
            if (space && sb.length() > 0) sb.append(' ');
            space = false;
            sb.append(c);
        }
        return sb.toString();
    }
}
