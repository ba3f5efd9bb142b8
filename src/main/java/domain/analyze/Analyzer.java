package domain.analyze;

import domain.lex.LexAction;
import domain.lex.LexResult;
import domain.lex.LexState;
import domain.lex.Lexer;
import domain.model.ParsingException;
import domain.token.Token;
import domain.token.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives the {@link Lexer} over a whole source text and assembles the result into a {@link Query}.
 *
 * <p>The analyzer owns the lex-state stack and the node, comment and line buffers. Depth and
 * spacing are left to {@link NodeManager}; the analyzer decides token kinds that need context
 * (a reserved word after a dot, {@code end} without {@code case}, {@code >} closing a type).</p>
 *
 * <p>Instances keep per-parse state and are not thread-safe. Create one per document.</p>
 */
public final class Analyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Analyzer.class);

    private final int lineLength;
    private final NodeManager nodeManager;

    private final List<LexState> states = new ArrayList<>();
    private final List<Node> arena = new ArrayList<>();
    private final List<Node> nodeBuffer = new ArrayList<>();
    private final List<Comment> commentBuffer = new ArrayList<>();
    private final List<Line> lineBuffer = new ArrayList<>();
    private String source = "";
    private int pos;
    private boolean suppressNextNewline;
    private boolean hadSuppressedNewline;
    private String trailingWhitespace = "";

    public Analyzer(int lineLength, boolean caseSensitiveNames) {
        this.lineLength = lineLength;
        this.nodeManager = new NodeManager(caseSensitiveNames);
    }

    /**
     * Lexes and groups {@code source} into lines.
     *
     * @throws domain.model.BracketException on unbalanced comment markers or closing brackets
     * @throws ParsingException when the lexer cannot make progress
     */
    public Query parseQuery(String source) {
        SourceValidator.validateCommentMarkers(source);
        reset(source);
        lex();
        flushLineBuffer();
        SourceValidator.validateBrackets(arena);
        return new Query(this.source, lineLength, lineBuffer, arena);
    }

    /** Token stream only, newlines included; used by the safety check and for tooling. */
    public List<Token> lex(String source) {
        Query query = parseQuery(source);
        List<Token> tokens = new ArrayList<>();
        for (Node node : query.getNodes()) {
            tokens.add(node.getToken());
        }
        return tokens;
    }

    private void reset(String source) {
        this.source = (source == null) ? "" : source;
        states.clear();
        states.add(LexState.MAIN);
        arena.clear();
        nodeBuffer.clear();
        commentBuffer.clear();
        lineBuffer.clear();
        pos = 0;
        suppressNextNewline = false;
        hadSuppressedNewline = false;
        trailingWhitespace = "";
    }

    private void lex() {
        while (pos < source.length()) {
            LexResult result = Lexer.lexOne(source, pos, currentState());
            if (result == null) {
                pos = source.length();
                return;
            }
            boolean consumed = execute(result, result.getAction());
            if (consumed) {
                if (result.getLength() == 0) throw new ParsingException(pos, source.substring(pos));
                pos += result.getLength();
            }
        }
    }

    /** Returns false when the action left the input for the next state to re-lex. */
    private boolean execute(LexResult r, LexAction action) {
        if (action.isReserved() && previousSqlType() == TokenType.DOT) {
            addNode(r.getPrefix(), r.getText(), TokenType.NAME);
            return true;
        }
        if (action.isTopLevelOnly() && !currentBrackets().isEmpty()) {
            addNode(r.getPrefix(), r.getText(), TokenType.NAME);
            return true;
        }

        switch (action.getKind()) {
            case ADD_NODE:
                if (action.getType() == TokenType.OPERATOR && ">>".equals(r.getText()) && openAngleCount() > 0) {
                    handleDoubleClosingAngle(r);
                    return true;
                }
                addNode(r.getPrefix(), r.getText(), action.getType());
                if (action.getType() == TokenType.FMT_OFF) {
                    pushState(LexState.FMT_OFF);
                } else if (action.getType() == TokenType.FMT_ON && currentState() == LexState.FMT_OFF) {
                    popState();
                }
                return true;
            case ADD_COMMENT:
                addComment(r.getPrefix(), r.getText());
                return true;
            case NEWLINE:
                handleNewline(r.getPrefix());
                return true;
            case SEMICOLON:
                addNode(r.getPrefix(), r.getText(), TokenType.SEMICOLON);
                flushLineBuffer();
                while (states.size() > 1) {
                    popState();
                }
                hadSuppressedNewline = false;
                suppressNextNewline = true;
                return true;
            case SET_OPERATOR:
                handleSetOperator(r);
                return true;
            case DDL_AS:
                addNode(r.getPrefix(), r.getText(), TokenType.UNTERM_KEYWORD);
                if (!quotedBodyFollows(pos + r.getLength())) {
                    popState();
                }
                return true;
            case CLOSING_ANGLE:
                handleClosingAngle(r);
                return true;
            case ANGLE_TYPE_OPEN:
                handleAngleTypeOpen(r);
                return true;
            case STATEMENT_END:
                addNode(r.getPrefix(), r.getText(),
                        hasOpenStatement() ? TokenType.STATEMENT_END : TokenType.NAME);
                return true;
            case JINJA_BLOCK_START:
                addNode(r.getPrefix(), r.getText(), TokenType.JINJA_BLOCK_START);
                if (action.getState() != null) {
                    pushState(action.getState());
                }
                return true;
            case JINJA_BLOCK_KEYWORD:
                handleBlockKeyword(r);
                return true;
            case JINJA_BLOCK_END:
                if (currentState() == LexState.JINJA_SET_BLOCK || currentState() == LexState.JINJA_CALL_BLOCK) {
                    popState();
                }
                addNode(r.getPrefix(), r.getText(), TokenType.JINJA_BLOCK_END);
                return true;
            case JINJA_EXPRESSION:
                addNode(r.getPrefix(), r.getText(), TokenType.JINJA_EXPRESSION);
                return true;
            case KEYWORD_BEFORE_PAREN:
                return handleKeywordBeforeParen(r, action);
            case LEX_RULESET:
                if (action.getState() == currentState()) {
                    throw new ParsingException(pos, source.substring(pos));
                }
                pushState(action.getState());
                return false;
            default:
                throw new IllegalStateException("Unhandled lex action: " + action);
        }
    }

    // ---- actions ----

    private void handleNewline(String prefix) {
        if (suppressNextNewline) {
            suppressNextNewline = false;
            hadSuppressedNewline = true;
            return;
        }
        trailingWhitespace = prefix;
        flushLineBuffer();
        trailingWhitespace = "";
    }

    private void handleSetOperator(LexResult r) {
        if (!nodeBuffer.isEmpty() || !commentBuffer.isEmpty()) {
            flushLineBuffer();
        }
        addNode(r.getPrefix(), r.getText(), TokenType.SET_OPERATOR);
        flushLineBuffer();
        hadSuppressedNewline = false;
        suppressNextNewline = true;
    }

    private void handleClosingAngle(LexResult r) {
        Node opener = nearestOpeningBracket();
        if (opener != null && "<".equals(opener.getValue())) {
            addNode(r.getPrefix(), r.getText(), TokenType.BRACKET_CLOSE);
        } else {
            addNode(r.getPrefix(), r.getText(), TokenType.OPERATOR);
        }
    }

    /** {@code >>} closing two nested types, or closing one and then shifting. */
    private void handleDoubleClosingAngle(LexResult r) {
        boolean both = openAngleCount() >= 2;
        addNode(r.getPrefix(), ">", TokenType.BRACKET_CLOSE);
        addNode("", ">", both ? TokenType.BRACKET_CLOSE : TokenType.OPERATOR,
                pos + r.getPrefix().length() + 1);
    }

    /** {@code array<}: a name, then a {@code <} opening bracket glued to it. */
    private void handleAngleTypeOpen(LexResult r) {
        String text = r.getText();
        int end = 0;
        while (end < text.length() && text.charAt(end) != '<' && !Character.isWhitespace(text.charAt(end))) {
            end++;
        }
        addNode(r.getPrefix(), text.substring(0, end), TokenType.NAME);
        String between = text.substring(end, text.indexOf('<'));
        addNode(between, "<", TokenType.BRACKET_OPEN, pos + r.getPrefix().length() + end);
    }

    /**
     * {@code else}/{@code elif} closes the current branch and opens the next one as if it
     * directly followed whatever preceded the block's opening tag.
     */
    private void handleBlockKeyword(LexResult r) {
        List<Node> blocks = NodeManager.openJinjaBlocksAfter(lastNode());
        Node previous = lastNode();
        if (!blocks.isEmpty()) {
            previous = blocks.get(blocks.size() - 1).getPrevious();
        }
        Token token = new Token(TokenType.JINJA_BLOCK_KEYWORD, r.getPrefix(), r.getText(), pos, pos + r.getLength());
        Node node = nodeManager.createNode(arena.size(), token, previous);
        appendNode(node);
    }

    /**
     * {@code except(}/{@code exclude(}/{@code replace(} modify a preceding star; anywhere else
     * {@code except} is the set operator and the others are function names.
     */
    private boolean handleKeywordBeforeParen(LexResult r, LexAction action) {
        if (previousSqlType() == TokenType.STAR) {
            addNode(r.getPrefix(), r.getText(), action.getType());
        } else if ("except".equalsIgnoreCase(r.getText())) {
            handleSetOperator(r);
        } else {
            addNode(r.getPrefix(), r.getText(), TokenType.NAME);
        }
        return true;
    }

    /** Whether the text after {@code as} (skipping blanks and comments) opens a quoted body. */
    private boolean quotedBodyFollows(int from) {
        int i = from;
        int len = source.length();
        while (i < len) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (source.startsWith("--", i) || source.startsWith("//", i) || c == '#') {
                int nl = source.indexOf('\n', i);
                if (nl < 0) return false;
                i = nl + 1;
            } else if (source.startsWith("/*", i)) {
                int end = source.indexOf("*/", i + 2);
                if (end < 0) return false;
                i = end + 2;
            } else {
                return c == '\'' || c == '"' || c == '`' || source.startsWith("$$", i);
            }
        }
        return false;
    }

    // ---- comments ----

    private void addComment(String prefix, String text) {
        Token token = new Token(TokenType.COMMENT, "", text, pos, pos + prefix.length() + text.length());
        boolean standalone = nodeBuffer.isEmpty();
        Node anchor = lastNode();
        if (!standalone) {
            Node last = nodeBuffer.get(nodeBuffer.size() - 1);
            if (last.isSemicolon() && nodeBuffer.size() >= 2) {
                anchor = nodeBuffer.get(nodeBuffer.size() - 2);
            }
        }

        if (standalone && !lineBuffer.isEmpty() && !hadSuppressedNewline && attachAfterSemicolon(token)) {
            return;
        }
        hadSuppressedNewline = false;
        commentBuffer.add(new Comment(token, standalone, anchor));
    }

    /**
     * A comment on the same physical line as a just-flushed {@code ;} trails the statement it
     * ends, not the next one.
     */
    private boolean attachAfterSemicolon(Token token) {
        int lastIndex = lineBuffer.size() - 1;
        Line last = lineBuffer.get(lastIndex);
        Node lastContent = last.lastContentNode();
        if (lastContent == null || !lastContent.isSemicolon()) return false;
        List<Node> content = last.contentNodes();
        Node anchor = content.size() >= 2 ? content.get(content.size() - 2) : content.get(0);
        List<Comment> comments = new ArrayList<>(last.getComments());
        comments.add(new Comment(token, false, anchor));
        lineBuffer.set(lastIndex, last.withComments(comments));
        return true;
    }

    // ---- nodes and lines ----

    private void addNode(String prefix, String text, TokenType type) {
        addNode(prefix, text, type, pos);
    }

    private void addNode(String prefix, String text, TokenType type, int spos) {
        Token token = new Token(type, prefix, text, spos, spos + prefix.length() + text.length());
        appendNode(nodeManager.createNode(arena.size(), token, lastNode()));
    }

    private void appendNode(Node node) {
        arena.add(node);
        nodeBuffer.add(node);
        suppressNextNewline = false;
    }

    private void flushLineBuffer() {
        Node previous = nodeBuffer.isEmpty() ? lastNode() : nodeBuffer.get(0).getPrevious();
        Token newlineToken = new Token(TokenType.NEWLINE, trailingWhitespace, "\n", pos, pos + 1);
        Node newline = nodeManager.createNode(arena.size(), newlineToken, lastNode());
        arena.add(newline);

        boolean disabled = newline.isFormattingDisabled();
        for (Node node : nodeBuffer) {
            if (node.isFormattingDisabled()) {
                disabled = true;
                break;
            }
        }
        List<Node> nodes = new ArrayList<>(nodeBuffer);
        nodes.add(newline);
        lineBuffer.add(new Line(previous, nodes, commentBuffer, disabled));
        nodeBuffer.clear();
        commentBuffer.clear();
    }

    private Node lastNode() {
        return arena.isEmpty() ? null : arena.get(arena.size() - 1);
    }

    private TokenType previousSqlType() {
        Node n = lastNode();
        while (n != null && n.getType().doesNotSetPrevSqlContext()) {
            n = n.getPrevious();
        }
        return n == null ? null : n.getType();
    }

    private List<Node> currentBrackets() {
        return NodeManager.openBracketsAfter(lastNode());
    }

    private Node nearestOpeningBracket() {
        List<Node> brackets = currentBrackets();
        for (int i = brackets.size() - 1; i >= 0; i--) {
            if (brackets.get(i).isOpeningBracket()) return brackets.get(i);
        }
        return null;
    }

    private int openAngleCount() {
        int n = 0;
        for (Node bracket : currentBrackets()) {
            if (bracket.is(TokenType.BRACKET_OPEN) && "<".equals(bracket.getValue())) n++;
        }
        return n;
    }

    private boolean hasOpenStatement() {
        for (Node n : currentBrackets()) {
            if (n.is(TokenType.STATEMENT_START)) return true;
        }
        return false;
    }

    // ---- lex states ----

    private LexState currentState() {
        return states.get(states.size() - 1);
    }

    private void pushState(LexState state) {
        states.add(state);
        LOGGER.trace("lex state push {} at {}", state, pos);
    }

    private void popState() {
        if (states.size() > 1) {
            LexState popped = states.remove(states.size() - 1);
            LOGGER.trace("lex state pop {} at {}", popped, pos);
        }
    }
}
