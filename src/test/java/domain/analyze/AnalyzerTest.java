package domain.analyze;

import domain.model.BracketException;
import domain.model.ErrorCode;
import domain.token.TokenType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalyzerTest {

    private static Query parse(String sql) {
        return new Analyzer(88, false).parseQuery(sql);
    }

    private static List<Line> codeLines(Query q) {
        List<Line> out = new ArrayList<>();
        for (Line line : q.getLines()) {
            if (line.contentCount() > 0) out.add(line);
        }
        return out;
    }

    private static Node node(Query q, String value) {
        for (Node n : q.getNodes()) {
            if (n.getValue().equals(value)) return n;
        }
        throw new AssertionError("no node " + value);
    }

    @Test
    void one_line_per_source_line() {
        Query q = parse("select a,\n  b\nfrom t\n");
        assertEquals(3, codeLines(q).size());
        assertEquals("select a,\n", codeLines(q).get(0).render());
    }

    @Test
    void empty_source_has_no_code() {
        Query q = parse("");
        assertTrue(codeLines(q).isEmpty());
        assertEquals("", q.render().trim());
    }

    @Test
    void comment_on_its_own_line_is_standalone() {
        Query q = parse("-- top\nselect 1\n");
        List<Comment> comments = q.comments();
        assertEquals(1, comments.size());
        assertTrue(comments.get(0).isStandalone());
        assertEquals("-- top", comments.get(0).getText());
    }

    @Test
    void comment_after_code_is_inline() {
        Query q = parse("select 1 -- trailing\n");
        Comment c = q.comments().get(0);
        assertFalse(c.isStandalone());
        assertTrue(c.isInline());
        assertEquals("  -- trailing", c.renderInline());
    }

    @Test
    void comment_after_semicolon_trails_the_statement_it_ends() {
        Query q = parse("select 1; -- note\nselect 2\n");
        Line first = codeLines(q).get(0);
        assertEquals(TokenType.SEMICOLON, first.lastContentNode().getType());
        assertEquals(1, first.getComments().size());
        assertEquals("-- note", first.getComments().get(0).getText());
    }

    @Test
    void semicolon_ends_the_line_and_resets_depth() {
        Query q = parse("select (1; select 2\n");
        List<Line> lines = codeLines(q);
        assertEquals(2, lines.size());
        assertEquals(Depth.ZERO, lines.get(1).depth());
    }

    @Test
    void set_operator_gets_its_own_line() {
        Query q = parse("select 1 union all select 2\n");
        List<Line> lines = codeLines(q);
        assertEquals(3, lines.size());
        assertTrue(lines.get(1).startsWithSetOperator());
        assertEquals(1, lines.get(1).contentCount());
        assertEquals("union all", lines.get(1).firstContentNode().getValue());
    }

    @Test
    void angle_brackets_after_type_names() {
        Query q = parse("select cast(a as array<struct<b int>>) from t\n");
        long opens = q.getNodes().stream().filter(n -> n.is(TokenType.BRACKET_OPEN) && n.getValue().equals("<")).count();
        long closes = q.getNodes().stream().filter(n -> n.is(TokenType.BRACKET_CLOSE) && n.getValue().equals(">")).count();
        assertEquals(2, opens);
        assertEquals(2, closes);
        assertEquals(Depth.ZERO, node(q, "from").depth());
    }

    @Test
    void greater_than_without_type_bracket_is_an_operator() {
        Query q = parse("select a > b\n");
        assertEquals(TokenType.OPERATOR, node(q, ">").getType());
    }

    @Test
    void depth_follows_clauses_and_brackets() {
        Query q = parse("select a, (b + c) from t\n");
        assertEquals(new Depth(0, 0), node(q, "select").depth());
        assertEquals(new Depth(1, 0), node(q, "a").depth());
        assertEquals(new Depth(2, 0), node(q, "b").depth());
        assertEquals(new Depth(1, 0), node(q, ")").depth());
        assertEquals(new Depth(0, 0), node(q, "from").depth());
        assertEquals(new Depth(1, 0), node(q, "t").depth());
    }

    @Test
    void template_blocks_add_jinja_depth() {
        Query q = parse("{% if x %}\nselect 1\n{% endif %}\n");
        assertEquals(new Depth(0, 1), node(q, "select").depth());
        Node end = q.getNodes().stream().filter(n -> n.is(TokenType.JINJA_BLOCK_END)).findFirst().orElseThrow();
        assertEquals(Depth.ZERO, end.depth());
    }

    @Test
    void whitespace_is_normalized_between_tokens() {
        Query q = parse("SELECT   a ,b,  f ( x ) ,  t . col,  - 1 FROM t\n");
        assertEquals("select a, b, f(x), t.col, -1 from t\n", codeLines(q).get(0).render());
    }

    @Test
    void names_are_lowercased_unless_case_sensitive() {
        assertEquals("mycol", node(parse("select MyCol\n"), "mycol").getValue());

        Query sensitive = new Analyzer(88, true).parseQuery("select MyCol, \"Quoted\"\n");
        assertEquals("MyCol", node(sensitive, "MyCol").getValue());
        assertEquals("\"Quoted\"", node(sensitive, "\"Quoted\"").getValue());
    }

    @Test
    void unmatched_closing_bracket_is_rejected() {
        BracketException e = assertThrows(BracketException.class, () -> parse("SELECT )\n"));
        assertEquals(ErrorCode.BRACKET, e.getCode());
        assertEquals(")", e.getDelimiter());
    }

    @Test
    void unbalanced_block_comments_are_rejected() {
        assertThrows(BracketException.class, () -> parse("select 1 /* open\n"));
        assertThrows(BracketException.class, () -> parse("select 1 */\n"));
        // markers inside strings do not count
        assertDoesNotThrow(() -> parse("select '*/' from t\n"));
    }

    @Test
    void lex_returns_every_node_token_in_order() {
        List<TokenType> types = new ArrayList<>();
        new Analyzer(88, false).lex("select 1\n").forEach(t -> types.add(t.getType()));
        assertEquals(TokenType.UNTERM_KEYWORD, types.get(0));
        assertEquals(TokenType.NUMBER, types.get(1));
        assertTrue(types.contains(TokenType.NEWLINE));
    }
}
