package domain.lex;

import domain.analyze.Analyzer;
import domain.analyze.Node;
import domain.token.Token;
import domain.token.TokenType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    private static List<Token> tokens(String sql) {
        List<Token> out = new ArrayList<>();
        for (Token t : new Analyzer(88, false).lex(sql)) {
            if (t.getType() != TokenType.NEWLINE) out.add(t);
        }
        return out;
    }

    private static List<TokenType> types(String sql) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : tokens(sql)) out.add(t.getType());
        return out;
    }

    @Test
    void lexOne_returns_null_when_only_spaces_remain() {
        assertNull(Lexer.lexOne("select   ", 6, LexState.MAIN));
    }

    @Test
    void lexOne_keeps_leading_spaces_as_prefix() {
        LexResult r = Lexer.lexOne("select   a", 6, LexState.MAIN);
        assertNotNull(r);
        assertEquals("   ", r.getPrefix());
        assertEquals("a", r.getText());
        assertEquals(TokenType.NAME, r.getAction().getType());
    }

    @Test
    void multi_word_keywords_take_the_longest_match() {
        LexResult r = Lexer.lexOne("LEFT  OUTER JOIN b", 0, LexState.MAIN);
        assertEquals("LEFT  OUTER JOIN", r.getText());
        assertEquals(TokenType.UNTERM_KEYWORD, r.getAction().getType());

        List<Node> nodes = new Analyzer(88, false).parseQuery("select * from a LEFT  OUTER JOIN b\n").getNodes();
        assertTrue(nodes.stream().anyMatch(n -> n.isUntermKeyword() && n.getValue().equals("left outer join")));
    }

    @Test
    void clause_keywords_and_names() {
        assertEquals(List.of(TokenType.UNTERM_KEYWORD, TokenType.NAME, TokenType.UNTERM_KEYWORD, TokenType.NAME),
                types("SELECT a FROM t"));
        assertEquals(List.of(TokenType.UNTERM_KEYWORD, TokenType.NAME, TokenType.UNTERM_KEYWORD, TokenType.NAME),
                types("select a order  by a"));
    }

    @Test
    void keyword_after_dot_is_a_name() {
        List<TokenType> t = types("select t.select from t");
        assertEquals(TokenType.NAME, t.get(1));
        assertEquals(TokenType.DOT, t.get(2));
        assertEquals(TokenType.NAME, t.get(3));
    }

    @Test
    void numbers() {
        for (String n : new String[]{"42", "1.5", ".5", "1e10", "2.5E-3", "0x1F"}) {
            List<Token> t = tokens("select " + n);
            assertEquals(2, t.size(), n);
            assertEquals(TokenType.NUMBER, t.get(1).getType(), n);
            assertEquals(n, t.get(1).getText());
        }
    }

    @Test
    void strings_are_single_tokens_and_quoted_names_keep_their_quotes() {
        List<Token> t = tokens("select 'hello world', \"My Col\", `x y`");
        assertEquals(TokenType.NAME, t.get(1).getType());
        assertEquals("'hello world'", t.get(1).getText());
        assertEquals(TokenType.QUOTED_NAME, t.get(3).getType());
        assertEquals("\"My Col\"", t.get(3).getText());
        assertEquals(TokenType.QUOTED_NAME, t.get(5).getType());
    }

    @Test
    void doubled_quotes_stay_inside_one_literal() {
        List<Token> t = tokens("select 'it''s', \"a\"\"b\", '' from t");
        assertEquals("'it''s'", t.get(1).getText());
        assertEquals(TokenType.NAME, t.get(1).getType());
        assertEquals("\"a\"\"b\"", t.get(3).getText());
        assertEquals(TokenType.QUOTED_NAME, t.get(3).getType());
        assertEquals("''", t.get(5).getText());
        assertEquals(TokenType.UNTERM_KEYWORD, t.get(6).getType());
    }

    @Test
    void compound_operators() {
        assertEquals(">=", tokens("a >= b").get(1).getText());
        assertEquals("<>", tokens("a <> b").get(1).getText());
        assertEquals("||", tokens("a || b").get(1).getText());
        assertEquals("->>", tokens("a ->> 'k'").get(1).getText());
        assertEquals(TokenType.OPERATOR, tokens("a ->> 'k'").get(1).getType());
        assertEquals(TokenType.DOUBLE_COLON, tokens("x::int").get(1).getType());
    }

    @Test
    void word_and_boolean_operators() {
        List<TokenType> t = types("select * from t where a not in (1) and b is not null");
        assertTrue(t.contains(TokenType.WORD_OPERATOR));
        assertTrue(t.contains(TokenType.BOOLEAN_OPERATOR));
        assertEquals("not in", tokens("a not  in (1)").get(1).getText().replaceAll("\\s+", " "));
    }

    @Test
    void case_end_pair_as_statement_brackets() {
        List<TokenType> t = types("select case when a then 1 end");
        assertEquals(TokenType.STATEMENT_START, t.get(1));
        assertEquals(TokenType.STATEMENT_END, t.get(t.size() - 1));
    }

    @Test
    void end_without_case_is_a_name() {
        List<TokenType> t = types("select end from t");
        assertEquals(TokenType.NAME, t.get(1));
    }

    @Test
    void set_operators() {
        List<Token> t = tokens("select 1 UNION ALL select 2");
        assertEquals(TokenType.SET_OPERATOR, t.get(2).getType());
        assertEquals("UNION ALL", t.get(2).getText());
    }

    @Test
    void template_tags() {
        assertEquals(List.of(TokenType.JINJA_BLOCK_START, TokenType.UNTERM_KEYWORD, TokenType.NUMBER,
                        TokenType.JINJA_BLOCK_KEYWORD, TokenType.UNTERM_KEYWORD, TokenType.NUMBER,
                        TokenType.JINJA_BLOCK_END),
                types("{% if x %}select 1{% else %}select 2{% endif %}"));

        assertEquals(List.of(TokenType.JINJA_STATEMENT), types("{% set x = 1 %}"));
        assertEquals(List.of(TokenType.UNTERM_KEYWORD, TokenType.JINJA_EXPRESSION), types("select {{ ref('a') }}"));
    }

    @Test
    void set_block_body_is_passthrough_data() {
        List<TokenType> t = types("{% set cols %}\na, b\n{% endset %}");
        assertEquals(TokenType.JINJA_BLOCK_START, t.get(0));
        assertEquals(TokenType.DATA, t.get(1));
        assertEquals(TokenType.JINJA_BLOCK_END, t.get(t.size() - 1));
    }

    @Test
    void expression_with_nested_braces_is_one_token() {
        List<Token> t = tokens("select {{ config({'a': 1}) }}");
        assertEquals(2, t.size());
        assertEquals("{{ config({'a': 1}) }}", t.get(1).getText());
    }

    @Test
    void unsupported_ddl_is_passthrough_data() {
        List<Token> t = tokens("create table t (a int)");
        assertEquals(1, t.size());
        assertEquals(TokenType.DATA, t.get(0).getType());
        assertEquals("create table t (a int)", t.get(0).getText());
    }

    @Test
    void fmt_markers() {
        assertSame(TokenType.FMT_OFF, Lexer.fmtMarker("-- fmt: off").getType());
        assertSame(TokenType.FMT_ON, Lexer.fmtMarker("# fmt:on").getType());
        assertNull(Lexer.fmtMarker("-- format: off"));
    }

    @Test
    void frame_clause_is_one_keyword() {
        assertEquals(-1, Lexer.frameClauseEnd("rows foo", 0));
        String frame = "rows between unbounded preceding and current row";
        assertEquals(frame.length(), Lexer.frameClauseEnd(frame + ")", 0));
    }
}
