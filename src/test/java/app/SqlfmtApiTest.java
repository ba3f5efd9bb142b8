package app;

import domain.analyze.Query;
import domain.config.Dialect;
import domain.config.Mode;
import domain.model.BracketException;
import domain.model.ErrorCode;
import domain.model.SqlfmtException;
import domain.token.Token;
import domain.token.TokenType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlfmtApiTest {

    private static String format(String sql) {
        return SqlfmtApi.format(sql, Mode.defaults());
    }

    @Test
    void keywords_are_lowercased_and_spaces_collapsed() {
        assertEquals("select 1\n", format("SELECT    1\n"));
    }

    @Test
    void short_query_fits_on_one_line() {
        assertEquals("select a, b from t where x = 1\n", format("SELECT a, b FROM t WHERE x = 1\n"));
    }

    @Test
    void blank_lines_between_statements_are_capped() {
        String out = format("SELECT 1\n\n\n\n\nSELECT 2\n");
        assertTrue(out.startsWith("select 1\n"), out);
        assertTrue(out.endsWith("select 2\n"), out);
        assertFalse(out.contains("\n\n\n\n"), out);
    }

    @Test
    void between_is_kept_together() {
        assertTrue(format("SELECT * FROM t WHERE x BETWEEN 1 AND 10\n").contains("between 1 and 10"));
    }

    @Test
    void unmatched_bracket_fails_without_output() {
        SqlfmtException e = assertThrows(SqlfmtException.class, () -> format("SELECT )\n"));
        assertTrue(e instanceof BracketException);
        assertEquals(ErrorCode.BRACKET, e.getCode());
    }

    @Test
    void template_expression_is_respaced_and_passes_the_safety_check() {
        assertEquals("{{ a + b }}\n", format("{{ a+b }}\n"));
    }

    @Test
    void quoted_names_and_strings_keep_their_case() {
        String out = format("SELECT \"MyColumn\", 'Hello World' FROM \"MyTable\"\n");
        assertEquals("select \"MyColumn\", 'Hello World' from \"MyTable\"\n", out);
    }

    @Test
    void case_sensitive_dialect_keeps_name_case() {
        Mode mode = Mode.builder().dialect(Dialect.CASE_SENSITIVE).build();
        assertEquals("select MyCol from T\n", SqlfmtApi.format("SELECT MyCol FROM T\n", mode));
    }

    @Test
    void disabled_region_is_copied_verbatim() {
        String src = "-- fmt: off\nSELECT   A,B\n-- fmt: on\nSELECT   C\n";
        String out = format(src);
        assertTrue(out.contains("SELECT   A,B\n"), out);
        assertTrue(out.endsWith("select c\n"), out);
    }

    @Test
    void comments_are_kept() {
        String out = format("-- this is a comment\nSELECT 1 -- one\n");
        assertTrue(out.startsWith("-- this is a comment\n"), out);
        assertTrue(out.contains("select 1  -- one\n"), out);
    }

    @Test
    void long_select_list_breaks_one_column_per_line() {
        String out = SqlfmtApi.format("select aaaa, bbbb, cccc from t\n", Mode.builder().lineLength(16).build());
        assertEquals("select\n    aaaa,\n    bbbb,\n    cccc\nfrom t\n", out);
    }

    @Test
    void semicolon_closes_the_statement_so_it_can_merge() {
        assertEquals("select 1\n;\n", format("select 1;\n"));
        String out = format("SELECT a FROM t\nWHERE x IN (1, 2);\nSELECT b FROM u;\n");
        assertFalse(out.contains(" ;"), out);
        assertEquals(2, out.split("\n;\n", -1).length - 1, out);
        assertTrue(out.endsWith("\n;\n"), out);
    }

    @Test
    void doubled_quote_escape_survives_formatting() {
        assertEquals("select 'it''s' from t\n", format("SELECT 'it''s' FROM t\n"));
    }

    @Test
    void empty_input_formats_to_empty_output() {
        assertEquals("", format(""));
        assertEquals("", format("\n\n\n"));
    }

    @Test
    void parse_and_lex_stop_early() {
        Query q = SqlfmtApi.parse("select 1\n", Mode.defaults());
        assertFalse(q.getLines().isEmpty());
        List<Token> tokens = SqlfmtApi.lex("select 1\n", Mode.defaults());
        assertEquals(TokenType.UNTERM_KEYWORD, tokens.get(0).getType());
    }
}
