package domain.token;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenTypeTest {

    @Test
    void template_kinds_are_jinja_and_only_tags_without_blocks_are_statements() {
        assertTrue(TokenType.JINJA_EXPRESSION.isJinja());
        assertTrue(TokenType.JINJA_BLOCK_START.isJinja());
        assertTrue(TokenType.JINJA_BLOCK_KEYWORD.isJinja());
        assertFalse(TokenType.NAME.isJinja());

        assertTrue(TokenType.JINJA_STATEMENT.isJinjaStatement());
        assertTrue(TokenType.JINJA_EXPRESSION.isJinjaStatement());
        assertFalse(TokenType.JINJA_BLOCK_END.isJinjaStatement());
    }

    @Test
    void semicolon_and_set_operator_divide_queries() {
        for (TokenType t : TokenType.values()) {
            boolean expected = t == TokenType.SEMICOLON || t == TokenType.SET_OPERATOR;
            assertEquals(expected, t.dividesQueries(), t.name());
        }
    }

    @Test
    void case_and_end_count_as_brackets() {
        assertTrue(TokenType.STATEMENT_START.isOpeningBracket());
        assertTrue(TokenType.STATEMENT_END.isClosingBracket());
        assertTrue(TokenType.BRACKET_OPEN.isOpeningBracket());
        assertFalse(TokenType.BRACKET_OPEN.isClosingBracket());
    }

    @Test
    void keywords_are_lowercased_but_names_are_not() {
        assertTrue(TokenType.UNTERM_KEYWORD.isAlwaysLowercased());
        assertTrue(TokenType.BOOLEAN_OPERATOR.isAlwaysLowercased());
        assertTrue(TokenType.SET_OPERATOR.isAlwaysLowercased());
        assertFalse(TokenType.QUOTED_NAME.isAlwaysLowercased());
        assertFalse(TokenType.NAME.isAlwaysLowercased());
    }

    @Test
    void spacing_predicates() {
        assertTrue(TokenType.COMMA.isNeverPrecededBySpace());
        assertTrue(TokenType.DOUBLE_COLON.isNeverPrecededBySpace());
        assertTrue(TokenType.BRACKET_CLOSE.isNeverPrecededBySpace());
        assertFalse(TokenType.NAME.isNeverPrecededBySpace());

        assertTrue(TokenType.OPERATOR.isPrecededBySpaceExceptAfterOpenBracket());
        assertTrue(TokenType.NUMBER.isPrecededBySpaceExceptAfterOpenBracket());
        assertFalse(TokenType.COMMA.isPrecededBySpaceExceptAfterOpenBracket());
    }

    @Test
    void operators_and_names() {
        assertTrue(TokenType.ON.isAlwaysOperator());
        assertTrue(TokenType.DOUBLE_COLON.isAlwaysOperator());
        assertFalse(TokenType.STAR.isAlwaysOperator());

        assertTrue(TokenType.STAR.isPossibleName());
        assertTrue(TokenType.QUOTED_NAME.isPossibleName());
        assertFalse(TokenType.NUMBER.isPossibleName());
    }

    @Test
    void newlines_and_template_tags_do_not_set_sql_context() {
        assertTrue(TokenType.NEWLINE.doesNotSetPrevSqlContext());
        assertTrue(TokenType.JINJA_STATEMENT.doesNotSetPrevSqlContext());
        // an expression stands in for a value
        assertFalse(TokenType.JINJA_EXPRESSION.doesNotSetPrevSqlContext());
        assertFalse(TokenType.NAME.doesNotSetPrevSqlContext());
    }
}
