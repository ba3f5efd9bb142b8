package domain.safety;

import domain.config.Dialect;
import domain.model.EquivalenceException;
import domain.model.ErrorCode;
import domain.token.TokenType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EquivalenceCheckerTest {

    private final EquivalenceChecker checker = new EquivalenceChecker(Dialect.POLYGLOT, 88);

    @Test
    void operator_spacing_inside_template_expressions_is_equivalent() {
        assertDoesNotThrow(() -> checker.check("{{ a+b }}", "{{ a + b }}"));
        assertDoesNotThrow(() -> checker.check("select {{ref('x')}}", "select {{ ref(\"x\") }}"));
    }

    @Test
    void case_and_layout_changes_are_equivalent() {
        assertDoesNotThrow(() -> checker.check("SELECT A,B FROM T", "select a, b\nfrom t\n"));
        assertDoesNotThrow(() -> checker.check("select   1", "select 1\n"));
    }

    @Test
    void different_names_are_rejected() {
        EquivalenceException e = assertThrows(EquivalenceException.class,
                () -> checker.check("select a from t", "select b from t"));
        assertEquals(ErrorCode.EQUIVALENCE, e.getCode());
        assertEquals(1, e.getIndex());
    }

    @Test
    void dropped_tokens_are_rejected() {
        assertThrows(EquivalenceException.class, () -> checker.check("select a, b from t", "select a from t"));
    }

    @Test
    void changed_token_kinds_are_rejected() {
        // a quoted name is not the same token as a string
        assertThrows(EquivalenceException.class, () -> checker.check("select \"a\"", "select 'a'"));
    }

    @Test
    void normalize_template_payloads() {
        assertEquals("{{ a + b }}", EquivalenceChecker.normalize("{{-a+b-}}", TokenType.JINJA_EXPRESSION));
        assertEquals("{% if x %}", EquivalenceChecker.normalize("{%  if   x %}", TokenType.JINJA_BLOCK_START));
        assertEquals("{{ f(a,b) }}", EquivalenceChecker.normalize("{{ f( a, b, ) }}", TokenType.JINJA_EXPRESSION));
        assertEquals("left outer join", EquivalenceChecker.normalize("LEFT\n  OUTER JOIN", TokenType.UNTERM_KEYWORD));
    }

    @Test
    void comparison_operators_are_not_respaced() {
        assertEquals("a == b", EquivalenceChecker.normalizeOperators("a == b"));
        assertEquals("a != b", EquivalenceChecker.normalizeOperators("a != b"));
        assertEquals("a | b", EquivalenceChecker.normalizeOperators("a|b"));
        assertEquals("a || b", EquivalenceChecker.normalizeOperators("a || b"));
    }
}
