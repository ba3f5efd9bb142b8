package domain.format;

import domain.analyze.Analyzer;
import domain.analyze.Line;
import domain.analyze.Query;
import domain.token.TokenType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryFormatterTest {

    private static String format(String sql, int width) {
        Query q = new Analyzer(width, false).parseQuery(sql);
        new QueryFormatter(width, false).format(q);
        return q.render();
    }

    private static int longestBlankRun(String out) {
        int longest = 0;
        int run = 0;
        for (String row : out.split("\n", -1)) {
            if (row.isBlank()) {
                run++;
                longest = Math.max(longest, run);
            } else {
                run = 0;
            }
        }
        return longest;
    }

    @Test
    void at_most_two_blank_lines_at_top_level() {
        String out = format("select 1\n\n\n\n\nselect 2\n", 88);
        assertTrue(out.startsWith("select 1\n"), out);
        assertTrue(out.endsWith("select 2\n"), out);
        assertTrue(longestBlankRun(out.substring(0, out.length() - 1)) <= 2, out);
    }

    @Test
    void at_most_one_blank_line_inside_a_query() {
        String out = format("select\n    a,\n\n\n\n    b\nfrom t\n", 88);
        assertTrue(longestBlankRun(out.substring(0, out.length() - 1)) <= 1, out);
    }

    @Test
    void trailing_blank_lines_are_dropped() {
        assertEquals("select 1\n", format("select 1\n\n\n\n", 88));
    }

    @Test
    void removeExtraBlankLines_keeps_blank_lines_in_disabled_regions() {
        Query q = new Analyzer(88, false).parseQuery("-- fmt: off\nselect 1\n\n\n\n\nselect 2\n-- fmt: on\n");
        List<Line> out = new QueryFormatter(88, false).removeExtraBlankLines(q.getLines());
        long disabledBlanks = out.stream().filter(l -> l.isBlank() && l.isFormattingDisabled()).count();
        long before = q.getLines().stream().filter(l -> l.isBlank() && l.isFormattingDisabled()).count();
        assertEquals(before, disabledBlanks);
    }

    @Test
    void template_tags_are_normalized() {
        assertEquals("select {{ a + b }} from t\n", format("select {{a+b}} from t\n", 88));
    }

    @Test
    void template_tags_are_left_alone_without_jinjafmt() {
        Query q = new Analyzer(88, false).parseQuery("select {{a+b}} from t\n");
        new QueryFormatter(88, true).format(q);
        assertEquals("select {{a+b}} from t\n", q.render());
    }

    @Test
    void block_tags_pulled_out_to_the_depth_of_their_body() {
        Query q = new Analyzer(88, false).parseQuery("select a,\n{% if x %}\nfrom t\n{% endif %}\n");
        QueryFormatter formatter = new QueryFormatter(88, true);
        List<Line> lines = formatter.splitLines(q.getLines());
        formatter.dedentJinjaBlocks(lines);

        Line start = lines.stream().filter(l -> l.firstContentNode() != null
                && l.firstContentNode().is(TokenType.JINJA_BLOCK_START)).findFirst().orElseThrow();
        Line end = lines.stream().filter(l -> l.firstContentNode() != null
                && l.firstContentNode().is(TokenType.JINJA_BLOCK_END)).findFirst().orElseThrow();
        assertEquals(0, start.depth().getSql());
        assertEquals(0, end.depth().getSql());
    }

    @Test
    void long_template_call_is_moved_to_its_own_lines() {
        String call = "{{ dbt_utils.star(from=ref('some_really_long_model_name'), except=['column_one', 'column_two']) }}";
        String out = format("select " + call + " from t\n", 88);
        assertTrue(out.startsWith("select\n"), out);
        assertTrue(out.contains("    {{\n"), out);
        assertTrue(out.contains("dbt_utils.star(\n"), out);
        assertTrue(out.contains("from t"), out);
    }

    @Test
    void format_is_stable() {
        String once = format("SELECT a,b , c FROM t WHERE x=1 AND y IN (1,2,3)\n", 88);
        assertEquals(once, format(once, 88));
    }
}
