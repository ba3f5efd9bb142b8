package domain.format;

import domain.analyze.Analyzer;
import domain.analyze.Line;
import domain.analyze.Query;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LineMergerTest {

    private static String splitThenMerge(String sql, int width) {
        Query q = new Analyzer(width, false).parseQuery(sql);
        QueryFormatter formatter = new QueryFormatter(width, true);
        List<Line> merged = new LineMerger(width).maybeMergeLines(formatter.splitLines(q.getLines()));
        q.setLines(formatter.removeExtraBlankLines(merged));
        return q.render();
    }

    @Test
    void everything_on_one_line_when_it_fits() {
        assertEquals("select a, b from t where x = 1\n", splitThenMerge("select a, b from t where x = 1\n", 88));
    }

    @Test
    void clauses_get_their_own_lines_when_the_query_is_too_wide() {
        assertEquals("select a, b\nfrom t\nwhere x = 1\n", splitThenMerge("select a, b from t where x = 1\n", 20));
    }

    @Test
    void merged_lines_respect_the_width() {
        String out = splitThenMerge(
                "select first_column, second_column, third_column from some_table where first_column = 1\n", 40);
        for (String row : out.split("\n")) {
            assertTrue(row.length() <= 40, row);
        }
        assertTrue(out.startsWith("select\n"), out);
    }

    @Test
    void between_bounds_stay_together() {
        assertTrue(splitThenMerge("select * from t where x between 1 and 10\n", 88).contains("between 1 and 10"));
    }

    @Test
    void blank_line_between_statements_prevents_merging() {
        String out = splitThenMerge("select 1\n\nselect 2\n", 88);
        assertTrue(out.startsWith("select 1\n"), out);
        assertTrue(out.contains("select 2"), out);
        assertFalse(out.contains("select 1 select 2"), out);
    }

    @Test
    void semicolon_is_never_merged_with_the_next_statement() {
        String out = splitThenMerge("select 1; select 2\n", 88);
        assertFalse(out.contains("; select"), out);
        assertFalse(out.contains("1 select"), out);
    }

    @Test
    void inline_comment_keeps_its_line() {
        String out = splitThenMerge("select a, -- first\n b from t\n", 88);
        assertTrue(out.contains("-- first"), out);
        assertFalse(out.contains("-- first b"), out);
    }

    @Test
    void empty_input_is_returned_as_is() {
        assertTrue(new LineMerger(88).maybeMergeLines(List.of()).isEmpty());
    }
}
