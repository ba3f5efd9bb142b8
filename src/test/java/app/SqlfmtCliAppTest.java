package app;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlfmtCliAppTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        InputStream in = new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
        return SqlfmtCliApp.run(args, in, new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void no_inputs_prints_usage_and_fails() {
        assertEquals(SqlfmtCliApp.EXIT_ERROR, run(""));
        assertTrue(stdout().startsWith("usage: sqlfmt"));
    }

    @Test
    void help_prints_usage() {
        assertEquals(SqlfmtCliApp.EXIT_OK, run("", "--help"));
        assertTrue(stdout().contains("--line-length"));
    }

    @Test
    void dash_formats_stdin_to_stdout() {
        assertEquals(SqlfmtCliApp.EXIT_OK, run("SELECT    1\n", "-"));
        assertEquals("select 1\n", stdout());
    }

    @Test
    void check_on_stdin_reports_without_printing() {
        assertEquals(SqlfmtCliApp.EXIT_WOULD_CHANGE, run("SELECT    1\n", "--check", "-"));
        assertEquals(SqlfmtCliApp.EXIT_OK, run("select 1\n", "--check", "-"));
        assertEquals("", stdout());
    }

    @Test
    void stdin_error_exits_with_two() {
        assertEquals(SqlfmtCliApp.EXIT_ERROR, run("SELECT )\n", "-"));
        assertEquals("", stdout());
    }

    @Test
    void files_are_rewritten_and_check_leaves_them_alone() throws Exception {
        Path f = tempDir.resolve("q.sql");
        Files.writeString(f, "SELECT    1\n");

        assertEquals(SqlfmtCliApp.EXIT_WOULD_CHANGE, run("", "--check", tempDir.toString()));
        assertEquals("SELECT    1\n", Files.readString(f));

        assertEquals(SqlfmtCliApp.EXIT_OK, run("", tempDir.toString()));
        assertEquals("select 1\n", Files.readString(f));

        assertEquals(SqlfmtCliApp.EXIT_OK, run("", "--check", tempDir.toString()));
    }

    @Test
    void any_failed_file_exits_with_two() throws Exception {
        Files.writeString(tempDir.resolve("good.sql"), "select 1\n");
        Files.writeString(tempDir.resolve("bad.sql"), "SELECT )\n");
        assertEquals(SqlfmtCliApp.EXIT_ERROR, run("", "--single-process", tempDir.toString()));
    }

    @Test
    void report_option_writes_a_csv() throws Exception {
        Files.writeString(tempDir.resolve("q.sql"), "SELECT 1\n");
        Path report = tempDir.resolve("out/report.csv");

        assertEquals(SqlfmtCliApp.EXIT_OK, run("", "--report", report.toString(), tempDir.resolve("q.sql").toString()));
        List<String> rows = Files.readAllLines(report);
        assertEquals("path,status,error_code,message", rows.get(0));
        assertEquals(2, rows.size());
        assertTrue(rows.get(1).contains("CHANGED"));
    }

    @Test
    void bad_options_exit_with_two() {
        assertEquals(SqlfmtCliApp.EXIT_ERROR, run("select 1\n", "--dialect", "oracle", "-"));
        assertEquals(SqlfmtCliApp.EXIT_ERROR, run("select 1\n", "--line-length", "wide", "-"));
        assertEquals(SqlfmtCliApp.EXIT_ERROR, run("select 1\n", "--config", tempDir.resolve("none.properties").toString(), "-"));
    }

    @Test
    void line_length_option_is_applied() {
        assertEquals(SqlfmtCliApp.EXIT_OK, run("select aaaa, bbbb, cccc from t\n", "--line-length=16", "-"));
        assertEquals("select\n    aaaa,\n    bbbb,\n    cccc\nfrom t\n", stdout());
    }
}
