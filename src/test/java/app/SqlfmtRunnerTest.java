package app;

import domain.config.Mode;
import domain.model.ConfigurationException;
import domain.model.ErrorCode;
import domain.model.FileResult;
import domain.model.FileStatus;
import domain.model.Report;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class SqlfmtRunnerTest {

    @TempDir
    Path tempDir;

    private Path write(String name, String content) throws Exception {
        Path p = tempDir.resolve(name);
        Files.writeString(p, content);
        return p;
    }

    @Test
    void formats_files_in_place_and_reports_each_one() throws Exception {
        Path ugly = write("a.sql", "SELECT    1\n");
        Path clean = write("b.sql", "select 1\n");
        Path broken = write("c.sql", "SELECT )\n");

        List<FileResult> seen = Collections.synchronizedList(new ArrayList<>());
        Report report = new SqlfmtRunner(Mode.builder().threads(2).build(), seen::add).run(List.of(tempDir));

        assertEquals(3, report.total());
        assertEquals(3, seen.size());
        assertEquals(FileStatus.CHANGED, report.getResults().get(0).getStatus());
        assertEquals(FileStatus.UNCHANGED, report.getResults().get(1).getStatus());
        assertEquals(FileStatus.ERROR, report.getResults().get(2).getStatus());
        assertEquals(ErrorCode.BRACKET, report.getResults().get(2).getErrorCode());

        assertEquals("select 1\n", Files.readString(ugly));
        assertEquals("select 1\n", Files.readString(clean));
        // a file that failed is left untouched
        assertEquals("SELECT )\n", Files.readString(broken));
        assertEquals("3 file(s) processed, 1 reformatted, 1 unchanged, 1 error(s)", report.summary());
    }

    @Test
    void check_mode_writes_nothing() throws Exception {
        Path ugly = write("a.sql", "SELECT    1\n");
        Report report = new SqlfmtRunner(Mode.builder().check(true).build()).run(List.of(ugly));

        assertTrue(report.hasChanges());
        assertFalse(report.hasErrors());
        assertEquals("SELECT    1\n", Files.readString(ugly));
        assertEquals("1 file(s) processed, 1 would be reformatted", report.summary());
    }

    @Test
    void single_process_keeps_input_order() throws Exception {
        write("b.sql", "select 2\n");
        write("a.sql", "select 1\n");
        Report report = new SqlfmtRunner(Mode.builder().singleProcess(true).build()).run(List.of(tempDir));
        assertEquals("a.sql", report.getResults().get(0).getPath().getFileName().toString());
        assertEquals("b.sql", report.getResults().get(1).getPath().getFileName().toString());
    }

    @Test
    void unreadable_file_is_an_io_error() {
        FileResult r = new SqlfmtRunner(Mode.defaults()).formatFile(tempDir.resolve("missing.sql"));
        assertEquals(FileStatus.ERROR, r.getStatus());
        assertEquals(ErrorCode.IO, r.getErrorCode());
        assertTrue(r.getMessage().startsWith("Read error:"));
    }

    @Test
    void malformed_bytes_are_a_read_error_and_the_file_is_left_alone() throws Exception {
        Path file = tempDir.resolve("latin.sql");
        byte[] original = {'S', 'E', 'L', 'E', 'C', 'T', ' ', '1', ' ', '-', '-', ' ', (byte) 0xff, (byte) 0xfe, '\n'};
        Files.write(file, original);

        FileResult r = new SqlfmtRunner(Mode.defaults()).formatFile(file);
        assertEquals(FileStatus.ERROR, r.getStatus());
        assertEquals(ErrorCode.IO, r.getErrorCode());
        assertTrue(r.getMessage().startsWith("Read error:"), r.getMessage());
        assertArrayEquals(original, Files.readAllBytes(file));
    }

    @Test
    void unexpected_failure_is_recorded_and_later_files_still_run() throws Exception {
        Path a = write("a.sql", "boom\n");
        Path b = write("b.sql", "SELECT    1\n");
        Mode mode = Mode.builder().singleProcess(true).build();
        SqlfmtRunner runner = new SqlfmtRunner(mode, r -> {
        }, (source, m) -> {
            if (source.startsWith("boom")) throw new IllegalStateException("Unhandled lex action");
            return SqlfmtApi.format(source, m);
        });

        Report report = runner.run(List.of(a, b));
        assertEquals(2, report.total());
        assertEquals(FileStatus.ERROR, report.getResults().get(0).getStatus());
        assertTrue(report.getResults().get(0).getMessage().contains("Unhandled lex action"));
        assertEquals(FileStatus.CHANGED, report.getResults().get(1).getStatus());
        assertEquals("select 1\n", Files.readString(b));
    }

    @Test
    void pooled_failure_keeps_its_error_code() throws Exception {
        write("a.sql", "select 1\n");
        write("b.sql", "select 2\n");
        Consumer<FileResult> listener = r -> {
            if (r.getPath().endsWith("b.sql")) throw new ConfigurationException("listener rejected " + r.getPath());
        };
        Report report = new SqlfmtRunner(Mode.builder().threads(2).build(), listener).run(List.of(tempDir));

        assertEquals(FileStatus.UNCHANGED, report.getResults().get(0).getStatus());
        assertEquals(FileStatus.ERROR, report.getResults().get(1).getStatus());
        assertEquals(ErrorCode.CONFIGURATION, report.getResults().get(1).getErrorCode());
    }
}
