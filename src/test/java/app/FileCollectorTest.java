package app;

import domain.config.Mode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileCollectorTest {

    @TempDir
    Path tempDir;

    private Path touch(String relative) throws Exception {
        Path p = tempDir.resolve(relative);
        Files.createDirectories(p.getParent());
        Files.writeString(p, "select 1\n");
        return p;
    }

    @Test
    void walks_directories_for_sql_files_in_sorted_order() throws Exception {
        Path b = touch("models/b.sql");
        Path a = touch("models/a.sql");
        Path nested = touch("models/staging/c.sql.jinja");
        touch("models/readme.md");

        List<Path> files = new FileCollector(Mode.defaults()).collect(List.of(tempDir));
        assertEquals(List.of(a.toAbsolutePath(), b.toAbsolutePath(), nested.toAbsolutePath()), files);
    }

    @Test
    void hidden_entries_and_excluded_names_are_skipped() throws Exception {
        Path kept = touch("models/a.sql");
        touch(".git/x.sql");
        touch("models/.hidden.sql");
        touch("models/scratch.tmp.sql");

        Mode mode = Mode.builder().exclude(List.of("*.tmp.sql")).build();
        assertEquals(List.of(kept.toAbsolutePath()), new FileCollector(mode).collect(List.of(tempDir)));
    }

    @Test
    void explicit_files_are_deduplicated() throws Exception {
        Path a = touch("a.sql");
        List<Path> files = new FileCollector(Mode.defaults()).collect(List.of(a, tempDir, a));
        assertEquals(List.of(a.toAbsolutePath()), files);
    }

    @Test
    void missing_inputs_yield_nothing() {
        assertTrue(new FileCollector(Mode.defaults()).collect(List.of(tempDir.resolve("nope"))).isEmpty());
    }
}
