package infra.config;

import domain.config.Dialect;
import domain.config.Mode;
import domain.model.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SqlfmtConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final SqlfmtConfigLoader loader = new SqlfmtConfigLoader();

    @Test
    void applies_every_supported_key() throws Exception {
        Path file = tempDir.resolve(SqlfmtConfigLoader.FILE_NAME);
        Files.writeString(file, String.join("\n",
                "line_length=100",
                "dialect=duckdb",
                "exclude=target/**, *.tmp.sql",
                "no_jinjafmt=yes",
                "encoding=ISO-8859-1",
                ""));

        Mode mode = loader.apply(file, Mode.builder()).build();
        assertEquals(100, mode.getLineLength());
        assertEquals(Dialect.DUCKDB, mode.getDialect());
        assertEquals(List.of("target/**", "*.tmp.sql"), mode.getExclude());
        assertTrue(mode.isNoJinjafmt());
        assertEquals("ISO-8859-1", mode.getEncoding().name());
    }

    @Test
    void discovers_the_nearest_file_above_the_inputs() throws Exception {
        Path models = Files.createDirectories(tempDir.resolve("project/models/staging"));
        Path config = Files.writeString(tempDir.resolve("project/" + SqlfmtConfigLoader.FILE_NAME), "line_length=60\n");
        Path a = Files.writeString(models.resolve("a.sql"), "select 1\n");
        Path b = Files.writeString(tempDir.resolve("project/models/b.sql"), "select 2\n");

        assertEquals(config.toAbsolutePath().normalize(), loader.discover(List.of(a, b)));
    }

    @Test
    void nothing_discovered_without_a_file() throws Exception {
        Path a = Files.writeString(tempDir.resolve("a.sql"), "select 1\n");
        Path found = loader.discover(List.of(a));
        // a file further up the real filesystem would be legitimate, but never inside tempDir
        assertTrue(found == null || !found.startsWith(tempDir));
    }

    @Test
    void commonParent_of_sibling_dirs() throws Exception {
        Path x = Files.createDirectories(tempDir.resolve("x/deep"));
        Path y = Files.createDirectories(tempDir.resolve("y"));
        assertEquals(tempDir.toAbsolutePath().normalize(), SqlfmtConfigLoader.commonParent(List.of(x, y)));
    }

    @Test
    void unknown_keys_and_bad_values_are_rejected() {
        Properties unknown = new Properties();
        unknown.setProperty("linelength", "80");
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> loader.apply(unknown, Mode.builder()));
        assertEquals("Unknown config option: linelength", e.getMessage());

        Properties badInt = new Properties();
        badInt.setProperty("line_length", "wide");
        assertThrows(ConfigurationException.class, () -> loader.apply(badInt, Mode.builder()));

        Properties badBool = new Properties();
        badBool.setProperty("no_jinjafmt", "perhaps");
        assertThrows(ConfigurationException.class, () -> loader.apply(badBool, Mode.builder()));
    }

    @Test
    void missing_explicit_file_is_an_error() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> loader.apply(tempDir.resolve("nope.properties"), Mode.builder()));
        assertTrue(e.getMessage().startsWith("Config file not found"));
    }

    @Test
    void splitList_drops_empty_parts() {
        assertEquals(List.of("a", "b"), SqlfmtConfigLoader.splitList(" a ,, b ,"));
    }
}
