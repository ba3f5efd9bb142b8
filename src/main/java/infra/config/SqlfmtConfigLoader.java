package infra.config;

import domain.config.Mode;
import domain.model.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * Loads {@code sqlfmt.properties}.
 *
 * <p>Without an explicit path the file is looked up from the deepest directory shared by all
 * inputs upwards; the first one found wins.</p>
 *
 * <pre>
 * line_length=100
 * dialect=duckdb
 * exclude=target/**,*.tmp.sql
 * no_jinjafmt=false
 * encoding=UTF-8
 * </pre>
 */
public final class SqlfmtConfigLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(SqlfmtConfigLoader.class);

    public static final String FILE_NAME = "sqlfmt.properties";

    private static final Set<String> KEYS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "line_length", "dialect", "exclude", "no_jinjafmt", "encoding")));

    /** Nearest config file above the inputs, or null. */
    public Path discover(List<Path> inputs) {
        Path dir = commonParent(inputs);
        while (dir != null) {
            Path candidate = dir.resolve(FILE_NAME);
            if (Files.isRegularFile(candidate)) {
                LOGGER.debug("using config {}", candidate);
                return candidate;
            }
            dir = dir.getParent();
        }
        return null;
    }

    /**
     * Applies the settings in {@code file} onto {@code builder}.
     *
     * @throws ConfigurationException on a missing file, an unknown key or a bad value
     */
    public Mode.Builder apply(Path file, Mode.Builder builder) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Config file not found: " + file);
        }
        Properties props = new Properties();
        try (InputStream is = Files.newInputStream(file);
             Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config: " + file, e);
        }
        return apply(props, builder);
    }

    Mode.Builder apply(Properties props, Mode.Builder builder) {
        for (String key : props.stringPropertyNames()) {
            if (!KEYS.contains(key)) {
                throw new ConfigurationException("Unknown config option: " + key);
            }
        }
        String lineLength = trimToNull(props.getProperty("line_length"));
        if (lineLength != null) {
            try {
                builder.lineLength(Integer.parseInt(lineLength));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("line_length must be an integer: " + lineLength, e);
            }
        }
        String dialect = trimToNull(props.getProperty("dialect"));
        if (dialect != null) builder.dialect(dialect);

        String exclude = trimToNull(props.getProperty("exclude"));
        if (exclude != null) builder.exclude(splitList(exclude));

        String noJinjafmt = trimToNull(props.getProperty("no_jinjafmt"));
        if (noJinjafmt != null) builder.noJinjafmt(parseBoolean(noJinjafmt));

        String encoding = trimToNull(props.getProperty("encoding"));
        if (encoding != null) builder.encoding(encoding);
        return builder;
    }

    static List<String> splitList(String raw) {
        List<String> out = new ArrayList<>();
        for (String part : raw.split(",")) {
            String t = part.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    private static boolean parseBoolean(String v) {
        String s = v.toLowerCase();
        if (s.equals("true") || s.equals("1") || s.equals("yes") || s.equals("y")) return true;
        if (s.equals("false") || s.equals("0") || s.equals("no") || s.equals("n")) return false;
        throw new ConfigurationException("Not a boolean: " + v);
    }

    static Path commonParent(List<Path> inputs) {
        Path common = null;
        for (Path input : inputs) {
            Path p = input.toAbsolutePath().normalize();
            Path dir = Files.isDirectory(p) ? p : p.getParent();
            if (dir == null) continue;
            if (common == null) {
                common = dir;
                continue;
            }
            while (common != null && !dir.startsWith(common)) {
                common = common.getParent();
            }
        }
        return common;
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
