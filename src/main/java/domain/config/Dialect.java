package domain.config;

import domain.analyze.Analyzer;
import domain.model.ConfigurationException;

import java.util.Locale;

/**
 * SQL dialects. All share one grammar; they differ only in whether unquoted names keep their
 * case.
 */
public enum Dialect {
    POLYGLOT("polyglot", false),
    CLICKHOUSE("clickhouse", false),
    DUCKDB("duckdb", false),
    CASE_SENSITIVE("polyglot-case-sensitive", true);

    private final String id;
    private final boolean caseSensitiveNames;

    Dialect(String id, boolean caseSensitiveNames) {
        this.id = id;
        this.caseSensitiveNames = caseSensitiveNames;
    }

    public String getId() {
        return id;
    }

    public boolean isCaseSensitiveNames() {
        return caseSensitiveNames;
    }

    public Analyzer newAnalyzer(int lineLength) {
        return new Analyzer(lineLength, caseSensitiveNames);
    }

    /**
     * Looks a dialect up by id or constant name, ignoring case ({@code duckdb},
     * {@code case_sensitive}, {@code polyglot-case-sensitive}).
     */
    public static Dialect fromName(String name) {
        String v = (name == null) ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (Dialect d : values()) {
            if (d.id.equals(v) || d.name().toLowerCase(Locale.ROOT).equals(v.replace('-', '_'))) {
                return d;
            }
        }
        throw new ConfigurationException("Unknown dialect: " + name);
    }
}
