package domain.config;

import domain.model.ConfigurationException;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Formatting and run options. Immutable; use {@link #builder()} or {@link #toBuilder()}.
 */
public final class Mode {

    public static final int DEFAULT_LINE_LENGTH = 88;

    private static final List<String> SQL_EXTENSIONS = Collections.unmodifiableList(Arrays.asList(
            ".sql", ".sql.jinja", ".sql.jinja2", ".ddl", ".dml"));

    private final int lineLength;
    private final Dialect dialect;
    private final boolean check;
    private final boolean fast;
    private final boolean noJinjafmt;
    private final List<String> exclude;
    private final Charset encoding;
    private final boolean verbose;
    private final boolean quiet;
    private final int threads;
    private final boolean singleProcess;

    private Mode(Builder b) {
        this.lineLength = b.lineLength;
        this.dialect = b.dialect;
        this.check = b.check;
        this.fast = b.fast;
        this.noJinjafmt = b.noJinjafmt;
        this.exclude = Collections.unmodifiableList(new ArrayList<>(b.exclude));
        this.encoding = b.encoding;
        this.verbose = b.verbose;
        this.quiet = b.quiet;
        this.threads = b.threads;
        this.singleProcess = b.singleProcess;
    }

    public static Mode defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.lineLength = lineLength;
        b.dialect = dialect;
        b.check = check;
        b.fast = fast;
        b.noJinjafmt = noJinjafmt;
        b.exclude = new ArrayList<>(exclude);
        b.encoding = encoding;
        b.verbose = verbose;
        b.quiet = quiet;
        b.threads = threads;
        b.singleProcess = singleProcess;
        return b;
    }

    public int getLineLength() {
        return lineLength;
    }

    public Dialect getDialect() {
        return dialect;
    }

    /** Report what would change without writing. */
    public boolean isCheck() {
        return check;
    }

    public boolean isFast() {
        return fast;
    }

    public boolean isNoJinjafmt() {
        return noJinjafmt;
    }

    /** File-name globs skipped while walking directories. */
    public List<String> getExclude() {
        return exclude;
    }

    public Charset getEncoding() {
        return encoding;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /** Worker count; 0 means one per available processor. */
    public int getThreads() {
        return threads;
    }

    public boolean isSingleProcess() {
        return singleProcess;
    }

    public boolean shouldSafetyCheck() {
        return !fast && !check;
    }

    public boolean isSqlFile(String fileName) {
        if (fileName == null) return false;
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (String ext : SQL_EXTENSIONS) {
            if (lower.endsWith(ext)) return true;
        }
        return false;
    }

    public static List<String> sqlExtensions() {
        return SQL_EXTENSIONS;
    }

    @Override
    public String toString() {
        return "Mode{lineLength=" + lineLength + ", dialect=" + dialect.getId() + ", check=" + check
                + ", fast=" + fast + ", noJinjafmt=" + noJinjafmt + ", exclude=" + exclude
                + ", encoding=" + encoding + ", threads=" + threads + ", singleProcess=" + singleProcess + "}";
    }

    public static final class Builder {
        private int lineLength = DEFAULT_LINE_LENGTH;
        private Dialect dialect = Dialect.POLYGLOT;
        private boolean check;
        private boolean fast;
        private boolean noJinjafmt;
        private List<String> exclude = new ArrayList<>();
        private Charset encoding = StandardCharsets.UTF_8;
        private boolean verbose;
        private boolean quiet;
        private int threads;
        private boolean singleProcess;

        private Builder() {
        }

        public Builder lineLength(int lineLength) {
            if (lineLength <= 0) {
                throw new ConfigurationException("line_length must be positive: " + lineLength);
            }
            this.lineLength = lineLength;
            return this;
        }

        public Builder dialect(Dialect dialect) {
            this.dialect = (dialect == null) ? Dialect.POLYGLOT : dialect;
            return this;
        }

        public Builder dialect(String name) {
            return dialect(Dialect.fromName(name));
        }

        public Builder check(boolean check) {
            this.check = check;
            return this;
        }

        public Builder fast(boolean fast) {
            this.fast = fast;
            return this;
        }

        public Builder noJinjafmt(boolean noJinjafmt) {
            this.noJinjafmt = noJinjafmt;
            return this;
        }

        public Builder exclude(List<String> exclude) {
            this.exclude = (exclude == null) ? new ArrayList<String>() : new ArrayList<>(exclude);
            return this;
        }

        public Builder encoding(Charset encoding) {
            this.encoding = (encoding == null) ? StandardCharsets.UTF_8 : encoding;
            return this;
        }

        public Builder encoding(String name) {
            try {
                return encoding(Charset.forName(name.trim()));
            } catch (RuntimeException e) {
                throw new ConfigurationException("Unknown encoding: " + name, e);
            }
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder quiet(boolean quiet) {
            this.quiet = quiet;
            return this;
        }

        public Builder threads(int threads) {
            if (threads < 0) {
                throw new ConfigurationException("threads must not be negative: " + threads);
            }
            this.threads = threads;
            return this;
        }

        public Builder singleProcess(boolean singleProcess) {
            this.singleProcess = singleProcess;
            return this;
        }

        public Mode build() {
            return new Mode(this);
        }
    }
}
