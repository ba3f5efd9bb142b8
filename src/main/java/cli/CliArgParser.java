package cli;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * CLI argument parsing helpers.
 */
public final class CliArgParser {

    /** Flags that never take the next argument as their value. */
    static final Set<String> PRESENCE_FLAGS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "check", "fast", "no-jinjafmt", "single-process", "verbose", "quiet", "help")));

    private CliArgParser() {
    }

    /** Options by name (without {@code --}) plus positional arguments, in order. */
    public static final class ParsedArgs {
        private final Map<String, String> options;
        private final List<String> positionals;

        ParsedArgs(Map<String, String> options, List<String> positionals) {
            this.options = Collections.unmodifiableMap(options);
            this.positionals = Collections.unmodifiableList(positionals);
        }

        public Map<String, String> getOptions() {
            return options;
        }

        public List<String> getPositionals() {
            return positionals;
        }

        public String get(String key) {
            return options.get(key);
        }

        public boolean has(String key) {
            return options.containsKey(key);
        }
    }

    public static int parseInt(String key, String s) {
        try {
            return Integer.parseInt(s.trim());
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("--" + key + " expects an integer: " + s, e);
        }
    }

    public static boolean parseBoolean(String s, boolean def) {
        if (s == null || s.isBlank()) return def;
        String v = s.trim()
                .toLowerCase();
        return v.equals("true") || v.equals("1") || v.equals("y") || v.equals("yes");
    }

    /**
     * Presence-style flag.
     * <ul>
     *   <li>--check       => true</li>
     *   <li>--check=true  => true</li>
     *   <li>--check=false => false</li>
     * </ul>
     */
    public static boolean flag(ParsedArgs argv, String key) {
        if (argv == null || key == null) return false;
        if (!argv.has(key)) return false;
        String raw = argv.get(key);
        if (raw == null || raw.isBlank()) return true;
        return parseBoolean(raw, true);
    }

    /** Comma separated values, repeated occurrences already joined. */
    public static List<String> list(ParsedArgs argv, String key) {
        List<String> out = new ArrayList<>();
        String raw = (argv == null) ? null : argv.get(key);
        if (raw == null) return out;
        for (String part : raw.split(",")) {
            String t = part.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    /**
     * Parses {@code --key=value}, {@code --key value} and presence flags. Everything else,
     * including a lone {@code -}, is positional. A repeated option is joined with commas.
     */
    public static ParsedArgs parseArgs(String[] args) {
        Map<String, String> m = new LinkedHashMap<>();
        List<String> positionals = new ArrayList<>();
        if (args == null) return new ParsedArgs(m, positionals);

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a == null) continue;
            a = a.trim();
            if (!a.startsWith("--")) {
                if (!a.isEmpty()) positionals.add(a);
                continue;
            }

            String k;
            String v;

            int eq = a.indexOf('=');
            if (eq > 2) {
                k = a.substring(2, eq)
                        .trim();
                v = a.substring(eq + 1)
                        .trim();
            } else {
                k = a.substring(2)
                        .trim();
                v = "";
                if (!PRESENCE_FLAGS.contains(k) && i + 1 < args.length && args[i + 1] != null
                        && !args[i + 1].startsWith("--")) {
                    v = args[i + 1].trim();
                    i++;
                }
            }

            if (k.isEmpty()) continue;
            String prev = m.get(k);
            m.put(k, (prev == null || prev.isEmpty()) ? v : prev + "," + v);
        }

        return new ParsedArgs(m, positionals);
    }
}
