package app;

import domain.analyze.Query;
import domain.config.Mode;
import domain.format.QueryFormatter;
import domain.safety.EquivalenceChecker;
import domain.token.Token;

import java.util.List;

/**
 * Library entry points: format a source string, or stop after parsing or lexing.
 */
public final class SqlfmtApi {

    private SqlfmtApi() {
    }

    /**
     * Formats {@code source}. Deterministic for a given source and mode.
     *
     * @throws domain.model.SqlfmtException with code PARSING, BRACKET or EQUIVALENCE
     */
    public static String format(String source, Mode mode) {
        Query query = parse(source, mode);
        new QueryFormatter(mode.getLineLength(), mode.isNoJinjafmt()).format(query);
        String formatted = query.render();
        if (mode.shouldSafetyCheck()) {
            new EquivalenceChecker(mode.getDialect(), mode.getLineLength()).check(source, formatted);
        }
        return formatted;
    }

    /** Source split into lines of nodes, before any formatting pass. */
    public static Query parse(String source, Mode mode) {
        return mode.getDialect().newAnalyzer(mode.getLineLength()).parseQuery(source);
    }

    public static List<Token> lex(String source, Mode mode) {
        return mode.getDialect().newAnalyzer(mode.getLineLength()).lex(source);
    }
}
