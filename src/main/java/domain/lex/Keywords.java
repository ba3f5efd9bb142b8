package domain.lex;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Keyword tables: multi-word continuations and the lists each lex state classifies against.
 * Built once at class load and read-only afterwards.
 */
final class Keywords {

    private Keywords() {
    }

    private static final String[][] JOIN_TAILS = {
            {"left", "outer", "join"}, {"left", "join"},
            {"right", "outer", "join"}, {"right", "join"},
            {"inner", "join"},
            {"full", "outer", "join"}, {"full", "join"},
            {"join"}
    };

    private static final String[] FUNCTION_MODIFIERS = {"temporary", "temp", "secure", "external", "table"};

    private static final String[] FUNCTION_SET_PARAMS = {
            "api_integration", "headers", "context_headers", "max_batch_rows", "compression",
            "request_translator", "response_translator", "comment", "schema", "secure"
    };

    static final String[] WAREHOUSE_PARAMS = {
            "warehouse_type", "warehouse_size", "max_cluster_count", "min_cluster_count",
            "scaling_policy", "auto_suspend", "auto_resume", "initially_suspended",
            "resource_monitor", "comment", "enable_query_acceleration",
            "query_acceleration_max_scale_factor", "max_concurrency_level",
            "statement_queued_timeout_in_seconds", "statement_timeout_in_seconds", "tag"
    };

    static final Set<String> UNTERM = set(
            "with recursive", "with",
            "select as struct", "select as value", "select all", "select distinct", "select",
            "global inner join", "global left outer join", "global left join", "global right outer join",
            "global right join", "global full outer join", "global full join", "global any join", "global join",
            "any left outer join", "any left join", "any right outer join", "any right join", "any inner join",
            "any full outer join", "any full join", "paste join",
            "natural full outer join", "natural full join", "natural left outer join", "natural left join",
            "natural right outer join", "natural right join", "natural inner join", "natural join",
            "cross lateral join", "cross join",
            "left outer join", "left semi join", "left anti join", "left asof join", "left join",
            "right outer join", "right semi join", "right anti join", "right join",
            "full outer join", "full join", "inner join", "semi join", "anti join",
            "asof left join", "asof join", "positional join", "any join", "lateral join", "join",
            "lateral view outer", "lateral view", "lateral",
            "prewhere", "where", "group by", "cluster by", "distribute by", "sort by", "having", "qualify",
            "window", "order by", "limit", "fetch first", "fetch next",
            "for no key update", "for key share", "for update", "for share",
            "when", "then", "else", "partition by", "values", "returning", "into", "match_recognize",
            "connect", "start with");

    static final Set<String> WORD_OPERATORS = set(
            "is not distinct from", "is distinct from", "not similar to", "similar to",
            "not ilike all", "not ilike any", "not like all", "not like any",
            "ilike all", "ilike any", "like all", "like any",
            "not between", "not ilike", "not like", "not rlike", "not regexp", "not exists",
            "global not in", "global in", "not in", "is not",
            "grouping sets", "within group", "respect nulls", "ignore nulls", "nulls first", "nulls last",
            "as", "between", "cube", "exists", "filter", "ilike", "isnull", "in", "interval", "is", "like",
            "notnull", "over", "pivot", "regexp", "rlike", "rollup", "some", "tablesample", "unpivot",
            "asc", "desc");

    static final Set<String> SET_OPERATORS = set(
            "union all by name", "union by name", "union all", "union distinct",
            "intersect all", "intersect distinct", "except all", "except distinct",
            "union all corresponding by", "union corresponding by", "union strict corresponding",
            "union corresponding", "intersect all corresponding", "intersect corresponding",
            "except all corresponding", "except corresponding",
            "union", "intersect", "except", "minus");

    static final Set<String> UNSUPPORTED_FIRST_WORDS = set(
            "delete", "insert", "update", "merge", "truncate", "rename", "unset", "use", "execute",
            "begin", "commit", "rollback", "copy", "clone", "cluster", "deallocate", "declare",
            "discard", "do", "export", "handler", "import", "lock", "move", "prepare", "reassign",
            "repair", "security", "unload", "validate", "vacuum", "analyze", "refresh", "list",
            "remove", "get", "put", "describe", "show", "comment", "add", "undrop", "cache", "clear");

    static final Set<String> EXPLAIN = set("explain", "explain analyze", "explain verbose", "explain using");

    private static final Set<String> FUNCTION_UNTERM = set(
            "language", "transform", "immutable", "stable", "volatile", "strict", "cost", "rows",
            "support", "imports", "packages", "handler", "target_path", "options", "cascade", "restrict",
            "comment", "set comment", "unset comment",
            "api_integration", "set api_integration", "headers", "set headers",
            "context_headers", "set context_headers", "max_batch_rows", "set max_batch_rows",
            "compression", "set compression", "request_translator", "set request_translator",
            "response_translator", "set response_translator",
            "remote with connection", "rename to", "owner to", "set schema",
            "depends on extension", "no depends on extension", "set secure", "unset secure",
            "not null", "null", "set", "reset");

    private static final String[] FUNCTION_UNTERM_PREFIXES = {
            "return", "leakproof", "not leakproof", "called on null", "returns null on null", "security", "parallel"
    };

    static final Set<String> ANGLE_TYPES = set("array", "struct", "map", "table");
    static final Set<String> NAME_BEFORE_PAREN = set("filter", "isnull", "offset", "get", "comment", "add", "remove", "list");
    static final Set<String> STAR_MODIFIERS = set("except", "exclude", "replace");

    private static Set<String> set(String... words) {
        return Collections.unmodifiableSet(new HashSet<>(Arrays.asList(words)));
    }

    private static String[] w(String... words) {
        return words;
    }

    /**
     * Greedily extends {@code first} (lowercased) with continuation words. The cursor sits right
     * after the first word; on success it is moved past the longest continuation, which is the
     * longer of the state table's match and the shared table's match.
     */
    static boolean extend(SqlScan scan, String first, LexState state) {
        int start = scan.pos;
        int stateEnd = -1;
        if (extendForState(scan, first, state)) {
            stateEnd = scan.pos;
            scan.pos = start;
        }
        int baseEnd = -1;
        if (extendBase(scan, first)) {
            baseEnd = scan.pos;
        }
        int end = Math.max(stateEnd, baseEnd);
        scan.pos = (end < 0) ? start : end;
        return end >= 0;
    }

    private static boolean extendForState(SqlScan scan, String first, LexState state) {
        switch (state) {
            case GRANT:
                switch (first) {
                    case "revoke":
                        return scan.tryWords("grant", "option", "for");
                    case "with":
                        return scan.tryWords("grant", "option");
                    case "granted":
                        return scan.tryWords("by");
                    default:
                        return false;
                }
            case FUNCTION:
                switch (first) {
                    case "called":
                        return scan.tryWords("on", "null", "input");
                    case "returns":
                        return scan.tryWords("null", "on", "null", "input");
                    case "remote":
                        return scan.tryWords("with", "connection");
                    case "rename":
                    case "owner":
                        return scan.tryWords("to");
                    case "depends":
                        return scan.tryWords("on", "extension");
                    case "no":
                        return scan.tryWords("depends", "on", "extension");
                    case "not":
                        return scan.tryWords("leakproof");
                    case "parallel":
                        return scan.tryAnyWords(w("safe"), w("unsafe"), w("restricted"));
                    case "security":
                        return scan.tryAnyWords(w("definer"), w("invoker"));
                    case "set":
                        return tryAnyOne(scan, FUNCTION_SET_PARAMS);
                    case "unset":
                        return scan.tryAnyWords(w("comment"), w("secure"));
                    default:
                        return false;
                }
            case WAREHOUSE:
                switch (first) {
                    case "abort":
                        return scan.tryWords("all", "queries");
                    case "rename":
                        return scan.tryWords("to");
                    case "resume":
                        return scan.tryWords("if", "suspended");
                    case "with":
                    case "set":
                    case "unset":
                        return tryAnyOne(scan, WAREHOUSE_PARAMS);
                    default:
                        return false;
                }
            default:
                return false;
        }
    }

    private static boolean tryAnyOne(SqlScan scan, String[] words) {
        for (String word : words) {
            if (scan.tryWords(word)) return true;
        }
        return false;
    }

    private static boolean extendBase(SqlScan scan, String first) {
        switch (first) {
            case "global":
                return scan.tryAnyWords(JOIN_TAILS)
                        || scan.tryAnyWords(w("any", "join"), w("not", "in"), w("in"));
            case "any":
            case "natural":
                return scan.tryAnyWords(JOIN_TAILS);
            case "cross":
                return scan.tryAnyWords(w("lateral", "join"), w("join"));
            case "left":
                return scan.tryAnyWords(w("outer", "join"), w("semi", "join"), w("anti", "join"),
                        w("asof", "join"), w("join"));
            case "right":
                return scan.tryAnyWords(w("outer", "join"), w("semi", "join"), w("anti", "join"), w("join"));
            case "full":
                return scan.tryAnyWords(w("outer", "join"), w("join"));
            case "inner":
            case "semi":
            case "anti":
            case "positional":
            case "paste":
                return scan.tryWords("join");
            case "asof":
                return scan.tryAnyWords(w("left", "join"), w("join"));
            case "select":
                return scan.tryAnyWords(w("as", "struct"), w("as", "value"), w("into"), w("all"), w("distinct"))
                        || trySelectTop(scan);
            case "with":
                return scan.tryWords("recursive");
            case "delete":
                return scan.tryWords("from");
            case "group":
            case "order":
            case "cluster":
            case "distribute":
            case "sort":
            case "partition":
                return scan.tryWords("by");
            case "lateral":
                return scan.tryAnyWords(w("view", "outer"), w("view"), w("join"));
            case "fetch":
                return scan.tryAnyWords(w("first"), w("next"));
            case "start":
                return scan.tryWords("with");
            case "for":
                return scan.tryAnyWords(w("no", "key", "update"), w("key", "share"), w("update"), w("share"));
            case "is":
                return scan.tryAnyWords(w("not", "distinct", "from"), w("distinct", "from"), w("not"));
            case "not":
                return scan.tryAnyWords(w("similar", "to"), w("ilike", "all"), w("ilike", "any"),
                        w("like", "all"), w("like", "any"), w("between"), w("ilike"), w("like"),
                        w("rlike"), w("regexp"), w("exists"), w("in"));
            case "ilike":
            case "like":
                return scan.tryAnyWords(w("all"), w("any"));
            case "similar":
                return scan.tryWords("to");
            case "grouping":
                return scan.tryWords("sets");
            case "within":
                return scan.tryWords("group");
            case "respect":
            case "ignore":
                return scan.tryWords("nulls");
            case "nulls":
                return scan.tryAnyWords(w("first"), w("last"));
            case "union":
                return scan.tryAnyWords(w("all", "by", "name"), w("by", "name"), w("all", "corresponding", "by"),
                        w("corresponding", "by"), w("strict", "corresponding"), w("corresponding"),
                        w("all"), w("distinct"));
            case "intersect":
            case "except":
            case "minus":
                return scan.tryAnyWords(w("all", "corresponding"), w("corresponding"), w("all"), w("distinct"));
            case "create":
                return extendCreate(scan);
            case "alter":
                return extendAlter(scan);
            case "drop":
                return scan.tryAnyWords(w("function", "if", "exists"), w("function"));
            case "insert":
                return scan.tryAnyWords(w("overwrite", "into"), w("overwrite"), w("into"));
            case "merge":
                return scan.tryWords("into");
            case "rename":
            case "cache":
                return scan.tryWords("table");
            case "clear":
                return scan.tryWords("cache");
            case "reassign":
                return scan.tryWords("owned");
            case "import":
                return scan.tryAnyWords(w("foreign", "schema"), w("table"));
            case "security":
                return scan.tryWords("label");
            case "explain":
                return scan.tryAnyWords(w("analyze"), w("verbose"), w("using"));
            default:
                return false;
        }
    }

    /** {@code select top <digits>}. */
    private static boolean trySelectTop(SqlScan scan) {
        int save = scan.pos;
        if (!scan.tryWords("top")) return false;
        scan.skipSpaces();
        int digits = scan.pos;
        while (SqlScan.isDigit(scan.peek())) scan.pos++;
        if (scan.pos == digits) {
            scan.pos = save;
            return false;
        }
        return true;
    }

    /**
     * {@code create [or replace] [modifiers] function [if not exists]} or
     * {@code create [or replace] warehouse [if not exists]}.
     */
    private static boolean extendCreate(SqlScan scan) {
        boolean orReplace = scan.tryWords("or", "replace");
        if (tryModifiersThenFunction(scan)) {
            scan.tryWords("if", "not", "exists");
            return true;
        }
        if (scan.tryWords("warehouse")) {
            scan.tryWords("if", "not", "exists");
            return true;
        }
        return orReplace;
    }

    private static boolean extendAlter(SqlScan scan) {
        if (scan.tryWords("function") || scan.tryWords("warehouse")) {
            scan.tryWords("if", "exists");
            return true;
        }
        return false;
    }

    /** Skips up to one of each function modifier and then requires {@code function}. */
    static boolean tryModifiersThenFunction(SqlScan scan) {
        int save = scan.pos;
        for (int i = 0; i <= FUNCTION_MODIFIERS.length; i++) {
            if (scan.tryWords("function")) return true;
            if (!tryAnyOne(scan, FUNCTION_MODIFIERS)) break;
        }
        scan.pos = save;
        return false;
    }

    /**
     * Lookahead after {@code create ...}: an object type, an optional {@code if not exists}, a
     * name and then {@code clone}.
     */
    static boolean looksLikeClone(String s, int from) {
        SqlScan scan = new SqlScan(s, from);
        if (!scan.tryWords("file", "format")
                && !scan.tryAnyWords(w("database"), w("schema"), w("table"), w("stage"),
                w("sequence"), w("stream"), w("task"))) {
            return false;
        }
        scan.tryWords("if", "not", "exists");
        scan.skipSpaces();
        char c = scan.peek();
        if (c == '"' || c == '`' || c == '\'') {
            scan.pos++;
            int close = s.indexOf(c, scan.pos);
            if (close < 0) return false;
            scan.pos = close + 1;
        } else {
            int start = scan.pos;
            while (SqlScan.isAsciiAlnum(scan.peek()) || scan.peek() == '_' || scan.peek() == '.') scan.pos++;
            if (scan.pos == start) return false;
        }
        return scan.tryWords("clone");
    }

    static boolean looksLikeFunction(String s, int from) {
        return tryModifiersThenFunction(new SqlScan(s, from));
    }

    static boolean looksLikeWarehouse(String s, int from) {
        return new SqlScan(s, from).tryWords("warehouse");
    }

    static boolean isFunctionDdl(String kw) {
        return (kw.startsWith("create") || kw.startsWith("alter") || kw.startsWith("drop")) && kw.contains("function");
    }

    static boolean isWarehouseDdl(String kw) {
        return (kw.startsWith("create") || kw.startsWith("alter")) && kw.contains("warehouse");
    }

    static boolean isFunctionUnterm(String kw) {
        if (FUNCTION_UNTERM.contains(kw) || isFunctionDdl(kw)) return true;
        for (String prefix : FUNCTION_UNTERM_PREFIXES) {
            if (kw.startsWith(prefix)) return true;
        }
        return false;
    }

    static boolean isWarehouseUnterm(String kw) {
        if (isWarehouseDdl(kw) || kw.equals("suspend") || kw.equals("rename to")
                || kw.startsWith("resume") || kw.startsWith("abort all queries")) {
            return true;
        }
        for (String param : WAREHOUSE_PARAMS) {
            if (kw.contains(param)) return true;
        }
        return false;
    }

    static boolean isGrantUnterm(String kw) {
        switch (kw) {
            case "grant":
            case "on":
            case "to":
            case "from":
            case "cascade":
            case "restrict":
                return true;
            default:
                return kw.startsWith("revoke") || kw.startsWith("with grant") || kw.startsWith("granted by");
        }
    }
}
