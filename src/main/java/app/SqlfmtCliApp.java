package app;

import cli.CliArgParser;
import cli.CliProgressMonitor;
import cli.SqlfmtCli;
import domain.config.Mode;
import domain.model.Report;
import domain.model.SqlfmtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/** CLI entry (invoked by {@link SqlfmtCli}). */
public final class SqlfmtCliApp {

    private static final Logger LOGGER = LoggerFactory.getLogger(SqlfmtCliApp.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_WOULD_CHANGE = 1;
    public static final int EXIT_ERROR = 2;

    private static final String USAGE = String.join("\n",
            "usage: sqlfmt [options] <file|dir|->...",
            "  --line-length <n>      maximum line width (default 88)",
            "  --dialect <name>       polyglot | clickhouse | duckdb | polyglot-case-sensitive",
            "  --check                report files that would change; write nothing",
            "  --fast                 skip the safety check",
            "  --no-jinjafmt          leave template tags as they are",
            "  --exclude <globs>      comma separated file-name globs to skip",
            "  --threads <n>          worker threads (default: all processors)",
            "  --single-process       format files one at a time on the main thread",
            "  --config <file>        sqlfmt.properties to use instead of discovery",
            "  --report <file>        write a .csv or .xlsx report",
            "  --verbose | --quiet    more or less logging");

    private SqlfmtCliApp() {
    }

    public static int run(String[] args, InputStream stdin, PrintStream stdout) {
        long t0 = System.nanoTime();
        CliArgParser.ParsedArgs argv = CliArgParser.parseArgs(args);
        CliProgressMonitor.applyVerbosity(CliArgParser.flag(argv, "verbose"), CliArgParser.flag(argv, "quiet"));

        if (CliArgParser.flag(argv, "help") || argv.getPositionals().isEmpty()) {
            stdout.println(USAGE);
            return argv.getPositionals().isEmpty() && !CliArgParser.flag(argv, "help") ? EXIT_ERROR : EXIT_OK;
        }

        SqlfmtComponentsFactory factory = new SqlfmtComponentsFactory();
        boolean useStdin = argv.getPositionals().contains("-");
        List<Path> inputs = new ArrayList<>();
        for (String p : argv.getPositionals()) {
            if (!"-".equals(p)) inputs.add(Paths.get(p));
        }

        Mode mode;
        try {
            mode = buildMode(argv, factory, inputs);
        } catch (SqlfmtException | IllegalArgumentException e) {
            LOGGER.error("{}", e.getMessage());
            return EXIT_ERROR;
        }
        LOGGER.debug("[CONF] {}", mode);

        if (useStdin) {
            return formatStdin(stdin, stdout, mode);
        }

        CliProgressMonitor monitor = new CliProgressMonitor(mode.isCheck());
        Report report;
        try {
            report = new SqlfmtRunner(mode, monitor::onFile).run(inputs);
        } catch (SqlfmtException e) {
            LOGGER.error("{}", e.getMessage());
            return EXIT_ERROR;
        }
        monitor.logSummary(report, t0);

        String reportPath = argv.get("report");
        if (reportPath != null && !reportPath.isBlank()) {
            try {
                factory.createReportWriter(Paths.get(reportPath)).write(Paths.get(reportPath), report);
                LOGGER.info("report written to {}", Paths.get(reportPath).toAbsolutePath());
            } catch (SqlfmtException e) {
                LOGGER.error("{}", e.getMessage());
                return EXIT_ERROR;
            }
        }

        if (report.hasErrors()) return EXIT_ERROR;
        if (mode.isCheck() && report.hasChanges()) return EXIT_WOULD_CHANGE;
        return EXIT_OK;
    }

    static Mode buildMode(CliArgParser.ParsedArgs argv, SqlfmtComponentsFactory factory, List<Path> inputs) {
        String config = argv.get("config");
        Path explicit = (config == null || config.isBlank()) ? null : Paths.get(config);
        Mode.Builder b = factory.createModeBuilder(explicit, inputs);

        if (argv.has("line-length")) b.lineLength(CliArgParser.parseInt("line-length", argv.get("line-length")));
        if (argv.has("dialect")) b.dialect(argv.get("dialect"));
        if (argv.has("exclude")) b.exclude(CliArgParser.list(argv, "exclude"));
        if (argv.has("threads")) b.threads(CliArgParser.parseInt("threads", argv.get("threads")));
        if (argv.has("check")) b.check(CliArgParser.flag(argv, "check"));
        if (argv.has("fast")) b.fast(CliArgParser.flag(argv, "fast"));
        if (argv.has("no-jinjafmt")) b.noJinjafmt(CliArgParser.flag(argv, "no-jinjafmt"));
        if (argv.has("single-process")) b.singleProcess(CliArgParser.flag(argv, "single-process"));
        b.verbose(CliArgParser.flag(argv, "verbose"));
        b.quiet(CliArgParser.flag(argv, "quiet"));
        return b.build();
    }

    private static int formatStdin(InputStream stdin, PrintStream stdout, Mode mode) {
        String source;
        try {
            ByteArrayOutputStream buf = new ByteArrayOutputStream();
            stdin.transferTo(buf);
            source = SqlfmtRunner.decode(buf.toByteArray(), mode.getEncoding());
        } catch (IOException e) {
            LOGGER.error("Read error: {}", e.getMessage());
            return EXIT_ERROR;
        }
        String formatted;
        try {
            formatted = SqlfmtApi.format(source, mode);
        } catch (SqlfmtException e) {
            LOGGER.error("{}: {}", e.getCode(), e.getMessage());
            return EXIT_ERROR;
        }
        if (mode.isCheck()) {
            return source.equals(formatted) ? EXIT_OK : EXIT_WOULD_CHANGE;
        }
        stdout.print(formatted);
        stdout.flush();
        return EXIT_OK;
    }
}
