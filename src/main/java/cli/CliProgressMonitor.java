package cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import domain.model.FileResult;
import domain.model.Report;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-file progress and the final summary, logged through SLF4J.
 */
public final class CliProgressMonitor {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliProgressMonitor.class);

    private final AtomicInteger done = new AtomicInteger(0);
    private final boolean check;

    public CliProgressMonitor(boolean check) {
        this.check = check;
    }

    /** {@code --verbose} raises the root level to DEBUG, {@code --quiet} lowers it to WARN. */
    public static void applyVerbosity(boolean verbose, boolean quiet) {
        Level level = verbose ? Level.DEBUG : (quiet ? Level.WARN : null);
        if (level == null) return;
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext) {
            ((LoggerContext) factory).getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        }
    }

    public void onFile(FileResult result) {
        int n = done.incrementAndGet();
        switch (result.getStatus()) {
            case CHANGED:
                LOGGER.info("[{}] {} {}", n, check ? "would reformat" : "reformatted", result.getPath());
                break;
            case ERROR:
                LOGGER.warn("[{}] failed {}: {} {}", n, result.getPath(), result.getErrorCode(), result.getMessage());
                break;
            default:
                LOGGER.debug("[{}] unchanged {}", n, result.getPath());
                break;
        }
    }

    public void logSummary(Report report, long startNs) {
        long elapsedMs = (System.nanoTime() - startNs) / 1_000_000L;
        LOGGER.info("{} in {}ms", report.summary(), elapsedMs);
    }
}
