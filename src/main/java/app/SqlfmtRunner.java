package app;

import domain.config.Mode;
import domain.model.ErrorCode;
import domain.model.FileResult;
import domain.model.Report;
import domain.model.SqlfmtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Formats files in place, one task per file on a bounded pool. A failing file is recorded in
 * the report and does not stop the others.
 */
public final class SqlfmtRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(SqlfmtRunner.class);

    private final Mode mode;
    private final Consumer<FileResult> listener;
    private final BiFunction<String, Mode, String> formatter;

    public SqlfmtRunner(Mode mode) {
        this(mode, r -> {
        });
    }

    /**
     * @param listener called once per finished file, possibly from a worker thread
     */
    public SqlfmtRunner(Mode mode, Consumer<FileResult> listener) {
        this(mode, listener, SqlfmtApi::format);
    }

    SqlfmtRunner(Mode mode, Consumer<FileResult> listener, BiFunction<String, Mode, String> formatter) {
        this.mode = mode;
        this.listener = listener;
        this.formatter = formatter;
    }

    public Report run(List<Path> inputs) {
        List<Path> files = new FileCollector(mode).collect(inputs);
        LOGGER.debug("collected {} file(s) from {} input(s)", files.size(), inputs.size());
        Report report = new Report(mode.isCheck());

        if (mode.isSingleProcess() || files.size() <= 1) {
            for (Path file : files) {
                report.add(formatFile(file));
            }
            return report;
        }

        int threads = mode.getThreads() > 0 ? mode.getThreads() : Runtime.getRuntime().availableProcessors();
        threads = Math.max(1, Math.min(threads, files.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<FileResult>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(pool.submit(() -> formatFile(file)));
            }
            for (int i = 0; i < futures.size(); i++) {
                report.add(await(futures.get(i), files.get(i)));
            }
        } finally {
            pool.shutdownNow();
        }
        return report;
    }

    private static FileResult await(Future<FileResult> future, Path file) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FileResult.error(file, ErrorCode.IO, "Interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof SqlfmtException) {
                return FileResult.error(file, (SqlfmtException) cause);
            }
            return FileResult.error(file, ErrorCode.IO, String.valueOf(cause.getMessage()));
        }
    }

    /** Reads, formats and (unless checking) writes back one file. */
    public FileResult formatFile(Path file) {
        FileResult result;
        try {
            result = doFormatFile(file);
        } catch (RuntimeException e) {
            LOGGER.error("unexpected failure formatting {}", file, e);
            result = FileResult.error(file, ErrorCode.PARSING, "Internal error: " + e);
        }
        listener.accept(result);
        return result;
    }

    private FileResult doFormatFile(Path file) {
        String source;
        try {
            source = decode(Files.readAllBytes(file), mode.getEncoding());
        } catch (CharacterCodingException e) {
            return FileResult.error(file, ErrorCode.IO,
                    "Read error: " + file + " is not valid " + mode.getEncoding().name());
        } catch (IOException e) {
            return FileResult.error(file, ErrorCode.IO, "Read error: " + e.getMessage());
        }

        String formatted;
        try {
            formatted = formatter.apply(source, mode);
        } catch (SqlfmtException e) {
            return FileResult.error(file, e);
        }

        if (source.equals(formatted)) {
            return FileResult.unchanged(file);
        }
        if (mode.isCheck()) {
            return FileResult.changed(file);
        }
        try {
            Files.write(file, formatted.getBytes(mode.getEncoding()));
        } catch (IOException e) {
            return FileResult.error(file, ErrorCode.IO, "Write error: " + e.getMessage());
        }
        return FileResult.changed(file);
    }

    /** Strict decoding: malformed input must fail instead of turning into U+FFFD on disk. */
    static String decode(byte[] bytes, Charset charset) throws CharacterCodingException {
        return charset
                .newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }
}
