package infra.output;

import domain.model.ErrorCode;
import domain.model.FileResult;
import domain.model.Report;
import domain.model.SqlfmtException;
import domain.output.ReportWriter;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CSV report: one row per file with columns {@code path,status,error_code,message}.
 */
public final class CsvReportWriter implements ReportWriter {

    static final String[] HEADER = {"path", "status", "error_code", "message"};

    @Override
    public void write(Path target, Report report) {
        if (target == null) throw new IllegalArgumentException("target is null");
        if (report == null) throw new IllegalArgumentException("report is null");
        ReportFiles.createParentDirectories(target);

        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVPrinter printer = CSVFormat.DEFAULT
                     .builder()
                     .setHeader(HEADER)
                     .build()
                     .print(out)) {
            for (FileResult it : report.getResults()) {
                printer.printRecord(
                        String.valueOf(it.getPath()),
                        it.getStatus().name(),
                        it.getErrorCode() == null ? "" : it.getErrorCode().name(),
                        it.getMessage());
            }
        } catch (Exception e) {
            throw new SqlfmtException(ErrorCode.IO, "Failed to write csv: " + target, e);
        }
    }
}
