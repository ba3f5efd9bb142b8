package infra.output;

import domain.model.ErrorCode;
import domain.model.FileResult;
import domain.model.Report;
import domain.model.SqlfmtException;
import domain.output.ReportWriter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * XLSX report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>results: one row per file (path, status, error code, message)</li>
 *   <li>summary: totals per status</li>
 * </ul>
 */
public final class XlsxReportWriter implements ReportWriter {

    private static void writeResultsSheet(Workbook wb, Report report) {
        Sheet sh = wb.createSheet("results");
        int r = 0;
        Row header = sh.createRow(r++);
        for (int c = 0; c < CsvReportWriter.HEADER.length; c++) {
            header.createCell(c)
                    .setCellValue(CsvReportWriter.HEADER[c]);
        }

        for (FileResult it : report.getResults()) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(String.valueOf(it.getPath()));
            row.createCell(1)
                    .setCellValue(it.getStatus()
                            .name());
            row.createCell(2)
                    .setCellValue(it.getErrorCode() == null ? "" : it.getErrorCode()
                            .name());
            row.createCell(3)
                    .setCellValue(ReportFiles.nullToEmpty(it.getMessage()));
        }
    }

    private static void writeSummarySheet(Workbook wb, Report report) {
        Sheet sh = wb.createSheet("summary");
        int r = 0;
        r = summaryRow(sh, r, "total", report.total());
        r = summaryRow(sh, r, report.isCheck() ? "would_reformat" : "reformatted", report.changed());
        r = summaryRow(sh, r, "unchanged", report.unchanged());
        summaryRow(sh, r, "errors", report.errors());
    }

    private static int summaryRow(Sheet sh, int r, String label, int value) {
        Row row = sh.createRow(r);
        row.createCell(0)
                .setCellValue(label);
        row.createCell(1)
                .setCellValue(value);
        return r + 1;
    }

    @Override
    public void write(Path target, Report report) {
        if (target == null) throw new IllegalArgumentException("target is null");
        if (report == null) throw new IllegalArgumentException("report is null");
        ReportFiles.createParentDirectories(target);

        try (Workbook wb = new XSSFWorkbook()) {
            writeResultsSheet(wb, report);
            writeSummarySheet(wb, report);

            try (OutputStream os = Files.newOutputStream(target)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new SqlfmtException(ErrorCode.IO, "Failed to write xlsx: " + target, e);
        }
    }
}
