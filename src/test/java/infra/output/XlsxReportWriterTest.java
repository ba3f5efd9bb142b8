package infra.output;

import domain.model.ErrorCode;
import domain.model.FileResult;
import domain.model.Report;
import org.apache.logging.log4j.LogManager;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class XlsxReportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writes_results_and_summary_sheets() throws Exception {
        Report report = new Report(true);
        report.add(FileResult.changed(Paths.get("a.sql")));
        report.add(FileResult.unchanged(Paths.get("b.sql")));
        report.add(FileResult.error(Paths.get("c.sql"), ErrorCode.PARSING, "Could not lex '~'"));

        Path target = tempDir.resolve("report.xlsx");
        new XlsxReportWriter().write(target, report);

        try (InputStream in = Files.newInputStream(target); Workbook wb = new XSSFWorkbook(in)) {
            Sheet results = wb.getSheet("results");
            assertNotNull(results);
            assertEquals("path", results.getRow(0).getCell(0).getStringCellValue());
            assertEquals("a.sql", results.getRow(1).getCell(0).getStringCellValue());
            assertEquals("CHANGED", results.getRow(1).getCell(1).getStringCellValue());
            assertEquals("PARSING", results.getRow(3).getCell(2).getStringCellValue());
            assertEquals("Could not lex '~'", results.getRow(3).getCell(3).getStringCellValue());

            Sheet summary = wb.getSheet("summary");
            assertEquals("total", summary.getRow(0).getCell(0).getStringCellValue());
            assertEquals(3.0, summary.getRow(0).getCell(1).getNumericCellValue());
            assertEquals("would_reformat", summary.getRow(1).getCell(0).getStringCellValue());
            assertEquals(1.0, summary.getRow(3).getCell(1).getNumericCellValue());
        }
    }

    @Test
    void poi_logging_is_routed_to_slf4j() {
        assertEquals("org.apache.logging.slf4j.SLF4JLoggerContextFactory", LogManager.getFactory().getClass().getName());
    }
}
