package infra.output;

import domain.model.Report;
import domain.output.ReportWriter;

import java.nio.file.Path;

/**
 * No-op implementation (no --report given).
 */
public final class NullReportWriter implements ReportWriter {
    @Override
    public void write(Path target, Report report) {
        // intentionally no-op
    }
}
