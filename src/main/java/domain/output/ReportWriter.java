package domain.output;

import domain.model.Report;

import java.nio.file.Path;

/** Saves a run report. */
public interface ReportWriter {

    void write(Path target, Report report);
}
