package app;

import domain.config.Mode;
import domain.output.ReportWriter;
import infra.config.SqlfmtConfigLoader;
import infra.output.CsvReportWriter;
import infra.output.NullReportWriter;
import infra.output.XlsxReportWriter;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Object-assembly factory for {@link SqlfmtCliApp}: the base mode from config files and the
 * report writer for a target path.
 */
final class SqlfmtComponentsFactory {

    private final SqlfmtConfigLoader configLoader = new SqlfmtConfigLoader();

    /** Defaults overlaid with the explicit config file, or the one discovered above the inputs. */
    Mode.Builder createModeBuilder(Path explicitConfig, List<Path> inputs) {
        Mode.Builder builder = Mode.builder();
        Path config = (explicitConfig != null) ? explicitConfig : configLoader.discover(inputs);
        if (config != null) {
            configLoader.apply(config, builder);
        }
        return builder;
    }

    ReportWriter createReportWriter(Path target) {
        if (target == null) return new NullReportWriter();
        String name = String.valueOf(target.getFileName()).toLowerCase(Locale.ROOT);
        if (name.endsWith(".xlsx")) return new XlsxReportWriter();
        return new CsvReportWriter();
    }
}
