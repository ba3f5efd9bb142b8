package infra.output;

import domain.model.ErrorCode;
import domain.model.SqlfmtException;

import java.nio.file.Files;
import java.nio.file.Path;

final class ReportFiles {

    private ReportFiles() {
    }

    static void createParentDirectories(Path target) {
        try {
            Path parent = target.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new SqlfmtException(ErrorCode.IO, "Failed to create report parent dir: " + target, e);
        }
    }

    static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
