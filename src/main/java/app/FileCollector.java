package app;

import domain.config.Mode;
import domain.model.ErrorCode;
import domain.model.SqlfmtException;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Expands input paths into the SQL files to format.
 *
 * <p>Directories are walked recursively. Entries whose name starts with {@code .} or matches an
 * exclude glob are skipped. The result is de-duplicated and sorted.</p>
 */
public final class FileCollector {

    private final Mode mode;
    private final List<PathMatcher> excludes;

    public FileCollector(Mode mode) {
        this.mode = mode;
        this.excludes = new ArrayList<>();
        for (String glob : mode.getExclude()) {
            if (glob == null || glob.isBlank()) continue;
            excludes.add(FileSystems.getDefault().getPathMatcher("glob:" + glob.trim()));
        }
    }

    public List<Path> collect(List<Path> inputs) {
        TreeSet<Path> out = new TreeSet<>();
        for (Path input : inputs) {
            Path p = input.toAbsolutePath().normalize();
            if (Files.isRegularFile(p)) {
                if (mode.isSqlFile(fileName(p))) out.add(p);
            } else if (Files.isDirectory(p)) {
                walk(p, out);
            }
        }
        return new ArrayList<>(out);
    }

    private void walk(Path dir, TreeSet<Path> out) {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                String name = fileName(entry);
                if (name.startsWith(".") || isExcluded(entry)) continue;
                if (Files.isDirectory(entry)) {
                    walk(entry, out);
                } else if (mode.isSqlFile(name)) {
                    out.add(entry);
                }
            }
        } catch (IOException e) {
            throw new SqlfmtException(ErrorCode.IO, "Failed to list directory: " + dir, e);
        }
    }

    private boolean isExcluded(Path entry) {
        Path name = entry.getFileName();
        for (PathMatcher m : excludes) {
            if (m.matches(name)) return true;
        }
        return false;
    }

    private static String fileName(Path p) {
        Path name = p.getFileName();
        return name == null ? "" : name.toString();
    }
}
