package domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Results of one run, in input order.
 */
public final class Report {

    private final List<FileResult> results = new ArrayList<>();
    private final boolean check;

    public Report(boolean check) {
        this.check = check;
    }

    public void add(FileResult result) {
        results.add(result);
    }

    public List<FileResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    public boolean isCheck() {
        return check;
    }

    public int total() {
        return results.size();
    }

    public int changed() {
        return count(FileStatus.CHANGED);
    }

    public int unchanged() {
        return count(FileStatus.UNCHANGED);
    }

    public int errors() {
        return count(FileStatus.ERROR);
    }

    public boolean hasErrors() {
        return errors() > 0;
    }

    public boolean hasChanges() {
        return changed() > 0;
    }

    public List<FileResult> errorResults() {
        List<FileResult> out = new ArrayList<>();
        for (FileResult r : results) {
            if (r.getStatus() == FileStatus.ERROR) out.add(r);
        }
        return out;
    }

    /** e.g. {@code 3 file(s) processed, 1 reformatted, 2 unchanged}. */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(total()).append(" file(s) processed");
        if (changed() > 0) {
            sb.append(", ").append(changed()).append(check ? " would be reformatted" : " reformatted");
        }
        if (unchanged() > 0) {
            sb.append(", ").append(unchanged()).append(" unchanged");
        }
        if (errors() > 0) {
            sb.append(", ").append(errors()).append(" error(s)");
        }
        return sb.toString();
    }

    private int count(FileStatus status) {
        int n = 0;
        for (FileResult r : results) {
            if (r.getStatus() == status) n++;
        }
        return n;
    }
}
