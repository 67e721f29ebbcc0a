package info.isaksson.erland.svinst.model;

import java.util.List;
import java.util.stream.Collectors;

/** Per-file results in the order the files were supplied. */
public final class Report {
    public final List<FileResult> files;

    public Report(List<FileResult> files) {
        this.files = files == null ? List.of() : List.copyOf(files);
    }

    /** True iff no file failed. */
    public boolean isSuccess() {
        return files.stream().noneMatch(FileResult::isFailure);
    }

    public List<FileResult> failures() {
        return files.stream().filter(FileResult::isFailure).collect(Collectors.toList());
    }

    public List<FileResult> successes() {
        return files.stream().filter(f -> !f.isFailure()).collect(Collectors.toList());
    }
}
