package info.isaksson.erland.svinst.core;

import info.isaksson.erland.svinst.model.FileResult;
import info.isaksson.erland.svinst.model.Report;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/** Collects per-file results in input order into a {@link Report}. */
public final class ReportAssembler {

    private static final Logger logger = LogManager.getLogger(ReportAssembler.class);

    private final List<FileResult> results = new ArrayList<>();

    public ReportAssembler add(FileResult result) {
        if (result == null) throw new IllegalArgumentException("result must not be null");
        results.add(result);
        return this;
    }

    public Report build() {
        Report report = new Report(results);
        logger.debug("Report: {} file(s), {} failed", report.files.size(), report.failures().size());
        return report;
    }
}
