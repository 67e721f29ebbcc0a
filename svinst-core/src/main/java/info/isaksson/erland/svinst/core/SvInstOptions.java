package info.isaksson.erland.svinst.core;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Options for one svinst run.
 *
 * <p>Mirrors the CLI flags in a structured form.</p>
 */
public final class SvInstOptions {
    /** Include search directories, searched in order after the including file's directory. */
    public List<Path> includeDirs = new ArrayList<>();

    /** Macro predefinitions, {@code NAME} or {@code NAME=VALUE}. */
    public List<String> defines = new ArrayList<>();

    /** Produce the full syntax tree instead of the hierarchy summary. */
    public boolean fullTree = false;

    /** Drop every {@code `include} directive instead of resolving it. */
    public boolean ignoreIncludes = false;

    /** Worker threads; 0 or less means one per available processor. */
    public int jobs = 0;

    int effectiveJobs(int fileCount) {
        int n = jobs > 0 ? jobs : Runtime.getRuntime().availableProcessors();
        return Math.max(1, Math.min(n, fileCount));
    }
}
