package info.isaksson.erland.svinst.core;

import info.isaksson.erland.svinst.model.FailureKind;
import info.isaksson.erland.svinst.model.FileFailure;
import info.isaksson.erland.svinst.model.FileResult;
import info.isaksson.erland.svinst.model.Report;
import info.isaksson.erland.svinst.preprocess.MacroTable;
import info.isaksson.erland.svinst.preprocess.Preprocessor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Core API: extract the design hierarchy (or full syntax tree) of a list of files.
 *
 * <p>CLI and other wrappers should use this class instead of re-implementing the pipeline.
 * Files are processed independently on a fixed thread pool; the report lists them in the
 * order given, whatever order they finish in.</p>
 */
public final class SvInstService {

    private static final Logger logger = LogManager.getLogger(SvInstService.class);

    /**
     * @throws IllegalArgumentException if a macro predefinition is invalid
     */
    public Report run(List<Path> files, SvInstOptions options) {
        if (files == null) throw new IllegalArgumentException("files must not be null");
        if (options == null) options = new SvInstOptions();

        MacroTable initialMacros = MacroTable.fromPredefinitions(options.defines);
        Preprocessor preprocessor = new Preprocessor(options.includeDirs, options.ignoreIncludes);
        FilePipeline pipeline = new FilePipeline(preprocessor, initialMacros, options.fullTree);

        ReportAssembler assembler = new ReportAssembler();
        if (files.isEmpty()) return assembler.build();

        int jobs = options.effectiveJobs(files.size());
        logger.debug("Processing {} file(s) on {} worker(s)", files.size(), jobs);

        ExecutorService executor = Executors.newFixedThreadPool(jobs, r -> {
            Thread t = new Thread(r, "svinst-worker");
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<FileResult>> futures = new ArrayList<>(files.size());
            for (Path f : files) {
                futures.add(executor.submit(() -> pipeline.process(f)));
            }
            for (int i = 0; i < futures.size(); i++) {
                assembler.add(await(futures.get(i), files.get(i)));
            }
        } finally {
            executor.shutdownNow();
        }
        return assembler.build();
    }

    private static FileResult await(Future<FileResult> future, Path file) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FileResult.failed(file.toString(), new FileFailure(FailureKind.INTERNAL_ERROR, "interrupted", null));
        } catch (ExecutionException e) {
            logger.error("Worker failed for {}", file, e.getCause());
            return FileResult.failed(file.toString(),
                    new FileFailure(FailureKind.INTERNAL_ERROR, String.valueOf(e.getCause()), null));
        }
    }
}
