package info.isaksson.erland.svinst.core;

import info.isaksson.erland.svinst.extract.HierarchyExtractor;
import info.isaksson.erland.svinst.extract.ParsedUnit;
import info.isaksson.erland.svinst.extract.SvSyntaxException;
import info.isaksson.erland.svinst.extract.SvSyntaxParser;
import info.isaksson.erland.svinst.extract.SyntaxTreeDumper;
import info.isaksson.erland.svinst.model.FailureKind;
import info.isaksson.erland.svinst.model.FileFailure;
import info.isaksson.erland.svinst.model.FileResult;
import info.isaksson.erland.svinst.preprocess.MacroTable;
import info.isaksson.erland.svinst.preprocess.PreprocessException;
import info.isaksson.erland.svinst.preprocess.PreprocessedSource;
import info.isaksson.erland.svinst.preprocess.Preprocessor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Preprocess, parse and extract one file.
 *
 * <p>Every outcome, including unexpected exceptions, becomes a {@link FileResult}; nothing
 * escapes to affect other files. Holds no per-file state, so one instance serves all workers.</p>
 */
final class FilePipeline {

    private static final Logger logger = LogManager.getLogger(FilePipeline.class);

    private final Preprocessor preprocessor;
    private final MacroTable initialMacros;
    private final boolean fullTree;
    private final SvSyntaxParser parser = new SvSyntaxParser();
    private final HierarchyExtractor extractor = new HierarchyExtractor();
    private final SyntaxTreeDumper dumper = new SyntaxTreeDumper();

    FilePipeline(Preprocessor preprocessor, MacroTable initialMacros, boolean fullTree) {
        this.preprocessor = preprocessor;
        this.initialMacros = initialMacros;
        this.fullTree = fullTree;
    }

    FileResult process(Path file) {
        String name = file.toString();
        try {
            PreprocessedSource source = preprocessor.process(file, initialMacros);
            ParsedUnit unit = parser.parse(source);
            return fullTree
                    ? FileResult.fullTree(name, dumper.dump(unit))
                    : FileResult.summary(name, extractor.extract(unit));
        } catch (PreprocessException e) {
            return failed(name, new FileFailure(e.getKind(), e.getMessage(), e.getLocation()));
        } catch (SvSyntaxException e) {
            return failed(name, new FileFailure(FailureKind.PARSE_FAILURE, e.getMessage(), e.getLocation()));
        } catch (NoSuchFileException e) {
            return failed(name, new FileFailure(FailureKind.IO_ERROR, "no such file", null));
        } catch (IOException e) {
            return failed(name, new FileFailure(FailureKind.IO_ERROR, e.getMessage(), null));
        } catch (RuntimeException | StackOverflowError e) {
            logger.error("Unexpected failure while processing {}", name, e);
            return failed(name, new FileFailure(FailureKind.INTERNAL_ERROR,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), null));
        }
    }

    private static FileResult failed(String name, FileFailure failure) {
        logger.debug("{} failed: {}", name, failure);
        return FileResult.failed(name, failure);
    }
}
