package info.isaksson.erland.svinst.extract;

import info.isaksson.erland.svinst.parser.SystemVerilogLexer;
import info.isaksson.erland.svinst.parser.SystemVerilogParser;
import info.isaksson.erland.svinst.preprocess.PreprocessedSource;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs the structural parser over preprocessed text.
 *
 * <p>Parses in fast SLL mode first and only retries in full LL mode when SLL gives up, so the
 * reported error is always the one a full parse finds. Stateless; safe to share.</p>
 */
public final class SvSyntaxParser {

    private static final Logger logger = LogManager.getLogger(SvSyntaxParser.class);

    /**
     * @throws SvSyntaxException with {@link SvSyntaxException#getLocation()} set to the original position
     */
    public ParsedUnit parse(PreprocessedSource source) {
        try {
            return new ParsedUnit(source, parseTree(source), SystemVerilogParser.ruleNames);
        } catch (SvSyntaxException e) {
            throw e.at(source.sourceMap.locate(e.getLine(), e.getColumn() + 1));
        }
    }

    private static SystemVerilogParser.Source_textContext parseTree(PreprocessedSource source) {
        SystemVerilogLexer lexer = new SystemVerilogLexer(CharStreams.fromString(source.text, source.fileName));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        SystemVerilogParser parser = new SystemVerilogParser(tokens);
        parser.removeErrorListeners();
        parser.setErrorHandler(new BailErrorStrategy());
        parser.getInterpreter().setPredictionMode(PredictionMode.SLL);
        try {
            return parser.source_text();
        } catch (ParseCancellationException e) {
            logger.debug("SLL parse of {} gave up, retrying with full LL", source.fileName);
        }

        tokens.seek(0);
        parser.reset();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);
        parser.setErrorHandler(new DefaultErrorStrategy());
        parser.getInterpreter().setPredictionMode(PredictionMode.LL);
        return parser.source_text();
    }
}
