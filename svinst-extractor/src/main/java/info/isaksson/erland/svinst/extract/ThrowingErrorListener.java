package info.isaksson.erland.svinst.extract;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/** Turns the first lexer or parser error into an {@link SvSyntaxException}. */
final class ThrowingErrorListener extends BaseErrorListener {

    static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

    private ThrowingErrorListener() {}

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
                            String msg, RecognitionException e) {
        String message = msg;
        if (offendingSymbol instanceof Token) {
            Token t = (Token) offendingSymbol;
            message = t.getType() == Token.EOF ? "unexpected end of input" : "unexpected '" + t.getText() + "'";
        }
        throw new SvSyntaxException(message, line, charPositionInLine);
    }
}
