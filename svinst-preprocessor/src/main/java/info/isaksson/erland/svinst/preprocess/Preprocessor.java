package info.isaksson.erland.svinst.preprocess;

import info.isaksson.erland.svinst.model.FailureKind;
import info.isaksson.erland.svinst.model.SourceLocation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * SystemVerilog text preprocessor: conditional compilation, text macros and file inclusion.
 *
 * <p>The preprocessor itself is immutable and may be shared between threads. All mutable
 * state (macro table, conditional nesting, include chain, output) lives in a {@link Session}
 * created for each {@link #process} call. Include nesting and macro expansion are recursive
 * and bounded by {@link #MAX_INCLUDE_DEPTH} and {@link #MAX_EXPANSION_DEPTH}.</p>
 *
 * <p>Line structure is preserved: comments become blanks, inactive text and directives become
 * empty text and macro expansions stay on the invoking line, so every output line maps to
 * exactly one source line through the resulting {@link SourceMap}.</p>
 */
public final class Preprocessor {

    private static final Logger logger = LogManager.getLogger(Preprocessor.class);

    public static final int MAX_INCLUDE_DEPTH = 64;
    public static final int MAX_EXPANSION_DEPTH = 64;

    /** Tool directives that do not affect the hierarchy; their arguments run to end of line. */
    private static final Set<String> IGNORED_WITH_ARGUMENT = Set.of(
            "timescale", "default_nettype", "unconnected_drive", "pragma", "line", "begin_keywords");

    private static final Set<String> IGNORED_BARE = Set.of(
            "resetall", "celldefine", "endcelldefine", "nounconnected_drive", "end_keywords");

    private final IncludeResolver resolver;
    private final boolean ignoreIncludes;

    public Preprocessor(List<Path> includeDirs, boolean ignoreIncludes) {
        this.resolver = new IncludeResolver(includeDirs);
        this.ignoreIncludes = ignoreIncludes;
    }

    /** Read and preprocess {@code file}. */
    public PreprocessedSource process(Path file, MacroTable initialMacros) throws IOException, PreprocessException {
        return process(file, readSource(file), initialMacros);
    }

    /**
     * Preprocess {@code text} as the content of {@code file}.
     *
     * @param initialMacros predefined macros; copied, never modified
     */
    public PreprocessedSource process(Path file, String text, MacroTable initialMacros) throws PreprocessException {
        if (file == null) throw new IllegalArgumentException("file must not be null");
        if (text == null) throw new IllegalArgumentException("text must not be null");

        Session session = new Session(initialMacros == null ? new MacroTable() : initialMacros.copy(), file);
        session.activeIncludes.push(canonical(file));
        session.scan(SourceCursor.forFile(file, text), 0, 0);

        if (!session.conditions.isEmpty()) {
            throw new PreprocessException(FailureKind.UNBALANCED_CONDITIONAL,
                    "missing `endif for " + session.conditions.depth() + " open conditional group(s)",
                    session.openConditionals.peek());
        }
        PreprocessedSource out = session.out.build(file.toString());
        logger.debug("Preprocessed {}: {} line(s), {} macro(s) defined at end", file, out.sourceMap.lineCount(),
                session.macros.size());
        return out;
    }

    static String readSource(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private static Path canonical(Path p) {
        try {
            return p.toRealPath();
        } catch (IOException e) {
            return p.toAbsolutePath().normalize();
        }
    }

    /** Per-file preprocessing state. */
    private final class Session {
        final MacroTable macros;
        final ConditionalStack conditions = new ConditionalStack();
        final Deque<SourceLocation> openConditionals = new ArrayDeque<>();
        final Deque<Path> activeIncludes = new ArrayDeque<>();
        final ExpandedText out;

        Session(MacroTable macros, Path topFile) {
            this.macros = macros;
            this.out = new ExpandedText(SourceLocation.of(topFile.toString(), 1));
        }

        void scan(SourceCursor c, int includeDepth, int expansionDepth) throws PreprocessException {
            while (!c.atEnd()) {
                char ch = c.peek();
                if (ch == '\n') {
                    c.next();
                    lineBreak(c);
                } else if (ch == '/' && c.peek(1) == '/') {
                    while (!c.atEnd() && c.peek() != '\n') c.next();
                } else if (ch == '/' && c.peek(1) == '*') {
                    blockComment(c);
                } else if (ch == '"') {
                    stringLiteral(c);
                } else if (ch == '\\') {
                    escapedIdentifier(c);
                } else if (ch == '`') {
                    directive(c, includeDepth, expansionDepth);
                } else {
                    c.next();
                    if (conditions.isActive()) out.append(ch);
                }
            }
        }

        /** A newline was consumed from {@code c}. */
        void lineBreak(SourceCursor c) {
            if (c.isExpansion()) {
                if (conditions.isActive()) out.append(' ');
            } else {
                out.newline(SourceLocation.of(c.file, c.rawLine()));
            }
        }

        private void blockComment(SourceCursor c) {
            boolean active = conditions.isActive();
            int end = 2;
            while (c.peek(end) != '\0' && !(c.peek(end) == '*' && c.peek(end + 1) == '/')) end++;
            if (c.peek(end) == '\0') {
                // Unterminated: keep the opener so the structural parser reports its position.
                c.next();
                c.next();
                if (active) out.append("/*");
                return;
            }
            for (int i = 0; i < end + 2; i++) {
                char ch = c.next();
                if (ch == '\n') {
                    lineBreak(c);
                } else if (active) {
                    out.append(' ');
                }
            }
        }

        private void stringLiteral(SourceCursor c) {
            boolean active = conditions.isActive();
            if (active) out.append(c.next()); else c.next();
            while (!c.atEnd()) {
                char ch = c.peek();
                if (ch == '\n') return;
                c.next();
                if (ch == '\\' && !c.atEnd()) {
                    char esc = c.next();
                    if (active) out.append('\\');
                    if (esc == '\n') {
                        lineBreak(c);
                    } else if (active) {
                        out.append(esc);
                    }
                    continue;
                }
                if (active) out.append(ch);
                if (ch == '"') return;
            }
        }

        private void escapedIdentifier(SourceCursor c) {
            boolean active = conditions.isActive();
            while (!c.atEnd() && !Character.isWhitespace(c.peek())) {
                char ch = c.next();
                if (active) out.append(ch);
            }
        }

        private void directive(SourceCursor c, int includeDepth, int expansionDepth) throws PreprocessException {
            SourceLocation at = c.location();
            c.next();
            String name = readIdentifier(c);
            if (name.isEmpty()) {
                if (!conditions.isActive()) return;
                throw new PreprocessException(FailureKind.MALFORMED_DIRECTIVE, "stray '`'", at);
            }

            // An inactive `define may carry conditional directives in its body; skip it whole.
            if (name.equals("define") && !conditions.isActive()) {
                readDefineBody(c);
                return;
            }

            switch (name) {
                case "ifdef":
                case "ifndef": {
                    String arg = readDirectiveArgument(c, name, at);
                    conditions.pushIf(macros.isDefined(arg) == name.equals("ifdef"));
                    openConditionals.push(at);
                    return;
                }
                case "elsif": {
                    String arg = readDirectiveArgument(c, name, at);
                    if (!conditions.elsif(macros.isDefined(arg))) {
                        throw unbalanced("`elsif", at);
                    }
                    return;
                }
                case "else":
                    if (!conditions.elseBranch()) throw unbalanced("`else", at);
                    return;
                case "endif":
                    if (!conditions.pop()) {
                        throw new PreprocessException(FailureKind.UNBALANCED_CONDITIONAL,
                                "`endif without matching `ifdef/`ifndef", at);
                    }
                    openConditionals.pop();
                    return;
                default:
                    break;
            }

            // Everything else in inactive text is skipped without being resolved.
            if (!conditions.isActive()) return;

            switch (name) {
                case "define":
                    define(c, at);
                    return;
                case "undef":
                    macros.undefine(readDirectiveArgument(c, name, at));
                    return;
                case "undefineall":
                    macros.clear();
                    return;
                case "include":
                    include(c, at, includeDepth);
                    return;
                case "__FILE__":
                    out.append('"' + c.file + '"');
                    return;
                case "__LINE__":
                    out.append(Integer.toString(at.line));
                    return;
                default:
                    break;
            }

            if (IGNORED_WITH_ARGUMENT.contains(name)) {
                while (!c.atEnd() && c.peek() != '\n') c.next();
                return;
            }
            if (IGNORED_BARE.contains(name)) return;

            invoke(c, name, at, includeDepth, expansionDepth);
        }

        private PreprocessException unbalanced(String directive, SourceLocation at) {
            String detail = conditions.isEmpty()
                    ? directive + " without matching `ifdef/`ifndef"
                    : directive + " after `else in the same conditional group";
            return new PreprocessException(FailureKind.UNBALANCED_CONDITIONAL, detail, at);
        }

        private String readDirectiveArgument(SourceCursor c, String directive, SourceLocation at) throws PreprocessException {
            skipBlanks(c);
            String arg = readIdentifier(c);
            if (arg.isEmpty()) {
                throw new PreprocessException(FailureKind.MALFORMED_DIRECTIVE, "`" + directive + " requires a macro name", at);
            }
            return arg;
        }

        private void define(SourceCursor c, SourceLocation at) throws PreprocessException {
            skipBlanks(c);
            String name = readIdentifier(c);
            if (name.isEmpty()) {
                throw new PreprocessException(FailureKind.MALFORMED_DIRECTIVE, "`define requires a macro name", at);
            }

            List<String> params = null;
            List<String> defaults = null;
            if (c.peek() == '(') {
                c.next();
                params = new ArrayList<>();
                defaults = new ArrayList<>();
                readFormals(c, name, at, params, defaults);
            }

            String body = readDefineBody(c);
            MacroDefinition macro = params == null
                    ? MacroDefinition.objectLike(name, body)
                    : MacroDefinition.functionLike(name, params, defaults, body);
            macros.define(macro);
        }

        private void readFormals(SourceCursor c, String macro, SourceLocation at, List<String> params, List<String> defaults)
                throws PreprocessException {
            skipBlanks(c);
            if (c.peek() == ')') {
                c.next();
                return;
            }
            while (true) {
                skipBlanks(c);
                String formal = readIdentifier(c);
                if (formal.isEmpty()) {
                    throw new PreprocessException(FailureKind.MALFORMED_DIRECTIVE,
                            "malformed parameter list in `define " + macro, at);
                }
                skipBlanks(c);
                String dflt = null;
                if (c.peek() == '=') {
                    c.next();
                    dflt = readBalanced(c, false, at, macro).strip();
                }
                params.add(formal);
                defaults.add(dflt);
                char ch = c.atEnd() ? '\0' : c.next();
                if (ch == ')') return;
                if (ch != ',') {
                    throw new PreprocessException(FailureKind.MALFORMED_DIRECTIVE,
                            "malformed parameter list in `define " + macro, at);
                }
            }
        }

        /** Body runs to end of line; a backslash before the newline continues it. */
        private String readDefineBody(SourceCursor c) {
            StringBuilder body = new StringBuilder();
            while (!c.atEnd()) {
                char ch = c.peek();
                if (ch == '\n') break;
                if (ch == '\\' && (c.peek(1) == '\n' || (c.peek(1) == '\r' && c.peek(2) == '\n'))) {
                    c.next();
                    if (c.peek() == '\r') c.next();
                    c.next();
                    lineBreak(c);
                    body.append('\n');
                    continue;
                }
                if (ch == '/' && c.peek(1) == '/') {
                    while (!c.atEnd() && c.peek() != '\n') c.next();
                    break;
                }
                if (ch == '/' && c.peek(1) == '*') {
                    c.next();
                    c.next();
                    while (!c.atEnd() && !(c.peek() == '*' && c.peek(1) == '/')) {
                        if (c.next() == '\n') lineBreak(c);
                    }
                    if (!c.atEnd()) {
                        c.next();
                        c.next();
                    }
                    body.append(' ');
                    continue;
                }
                if (ch == '"') {
                    body.append(c.next());
                    while (!c.atEnd() && c.peek() != '\n') {
                        char s = c.next();
                        body.append(s);
                        if (s == '\\' && !c.atEnd() && c.peek() != '\n') {
                            body.append(c.next());
                        } else if (s == '"') {
                            break;
                        }
                    }
                    continue;
                }
                body.append(c.next());
            }
            return body.toString().strip();
        }

        private void include(SourceCursor c, SourceLocation at, int includeDepth) throws PreprocessException {
            skipBlanks(c);
            boolean angled = c.peek() == '<';
            String name;
            if (c.peek() == '"' || angled) {
                name = readDelimited(c, angled ? '>' : '"', at);
            } else if (c.peek() == '`') {
                name = includeNameFromMacro(c, at);
                angled = name.startsWith("<");
                name = name.substring(1, name.length() - 1);
            } else {
                throw new PreprocessException(FailureKind.MALFORMED_DIRECTIVE,
                        "`include expects a file name in quotes", at);
            }

            if (ignoreIncludes) {
                logger.debug("Ignoring `include \"{}\" at {}", name, at);
                return;
            }

            final String fileName = name;
            Path currentDir = c.path.toAbsolutePath().getParent();
            Path resolved = resolver.resolve(fileName, currentDir, angled)
                    .orElseThrow(() -> new PreprocessException(FailureKind.INCLUDE_NOT_FOUND,
                            "cannot find include file \"" + fileName + "\"", at));
            Path key = canonical(resolved);
            if (activeIncludes.contains(key)) {
                throw new PreprocessException(FailureKind.INCLUDE_CYCLE,
                        "include cycle: " + describeChain(key), at);
            }
            if (includeDepth + 1 > MAX_INCLUDE_DEPTH) {
                throw new PreprocessException(FailureKind.INCLUDE_DEPTH_LIMIT,
                        "includes nested deeper than " + MAX_INCLUDE_DEPTH + " levels", at);
            }

            final String text;
            try {
                text = readSource(resolved);
            } catch (IOException e) {
                throw new PreprocessException(FailureKind.IO_ERROR,
                        "cannot read include file " + resolved + ": " + e.getMessage(), at, e);
            }
            logger.debug("Including {} from {}", resolved, at);

            activeIncludes.push(key);
            out.startLine(SourceLocation.of(resolved.toString(), 1));
            scan(SourceCursor.forFile(resolved, text), includeDepth + 1, 0);
            activeIncludes.pop();
            out.startLine(SourceLocation.of(c.file, c.line()));
        }

        private String describeChain(Path repeated) {
            List<String> names = new ArrayList<>();
            for (Iterator<Path> it = activeIncludes.descendingIterator(); it.hasNext(); ) {
                names.add(String.valueOf(it.next().getFileName()));
            }
            names.add(String.valueOf(repeated.getFileName()));
            return String.join(" -> ", names);
        }

        /** {@code `include `NAME} where NAME expands to {@code "file"} or {@code <file>}; returns it with delimiters. */
        private String includeNameFromMacro(SourceCursor c, SourceLocation at) throws PreprocessException {
            c.next();
            String macroName = readIdentifier(c);
            MacroDefinition m = macros.lookup(macroName);
            if (m == null) {
                throw new PreprocessException(FailureKind.UNDEFINED_MACRO, "undefined macro `" + macroName, at);
            }
            String body = m.body.strip();
            boolean quoted = body.length() >= 2 && body.startsWith("\"") && body.endsWith("\"");
            boolean angled = body.length() >= 2 && body.startsWith("<") && body.endsWith(">");
            if (m.isFunctionLike() || !(quoted || angled)) {
                throw new PreprocessException(FailureKind.MALFORMED_DIRECTIVE,
                        "`include `" + macroName + " does not expand to a file name", at);
            }
            return body;
        }

        private String readDelimited(SourceCursor c, char close, SourceLocation at) throws PreprocessException {
            c.next();
            StringBuilder sb = new StringBuilder();
            while (!c.atEnd() && c.peek() != '\n' && c.peek() != close) {
                sb.append(c.next());
            }
            if (c.peek() != close) {
                throw new PreprocessException(FailureKind.MALFORMED_DIRECTIVE, "unterminated file name in `include", at);
            }
            c.next();
            return sb.toString();
        }

        private void invoke(SourceCursor c, String name, SourceLocation at, int includeDepth, int expansionDepth)
                throws PreprocessException {
            MacroDefinition macro = macros.lookup(name);
            if (macro == null) {
                throw new PreprocessException(FailureKind.UNDEFINED_MACRO, "undefined macro `" + name, at);
            }
            if (expansionDepth + 1 > MAX_EXPANSION_DEPTH) {
                throw new PreprocessException(FailureKind.MACRO_RECURSION_LIMIT,
                        "macro expansion nested deeper than " + MAX_EXPANSION_DEPTH + " levels while expanding `" + name, at);
            }

            int startLine = c.rawLine();
            String expansion;
            if (macro.isFunctionLike()) {
                List<String> actuals = readActuals(c, macro, at);
                expansion = substitute(macro.body, bindArguments(macro, actuals, at));
            } else {
                expansion = substitute(macro.body, Map.of());
            }

            scan(SourceCursor.forExpansion(c, expansion, at), includeDepth, expansionDepth + 1);

            // Arguments spanning several lines: keep the following text on its original line.
            if (!c.isExpansion()) {
                for (int l = startLine + 1; l <= c.rawLine(); l++) {
                    out.newline(SourceLocation.of(c.file, l));
                }
            }
        }

        private List<String> readActuals(SourceCursor c, MacroDefinition macro, SourceLocation at) throws PreprocessException {
            int k = 0;
            while (Character.isWhitespace(c.peek(k))) k++;
            if (c.peek(k) != '(') {
                throw new PreprocessException(FailureKind.MALFORMED_DIRECTIVE,
                        "macro `" + macro.name + " expects an argument list", at);
            }
            for (int i = 0; i <= k; i++) c.next();

            List<String> actuals = new ArrayList<>();
            while (true) {
                actuals.add(readBalanced(c, true, at, macro.name));
                char ch = c.next();
                if (ch == ')') return actuals;
            }
        }

        /**
         * Read up to the next top-level {@code ','} or {@code ')'} (not consumed), honouring nested
         * brackets and string literals.
         */
        private String readBalanced(SourceCursor c, boolean multiLine, SourceLocation at, String macro) throws PreprocessException {
            StringBuilder sb = new StringBuilder();
            int depth = 0;
            while (true) {
                if (c.atEnd() || (!multiLine && c.peek() == '\n')) {
                    throw new PreprocessException(FailureKind.MALFORMED_DIRECTIVE,
                            "unterminated argument list for macro `" + macro, at);
                }
                char ch = c.peek();
                if (depth == 0 && (ch == ',' || ch == ')')) return sb.toString();
                if (ch == '/' && c.peek(1) == '/') {
                    while (!c.atEnd() && c.peek() != '\n') c.next();
                    continue;
                }
                if (ch == '/' && c.peek(1) == '*') {
                    skipArgumentComment(c, multiLine);
                    sb.append(' ');
                    continue;
                }
                if (ch == '"') {
                    sb.append(c.next());
                    while (!c.atEnd() && c.peek() != '\n') {
                        char s = c.next();
                        sb.append(s);
                        if (s == '\\' && !c.atEnd()) {
                            sb.append(c.next());
                        } else if (s == '"') {
                            break;
                        }
                    }
                    continue;
                }
                if (ch == '(' || ch == '[' || ch == '{') depth++;
                if (ch == ')' || ch == ']' || ch == '}') depth--;
                sb.append(c.next());
            }
        }

        /**
         * Skip a block comment inside an argument list. Lines it spans in an invocation are
         * restored by the padding after the expansion; in a {@code `define} they are emitted here.
         */
        private void skipArgumentComment(SourceCursor c, boolean multiLine) {
            c.next();
            c.next();
            while (!c.atEnd() && !(c.peek() == '*' && c.peek(1) == '/')) {
                if (c.next() == '\n' && !multiLine) lineBreak(c);
            }
            if (!c.atEnd()) {
                c.next();
                c.next();
            }
        }

        private Map<String, String> bindArguments(MacroDefinition macro, List<String> actuals, SourceLocation at)
                throws PreprocessException {
            List<String> formals = macro.params();
            List<String> given = actuals;
            if (formals.isEmpty() && given.size() == 1 && given.get(0).isBlank()) {
                given = List.of();
            }
            if (given.size() > formals.size()) {
                throw arity(macro, given.size(), at);
            }
            Map<String, String> bound = new HashMap<>();
            for (int i = 0; i < formals.size(); i++) {
                String value = i < given.size() ? given.get(i).strip() : null;
                if ((value == null || value.isEmpty()) && macro.defaultFor(i) != null) {
                    value = macro.defaultFor(i);
                }
                if (value == null) {
                    throw arity(macro, given.size(), at);
                }
                bound.put(formals.get(i), value);
            }
            return bound;
        }

        private PreprocessException arity(MacroDefinition macro, int given, SourceLocation at) {
            return new PreprocessException(FailureKind.MALFORMED_DIRECTIVE,
                    "macro `" + macro.name + " expects " + macro.params().size() + " argument(s), got " + given, at);
        }

        private void skipBlanks(SourceCursor c) {
            while (c.peek() == ' ' || c.peek() == '\t') c.next();
        }
    }

    /**
     * Replace whole-identifier occurrences of formals in {@code body}.
     *
     * <p>{@code ``} is removed (token pasting) and {@code `"} becomes a plain quote. Plain string
     * literals and names following a backtick (nested macro uses) are copied unchanged.</p>
     */
    static String substitute(String body, Map<String, String> bindings) {
        StringBuilder out = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char ch = body.charAt(i);
            if (ch == '`') {
                char n = i + 1 < body.length() ? body.charAt(i + 1) : '\0';
                if (n == '`') {
                    i += 2;
                } else if (n == '"') {
                    out.append('"');
                    i += 2;
                } else if (n == '\\' && body.startsWith("`\\`\"", i)) {
                    out.append("\\\"");
                    i += 4;
                } else {
                    out.append(ch);
                    i++;
                    while (i < body.length() && MacroTable.isIdentifierPart(body.charAt(i))) {
                        out.append(body.charAt(i++));
                    }
                }
            } else if (ch == '"') {
                int end = i + 1;
                while (end < body.length() && body.charAt(end) != '"') {
                    if (body.charAt(end) == '\\') end++;
                    end++;
                }
                end = Math.min(end + 1, body.length());
                out.append(body, i, end);
                i = end;
            } else if (MacroTable.isIdentifierStart(ch)) {
                int end = i;
                while (end < body.length() && MacroTable.isIdentifierPart(body.charAt(end))) end++;
                String word = body.substring(i, end);
                String value = bindings.get(word);
                out.append(value != null ? value : word);
                i = end;
            } else if (ch >= '0' && ch <= '9') {
                while (i < body.length() && MacroTable.isIdentifierPart(body.charAt(i))) {
                    out.append(body.charAt(i++));
                }
            } else {
                out.append(ch);
                i++;
            }
        }
        return out.toString();
    }

    private static String readIdentifier(SourceCursor c) {
        if (!MacroTable.isIdentifierStart(c.peek())) return "";
        StringBuilder sb = new StringBuilder();
        while (MacroTable.isIdentifierPart(c.peek())) {
            sb.append(c.next());
        }
        return sb.toString();
    }
}
