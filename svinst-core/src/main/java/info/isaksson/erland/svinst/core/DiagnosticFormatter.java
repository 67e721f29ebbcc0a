package info.isaksson.erland.svinst.core;

import info.isaksson.erland.svinst.model.FileFailure;
import info.isaksson.erland.svinst.model.FileResult;
import info.isaksson.erland.svinst.model.SourceLocation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Renders a failed file as user-facing diagnostic text.
 *
 * <pre>
 * parse failed: "top.sv" (ParseFailure: unexpected 'endmodule')
 *  top.sv:3:1
 *   |
 * 3 | endmodule
 *   | ^
 * </pre>
 */
public final class DiagnosticFormatter {

    private static final Logger logger = LogManager.getLogger(DiagnosticFormatter.class);

    public String format(FileResult result) {
        if (!result.isFailure()) throw new IllegalArgumentException("not a failed result: " + result.fileName);
        FileFailure f = result.failure;

        StringBuilder sb = new StringBuilder();
        sb.append("parse failed: \"").append(result.fileName).append("\" (")
                .append(f.kind.displayName()).append(": ").append(f.message).append(")\n");

        SourceLocation loc = f.location;
        if (loc == null || loc.line <= 0) return sb.toString();

        sb.append(' ').append(loc).append('\n');
        String text = sourceLine(loc);
        if (text == null) return sb.toString();

        String number = Integer.toString(loc.line);
        String gutter = " ".repeat(number.length() + 1) + "|";
        sb.append(gutter).append('\n');
        sb.append(number).append(" | ").append(text).append('\n');
        if (loc.hasColumn()) {
            sb.append(gutter).append(' ').append(" ".repeat(loc.column - 1)).append('^').append('\n');
        }
        return sb.toString();
    }

    private static String sourceLine(SourceLocation loc) {
        try {
            List<String> lines = Files.readAllLines(Path.of(loc.file), StandardCharsets.UTF_8);
            return loc.line <= lines.size() ? lines.get(loc.line - 1) : null;
        } catch (IOException | RuntimeException e) {
            logger.debug("No source snippet for {}: {}", loc, e.toString());
            return null;
        }
    }
}
