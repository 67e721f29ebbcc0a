package info.isaksson.erland.svinst;

import info.isaksson.erland.svinst.core.DiagnosticFormatter;
import info.isaksson.erland.svinst.core.SvInstOptions;
import info.isaksson.erland.svinst.core.SvInstService;
import info.isaksson.erland.svinst.model.FileResult;
import info.isaksson.erland.svinst.model.OutputFormat;
import info.isaksson.erland.svinst.model.Report;
import info.isaksson.erland.svinst.model.ReportWriter;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI entrypoint: extract module definitions and instances from SystemVerilog files.
 *
 * <p>The report document goes to standard output; per-file diagnostics go to standard error.</p>
 */
public final class Main {

    private static final Logger logger = LogManager.getLogger(Main.class);

    private static final SvInstService SERVICE = new SvInstService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        return run(args, System.out, System.err);
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            err.println("Error: " + ex.getMessage());
            err.println();
            CliArgs.printHelp(err);
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp(out);
            return 0;
        }

        if (parsed.files.isEmpty()) {
            err.println("Error: at least one input file is required.");
            err.println();
            CliArgs.printHelp(err);
            return 1;
        }

        if (parsed.verbose) {
            Configurator.setRootLevel(Level.DEBUG);
        }

        final Report report;
        try {
            report = SERVICE.run(parsed.files, toCoreOptions(parsed));
        } catch (IllegalArgumentException ex) {
            // Rejected -d values surface here, before any file is read.
            err.println("Error: " + ex.getMessage());
            return 1;
        }

        try {
            ReportWriter.write(report, parsed.format, out);
            // PrintStream reports write failures only through its error flag.
            if (out.checkError()) throw new IOException("output stream failed");
        } catch (IOException e) {
            err.println("Error: could not write report.");
            err.println(e.getMessage());
            return 2;
        }

        DiagnosticFormatter diagnostics = new DiagnosticFormatter();
        for (FileResult failed : report.failures()) {
            err.print(diagnostics.format(failed));
        }
        err.flush();

        logger.debug("{} file(s), {} failed", report.files.size(), report.failures().size());
        return report.isSuccess() ? 0 : 1;
    }

    private static SvInstOptions toCoreOptions(CliArgs parsed) {
        SvInstOptions o = new SvInstOptions();
        o.includeDirs = parsed.includes;
        o.defines = parsed.defines;
        o.ignoreIncludes = parsed.ignoreIncludes;
        o.fullTree = parsed.fullTree;
        o.jobs = parsed.jobs;
        return o;
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        boolean verbose = false;

        final List<Path> files = new ArrayList<>();
        final List<Path> includes = new ArrayList<>();
        final List<String> defines = new ArrayList<>();

        boolean ignoreIncludes = false;
        boolean fullTree = false;

        OutputFormat format = OutputFormat.YAML;

        // 0 means one worker per available processor
        int jobs = 0;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();
            boolean onlyFiles = false;

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                if (onlyFiles || !a.startsWith("-") || a.equals("-")) {
                    out.files.add(Paths.get(a));
                    continue;
                }

                // support --opt=value
                String inline = null;
                if (a.startsWith("--") && a.indexOf('=') > 0) {
                    inline = a.substring(a.indexOf('=') + 1);
                    a = a.substring(0, a.indexOf('='));
                }

                switch (a) {
                    case "--":
                        onlyFiles = true;
                        break;
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--verbose":
                    case "-v":
                        out.verbose = true;
                        break;
                    case "--include":
                    case "-i":
                        out.includes.add(Paths.get(inline != null ? inline : requireValue(args, ++i, a)));
                        break;
                    case "--define":
                    case "-d":
                        out.defines.add(inline != null ? inline : requireValue(args, ++i, a));
                        break;
                    case "--ignore-include":
                        out.ignoreIncludes = true;
                        break;
                    case "--full-tree":
                        out.fullTree = true;
                        break;
                    case "--format":
                        out.format = OutputFormat.parseCli(inline != null ? inline : requireValue(args, ++i, a));
                        break;
                    case "--jobs":
                    case "-j":
                        out.jobs = parsePositiveInt(inline != null ? inline : requireValue(args, ++i, a), a);
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown argument: " + args[i]);
                }

                if (inline != null && !takesValue(a)) {
                    throw new IllegalArgumentException("Option " + a + " does not take a value");
                }
            }

            return out;
        }

        private static boolean takesValue(String flag) {
            switch (flag) {
                case "--include":
                case "--define":
                case "--format":
                case "--jobs":
                    return true;
                default:
                    return false;
            }
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static int parsePositiveInt(String v, String flag) {
            try {
                int n = Integer.parseInt(v.trim());
                if (n < 1) throw new IllegalArgumentException("Invalid value for " + flag + ": " + v + " (must be at least 1)");
                return n;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + flag + ": " + v);
            }
        }

        static void printHelp(PrintStream ps) {
            ps.println(
                    "svinst\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar svinst.jar [options] <file>...\n" +
                    "\n" +
                    "Options:\n" +
                    "  -i, --include <dir>      Include search directory (repeatable). Searched in order\n" +
                    "                           after the directory of the including file.\n" +
                    "  -d, --define <NAME[=V]>  Predefine a macro (repeatable). Backslash escapes in V\n" +
                    "                           are resolved.\n" +
                    "      --ignore-include     Drop every `include directive instead of resolving it\n" +
                    "      --full-tree          Dump the full syntax tree instead of the hierarchy summary\n" +
                    "      --format <mode>      Output document format: yaml | json (default: yaml)\n" +
                    "  -j, --jobs <n>           Worker threads (default: available processors)\n" +
                    "  -v, --verbose            Debug logging on stderr\n" +
                    "  -h, --help               Show help\n" +
                    "\n" +
                    "Options taking a value also accept --opt=value.\n" +
                    "\n" +
                    "Exit status: 0 if every file was processed, 1 if any file failed or the\n" +
                    "arguments are invalid, 2 if the report could not be written.\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/svinst.jar samples/pass/test.sv\n" +
                    "  java -jar target/svinst.jar -i samples/include samples/pass/inc_test.sv\n" +
                    "  java -jar target/svinst.jar -d USE_FAST -d WIDTH_CELL=wide_cell --format json samples/pass/def_test.sv\n"
            );
        }
    }
}
