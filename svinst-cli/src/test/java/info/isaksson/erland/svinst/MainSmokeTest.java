package info.isaksson.erland.svinst;

import info.isaksson.erland.svinst.testutil.TestPaths;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainSmokeTest {

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int run(String... args) {
        PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        return Main.run(args, out, err);
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    void workedExampleYaml() {
        Path f = TestPaths.sample("pass/test.sv");

        assertEquals(0, run(f.toString()));

        String expected = "files:\n"
                + "  - file_name: \"" + f + "\"\n"
                + "    defs:\n"
                + "      - mod_name: \"A\"\n"
                + "        insts: []\n"
                + "      - mod_name: \"B\"\n"
                + "        insts: []\n"
                + "      - mod_name: \"C\"\n"
                + "        insts:\n"
                + "          - mod_name: \"A\"\n"
                + "            inst_name: \"I0\"\n"
                + "          - mod_name: \"B\"\n"
                + "            inst_name: \"I1\"\n";
        assertEquals(expected, out());
        assertEquals("", err());
    }

    @Test
    void brokenFileFailsWithDiagnostic() {
        Path f = TestPaths.sample("fail/broken.sv");

        assertEquals(1, run(f.toString()));

        assertEquals("files: []\n", out());
        assertTrue(err().startsWith("parse failed: \"" + f + "\" (ParseFailure: "), err());
        assertTrue(err().contains(":3:1\n"), err());
        assertTrue(err().contains("3 | endmodule\n"), err());
    }

    @Test
    void goodFilesStillReportedNextToBrokenOne() {
        Path good = TestPaths.sample("pass/test.sv");
        Path bad = TestPaths.sample("fail/broken.sv");

        assertEquals(1, run("-j", "2", bad.toString(), good.toString()));

        assertTrue(out().contains("file_name: \"" + good + "\""), out());
        assertFalse(out().contains(bad.toString()), out());
    }

    @Test
    void includeDirectoryOption() {
        Path f = TestPaths.sample("pass/inc_test.sv");

        assertEquals(1, run(f.toString()));
        assertTrue(err().contains("IncludeNotFound"), err());

        outBytes.reset();
        errBytes.reset();
        assertEquals(0, run("-i", TestPaths.sample("include").toString(), f.toString()));
        assertTrue(out().contains("mod_name: \"inc_leaf\"\n            inst_name: \"u_cell\""), out());
    }

    @Test
    void defineOptions() {
        Path f = TestPaths.sample("pass/def_test.sv");

        assertEquals(0, run("-d", "USE_FAST", "--define=WIDTH_CELL=wide_cell", f.toString()));

        assertTrue(out().contains("mod_name: \"fast_core\""), out());
        assertTrue(out().contains("mod_name: \"wide_cell\""), out());
        assertFalse(out().contains("slow_core"), out());
    }

    @Test
    void packagesAndInterfaces() {
        assertEquals(0, run(TestPaths.sample("pass/pkg.sv").toString(), TestPaths.sample("pass/intf.sv").toString()));

        assertTrue(out().contains("- pkg_name: \"cfg_pkg\"\n        insts: []"), out());
        // fifo imports cfg_pkg in its header and again in its body, both before u_ram
        assertTrue(out().contains("- mod_name: \"fifo\"\n"
                + "        insts:\n"
                + "          - pkg_name: \"cfg_pkg\"\n"
                + "          - pkg_name: \"cfg_pkg\"\n"
                + "          - mod_name: \"ram\"\n"
                + "            inst_name: \"u_ram\"\n"), out());
        assertTrue(out().contains("- intf_name: \"bus_if\""), out());
        assertTrue(out().contains("mod_name: \"bus_if\"\n            inst_name: \"bus\""), out());
    }

    @Test
    void fullTreeJson() {
        assertEquals(0, run("--full-tree", "--format", "json", TestPaths.sample("pass/simple.sv").toString()));

        String s = out();
        assertTrue(s.trim().startsWith("{"), s);
        assertTrue(s.contains("\"syntax_tree\""), s);
        assertTrue(s.contains("\"SourceText\""), s);
        assertTrue(s.contains("\"Token\" : \"simple_top\""), s);
    }

    @Test
    void includeCycleFails() {
        assertEquals(1, run(TestPaths.sample("fail/cycle_a.sv").toString()));
        assertTrue(err().contains("(IncludeCycle: "), err());
    }

    @Test
    void outputIsDeterministic() {
        String[] args = {"-j", "4",
                TestPaths.sample("pass/test.sv").toString(),
                TestPaths.sample("pass/simple.sv").toString(),
                TestPaths.sample("pass/intf.sv").toString()};
        assertEquals(0, run(args));
        String first = out();
        outBytes.reset();
        assertEquals(0, run(args));
        assertEquals(first, out());
    }

    @Test
    void helpAndUsageErrors() {
        assertEquals(0, run("--help"));
        assertTrue(out().contains("Usage:"));

        assertEquals(1, run());
        assertTrue(err().contains("at least one input file"));

        errBytes.reset();
        assertEquals(1, run("--bogus", "x.sv"));
        assertTrue(err().startsWith("Error: Unknown argument: --bogus"));

        errBytes.reset();
        assertEquals(1, run("-d", "=bad", TestPaths.sample("pass/test.sv").toString()));
        assertTrue(err().startsWith("Error: "));
    }
}
