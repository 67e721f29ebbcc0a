package info.isaksson.erland.svinst.preprocess;

import info.isaksson.erland.svinst.model.FailureKind;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PreprocessorTest {

    private static final Path FILE = Path.of("test.sv");

    private static PreprocessedSource run(String text, String... defines) throws PreprocessException {
        return new Preprocessor(List.of(), false).process(FILE, text, MacroTable.fromPredefinitions(List.of(defines)));
    }

    private static PreprocessException fail(String text) {
        return assertThrows(PreprocessException.class, () -> run(text));
    }

    private static String line(PreprocessedSource src, int oneBased) {
        return src.text.split("\n", -1)[oneBased - 1];
    }

    @Test
    void expandsObjectLikeMacro() throws Exception {
        PreprocessedSource out = run("`define W 8\nmodule top; wire [`W-1:0] x; endmodule\n");
        assertEquals("module top; wire [8-1:0] x; endmodule", line(out, 2));
        assertEquals(2, out.sourceMap.origin(2).line);
    }

    @Test
    void selectsConditionalBranchFromPredefinitions() throws Exception {
        String text = "`ifdef USE_A\na_mod u();\n`else\nb_mod u();\n`endif\n";
        PreprocessedSource withA = run(text, "USE_A");
        assertTrue(withA.text.contains("a_mod"));
        assertFalse(withA.text.contains("b_mod"));

        PreprocessedSource without = run(text);
        assertFalse(without.text.contains("a_mod"));
        assertTrue(without.text.contains("b_mod"));
        // Directive and inactive lines stay as empty lines.
        assertEquals(6, without.text.split("\n", -1).length);
    }

    @Test
    void elsifTakesFirstDefinedBranch() throws Exception {
        String text = "`ifdef A\nx_a\n`elsif B\nx_b\n`elsif C\nx_c\n`else\nx_else\n`endif\n";
        PreprocessedSource out = run(text, "B", "C");
        assertTrue(out.text.contains("x_b"));
        assertFalse(out.text.contains("x_a"));
        assertFalse(out.text.contains("x_c"));
        assertFalse(out.text.contains("x_else"));
    }

    @Test
    void ifndefAndNestedGroups() throws Exception {
        String text = "`ifndef A\n`ifdef B\nin_b\n`else\nnot_b\n`endif\n`endif\n";
        assertTrue(run(text, "B").text.contains("in_b"));
        assertTrue(run(text).text.contains("not_b"));
        assertFalse(run(text, "A", "B").text.contains("in_b"));
    }

    @Test
    void inactiveRegionsAreNotExpanded() throws Exception {
        PreprocessedSource out = run("`ifdef NOPE\n`UNDEFINED_THING\n`include \"missing.svh\"\n`endif\nok\n");
        assertEquals("ok", line(out, 5));
    }

    @Test
    void inactiveDefineBodyMayContainConditionalDirectives() throws Exception {
        PreprocessedSource out = run("`ifdef NOPE\n`define E `endif\n`endif\nok\n");
        assertEquals("ok", line(out, 4));

        PreprocessedSource continued = run("`ifdef NOPE\n`define E \\\n  `ifdef X\n`endif\n`ifdef E\nbad\n`endif\nok\n");
        assertEquals("ok", line(continued, 8));
        assertFalse(continued.text.contains("bad"));
        assertEquals(8, continued.sourceMap.origin(8).line);
    }

    @Test
    void definesInsideFileAffectLaterConditionals() throws Exception {
        PreprocessedSource out = run("`define LOCAL\n`ifdef LOCAL\nyes\n`endif\n`undef LOCAL\n`ifdef LOCAL\nno\n`endif\n");
        assertTrue(out.text.contains("yes"));
        assertFalse(out.text.contains("no"));
    }

    @Test
    void undefineallClearsPredefinitions() throws Exception {
        PreprocessedSource out = run("`undefineall\n`ifdef SIM\nsim\n`endif\n", "SIM");
        assertFalse(out.text.contains("sim"));
    }

    @Test
    void strayEndifIsUnbalanced() {
        PreprocessException ex = fail("module m;\n`endif\nendmodule\n");
        assertEquals(FailureKind.UNBALANCED_CONDITIONAL, ex.getKind());
        assertEquals(2, ex.getLocation().line);
    }

    @Test
    void missingEndifReportsOpeningDirective() {
        PreprocessException ex = fail("`ifdef A\nx\n");
        assertEquals(FailureKind.UNBALANCED_CONDITIONAL, ex.getKind());
        assertEquals(1, ex.getLocation().line);
    }

    @Test
    void elseAfterElseIsUnbalanced() {
        PreprocessException ex = fail("`ifdef A\n`else\n`else\n`endif\n");
        assertEquals(FailureKind.UNBALANCED_CONDITIONAL, ex.getKind());
        assertEquals(3, ex.getLocation().line);
    }

    @Test
    void undefinedMacroHasPosition() {
        PreprocessException ex = fail("module m; `FOO endmodule\n");
        assertEquals(FailureKind.UNDEFINED_MACRO, ex.getKind());
        assertEquals(1, ex.getLocation().line);
        assertEquals(11, ex.getLocation().column);
        assertTrue(ex.getMessage().contains("FOO"));
    }

    @Test
    void strayBacktickIsMalformed() {
        assertEquals(FailureKind.MALFORMED_DIRECTIVE, fail("module m; ` endmodule\n").getKind());
    }

    @Test
    void functionLikeMacroWithDefaults() throws Exception {
        PreprocessedSource out = run("`define INST(m, n=u0) m n();\n`INST(sub)\n`INST(sub, u1)\n");
        assertEquals("sub u0();", line(out, 2));
        assertEquals("sub u1();", line(out, 3));
    }

    @Test
    void functionLikeMacroArityIsChecked() {
        PreprocessException ex = fail("`define F(a, b) a b\n`F(1, 2, 3)\n");
        assertEquals(FailureKind.MALFORMED_DIRECTIVE, ex.getKind());
        assertEquals(FailureKind.MALFORMED_DIRECTIVE, fail("`define F(a, b) a b\n`F(1)\n").getKind());
        assertEquals(FailureKind.MALFORMED_DIRECTIVE, fail("`define F(a) a\n`F;\n").getKind());
    }

    @Test
    void argumentsRespectNestedBrackets() throws Exception {
        PreprocessedSource out = run("`define PAIR(a, b) {a, b}\nassign x = `PAIR(f(1, 2), y[3:0]);\n");
        assertEquals("assign x = {f(1, 2), y[3:0]};", line(out, 2));
    }

    @Test
    void blockCommentsInArgumentsAreSkipped() throws Exception {
        PreprocessedSource out = run("`define M(a, b) a b\n`M(sub /* , */, u) ();\n");
        assertEquals("sub u ();", line(out, 2));

        PreprocessedSource multi = run("`define M(a, b) a b\n`M(sub /* one,\n two */, u)\nnext;\n");
        assertEquals("sub u", line(multi, 2));
        assertEquals("next;", line(multi, 4));
        assertEquals(4, multi.sourceMap.origin(4).line);
    }

    @Test
    void blockCommentInDefaultArgumentIsSkipped() throws Exception {
        PreprocessedSource out = run("`define INST(m, n = /* x, y */ u0) m n();\n`INST(sub)\n");
        assertEquals("sub u0();", line(out, 2));
    }

    @Test
    void pastesAndStringifies() throws Exception {
        PreprocessedSource out = run("`define CAT(a, b) a``b\n`define STR(x) `\"x`\"\n`CAT(foo, bar) u();\n$display(`STR(hello));\n");
        assertEquals("foobar u();", line(out, 3));
        assertEquals("$display(\"hello\");", line(out, 4));
    }

    @Test
    void macroBodiesExpandNestedMacros() throws Exception {
        PreprocessedSource out = run("`define INNER child\n`define OUTER `INNER u_c();\n`OUTER\n");
        assertEquals("child u_c();", line(out, 3));
    }

    @Test
    void selfReferentialMacroHitsRecursionLimit() {
        PreprocessException ex = fail("`define LOOP `LOOP\n`LOOP\n");
        assertEquals(FailureKind.MACRO_RECURSION_LIMIT, ex.getKind());
        assertEquals(2, ex.getLocation().line);
    }

    @Test
    void continuedDefineKeepsLineNumbers() throws Exception {
        PreprocessedSource out = run("`define M \\\n  sub u();\nmodule t; `M endmodule\n");
        assertEquals("module t; sub u(); endmodule", line(out, 3));
        assertEquals(3, out.sourceMap.origin(3).line);
    }

    @Test
    void multiLineInvocationKeepsFollowingLines() throws Exception {
        PreprocessedSource out = run("`define P(a) a\n`P(\n  x\n) y;\nz;\n");
        assertEquals("x", line(out, 2));
        assertEquals("z;", line(out, 5));
        assertEquals(5, out.sourceMap.origin(5).line);
    }

    @Test
    void commentsBecomeBlanksPreservingLines() throws Exception {
        PreprocessedSource out = run("module /* multi\nline */ m; // trailing\nendmodule");
        String[] lines = out.text.split("\n", -1);
        assertEquals(3, lines.length);
        assertFalse(out.text.contains("multi"));
        assertFalse(out.text.contains("trailing"));
        assertEquals("endmodule", lines[2]);
        assertTrue(lines[1].trim().startsWith("m;"));
    }

    @Test
    void stringLiteralsAreNotScanned() throws Exception {
        PreprocessedSource out = run("$display(\"`NOT_A_MACRO // not a comment\");\n");
        assertEquals("$display(\"`NOT_A_MACRO // not a comment\");", line(out, 1));
    }

    @Test
    void toolDirectivesAreDropped() throws Exception {
        PreprocessedSource out = run("`timescale 1ns/1ps\n`default_nettype none\n`celldefine\nmodule m; endmodule\n`endcelldefine\n");
        assertFalse(out.text.contains("1ns"));
        assertFalse(out.text.contains("none"));
        assertEquals("module m; endmodule", line(out, 4));
    }

    @Test
    void fileAndLineMacros() throws Exception {
        PreprocessedSource out = run("\n\nx = `__LINE__; f = `__FILE__;\n");
        assertEquals("x = 3; f = \"test.sv\";", line(out, 3));
    }

    @Test
    void initialTableIsNotModified() throws Exception {
        MacroTable initial = MacroTable.fromPredefinitions(List.of("KEEP"));
        new Preprocessor(List.of(), false).process(FILE, "`define NEW 1\n`undef KEEP\n", initial);
        assertTrue(initial.isDefined("KEEP"));
        assertFalse(initial.isDefined("NEW"));
    }

    @Test
    void includesFileFromSameDirectory() throws Exception {
        Path dir = Files.createTempDirectory("svinst-pp-inc");
        Path inc = Files.writeString(dir.resolve("inc.svh"), "module inc_mod; endmodule\n");
        Path top = Files.writeString(dir.resolve("top.sv"), "`include \"inc.svh\"\nmodule top; inc_mod u(); endmodule\n");

        PreprocessedSource out = new Preprocessor(List.of(), false).process(top, new MacroTable());
        assertEquals("module inc_mod; endmodule", line(out, 1));
        assertTrue(out.sourceMap.origin(1).file.endsWith("inc.svh"));
        assertEquals(inc.toString(), out.sourceMap.origin(1).file);
        assertEquals("module top; inc_mod u(); endmodule", line(out, 3));
        assertEquals(top.toString(), out.sourceMap.origin(3).file);
        assertEquals(2, out.sourceMap.origin(3).line);
    }

    @Test
    void includeSeesAndContributesDefines() throws Exception {
        Path dir = Files.createTempDirectory("svinst-pp-incdef");
        Path incDir = Files.createDirectories(dir.resolve("include"));
        Files.writeString(incDir.resolve("defs.svh"), "`define CHILD leaf\n");
        Path top = Files.writeString(dir.resolve("top.sv"),
                "`define HDR \"defs.svh\"\n`include `HDR\nmodule top; `CHILD u(); endmodule\n");

        PreprocessedSource out = new Preprocessor(List.of(incDir), false).process(top, new MacroTable());
        assertTrue(out.text.contains("module top; leaf u(); endmodule"));
    }

    @Test
    void missingIncludeFails() throws Exception {
        Path dir = Files.createTempDirectory("svinst-pp-missing");
        Path top = Files.writeString(dir.resolve("top.sv"), "\n`include \"nope.svh\"\n");
        PreprocessException ex = assertThrows(PreprocessException.class,
                () -> new Preprocessor(List.of(), false).process(top, new MacroTable()));
        assertEquals(FailureKind.INCLUDE_NOT_FOUND, ex.getKind());
        assertEquals(2, ex.getLocation().line);
        assertTrue(ex.getMessage().contains("nope.svh"));
    }

    @Test
    void ignoreIncludesSkipsResolution() throws Exception {
        Path dir = Files.createTempDirectory("svinst-pp-ignore");
        Path top = Files.writeString(dir.resolve("top.sv"), "`include \"nope.svh\"\nmodule m; endmodule\n");
        PreprocessedSource out = new Preprocessor(List.of(), true).process(top, new MacroTable());
        assertEquals("module m; endmodule", line(out, 2));
    }

    @Test
    void includeCycleIsDetected() throws Exception {
        Path dir = Files.createTempDirectory("svinst-pp-cycle");
        Path a = Files.writeString(dir.resolve("a.sv"), "`include \"b.sv\"\n");
        Files.writeString(dir.resolve("b.sv"), "`include \"a.sv\"\n");
        PreprocessException ex = assertThrows(PreprocessException.class,
                () -> new Preprocessor(List.of(), false).process(a, new MacroTable()));
        assertEquals(FailureKind.INCLUDE_CYCLE, ex.getKind());
        assertTrue(ex.getMessage().contains("a.sv -> b.sv -> a.sv"), ex.getMessage());
    }

    @Test
    void sameHeaderMayBeIncludedTwiceSequentially() throws Exception {
        Path dir = Files.createTempDirectory("svinst-pp-twice");
        Files.writeString(dir.resolve("w.svh"), "w\n");
        Path top = Files.writeString(dir.resolve("top.sv"), "`include \"w.svh\"\n`include \"w.svh\"\n");
        PreprocessedSource out = new Preprocessor(List.of(), false).process(top, new MacroTable());
        assertEquals(2, out.text.split("w", -1).length - 1);
    }

    @Test
    void includeNestingIsDepthLimited() throws Exception {
        Path dir = Files.createTempDirectory("svinst-pp-depth");
        int headers = Preprocessor.MAX_INCLUDE_DEPTH + 1;
        for (int i = 1; i < headers; i++) {
            Files.writeString(dir.resolve("h" + i + ".svh"), "`include \"h" + (i + 1) + ".svh\"\n");
        }
        Files.writeString(dir.resolve("h" + headers + ".svh"), "leaf\n");
        Path top = Files.writeString(dir.resolve("top.sv"), "`include \"h1.svh\"\n");

        PreprocessException ex = assertThrows(PreprocessException.class,
                () -> new Preprocessor(List.of(), false).process(top, new MacroTable()));
        assertEquals(FailureKind.INCLUDE_DEPTH_LIMIT, ex.getKind());
        assertTrue(ex.getLocation().file.endsWith("h" + Preprocessor.MAX_INCLUDE_DEPTH + ".svh"), ex.getLocation().file);
    }

    @Test
    void includeAtDepthLimitIsAccepted() throws Exception {
        Path dir = Files.createTempDirectory("svinst-pp-depth-ok");
        int headers = Preprocessor.MAX_INCLUDE_DEPTH;
        for (int i = 1; i < headers; i++) {
            Files.writeString(dir.resolve("h" + i + ".svh"), "`include \"h" + (i + 1) + ".svh\"\n");
        }
        Files.writeString(dir.resolve("h" + headers + ".svh"), "leaf\n");
        Path top = Files.writeString(dir.resolve("top.sv"), "`include \"h1.svh\"\n");

        PreprocessedSource out = new Preprocessor(List.of(), false).process(top, new MacroTable());
        assertTrue(out.text.contains("leaf"));
    }

    @Test
    void angledIncludeSkipsIncludersDirectory() throws Exception {
        Path dir = Files.createTempDirectory("svinst-pp-angled");
        Path incDir = Files.createDirectories(dir.resolve("include"));
        Files.writeString(dir.resolve("cells.svh"), "local_cell\n");
        Files.writeString(incDir.resolve("cells.svh"), "dir_cell\n");
        Path quoted = Files.writeString(dir.resolve("quoted.sv"), "`include \"cells.svh\"\n");
        Path angled = Files.writeString(dir.resolve("angled.sv"), "`include <cells.svh>\n");

        Preprocessor pp = new Preprocessor(List.of(incDir), false);
        assertTrue(pp.process(quoted, new MacroTable()).text.contains("local_cell"));
        String text = pp.process(angled, new MacroTable()).text;
        assertTrue(text.contains("dir_cell"), text);
        assertFalse(text.contains("local_cell"), text);
    }

    @Test
    void includeMacroMustNameAFile() {
        PreprocessException ex = fail("`define HDR cells_svh\n`include `HDR\n");
        assertEquals(FailureKind.MALFORMED_DIRECTIVE, ex.getKind());
        assertEquals(2, ex.getLocation().line);

        assertEquals(FailureKind.MALFORMED_DIRECTIVE, fail("`define HDR(x) \"x\"\n`include `HDR\n").getKind());
        assertEquals(FailureKind.UNDEFINED_MACRO, fail("`include `NOPE\n").getKind());
    }

    @Test
    void unterminatedBlockCommentIsPassedThrough() throws Exception {
        PreprocessedSource out = run("module m; /* never closed\n");
        assertTrue(out.text.contains("/*"));
    }
}
