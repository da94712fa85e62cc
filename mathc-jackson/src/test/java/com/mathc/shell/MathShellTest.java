package com.mathc.shell;

import com.mathc.ParserOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class MathShellTest {

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int run(String input, String... args) throws Exception {
        MathShell.Config config = MathShell.Config.parse(args, new PrintStream(errBytes, true, StandardCharsets.UTF_8));
        assertNotNull(config);
        MathShell shell = new MathShell(config,
            new BufferedReader(new StringReader(input)),
            new PrintStream(outBytes, true, StandardCharsets.UTF_8),
            new PrintStream(errBytes, true, StandardCharsets.UTF_8));
        return shell.run();
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Prints tokens and the S-expression for each line")
    void testSexpOutput() throws Exception {
        int failures = run("1+2*3\nquit\n");

        assertEquals(0, failures);
        assertTrue(out().contains("Math Compiler"));
        assertTrue(out().contains("Tokens:"));
        assertTrue(out().contains("PLUS"));
        assertTrue(out().contains("(+ 1 (* 2 3))"), out());
    }

    @Test
    @DisplayName("Parse error points at the offending column")
    void testParseErrorCaret() throws Exception {
        int failures = run("1+\n");

        assertEquals(1, failures);
        assertTrue(err().startsWith("error: "), err());
        assertTrue(err().lines().anyMatch(line -> line.equals("  1+")));
        assertTrue(err().lines().anyMatch(line -> line.equals("    ^")), err());
    }

    @Test
    void testLexErrorCaret() throws Exception {
        int failures = run("1 # 2\n");

        assertEquals(1, failures);
        assertTrue(err().contains("Unrecognized character '#'"), err());
        assertTrue(err().lines().anyMatch(line -> line.equals("    ^")), err());
    }

    @Test
    void testKeepsGoingAfterAnError() throws Exception {
        int failures = run("\\foo\n\\pi\n");

        assertEquals(1, failures);
        assertTrue(err().contains("Unknown command '\\foo'"));
        assertTrue(out().contains("pi"));
    }

    @Test
    @DisplayName("Quit words and end of input stop the loop")
    void testQuitWords() throws Exception {
        run("no\n1+2\n");
        assertFalse(out().contains("(+ 1 2)"));

        outBytes.reset();
        run("N\n1+2\n");
        assertFalse(out().contains("(+ 1 2)"));

        outBytes.reset();
        assertEquals(0, run(""));
    }

    @Test
    void testBlankLinesAreSkipped() throws Exception {
        assertEquals(0, run("\n   \nx\n"));
        assertTrue(out().contains("x"));
    }

    @Test
    void testJsonOutput() throws Exception {
        run("x^2\n", "--json", "--hide-tokens");

        assertFalse(out().contains("Tokens:"));
        assertTrue(out().contains("\"root\":2"), out());
        assertTrue(out().contains("\"kind\":\"POWER\""), out());
    }

    @Test
    void testJsonTokens() throws Exception {
        run("7\n", "--json");
        assertTrue(out().contains("\"type\":\"NUMBER\""), out());
        assertTrue(out().contains("\"type\":\"END\""), out());
    }

    @Test
    void testImplicitIdentifierOption() throws Exception {
        assertEquals(1, run("2x\n"));

        outBytes.reset();
        errBytes.reset();
        assertEquals(0, run("2x\n", "--implicit-identifiers", "--hide-tokens"));
        assertTrue(out().contains("(* 2 x)"), out());
    }

    @Test
    void testMaxDepthOption() throws Exception {
        assertEquals(1, run("((((1))))\n", "--max-depth=2"));
        assertTrue(err().contains("nest") || err().contains("deep"), err());
    }

    @Test
    void testRationalizeOption() throws Exception {
        run("0.75\n", "--rationalize", "--hide-tokens");
        assertTrue(out().contains("3/4"), out());
    }

    @Test
    void testConfigParse() {
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);

        MathShell.Config config = MathShell.Config.parse(new String[]{"--max-depth=12", "--rationalize", "--pretty"}, err);
        assertNotNull(config);
        ParserOptions options = config.options();
        assertEquals(12, options.maxDepth());
        assertTrue(options.rationalizeReals());
        assertFalse(options.implicitIdentifierProducts());
        assertTrue(config.pretty);
        assertEquals(MathShell.Mode.SEXP, config.mode);

        assertEquals(ParserOptions.DEFAULTS, MathShell.Config.parse(new String[0], err).options());
    }

    @Test
    void testConfigRejectsBadArguments() {
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);

        assertNull(MathShell.Config.parse(new String[]{"--help"}, err));
        assertNull(MathShell.Config.parse(new String[]{"--max-depth=abc"}, err));
        assertNull(MathShell.Config.parse(new String[]{"--max-depth=0"}, err));
        assertNull(MathShell.Config.parse(new String[]{"--verbose"}, err));
        assertTrue(err().contains("Unknown option: --verbose"));
        assertTrue(err().contains("Invalid max depth: abc"));
    }
}
