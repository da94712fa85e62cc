package com.mathc.shell;

import com.mathc.Lexer;
import com.mathc.ParseException;
import com.mathc.Parser;
import com.mathc.ParserOptions;
import com.mathc.Result;
import com.mathc.SyntaxError;
import com.mathc.Token;
import com.mathc.ast.Ast;
import com.mathc.ast.AstPrinter;
import com.mathc.json.AstJsonProvider;
import com.mathc.json.AstJsonSerializer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

/**
 * Interactive front end: reads one expression per line, prints its tokens
 * and its tree, and points at the offending column when a line is rejected.
 *
 * Usage:
 *   java -cp ... com.mathc.shell.MathShell [options]
 *
 * Options:
 *   --json                    Print the tree (and tokens) as JSON instead of an S-expression
 *   --pretty                  Indent JSON output
 *   --hide-tokens             Do not print the token list
 *   --max-depth=N             Nesting limit (default: 256)
 *   --rationalize             Turn decimal literals into exact fractions when possible
 *   --implicit-identifiers    Treat "2x" and "x y" as products
 *   --help                    Show usage
 */
public class MathShell {

    private static final String BANNER = "Math Compiler v0.1.0";
    private static final Set<String> QUIT_WORDS = Set.of("n", "no", "quit", "exit");

    private final Config config;
    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;
    private final AstJsonSerializer serializer;

    public static void main(String[] args) {
        Config config = Config.parse(args, System.err);
        if (config == null) {
            printUsage(System.out);
            System.exit(1);
        }

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        MathShell shell = new MathShell(config, in, System.out, System.err);
        try {
            shell.run();
        } catch (IOException e) {
            System.err.println("Fatal error: " + e.getMessage());
            System.exit(1);
        }
    }

    public MathShell(Config config, BufferedReader in, PrintStream out, PrintStream err) {
        this.config = config;
        this.in = in;
        this.out = out;
        this.err = err;
        this.serializer = config.mode == Mode.JSON ? AstJsonProvider.getProvider().getSerializer() : null;
    }

    /**
     * Reads lines until end of input or a quit word.
     *
     * @return the number of lines that failed to tokenize or parse
     */
    public int run() throws IOException {
        out.println(BANNER);
        out.println();

        int failures = 0;
        while (true) {
            out.print("> ");
            out.flush();
            String line = in.readLine();
            if (line == null || QUIT_WORDS.contains(line.trim().toLowerCase())) {
                break;
            }
            if (line.isBlank()) {
                continue;
            }
            if (!evaluate(line)) {
                failures++;
            }
        }
        return failures;
    }

    /**
     * Tokenizes, parses and prints one expression.
     *
     * @return false if the line was rejected
     */
    public boolean evaluate(String line) {
        Result<List<Token>> lexed = Lexer.tryTokenize(line);
        if (!lexed.isOk()) {
            reportError(line, lexed.error());
            return false;
        }
        List<Token> tokens = lexed.value();
        if (config.showTokens) {
            printTokens(tokens);
        }

        Ast ast;
        try {
            ast = new Parser(tokens, config.options()).parse();
        } catch (ParseException e) {
            reportError(line, e.error());
            return false;
        }

        if (config.mode == Mode.JSON) {
            out.println(config.pretty ? serializer.serializePretty(ast) : serializer.serialize(ast));
        } else {
            out.println(AstPrinter.print(ast));
        }
        return true;
    }

    private void printTokens(List<Token> tokens) {
        if (config.mode == Mode.JSON) {
            out.println(serializer.serializeTokens(tokens));
            return;
        }
        out.println("Tokens:");
        for (Token token : tokens) {
            String value = token.number() != null ? "  = " + token.number() : "";
            out.printf("  %-12s %-14s @%d%s%n", token.type(), token.lexeme(), token.position(), value);
        }
    }

    private void reportError(String line, SyntaxError error) {
        err.println("error: " + error.message());
        if (error.hasOffset()) {
            err.println("  " + line);
            err.println("  " + " ".repeat(Math.min(error.offset(), line.length())) + "^");
        }
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: MathShell [options]");
        out.println();
        out.println("Options:");
        out.println("  --json                    Print the tree (and tokens) as JSON");
        out.println("  --pretty                  Indent JSON output");
        out.println("  --hide-tokens             Do not print the token list");
        out.println("  --max-depth=N             Nesting limit (default: " + ParserOptions.DEFAULT_MAX_DEPTH + ")");
        out.println("  --rationalize             Turn decimal literals into exact fractions when possible");
        out.println("  --implicit-identifiers    Treat \"2x\" and \"x y\" as products");
        out.println("  --help                    Show this help");
        out.println();
        out.println("Enter one expression per line; 'quit' or end of input exits.");
    }

    // ========== Inner classes ==========

    public enum Mode {
        SEXP, JSON
    }

    public static class Config {
        Mode mode = Mode.SEXP;
        boolean pretty = false;
        boolean showTokens = true;
        int maxDepth = ParserOptions.DEFAULT_MAX_DEPTH;
        boolean rationalize = false;
        boolean implicitIdentifiers = false;

        /**
         * @return the parsed configuration, or null if usage should be shown
         */
        public static Config parse(String[] args, PrintStream err) {
            Config config = new Config();

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return null;
                } else if (arg.equals("--json")) {
                    config.mode = Mode.JSON;
                } else if (arg.equals("--pretty")) {
                    config.pretty = true;
                } else if (arg.equals("--hide-tokens")) {
                    config.showTokens = false;
                } else if (arg.startsWith("--max-depth=")) {
                    try {
                        config.maxDepth = Integer.parseInt(arg.substring(12));
                    } catch (NumberFormatException e) {
                        err.println("Invalid max depth: " + arg.substring(12));
                        return null;
                    }
                    if (config.maxDepth < 1) {
                        err.println("Max depth must be positive");
                        return null;
                    }
                } else if (arg.equals("--rationalize")) {
                    config.rationalize = true;
                } else if (arg.equals("--implicit-identifiers")) {
                    config.implicitIdentifiers = true;
                } else {
                    err.println("Unknown option: " + arg);
                    return null;
                }
            }

            return config;
        }

        public ParserOptions options() {
            return ParserOptions.DEFAULTS
                .withMaxDepth(maxDepth)
                .withRationalizeReals(rationalize)
                .withImplicitIdentifierProducts(implicitIdentifiers);
        }
    }
}
