package monoc.cli;

import monoc.ast.Program;
import monoc.ast.decl.FunctionDecl;
import monoc.lexer.Lexer;
import monoc.lexer.LexerException;
import monoc.mono.MonomorphizationException;
import monoc.mono.Monomorphizer;
import monoc.parser.Parser;
import monoc.parser.ParserException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

public final class Main {
    // strong reference; LogManager only keeps loggers weakly
    private static final Logger MONOC_LOGGER = Logger.getLogger("monoc");

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 1 || args.length > 2 || (args.length == 2 && !"-v".equals(args[1]))) {
            System.err.println("Usage: monoc <input.mc> [-v]");
            return 2;
        }
        if (args.length == 2) enableVerboseLogging();

        Path input = Path.of(args[0]);
        try {
            // 1. Reading
            String source = Files.readString(input);
            System.out.println("[1/4] Reading: " + input);

            // 2. Lexer
            var tokens = new Lexer(source).tokenize();
            System.out.println("[2/4] Lexer: " + tokens.size() + " tokens");

            // 3. Parser
            var program = new Parser(tokens).parseProgram();
            System.out.println("[3/4] Parser: " + program.functions().size() + " functions");

            // 4. Monomorphization
            var mono = new Monomorphizer();
            Program out = mono.monomorphizeProgram(program);
            System.out.println("[4/4] Monomorphizer: " + out.functions().size() + " functions");

            System.out.println();
            for (FunctionDecl f : out.functions()) {
                System.out.println("  " + signature(f));
            }
            System.out.println("\n✓ Success: " + mono.context().specializationCount() + " specialization(s)");
            return 0;
        } catch (IOException e) {
            System.err.println("error: cannot read " + input + ": " + e.getMessage());
            return 1;
        } catch (LexerException | ParserException | MonomorphizationException e) {
            System.err.println("error: " + e.getMessage());
            return 1;
        }
    }

    static String signature(FunctionDecl f) {
        String params = f.params().stream()
                .map(FunctionDecl.Param::name)
                .collect(Collectors.joining(", "));
        return f.name() + "(" + params + ")";
    }

    static void enableVerboseLogging() {
        Logger logger = MONOC_LOGGER;
        logger.setLevel(Level.FINE);
        for (Handler h : logger.getHandlers()) {
            if (h instanceof ConsoleHandler) return;
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        logger.addHandler(handler);
        logger.setUseParentHandlers(false);
    }
}
