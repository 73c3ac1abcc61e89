package monoc.cli;

import monoc.lexer.Lexer;
import monoc.parser.Parser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.logging.ConsoleHandler;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    @TempDir
    Path dir;

    private Path write(String name, String src) throws IOException {
        Path p = dir.resolve(name);
        Files.writeString(p, src);
        return p;
    }

    @Test
    void usage_errors_exit_with_2() {
        assertEquals(2, Main.run(new String[0]));
        assertEquals(2, Main.run(new String[]{"a.mc", "--bogus"}));
        assertEquals(2, Main.run(new String[]{"a.mc", "-v", "extra"}));
    }

    @Test
    void compiles_valid_program() throws IOException {
        Path in = write("ok.mc", """
                fnc f[N: int] : int() { return N; }
                fnc main() { f[1](); f[2](); }
                """);
        assertEquals(0, Main.run(new String[]{in.toString()}));
        assertEquals(0, Main.run(new String[]{in.toString(), "-v"}));
    }

    @Test
    void compile_errors_exit_with_1() throws IOException {
        assertEquals(1, Main.run(new String[]{write("lex.mc", "fnc main() { @ }").toString()}));
        assertEquals(1, Main.run(new String[]{write("parse.mc", "fnc main( { }").toString()}));
        assertEquals(1, Main.run(new String[]{write("mono.mc", """
                fnc f[N: int]() { }
                fnc main(n: int) { f[n](); }
                """).toString()}));
        assertEquals(1, Main.run(new String[]{dir.resolve("missing.mc").toString()}));
    }

    @Test
    void verbose_logging_installs_one_console_handler() {
        Main.enableVerboseLogging();
        Main.enableVerboseLogging();
        Logger logger = Logger.getLogger("monoc");
        long consoles = Arrays.stream(logger.getHandlers()).filter(h -> h instanceof ConsoleHandler).count();
        assertEquals(1, consoles);
        assertFalse(logger.getUseParentHandlers());
    }

    @Test
    void signature_lists_runtime_params() {
        var f = new Parser(new Lexer("fnc add(a: int, b: int) { }").tokenize()).parseProgram().functions().get(0);
        assertEquals("add(a, b)", Main.signature(f));
    }
}
