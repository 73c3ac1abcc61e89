package monoc.mono;

import monoc.ast.Program;
import monoc.ast.expr.CallExpr;
import monoc.ast.expr.VarExpr;
import monoc.lexer.Lexer;
import monoc.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CallCollectorTest {

    private static Program parse(String src) {
        var tokens = new Lexer(src).tokenize();
        return new Parser(tokens).parseProgram();
    }

    private static List<String> names(List<CallExpr> calls) {
        return calls.stream()
                .map(c -> c.callee() instanceof VarExpr v ? v.name() : "?")
                .toList();
    }

    @Test
    void collects_in_pre_order_and_source_order() {
        var p = parse("""
                fnc main() {
                  a(b(), c[1](d()));
                  e();
                }
                """);
        assertEquals(List.of("a", "b", "c", "d", "e"), names(CallCollector.collect(p)));
    }

    @Test
    void collects_across_functions() {
        var p = parse("""
                fnc f() { x(); }
                struct S { v: int; }
                fnc g() { y(); }
                """);
        assertEquals(List.of("x", "y"), names(CallCollector.collect(p)));
        assertEquals(List.of("y"), names(CallCollector.collect(p.function("g"))));
    }

    @Test
    void finds_calls_in_every_statement_and_expression_kind() {
        var p = parse("""
                fnc main() {
                  let v: int[s1()] = s2();
                  t[s3()] = s4();
                  if (s5()) { s6(); } else if (s7()) { } else { s8(); }
                  while (s9()) { }
                  for (i in s10()...s11()) { }
                  defer { s12(); }
                  match (s13()) { case k if s14() { s15(); } }
                  with (h = s16()) { s17(); }
                  o.m(s18()).f[s19()];
                  x[s20():s21()];
                  [s22()];
                  new P { a: s23() };
                  s24() ? s25() : s26();
                  try s27();
                  -s28();
                  s29()[0](s30());
                  return s31();
                }
                """);
        var found = names(CallCollector.collect(p));
        assertEquals(32, found.size());
        for (int i = 0; i < 28; i++) {
            assertEquals("s" + (i + 1), found.get(i));
        }
        // a call through a computed callee comes before its callee and arguments
        assertEquals(List.of("?", "s29", "s30", "s31"), found.subList(28, 32));
    }

    @Test
    void collects_calls_in_compile_time_args_and_types() {
        var p = parse("""
                fnc main(b: Buf<(size())>) {
                  f[g()](h());
                }
                """);
        assertEquals(List.of("size", "f", "g", "h"), names(CallCollector.collect(p)));
    }

    @Test
    void collects_from_single_statement_and_expression() {
        var p = parse("fnc main() { a(b()); }");
        var stmt = p.functions().get(0).body().statements().get(0);
        var calls = CallCollector.collect(stmt);
        assertEquals(2, calls.size());
        assertSame(calls.get(1), ((CallExpr) calls.get(0)).args().get(0));
        assertEquals(List.of("b"), names(CallCollector.collect(calls.get(1))));
    }

    @Test
    void nothing_to_collect() {
        assertTrue(CallCollector.collect(parse("fnc main() { let x = 1 + 2; }")).isEmpty());
    }
}
