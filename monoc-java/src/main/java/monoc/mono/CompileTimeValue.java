package monoc.mono;

import monoc.ast.expr.BoolLiteral;
import monoc.ast.expr.CharLiteral;
import monoc.ast.expr.FloatLiteral;
import monoc.ast.expr.IntLiteral;
import monoc.ast.expr.Literal;
import monoc.ast.expr.NoneLiteral;
import monoc.ast.expr.StringLiteral;

import java.nio.charset.StandardCharsets;

/**
 * Value of one compile-time argument. Records give value equality, so two
 * call sites spelling the same number differently share a cache entry.
 */
public sealed interface CompileTimeValue {

    Literal toLiteral();

    String nameSegment();

    static CompileTimeValue of(Literal literal) {
        if (literal instanceof IntLiteral i) return new IntValue(i.value());
        if (literal instanceof BoolLiteral b) return new BoolValue(b.value());
        return new OtherValue(literal);
    }

    record IntValue(long value) implements CompileTimeValue {
        @Override
        public Literal toLiteral() {
            return new IntLiteral(value);
        }

        @Override
        public String nameSegment() {
            // "-10" -> "neg10"; substring keeps Long.MIN_VALUE intact
            if (value < 0) return "neg" + Long.toString(value).substring(1);
            return Long.toString(value);
        }
    }

    record BoolValue(boolean value) implements CompileTimeValue {
        @Override
        public Literal toLiteral() {
            return new BoolLiteral(value);
        }

        @Override
        public String nameSegment() {
            return value ? "true" : "false";
        }
    }

    /**
     * Any literal kind other than int/bool. Only reachable when type checking
     * was skipped; naming still has to be deterministic.
     */
    record OtherValue(Literal literal) implements CompileTimeValue {
        @Override
        public Literal toLiteral() {
            return literal;
        }

        @Override
        public String nameSegment() {
            String kind;
            String text;
            if (literal instanceof FloatLiteral f) {
                kind = "float";
                text = Double.toString(f.value());
            } else if (literal instanceof StringLiteral s) {
                kind = "str";
                text = s.value();
            } else if (literal instanceof CharLiteral c) {
                kind = "char";
                text = String.valueOf(c.value());
            } else if (literal instanceof NoneLiteral) {
                kind = "none";
                text = "";
            } else {
                kind = "lit";
                text = literal.toString();
            }
            return kind + hex(text);
        }

        private static String hex(String text) {
            StringBuilder sb = new StringBuilder();
            for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
                sb.append(Character.forDigit((b >> 4) & 0xF, 16));
                sb.append(Character.forDigit(b & 0xF, 16));
            }
            return sb.toString();
        }
    }
}
