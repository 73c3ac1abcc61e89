package monoc.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<Token> lex(String src) {
        return new Lexer(src).tokenize();
    }

    private static List<TokenType> typesNoEof(String src) {
        return lex(src).stream().filter(t -> t.type() != TokenType.EOF).map(Token::type).toList();
    }

    @Test
    void lex_all_single_char_tokens() {
        var ts = typesNoEof("(){}[]:;,+-*/%.?");
        assertEquals(List.of(
                TokenType.LPAREN, TokenType.RPAREN,
                TokenType.LBRACE, TokenType.RBRACE,
                TokenType.LBRACKET, TokenType.RBRACKET,
                TokenType.COLON, TokenType.SEMICOLON, TokenType.COMMA,
                TokenType.PLUS, TokenType.MINUS, TokenType.STAR, TokenType.SLASH, TokenType.PERCENT,
                TokenType.DOT, TokenType.QUESTION
        ), ts);
    }

    @Test
    void lex_range_vs_dot() {
        assertEquals(List.of(TokenType.RANGE), typesNoEof("..."));
        assertEquals(List.of(TokenType.DOT, TokenType.DOT), typesNoEof(".."));
        assertEquals(List.of(TokenType.INT_LITERAL, TokenType.DOT), typesNoEof("12."));
        assertEquals(List.of(TokenType.INT_LITERAL, TokenType.RANGE, TokenType.IDENTIFIER), typesNoEof("12...n"));
    }

    @Test
    void lex_keywords_types_and_bool_literal() {
        var ts = typesNoEof("fnc struct let var if else while for in return break continue "
                + "defer with match case try new none int float bool string void T F true false");
        assertEquals(List.of(
                TokenType.FNC, TokenType.STRUCT, TokenType.LET, TokenType.VAR, TokenType.IF, TokenType.ELSE,
                TokenType.WHILE, TokenType.FOR, TokenType.IN, TokenType.RETURN, TokenType.BREAK,
                TokenType.CONTINUE, TokenType.DEFER, TokenType.WITH, TokenType.MATCH, TokenType.CASE,
                TokenType.TRY, TokenType.NEW, TokenType.NONE,
                TokenType.INT, TokenType.FLOAT, TokenType.BOOL, TokenType.STRING, TokenType.VOID,
                TokenType.BOOL_LITERAL, TokenType.BOOL_LITERAL, TokenType.BOOL_LITERAL, TokenType.BOOL_LITERAL
        ), ts);
        var toks = lex("T F");
        assertEquals("T", toks.get(0).lexeme());
        assertEquals("F", toks.get(1).lexeme());
    }

    @Test
    void lex_identifier_vs_keyword() {
        assertEquals(List.of(TokenType.IN, TokenType.IDENTIFIER), typesNoEof("in in1"));
        assertEquals(List.of(TokenType.IDENTIFIER), typesNoEof("_"));
    }

    @Test
    void lex_numbers_int_and_float() {
        assertEquals(List.of(TokenType.INT_LITERAL, TokenType.FLOAT_LITERAL), typesNoEof("0 3.14"));
        var toks = lex("3.14");
        assertEquals("3.14", toks.get(0).lexeme());
    }

    @Test
    void lex_hex_literal_keeps_prefix() {
        var toks = lex("0xFF 0x");
        assertEquals(TokenType.INT_LITERAL, toks.get(0).type());
        assertEquals("0xFF", toks.get(0).lexeme());
        // "0x" without digits is 0 followed by identifier x
        assertEquals("0", toks.get(1).lexeme());
        assertEquals(TokenType.IDENTIFIER, toks.get(2).type());
    }

    @Test
    void lex_string_literal() {
        var toks = lex("\"abc\"");
        assertEquals(TokenType.STRING_LITERAL, toks.get(0).type());
        assertEquals("abc", toks.get(0).lexeme());
    }

    @Test
    void lex_char_literal_with_escapes() {
        var toks = lex("'a' '\\n' '\\''");
        assertEquals(TokenType.CHAR_LITERAL, toks.get(0).type());
        assertEquals("a", toks.get(0).lexeme());
        assertEquals("\n", toks.get(1).lexeme());
        assertEquals("'", toks.get(2).lexeme());
    }

    @Test
    void lex_comment_skipped() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER), typesNoEof("x//cmt\ny"));
    }

    @Test
    void lex_whitespace_and_positions() {
        var toks = lex("a\n  b");
        assertEquals("IDENTIFIER('a')@1:1", toks.get(0).toString());
        assertEquals("IDENTIFIER('b')@2:3", toks.get(1).toString());
    }

    @Test
    void lex_generic_brackets_are_separate_tokens() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.LT, TokenType.IDENTIFIER, TokenType.LT,
                TokenType.INT_LITERAL, TokenType.GT, TokenType.GT), typesNoEof("A<B<3>>"));
    }

    static Stream<String> opInputs() {
        return Stream.of(
                "a=b", "a==b", "a!=b", "a<b", "a<=b", "a>b", "a>=b", "a&&b", "a||b", "!a"
        );
    }

    @ParameterizedTest
    @MethodSource("opInputs")
    void lex_operators(String input) {
        var toks = lex(input);
        assertTrue(toks.size() >= 3);
        assertEquals(TokenType.EOF, toks.get(toks.size() - 1).type());
    }

    @Test
    void lex_error_single_ampersand() {
        assertThrows(LexerException.class, () -> lex("&"));
    }

    @Test
    void lex_error_single_pipe() {
        assertThrows(LexerException.class, () -> lex("|"));
    }

    @Test
    void lex_error_unexpected_char() {
        assertThrows(LexerException.class, () -> lex("@"));
    }

    @Test
    void lex_error_unterminated_string() {
        assertThrows(LexerException.class, () -> lex("\"abc"));
        assertThrows(LexerException.class, () -> lex("\"ab\nc\""));
    }

    @Test
    void lex_error_bad_char_literal() {
        assertThrows(LexerException.class, () -> lex("''"));
        assertThrows(LexerException.class, () -> lex("'ab'"));
        assertThrows(LexerException.class, () -> lex("'\\q'"));
    }
}
