package monoc.lexer;

public enum TokenType {

    // literals
    IDENTIFIER,
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    CHAR_LITERAL,
    BOOL_LITERAL,
    NONE,

    // keywords
    FNC,
    STRUCT,
    LET,
    VAR,
    IF,
    ELSE,
    WHILE,
    FOR,
    IN,
    RETURN,
    BREAK,
    CONTINUE,
    DEFER,
    WITH,
    MATCH,
    CASE,
    TRY,
    NEW,

    // types
    INT,
    FLOAT,
    BOOL,
    STRING,
    VOID,

    // operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    ASSIGN,
    EQ, NEQ,
    LT, LE,
    GT, GE,
    AND, OR, NOT,
    QUESTION,

    // symbols
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    LBRACKET, RBRACKET,
    COLON, SEMICOLON, COMMA,
    DOT, RANGE,

    EOF
}
