package work.lcod.probe.selector;

enum TokenType {
    WORD,
    PATH,
    META,
    STRING,
    DOLLAR,
    AS,
    GT,
    DEEP_GT,
    LBRACE,
    RBRACE,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA,
    COLON,
    AMP,
    PIPE,
    AT,
    BANG,
    EQUALS,
    SEMICOLON,
    EOF
}
