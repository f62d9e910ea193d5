package work.lcod.notegen.formula;

enum TokenType {
    NUMBER,
    STRING,
    PATH,
    TRUE,
    FALSE,
    NULL,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    LPAREN,
    RPAREN,
    QUESTION,
    COLON,
    NOT,
    ANDAND,
    OROR,
    EQ,
    NE,
    LT,
    LE,
    GT,
    GE,
    EOF
}
