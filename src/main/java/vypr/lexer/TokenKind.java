package vypr.lexer;

import org.antlr.v4.runtime.Token;
import vypr.parser.VyprParser;

/**
 * Token kinds of the Vypr language, each bound to the token type the generated parser expects.
 */
public enum TokenKind {
    // keywords
    VAR(VyprParser.VAR),
    IF(VyprParser.IF),
    ELSE(VyprParser.ELSE),
    LOOP(VyprParser.LOOP),
    WHILE(VyprParser.WHILE),
    TIMES(VyprParser.TIMES),
    IN(VyprParser.IN),
    FUNC(VyprParser.FUNC),
    RETURN(VyprParser.RETURN),
    PRINT(VyprParser.PRINT),
    INPUT(VyprParser.INPUT),

    // literals
    INTEGER(VyprParser.INTEGER),
    FLOAT(VyprParser.FLOAT),
    STRING(VyprParser.STRING),
    BOOLEAN(VyprParser.BOOLEAN),
    IDENTIFIER(VyprParser.IDENTIFIER),

    // operators
    PLUS(VyprParser.PLUS),
    MINUS(VyprParser.MINUS),
    MULTIPLY(VyprParser.MULTIPLY),
    DIVIDE(VyprParser.DIVIDE),
    CONCAT(VyprParser.CONCAT),
    ASSIGN(VyprParser.ASSIGN),
    EQUAL(VyprParser.EQUAL),
    NOT_EQUAL(VyprParser.NOT_EQUAL),
    LESS_THAN(VyprParser.LESS_THAN),
    GREATER_THAN(VyprParser.GREATER_THAN),
    LESS_EQUAL(VyprParser.LESS_EQUAL),
    GREATER_EQUAL(VyprParser.GREATER_EQUAL),

    // punctuation
    LPAREN(VyprParser.LPAREN),
    RPAREN(VyprParser.RPAREN),
    COMMA(VyprParser.COMMA),
    COLON(VyprParser.COLON),
    DOT(VyprParser.DOT),
    LBRACKET(VyprParser.LBRACKET),
    RBRACKET(VyprParser.RBRACKET),

    // structure
    NEWLINE(VyprParser.NEWLINE),
    INDENT(VyprParser.INDENT),
    DEDENT(VyprParser.DEDENT),
    EOF(Token.EOF);

    private final int tokenType;

    TokenKind(int tokenType) {
        this.tokenType = tokenType;
    }

    public int tokenType() {
        return tokenType;
    }

    public boolean isStructural() {
        return this == NEWLINE || this == INDENT || this == DEDENT || this == EOF;
    }

    public static TokenKind fromTokenType(int tokenType) {
        for (TokenKind kind : values()) {
            if (kind.tokenType == tokenType) return kind;
        }
        throw new IllegalArgumentException("Unknown token type: " + tokenType);
    }
}
