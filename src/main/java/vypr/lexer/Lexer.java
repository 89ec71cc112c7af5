package vypr.lexer;

import vypr.CompilerOptions;
import vypr.exception.LexicalException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns Vypr source text into tokens. Block structure comes from an indentation stack:
 * a deeper line pushes its width and yields INDENT, a shallower line pops back to a
 * width already on the stack and yields one DEDENT per pop.
 */
public class Lexer {
    private static final Map<String, TokenKind> KEYWORDS = new HashMap<>();

    static {
        KEYWORDS.put("var", TokenKind.VAR);
        KEYWORDS.put("if", TokenKind.IF);
        KEYWORDS.put("else", TokenKind.ELSE);
        KEYWORDS.put("loop", TokenKind.LOOP);
        KEYWORDS.put("while", TokenKind.WHILE);
        KEYWORDS.put("times", TokenKind.TIMES);
        KEYWORDS.put("in", TokenKind.IN);
        KEYWORDS.put("func", TokenKind.FUNC);
        KEYWORDS.put("return", TokenKind.RETURN);
        KEYWORDS.put("print", TokenKind.PRINT);
        KEYWORDS.put("input", TokenKind.INPUT);
        KEYWORDS.put("true", TokenKind.BOOLEAN);
        KEYWORDS.put("false", TokenKind.BOOLEAN);
    }

    private static final String INDENTATION_HINT = " (indent with spaces; a tab counts as %d columns)";

    private final String text;
    private final int tabWidth;
    private final List<VyprToken> tokens = new ArrayList<>();
    private final Deque<Integer> indentStack = new ArrayDeque<>();
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public Lexer(String text) {
        this(text, CompilerOptions.DEFAULT);
    }

    public Lexer(String text, CompilerOptions options) {
        this.text = text;
        this.tabWidth = options.tabWidth();
        indentStack.push(0);
    }

    public static List<VyprToken> tokenize(String text, CompilerOptions options) throws LexicalException {
        return new Lexer(text, options).tokenize();
    }

    public List<VyprToken> tokenize() throws LexicalException {
        while (!atEnd()) {
            lexLine();
        }
        if (!tokens.isEmpty() && last().getKind() != TokenKind.NEWLINE) {
            add(TokenKind.NEWLINE, "<NEWLINE>", null, line, column);
        }
        while (indentStack.peek() > 0) {
            indentStack.pop();
            add(TokenKind.DEDENT, "<DEDENT>", null, line, column);
        }
        add(TokenKind.EOF, "<EOF>", null, line, column);
        return tokens;
    }

    // One physical line, starting at column 1.
    private void lexLine() throws LexicalException {
        int width = 0;
        while (!atEnd() && (current() == ' ' || current() == '\t')) {
            width += current() == '\t' ? tabWidth : 1;
            advance();
        }
        if (atEnd() || current() == '\n' || current() == '\r' || isCommentStart()) {
            skipRestOfLine();
            return;
        }
        processIndentation(width);
        while (!atEnd() && current() != '\n') {
            char c = current();
            if (c == ' ' || c == '\t' || c == '\r') {
                advance();
            } else if (isCommentStart()) {
                while (!atEnd() && current() != '\n') advance();
            } else {
                lexToken();
            }
        }
        add(TokenKind.NEWLINE, "<NEWLINE>", null, line, column);
        if (!atEnd()) {
            advance();
        }
    }

    private void processIndentation(int width) throws LexicalException {
        int top = indentStack.peek();
        if (width > top) {
            indentStack.push(width);
            add(TokenKind.INDENT, "<INDENT>", width, line, 1);
            return;
        }
        while (width < indentStack.peek()) {
            indentStack.pop();
            add(TokenKind.DEDENT, "<DEDENT>", null, line, 1);
        }
        if (width != indentStack.peek()) {
            throw new LexicalException("Inconsistent indentation: width " + width
                    + " does not match any enclosing block (expected " + indentStack.peek() + ")"
                    + String.format(INDENTATION_HINT, tabWidth), line, 1);
        }
    }

    private void lexToken() throws LexicalException {
        char c = current();
        int startColumn = column;
        if (Character.isDigit(c)) {
            number();
            return;
        }
        if (c == '"' || c == '\'') {
            string();
            return;
        }
        if (Character.isLetter(c) || c == '_') {
            identifier();
            return;
        }
        switch (c) {
            case '+': single(TokenKind.PLUS); return;
            case '-': single(TokenKind.MINUS); return;
            case '*': single(TokenKind.MULTIPLY); return;
            case '/': single(TokenKind.DIVIDE); return;
            case '^': single(TokenKind.CONCAT); return;
            case '(': single(TokenKind.LPAREN); return;
            case ')': single(TokenKind.RPAREN); return;
            case ',': single(TokenKind.COMMA); return;
            case ':': single(TokenKind.COLON); return;
            case '.': single(TokenKind.DOT); return;
            case '[': single(TokenKind.LBRACKET); return;
            case ']': single(TokenKind.RBRACKET); return;
            case '=':
                pair(TokenKind.ASSIGN, TokenKind.EQUAL);
                return;
            case '<':
                pair(TokenKind.LESS_THAN, TokenKind.LESS_EQUAL);
                return;
            case '>':
                pair(TokenKind.GREATER_THAN, TokenKind.GREATER_EQUAL);
                return;
            case '!':
                advance();
                if (!atEnd() && current() == '=') {
                    advance();
                    add(TokenKind.NOT_EQUAL, "!=", null, line, startColumn);
                    return;
                }
                throw new LexicalException("Invalid token '!' (did you mean '!='?)", line, startColumn);
            default:
                throw new LexicalException("Invalid character '" + c + "'", line, startColumn);
        }
    }

    private void single(TokenKind kind) {
        add(kind, String.valueOf(current()), null, line, column);
        advance();
    }

    // Operator that may be followed by '=' to form the two-character variant.
    private void pair(TokenKind alone, TokenKind withEquals) {
        int startColumn = column;
        char first = current();
        advance();
        if (!atEnd() && current() == '=') {
            advance();
            add(withEquals, first + "=", null, line, startColumn);
        } else {
            add(alone, String.valueOf(first), null, line, startColumn);
        }
    }

    private void number() throws LexicalException {
        int start = pos;
        int startColumn = column;
        while (!atEnd() && Character.isDigit(current())) advance();
        if (!atEnd() && current() == '.' && Character.isDigit(peek())) {
            advance();
            while (!atEnd() && Character.isDigit(current())) advance();
            String lexeme = text.substring(start, pos);
            add(TokenKind.FLOAT, lexeme, Double.parseDouble(lexeme), line, startColumn);
            return;
        }
        String lexeme = text.substring(start, pos);
        try {
            add(TokenKind.INTEGER, lexeme, Long.parseLong(lexeme), line, startColumn);
        } catch (NumberFormatException e) {
            throw new LexicalException("Integer literal out of range: " + lexeme, line, startColumn);
        }
    }

    private void string() throws LexicalException {
        int startColumn = column;
        int start = pos;
        char quote = current();
        advance();
        StringBuilder value = new StringBuilder();
        while (!atEnd() && current() != quote && current() != '\n') {
            if (current() == '\\' && peek() == quote) {
                advance();
            }
            value.append(current());
            advance();
        }
        if (atEnd() || current() != quote) {
            throw new LexicalException("Unterminated string", line, startColumn);
        }
        advance();
        add(TokenKind.STRING, text.substring(start, pos), value.toString(), line, startColumn);
    }

    private void identifier() {
        int start = pos;
        int startColumn = column;
        while (!atEnd() && (Character.isLetterOrDigit(current()) || current() == '_')) advance();
        String word = text.substring(start, pos);
        TokenKind kind = KEYWORDS.getOrDefault(word, TokenKind.IDENTIFIER);
        Object value = kind == TokenKind.BOOLEAN ? Boolean.valueOf(word.equals("true")) : word;
        add(kind, word, value, line, startColumn);
    }

    private boolean isCommentStart() {
        return current() == '/' && peek() == '/';
    }

    private void skipRestOfLine() {
        while (!atEnd() && current() != '\n') advance();
        if (!atEnd()) advance();
    }

    private void add(TokenKind kind, String lexeme, Object value, int tokenLine, int tokenColumn) {
        tokens.add(new VyprToken(kind, lexeme, value, tokenLine, tokenColumn));
    }

    private VyprToken last() {
        return tokens.get(tokens.size() - 1);
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private char current() {
        return text.charAt(pos);
    }

    private char peek() {
        return pos + 1 < text.length() ? text.charAt(pos + 1) : '\0';
    }

    private void advance() {
        if (text.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }
}
