package com.trading.sdg.compiler.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.trading.sdg.compiler.CompileErrorKind;
import com.trading.sdg.compiler.CompileException;

/**
 * Splits script text into tokens. Newlines inside brackets are ignored, a
 * trailing backslash joins lines and {@code #} starts a comment.
 */
public final class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("and", TokenType.AND), Map.entry("or", TokenType.OR), Map.entry("not", TokenType.NOT),
            Map.entry("if", TokenType.IF), Map.entry("else", TokenType.ELSE), Map.entry("elif", TokenType.ELIF),
            Map.entry("True", TokenType.TRUE), Map.entry("False", TokenType.FALSE),
            Map.entry("None", TokenType.NONE), Map.entry("in", TokenType.IN), Map.entry("is", TokenType.IS),
            Map.entry("import", TokenType.IMPORT), Map.entry("from", TokenType.FROM),
            Map.entry("def", TokenType.DEF), Map.entry("class", TokenType.CLASS), Map.entry("for", TokenType.FOR),
            Map.entry("while", TokenType.WHILE), Map.entry("with", TokenType.WITH),
            Map.entry("return", TokenType.RETURN), Map.entry("lambda", TokenType.LAMBDA),
            Map.entry("try", TokenType.TRY), Map.entry("del", TokenType.DEL), Map.entry("global", TokenType.GLOBAL),
            Map.entry("yield", TokenType.YIELD), Map.entry("assert", TokenType.ASSERT),
            Map.entry("pass", TokenType.PASS));

    private final String src;
    private int pos;
    private int line = 1;
    private int lineStart;
    private int depth;
    private final List<Token> tokens = new ArrayList<>();

    public Lexer(String src) {
        this.src = src;
    }

    public List<Token> tokenize() {
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '\n') {
                if (depth == 0)
                    addNewline();
                pos++;
                line++;
                lineStart = pos;
            } else if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                pos++;
            } else if (c == '#') {
                while (pos < src.length() && src.charAt(pos) != '\n')
                    pos++;
            } else if (c == '\\' && pos + 1 < src.length() && (src.charAt(pos + 1) == '\n'
                    || (src.charAt(pos + 1) == '\r' && pos + 2 < src.length() && src.charAt(pos + 2) == '\n'))) {
                pos = src.indexOf('\n', pos) + 1;
                line++;
                lineStart = pos;
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < src.length()
                    && Character.isDigit(src.charAt(pos + 1)))) {
                number();
            } else if (c == '"' || c == '\'') {
                string(c);
            } else if (Character.isLetter(c) || c == '_') {
                name();
            } else {
                operator(c);
            }
        }
        addNewline();
        tokens.add(new Token(TokenType.EOF, "", null, line, pos - lineStart + 1));
        return tokens;
    }

    private void addNewline() {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.NEWLINE)
            tokens.add(new Token(TokenType.NEWLINE, "\\n", null, line, pos - lineStart + 1));
    }

    private void number() {
        int start = pos;
        boolean isFloat = false;
        while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_'))
            pos++;
        if (pos < src.length() && src.charAt(pos) == '.') {
            isFloat = true;
            pos++;
            while (pos < src.length() && Character.isDigit(src.charAt(pos)))
                pos++;
        }
        if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
            int save = pos;
            pos++;
            if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-'))
                pos++;
            if (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                isFloat = true;
                while (pos < src.length() && Character.isDigit(src.charAt(pos)))
                    pos++;
            } else {
                pos = save;
            }
        }
        String text = src.substring(start, pos);
        String digits = text.replace("_", "");
        try {
            if (isFloat)
                tokens.add(token(TokenType.FLOAT, text, Double.parseDouble(digits), start));
            else
                tokens.add(token(TokenType.INTEGER, text, Long.parseLong(digits), start));
        } catch (NumberFormatException e) {
            throw new CompileException(CompileErrorKind.SYNTAX_ERROR, "Invalid number literal '" + text + "'", line);
        }
    }

    private void string(char quote) {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= src.length() || src.charAt(pos) == '\n')
                throw new CompileException(CompileErrorKind.SYNTAX_ERROR, "Unterminated string literal", line);
            char c = src.charAt(pos);
            if (c == quote) {
                pos++;
                break;
            }
            if (c == '\\' && pos + 1 < src.length()) {
                char n = src.charAt(pos + 1);
                switch (n) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '\\' -> sb.append('\\');
                    case '\'' -> sb.append('\'');
                    case '"' -> sb.append('"');
                    default -> sb.append('\\').append(n);
                }
                pos += 2;
                continue;
            }
            sb.append(c);
            pos++;
        }
        tokens.add(token(TokenType.STRING, src.substring(start, pos), sb.toString(), start));
    }

    private void name() {
        int start = pos;
        while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_'))
            pos++;
        String text = src.substring(start, pos);
        TokenType kw = KEYWORDS.get(text);
        tokens.add(token(kw != null ? kw : TokenType.NAME, text, text, start));
    }

    private void operator(char c) {
        int start = pos;
        char n = pos + 1 < src.length() ? src.charAt(pos + 1) : '\0';
        TokenType type;
        int len = 1;
        switch (c) {
            case '+' -> type = TokenType.PLUS;
            case '-' -> type = TokenType.MINUS;
            case '*' -> {
                type = n == '*' ? TokenType.DOUBLE_STAR : TokenType.STAR;
                len = n == '*' ? 2 : 1;
            }
            case '/' -> type = TokenType.SLASH;
            case '%' -> type = TokenType.PERCENT;
            case '&' -> type = TokenType.AMPERSAND;
            case '|' -> type = TokenType.PIPE;
            case '~' -> type = TokenType.TILDE;
            case '<' -> {
                type = n == '=' ? TokenType.LTE : TokenType.LT;
                len = n == '=' ? 2 : 1;
            }
            case '>' -> {
                type = n == '=' ? TokenType.GTE : TokenType.GT;
                len = n == '=' ? 2 : 1;
            }
            case '=' -> {
                type = n == '=' ? TokenType.EQ : TokenType.ASSIGN;
                len = n == '=' ? 2 : 1;
            }
            case '!' -> {
                if (n != '=')
                    throw new CompileException(CompileErrorKind.SYNTAX_ERROR, "Unexpected character '!'", line);
                type = TokenType.NEQ;
                len = 2;
            }
            case '(' -> type = TokenType.LPAREN;
            case ')' -> type = TokenType.RPAREN;
            case '[' -> type = TokenType.LBRACKET;
            case ']' -> type = TokenType.RBRACKET;
            case '{' -> type = TokenType.LBRACE;
            case '}' -> type = TokenType.RBRACE;
            case ',' -> type = TokenType.COMMA;
            case '.' -> type = TokenType.DOT;
            case ':' -> type = TokenType.COLON;
            case ';' -> type = TokenType.SEMICOLON;
            default -> throw new CompileException(CompileErrorKind.SYNTAX_ERROR,
                    "Unexpected character '" + c + "'", line);
        }
        switch (type) {
            case LPAREN, LBRACKET, LBRACE -> depth++;
            case RPAREN, RBRACKET, RBRACE -> depth = Math.max(0, depth - 1);
            default -> {
            }
        }
        pos += len;
        tokens.add(token(type, src.substring(start, pos), null, start));
    }

    private Token token(TokenType type, String text, Object value, int start) {
        return new Token(type, text, value == null ? text : value, line, start - lineStart + 1);
    }
}
