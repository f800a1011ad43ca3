package com.trading.sdg.compiler.parser;

public enum TokenType {
    NAME, INTEGER, FLOAT, STRING,
    // Keywords
    AND, OR, NOT, IF, ELSE, TRUE, FALSE, NONE, IN, IS,
    IMPORT, FROM, DEF, CLASS, FOR, WHILE, WITH, RETURN, LAMBDA, ELIF, TRY, DEL, GLOBAL, YIELD, ASSERT, PASS,
    // Operators
    PLUS, MINUS, STAR, SLASH, PERCENT, DOUBLE_STAR, AMPERSAND, PIPE, TILDE,
    LT, GT, LTE, GTE, EQ, NEQ, ASSIGN,
    LPAREN, RPAREN, LBRACKET, RBRACKET, LBRACE, RBRACE,
    COMMA, DOT, COLON, SEMICOLON,
    NEWLINE, EOF;

    /** Statement keywords the strategy language rejects. */
    public boolean isDisallowedStatement() {
        return switch (this) {
            case IMPORT, FROM, DEF, CLASS, FOR, WHILE, WITH, RETURN, LAMBDA, IF, ELIF, ELSE, TRY, DEL, GLOBAL,
                    YIELD, ASSERT, PASS -> true;
            default -> false;
        };
    }
}
