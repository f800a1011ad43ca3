package com.trading.sdg.compiler.parser;

/**
 * Lexical token. {@code value} holds the decoded literal for numbers and
 * strings, otherwise the source text.
 */
public record Token(TokenType type, String text, Object value, int line, int column) {

    @Override
    public String toString() {
        return type + "('" + text + "')@" + line + ":" + column;
    }
}
