package io.scopebind.core.expression;

/** Lexical token kinds of the restricted expression grammar. */
enum TokenType {
    NUMBER,
    STRING,
    TEMPLATE,
    IDENTIFIER,
    PUNCTUATOR,
    EOF
}
