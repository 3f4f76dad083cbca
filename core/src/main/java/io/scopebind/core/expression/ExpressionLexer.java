package io.scopebind.core.expression;

import io.scopebind.core.error.ExpressionParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits expression text into tokens. Operates on a {@code [from, to)} window of the source so
 * that template literal holes can be lexed in place and keep absolute offsets.
 *
 * <p>
 * The lexer recognises every punctuator the parser needs in order to reject a construct with a
 * precise message ({@code =>}, {@code ++}, {@code ;}, {@code ...}); deciding what is allowed is
 * the parser's job.
 */
final class ExpressionLexer {

    /** Punctuators ordered longest first so that greedy matching picks e.g. {@code ===} over {@code ==}. */
    private static final String[] PUNCTUATORS = {
        ">>>=", "...", "===", "!==", "**=", "<<=", ">>=", ">>>", "&&=", "||=", "??=",
        "=>", "==", "!=", "<=", ">=", "&&", "||", "??", "?.", "++", "--", "+=", "-=", "*=", "/=", "%=",
        "&=", "|=", "^=", "**", "<<", ">>",
        "(", ")", "[", "]", "{", "}", ",", ":", ";", ".", "?", "!", "~", "+", "-", "*", "/", "%", "<",
        ">", "=", "&", "|", "^", "@", "#"
    };

    private final String source;
    private final int to;
    private int pos;

    ExpressionLexer(String source) {
        this(source, 0, source.length());
    }

    ExpressionLexer(String source, int from, int to) {
        this.source = source;
        this.pos = from;
        this.to = to;
    }

    Token next() {
        skipWhitespaceAndComments();
        if (pos >= to) {
            return new Token(TokenType.EOF, "", to, to);
        }
        char c = source.charAt(pos);
        if (isIdentifierStart(c)) {
            return identifier();
        }
        if (isDigit(c) || (c == '.' && pos + 1 < to && isDigit(source.charAt(pos + 1)))) {
            return number();
        }
        if (c == '"' || c == '\'') {
            return string(c);
        }
        if (c == '`') {
            return template();
        }
        for (String punctuator : PUNCTUATORS) {
            // "?." followed by a digit is a conditional, not optional chaining: a?.5:b
            if (punctuator.equals("?.") && pos + 2 < to && isDigit(source.charAt(pos + 2))) {
                continue;
            }
            if (source.startsWith(punctuator, pos) && pos + punctuator.length() <= to) {
                int start = pos;
                pos += punctuator.length();
                return new Token(TokenType.PUNCTUATOR, punctuator, start, pos);
            }
        }
        throw error("Unexpected character '" + c + "'", pos);
    }

    private Token identifier() {
        int start = pos++;
        while (pos < to && isIdentifierPart(source.charAt(pos))) {
            pos++;
        }
        return new Token(TokenType.IDENTIFIER, source.substring(start, pos), start, pos);
    }

    private Token number() {
        int start = pos;
        if (source.charAt(pos) == '0' && pos + 1 < to && (source.charAt(pos + 1) == 'x' || source.charAt(pos + 1) == 'X')) {
            pos += 2;
            int digits = pos;
            while (pos < to && Character.digit(source.charAt(pos), 16) >= 0) {
                pos++;
            }
            if (pos == digits) {
                throw error("Invalid hexadecimal number", start);
            }
        } else {
            while (pos < to && isDigit(source.charAt(pos))) {
                pos++;
            }
            if (pos < to && source.charAt(pos) == '.') {
                pos++;
                while (pos < to && isDigit(source.charAt(pos))) {
                    pos++;
                }
            }
            if (pos < to && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
                pos++;
                if (pos < to && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                    pos++;
                }
                int digits = pos;
                while (pos < to && isDigit(source.charAt(pos))) {
                    pos++;
                }
                if (pos == digits) {
                    throw error("Invalid number exponent", start);
                }
            }
        }
        if (pos < to && isIdentifierStart(source.charAt(pos))) {
            throw error("Identifier directly after number", pos);
        }
        return new Token(TokenType.NUMBER, source.substring(start, pos), start, pos);
    }

    private Token string(char quote) {
        int start = pos++;
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= to) {
                throw error("Unterminated string literal", start);
            }
            char c = source.charAt(pos++);
            if (c == quote) {
                break;
            }
            if (c == '\n' || c == '\r') {
                throw error("Unterminated string literal", start);
            }
            if (c == '\\') {
                escape(sb);
            } else {
                sb.append(c);
            }
        }
        return new Token(TokenType.STRING, sb.toString(), start, pos);
    }

    private Token template() {
        int start = pos++;
        List<String> quasis = new ArrayList<>();
        List<int[]> holes = new ArrayList<>();
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= to) {
                throw error("Unterminated template literal", start);
            }
            char c = source.charAt(pos++);
            if (c == '`') {
                quasis.add(sb.toString());
                break;
            }
            if (c == '\\') {
                escape(sb);
            } else if (c == '$' && pos < to && source.charAt(pos) == '{') {
                quasis.add(sb.toString());
                sb.setLength(0);
                pos++;
                int holeStart = pos;
                skipHole(start);
                holes.add(new int[] {holeStart, pos - 1});
            } else {
                sb.append(c);
            }
        }
        return new Token(TokenType.TEMPLATE, source.substring(start, pos), start, pos, quasis, holes);
    }

    /** Advances past the closing brace of a {@code ${...}} hole, honouring nested literals. */
    private void skipHole(int templateStart) {
        int depth = 1;
        while (depth > 0) {
            if (pos >= to) {
                throw error("Unterminated template literal", templateStart);
            }
            char c = source.charAt(pos);
            if (c == '"' || c == '\'') {
                string(c);
            } else if (c == '`') {
                template();
            } else {
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                }
                pos++;
            }
        }
    }

    private void escape(StringBuilder sb) {
        if (pos >= to) {
            throw error("Unterminated escape sequence", pos - 1);
        }
        char e = source.charAt(pos++);
        switch (e) {
            case 'n' -> sb.append('\n');
            case 't' -> sb.append('\t');
            case 'r' -> sb.append('\r');
            case 'b' -> sb.append('\b');
            case 'f' -> sb.append('\f');
            case 'v' -> sb.append('\u000B');
            case '0' -> sb.append('\0');
            case '\r' -> {
                if (pos < to && source.charAt(pos) == '\n') {
                    pos++;
                }
            }
            case '\n' -> {
                // line continuation
            }
            case 'x' -> sb.append((char) hex(2));
            case 'u' -> {
                if (pos < to && source.charAt(pos) == '{') {
                    int close = source.indexOf('}', pos);
                    if (close < 0 || close >= to || close == pos + 1) {
                        throw error("Invalid unicode escape", pos);
                    }
                    int codePoint;
                    try {
                        codePoint = Integer.parseInt(source.substring(pos + 1, close), 16);
                    } catch (NumberFormatException ex) {
                        throw error("Invalid unicode escape", pos);
                    }
                    if (!Character.isValidCodePoint(codePoint)) {
                        throw error("Invalid unicode escape", pos);
                    }
                    sb.appendCodePoint(codePoint);
                    pos = close + 1;
                } else {
                    sb.append((char) hex(4));
                }
            }
            default -> sb.append(e);
        }
    }

    private int hex(int length) {
        if (pos + length > to) {
            throw error("Invalid escape sequence", pos);
        }
        int value = 0;
        for (int i = 0; i < length; i++) {
            int digit = Character.digit(source.charAt(pos + i), 16);
            if (digit < 0) {
                throw error("Invalid escape sequence", pos);
            }
            value = (value << 4) | digit;
        }
        pos += length;
        return value;
    }

    private void skipWhitespaceAndComments() {
        while (pos < to) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c) || c == '\u00A0' || c == '\uFEFF') {
                pos++;
            } else if (c == '/' && pos + 1 < to && source.charAt(pos + 1) == '/') {
                while (pos < to && source.charAt(pos) != '\n') {
                    pos++;
                }
            } else if (c == '/' && pos + 1 < to && source.charAt(pos + 1) == '*') {
                int close = source.indexOf("*/", pos + 2);
                if (close < 0 || close + 2 > to) {
                    throw error("Unterminated comment", pos);
                }
                pos = close + 2;
            } else {
                return;
            }
        }
    }

    private ExpressionParseException error(String message, int at) {
        return new ExpressionParseException(message + " (" + (at + 1) + ")", source, at);
    }

    static boolean isIdentifierStart(char c) {
        return c == '$' || c == '_' || Character.isLetter(c);
    }

    static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || Character.isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
