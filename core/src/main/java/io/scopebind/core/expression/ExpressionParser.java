package io.scopebind.core.expression;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.scopebind.core.error.ExpressionParseException;
import io.scopebind.core.expression.ExpressionNode.ArrayLiteral;
import io.scopebind.core.expression.ExpressionNode.Assignment;
import io.scopebind.core.expression.ExpressionNode.Binary;
import io.scopebind.core.expression.ExpressionNode.Conditional;
import io.scopebind.core.expression.ExpressionNode.EffectCall;
import io.scopebind.core.expression.ExpressionNode.Identifier;
import io.scopebind.core.expression.ExpressionNode.Literal;
import io.scopebind.core.expression.ExpressionNode.Member;
import io.scopebind.core.expression.ExpressionNode.ObjectLiteral;
import io.scopebind.core.expression.ExpressionNode.Property;
import io.scopebind.core.expression.ExpressionNode.Template;
import io.scopebind.core.expression.ExpressionNode.Unary;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser for the restricted expression grammar. Produces an
 * {@link ExpressionNode} tree or fails with an {@link ExpressionParseException} naming the
 * rejected construct.
 *
 * <p>
 * The grammar is a single expression: literals, template literals, array and object
 * construction, prefix and binary operators without side effects, member access, and the
 * conditional operator. The text is always parsed in expression position, so {@code {}} is an
 * empty object literal and never a block. In effectful mode, assignment to a bare identifier and
 * calls to whitelisted effect names are accepted as well.
 *
 * <p>
 * Not thread-safe: create one parser per parse.
 */
final class ExpressionParser {

    /** Words that start a statement or a construct outside the grammar, with the message to report. */
    private static final Map<String, String> REJECTED_WORDS = Map.ofEntries(
            Map.entry("function", "Functions are not supported"),
            Map.entry("class", "Classes are not supported"),
            Map.entry("new", "Classes are not supported"),
            Map.entry("this", "\"this\" keyword is not supported"),
            Map.entry("super", "\"super\" keyword is not supported"),
            Map.entry("var", "Declarations are not supported"),
            Map.entry("let", "Declarations are not supported"),
            Map.entry("const", "Declarations are not supported"),
            Map.entry("if", "Statements are not supported"),
            Map.entry("else", "Statements are not supported"),
            Map.entry("for", "Loops are not supported"),
            Map.entry("while", "Loops are not supported"),
            Map.entry("do", "Loops are not supported"),
            Map.entry("switch", "Statements are not supported"),
            Map.entry("return", "Statements are not supported"),
            Map.entry("throw", "Statements are not supported"),
            Map.entry("try", "Statements are not supported"),
            Map.entry("with", "Statements are not supported"),
            Map.entry("debugger", "Statements are not supported"),
            Map.entry("import", "Imports are not supported"),
            Map.entry("export", "Exports are not supported"),
            Map.entry("delete", "\"delete\" operator is not supported"),
            Map.entry("await", "Async code is not supported"),
            Map.entry("async", "Async code is not supported"),
            Map.entry("yield", "Generators are not supported"),
            Map.entry("in", "\"in\" operator is not supported"),
            Map.entry("instanceof", "\"instanceof\" operator is not supported"));

    private static final Set<String> ASSIGNMENT_OPERATORS =
            Set.of("=", "+=", "-=", "*=", "/=", "%=", "**=", "&&=", "||=", "??=");

    private static final Set<String> UNSUPPORTED_OPERATORS =
            Set.of("&", "|", "^", "<<", ">>", ">>>", "&=", "|=", "^=", "<<=", ">>=", ">>>=");

    /** Words that parse as identifiers but can never be variable references. */
    private static final Set<String> NON_REFERENCE_WORDS = Set.of("true", "false", "null", "typeof", "void");

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final String source;
    private final ExpressionLexer lexer;
    private final boolean effectful;
    private final Set<String> effectCalls;
    private final int maxDepth;
    private Token current;
    private int depth;

    ExpressionParser(String source, int from, int to, boolean effectful, Set<String> effectCalls, int maxDepth) {
        this.source = source;
        this.lexer = new ExpressionLexer(source, from, to);
        this.effectful = effectful;
        this.effectCalls = effectCalls;
        this.maxDepth = maxDepth;
        this.current = lexer.next();
    }

    /** Parses the whole window as exactly one expression. */
    ExpressionNode parse() {
        if (current.type() == TokenType.EOF) {
            throw error("Expression cannot be empty", current);
        }
        ExpressionNode node = parseAssignment();
        if (current.is(",") || current.is(";")) {
            throw error("Only single expression is supported", current);
        }
        if (current.type() != TokenType.EOF) {
            throw unexpected(current);
        }
        return node;
    }

    private ExpressionNode parseAssignment() {
        enter();
        try {
            if (current.is("...")) {
                throw error("Spread syntax is not supported", current);
            }
            Token startToken = current;
            ExpressionNode left = parseConditional();
            if (current.is("=>")) {
                throw error("Functions are not supported", current);
            }
            if (current.type() == TokenType.PUNCTUATOR && ASSIGNMENT_OPERATORS.contains(current.text())) {
                Token operator = current;
                if (!effectful) {
                    throw error("Assignment is supported only inside actions", operator);
                }
                if (!(left instanceof Identifier target)) {
                    throw error("Only variables can be assigned", startToken);
                }
                advance();
                return new Assignment(target, operator.text(), parseAssignment());
            }
            return left;
        } finally {
            depth--;
        }
    }

    private ExpressionNode parseConditional() {
        ExpressionNode test = parseBinary(0);
        if (!current.is("?")) {
            return test;
        }
        advance();
        ExpressionNode consequent = parseAssignment();
        expect(":");
        ExpressionNode alternate = parseAssignment();
        return new Conditional(test, consequent, alternate);
    }

    /** Binary operator precedence, lowest first. */
    private static final List<Set<String>> PRECEDENCE = List.of(
            Set.of("??"),
            Set.of("||"),
            Set.of("&&"),
            Set.of("==", "!=", "===", "!=="),
            Set.of("<", ">", "<=", ">="),
            Set.of("+", "-"),
            Set.of("*", "/", "%"));

    private ExpressionNode parseBinary(int level) {
        if (level == PRECEDENCE.size()) {
            return parseExponent();
        }
        ExpressionNode left = parseBinary(level + 1);
        while (current.type() == TokenType.PUNCTUATOR) {
            if (UNSUPPORTED_OPERATORS.contains(current.text())) {
                throw error("Bitwise operators are not supported", current);
            }
            if (!PRECEDENCE.get(level).contains(current.text())) {
                break;
            }
            String operator = current.text();
            advance();
            left = new Binary(operator, left, parseBinary(level + 1));
        }
        if (current.type() == TokenType.IDENTIFIER && REJECTED_WORDS.containsKey(current.text())) {
            throw error(REJECTED_WORDS.get(current.text()), current);
        }
        return left;
    }

    private ExpressionNode parseExponent() {
        ExpressionNode base = parseUnary();
        if (current.is("**")) {
            if (base instanceof Unary) {
                throw error("Unary operator before \"**\" must be parenthesized", current);
            }
            advance();
            // right-associative
            return new Binary("**", base, parseExponentOperand());
        }
        return base;
    }

    private ExpressionNode parseExponentOperand() {
        enter();
        try {
            return parseExponent();
        } finally {
            depth--;
        }
    }

    private ExpressionNode parseUnary() {
        enter();
        try {
            if (current.is("++") || current.is("--")) {
                throw error("Increment and decrement are not supported", current);
            }
            if (current.is("!") || current.is("-") || current.is("+") || current.is("~")) {
                String operator = current.text();
                advance();
                return new Unary(operator, parseUnary());
            }
            if (current.type() == TokenType.IDENTIFIER
                    && (current.text().equals("typeof") || current.text().equals("void"))) {
                String operator = current.text();
                advance();
                return new Unary(operator, parseUnary());
            }
            ExpressionNode node = parsePostfix();
            if (current.is("++") || current.is("--")) {
                throw error("Increment and decrement are not supported", current);
            }
            return node;
        } finally {
            depth--;
        }
    }

    private ExpressionNode parsePostfix() {
        ExpressionNode node = parsePrimary();
        boolean chained = false;
        while (true) {
            if (current.is(".")) {
                advance();
                node = new Member(node, expectPropertyName(), null, false, chained);
                chained = true;
            } else if (current.is("?.")) {
                advance();
                if (current.is("[")) {
                    advance();
                    ExpressionNode index = parseAssignment();
                    expect("]");
                    node = new Member(node, null, index, true, chained);
                    chained = true;
                } else if (current.is("(")) {
                    throw error("Functions are not supported", current);
                } else {
                    node = new Member(node, expectPropertyName(), null, true, chained);
                    chained = true;
                }
            } else if (current.is("[")) {
                advance();
                ExpressionNode index = parseAssignment();
                expect("]");
                node = new Member(node, null, index, false, chained);
                chained = true;
            } else if (current.is("(")) {
                node = parseCall(node);
            } else if (current.type() == TokenType.TEMPLATE) {
                throw error("Tagged template is not supported", current);
            } else {
                return node;
            }
        }
    }

    private ExpressionNode parseCall(ExpressionNode callee) {
        Token open = current;
        if (!effectful || !(callee instanceof Identifier identifier) || !effectCalls.contains(identifier.name())) {
            throw error("Functions are not supported", open);
        }
        advance();
        List<ExpressionNode> arguments = new ArrayList<>();
        while (!current.is(")")) {
            arguments.add(parseAssignment());
            if (!current.is(",")) {
                break;
            }
            advance();
        }
        expect(")");
        return new EffectCall(identifier.name(), List.copyOf(arguments));
    }

    private ExpressionNode parsePrimary() {
        Token token = current;
        switch (token.type()) {
            case NUMBER -> {
                advance();
                return new Literal(JsonValues.number(parseNumber(token)));
            }
            case STRING -> {
                advance();
                return new Literal(NODES.textNode(token.text()));
            }
            case TEMPLATE -> {
                advance();
                return parseTemplate(token);
            }
            case IDENTIFIER -> {
                return parseWord(token);
            }
            case PUNCTUATOR -> {
                return parsePunctuator(token);
            }
            default -> throw unexpected(token);
        }
    }

    private ExpressionNode parseWord(Token token) {
        String word = token.text();
        if (REJECTED_WORDS.containsKey(word)) {
            throw error(REJECTED_WORDS.get(word), token);
        }
        advance();
        switch (word) {
            case "true" -> {
                return new Literal(NODES.booleanNode(true));
            }
            case "false" -> {
                return new Literal(NODES.booleanNode(false));
            }
            case "null" -> {
                return new Literal(NODES.nullNode());
            }
            default -> {
                if (current.is("=>")) {
                    throw error("Functions are not supported", current);
                }
                return new Identifier(word, token.start(), token.end());
            }
        }
    }

    private ExpressionNode parsePunctuator(Token token) {
        if (token.is("(")) {
            advance();
            if (current.is(")")) {
                throw error("Functions are not supported", token);
            }
            ExpressionNode inner = parseAssignment();
            if (current.is(",")) {
                throw error("Only single expression is supported", current);
            }
            expect(")");
            if (current.is("=>")) {
                throw error("Functions are not supported", current);
            }
            return inner;
        }
        if (token.is("[")) {
            advance();
            return parseArray();
        }
        if (token.is("{")) {
            advance();
            return parseObject();
        }
        if (token.is("/")) {
            throw error("Regular expressions are not supported", token);
        }
        if (token.is("...")) {
            throw error("Spread syntax is not supported", token);
        }
        if (token.is(";")) {
            throw error("Only single expression is supported", token);
        }
        throw unexpected(token);
    }

    private ExpressionNode parseArray() {
        List<ExpressionNode> elements = new ArrayList<>();
        while (!current.is("]")) {
            if (current.is(",")) {
                throw error("Array holes are not supported", current);
            }
            elements.add(parseAssignment());
            if (!current.is(",")) {
                break;
            }
            advance();
        }
        expect("]");
        return new ArrayLiteral(List.copyOf(elements));
    }

    private ExpressionNode parseObject() {
        List<Property> properties = new ArrayList<>();
        while (!current.is("}")) {
            Token keyToken = current;
            String key;
            switch (keyToken.type()) {
                case IDENTIFIER, STRING -> key = keyToken.text();
                case NUMBER -> key = JsonValues.formatNumber(parseNumber(keyToken));
                default -> {
                    if (keyToken.is("[")) {
                        throw error("Computed keys are not supported", keyToken);
                    }
                    if (keyToken.is("...")) {
                        throw error("Spread syntax is not supported", keyToken);
                    }
                    throw unexpected(keyToken);
                }
            }
            advance();
            if (current.is("(")) {
                throw error("Functions are not supported", current);
            }
            if (current.is(":")) {
                advance();
                properties.add(new Property(key, parseAssignment(), false));
            } else if (keyToken.type() == TokenType.IDENTIFIER) {
                if (REJECTED_WORDS.containsKey(key)) {
                    throw error(REJECTED_WORDS.get(key), keyToken);
                }
                if (NON_REFERENCE_WORDS.contains(key)) {
                    throw unexpected(current);
                }
                properties.add(new Property(key, new Identifier(key, keyToken.start(), keyToken.end()), true));
            } else {
                throw unexpected(current);
            }
            if (!current.is(",")) {
                break;
            }
            advance();
        }
        expect("}");
        return new ObjectLiteral(List.copyOf(properties));
    }

    private ExpressionNode parseTemplate(Token token) {
        List<ExpressionNode> expressions = new ArrayList<>();
        for (int[] hole : token.holes()) {
            ExpressionParser inner = new ExpressionParser(source, hole[0], hole[1], effectful, effectCalls, maxDepth);
            inner.depth = depth;
            expressions.add(inner.parse());
        }
        return new Template(token.quasis(), List.copyOf(expressions));
    }

    private String expectPropertyName() {
        if (current.type() != TokenType.IDENTIFIER) {
            throw unexpected(current);
        }
        String name = current.text();
        advance();
        return name;
    }

    private double parseNumber(Token token) {
        String text = token.text();
        if (text.startsWith("0x") || text.startsWith("0X")) {
            return new java.math.BigInteger(text.substring(2), 16).doubleValue();
        }
        if (text.length() > 1 && text.charAt(0) == '0' && Character.isDigit(text.charAt(1))) {
            throw error("Legacy octal literals are not supported", token);
        }
        return Double.parseDouble(text);
    }

    private void expect(String punctuator) {
        if (!current.is(punctuator)) {
            throw error("Expected \"" + punctuator + "\" but found " + current, current);
        }
        advance();
    }

    private void advance() {
        current = lexer.next();
    }

    private void enter() {
        if (++depth > maxDepth) {
            depth--;
            throw error("Expression is nested too deeply", current);
        }
    }

    private ExpressionParseException unexpected(Token token) {
        return error("Unexpected token " + token, token);
    }

    private ExpressionParseException error(String message, Token at) {
        return new ExpressionParseException(message + " (" + (at.start() + 1) + ")", source, at.start());
    }
}
