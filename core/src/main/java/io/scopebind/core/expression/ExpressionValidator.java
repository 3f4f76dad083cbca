package io.scopebind.core.expression;

import io.scopebind.core.error.ExpressionParseException;
import io.scopebind.core.error.UnknownIdentifierException;
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
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Parses expression text against the restricted grammar, runs the identifier policy over every
 * bare identifier, and returns the normalized text.
 *
 * <p>
 * Normalization only rewrites identifier spans; all other characters of the input are kept, so
 * validating already-normalized text with the identity policy returns it unchanged. When a
 * shorthand object property is renamed, it is expanded to {@code key: identifier} so the object
 * key stays the same.
 *
 * <p>
 * Thread-safe: holds only immutable configuration.
 */
public final class ExpressionValidator {

    private final ExpressionLimits limits;
    private final Set<String> effectCalls;

    /** Creates a validator with default limits and no whitelisted effect calls. */
    public ExpressionValidator() {
        this(ExpressionLimits.DEFAULT, Set.of());
    }

    /**
     * Creates a validator.
     *
     * @param limits      size limits applied to every expression
     * @param effectCalls callee names accepted as effect calls in effectful mode
     */
    public ExpressionValidator(ExpressionLimits limits, Set<String> effectCalls) {
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
        this.effectCalls = Set.copyOf(Objects.requireNonNull(effectCalls, "effectCalls must not be null"));
    }

    /**
     * Validates and normalizes expression text.
     *
     * @param text    the expression text
     * @param options validation options
     * @return the normalized text; the input itself for an empty optional expression
     * @throws ExpressionParseException    if the text is malformed or uses a rejected construct
     * @throws UnknownIdentifierException  if the identifier policy rejects an identifier
     */
    public String validate(String text, ValidateOptions options) {
        return parse(text, options).text();
    }

    /**
     * Validates expression text and returns the syntax tree along with the normalized text.
     *
     * @param text    the expression text
     * @param options validation options
     * @return the parsed expression
     * @throws ExpressionParseException    if the text is malformed or uses a rejected construct
     * @throws UnknownIdentifierException  if the identifier policy rejects an identifier
     */
    public ParsedExpression parse(String text, ValidateOptions options) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(options, "options must not be null");
        if (text.isBlank() && options.optional()) {
            return new ParsedExpression(text, null, List.of());
        }
        if (text.length() > limits.maxLength()) {
            throw new ExpressionParseException(
                    "Expression exceeds " + limits.maxLength() + " characters", text, limits.maxLength());
        }
        ExpressionNode root =
                new ExpressionParser(text, 0, text.length(), options.effectful(), effectCalls, limits.maxDepth())
                        .parse();

        List<Reference> references = new ArrayList<>();
        collect(root, false, references);
        references.sort(Comparator.comparingInt(reference -> reference.identifier().start()));

        Set<String> identifiers = new LinkedHashSet<>();
        StringBuilder normalized = new StringBuilder(text.length());
        int copied = 0;
        for (Reference reference : references) {
            Identifier identifier = reference.identifier();
            String replacement = transform(options.identifiers(), identifier.name(), text);
            identifiers.add(identifier.name());
            normalized.append(text, copied, identifier.start());
            if (reference.shorthand() && !replacement.equals(identifier.name())) {
                normalized.append(identifier.name()).append(": ");
            }
            normalized.append(replacement);
            copied = identifier.end();
        }
        normalized.append(text, copied, text.length());
        return new ParsedExpression(normalized.toString(), root, new ArrayList<>(identifiers));
    }

    private static String transform(IdentifierPolicy policy, String identifier, String text) {
        String replacement;
        try {
            replacement = policy.transform(identifier);
        } catch (UnknownIdentifierException e) {
            if (e.expression() == null) {
                throw new UnknownIdentifierException(e.identifier(), text);
            }
            throw e;
        }
        if (replacement == null
                || replacement.isEmpty()
                || !ExpressionLexer.isIdentifierStart(replacement.charAt(0))
                || !replacement.chars().allMatch(c -> ExpressionLexer.isIdentifierPart((char) c))) {
            throw new IllegalStateException(
                    "Identifier policy returned an invalid identifier for '" + identifier + "': " + replacement);
        }
        return replacement;
    }

    private record Reference(Identifier identifier, boolean shorthand) {}

    /** Collects identifier references; member names, object keys and effect callees are not references. */
    private static void collect(ExpressionNode node, boolean shorthand, List<Reference> out) {
        if (node instanceof Identifier identifier) {
            out.add(new Reference(identifier, shorthand));
        } else if (node instanceof Literal) {
            return;
        } else if (node instanceof Template template) {
            template.expressions().forEach(expression -> collect(expression, false, out));
        } else if (node instanceof ArrayLiteral array) {
            array.elements().forEach(element -> collect(element, false, out));
        } else if (node instanceof ObjectLiteral object) {
            for (Property property : object.properties()) {
                collect(property.value(), property.shorthand(), out);
            }
        } else if (node instanceof Unary unary) {
            collect(unary.operand(), false, out);
        } else if (node instanceof Binary binary) {
            collect(binary.left(), false, out);
            collect(binary.right(), false, out);
        } else if (node instanceof Member member) {
            collect(member.object(), false, out);
            if (member.index() != null) {
                collect(member.index(), false, out);
            }
        } else if (node instanceof Conditional conditional) {
            collect(conditional.test(), false, out);
            collect(conditional.consequent(), false, out);
            collect(conditional.alternate(), false, out);
        } else if (node instanceof EffectCall call) {
            call.arguments().forEach(argument -> collect(argument, false, out));
        } else if (node instanceof Assignment assignment) {
            collect(assignment.target(), false, out);
            collect(assignment.value(), false, out);
        }
    }
}
