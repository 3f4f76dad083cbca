package io.scopebind.core.expression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.scopebind.core.error.ExpressionParseException;
import io.scopebind.core.error.UnknownIdentifierException;
import io.scopebind.core.expression.ExpressionNode.Assignment;
import io.scopebind.core.expression.ExpressionNode.ObjectLiteral;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Tests for {@link ExpressionValidator}: grammar restrictions, identifier policy and normalization. */
class ExpressionValidatorTest {

    private final ExpressionValidator validator = new ExpressionValidator(ExpressionLimits.DEFAULT, Set.of("setState"));

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        void identityPolicyKeepsTextUnchanged() {
            String text = "a +  1 /* note */ ? `x${ b }` : { c, d: [1, 2] }";

            assertThat(validator.validate(text, ValidateOptions.defaults())).isEqualTo(text);
        }

        @Test
        void substitutesOnlyIdentifierSpans() {
            IdentifierPolicy rename = identifier -> identifier.equals("a") ? "renamed" : identifier;

            String normalized = validator.validate("a + a.a + obj['a'] + { a: a }", ValidateOptions.defaults().withIdentifiers(rename));

            assertThat(normalized).isEqualTo("renamed + renamed.a + obj['a'] + { a: renamed }");
        }

        @Test
        void expandsRenamedShorthandProperty() {
            IdentifierPolicy rename = identifier -> identifier + "2";

            assertThat(validator.validate("{ a, b: 1 }", ValidateOptions.defaults().withIdentifiers(rename)))
                    .isEqualTo("{ a: a2, b: 1 }");
        }

        @Test
        void normalizingTwiceIsANoOp() {
            String id = "V1St-GX";
            IdentifierPolicy toEncoded = identifier -> identifier.equals("count") ? VariableIdentifiers.encode(id) : identifier;

            String once = validator.validate("{ count } ?? count + 1", ValidateOptions.defaults().withIdentifiers(toEncoded));
            String twice = validator.validate(once, ValidateOptions.defaults().withIdentifiers(toEncoded));

            assertThat(twice).isEqualTo(once);
        }

        @Test
        void policyReturningInvalidIdentifierFails() {
            IdentifierPolicy broken = identifier -> "not an identifier";

            assertThatThrownBy(() -> validator.validate("a", ValidateOptions.defaults().withIdentifiers(broken)))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Identifier policy")
    class Policy {

        @Test
        void isCalledOncePerReferenceInSourceOrder() {
            List<String> seen = new ArrayList<>();

            ParsedExpression parsed =
                    validator.parse("b + a + b + x.y + `${c}`", ValidateOptions.defaults().withIdentifiers(IdentifierPolicy.collecting(seen)));

            assertThat(seen).containsExactly("b", "a", "b", "x", "c");
            assertThat(parsed.identifiers()).containsExactly("b", "a", "x", "c");
        }

        @Test
        void memberNamesAndObjectKeysAreNotReferences() {
            List<String> seen = new ArrayList<>();

            validator.validate("{ key: 1 }.key", ValidateOptions.defaults().withIdentifiers(IdentifierPolicy.collecting(seen)));

            assertThat(seen).isEmpty();
        }

        @Test
        void collectsOnlyEncodedVariableIds() {
            List<String> ids = new ArrayList<>();
            String text = VariableIdentifiers.encode("v-1") + " + plain + " + VariableIdentifiers.encode("v_2");

            validator.validate(text, ValidateOptions.defaults().withIdentifiers(IdentifierPolicy.collectingVariableIds(ids)));

            assertThat(ids).containsExactly("v-1", "v_2");
        }

        @Test
        void allowListRejectsUnknownIdentifier() {
            ValidateOptions options = ValidateOptions.defaults().withIdentifiers(IdentifierPolicy.allowOnly(Set.of("x")));

            assertThatThrownBy(() -> validator.validate("x + y", options))
                    .isInstanceOfSatisfying(UnknownIdentifierException.class, e -> {
                        assertThat(e.identifier()).isEqualTo("y");
                        assertThat(e.expression()).isEqualTo("x + y");
                    })
                    .hasMessage("Unknown variable \"y\"");
        }

        @Test
        void undefinedIsAnIdentifier() {
            List<String> seen = new ArrayList<>();

            validator.validate("undefined ?? NaN", ValidateOptions.defaults().withIdentifiers(IdentifierPolicy.collecting(seen)));

            assertThat(seen).containsExactly("undefined", "NaN");
        }
    }

    @Nested
    @DisplayName("Grammar")
    class Grammar {

        @Test
        void braceTextParsesAsObjectLiteral() {
            ParsedExpression parsed = validator.parse("{}", ValidateOptions.defaults());

            assertThat(parsed.root()).isInstanceOfSatisfying(ObjectLiteral.class, object -> assertThat(object.properties()).isEmpty());
        }

        @Test
        void emptyTextIsValidWhenOptional() {
            ParsedExpression parsed = validator.parse("   ", ValidateOptions.defaults().asOptional());

            assertThat(parsed.isEmpty()).isTrue();
            assertThat(parsed.text()).isEqualTo("   ");
        }

        @Test
        void emptyTextIsRejectedWhenRequired() {
            assertThatThrownBy(() -> validator.validate("", ValidateOptions.defaults()))
                    .isInstanceOf(ExpressionParseException.class)
                    .hasMessageStartingWith("Expression cannot be empty");
        }

        @ParameterizedTest(name = "{0}")
        @CsvSource(
                delimiter = '|',
                value = {
                    "a = 1                | Assignment is supported only inside actions",
                    "x => x               | Functions are not supported",
                    "f()                  | Functions are not supported",
                    "a.b()                | Functions are not supported",
                    "function f() {}      | Functions are not supported",
                    "new Date             | Classes are not supported",
                    "for                  | Loops are not supported",
                    "a++                  | Increment and decrement are not supported",
                    "--a                  | Increment and decrement are not supported",
                    "1, 2                 | Only single expression is supported",
                    "1; 2                 | Only single expression is supported",
                    "[1, , 2]             | Array holes are not supported",
                    "[...a]               | Spread syntax is not supported",
                    "{ [k]: 1 }           | Computed keys are not supported",
                    "a & b                | Bitwise operators are not supported",
                    "tag`x`               | Tagged template is not supported",
                    "010                  | Legacy octal literals are not supported",
                    "/ab/                 | Regular expressions are not supported"
                })
        void rejectsDisallowedConstructs(String text, String message) {
            assertThatThrownBy(() -> validator.validate(text, ValidateOptions.defaults()))
                    .isInstanceOf(ExpressionParseException.class)
                    .hasMessageStartingWith(message);
        }

        @Test
        void parseErrorCarriesPosition() {
            assertThatThrownBy(() -> validator.validate("a = 1", ValidateOptions.defaults()))
                    .isInstanceOfSatisfying(ExpressionParseException.class, e -> {
                        assertThat(e.position()).isEqualTo(2);
                        assertThat(e.expression()).isEqualTo("a = 1");
                    });
        }
    }

    @Nested
    @DisplayName("Effectful mode")
    class Effectful {

        @Test
        void allowsAssignmentToIdentifier() {
            List<String> seen = new ArrayList<>();

            ParsedExpression parsed = validator.parse(
                    "count = count + 1",
                    ValidateOptions.defaults().asEffectful().withIdentifiers(IdentifierPolicy.collecting(seen)));

            assertThat(parsed.root()).isInstanceOf(Assignment.class);
            assertThat(seen).containsExactly("count", "count");
        }

        @Test
        void rejectsAssignmentToMember() {
            assertThatThrownBy(() -> validator.validate("a.b = 1", ValidateOptions.defaults().asEffectful()))
                    .isInstanceOf(ExpressionParseException.class)
                    .hasMessageStartingWith("Only variables can be assigned");
        }

        @Test
        void allowsWhitelistedEffectCallWithoutReportingCallee() {
            List<String> seen = new ArrayList<>();

            validator.validate(
                    "setState(value)",
                    ValidateOptions.defaults().asEffectful().withIdentifiers(IdentifierPolicy.collecting(seen)));

            assertThat(seen).containsExactly("value");
        }

        @Test
        void rejectsCallsOutsideWhitelist() {
            assertThatThrownBy(() -> validator.validate("fetch(url)", ValidateOptions.defaults().asEffectful()))
                    .isInstanceOf(ExpressionParseException.class)
                    .hasMessageStartingWith("Functions are not supported");
        }

        @Test
        void rejectsEffectCallOutsideActions() {
            assertThatThrownBy(() -> validator.validate("setState(1)", ValidateOptions.defaults()))
                    .isInstanceOf(ExpressionParseException.class)
                    .hasMessageStartingWith("Functions are not supported");
        }
    }

    @Nested
    @DisplayName("Limits")
    class Limits {

        @Test
        void rejectsTooLongText() {
            ExpressionValidator small = new ExpressionValidator(new ExpressionLimits(5, 64), Set.of());

            assertThatThrownBy(() -> small.validate("123456", ValidateOptions.defaults()))
                    .isInstanceOf(ExpressionParseException.class)
                    .hasMessageContaining("exceeds 5 characters");
        }

        @Test
        void rejectsTooDeepNesting() {
            ExpressionValidator shallow = new ExpressionValidator(new ExpressionLimits(1000, 4), Set.of());

            assertThatThrownBy(() -> shallow.validate("[[[[[[1]]]]]]", ValidateOptions.defaults()))
                    .isInstanceOf(ExpressionParseException.class)
                    .hasMessageStartingWith("Expression is nested too deeply");
        }
    }
}
