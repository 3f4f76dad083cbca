package io.scopebind.core.expression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link VariableIdentifiers}. */
class VariableIdentifiersTest {

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"abc", "V1StGXR8_Z5jdHi6B-myT", "a_b__c", "_", "-", "0", "ünï-cødé", "a b", "x😀y"})
    @DisplayName("decode(encode(id)) returns the id")
    void roundTrips(String id) {
        String identifier = VariableIdentifiers.encode(id);

        assertThat(VariableIdentifiers.decode(identifier)).contains(id);
        assertThat(VariableIdentifiers.isVariableIdentifier(identifier)).isTrue();
    }

    @Test
    void encodedIdentifierIsALegalIdentifier() {
        String identifier = VariableIdentifiers.encode("V1St-GX.R8 z");

        assertThat(identifier).startsWith(VariableIdentifiers.PREFIX);
        assertThat(ExpressionLexer.isIdentifierStart(identifier.charAt(0))).isTrue();
        assertThat(identifier.chars().allMatch(c -> ExpressionLexer.isIdentifierPart((char) c)))
                .isTrue();
    }

    @Test
    void escapesAreLowercaseHex() {
        assertThat(VariableIdentifiers.encode("a-b_c")).isEqualTo("$ws$dataSource$a_002db__c");
    }

    @Test
    void distinctIdsNeverCollide() {
        assertThat(VariableIdentifiers.encode("a_b")).isNotEqualTo(VariableIdentifiers.encode("a-b"));
        assertThat(VariableIdentifiers.encode("a__b")).isNotEqualTo(VariableIdentifiers.encode("a_b"));
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(
            strings = {
                "count",
                "$ws$data",
                "$ws$dataSource$",
                "$ws$dataSource$a_",
                "$ws$dataSource$a_00",
                "$ws$dataSource$a_002D",
                "$ws$dataSource$a_0061",
                "$ws$dataSource$a_005f",
                "$ws$dataSource$a$b",
                "$ws$dataSource$a_zzzz"
            })
    @DisplayName("identifiers outside the canonical encoding decode to empty")
    void rejectsNonMatchingIdentifiers(String identifier) {
        assertThat(VariableIdentifiers.decode(identifier)).isEmpty();
    }

    @Test
    void emptyIdIsRejected() {
        assertThatThrownBy(() -> VariableIdentifiers.encode("")).isInstanceOf(IllegalArgumentException.class);
    }
}
