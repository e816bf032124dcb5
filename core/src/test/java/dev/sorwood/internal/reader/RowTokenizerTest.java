/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sorwood.internal.reader;

import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import dev.sorwood.row.Field;
import dev.sorwood.row.Row;
import dev.sorwood.schema.TypeRank;

import static org.assertj.core.api.Assertions.assertThat;

public class RowTokenizerTest {

    // ==================== Extraction ====================

    @Test
    void testExtractKeepsSourceOrder() {
        assertThat(RowTokenizer.extract("<1><hello><\"wor ld\"><-3>"))
                .containsExactly("1", "hello", "\"wor ld\"", "-3");
    }

    @Test
    void testExtractKeepsInteriorWhitespace() {
        assertThat(RowTokenizer.extract("<  padded  > <1 >")).containsExactly("  padded  ", "1 ");
    }

    @Test
    void testExtractIgnoresTextOutsideMarkers() {
        assertThat(RowTokenizer.extract("id=<7>, name=<bob> # trailing")).containsExactly("7", "bob");
        assertThat(RowTokenizer.extract("no fields here")).isEmpty();
        assertThat(RowTokenizer.extract("")).isEmpty();
    }

    @Test
    void testExtractSkipsBodiesWithDisallowedCharacters() {
        assertThat(RowTokenizer.extract("<a<b>")).containsExactly("b");
        assertThat(RowTokenizer.extract("<café><ok>")).containsExactly("ok");
        assertThat(RowTokenizer.extract("<a\"b><c>")).containsExactly("c");
    }

    @Test
    void testExtractEmptyAndQuotedBodies() {
        assertThat(RowTokenizer.extract("<><\"\"><\"x>")).containsExactly("", "\"\"", "\"x");
    }

    // ==================== Classification ====================

    static Stream<Arguments> classifications() {
        return Stream.of(
                Arguments.of("0", TypeRank.BOOL, "0"),
                Arguments.of("1", TypeRank.BOOL, "1"),
                Arguments.of("1  ", TypeRank.BOOL, "1  "),
                Arguments.of("01", TypeRank.INTEGER, "01"),
                Arguments.of("2", TypeRank.INTEGER, "2"),
                Arguments.of("+12", TypeRank.INTEGER, "+12"),
                Arguments.of("-3 ", TypeRank.INTEGER, "-3 "),
                Arguments.of("1.5", TypeRank.FLOAT, "1.5"),
                Arguments.of("-.5", TypeRank.FLOAT, "-.5"),
                Arguments.of("1.2.3", TypeRank.FLOAT, "1.2.3"),
                Arguments.of(".", TypeRank.FLOAT, "."),
                Arguments.of("hello", TypeRank.STRING, "\"hello\""),
                Arguments.of("x y", TypeRank.STRING, "\"x y\""),
                Arguments.of(" 1", TypeRank.STRING, "\" 1\""),
                Arguments.of("1e5", TypeRank.STRING, "\"1e5\""),
                Arguments.of("1-2", TypeRank.STRING, "\"1-2\""),
                Arguments.of("\"wor ld\"", TypeRank.STRING, "\"wor ld\""),
                Arguments.of("\"\"", TypeRank.STRING, "\"\""));
    }

    @ParameterizedTest
    @MethodSource("classifications")
    void testClassify(String body, TypeRank expectedRank, String expectedValue) {
        Field field = RowTokenizer.classify(body, TypeRank.BOOL);

        assertThat(field.missing()).isFalse();
        assertThat(field.rank()).isEqualTo(expectedRank);
        assertThat(field.value()).isEqualTo(expectedValue);
    }

    @Test
    void testEmptyBodyIsMissing() {
        Field field = RowTokenizer.classify("", TypeRank.BOOL);

        assertThat(field.missing()).isTrue();
        assertThat(field.value()).isEmpty();
        assertThat(field.rank()).isEqualTo(TypeRank.BOOL);
    }

    @Test
    void testUnbalancedQuoteIsMissing() {
        assertThat(RowTokenizer.classify("\"abc", TypeRank.BOOL).missing()).isTrue();
        assertThat(RowTokenizer.classify("abc\"", TypeRank.BOOL).missing()).isTrue();
    }

    @Test
    void testQuotedEmptyStringIsNotMissing() {
        Field field = RowTokenizer.classify("\"\"", TypeRank.BOOL);

        assertThat(field.missing()).isFalse();
        assertThat(field.value()).isEqualTo("\"\"");
    }

    @Test
    void testRankIsPromotedAgainstCurrentRank() {
        assertThat(RowTokenizer.classify("1", TypeRank.INTEGER).rank()).isEqualTo(TypeRank.INTEGER);
        assertThat(RowTokenizer.classify("1", TypeRank.STRING).rank()).isEqualTo(TypeRank.STRING);
        assertThat(RowTokenizer.classify("abc", TypeRank.INTEGER).rank()).isEqualTo(TypeRank.STRING);
        assertThat(RowTokenizer.classify("", TypeRank.FLOAT).rank()).isEqualTo(TypeRank.FLOAT);
        assertThat(RowTokenizer.classify("\"x", TypeRank.INTEGER).rank()).isEqualTo(TypeRank.INTEGER);
    }

    // ==================== Tokenization ====================

    @Test
    void testTokenizeYieldsOneFieldPerMarkerPair() {
        Row row = RowTokenizer.tokenize("<1><hello><\"wor ld\"><><2.5>", i -> TypeRank.BOOL);

        assertThat(row.getFieldCount()).isEqualTo(5);
        assertThat(row.fields()).extracting(Field::rank)
                .containsExactly(TypeRank.BOOL, TypeRank.STRING, TypeRank.STRING, TypeRank.BOOL, TypeRank.FLOAT);
        assertThat(row.getValue(1)).isEqualTo("\"hello\"");
        assertThat(row.isMissing(3)).isTrue();
        assertThat(row.isMissing(5)).isTrue();
    }

    @Test
    void testTokenizeUsesPerColumnRanks() {
        TypeRank[] current = { TypeRank.INTEGER, TypeRank.BOOL };
        Row row = RowTokenizer.tokenize("<1><1><1>", i -> i < current.length ? current[i] : TypeRank.BOOL);

        assertThat(row.fields()).extracting(Field::rank)
                .containsExactly(TypeRank.INTEGER, TypeRank.BOOL, TypeRank.BOOL);
    }

    @Test
    void testTokenizeIsIdempotent() {
        String line = "<0><  a b  ><\"q\"><-1.0><>";

        Row first = RowTokenizer.tokenize(line, i -> TypeRank.BOOL);
        Row second = RowTokenizer.tokenize(line, i -> TypeRank.BOOL);

        assertThat(second).isEqualTo(first);
    }
}
