/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sorwood.internal.reader;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import dev.sorwood.row.Field;
import dev.sorwood.row.Row;
import dev.sorwood.schema.TypeRank;

/**
 * Splits a SoR line into its {@code <...>} delimited field bodies and classifies
 * each body into a {@link Field}.
 * <p>
 * Classification is an ordered cascade; the first matching rule wins:
 * </p>
 * <ol>
 *   <li>empty body: missing</li>
 *   <li>{@code 0} or {@code 1}, optionally followed by whitespace: BOOL</li>
 *   <li>optional sign, digits, optional trailing whitespace: INTEGER</li>
 *   <li>optional sign, digits and decimal points, optional trailing whitespace: FLOAT</li>
 *   <li>a quoted run of allowed characters (kept as is), or an unquoted run of
 *       allowed characters (wrapped in quotes): STRING</li>
 *   <li>anything else: missing</li>
 * </ol>
 * <p>
 * The FLOAT rule accepts several decimal points and a lone {@code "."}.
 * </p>
 * <p>
 * Every rank returned is promoted against the rank the column currently has,
 * so one tokenization serves both schema inference and schema checks.
 * This class is stateless.
 * </p>
 */
public final class RowTokenizer {

    /**
     * Characters allowed inside a field body, as a regex character class body:
     * ASCII letters, digits, whitespace and a fixed punctuation set.
     */
    static final String ALLOWED_CHARS = "A-Za-z0-9\\s.,;:!?'()\\[\\]{}_+*/=&%$#@~^|\\\\-";

    private static final Pattern FIELD = Pattern.compile("<(\"?[" + ALLOWED_CHARS + "]*\"?)>");

    private static final Pattern BOOL = Pattern.compile("[01]\\s*");
    private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+\\s*");
    private static final Pattern FLOAT = Pattern.compile("[+-]?[0-9.]+\\s*");
    private static final Pattern QUOTED_STRING = Pattern.compile("\"[" + ALLOWED_CHARS + "]*\"");
    private static final Pattern UNQUOTED_STRING = Pattern.compile("[" + ALLOWED_CHARS + "]+");

    private RowTokenizer() {
        // Utility class
    }

    /**
     * Returns the raw bodies of all fields of the given line, in source order.
     * The markers are stripped; the interior is kept verbatim.
     */
    public static List<String> extract(String line) {
        List<String> bodies = new ArrayList<>();
        Matcher matcher = FIELD.matcher(line);
        while (matcher.find()) {
            bodies.add(matcher.group(1));
        }
        return bodies;
    }

    /**
     * Classifies a single field body.
     *
     * @param body the field body, without markers
     * @param current the column's current rank; {@link TypeRank#BOOL} if the column is unknown
     * @return the classified field, its rank promoted against {@code current}
     */
    public static Field classify(String body, TypeRank current) {
        if (body.isEmpty()) {
            return Field.missing(current.promote(TypeRank.BOOL));
        }
        if (BOOL.matcher(body).matches()) {
            return Field.of(current.promote(TypeRank.BOOL), body);
        }
        if (INTEGER.matcher(body).matches()) {
            return Field.of(current.promote(TypeRank.INTEGER), body);
        }
        if (FLOAT.matcher(body).matches()) {
            return Field.of(current.promote(TypeRank.FLOAT), body);
        }
        if (QUOTED_STRING.matcher(body).matches()) {
            return Field.of(current.promote(TypeRank.STRING), body);
        }
        if (UNQUOTED_STRING.matcher(body).matches()) {
            return Field.of(current.promote(TypeRank.STRING), '"' + body + '"');
        }
        return Field.missing(current.promote(TypeRank.BOOL));
    }

    /**
     * Tokenizes and classifies a whole line.
     *
     * @param line the line, without its terminator
     * @param currentRanks the current rank per column index; must return
     *                     {@link TypeRank#BOOL} for columns it does not know
     */
    public static Row tokenize(String line, IntFunction<TypeRank> currentRanks) {
        List<String> bodies = extract(line);
        List<Field> fields = new ArrayList<>(bodies.size());
        for (int i = 0; i < bodies.size(); i++) {
            fields.add(classify(bodies.get(i), currentRanks.apply(i)));
        }
        return new Row(fields);
    }
}
