package com.vectorstore.dedup.similarity;

import com.vectorstore.dedup.core.TimestampParser;
import com.vectorstore.dedup.core.model.AttributeValue;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Scores the similarity of two values of the same attribute, between 0 and 100.
 *
 * <p>Strings get field-name-aware normalization before falling back to edit distance:</p>
 * <ul>
 *   <li>{@code url}/{@code link} fields ignore the query string (match scores 95)</li>
 *   <li>{@code file}/{@code name} fields compare the part before the first dot (match scores 90)</li>
 *   <li>{@code date}/{@code time} fields compare parsed instants (match scores 100)</li>
 * </ul>
 * <p>Numbers score by relative difference; structured values only match when their
 * canonical serializations are identical.</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
public class FieldComparator {

    /**
     * Field scores above this value count as a matching field.
     */
    public static final double MATCH_THRESHOLD = 80.0;

    static final double URL_MATCH_SCORE = 95.0;
    static final double FILE_NAME_MATCH_SCORE = 90.0;

    private final LevenshteinSimilarity levenshtein;

    public FieldComparator() {
        this(new LevenshteinSimilarity());
    }

    public FieldComparator(LevenshteinSimilarity levenshtein) {
        this.levenshtein = levenshtein;
    }

    /**
     * Compares two values of the named field. Absent values are passed as {@code null}
     * or {@link AttributeValue#NULL}.
     */
    public double compare(String fieldName, AttributeValue value1, AttributeValue value2) {
        AttributeValue v1 = value1 != null ? value1 : AttributeValue.NULL;
        AttributeValue v2 = value2 != null ? value2 : AttributeValue.NULL;

        if (v1.kind() == AttributeValue.Kind.STRUCTURED && v2.kind() == AttributeValue.Kind.STRUCTURED) {
            return compareStructured(v1, v2);
        }
        if (v1.equals(v2)) {
            return 100.0;
        }
        if (v1.isNull() || v2.isNull()) {
            return 0.0;
        }
        if (v1.kind() != v2.kind()) {
            return 0.0;
        }

        switch (v1.kind()) {
            case STRING:
                return compareStrings(fieldName, v1.asString(), v2.asString());
            case NUMBER:
                return compareNumbers(v1.asNumber(), v2.asNumber());
            default:
                return 0.0;
        }
    }

    double compareStrings(String fieldName, String s1, String s2) {
        if (s1.equals(s2)) {
            return 100.0;
        }
        String field = fieldName != null ? fieldName.toLowerCase(Locale.ROOT) : "";

        if (field.contains("url") || field.contains("link")) {
            if (beforeFirst(s1, '?').equals(beforeFirst(s2, '?'))) {
                return URL_MATCH_SCORE;
            }
        }

        if (field.contains("file") || field.contains("name")) {
            if (beforeFirst(s1, '.').equals(beforeFirst(s2, '.'))) {
                return FILE_NAME_MATCH_SCORE;
            }
        }

        if (field.contains("date") || field.contains("time")) {
            Optional<Instant> t1 = TimestampParser.parse(s1);
            Optional<Instant> t2 = TimestampParser.parse(s2);
            if (t1.isPresent() && t1.equals(t2)) {
                return 100.0;
            }
        }

        return levenshtein.score(s1, s2);
    }

    double compareNumbers(double n1, double n2) {
        if (n1 == n2) {
            return 100.0;
        }
        double diff = Math.abs(n1 - n2);
        double average = Math.abs((n1 + n2) / 2);
        if (average == 0.0) {
            return 0.0;
        }
        double percentDiff = (diff / average) * 100.0;
        return Math.max(0.0, 100.0 - percentDiff);
    }

    double compareStructured(AttributeValue v1, AttributeValue v2) {
        return CanonicalJson.serialize(v1).equals(CanonicalJson.serialize(v2)) ? 100.0 : 0.0;
    }

    private static String beforeFirst(String value, char delimiter) {
        int index = value.indexOf(delimiter);
        return index >= 0 ? value.substring(0, index) : value;
    }
}
