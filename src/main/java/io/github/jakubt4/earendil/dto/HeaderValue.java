package io.github.jakubt4.earendil.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.Locale;

/**
 * Value of a header keyword: an integer, a float, a string, or nothing (comment-only records).
 *
 * <p>Serialised with a {@code type} tag next to the typed value field:
 * <pre>
 *   {"type":"FLOAT","floatValue":51.5}
 *   {"type":"INTEGER","intValue":2048}
 *   {"type":"STRING","stringValue":"RA---TAN"}
 *   {"type":"ABSENT"}
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(HeaderValue.IntegerValue.class),
        @JsonSubTypes.Type(HeaderValue.FloatValue.class),
        @JsonSubTypes.Type(HeaderValue.StringValue.class),
        @JsonSubTypes.Type(HeaderValue.Absent.class)
})
public sealed interface HeaderValue {

    /** Value field text in FITS fixed format, empty for {@link Absent}. */
    String fitsValue();

    static HeaderValue ofInteger(final long value) {
        return new IntegerValue(value);
    }

    static HeaderValue ofFloat(final double value) {
        return new FloatValue(value);
    }

    static HeaderValue ofString(final String value) {
        return new StringValue(value);
    }

    static HeaderValue absent() {
        return new Absent();
    }

    @JsonTypeName("INTEGER")
    record IntegerValue(long intValue) implements HeaderValue {

        @Override
        public String fitsValue() {
            return Long.toString(intValue);
        }
    }

    @JsonTypeName("FLOAT")
    record FloatValue(double floatValue) implements HeaderValue {

        @Override
        public String fitsValue() {
            return String.format(Locale.ROOT, "%.13G", floatValue);
        }
    }

    @JsonTypeName("STRING")
    record StringValue(String stringValue) implements HeaderValue {

        public StringValue {
            if (stringValue == null) {
                throw new IllegalArgumentException("String header value must not be null, use Absent");
            }
        }

        @Override
        public String fitsValue() {
            final var padded = String.format("%-8s", stringValue.replace("'", "''"));
            return "'" + padded + "'";
        }
    }

    @JsonTypeName("ABSENT")
    record Absent() implements HeaderValue {

        @Override
        public String fitsValue() {
            return "";
        }
    }
}
