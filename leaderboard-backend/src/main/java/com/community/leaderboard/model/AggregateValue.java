package com.community.leaderboard.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Tagged aggregate value, stored as {@code {"type": "...", "value": ...}}.
 * <p>
 * Only the factory methods create instances, so the payload always matches the tag:
 * DURATION holds a {@link Long} of whole milliseconds, NUMBER a {@link Number}, STRING a {@link String}.
 * A stored duration with a fractional part is rejected rather than truncated.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class AggregateValue {

    private final AggregateValueType type;
    private final Object value;

    private AggregateValue(AggregateValueType type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static AggregateValue duration(long millis) {
        return new AggregateValue(AggregateValueType.DURATION, millis);
    }

    public static AggregateValue number(Number number) {
        if (number == null) {
            throw new IllegalArgumentException("number aggregate value must not be null");
        }
        return new AggregateValue(AggregateValueType.NUMBER, number);
    }

    public static AggregateValue string(String text) {
        if (text == null) {
            throw new IllegalArgumentException("string aggregate value must not be null");
        }
        return new AggregateValue(AggregateValueType.STRING, text);
    }

    @JsonCreator
    public static AggregateValue of(@JsonProperty("type") AggregateValueType type,
                                    @JsonProperty("value") Object value) {
        if (type == null) {
            throw new IllegalArgumentException("aggregate value type is required");
        }
        switch (type) {
            case DURATION:
                if (!(value instanceof Number)) {
                    throw new IllegalArgumentException("duration aggregate value must be numeric: " + value);
                }
                return duration(wholeMillis((Number) value));
            case NUMBER:
                if (!(value instanceof Number)) {
                    throw new IllegalArgumentException("number aggregate value must be numeric: " + value);
                }
                return number((Number) value);
            case STRING:
                if (!(value instanceof String)) {
                    throw new IllegalArgumentException("string aggregate value must be text: " + value);
                }
                return string((String) value);
            default:
                throw new IllegalArgumentException("Unsupported aggregate value type: " + type);
        }
    }

    private static long wholeMillis(Number number) {
        try {
            return new BigDecimal(number.toString()).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("duration aggregate value must be whole milliseconds: " + number, e);
        }
    }

    public long asDurationMillis() {
        requireType(AggregateValueType.DURATION);
        return (Long) value;
    }

    public Number asNumber() {
        requireType(AggregateValueType.NUMBER);
        return (Number) value;
    }

    public String asString() {
        requireType(AggregateValueType.STRING);
        return (String) value;
    }

    private void requireType(AggregateValueType expected) {
        if (type != expected) {
            throw new IllegalStateException("Aggregate value is " + type.getTag() + ", not " + expected.getTag());
        }
    }
}
