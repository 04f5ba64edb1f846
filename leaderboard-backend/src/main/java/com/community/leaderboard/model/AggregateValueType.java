package com.community.leaderboard.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Semantic kind of an {@link AggregateValue}. DURATION values are whole milliseconds.
 */
public enum AggregateValueType {

    DURATION("duration"),
    NUMBER("number"),
    STRING("string");

    private final String tag;

    AggregateValueType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static AggregateValueType fromTag(String tag) {
        for (AggregateValueType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown aggregate value type: " + tag);
    }
}
