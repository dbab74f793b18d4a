package com.deepansh.assistant.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum MemoryType {

    USER_PREFERENCE("user_preference"),
    USER_INFO("user_info"),
    TOPIC_INTEREST("topic_interest"),
    INTERACTION("interaction"),
    FACT("fact");

    private final String value;

    MemoryType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Lenient lookup by wire value or enum name; empty when unrecognized. */
    public static Optional<MemoryType> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim();
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(normalized) || t.name().equalsIgnoreCase(normalized))
                .findFirst();
    }

    @JsonCreator
    public static MemoryType fromValue(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown memory type: " + raw));
    }
}
