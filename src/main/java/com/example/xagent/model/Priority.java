package com.example.xagent.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Priority of a requirement or task. Serialized as its lower-case code.
 */
public enum Priority {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient parse: unknown or missing values fall back to {@link #MEDIUM}. */
    @JsonCreator
    public static Priority fromCode(String code) {
        if (code == null || code.isBlank()) return MEDIUM;
        for (Priority p : values()) {
            if (p.code().equalsIgnoreCase(code.trim())) return p;
        }
        return MEDIUM;
    }
}
