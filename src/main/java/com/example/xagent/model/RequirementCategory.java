package com.example.xagent.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Requirement category. Anything that is not explicitly non-functional is functional.
 */
public enum RequirementCategory {
    FUNCTIONAL("functional"),
    NON_FUNCTIONAL("non-functional");

    private final String code;

    RequirementCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static RequirementCategory fromCode(String code) {
        if (code != null && NON_FUNCTIONAL.code.equalsIgnoreCase(code.trim())) {
            return NON_FUNCTIONAL;
        }
        return FUNCTIONAL;
    }
}
