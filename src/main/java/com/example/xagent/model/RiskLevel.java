package com.example.xagent.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
