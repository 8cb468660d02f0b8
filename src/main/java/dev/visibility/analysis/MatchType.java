package dev.visibility.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MatchType {
    EXACT,
    PARTIAL,
    CONTEXTUAL,
    NONE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
