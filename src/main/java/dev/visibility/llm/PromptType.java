package dev.visibility.llm;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PromptType {
    FACTUAL(0.3),
    OPINION(0.5),
    RECOMMENDATION(0.7);

    private final double defaultTemperature;

    PromptType(double defaultTemperature) {
        this.defaultTemperature = defaultTemperature;
    }

    public double defaultTemperature() {
        return defaultTemperature;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
