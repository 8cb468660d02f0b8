package dev.visibility.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Sentiment {
    POSITIVE(1.0),
    NEUTRAL(0.5),
    NEGATIVE(0.0);

    private final double weight;

    Sentiment(double weight) {
        this.weight = weight;
    }

    /**
     * Contribution to an averaged sentiment score: positive=1, neutral=0.5, negative=0.
     */
    public double weight() {
        return weight;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
