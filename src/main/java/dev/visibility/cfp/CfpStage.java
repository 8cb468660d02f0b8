package dev.visibility.cfp;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CfpStage {
    CRAWLING,
    FINGERPRINTING,
    CREATING_ENTITY,
    PUBLISHING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
