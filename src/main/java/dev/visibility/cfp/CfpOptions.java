package dev.visibility.cfp;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Per-run switches. Null {@code publishToProduction}, {@code requireFingerprint}
 * and {@code timeout} fall back to the 'cfp' configuration.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class CfpOptions {

    @Builder.Default
    private final boolean includeFingerprint = true;

    @Builder.Default
    private final boolean buildEntity = true;

    private final boolean publish;

    private final Boolean publishToProduction;

    private final Boolean requireFingerprint;

    private final Duration timeout;

    /**
     * Compute and store the next due date from the business tier after a successful crawl.
     */
    private final boolean scheduleNext;

    public static CfpOptions defaults() {
        return CfpOptions.builder().build();
    }
}
