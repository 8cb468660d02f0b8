package dev.visibility.cfp;

/**
 * Per-stage success flags. A stage the caller did not request reports true.
 */
public record PartialResults(
        boolean crawlSuccess,
        boolean fingerprintSuccess,
        boolean entityCreationSuccess,
        boolean publishSuccess) {

    public static PartialResults none() {
        return new PartialResults(false, false, false, false);
    }

    public boolean anySuccess() {
        return crawlSuccess || fingerprintSuccess || entityCreationSuccess || publishSuccess;
    }
}
