package dev.visibility.cfp;

/**
 * Receives stage transitions of a CFP run. Invoked synchronously at stage boundaries,
 * so implementations must return quickly.
 */
@FunctionalInterface
public interface CfpProgressListener {

    CfpProgressListener NOOP = (stage, progressPercent, message) -> {
    };

    void onStageTransition(CfpStage stage, int progressPercent, String message);
}
