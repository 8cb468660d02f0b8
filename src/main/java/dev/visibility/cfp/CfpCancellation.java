package dev.visibility.cfp;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one CFP run. Checked between stages only;
 * an in-flight request always completes or times out on its own.
 */
public class CfpCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
