package labrunner.coordinator.suite;

import java.time.Duration;

/**
 * The suite wait deadline passed before the run finished.
 */
public class SuiteTimeoutException extends RuntimeException {

    private final String suiteId;
    private final int outstandingTasks;
    private final Duration timeout;

    public SuiteTimeoutException(String suiteId, int outstandingTasks, Duration timeout) {
        super("Suite " + suiteId + " timed out after " + timeout + " with " + outstandingTasks
                + " outstanding task(s)");
        this.suiteId = suiteId;
        this.outstandingTasks = outstandingTasks;
        this.timeout = timeout;
    }

    public String suiteId() {
        return suiteId;
    }

    public int outstandingTasks() {
        return outstandingTasks;
    }

    public Duration timeout() {
        return timeout;
    }
}
