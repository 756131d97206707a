package labrunner.coordinator.model;

/**
 * State of a dispatched task as reported by the task queue.
 */
public enum TaskState {
    /** Waiting for a bot to pick it up */
    PENDING,
    /** Picked up by a bot and executing */
    RUNNING,
    /** Payload ran to the end; check the failure flag for its verdict */
    COMPLETED,
    /** Bot died or no resource could run it */
    FAILED_INFRA,
    /** Nobody picked it up before its expiration */
    EXPIRED,
    /** Cancelled or killed by timeout */
    KILLED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    /** Terminal states that never ran the payload to completion. */
    public boolean isInfraFailure() {
        return this == FAILED_INFRA || this == EXPIRED || this == KILLED;
    }
}
