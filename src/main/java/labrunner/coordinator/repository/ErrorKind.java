package labrunner.coordinator.repository;

/**
 * Categories of task queue errors. Callers branch on the kind rather than on
 * exception types.
 */
public enum ErrorKind {
    /** Transport or storage failure talking to the queue */
    INFRA,
    /** The queue did not answer in time */
    TIMEOUT,
    /** The referenced task does not exist */
    NOT_FOUND
}
