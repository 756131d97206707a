package labrunner.coordinator.repository;

import java.util.Objects;

/**
 * Failure of a task queue operation. Never used to report a test result.
 */
public class TaskQueueException extends RuntimeException {

    private final ErrorKind kind;

    public TaskQueueException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind is required");
    }

    public TaskQueueException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind is required");
    }

    public ErrorKind kind() {
        return kind;
    }

    @Override
    public String toString() {
        return "TaskQueueException{kind=" + kind + ", message='" + getMessage() + "'}";
    }
}
