package labrunner.coordinator.model;

/**
 * Process exit codes of a suite run.
 */
public enum ReturnCode {
    OK(0),
    ERROR(1),
    WARNING(2),
    INFRA_FAILURE(3),
    SUITE_TIMEOUT(4);

    private final int exitCode;

    ReturnCode(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
