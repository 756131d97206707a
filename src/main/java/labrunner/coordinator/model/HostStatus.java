package labrunner.coordinator.model;

/**
 * Lab host status.
 */
public enum HostStatus {
    READY,
    RUNNING,
    VERIFYING,
    PROVISIONING,
    CLEANING,
    REPAIRING,
    REPAIR_FAILED;

    /** Only READY hosts may be handed out or released back to the pool. */
    public boolean isHealthy() {
        return this == READY;
    }
}
