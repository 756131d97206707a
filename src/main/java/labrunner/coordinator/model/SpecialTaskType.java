package labrunner.coordinator.model;

/**
 * Kinds of maintenance work that run against a single host.
 */
public enum SpecialTaskType {
    VERIFY,
    CLEANUP,
    RESET,
    REPAIR,
    PROVISION
}
