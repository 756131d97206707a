package labrunner.coordinator.model;

/**
 * How a suite decides it is done.
 */
public enum SuiteMode {
    /** Wait until every child test is finished and nothing is being retried */
    NORMAL,
    /** Stop as soon as enough distinct bots have provisioned successfully */
    PROVISION
}
