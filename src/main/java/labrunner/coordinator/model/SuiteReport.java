package labrunner.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Summary of a finished (or timed out) suite run.
 */
public record SuiteReport(
        @JsonProperty("suiteName") String suiteName,
        @JsonProperty("suiteId") String suiteId,
        @JsonProperty("state") String state,
        @JsonProperty("returnCode") ReturnCode returnCode,
        @JsonProperty("results") List<ChildTestResult> results,
        @JsonProperty("provisionedDuts") List<String> provisionedDuts,
        @JsonProperty("outstandingCount") int outstandingCount) {

    /** Suite state used when the wait deadline passed. */
    public static final String TIMED_OUT = "TIMED_OUT";

    public SuiteReport {
        results = List.copyOf(results);
        provisionedDuts = List.copyOf(provisionedDuts);
        if (outstandingCount < 0) {
            throw new IllegalArgumentException("outstandingCount must not be negative");
        }
    }

    @JsonIgnore
    public long passedCount() {
        return results.stream().filter(ChildTestResult::passed).count();
    }

    /** Tests that ended unsuccessfully. Unfinished tests are in {@link #outstandingCount()}. */
    @JsonIgnore
    public long failedCount() {
        return results.stream().filter(ChildTestResult::failed).count();
    }

    @JsonIgnore
    public boolean timedOut() {
        return returnCode == ReturnCode.SUITE_TIMEOUT;
    }
}
