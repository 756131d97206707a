package labrunner.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Final outcome of one logical child test, retries folded in.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChildTestResult(
        @JsonProperty("testName") String testName,
        @JsonProperty("dutName") String dutName,
        @JsonProperty("state") String state,
        @JsonProperty("retryCount") int retryCount,
        @JsonProperty("taskIds") List<String> taskIds) {

    public ChildTestResult {
        taskIds = List.copyOf(taskIds);
    }

    public boolean passed() {
        return Task.COMPLETED_SUCCESS.equals(state);
    }

    /** Ended without success. Tests still pending or running are neither passed nor failed. */
    public boolean failed() {
        return !passed() && !TaskState.PENDING.name().equals(state) && !TaskState.RUNNING.name().equals(state);
    }

    /** Name shown in reports, suffixed with the DUT for provision suites. */
    public String displayName() {
        return dutName == null || dutName.isBlank() ? testName : testName + "-" + dutName;
    }
}
