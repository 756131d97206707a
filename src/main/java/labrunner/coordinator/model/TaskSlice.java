package labrunner.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * One scheduling alternative of a task request: the command to run, the bot
 * dimensions it needs, and how long to wait for such a bot before falling
 * through to the next slice.
 */
public record TaskSlice(
        @JsonProperty("command") List<String> command,
        @JsonProperty("dimensions") Map<String, String> dimensions,
        @JsonProperty("expirationSecs") long expirationSecs) {

    public TaskSlice {
        command = List.copyOf(command);
        dimensions = Map.copyOf(dimensions);
        if (expirationSecs < 0) {
            throw new IllegalArgumentException("expirationSecs must not be negative");
        }
    }
}
