package labrunner.coordinator.suite;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import labrunner.coordinator.model.SuiteMode;
import labrunner.coordinator.model.TestSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Suite description read from a JSON file: the already-resolved child tests
 * plus how to run them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SuiteRequest(
        @JsonProperty("suiteName") String suiteName,
        @JsonProperty("provision") boolean provision,
        @JsonProperty("provisionThreshold") int provisionThreshold,
        @JsonProperty("tests") List<TestEntry> tests) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * One child test. Omitted numbers fall back to the TestSpec defaults.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TestEntry(
            @JsonProperty("name") String name,
            @JsonProperty("build") String build,
            @JsonProperty("board") String board,
            @JsonProperty("model") String model,
            @JsonProperty("pool") String pool,
            @JsonProperty("botId") String botId,
            @JsonProperty("dutName") String dutName,
            @JsonProperty("priority") Integer priority,
            @JsonProperty("jobRetries") Integer jobRetries,
            @JsonProperty("expirationSecs") Long expirationSecs,
            @JsonProperty("clientTest") boolean clientTest,
            @JsonProperty("experimental") boolean experimental,
            @JsonProperty("dependencies") List<String> dependencies,
            @JsonProperty("keyvals") Map<String, String> keyvals) {

        TestSpec toSpec() {
            TestSpec.Builder builder = TestSpec.builder()
                    .testName(name)
                    .build(build)
                    .board(board)
                    .model(model)
                    .pool(pool)
                    .botId(botId)
                    .dutName(dutName)
                    .clientTest(clientTest)
                    .experimental(experimental)
                    .dependencies(dependencies != null ? dependencies : List.of());
            if (priority != null) {
                builder.priority(priority);
            }
            if (jobRetries != null) {
                builder.jobRetries(jobRetries);
            }
            if (expirationSecs != null) {
                builder.expirationSecs(expirationSecs);
            }
            if (keyvals != null) {
                keyvals.forEach(builder::keyval);
            }
            return builder.build();
        }
    }

    public static SuiteRequest fromJson(String json) {
        try {
            SuiteRequest request = MAPPER.readValue(json, SuiteRequest.class);
            request.validate();
            return request;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid suite request: " + e.getOriginalMessage(), e);
        }
    }

    public SuiteMode mode() {
        return provision ? SuiteMode.PROVISION : SuiteMode.NORMAL;
    }

    public List<TestSpec> specs() {
        List<TestSpec> specs = new ArrayList<>();
        for (TestEntry entry : tests) {
            specs.add(entry.toSpec());
        }
        return specs;
    }

    /** Validate the request */
    public void validate() {
        if (suiteName == null || suiteName.isBlank()) {
            throw new IllegalArgumentException("suiteName is required");
        }
        if (tests == null || tests.isEmpty()) {
            throw new IllegalArgumentException("tests must not be empty");
        }
        if (provisionThreshold < 0) {
            throw new IllegalArgumentException("provisionThreshold must not be negative");
        }
        for (TestEntry entry : tests) {
            if (entry.name() == null || entry.build() == null || entry.board() == null || entry.pool() == null) {
                throw new IllegalArgumentException("every test needs name, build, board and pool");
            }
            if (entry.jobRetries() != null && entry.jobRetries() < 0) {
                throw new IllegalArgumentException("jobRetries of " + entry.name() + " must not be negative");
            }
            if (provision && entry.botId() == null) {
                throw new IllegalArgumentException("provision test " + entry.name() + " needs a botId");
            }
        }
    }
}
