package labrunner.coordinator.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Static description of one child test of a suite.
 */
public final class TestSpec {
    private final String testName;
    private final String build;
    private final String board;
    private final String model; // optional
    private final String pool;
    private final String botId; // set for provision suites, one spec per bot
    private final String dutName;
    private final int priority;
    private final long executionTimeoutSecs;
    private final long ioTimeoutSecs;
    private final long expirationSecs;
    private final long gracePeriodSecs;
    private final int jobRetries;
    private final boolean clientTest;
    private final boolean experimental;
    private final List<String> dependencies;
    private final Map<String, String> keyvals;
    private final String quotaAccount;

    private TestSpec(Builder builder) {
        this.testName = Objects.requireNonNull(builder.testName, "testName is required");
        this.build = Objects.requireNonNull(builder.build, "build is required");
        this.board = Objects.requireNonNull(builder.board, "board is required");
        this.model = builder.model;
        this.pool = Objects.requireNonNull(builder.pool, "pool is required");
        this.botId = builder.botId;
        this.dutName = builder.dutName;
        this.priority = builder.priority;
        this.executionTimeoutSecs = builder.executionTimeoutSecs;
        this.ioTimeoutSecs = builder.ioTimeoutSecs;
        this.expirationSecs = builder.expirationSecs;
        this.gracePeriodSecs = builder.gracePeriodSecs;
        if (builder.jobRetries < 0) {
            throw new IllegalArgumentException("jobRetries must not be negative");
        }
        this.jobRetries = builder.jobRetries;
        this.clientTest = builder.clientTest;
        this.experimental = builder.experimental;
        this.dependencies = List.copyOf(builder.dependencies);
        this.keyvals = Map.copyOf(builder.keyvals);
        this.quotaAccount = builder.quotaAccount;
    }

    public String testName() {
        return testName;
    }

    public String build() {
        return build;
    }

    public String board() {
        return board;
    }

    public String model() {
        return model;
    }

    public String pool() {
        return pool;
    }

    public String botId() {
        return botId;
    }

    public String dutName() {
        return dutName;
    }

    public int priority() {
        return priority;
    }

    public long executionTimeoutSecs() {
        return executionTimeoutSecs;
    }

    public long ioTimeoutSecs() {
        return ioTimeoutSecs;
    }

    public long expirationSecs() {
        return expirationSecs;
    }

    public long gracePeriodSecs() {
        return gracePeriodSecs;
    }

    /** Total attempts allowed for this test, the first run included. */
    public int jobRetries() {
        return jobRetries;
    }

    public boolean clientTest() {
        return clientTest;
    }

    public boolean experimental() {
        return experimental;
    }

    public List<String> dependencies() {
        return dependencies;
    }

    public Map<String, String> keyvals() {
        return keyvals;
    }

    public String quotaAccount() {
        return quotaAccount;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String testName;
        private String build;
        private String board;
        private String model;
        private String pool;
        private String botId;
        private String dutName;
        private int priority = 140;
        private long executionTimeoutSecs = 3600;
        private long ioTimeoutSecs = 3600;
        private long expirationSecs = 3600;
        private long gracePeriodSecs = 300;
        private int jobRetries = 1;
        private boolean clientTest;
        private boolean experimental;
        private List<String> dependencies = List.of();
        private final Map<String, String> keyvals = new LinkedHashMap<>();
        private String quotaAccount;

        public Builder testName(String testName) {
            this.testName = testName;
            return this;
        }

        public Builder build(String build) {
            this.build = build;
            return this;
        }

        public Builder board(String board) {
            this.board = board;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder pool(String pool) {
            this.pool = pool;
            return this;
        }

        public Builder botId(String botId) {
            this.botId = botId;
            return this;
        }

        public Builder dutName(String dutName) {
            this.dutName = dutName;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder executionTimeoutSecs(long executionTimeoutSecs) {
            this.executionTimeoutSecs = executionTimeoutSecs;
            return this;
        }

        public Builder ioTimeoutSecs(long ioTimeoutSecs) {
            this.ioTimeoutSecs = ioTimeoutSecs;
            return this;
        }

        public Builder expirationSecs(long expirationSecs) {
            this.expirationSecs = expirationSecs;
            return this;
        }

        public Builder gracePeriodSecs(long gracePeriodSecs) {
            this.gracePeriodSecs = gracePeriodSecs;
            return this;
        }

        public Builder jobRetries(int jobRetries) {
            this.jobRetries = jobRetries;
            return this;
        }

        public Builder clientTest(boolean clientTest) {
            this.clientTest = clientTest;
            return this;
        }

        public Builder experimental(boolean experimental) {
            this.experimental = experimental;
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public Builder keyval(String key, String value) {
            this.keyvals.put(key, value);
            return this;
        }

        public Builder quotaAccount(String quotaAccount) {
            this.quotaAccount = quotaAccount;
            return this;
        }

        public TestSpec build() {
            return new TestSpec(this);
        }
    }

    @Override
    public String toString() {
        return "TestSpec{testName='" + testName + "', build='" + build + "', board='" + board
                + "', pool='" + pool + "', jobRetries=" + jobRetries + "}";
    }
}
