package labrunner.coordinator.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything the task queue needs to create one task.
 */
public final class TaskRequest {
    private final String name;
    private final List<TaskSlice> slices;
    private final List<String> tags;
    private final String user;
    private final String parentId;
    private final int priority;
    private final long executionTimeoutSecs;
    private final long ioTimeoutSecs;
    private final long gracePeriodSecs;

    private TaskRequest(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name is required");
        if (builder.slices.isEmpty()) {
            throw new IllegalArgumentException("at least one slice is required");
        }
        this.slices = List.copyOf(builder.slices);
        this.tags = List.copyOf(builder.tags);
        this.user = builder.user;
        this.parentId = builder.parentId;
        this.priority = builder.priority;
        this.executionTimeoutSecs = builder.executionTimeoutSecs;
        this.ioTimeoutSecs = builder.ioTimeoutSecs;
        this.gracePeriodSecs = builder.gracePeriodSecs;
    }

    public String name() {
        return name;
    }

    public List<TaskSlice> slices() {
        return slices;
    }

    public List<String> tags() {
        return tags;
    }

    public String user() {
        return user;
    }

    public String parentId() {
        return parentId;
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

    public long gracePeriodSecs() {
        return gracePeriodSecs;
    }

    /** Sum of the expiration of all slices. */
    public long totalExpirationSecs() {
        return slices.stream().mapToLong(TaskSlice::expirationSecs).sum();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private final List<TaskSlice> slices = new ArrayList<>();
        private final List<String> tags = new ArrayList<>();
        private String user;
        private String parentId;
        private int priority;
        private long executionTimeoutSecs;
        private long ioTimeoutSecs;
        private long gracePeriodSecs;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder slice(TaskSlice slice) {
            this.slices.add(slice);
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
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

        public Builder gracePeriodSecs(long gracePeriodSecs) {
            this.gracePeriodSecs = gracePeriodSecs;
            return this;
        }

        public TaskRequest build() {
            return new TaskRequest(this);
        }
    }

    @Override
    public String toString() {
        return "TaskRequest{name='" + name + "', parentId='" + parentId + "', slices=" + slices.size()
                + ", tags=" + tags + "}";
    }
}
