package labrunner.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Maintenance work (verify, repair, ...) bound to one host. Tasks without a
 * job were requested from the frontend; tasks with a job run before it.
 */
public final class SpecialTask {
    private final String id;
    private final String hostId;
    private final String jobId;
    private final SpecialTaskType type;
    private final boolean active;
    private final boolean complete;
    private final Instant createdAt;

    private SpecialTask(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.hostId = Objects.requireNonNull(builder.hostId, "hostId is required");
        this.jobId = builder.jobId;
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.active = builder.active;
        this.complete = builder.complete;
        this.createdAt = builder.createdAt;
    }

    public String id() {
        return id;
    }

    public String hostId() {
        return hostId;
    }

    public String jobId() {
        return jobId;
    }

    public SpecialTaskType type() {
        return type;
    }

    public boolean active() {
        return active;
    }

    public boolean complete() {
        return complete;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean isFrontendTask() {
        return jobId == null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String hostId;
        private String jobId;
        private SpecialTaskType type = SpecialTaskType.VERIFY;
        private boolean active;
        private boolean complete;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder hostId(String hostId) {
            this.hostId = hostId;
            return this;
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder type(SpecialTaskType type) {
            this.type = type;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder complete(boolean complete) {
            this.complete = complete;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public SpecialTask build() {
            return new SpecialTask(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SpecialTask that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "SpecialTask{id='" + id + "', type=" + type + ", hostId='" + hostId + "', jobId='" + jobId + "'}";
    }
}
