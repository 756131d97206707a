package labrunner.coordinator.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * A queued job waiting for, or holding, a host.
 */
public final class Job {
    private final String id;
    private final String name;
    private final Set<String> dependencies; // labels the host must carry
    private final String hostId; // null until assigned
    private final boolean active;
    private final boolean complete;
    private final int priority;
    private final Instant createdAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = builder.name;
        this.dependencies = builder.dependencies == null ? Set.of() : Set.copyOf(builder.dependencies);
        this.hostId = builder.hostId;
        this.active = builder.active;
        this.complete = builder.complete;
        this.priority = builder.priority;
        this.createdAt = builder.createdAt;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public Set<String> dependencies() {
        return dependencies;
    }

    public String hostId() {
        return hostId;
    }

    public boolean active() {
        return active;
    }

    public boolean complete() {
        return complete;
    }

    public int priority() {
        return priority;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean hasHost() {
        return hostId != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private Set<String> dependencies;
        private String hostId;
        private boolean active;
        private boolean complete;
        private int priority;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder dependencies(Set<String> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public Builder hostId(String hostId) {
            this.hostId = hostId;
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

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', hostId='" + hostId + "', active=" + active + ", complete=" + complete + "}";
    }
}
