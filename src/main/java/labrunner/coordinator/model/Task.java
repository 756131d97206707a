package labrunner.coordinator.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of one dispatched task as read back from the task queue.
 * The orchestrator never mutates tasks; it only re-reads them.
 */
public final class Task {

    /** Final state reported for a completed task whose payload succeeded. */
    public static final String COMPLETED_SUCCESS = "COMPLETED_SUCCESS";
    /** Final state reported for a completed task whose payload failed. */
    public static final String COMPLETED_FAILURE = "COMPLETED_FAILURE";

    private final String id;
    private final String name;
    private final String parentId;
    private final TaskState state;
    private final boolean failure;
    private final String botId; // null until a bot picks it up
    private final List<String> tags;
    private final int priority;
    private final Instant createdAt;
    private final Instant finishedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = builder.name;
        this.parentId = builder.parentId;
        this.state = Objects.requireNonNull(builder.state, "state is required");
        this.failure = builder.failure;
        this.botId = builder.botId;
        this.tags = builder.tags == null ? List.of() : List.copyOf(builder.tags);
        this.priority = builder.priority;
        this.createdAt = builder.createdAt;
        this.finishedAt = builder.finishedAt;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String parentId() {
        return parentId;
    }

    public TaskState state() {
        return state;
    }

    public boolean failure() {
        return failure;
    }

    public String botId() {
        return botId;
    }

    public List<String> tags() {
        return tags;
    }

    public int priority() {
        return priority;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /** Completed and the payload reported success. */
    public boolean isSuccessful() {
        return state == TaskState.COMPLETED && !failure;
    }

    /** Terminal and counted as unsuccessful (payload failure or infra failure). */
    public boolean isUnsuccessful() {
        return (state == TaskState.COMPLETED && failure) || state.isInfraFailure();
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    /**
     * State string used in reports: COMPLETED is split by the failure flag,
     * every other state keeps its name.
     */
    public String finalState() {
        if (state == TaskState.COMPLETED) {
            return failure ? COMPLETED_FAILURE : COMPLETED_SUCCESS;
        }
        return state.name();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .parentId(parentId)
                .state(state)
                .failure(failure)
                .botId(botId)
                .tags(tags)
                .priority(priority)
                .createdAt(createdAt)
                .finishedAt(finishedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String parentId;
        private TaskState state = TaskState.PENDING;
        private boolean failure;
        private String botId;
        private List<String> tags;
        private int priority;
        private Instant createdAt;
        private Instant finishedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder state(TaskState state) {
            this.state = state;
            return this;
        }

        public Builder failure(boolean failure) {
            this.failure = failure;
            return this;
        }

        public Builder botId(String botId) {
            this.botId = botId;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
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

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', name='" + name + "', state=" + state + ", failure=" + failure + "}";
    }
}
