package labrunner.coordinator.model;

import java.util.Objects;
import java.util.Set;

/**
 * Immutable domain model of a lab host (DUT) and its lease flag.
 */
public final class Host {
    private final String id;
    private final String hostname;
    private final Set<String> labels;
    private final HostStatus status;
    private final boolean leased;
    private final boolean locked;

    private Host(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.hostname = builder.hostname != null ? builder.hostname : builder.id;
        this.labels = builder.labels == null ? Set.of() : Set.copyOf(builder.labels);
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.leased = builder.leased;
        this.locked = builder.locked;
    }

    public String id() {
        return id;
    }

    public String hostname() {
        return hostname;
    }

    public Set<String> labels() {
        return labels;
    }

    public HostStatus status() {
        return status;
    }

    public boolean leased() {
        return leased;
    }

    public boolean locked() {
        return locked;
    }

    /** Healthy and not locked by an admin. */
    public boolean isUsable() {
        return status.isHealthy() && !locked;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .hostname(hostname)
                .labels(labels)
                .status(status)
                .leased(leased)
                .locked(locked);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String hostname;
        private Set<String> labels;
        private HostStatus status = HostStatus.READY;
        private boolean leased;
        private boolean locked;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder hostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder labels(Set<String> labels) {
            this.labels = labels;
            return this;
        }

        public Builder status(HostStatus status) {
            this.status = status;
            return this;
        }

        public Builder leased(boolean leased) {
            this.leased = leased;
            return this;
        }

        public Builder locked(boolean locked) {
            this.locked = locked;
            return this;
        }

        public Host build() {
            return new Host(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Host host))
            return false;
        return Objects.equals(id, host.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Host{id='" + id + "', status=" + status + ", leased=" + leased + "}";
    }
}
