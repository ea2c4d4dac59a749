package dss.coordinator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A worker process registered with the store.
 */
public final class Simulator {
    private final String id;
    private final Instant registeredAt;
    private final Instant lastHeartbeat;

    private Simulator(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.registeredAt = builder.registeredAt;
        this.lastHeartbeat = builder.lastHeartbeat;
    }

    public String id() {
        return id;
    }

    public Instant registeredAt() {
        return registeredAt;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    /** True if no heartbeat arrived within {@code timeout} before {@code now}. */
    public boolean isStale(Instant now, Duration timeout) {
        return lastHeartbeat == null || lastHeartbeat.isBefore(now.minus(timeout));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private Instant registeredAt;
        private Instant lastHeartbeat;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder registeredAt(Instant registeredAt) {
            this.registeredAt = registeredAt;
            return this;
        }

        public Builder lastHeartbeat(Instant lastHeartbeat) {
            this.lastHeartbeat = lastHeartbeat;
            return this;
        }

        public Simulator build() {
            return new Simulator(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Simulator simulator))
            return false;
        return Objects.equals(id, simulator.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Simulator{id='" + id + "', lastHeartbeat=" + lastHeartbeat + "}";
    }
}
