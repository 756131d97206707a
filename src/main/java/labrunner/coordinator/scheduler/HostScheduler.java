package labrunner.coordinator.scheduler;

/**
 * One step of host bookkeeping, invoked periodically by {@link Scheduler}.
 * Implementations keep no state between ticks beyond what the stores hold.
 */
@FunctionalInterface
public interface HostScheduler {

    void tick();
}
