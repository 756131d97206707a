package labrunner.coordinator.scheduler;

/**
 * Does nothing on tick. Used when hosts are acquired inline by whoever runs
 * the jobs.
 */
public class DummyHostScheduler implements HostScheduler {

    @Override
    public void tick() {
    }
}
