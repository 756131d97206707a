package labrunner.coordinator.suite;

import java.time.Duration;

/**
 * Blocking pause between polls; replaced by a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
