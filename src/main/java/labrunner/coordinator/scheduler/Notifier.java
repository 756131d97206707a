package labrunner.coordinator.scheduler;

/**
 * Channel for problems an operator should look at.
 */
public interface Notifier {

    void notify(String subject, String message);
}
