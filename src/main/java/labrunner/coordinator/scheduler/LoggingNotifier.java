package labrunner.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes notifications to the log at WARN.
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void notify(String subject, String message) {
        log.warn("{}: {}", subject, message);
    }
}
