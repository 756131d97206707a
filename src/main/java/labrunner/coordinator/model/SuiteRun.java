package labrunner.coordinator.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * State of one suite execution. Owns the retry records of its child tests,
 * keyed by the task id that is currently active for each of them.
 *
 * Not thread-safe: a run is advanced by a single polling loop.
 */
public final class SuiteRun {
    private final String suiteId;
    private final SuiteMode mode;
    private final int provisionThreshold;
    private final boolean retryEnabled;

    // active task id -> record, in scheduling order
    private final Map<String, RetryRecord> records = new LinkedHashMap<>();
    private int remainingSuiteRetries;

    // Active tasks as seen by the most recent poll
    private Map<String, Task> lastSnapshot = Map.of();
    private boolean retriedInLastPoll;
    private int pollCount;

    public SuiteRun(String suiteId, SuiteMode mode, int provisionThreshold, boolean retryEnabled, int maxRetries) {
        if (suiteId == null || suiteId.isBlank()) {
            throw new IllegalArgumentException("suiteId is required");
        }
        if (provisionThreshold < 0) {
            throw new IllegalArgumentException("provisionThreshold must not be negative");
        }
        this.suiteId = suiteId;
        this.mode = Objects.requireNonNull(mode, "mode is required");
        this.provisionThreshold = provisionThreshold;
        this.retryEnabled = retryEnabled;
        this.remainingSuiteRetries = Math.max(0, maxRetries);
    }

    public String suiteId() {
        return suiteId;
    }

    public SuiteMode mode() {
        return mode;
    }

    public boolean isProvision() {
        return mode == SuiteMode.PROVISION;
    }

    public int provisionThreshold() {
        return provisionThreshold;
    }

    public boolean retryEnabled() {
        return retryEnabled;
    }

    /** Suite-wide retry budget shared by all child tests. */
    public int remainingSuiteRetries() {
        return remainingSuiteRetries;
    }

    public boolean isActive(String taskId) {
        return records.containsKey(taskId);
    }

    public Optional<RetryRecord> record(String taskId) {
        return Optional.ofNullable(records.get(taskId));
    }

    public Set<String> activeTaskIds() {
        return Collections.unmodifiableSet(records.keySet());
    }

    public Collection<RetryRecord> records() {
        return Collections.unmodifiableCollection(records.values());
    }

    /** Every superseded task id of every child test. */
    public Set<String> supersededTaskIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (RetryRecord record : records.values()) {
            ids.addAll(record.previousRetriedIds());
        }
        return ids;
    }

    public void track(RetryRecord record) {
        if (records.containsKey(record.taskId())) {
            throw new IllegalStateException("Task " + record.taskId() + " is already tracked by suite " + suiteId);
        }
        records.put(record.taskId(), record);
    }

    /**
     * Swap the record of a retried task for its successor. The old id stops
     * being active immediately; the test keeps its position in the run.
     */
    public void replace(String oldTaskId, RetryRecord successor) {
        if (!records.containsKey(oldTaskId)) {
            throw new IllegalStateException("Task " + oldTaskId + " is not active in suite " + suiteId);
        }
        List<Map.Entry<String, RetryRecord>> entries = new ArrayList<>(records.entrySet());
        records.clear();
        for (Map.Entry<String, RetryRecord> entry : entries) {
            if (entry.getKey().equals(oldTaskId)) {
                records.put(successor.taskId(), successor);
            } else {
                records.put(entry.getKey(), entry.getValue());
            }
        }
    }

    public void consumeSuiteRetry() {
        if (remainingSuiteRetries <= 0) {
            throw new IllegalStateException("Suite " + suiteId + " has no retries left");
        }
        remainingSuiteRetries--;
    }

    public void recordPoll(Map<String, Task> activeSnapshot, boolean retried) {
        this.lastSnapshot = Collections.unmodifiableMap(new LinkedHashMap<>(activeSnapshot));
        this.retriedInLastPoll = retried;
        this.pollCount++;
    }

    /** Active tasks as seen by the last poll; ids scheduled after it are absent. */
    public Map<String, Task> lastSnapshot() {
        return lastSnapshot;
    }

    public Optional<Task> lastSeen(String taskId) {
        return Optional.ofNullable(lastSnapshot.get(taskId));
    }

    public boolean retriedInLastPoll() {
        return retriedInLastPoll;
    }

    public int pollCount() {
        return pollCount;
    }

    /** Active ids that the last poll did not see in a terminal state. */
    public int outstandingCount() {
        int outstanding = 0;
        for (String taskId : records.keySet()) {
            Task task = lastSnapshot.get(taskId);
            if (task == null || !task.isTerminal()) {
                outstanding++;
            }
        }
        return outstanding;
    }

    /** Distinct bots whose active task finished successfully, as of the last poll. */
    public Set<String> successfulBots() {
        Set<String> bots = new LinkedHashSet<>();
        for (Task task : lastSnapshot.values()) {
            if (task.isSuccessful() && task.botId() != null && records.containsKey(task.id())) {
                bots.add(task.botId());
            }
        }
        return bots;
    }

    @Override
    public String toString() {
        return "SuiteRun{suiteId='" + suiteId + "', mode=" + mode + ", active=" + records.size()
                + ", remainingSuiteRetries=" + remainingSuiteRetries + "}";
    }
}
