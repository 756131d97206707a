package labrunner.coordinator.repository;

import labrunner.coordinator.model.Task;
import labrunner.coordinator.model.TaskRequest;

import java.util.List;

/**
 * Remote execution service the suite orchestrator dispatches child tests to.
 * Implementations must be safe to call from several independent processes.
 */
public interface TaskQueueClient {

    /**
     * Submit a new task.
     *
     * @param request what to run and where
     * @return the id assigned by the queue
     * @throws TaskQueueException if the task could not be created
     */
    String submit(TaskRequest request);

    /**
     * List every task created with the given parent id, superseded attempts
     * included, oldest first.
     *
     * @param parentId the suite id
     * @return tasks of the suite
     * @throws TaskQueueException if the query failed
     */
    List<Task> queryByParent(String parentId);
}
