package batchflow.engine.task;

/**
 * Executable body of a task, bound to a name in the {@link TaskRegistry}.
 * Return the job's result or throw to fail the attempt.
 */
@FunctionalInterface
public interface TaskFunction {

    Object execute(TaskContext context) throws Exception;
}
