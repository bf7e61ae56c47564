package batchflow.engine.error;

/**
 * A task name is already bound in the registry.
 */
public class DuplicateTaskException extends EngineException {

    private final String taskName;

    public DuplicateTaskException(String taskName) {
        super("Task already registered: " + taskName);
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
