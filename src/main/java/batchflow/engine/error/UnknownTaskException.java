package batchflow.engine.error;

/**
 * A task name is not bound in the registry.
 */
public class UnknownTaskException extends EngineException {

    private final String taskName;

    public UnknownTaskException(String taskName) {
        super("Unknown task: " + taskName);
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
