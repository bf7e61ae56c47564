package batchflow.engine.error;

/**
 * Submission rejected because the queue reached its configured size. Retry later.
 */
public class QueueFullException extends EngineException {

    private final int limit;

    public QueueFullException(int limit) {
        super("Queue is full (max " + limit + " pending jobs)");
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
