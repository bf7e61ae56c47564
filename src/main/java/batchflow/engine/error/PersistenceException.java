package batchflow.engine.error;

/**
 * A durable write or read failed. In-memory scheduling state is unaffected.
 */
public class PersistenceException extends EngineException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
