package batchflow.engine.error;

/**
 * Base class of the failures the engine surfaces to its callers.
 */
public class EngineException extends RuntimeException {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
