package batchflow.engine.error;

import batchflow.engine.model.JobStatus;

/**
 * Operation not allowed in the current state of a job or group.
 */
public class InvalidStateException extends EngineException {

    public InvalidStateException(String message) {
        super(message);
    }

    public InvalidStateException(String jobId, JobStatus status, String operation) {
        super("Cannot " + operation + " job " + jobId + " in state " + status);
    }
}
