package batchflow.engine.error;

/**
 * Referenced job or group does not exist.
 */
public class NotFoundException extends EngineException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException job(String jobId) {
        return new NotFoundException("Job not found: " + jobId);
    }

    public static NotFoundException group(String groupId) {
        return new NotFoundException("Group not found: " + groupId);
    }
}
