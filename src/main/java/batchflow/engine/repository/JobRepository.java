package batchflow.engine.repository;

import batchflow.engine.model.Job;
import batchflow.engine.model.JobStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Job persistence.
 * One record per job, keyed by id; writes overwrite older versions only.
 */
public interface JobRepository {

    /**
     * Insert or overwrite a job record.
     * A stored record with an equal or higher version is left untouched.
     *
     * @param job the job snapshot to save
     * @return true if the record was written
     */
    boolean save(Job job);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<Job> findById(String jobId);

    /**
     * Load every job not in a terminal state, ordered by creation.
     * Jobs stored as RUNNING are returned as QUEUED: their in-progress
     * attempt is lost and they must run again.
     *
     * @return pending jobs
     */
    List<Job> findPending();

    /**
     * Get jobs by status.
     *
     * @param status the status filter
     * @return list of jobs, newest first
     */
    List<Job> findByStatus(JobStatus status);

    /**
     * Get the highest sequence number ever assigned.
     *
     * @return max sequence, 0 when the store is empty
     */
    long maxSequence();

    /**
     * Delete a job record.
     *
     * @param jobId the job ID
     * @return true if deleted
     */
    boolean delete(String jobId);
}
