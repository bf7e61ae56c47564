package batchflow.engine.repository;

import batchflow.engine.model.JobGroup;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for JobGroup persistence.
 */
public interface JobGroupRepository {

    /**
     * Insert or overwrite a group record, skipping it if a newer version is stored.
     *
     * @param group the group snapshot
     * @return true if the record was written
     */
    boolean save(JobGroup group);

    /**
     * Find a group by ID.
     *
     * @param groupId the group ID
     * @return the group if found
     */
    Optional<JobGroup> findById(String groupId);

    /**
     * Load every group whose state is not resolved.
     *
     * @return pending groups ordered by creation
     */
    List<JobGroup> findPending();

    /**
     * Delete a group record.
     *
     * @param groupId the group ID
     * @return true if deleted
     */
    boolean delete(String groupId);
}
