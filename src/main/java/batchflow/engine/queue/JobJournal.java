package batchflow.engine.queue;

import batchflow.engine.core.JobEventBus;
import batchflow.engine.error.PersistenceException;
import batchflow.engine.model.Job;
import batchflow.engine.model.JobGroup;
import batchflow.engine.repository.JobGroupRepository;
import batchflow.engine.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes queue changes to the store and publishes them on the event bus.
 * Every snapshot is attempted even if an earlier one failed; the first
 * failure is rethrown once all writes are done.
 */
public class JobJournal {

    private static final Logger log = LoggerFactory.getLogger(JobJournal.class);

    private final JobRepository jobRepository;
    private final JobGroupRepository groupRepository;
    private final JobEventBus events;

    public JobJournal(JobRepository jobRepository, JobGroupRepository groupRepository, JobEventBus events) {
        this.jobRepository = jobRepository;
        this.groupRepository = groupRepository;
        this.events = events;
    }

    /**
     * Persist and publish.
     *
     * @throws PersistenceException if any write failed (the change itself stays applied in memory)
     */
    void record(ChangeSet changes) {
        if (changes.isEmpty()) {
            return;
        }
        PersistenceException failure = null;

        for (Job job : changes.jobs()) {
            try {
                jobRepository.save(job);
            } catch (RuntimeException e) {
                log.error("Failed to persist job {} ({} v{}): {}", job.id(), job.status(), job.version(),
                        e.getMessage(), e);
                failure = merge(failure, "job " + job.id(), e);
            }
        }
        for (JobGroup group : changes.groups()) {
            try {
                groupRepository.save(group);
            } catch (RuntimeException e) {
                log.error("Failed to persist group {} ({} v{}): {}", group.id(), group.state(), group.version(),
                        e.getMessage(), e);
                failure = merge(failure, "group " + group.id(), e);
            }
        }

        changes.jobs().forEach(events::publishJob);
        changes.progressUpdates().forEach(events::publishJob);
        changes.groups().forEach(events::publishGroup);

        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Same as {@link #record} where the caller cannot act on a failed write
     * (worker-side changes, creation). The failure is already logged.
     */
    void recordQuietly(ChangeSet changes) {
        try {
            record(changes);
        } catch (PersistenceException e) {
            log.debug("Continuing after persistence failure: {}", e.getMessage());
        }
    }

    private static PersistenceException merge(PersistenceException failure, String what, RuntimeException e) {
        if (failure == null) {
            return e instanceof PersistenceException pe ? pe
                    : new PersistenceException("Failed to persist " + what, e);
        }
        failure.addSuppressed(e);
        return failure;
    }
}
