package batchflow.engine.queue;

import batchflow.engine.model.Job;
import batchflow.engine.model.JobGroup;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshots produced by one queue operation, collected under the lock and
 * handed to the journal after it is released. Later snapshots of the same
 * id replace earlier ones.
 */
final class ChangeSet {

    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final Map<String, JobGroup> groups = new LinkedHashMap<>();
    private final Map<String, Job> progress = new LinkedHashMap<>();

    void job(Job job) {
        jobs.put(job.id(), job);
        progress.remove(job.id());
    }

    void group(JobGroup group) {
        groups.put(group.id(), group);
    }

    /** Progress-only update: published, not persisted. */
    void progress(Job job) {
        if (!jobs.containsKey(job.id())) {
            progress.put(job.id(), job);
        }
    }

    Collection<Job> jobs() {
        return jobs.values();
    }

    Collection<JobGroup> groups() {
        return groups.values();
    }

    Collection<Job> progressUpdates() {
        return progress.values();
    }

    boolean isEmpty() {
        return jobs.isEmpty() && groups.isEmpty() && progress.isEmpty();
    }
}
