package batchflow.engine.service;

import batchflow.engine.model.Job;
import batchflow.engine.model.JobGroup;
import batchflow.engine.queue.JobQueue;
import batchflow.engine.repository.JobGroupRepository;
import batchflow.engine.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rebuilds the in-memory queue from the store on startup. Jobs that were
 * RUNNING when the process stopped come back QUEUED and are re-run.
 */
public class RecoveryService {

    private static final Logger log = LoggerFactory.getLogger(RecoveryService.class);

    private final JobQueue queue;
    private final JobRepository jobRepository;
    private final JobGroupRepository groupRepository;

    public RecoveryService(JobQueue queue, JobRepository jobRepository, JobGroupRepository groupRepository) {
        this.queue = queue;
        this.jobRepository = jobRepository;
        this.groupRepository = groupRepository;
    }

    /**
     * @return number of unfinished jobs re-admitted
     * @throws batchflow.engine.error.PersistenceException if the store cannot be read
     */
    public int recover() {
        queue.advanceSequence(jobRepository.maxSequence());

        List<Job> pending = jobRepository.findPending();
        List<JobGroup> groups = groupRepository.findPending();

        Set<String> pendingIds = new HashSet<>();
        for (Job job : pending) {
            pendingIds.add(job.id());
        }

        // finished jobs that unfinished ones still refer to
        Set<String> history = new LinkedHashSet<>();
        for (Job job : pending) {
            history.addAll(job.dependencies());
        }
        for (JobGroup group : groups) {
            history.addAll(group.memberIds());
        }
        history.removeAll(pendingIds);

        int loaded = 0;
        for (String jobId : history) {
            Optional<Job> job = jobRepository.findById(jobId);
            if (job.isPresent() && job.get().isTerminal()) {
                queue.restoreHistory(job.get());
                loaded++;
            } else {
                log.warn("Referenced job {} is missing from the store", jobId);
            }
        }

        int restored = queue.restore(pending, groups);
        log.info("Recovery finished: {} unfinished job(s), {} group(s), {} finished job(s) loaded for reference",
                restored, groups.size(), loaded);
        return restored;
    }
}
