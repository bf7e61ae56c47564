package batchflow.engine.service;

import batchflow.engine.config.EngineConfig;
import batchflow.engine.error.NotFoundException;
import batchflow.engine.error.PersistenceException;
import batchflow.engine.model.*;
import batchflow.engine.queue.JobQueue;
import batchflow.engine.repository.JobGroupRepository;
import batchflow.engine.repository.JobRepository;
import batchflow.engine.task.TaskFunction;
import batchflow.engine.task.TaskRegistry;
import batchflow.engine.util.JsonValues;
import batchflow.engine.util.Times;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Public job operations: task registration, creation, submission, control,
 * waiting and queries.
 *
 * <p>
 * Live jobs are served from the in-memory queue. Finished jobs evicted from
 * memory are read back from the store.
 */
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobQueue queue;
    private final TaskRegistry registry;
    private final JobRepository jobRepository;
    private final JobGroupRepository groupRepository;
    private final EngineConfig config;

    public JobService(JobQueue queue, TaskRegistry registry, JobRepository jobRepository,
            JobGroupRepository groupRepository, EngineConfig config) {
        this.queue = queue;
        this.registry = registry;
        this.jobRepository = jobRepository;
        this.groupRepository = groupRepository;
        this.config = config;
    }

    // ==================== Tasks ====================

    public void registerTask(String name, TaskFunction function) {
        registry.register(name, function);
    }

    public void registerTask(String name, TaskFunction function, boolean overwrite) {
        registry.register(name, function, overwrite);
    }

    // ==================== Creation ====================

    /**
     * Create a job with normal priority, no dependencies and the default retry policy.
     *
     * @return the job ID
     */
    public String createJob(String taskName, Map<String, Object> args) {
        return createJob(JobSpec.forTask(taskName).args(args).build());
    }

    /**
     * Create a job.
     *
     * @param retryPolicy null for the configured default
     * @return the job ID
     */
    public String createJob(String taskName, Map<String, Object> args, JobPriority priority,
            List<String> dependencies, RetryPolicy retryPolicy) {
        return createJob(JobSpec.forTask(taskName)
                .args(args)
                .priority(priority != null ? priority : JobPriority.NORMAL)
                .dependencies(dependencies)
                .retryPolicy(retryPolicy)
                .build());
    }

    /**
     * Create a job in state CREATED. It does not run until submitted.
     *
     * Args and metadata are stored in their JSON form, so a job reads back the
     * same values before and after a restart.
     *
     * @return the job ID
     * @throws NotFoundException if a dependency or the group does not exist
     * @throws IllegalArgumentException if args or metadata are not JSON serializable
     */
    public String createJob(JobSpec spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec is required");
        }
        for (String dependency : spec.dependencies()) {
            ensureLoaded(dependency);
        }

        Job job = Job.builder()
                .id(generateId())
                .name(spec.name())
                .taskName(spec.taskName())
                .args(JsonValues.normalize(spec.args(), "args"))
                .metadata(JsonValues.normalize(spec.metadata(), "metadata"))
                .priority(spec.priority())
                .dependencies(spec.dependencies())
                .tags(spec.tags())
                .retryPolicy(spec.retryPolicy() != null ? spec.retryPolicy() : config.defaultRetryPolicy())
                .timeout(spec.timeout())
                .groupId(spec.groupId())
                .status(JobStatus.CREATED)
                .createdAt(Times.now())
                .build();

        Job stored = queue.add(job);
        log.info("Created job {} (task={}, priority={}, deps={})",
                stored.id(), stored.taskName(), stored.priority(), stored.dependencies().size());
        return stored.id();
    }

    /**
     * Submit a created job for execution. A job whose task name is not
     * registered fails immediately without being retried.
     *
     * @return the state after submission (QUEUED, WAITING, or terminal)
     * @throws NotFoundException                            if the job is unknown
     * @throws batchflow.engine.error.InvalidStateException if the job was already submitted
     * @throws batchflow.engine.error.QueueFullException   if the queue is full
     * @throws PersistenceException                         if the new state could not be stored
     */
    public JobStatus submit(String jobId) {
        Job job = queue.find(jobId).orElse(null);
        if (job == null) {
            return storedTerminal(jobId).status();
        }
        if (job.status() == JobStatus.CREATED && !registry.contains(job.taskName())) {
            return queue.failUnregistered(jobId);
        }
        return queue.submit(jobId);
    }

    /**
     * Create and submit in one step.
     *
     * @return the job ID
     */
    public String submitNew(JobSpec spec) {
        String jobId = createJob(spec);
        submit(jobId);
        return jobId;
    }

    // ==================== Control ====================

    public JobStatus pause(String jobId) {
        return queue.contains(jobId) ? queue.pause(jobId) : storedTerminal(jobId).status();
    }

    public JobStatus resume(String jobId) {
        return queue.contains(jobId) ? queue.resume(jobId) : storedTerminal(jobId).status();
    }

    public JobStatus cancel(String jobId) {
        return queue.contains(jobId) ? queue.cancel(jobId) : storedTerminal(jobId).status();
    }

    /**
     * Change the priority of a job that has not started.
     *
     * @return false if the job is running or finished
     */
    public boolean reprioritize(String jobId, JobPriority priority) {
        if (priority == null) {
            throw new IllegalArgumentException("priority is required");
        }
        if (!queue.contains(jobId)) {
            storedTerminal(jobId);
            return false;
        }
        return queue.reprioritize(jobId, priority);
    }

    // ==================== Waiting ====================

    /**
     * Block until the job reaches a terminal state.
     *
     * @param timeout null to wait indefinitely
     * @return the terminal state, or the current state if the timeout elapsed first
     */
    public JobStatus waitForJob(String jobId, Duration timeout) throws InterruptedException {
        Optional<Job> job = queue.awaitTerminal(jobId, timeout);
        if (job.isPresent()) {
            return job.get().status();
        }
        return storedTerminal(jobId).status();
    }

    /**
     * Block until every job is terminal.
     *
     * @param timeout shared budget for all jobs, null to wait indefinitely
     * @return true if all jobs completed successfully within the timeout
     */
    public boolean waitForJobs(Collection<String> jobIds, Duration timeout) throws InterruptedException {
        Instant deadline = timeout != null ? Instant.now().plus(timeout) : null;
        boolean allCompleted = true;
        for (String jobId : jobIds) {
            Duration remaining = null;
            if (deadline != null) {
                remaining = Duration.between(Instant.now(), deadline);
                if (remaining.isNegative()) {
                    remaining = Duration.ZERO;
                }
            }
            JobStatus status = waitForJob(jobId, remaining);
            if (status != JobStatus.COMPLETED) {
                allCompleted = false;
            }
        }
        return allCompleted;
    }

    // ==================== Queries ====================

    /**
     * Result of a completed job; empty if the job has not completed or returned nothing.
     */
    public Optional<Object> getResult(String jobId) {
        Job job = require(jobId);
        return job.status() == JobStatus.COMPLETED ? Optional.ofNullable(job.result()) : Optional.empty();
    }

    /**
     * Error of a failed or canceled job; empty otherwise.
     */
    public Optional<JobError> getError(String jobId) {
        Job job = require(jobId);
        return job.isTerminal() ? Optional.ofNullable(job.error()) : Optional.empty();
    }

    public JobStatusReport getStatus(String jobId) {
        return JobStatusReport.from(require(jobId));
    }

    public Optional<Job> findJob(String jobId) {
        Optional<Job> live = queue.find(jobId);
        return live.isPresent() ? live : jobRepository.findById(jobId);
    }

    /**
     * Jobs in memory matching all given filters (null filters match everything), oldest first.
     */
    public List<Job> listJobs(JobStatus status, String tag, String groupId) {
        Predicate<Job> filter = job -> (status == null || job.status() == status)
                && (tag == null || job.tags().contains(tag))
                && (groupId == null || groupId.equals(job.groupId()));
        return queue.jobs(filter);
    }

    public EngineStats stats() {
        return queue.stats();
    }

    /**
     * Remove finished jobs from memory and from the store. Jobs still needed by
     * an unfinished dependent or group are kept.
     *
     * @param status terminal status to purge, null for all terminal jobs
     * @return number of jobs removed
     */
    public int purge(JobStatus status) {
        if (status != null && !status.isTerminal()) {
            throw new IllegalArgumentException("Only terminal jobs can be purged, got " + status);
        }
        JobQueue.Eviction eviction = queue.evict(Instant.MAX, job -> status == null || job.status() == status);

        for (Job job : eviction.jobs()) {
            try {
                jobRepository.delete(job.id());
            } catch (PersistenceException e) {
                log.error("Failed to delete job {} from store: {}", job.id(), e.getMessage(), e);
            }
        }
        for (JobGroup group : eviction.groups()) {
            try {
                groupRepository.delete(group.id());
            } catch (PersistenceException e) {
                log.error("Failed to delete group {} from store: {}", group.id(), e.getMessage(), e);
            }
        }
        log.info("Purged {} job(s) and {} group(s)", eviction.jobs().size(), eviction.groups().size());
        return eviction.jobs().size();
    }

    // ==================== Helpers ====================

    private Job require(String jobId) {
        return findJob(jobId).orElseThrow(() -> NotFoundException.job(jobId));
    }

    /** A job known only to the store; by construction it is terminal. */
    private Job storedTerminal(String jobId) {
        Job job = jobRepository.findById(jobId).orElseThrow(() -> NotFoundException.job(jobId));
        if (!job.isTerminal()) {
            throw new IllegalStateException("Unfinished job " + jobId + " is missing from memory");
        }
        return job;
    }

    /** Bring an evicted dependency back into memory so the queue can see its final state. */
    private void ensureLoaded(String jobId) {
        if (queue.contains(jobId)) {
            return;
        }
        Job job = storedTerminal(jobId);
        queue.restoreHistory(job);
        log.debug("Reloaded finished job {} as a dependency", jobId);
    }

    private String generateId() {
        return "job-" + UUID.randomUUID();
    }
}
