package batchflow.engine.queue;

import batchflow.engine.error.InvalidStateException;
import batchflow.engine.error.NotFoundException;
import batchflow.engine.error.QueueFullException;
import batchflow.engine.model.*;
import batchflow.engine.scheduler.RetryCoordinator;
import batchflow.engine.task.CancellationToken;
import batchflow.engine.util.Times;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * In-memory job table and scheduler queue.
 *
 * <p>
 * Every job and group state transition happens here, under one lock. Jobs and
 * groups reference each other by id only. Each operation collects the
 * snapshots it produced and hands them to the {@link JobJournal} after the
 * lock is released, so disk I/O never runs under the lock.
 *
 * <p>
 * Selection order among eligible jobs: priority (highest first), then
 * {@code createdAt}, then creation sequence.
 */
public class JobQueue {

    private static final Logger log = LoggerFactory.getLogger(JobQueue.class);

    static final Comparator<Job> ORDER = Comparator
            .comparingInt((Job job) -> -job.priority().rank())
            .thenComparing(Job::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparingLong(Job::sequence)
            .thenComparing(Job::id);

    /**
     * A job handed to a worker together with the cancellation token of its attempt.
     */
    public record Lease(Job job, CancellationToken token) {
    }

    /**
     * Jobs and groups removed from memory by {@link #evict}.
     */
    public record Eviction(List<Job> jobs, List<JobGroup> groups) {
    }

    private record Eligibility(JobStatus status, JobError cancelReason) {
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private final Map<String, Job> jobs = new HashMap<>();
    private final Map<String, JobGroup> groups = new HashMap<>();
    private final Map<String, Set<String>> dependents = new HashMap<>();
    private final NavigableSet<Job> pending = new TreeSet<>(ORDER);
    private final Map<String, CancellationToken> tokens = new HashMap<>();
    private final Map<String, Instant> runnableSince = new HashMap<>();
    // jobs that became terminal since the last refreshPending
    private final Deque<String> finished = new ArrayDeque<>();

    private final RetryCoordinator retryCoordinator;
    private final JobJournal journal;
    private final int capacity;
    private final int maxQueueSize;
    private final Instant createdAt = Instant.now();

    private long sequence;
    private int running;
    private boolean closed;

    private long submittedCount;
    private long completedCount;
    private long failedCount;
    private long canceledCount;
    private long retriedCount;
    private long runCount;
    private long runMillis;
    private long minRunMillis = Long.MAX_VALUE;
    private long maxRunMillis;
    private long startCount;
    private long queueMillis;

    /**
     * @param capacity     maximum number of concurrently running jobs
     * @param maxQueueSize maximum number of Queued/Waiting jobs accepted by submit
     */
    public JobQueue(RetryCoordinator retryCoordinator, JobJournal journal, int capacity, int maxQueueSize) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        if (maxQueueSize < 1) {
            throw new IllegalArgumentException("maxQueueSize must be at least 1");
        }
        this.retryCoordinator = retryCoordinator;
        this.journal = journal;
        this.capacity = capacity;
        this.maxQueueSize = maxQueueSize;
    }

    // ==================== Creation ====================

    /**
     * Add a new job in state CREATED, attaching it to its group if one is set.
     * Dependencies must already be known to the queue. A failed write is
     * logged; the row is written with the job's next transition.
     *
     * @return the stored snapshot (with its sequence number)
     * @throws NotFoundException     if a dependency or the group is unknown
     * @throws InvalidStateException if the group is canceled
     */
    public Job add(Job job) {
        ChangeSet changes = new ChangeSet();
        Job stored;
        lock.lock();
        try {
            if (jobs.containsKey(job.id())) {
                throw new IllegalArgumentException("Duplicate job id: " + job.id());
            }
            for (String dependency : job.dependencies()) {
                if (dependency.equals(job.id())) {
                    throw new IllegalArgumentException("Job cannot depend on itself: " + job.id());
                }
                if (!jobs.containsKey(dependency)) {
                    throw new NotFoundException("Dependency not found: " + dependency);
                }
            }
            JobGroup group = job.groupId() != null ? requireGroup(job.groupId()) : null;
            if (group != null && group.canceled()) {
                throw new InvalidStateException("Group " + group.id() + " is canceled");
            }

            stored = job.toBuilder()
                    .status(JobStatus.CREATED)
                    .groupId(null)
                    .sequence(++sequence)
                    .build();
            index(stored);
            put(stored, changes);
            if (group != null) {
                stored = attach(stored, group, changes);
            }
            log.debug("Job {} created (task={}, priority={}, deps={})",
                    stored.id(), stored.taskName(), stored.priority(), stored.dependencies());
        } finally {
            lock.unlock();
        }
        journal.recordQuietly(changes);
        return stored;
    }

    public void addGroup(JobGroup group) {
        ChangeSet changes = new ChangeSet();
        lock.lock();
        try {
            if (groups.containsKey(group.id())) {
                throw new IllegalArgumentException("Duplicate group id: " + group.id());
            }
            groups.put(group.id(), group);
            changes.group(group);
        } finally {
            lock.unlock();
        }
        journal.recordQuietly(changes);
    }

    // ==================== Submission ====================

    /**
     * Move a CREATED job to QUEUED (or WAITING when blocked, or CANCELED when a
     * dependency already failed). Submitting a terminal job is a no-op.
     *
     * @return the state after submission
     * @throws NotFoundException     if the job is unknown
     * @throws InvalidStateException if the job was already submitted
     * @throws QueueFullException    if the queue holds {@code maxQueueSize} jobs
     */
    public JobStatus submit(String jobId) {
        ChangeSet changes = new ChangeSet();
        JobStatus status;
        lock.lock();
        try {
            Job job = require(jobId);
            if (job.isTerminal()) {
                return job.status();
            }
            if (job.status() != JobStatus.CREATED) {
                throw new InvalidStateException(jobId, job.status(), "submit");
            }
            if (pending.size() >= maxQueueSize) {
                throw new QueueFullException(maxQueueSize);
            }
            submittedCount++;
            enqueue(job, changes);
            refreshPending(changes);
            status = jobs.get(jobId).status();
            log.info("Job {} submitted ({}, priority={})", jobId, status, job.priority());
        } finally {
            lock.unlock();
        }
        journal.record(changes);
        return status;
    }

    /**
     * Fail a CREATED job whose task name is not registered. Never retried.
     */
    public JobStatus failUnregistered(String jobId) {
        ChangeSet changes = new ChangeSet();
        JobStatus status;
        lock.lock();
        try {
            Job job = require(jobId);
            if (job.isTerminal()) {
                return job.status();
            }
            if (job.status() != JobStatus.CREATED) {
                throw new InvalidStateException(jobId, job.status(), "submit");
            }
            submittedCount++;
            Job failed = job.next()
                    .status(JobStatus.FAILED)
                    .error(JobError.of(ErrorKind.UNKNOWN_TASK, "Unknown task: " + job.taskName()))
                    .finishedAt(Times.now())
                    .build();
            failedCount++;
            put(failed, changes);
            afterFailure(failed, changes);
            refreshPending(changes);
            status = JobStatus.FAILED;
            log.error("Job {} failed: task '{}' is not registered", jobId, job.taskName());
        } finally {
            lock.unlock();
        }
        journal.record(changes);
        return status;
    }

    // ==================== Worker side ====================

    /**
     * Hand the next eligible job to a worker, marking it RUNNING and counting the
     * attempt. Blocks up to {@code maxWait} while nothing is eligible or all
     * capacity is in use.
     *
     * @return the lease, or null on timeout or after {@link #close()}
     */
    public Lease take(Duration maxWait) throws InterruptedException {
        ChangeSet changes = new ChangeSet();
        Lease lease = null;
        long deadline = System.nanoTime() + maxWait.toNanos();
        lock.lockInterruptibly();
        try {
            while (!closed && lease == null) {
                Instant now = Times.now();
                Instant nextDue = null;
                Job candidate = null;
                if (running < capacity) {
                    for (Job job : pending) {
                        if (job.status() != JobStatus.QUEUED) {
                            continue;
                        }
                        if (job.isDue(now)) {
                            candidate = job;
                            break;
                        }
                        if (nextDue == null || job.nextAttemptAt().isBefore(nextDue)) {
                            nextDue = job.nextAttemptAt();
                        }
                    }
                }
                if (candidate != null) {
                    lease = start(candidate, now, changes);
                    break;
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                if (nextDue != null) {
                    long untilDue = Duration.between(now, nextDue).toNanos();
                    remaining = Math.min(remaining, Math.max(1_000_000L, untilDue));
                }
                changed.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
        journal.recordQuietly(changes);
        return lease;
    }

    /**
     * Report success of an attempt.
     *
     * @param attempt attempt number from the lease
     */
    public AttemptOutcome complete(String jobId, int attempt, Object result) {
        ChangeSet changes = new ChangeSet();
        lock.lock();
        try {
            Job job = jobs.get(jobId);
            if (!isCurrentAttempt(job, attempt)) {
                log.debug("Ignoring stale completion of job {} attempt {}", jobId, attempt);
                return AttemptOutcome.STALE;
            }
            Instant now = Times.now();
            endAttempt(job, now);
            Job done = job.next()
                    .status(JobStatus.COMPLETED)
                    .result(result)
                    .error(null)
                    .finishedAt(now)
                    .progress(100.0)
                    .pauseRequested(false)
                    .cancelRequested(false)
                    .build();
            completedCount++;
            put(done, changes);
            refreshPending(changes);
            log.info("Job {} completed (attempt {}, {} ms)", jobId, attempt,
                    Duration.between(job.startedAt(), now).toMillis());
        } finally {
            lock.unlock();
        }
        journal.recordQuietly(changes);
        return AttemptOutcome.COMPLETED;
    }

    /**
     * Report failure of an attempt. The retry coordinator decides between
     * re-queueing with backoff and failing the job.
     */
    public AttemptOutcome fail(String jobId, int attempt, JobError error) {
        ChangeSet changes = new ChangeSet();
        AttemptOutcome outcome;
        lock.lock();
        try {
            Job job = jobs.get(jobId);
            if (!isCurrentAttempt(job, attempt)) {
                log.debug("Ignoring stale failure of job {} attempt {}: {}", jobId, attempt, error);
                return AttemptOutcome.STALE;
            }
            outcome = failAttempt(job, error, changes);
        } finally {
            lock.unlock();
        }
        journal.recordQuietly(changes);
        return outcome;
    }

    /**
     * Force-fail an attempt that exceeded its time budget. The task body is
     * signalled through its cancellation token; whatever it reports later is stale.
     */
    public AttemptOutcome timeout(String jobId, int attempt) {
        ChangeSet changes = new ChangeSet();
        AttemptOutcome outcome;
        lock.lock();
        try {
            Job job = jobs.get(jobId);
            if (!isCurrentAttempt(job, attempt)) {
                return AttemptOutcome.STALE;
            }
            CancellationToken token = tokens.get(jobId);
            if (token != null) {
                token.cancel("Timed out");
            }
            long budget = job.timeout() != null ? job.timeout().toMillis() : 0;
            log.warn("Job {} attempt {} exceeded its {} ms time budget", jobId, attempt, budget);
            outcome = failAttempt(job, JobError.of(ErrorKind.TIMEOUT, "Timed out after " + budget + " ms"),
                    changes);
        } finally {
            lock.unlock();
        }
        journal.recordQuietly(changes);
        return outcome;
    }

    /**
     * Record progress of the current attempt. Published to listeners, not persisted.
     */
    public void updateProgress(String jobId, int attempt, double percent, String message) {
        ChangeSet changes = new ChangeSet();
        lock.lock();
        try {
            Job job = jobs.get(jobId);
            if (!isCurrentAttempt(job, attempt)) {
                return;
            }
            Job updated = job.next().progress(percent).progressMessage(message).build();
            jobs.put(jobId, updated);
            changes.progress(updated);
        } finally {
            lock.unlock();
        }
        journal.recordQuietly(changes);
    }

    // ==================== Control ====================

    /**
     * Pause a queued or waiting job. A running job is paused when its current
     * attempt fails and would be retried; a successful attempt completes it.
     *
     * @return the state after the call
     */
    public JobStatus pause(String jobId) {
        ChangeSet changes = new ChangeSet();
        JobStatus status;
        lock.lock();
        try {
            Job job = require(jobId);
            switch (job.status()) {
                case QUEUED, WAITING -> {
                    put(job.next().status(JobStatus.PAUSED).build(), changes);
                    log.info("Job {} paused", jobId);
                }
                case RUNNING -> {
                    if (!job.pauseRequested()) {
                        put(job.next().pauseRequested(true).build(), changes);
                        log.info("Job {} will pause after its current attempt", jobId);
                    }
                }
                case CREATED -> throw new InvalidStateException(jobId, job.status(), "pause");
                default -> {
                    // already paused or terminal
                }
            }
            status = jobs.get(jobId).status();
        } finally {
            lock.unlock();
        }
        journal.recordQuietly(changes);
        return status;
    }

    /**
     * Resume a paused job, or withdraw a pending pause request of a running one.
     *
     * @return the state after the call
     */
    public JobStatus resume(String jobId) {
        ChangeSet changes = new ChangeSet();
        JobStatus status;
        lock.lock();
        try {
            Job job = require(jobId);
            switch (job.status()) {
                case PAUSED -> {
                    enqueue(job, changes);
                    refreshPending(changes);
                    log.info("Job {} resumed", jobId);
                }
                case RUNNING -> {
                    if (job.pauseRequested()) {
                        put(job.next().pauseRequested(false).build(), changes);
                    }
                }
                case CREATED -> throw new InvalidStateException(jobId, job.status(), "resume");
                default -> {
                    // not paused or terminal
                }
            }
            status = jobs.get(jobId).status();
        } finally {
            lock.unlock();
        }
        journal.recordQuietly(changes);
        return status;
    }

    /**
     * Cancel a job. Immediate unless running; a running job is asked to stop
     * through its cancellation token and ends CANCELED if its attempt fails.
     *
     * @return the state after the call
     */
    public JobStatus cancel(String jobId) {
        ChangeSet changes = new ChangeSet();
        JobStatus status;
        lock.lock();
        try {
            Job job = require(jobId);
            cancelOne(job, JobError.of(ErrorKind.CANCELED, "Canceled by request"), changes);
            refreshPending(changes);
            status = jobs.get(jobId).status();
        } finally {
            lock.unlock();
        }
        journal.recordQuietly(changes);
        return status;
    }

    /**
     * Change the priority of a job that has not started running.
     *
     * @return false if the job is running or terminal
     */
    public boolean reprioritize(String jobId, JobPriority priority) {
        ChangeSet changes = new ChangeSet();
        boolean updated = false;
        lock.lock();
        try {
            Job job = require(jobId);
            if (job.status() != JobStatus.RUNNING && !job.isTerminal() && job.priority() != priority) {
                put(job.next().priority(priority).build(), changes);
                updated = true;
                log.info("Job {} reprioritized {} -> {}", jobId, job.priority(), priority);
            }
        } finally {
            lock.unlock();
        }
        journal.recordQuietly(changes);
        return updated;
    }

    // ==================== Groups ====================

    /**
     * Append a job to a group's member list. Adding a job to the group it is
     * already in is a no-op.
     *
     * @throws InvalidStateException if the job is in another group or the group is canceled
     */
    public void addToGroup(String jobId, String groupId) {
        ChangeSet changes = new ChangeSet();
        lock.lock();
        try {
            Job job = require(jobId);
            JobGroup group = requireGroup(groupId);
            if (groupId.equals(job.groupId())) {
                return;
            }
            if (job.groupId() != null) {
                throw new InvalidStateException("Job " + jobId + " already belongs to group " + job.groupId());
            }
            if (group.canceled()) {
                throw new InvalidStateException("Group " + groupId + " is canceled");
            }
            attach(job, group, changes);
            refreshPending(changes, List.of(jobId));
        } finally {
            lock.unlock();
        }
        journal.record(changes);
    }

    /**
     * Detach a job that has not been submitted yet from its group.
     */
    public void removeFromGroup(String jobId, String groupId) {
        ChangeSet changes = new ChangeSet();
        lock.lock();
        try {
            Job job = require(jobId);
            JobGroup group = requireGroup(groupId);
            if (!groupId.equals(job.groupId())) {
                throw new InvalidStateException("Job " + jobId + " is not a member of group " + groupId);
            }
            if (job.status() != JobStatus.CREATED) {
                throw new InvalidStateException(jobId, job.status(), "remove from group");
            }
            List<String> followers = group.memberIds()
                    .subList(group.memberIds().indexOf(jobId) + 1, group.memberIds().size());
            JobGroup updated = group.withoutMember(jobId, Times.now());
            groups.put(groupId, updated);
            changes.group(updated);
            put(job.next().groupId(null).build(), changes);
            refreshGroupState(groupId, changes);
            refreshPending(changes, followers);
        } finally {
            lock.unlock();
        }
        journal.recordQuietly(changes);
    }

    /**
     * Cancel a group and every member that is not terminal yet.
     *
     * @return the group state after the call
     */
    public GroupState cancelGroup(String groupId) {
        ChangeSet changes = new ChangeSet();
        GroupState state;
        lock.lock();
        try {
            JobGroup group = requireGroup(groupId);
            if (!group.canceled()) {
                JobGroup updated = group.toBuilder()
                        .canceled(true)
                        .state(GroupState.CANCELED)
                        .updatedAt(Times.now())
                        .version(group.version() + 1)
                        .build();
                groups.put(groupId, updated);
                changes.group(updated);
                log.info("Group {} canceled", groupId);
            }
            JobError reason = JobError.of(ErrorKind.CANCELED, "Group " + groupId + " canceled");
            for (String memberId : group.memberIds()) {
                Job member = jobs.get(memberId);
                if (member != null) {
                    cancelOne(member, reason, changes);
                }
            }
            refreshPending(changes);
            state = groups.get(groupId).state();
        } finally {
            lock.unlock();
        }
        journal.recordQuietly(changes);
        return state;
    }

    /**
     * Set one metadata entry on a group; a null value removes the key.
     */
    public JobGroup updateGroupMetadata(String groupId, String key, Object value) {
        ChangeSet changes = new ChangeSet();
        JobGroup updated;
        lock.lock();
        try {
            updated = requireGroup(groupId).withMetadata(key, value, Times.now());
            groups.put(groupId, updated);
            changes.group(updated);
        } finally {
            lock.unlock();
        }
        journal.record(changes);
        return updated;
    }

    // ==================== Queries and waits ====================

    public Optional<Job> find(String jobId) {
        lock.lock();
        try {
            return Optional.ofNullable(jobs.get(jobId));
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String jobId) {
        return find(jobId).isPresent();
    }

    public Optional<JobGroup> findGroup(String groupId) {
        lock.lock();
        try {
            return Optional.ofNullable(groups.get(groupId));
        } finally {
            lock.unlock();
        }
    }

    public Optional<GroupStatus> groupStatus(String groupId) {
        lock.lock();
        try {
            JobGroup group = groups.get(groupId);
            return group != null ? Optional.of(statusOf(group)) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Jobs matching the filter, oldest first.
     */
    public List<Job> jobs(Predicate<Job> filter) {
        lock.lock();
        try {
            List<Job> result = new ArrayList<>();
            for (Job job : jobs.values()) {
                if (filter.test(job)) {
                    result.add(job);
                }
            }
            result.sort(Comparator.comparing(Job::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparingLong(Job::sequence));
            return result;
        } finally {
            lock.unlock();
        }
    }

    public List<JobGroup> groups() {
        lock.lock();
        try {
            List<JobGroup> result = new ArrayList<>(groups.values());
            result.sort(Comparator.comparing(JobGroup::createdAt, Comparator.nullsLast(Comparator.naturalOrder())));
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until the job is terminal.
     *
     * @param timeout maximum wait, null for no limit
     * @return latest snapshot (possibly not terminal on timeout), empty if unknown
     */
    public Optional<Job> awaitTerminal(String jobId, Duration timeout) throws InterruptedException {
        long nanos = timeout != null ? timeout.toNanos() : 0L;
        lock.lockInterruptibly();
        try {
            Job job = jobs.get(jobId);
            while (job != null && !job.isTerminal()) {
                if (timeout == null) {
                    changed.await();
                } else {
                    if (nanos <= 0) {
                        break;
                    }
                    nanos = changed.awaitNanos(nanos);
                }
                job = jobs.get(jobId);
            }
            return Optional.ofNullable(job);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until every member of the group is terminal.
     *
     * @param timeout maximum wait, null for no limit
     * @return latest group status, empty if unknown
     */
    public Optional<GroupStatus> awaitGroup(String groupId, Duration timeout) throws InterruptedException {
        long nanos = timeout != null ? timeout.toNanos() : 0L;
        lock.lockInterruptibly();
        try {
            JobGroup group = groups.get(groupId);
            GroupStatus status = group != null ? statusOf(group) : null;
            while (status != null && !status.isSettled()) {
                if (timeout == null) {
                    changed.await();
                } else {
                    if (nanos <= 0) {
                        break;
                    }
                    nanos = changed.awaitNanos(nanos);
                }
                group = groups.get(groupId);
                status = group != null ? statusOf(group) : null;
            }
            return Optional.ofNullable(status);
        } finally {
            lock.unlock();
        }
    }

    public EngineStats stats() {
        lock.lock();
        try {
            int queued = 0;
            int waiting = 0;
            int paused = 0;
            for (Job job : jobs.values()) {
                switch (job.status()) {
                    case QUEUED -> queued++;
                    case WAITING -> waiting++;
                    case PAUSED -> paused++;
                    default -> {
                    }
                }
            }
            long average = runCount == 0 ? 0 : runMillis / runCount;
            long averageQueue = startCount == 0 ? 0 : queueMillis / startCount;
            return new EngineStats(submittedCount, completedCount, failedCount, canceledCount, retriedCount,
                    average, runCount == 0 ? 0 : minRunMillis, maxRunMillis, averageQueue,
                    queued, waiting, running, paused, Duration.between(createdAt, Instant.now()));
        } finally {
            lock.unlock();
        }
    }

    // ==================== Recovery and housekeeping ====================

    /**
     * Make sure new jobs get sequence numbers above {@code floor}.
     */
    public void advanceSequence(long floor) {
        lock.lock();
        try {
            sequence = Math.max(sequence, floor);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Load a finished job into memory without persisting it, so pending jobs
     * and groups can see its final state.
     */
    public void restoreHistory(Job job) {
        if (!job.isTerminal()) {
            throw new IllegalArgumentException("Only terminal jobs are history: " + job);
        }
        lock.lock();
        try {
            if (!jobs.containsKey(job.id())) {
                index(job);
                jobs.put(job.id(), job);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-admit unfinished jobs and groups loaded from the store after a restart.
     * Load terminal dependencies and group members with {@link #restoreHistory}
     * first. Jobs that lost their in-progress attempt with no attempts left end
     * FAILED; pending cancel and pause requests are honored.
     *
     * @return number of jobs restored
     */
    public int restore(Collection<Job> loadedJobs, Collection<JobGroup> loadedGroups) {
        ChangeSet changes = new ChangeSet();
        lock.lock();
        try {
            for (JobGroup group : loadedGroups) {
                groups.put(group.id(), group);
            }
            List<Job> failed = new ArrayList<>();
            for (Job loaded : loadedJobs) {
                sequence = Math.max(sequence, loaded.sequence());
                Job job = loaded;
                if (job.status() == JobStatus.QUEUED && job.cancelRequested()) {
                    job = job.next().status(JobStatus.CANCELED)
                            .error(JobError.of(ErrorKind.CANCELED, "Canceled by request"))
                            .finishedAt(Times.now())
                            .build();
                    canceledCount++;
                } else if (job.status() == JobStatus.QUEUED && !job.canRetry()) {
                    job = job.next().status(JobStatus.FAILED)
                            .error(JobError.of(ErrorKind.TASK_EXECUTION,
                                    "Attempt interrupted by restart, no attempts left"))
                            .finishedAt(Times.now())
                            .build();
                    failedCount++;
                    failed.add(job);
                } else if (job.status() == JobStatus.QUEUED && job.pauseRequested()) {
                    job = job.next().status(JobStatus.PAUSED).pauseRequested(false).build();
                } else {
                    job = job.next().build();
                }
                index(job);
                put(job, changes);
            }
            for (Job job : failed) {
                afterFailure(job, changes);
            }
            for (JobGroup group : loadedGroups) {
                refreshGroupState(group.id(), changes);
            }
            refreshPending(changes, pending.stream().map(Job::id).toList());
            log.info("Restored {} jobs and {} groups", loadedJobs.size(), loadedGroups.size());
        } finally {
            lock.unlock();
        }
        journal.recordQuietly(changes);
        return loadedJobs.size();
    }

    /**
     * Drop finished jobs from memory. A job stays while any unfinished job
     * depends on it; group members only leave together with their whole group.
     *
     * @param finishedBefore only jobs finished strictly before this instant
     * @param filter         additional condition on each evicted job
     */
    public Eviction evict(Instant finishedBefore, Predicate<Job> filter) {
        lock.lock();
        try {
            List<Job> evictedJobs = new ArrayList<>();
            List<JobGroup> evictedGroups = new ArrayList<>();
            Set<String> seenGroups = new HashSet<>();
            for (Job job : new ArrayList<>(jobs.values())) {
                if (!jobs.containsKey(job.id()) || !isEvictable(job, finishedBefore, filter)) {
                    continue;
                }
                JobGroup group = job.groupId() != null ? groups.get(job.groupId()) : null;
                if (group == null) {
                    remove(job, evictedJobs);
                    continue;
                }
                if (!seenGroups.add(group.id())) {
                    continue;
                }
                List<Job> members = members(group);
                if (members.stream().allMatch(m -> isEvictable(m, finishedBefore, filter))) {
                    members.forEach(m -> remove(m, evictedJobs));
                    groups.remove(group.id());
                    evictedGroups.add(group);
                }
            }
            return new Eviction(evictedJobs, evictedGroups);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop handing out jobs and wake every blocked worker.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    // ==================== Internals (lock held) ====================

    private Job require(String jobId) {
        Job job = jobs.get(jobId);
        if (job == null) {
            throw NotFoundException.job(jobId);
        }
        return job;
    }

    private JobGroup requireGroup(String groupId) {
        JobGroup group = groups.get(groupId);
        if (group == null) {
            throw NotFoundException.group(groupId);
        }
        return group;
    }

    /** Replace the snapshot of a job, keeping the pending set and group state in sync. */
    private void put(Job job, ChangeSet changes) {
        Job previous = jobs.put(job.id(), job);
        if (previous != null && previous.isPending()) {
            pending.remove(previous);
        }
        if (job.isPending()) {
            pending.add(job);
        }
        changes.job(job);
        if (job.isTerminal() && (previous == null || !previous.isTerminal())) {
            finished.add(job.id());
        }
        if (job.status() == JobStatus.QUEUED) {
            if (previous == null || previous.status() != JobStatus.QUEUED) {
                Instant now = Times.now();
                runnableSince.put(job.id(), job.isDue(now) ? now : job.nextAttemptAt());
            }
        } else {
            runnableSince.remove(job.id());
        }
        if (job.groupId() != null && (previous == null || previous.status() != job.status())) {
            refreshGroupState(job.groupId(), changes);
        }
        changed.signalAll();
    }

    private void index(Job job) {
        for (String dependency : job.dependencies()) {
            dependents.computeIfAbsent(dependency, k -> new HashSet<>()).add(job.id());
        }
    }

    private Job attach(Job job, JobGroup group, ChangeSet changes) {
        Instant now = Times.now();
        JobGroup updated = group.withMember(job.id(), now);
        groups.put(group.id(), updated);
        changes.group(updated);
        Job member = job.next().groupId(group.id()).build();
        put(member, changes);
        refreshGroupState(group.id(), changes);
        return member;
    }

    private Lease start(Job job, Instant now, ChangeSet changes) {
        Instant since = runnableSince.get(job.id());
        if (since != null) {
            queueMillis += since.isBefore(now) ? Duration.between(since, now).toMillis() : 0;
            startCount++;
        }
        Job started = job.next()
                .status(JobStatus.RUNNING)
                .attempts(job.attempts() + 1)
                .startedAt(now)
                .nextAttemptAt(null)
                .progress(0.0)
                .progressMessage(null)
                .build();
        put(started, changes);
        CancellationToken token = new CancellationToken();
        tokens.put(job.id(), token);
        running++;
        log.debug("Job {} started (attempt {}/{})", job.id(), started.attempts(),
                started.retryPolicy().maxAttempts());
        return new Lease(started, token);
    }

    private boolean isCurrentAttempt(Job job, int attempt) {
        return job != null && job.status() == JobStatus.RUNNING && job.attempts() == attempt;
    }

    private void endAttempt(Job job, Instant now) {
        running--;
        tokens.remove(job.id());
        if (job.startedAt() != null) {
            long millis = Duration.between(job.startedAt(), now).toMillis();
            runMillis += millis;
            minRunMillis = Math.min(minRunMillis, millis);
            maxRunMillis = Math.max(maxRunMillis, millis);
            runCount++;
        }
    }

    private AttemptOutcome failAttempt(Job job, JobError error, ChangeSet changes) {
        Instant now = Times.now();
        endAttempt(job, now);
        AttemptOutcome outcome;

        if (job.cancelRequested()) {
            Job canceled = job.next()
                    .status(JobStatus.CANCELED)
                    .error(JobError.of(ErrorKind.CANCELED, "Canceled while running: " + error.message()))
                    .finishedAt(now)
                    .pauseRequested(false)
                    .build();
            canceledCount++;
            put(canceled, changes);
            log.info("Job {} canceled during attempt {}", job.id(), job.attempts());
            outcome = AttemptOutcome.CANCELED;
        } else {
            RetryCoordinator.Decision decision = retryCoordinator.decide(job, error);
            if (decision.retry()) {
                JobStatus next = job.pauseRequested() ? JobStatus.PAUSED : JobStatus.QUEUED;
                Job retried = job.next()
                        .status(next)
                        .nextAttemptAt(now.plus(decision.delay()))
                        .pauseRequested(false)
                        .build();
                retriedCount++;
                put(retried, changes);
                log.warn("Job {} attempt {}/{} failed ({}), retry in {} ms", job.id(), job.attempts(),
                        job.retryPolicy().maxAttempts(), error, decision.delay().toMillis());
                outcome = AttemptOutcome.RETRY_SCHEDULED;
            } else {
                Job failed = job.next()
                        .status(JobStatus.FAILED)
                        .error(error)
                        .result(null)
                        .finishedAt(now)
                        .pauseRequested(false)
                        .build();
                failedCount++;
                put(failed, changes);
                log.error("Job {} failed after {} attempt(s): {}", job.id(), job.attempts(), error);
                afterFailure(failed, changes);
                outcome = AttemptOutcome.FAILED;
            }
        }
        refreshPending(changes);
        return outcome;
    }

    /** Cancel the unfinished siblings of a failed job in a cancel-on-failure group. */
    private void afterFailure(Job failed, ChangeSet changes) {
        JobGroup group = failed.groupId() != null ? groups.get(failed.groupId()) : null;
        if (group == null || !group.cancelOnFailure()) {
            return;
        }
        JobError reason = JobError.of(ErrorKind.CANCELED,
                "Group " + group.id() + " member " + failed.id() + " failed");
        int canceled = 0;
        for (String memberId : group.memberIds()) {
            Job sibling = jobs.get(memberId);
            if (sibling != null && !sibling.id().equals(failed.id()) && !sibling.isTerminal()) {
                cancelOne(sibling, reason, changes);
                canceled++;
            }
        }
        if (canceled > 0) {
            log.info("Group {}: canceled {} sibling(s) of failed job {}", group.id(), canceled, failed.id());
        }
    }

    private void cancelOne(Job job, JobError reason, ChangeSet changes) {
        switch (job.status()) {
            case CREATED, QUEUED, WAITING, PAUSED -> {
                Job canceled = job.next()
                        .status(JobStatus.CANCELED)
                        .error(reason)
                        .result(null)
                        .finishedAt(Times.now())
                        .nextAttemptAt(null)
                        .pauseRequested(false)
                        .build();
                canceledCount++;
                put(canceled, changes);
                log.info("Job {} canceled: {}", job.id(), reason.message());
            }
            case RUNNING -> {
                if (!job.cancelRequested()) {
                    put(job.next().cancelRequested(true).build(), changes);
                }
                CancellationToken token = tokens.get(job.id());
                if (token != null) {
                    token.cancel(reason.message());
                }
                log.info("Job {} asked to stop: {}", job.id(), reason.message());
            }
            default -> {
                // terminal
            }
        }
    }

    /** Place a CREATED or PAUSED job into the pending set in its current eligibility. */
    private void enqueue(Job job, ChangeSet changes) {
        Eligibility eligibility = evaluate(job);
        if (eligibility.cancelReason() != null) {
            cancelOne(job, eligibility.cancelReason(), changes);
        } else {
            put(job.next().status(eligibility.status()).build(), changes);
        }
    }

    private Eligibility evaluate(Job job) {
        boolean blocked = false;
        for (String dependencyId : job.dependencies()) {
            Job dependency = jobs.get(dependencyId);
            if (dependency == null) {
                return new Eligibility(null, JobError.of(ErrorKind.DEPENDENCY_FAILED,
                        "Dependency " + dependencyId + " not found"));
            }
            if (dependency.status() == JobStatus.FAILED || dependency.status() == JobStatus.CANCELED) {
                return new Eligibility(null, JobError.of(ErrorKind.DEPENDENCY_FAILED,
                        "Dependency " + dependencyId + " ended " + dependency.status()));
            }
            if (dependency.status() != JobStatus.COMPLETED) {
                blocked = true;
            }
        }
        JobGroup group = job.groupId() != null ? groups.get(job.groupId()) : null;
        if (group != null && group.cancelOnFailure()) {
            for (String memberId : group.memberIds()) {
                Job member = jobs.get(memberId);
                if (member != null && member.status() == JobStatus.FAILED) {
                    return new Eligibility(null, JobError.of(ErrorKind.DEPENDENCY_FAILED,
                            "Group " + group.id() + " member " + memberId + " failed"));
                }
            }
        }
        if (group != null && group.sequential()) {
            for (String memberId : group.memberIds()) {
                if (memberId.equals(job.id())) {
                    break;
                }
                Job prior = jobs.get(memberId);
                if (prior == null) {
                    continue;
                }
                if (prior.status() == JobStatus.FAILED || prior.status() == JobStatus.CANCELED) {
                    return new Eligibility(null, JobError.of(ErrorKind.DEPENDENCY_FAILED,
                            "Previous group member " + memberId + " ended " + prior.status()));
                }
                if (prior.status() != JobStatus.COMPLETED) {
                    blocked = true;
                    break;
                }
            }
        }
        return new Eligibility(blocked ? JobStatus.WAITING : JobStatus.QUEUED, null);
    }

    private void refreshPending(ChangeSet changes) {
        refreshPending(changes, List.of());
    }

    /**
     * Re-evaluate the given jobs and every pending job whose eligibility may
     * have changed because a job became terminal. Cancellations feed back into
     * the same work list until nothing cascades further.
     */
    private void refreshPending(ChangeSet changes, Collection<String> candidates) {
        Deque<String> work = new ArrayDeque<>(candidates);
        while (!work.isEmpty() || !finished.isEmpty()) {
            if (!finished.isEmpty()) {
                affectedBy(finished.poll(), work);
                continue;
            }
            Job job = jobs.get(work.poll());
            if (job == null || !job.isPending()) {
                continue;
            }
            Eligibility eligibility = evaluate(job);
            if (eligibility.cancelReason() != null) {
                cancelOne(job, eligibility.cancelReason(), changes);
            } else if (eligibility.status() != job.status()) {
                put(job.next().status(eligibility.status()).build(), changes);
            }
        }
    }

    /** Jobs gated by {@code jobId}: its dependents and, in a sequential group, the next unfinished member. */
    private void affectedBy(String jobId, Deque<String> work) {
        work.addAll(dependents.getOrDefault(jobId, Set.of()));
        Job job = jobs.get(jobId);
        JobGroup group = job != null && job.groupId() != null ? groups.get(job.groupId()) : null;
        if (group == null || !group.sequential()) {
            return;
        }
        List<String> members = group.memberIds();
        for (int i = members.indexOf(jobId) + 1; i > 0 && i < members.size(); i++) {
            work.add(members.get(i));
            Job follower = jobs.get(members.get(i));
            if (follower != null && !follower.isTerminal()) {
                break;
            }
        }
    }

    private void refreshGroupState(String groupId, ChangeSet changes) {
        JobGroup group = groups.get(groupId);
        if (group == null) {
            return;
        }
        GroupState state = statusOf(group).state();
        if (state != group.state()) {
            JobGroup updated = group.toBuilder()
                    .state(state)
                    .updatedAt(Times.now())
                    .version(group.version() + 1)
                    .build();
            groups.put(groupId, updated);
            changes.group(updated);
            log.debug("Group {} is now {}", groupId, state);
        }
    }

    private GroupStatus statusOf(JobGroup group) {
        return GroupStatus.of(group, members(group));
    }

    private List<Job> members(JobGroup group) {
        List<Job> members = new ArrayList<>(group.memberIds().size());
        for (String memberId : group.memberIds()) {
            Job member = jobs.get(memberId);
            if (member != null) {
                members.add(member);
            }
        }
        return members;
    }

    private boolean isEvictable(Job job, Instant finishedBefore, Predicate<Job> filter) {
        if (!job.isTerminal() || job.finishedAt() == null || !job.finishedAt().isBefore(finishedBefore)
                || !filter.test(job)) {
            return false;
        }
        for (String dependentId : dependents.getOrDefault(job.id(), Set.of())) {
            Job dependent = jobs.get(dependentId);
            if (dependent != null && !dependent.isTerminal()) {
                return false;
            }
        }
        return true;
    }

    private void remove(Job job, List<Job> evicted) {
        jobs.remove(job.id());
        for (String dependency : job.dependencies()) {
            Set<String> ids = dependents.get(dependency);
            if (ids != null) {
                ids.remove(job.id());
                if (ids.isEmpty()) {
                    dependents.remove(dependency);
                }
            }
        }
        evicted.add(job);
    }
}
