package batchflow.engine.service;

import batchflow.engine.error.NotFoundException;
import batchflow.engine.model.GroupState;
import batchflow.engine.model.GroupStatus;
import batchflow.engine.model.Job;
import batchflow.engine.model.JobGroup;
import batchflow.engine.queue.JobQueue;
import batchflow.engine.repository.JobGroupRepository;
import batchflow.engine.repository.JobRepository;
import batchflow.engine.util.JsonValues;
import batchflow.engine.util.Times;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Business logic for job groups.
 */
public class GroupService {

    private static final Logger log = LoggerFactory.getLogger(GroupService.class);

    private final JobQueue queue;
    private final JobGroupRepository groupRepository;
    private final JobRepository jobRepository;

    public GroupService(JobQueue queue, JobGroupRepository groupRepository, JobRepository jobRepository) {
        this.queue = queue;
        this.groupRepository = groupRepository;
        this.jobRepository = jobRepository;
    }

    /**
     * Create an empty group.
     *
     * @param sequential      members run one at a time in insertion order
     * @param cancelOnFailure a failed member cancels every unfinished sibling
     * @return the group ID
     */
    public String createGroup(String name, boolean sequential, boolean cancelOnFailure) {
        String groupId = "group-" + UUID.randomUUID();
        Instant now = Times.now();
        JobGroup group = JobGroup.builder()
                .id(groupId)
                .name(name != null && !name.isBlank() ? name : groupId)
                .sequential(sequential)
                .cancelOnFailure(cancelOnFailure)
                .state(GroupState.EMPTY)
                .createdAt(now)
                .updatedAt(now)
                .build();

        queue.addGroup(group);
        log.info("Created group {} '{}' (sequential={}, cancelOnFailure={})",
                groupId, group.name(), sequential, cancelOnFailure);
        return groupId;
    }

    public void addJobToGroup(String jobId, String groupId) {
        queue.addToGroup(jobId, groupId);
        log.debug("Job {} added to group {}", jobId, groupId);
    }

    public void removeJobFromGroup(String jobId, String groupId) {
        queue.removeFromGroup(jobId, groupId);
        log.debug("Job {} removed from group {}", jobId, groupId);
    }

    /**
     * Attach a value to the group; a null value removes the key.
     *
     * @throws IllegalArgumentException if the value is not JSON serializable
     */
    public void setMetadata(String groupId, String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("metadata key is required");
        }
        Object stored = null;
        if (value != null) {
            Map<String, Object> entry = new HashMap<>();
            entry.put(key, value);
            stored = JsonValues.normalize(entry, "metadata").get(key);
        }
        queue.updateGroupMetadata(groupId, key, stored);
        log.debug("Group {} metadata '{}' updated", groupId, key);
    }

    public Object getMetadata(String groupId, String key, Object defaultValue) {
        JobGroup group = findGroup(groupId).orElseThrow(() -> NotFoundException.group(groupId));
        return group.metadata(key, defaultValue);
    }

    /**
     * Cancel the group and every unfinished member.
     */
    public GroupState cancelGroup(String groupId) {
        if (queue.findGroup(groupId).isEmpty()) {
            return storedGroup(groupId).state();
        }
        return queue.cancelGroup(groupId);
    }

    /**
     * Block until every member of the group is terminal.
     *
     * @param timeout null to wait indefinitely
     * @return the group state at return time
     */
    public GroupState waitForGroup(String groupId, Duration timeout) throws InterruptedException {
        Optional<GroupStatus> status = queue.awaitGroup(groupId, timeout);
        if (status.isPresent()) {
            return status.get().state();
        }
        return storedGroup(groupId).state();
    }

    public GroupStatus getGroupStatus(String groupId) {
        Optional<GroupStatus> live = queue.groupStatus(groupId);
        if (live.isPresent()) {
            return live.get();
        }
        JobGroup group = storedGroup(groupId);
        List<Job> members = new ArrayList<>();
        for (String memberId : group.memberIds()) {
            jobRepository.findById(memberId).ifPresent(members::add);
        }
        return GroupStatus.of(group, members);
    }

    public Optional<JobGroup> findGroup(String groupId) {
        Optional<JobGroup> live = queue.findGroup(groupId);
        return live.isPresent() ? live : groupRepository.findById(groupId);
    }

    /**
     * Groups currently held in memory, oldest first.
     */
    public List<JobGroup> listGroups() {
        return queue.groups();
    }

    private JobGroup storedGroup(String groupId) {
        return groupRepository.findById(groupId).orElseThrow(() -> NotFoundException.group(groupId));
    }
}
