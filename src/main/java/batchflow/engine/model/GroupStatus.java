package batchflow.engine.model;

import java.util.Collection;

/**
 * Point-in-time summary of a group and its members.
 */
public record GroupStatus(
        String groupId,
        String name,
        GroupState state,
        int total,
        int completed,
        int failed,
        int canceled,
        int running,
        int active,
        double progress) {

    /**
     * Summarize a group from the current snapshots of its members.
     * Members missing from {@code members} are not counted.
     */
    public static GroupStatus of(JobGroup group, Collection<Job> members) {
        int completed = 0;
        int failed = 0;
        int canceled = 0;
        int running = 0;
        int active = 0;
        for (Job job : members) {
            switch (job.status()) {
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case CANCELED -> canceled++;
                case RUNNING -> {
                    running++;
                    active++;
                }
                default -> active++;
            }
        }
        int total = members.size();
        double progress = total == 0 ? 0.0 : (completed + failed + canceled) * 100.0 / total;
        return new GroupStatus(group.id(), group.name(),
                deriveState(group.canceled(), total, failed, canceled, active),
                total, completed, failed, canceled, running, active, progress);
    }

    static GroupState deriveState(boolean explicitlyCanceled, int total, int failed, int canceled, int active) {
        if (explicitlyCanceled) {
            return GroupState.CANCELED;
        }
        if (total == 0) {
            return GroupState.EMPTY;
        }
        if (failed > 0) {
            return GroupState.FAILED;
        }
        if (active > 0) {
            return GroupState.RUNNING;
        }
        return canceled > 0 ? GroupState.CANCELED : GroupState.COMPLETED;
    }

    /** Every member is terminal. */
    public boolean isSettled() {
        return active == 0;
    }
}
