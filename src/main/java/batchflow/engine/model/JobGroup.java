package batchflow.engine.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable domain model of a job group.
 * Members are referenced by id only; the group never owns job objects.
 */
public final class JobGroup {
    private final String id;
    private final String name;
    private final boolean sequential;
    private final boolean cancelOnFailure;
    private final List<String> memberIds;
    private final boolean canceled;
    private final Map<String, Object> metadata;
    private final GroupState state;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final long version;

    private JobGroup(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.sequential = builder.sequential;
        this.cancelOnFailure = builder.cancelOnFailure;
        this.memberIds = List.copyOf(builder.memberIds);
        this.canceled = builder.canceled;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.state = Objects.requireNonNull(builder.state, "state is required");
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.version = builder.version;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public boolean sequential() {
        return sequential;
    }

    public boolean cancelOnFailure() {
        return cancelOnFailure;
    }

    public List<String> memberIds() {
        return memberIds;
    }

    public boolean canceled() {
        return canceled;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    /** Value stored under {@code key}, or {@code defaultValue} when absent. */
    public Object metadata(String key, Object defaultValue) {
        return metadata.getOrDefault(key, defaultValue);
    }

    public GroupState state() {
        return state;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public long version() {
        return version;
    }

    public boolean contains(String jobId) {
        return memberIds.contains(jobId);
    }

    /** Copy with {@code jobId} appended to the member list. */
    public JobGroup withMember(String jobId, Instant now) {
        List<String> members = new ArrayList<>(memberIds);
        members.add(jobId);
        return toBuilder().memberIds(members).updatedAt(now).version(version + 1).build();
    }

    /** Copy with {@code jobId} removed from the member list. */
    public JobGroup withoutMember(String jobId, Instant now) {
        List<String> members = new ArrayList<>(memberIds);
        members.remove(jobId);
        return toBuilder().memberIds(members).updatedAt(now).version(version + 1).build();
    }

    /** Copy with {@code key} set to {@code value}; a null value removes the key. */
    public JobGroup withMetadata(String key, Object value, Instant now) {
        Map<String, Object> updated = new LinkedHashMap<>(metadata);
        if (value == null) {
            updated.remove(key);
        } else {
            updated.put(key, value);
        }
        return toBuilder().metadata(updated).updatedAt(now).version(version + 1).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .sequential(sequential)
                .cancelOnFailure(cancelOnFailure)
                .memberIds(memberIds)
                .canceled(canceled)
                .metadata(metadata)
                .state(state)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .version(version);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private boolean sequential;
        private boolean cancelOnFailure;
        private List<String> memberIds = List.of();
        private boolean canceled;
        private Map<String, Object> metadata = Map.of();
        private GroupState state = GroupState.EMPTY;
        private Instant createdAt;
        private Instant updatedAt;
        private long version;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder sequential(boolean sequential) {
            this.sequential = sequential;
            return this;
        }

        public Builder cancelOnFailure(boolean cancelOnFailure) {
            this.cancelOnFailure = cancelOnFailure;
            return this;
        }

        public Builder memberIds(List<String> memberIds) {
            this.memberIds = memberIds != null ? memberIds : List.of();
            return this;
        }

        public Builder canceled(boolean canceled) {
            this.canceled = canceled;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata != null ? metadata : Map.of();
            return this;
        }

        public Builder state(GroupState state) {
            this.state = state;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public JobGroup build() {
            return new JobGroup(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobGroup group))
            return false;
        return Objects.equals(id, group.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "JobGroup{id='" + id + "', name='" + name + "', state=" + state + ", members=" + memberIds.size() + "}";
    }
}
