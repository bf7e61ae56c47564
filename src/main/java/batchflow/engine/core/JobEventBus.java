package batchflow.engine.core;

import batchflow.engine.model.Job;
import batchflow.engine.model.JobGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fan-out of job and group change notifications to UI or CLI observers.
 * A failing listener is logged and does not affect the others.
 */
public final class JobEventBus {

    private static final Logger log = LoggerFactory.getLogger(JobEventBus.class);

    private final CopyOnWriteArrayList<JobListener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(JobListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(JobListener listener) {
        listeners.remove(listener);
    }

    public void publishJob(Job job) {
        for (JobListener listener : listeners) {
            try {
                listener.onJobChanged(job);
            } catch (RuntimeException e) {
                log.warn("Job listener {} failed on {}: {}", listener, job.id(), e.getMessage(), e);
            }
        }
    }

    public void publishGroup(JobGroup group) {
        for (JobListener listener : listeners) {
            try {
                listener.onGroupChanged(group);
            } catch (RuntimeException e) {
                log.warn("Job listener {} failed on group {}: {}", listener, group.id(), e.getMessage(), e);
            }
        }
    }
}
