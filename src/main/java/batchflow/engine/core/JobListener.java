package batchflow.engine.core;

import batchflow.engine.model.Job;
import batchflow.engine.model.JobGroup;

/**
 * Observer of job and group changes. Called on the thread that made the change,
 * after the lock is released; keep it short.
 */
public interface JobListener {

    void onJobChanged(Job job);

    default void onGroupChanged(JobGroup group) {
    }
}
