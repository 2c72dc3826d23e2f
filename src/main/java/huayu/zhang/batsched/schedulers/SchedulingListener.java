package huayu.zhang.batsched.schedulers;

import huayu.zhang.batsched.cluster.ResourceTracker;
import huayu.zhang.batsched.datastructures.Allocation;
import huayu.zhang.batsched.datastructures.Job;
import huayu.zhang.batsched.datastructures.JobRegistry;
import huayu.zhang.batsched.decisions.Decision;

import java.util.List;

/**
 * Observes a decision cycle. Callbacks run synchronously on the caller's
 * thread and must not mutate the registry or the tracker.
 */
public interface SchedulingListener {

  SchedulingListener NOOP = new SchedulingListener() {};

  default void onCycleStart(double now, JobRegistry registry, ResourceTracker tracker) {}

  default void onJobStarted(Job job, Allocation allocation, boolean backfilled) {}

  default void onJobRejected(Job job, int numResources) {}

  default void onJobCompleted(String jobId, Allocation allocation, ResourceTracker tracker) {}

  default void onCycleEnd(double now, List<Decision> decisions) {}
}
