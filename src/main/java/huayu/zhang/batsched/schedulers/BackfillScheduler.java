package huayu.zhang.batsched.schedulers;

import huayu.zhang.batsched.cluster.ResourceTracker;
import huayu.zhang.batsched.datastructures.Allocation;
import huayu.zhang.batsched.datastructures.Job;
import huayu.zhang.batsched.datastructures.JobRegistry;
import huayu.zhang.batsched.decisions.Decision;
import huayu.zhang.batsched.decisions.ExecuteJob;
import huayu.zhang.batsched.schedpolicies.*;
import huayu.zhang.batsched.utils.Configuration.SchedulingPolicy;
import huayu.zhang.batsched.utils.Utils;

import java.util.*;
import java.util.logging.Logger;

// runs the queue discipline shared by every policy: start heads while they
// fit, otherwise backfill at most one later job and end the cycle
public class BackfillScheduler {
  private static Logger LOG = Logger.getLogger(BackfillScheduler.class.getName());

  private final SchedPolicy policy_;
  private final BackfillStats stats_;
  private SchedulingListener listener_;

  public BackfillScheduler(SchedulingPolicy schedPolicy) {
    this(createPolicy(schedPolicy));
  }

  public BackfillScheduler(SchedPolicy policy) {
    policy_ = policy;
    stats_ = new BackfillStats();
    listener_ = SchedulingListener.NOOP;
  }

  public static SchedPolicy createPolicy(SchedulingPolicy schedPolicy) {
    switch (schedPolicy) {
    case FCFS:
      return new FcfsSchedPolicy();
    case EASY:
      return new EasyBackfillSchedPolicy();
    case CONSERVATIVE:
      return new ConservativeBackfillSchedPolicy();
    case BEST_CONTIGUOUS:
      return new BestContiguousSchedPolicy();
    default:
      throw new IllegalArgumentException("Unknown scheduling policy " + schedPolicy);
    }
  }

  public SchedPolicy getPolicy() { return policy_; }
  public BackfillStats getStats() { return stats_; }
  public void setListener(SchedulingListener listener) { listener_ = listener; }

  /**
   * Runs one scheduling pass at time {@code now} and appends the start
   * decisions, in the order they were taken, to {@code decisions}.
   */
  public void schedule(double now, JobRegistry registry, ResourceTracker tracker,
      List<Decision> decisions) {
    int slot = Utils.toSlot(now);
    tracker.ensureHorizon(slot);
    LOG.fine("===== SCHEDULING CYCLE START (time: " + now + ", queue: "
        + registry.numPending() + ") =====");

    while (registry.hasPending()) {
      Job head = registry.peekPending();
      Optional<SortedSet<Integer>> resources = policy_.feasibleNow(head, now, tracker);
      if (resources.isPresent()) {
        start(head, resources.get(), now, registry, tracker, decisions, false);
        continue;
      }
      LOG.fine("Job " + head.getJobId() + " cannot start now (needs "
          + head.getResourcesRequested() + " hosts, " + tracker.freeCount(slot) + " free)");
      Job backfilled = backfillOne(now, registry, tracker, decisions);
      if (backfilled == null) {
        LOG.fine("No jobs could be backfilled, ending scheduling cycle");
      } else {
        LOG.fine("Job " + backfilled.getJobId() + " was backfilled, ending scheduling cycle");
      }
      break;
    }
  }

  private Job backfillOne(double now, JobRegistry registry, ResourceTracker tracker,
      List<Decision> decisions) {
    List<Job> queue = registry.getPendingJobs();
    for (int i = 1; i < queue.size(); i++) {
      Job candidate = queue.get(i);
      Optional<SortedSet<Integer>> resources = policy_.feasibleBackfill(candidate, now, tracker);
      if (resources.isPresent()) {
        start(candidate, resources.get(), now, registry, tracker, decisions, true);
        return candidate;
      }
    }
    return null;
  }

  private void start(Job job, SortedSet<Integer> resources, double now, JobRegistry registry,
      ResourceTracker tracker, List<Decision> decisions, boolean backfill) {
    Allocation allocation = policy_.allocate(job, resources, now, tracker);
    tracker.take(allocation);
    registry.markRunning(job, allocation, now);
    decisions.add(new ExecuteJob(job.getJobId(), allocation.getResources()));
    if (backfill) {
      stats_.recordBackfill(allocation);
    }
    LOG.info((backfill ? "Backfill" : "Start") + " job " + job.getJobId() + " on resources "
        + Utils.toHostAllocation(allocation.getResources()) + " at " + now);
    listener_.onJobStarted(job, allocation, backfill);
  }
}
