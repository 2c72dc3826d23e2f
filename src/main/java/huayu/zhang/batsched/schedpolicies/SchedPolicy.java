package huayu.zhang.batsched.schedpolicies;

import huayu.zhang.batsched.cluster.ResourceTracker;
import huayu.zhang.batsched.datastructures.Allocation;
import huayu.zhang.batsched.datastructures.Job;
import huayu.zhang.batsched.utils.Utils;

import java.util.*;

/**
 * Feasibility tests and resource selection of one allocation policy. The
 * scheduling loop itself lives in
 * {@link huayu.zhang.batsched.schedulers.BackfillScheduler}.
 */
public abstract class SchedPolicy {

  private final String name_;
  private final String version_;

  public SchedPolicy(String name, String version) {
    name_ = name;
    version_ = version;
  }

  public String getName() { return name_; }
  public String getVersion() { return version_; }

  public abstract ResourceTracker createTracker(int numResources);

  /**
   * Resources the queue head could start on at time {@code now}, if any.
   */
  public abstract Optional<SortedSet<Integer>> feasibleNow(Job job, double now,
      ResourceTracker tracker);

  /**
   * Resources a job behind the queue head could be backfilled on. Policies
   * without backfilling never find any.
   */
  public Optional<SortedSet<Integer>> feasibleBackfill(Job job, double now,
      ResourceTracker tracker) {
    return Optional.empty();
  }

  public Allocation allocate(Job job, SortedSet<Integer> resources, double now,
      ResourceTracker tracker) {
    int slot = Utils.toSlot(now);
    int end = job.getEndSlot(now);
    if (!tracker.isTimeAware() || end == Allocation.OPEN_END) {
      return Allocation.openEnded(job.getJobId(), resources, slot);
    }
    return new Allocation(job.getJobId(), resources, slot, end);
  }

  // the k numerically smallest ids
  protected static SortedSet<Integer> first(SortedSet<Integer> ids, int k) {
    SortedSet<Integer> chosen = new TreeSet<>();
    Iterator<Integer> it = ids.iterator();
    while (chosen.size() < k && it.hasNext()) {
      chosen.add(it.next());
    }
    return chosen;
  }

  @Override
  public String toString() { return name_ + " " + version_; }
}
