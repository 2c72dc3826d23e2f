package huayu.zhang.batsched.schedpolicies;

import huayu.zhang.batsched.cluster.ResourcePool;
import huayu.zhang.batsched.cluster.ResourceTracker;
import huayu.zhang.batsched.datastructures.Job;
import huayu.zhang.batsched.utils.Utils;

import java.util.*;

// strict first come first served: the head runs when it fits, nobody passes it
public class FcfsSchedPolicy extends SchedPolicy {

  public FcfsSchedPolicy() {
    this("fcfs", "0.1.0");
  }

  protected FcfsSchedPolicy(String name, String version) {
    super(name, version);
  }

  @Override
  public ResourceTracker createTracker(int numResources) {
    return new ResourcePool(numResources);
  }

  @Override
  public Optional<SortedSet<Integer>> feasibleNow(Job job, double now, ResourceTracker tracker) {
    int slot = Utils.toSlot(now);
    if (!tracker.isAvailable(job.getResourcesRequested(), slot)) {
      return Optional.empty();
    }
    return Optional.of(first(tracker.getFree(slot), job.getResourcesRequested()));
  }
}
