package huayu.zhang.batsched.schedpolicies;

import huayu.zhang.batsched.cluster.ResourceTracker;
import huayu.zhang.batsched.datastructures.Job;

import java.util.*;

/**
 * EASY backfilling without a reservation for the queue head: any later job
 * that fits the free set right now may jump ahead. Walltimes are ignored.
 */
public class EasyBackfillSchedPolicy extends FcfsSchedPolicy {

  public EasyBackfillSchedPolicy() {
    super("easy_backfilling", "1.0.0");
  }

  @Override
  public Optional<SortedSet<Integer>> feasibleBackfill(Job job, double now, ResourceTracker tracker) {
    return feasibleNow(job, now, tracker);
  }
}
