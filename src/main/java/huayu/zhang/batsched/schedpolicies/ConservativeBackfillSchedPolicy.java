package huayu.zhang.batsched.schedpolicies;

import huayu.zhang.batsched.cluster.ReservationTable;
import huayu.zhang.batsched.cluster.ResourceTracker;
import huayu.zhang.batsched.datastructures.Allocation;
import huayu.zhang.batsched.datastructures.Job;
import huayu.zhang.batsched.utils.Utils;

import java.util.*;
import java.util.logging.Logger;

/**
 * Conservative backfilling over the reservation table. A job may start only
 * on resources that stay free for its whole walltime, so nothing already
 * reserved is ever disturbed.
 */
public class ConservativeBackfillSchedPolicy extends SchedPolicy {
  private static Logger LOG = Logger.getLogger(ConservativeBackfillSchedPolicy.class.getName());

  public ConservativeBackfillSchedPolicy() {
    this("conservative_backfilling", "1.0.0");
  }

  protected ConservativeBackfillSchedPolicy(String name, String version) {
    super(name, version);
  }

  @Override
  public ResourceTracker createTracker(int numResources) {
    return new ReservationTable(numResources);
  }

  @Override
  public Optional<SortedSet<Integer>> feasibleNow(Job job, double now, ResourceTracker tracker) {
    ReservationTable table = asTable(tracker);
    int slot = Utils.toSlot(now);
    table.ensureHorizon(slot);
    int k = job.getResourcesRequested();
    if (!table.isAvailable(k, slot)) {
      return Optional.empty();
    }
    SortedSet<Integer> ids = first(table.getFree(slot), k);
    if (!table.isFreeThroughout(ids, slot, windowEnd(job, now, table))) {
      LOG.fine("Job " + job.getJobId() + " fits now on " + ids
          + " but not for its entire walltime " + job.getWalltime());
      return Optional.empty();
    }
    return Optional.of(ids);
  }

  @Override
  public Optional<SortedSet<Integer>> feasibleBackfill(Job job, double now, ResourceTracker tracker) {
    ReservationTable table = asTable(tracker);
    int slot = Utils.toSlot(now);
    table.ensureHorizon(slot);
    int k = job.getResourcesRequested();
    if (!table.isAvailable(k, slot)) {
      return Optional.empty();
    }
    Optional<SortedSet<Integer>> candidates = freeThroughWindow(job, now, table);
    if (!candidates.isPresent()) {
      return candidates;
    }
    return Optional.of(select(candidates.get(), k));
  }

  /**
   * Intersects the ids free at the slot of {@code now} with every following
   * slot of the job's window. Empty once fewer than the requested count
   * survive.
   */
  protected Optional<SortedSet<Integer>> freeThroughWindow(Job job, double now,
      ReservationTable table) {
    int k = job.getResourcesRequested();
    int slot = Utils.toSlot(now);
    int end = windowEnd(job, now, table);
    SortedSet<Integer> assigned = table.getFree(slot);
    for (int t = slot; t < end; t++) {
      final int current = t;
      assigned.removeIf(id -> !table.isFree(id, current));
      if (assigned.size() < k) {
        LOG.fine("Job " + job.getJobId() + " cannot be backfilled: " + assigned.size()
            + " resources left at slot " + t + ", needs " + k);
        return Optional.empty();
      }
    }
    return Optional.of(assigned);
  }

  protected SortedSet<Integer> select(SortedSet<Integer> candidates, int k) {
    return first(candidates, k);
  }

  // exclusive end of the slots the job would reserve starting at now
  protected int windowEnd(Job job, double now, ReservationTable table) {
    int end = job.getEndSlot(now);
    if (end == Allocation.OPEN_END) {
      return table.getHorizon();
    }
    table.ensureHorizon(end);
    return end;
  }

  private static ReservationTable asTable(ResourceTracker tracker) {
    if (!(tracker instanceof ReservationTable)) {
      throw new IllegalArgumentException("Conservative backfilling needs a reservation table, got "
          + tracker.getClass().getSimpleName());
    }
    return (ReservationTable) tracker;
  }
}
