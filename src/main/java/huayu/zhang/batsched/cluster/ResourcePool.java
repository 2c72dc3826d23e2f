package huayu.zhang.batsched.cluster;

import huayu.zhang.batsched.datastructures.Allocation;

import java.util.*;
import java.util.logging.Logger;

/**
 * Snapshot tracker: a single free set updated in place as jobs start and
 * complete.
 */
public class ResourcePool extends ResourceTracker {
  private static Logger LOG = Logger.getLogger(ResourcePool.class.getName());

  private final TreeSet<Integer> free_;

  public ResourcePool(int numResources) {
    super(numResources);
    free_ = allResources();
    LOG.fine("Initialize resource pool with " + numResources + " resources");
  }

  @Override
  public boolean isTimeAware() { return false; }

  @Override
  public int freeCount(int slot) { return free_.size(); }

  @Override
  public SortedSet<Integer> getFree(int slot) { return new TreeSet<>(free_); }

  @Override
  public boolean isFree(int resourceId, int slot) { return free_.contains(resourceId); }

  @Override
  public void take(Allocation allocation) {
    for (int id : allocation.getResources()) {
      if (!free_.contains(id)) {
        throw new IllegalStateException("Resource " + id + " is already taken, cannot allocate "
            + allocation);
      }
    }
    free_.removeAll(allocation.getResources());
  }

  @Override
  public boolean release(Allocation allocation, int fromSlot) {
    for (int id : allocation.getResources()) {
      if (free_.contains(id) || id < 0 || id >= numResources_) {
        throw new IllegalStateException("Resource " + id + " is not held, cannot release "
            + allocation);
      }
    }
    free_.addAll(allocation.getResources());
    return true;
  }

  @Override
  public void ensureHorizon(int slot) {}

  @Override
  public int getHorizon() { return 1; }

  @Override
  public String describe(int fromSlot) {
    return free_.size() + "/" + numResources_ + " resources available " + free_;
  }
}
