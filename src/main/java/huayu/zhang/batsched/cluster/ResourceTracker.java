package huayu.zhang.batsched.cluster;

import huayu.zhang.batsched.datastructures.Allocation;

import java.util.*;

/**
 * Tracks which of the platform's interchangeable resource units are free.
 * Resource ids run from 0 to {@code numResources - 1} and are always handed
 * out in ascending order.
 *
 * <p>Snapshot trackers ignore the slot arguments; time-aware trackers index
 * every query by integer simulation time.
 */
public abstract class ResourceTracker {

  protected final int numResources_;

  public ResourceTracker(int numResources) {
    if (numResources < 0) {
      throw new IllegalArgumentException("Negative platform size " + numResources);
    }
    numResources_ = numResources;
  }

  public int getNumResources() { return numResources_; }

  public abstract boolean isTimeAware();

  public boolean isAvailable(int count, int slot) {
    return freeCount(slot) >= count;
  }

  public abstract int freeCount(int slot);

  // ascending copy of the ids free at the slot
  public abstract SortedSet<Integer> getFree(int slot);

  public abstract boolean isFree(int resourceId, int slot);

  /**
   * Removes the allocation's ids from the free set(s) it covers.
   *
   * @throws IllegalStateException if any id is already taken
   */
  public abstract void take(Allocation allocation);

  /**
   * Gives the allocation's ids back, starting at {@code fromSlot}.
   *
   * @return false if the tracker did not hold the allocation
   */
  public abstract boolean release(Allocation allocation, int fromSlot);

  // makes slot addressable; newly created slots start all free
  public abstract void ensureHorizon(int slot);

  // number of addressable slots
  public abstract int getHorizon();

  public abstract String describe(int fromSlot);

  protected TreeSet<Integer> allResources() {
    TreeSet<Integer> all = new TreeSet<>();
    for (int i = 0; i < numResources_; i++) {
      all.add(i);
    }
    return all;
  }
}
