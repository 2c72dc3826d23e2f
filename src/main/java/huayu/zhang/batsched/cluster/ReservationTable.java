package huayu.zhang.batsched.cluster;

import huayu.zhang.batsched.datastructures.Allocation;

import java.util.*;
import java.util.logging.Logger;

/**
 * Time-indexed free sets, one per integer slot, extended lazily and never
 * shrunk. Slots behind the current time stay as history.
 *
 * <p>Open-ended reservations (no usable walltime) are pinned: their ids are
 * left out of every slot created after they were taken, until released.
 */
public class ReservationTable extends ResourceTracker {
  private static Logger LOG = Logger.getLogger(ReservationTable.class.getName());

  private final List<TreeSet<Integer>> slots_;
  private final Map<String, Allocation> reservations_;   // jobId -> live reservation
  private final Set<Integer> pinned_;

  public ReservationTable(int numResources) {
    super(numResources);
    slots_ = new ArrayList<>();
    reservations_ = new LinkedHashMap<>();
    pinned_ = new TreeSet<>();
    ensureHorizon(0);
  }

  @Override
  public boolean isTimeAware() { return true; }

  @Override
  public void ensureHorizon(int slot) {
    if (slot < slots_.size()) {
      return;
    }
    int before = slots_.size();
    while (slots_.size() <= slot) {
      TreeSet<Integer> free = allResources();
      free.removeAll(pinned_);
      slots_.add(free);
    }
    LOG.fine("Extend reservation table from " + before + " to " + slots_.size() + " slots");
  }

  @Override
  public int getHorizon() { return slots_.size(); }

  @Override
  public int freeCount(int slot) { return slot(slot).size(); }

  @Override
  public SortedSet<Integer> getFree(int slot) { return new TreeSet<>(slot(slot)); }

  @Override
  public boolean isFree(int resourceId, int slot) { return slot(slot).contains(resourceId); }

  /**
   * True iff every id is free in every slot of {@code [fromSlot, toSlot)}.
   */
  public boolean isFreeThroughout(Collection<Integer> ids, int fromSlot, int toSlot) {
    for (int t = fromSlot; t < toSlot; t++) {
      if (!slot(t).containsAll(ids)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public void take(Allocation allocation) {
    if (reservations_.containsKey(allocation.getJobId())) {
      throw new IllegalStateException("Job " + allocation.getJobId() + " already holds a reservation");
    }
    int end = endOf(allocation);
    for (int t = allocation.getStartSlot(); t < end; t++) {
      for (int id : allocation.getResources()) {
        if (!slot(t).contains(id)) {
          throw new IllegalStateException("Resource " + id + " is already taken at slot " + t
              + ", cannot allocate " + allocation);
        }
      }
    }
    for (int t = allocation.getStartSlot(); t < end; t++) {
      slots_.get(t).removeAll(allocation.getResources());
    }
    if (allocation.isOpenEnded()) {
      pinned_.addAll(allocation.getResources());
    }
    reservations_.put(allocation.getJobId(), allocation);
  }

  /**
   * Frees the ids in every slot from {@code fromSlot} through the current
   * horizon. Slots before {@code fromSlot} are left as they are. An id stays
   * taken in a slot another live reservation holds.
   */
  @Override
  public boolean release(Allocation allocation, int fromSlot) {
    if (reservations_.remove(allocation.getJobId()) == null) {
      return false;
    }
    if (allocation.isOpenEnded()) {
      pinned_.removeAll(allocation.getResources());
    }
    for (int t = Math.max(fromSlot, 0); t < slots_.size(); t++) {
      Set<Integer> blocked = heldAt(t);
      for (int id : allocation.getResources()) {
        if (!blocked.contains(id)) {
          slots_.get(t).add(id);
        }
      }
    }
    return true;
  }

  public int numReservations() { return reservations_.size(); }

  @Override
  public String describe(int fromSlot) {
    StringBuilder sb = new StringBuilder();
    sb.append("RESERVATION TABLE (").append(slots_.size()).append(" slots)");
    for (int t = Math.max(fromSlot, 0); t < slots_.size(); t++) {
      TreeSet<Integer> free = slots_.get(t);
      TreeSet<Integer> allocated = allResources();
      allocated.removeAll(free);
      sb.append("\n  slot ").append(t).append(": ").append(free.size()).append('/')
          .append(numResources_).append(" available ").append(free);
      if (!allocated.isEmpty()) {
        sb.append(" allocated ").append(allocated);
      }
    }
    return sb.toString();
  }

  private TreeSet<Integer> slot(int t) {
    if (t < 0 || t >= slots_.size()) {
      throw new IllegalStateException("Slot " + t + " is outside the reservation table horizon "
          + slots_.size());
    }
    return slots_.get(t);
  }

  private int endOf(Allocation allocation) {
    if (allocation.isOpenEnded()) {
      ensureHorizon(allocation.getStartSlot());
      return slots_.size();
    }
    ensureHorizon(allocation.getEndSlot() - 1);
    return allocation.getEndSlot();
  }

  private Set<Integer> heldAt(int t) {
    Set<Integer> held = new HashSet<>();
    for (Allocation other : reservations_.values()) {
      if (other.covers(t)) {
        held.addAll(other.getResources());
      }
    }
    return held;
  }
}
