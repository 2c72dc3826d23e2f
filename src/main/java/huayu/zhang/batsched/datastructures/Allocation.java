package huayu.zhang.batsched.datastructures;

import java.util.*;

/**
 * The resource ids a running job occupies and, for time-aware trackers, the
 * half-open slot interval it reserves. An end slot of {@link #OPEN_END}
 * means the reservation lasts until the job's completion event.
 */
public class Allocation {
  public static final int OPEN_END = -1;

  private final String jobId_;
  private final SortedSet<Integer> resources_;
  private final int startSlot_;
  private final int endSlot_;

  public Allocation(String jobId, Collection<Integer> resources, int startSlot, int endSlot) {
    if (resources.isEmpty()) {
      throw new IllegalArgumentException("Allocation of job " + jobId + " has no resources");
    }
    if (endSlot != OPEN_END && endSlot <= startSlot) {
      throw new IllegalArgumentException("Allocation of job " + jobId + " has empty interval ["
          + startSlot + ", " + endSlot + ")");
    }
    jobId_ = jobId;
    resources_ = Collections.unmodifiableSortedSet(new TreeSet<>(resources));
    startSlot_ = startSlot;
    endSlot_ = endSlot;
  }

  public static Allocation openEnded(String jobId, Collection<Integer> resources, int startSlot) {
    return new Allocation(jobId, resources, startSlot, OPEN_END);
  }

  public String getJobId() { return jobId_; }
  public SortedSet<Integer> getResources() { return resources_; }
  public int getStartSlot() { return startSlot_; }
  public int getEndSlot() { return endSlot_; }
  public int size() { return resources_.size(); }

  public boolean isOpenEnded() { return endSlot_ == OPEN_END; }

  public boolean covers(int slot) {
    return slot >= startSlot_ && (isOpenEnded() || slot < endSlot_);
  }

  public boolean isContiguous() {
    int previous = -1;
    for (int id : resources_) {
      if (previous >= 0 && id - previous != 1) {
        return false;
      }
      previous = id;
    }
    return true;
  }

  public List<Integer> toList() {
    return new ArrayList<>(resources_);
  }

  @Override
  public String toString() {
    return "job " + jobId_ + " on " + resources_ + " slots [" + startSlot_ + ", "
        + (isOpenEnded() ? "open" : String.valueOf(endSlot_)) + ")";
  }
}
