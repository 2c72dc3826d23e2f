package huayu.zhang.batsched.schedulers;

import huayu.zhang.batsched.datastructures.Allocation;

import org.json.simple.JSONObject;

// how many backfills landed on consecutive resource ids
public class BackfillStats {
  private int numBackfills_;
  private int numContiguous_;
  private int numNonContiguous_;

  void recordBackfill(Allocation allocation) {
    numBackfills_++;
    if (allocation.isContiguous()) {
      numContiguous_++;
    } else {
      numNonContiguous_++;
    }
  }

  public int getNumBackfills() { return numBackfills_; }
  public int getNumContiguous() { return numContiguous_; }
  public int getNumNonContiguous() { return numNonContiguous_; }

  @SuppressWarnings("unchecked")
  public JSONObject toJSON() {
    JSONObject jStats = new JSONObject();
    jStats.put("backfills", numBackfills_);
    jStats.put("contiguous_backfills", numContiguous_);
    jStats.put("non_contiguous_backfills", numNonContiguous_);
    return jStats;
  }

  @Override
  public String toString() {
    return numBackfills_ + " total successes (" + numContiguous_ + " contiguous, "
        + numNonContiguous_ + " non-contiguous)";
  }
}
