package huayu.zhang.batsched.schedpolicies;

import java.util.*;

/**
 * Conservative feasibility, but a backfilled job prefers the first run of
 * consecutive ids (ascending scan) long enough for it. Without such a run it
 * takes the smallest ids.
 */
public class BestContiguousSchedPolicy extends ConservativeBackfillSchedPolicy {

  public BestContiguousSchedPolicy() {
    super("best_cont", "1.0.0");
  }

  @Override
  protected SortedSet<Integer> select(SortedSet<Integer> candidates, int k) {
    Optional<SortedSet<Integer>> run = firstContiguousRun(candidates, k);
    return run.isPresent() ? run.get() : first(candidates, k);
  }

  static Optional<SortedSet<Integer>> firstContiguousRun(SortedSet<Integer> ids, int k) {
    List<Integer> run = new ArrayList<>();
    for (int id : ids) {
      if (!run.isEmpty() && id - run.get(run.size() - 1) != 1) {
        run.clear();
      }
      run.add(id);
      if (run.size() == k) {
        return Optional.of(new TreeSet<>(run));
      }
    }
    return Optional.empty();
  }
}
