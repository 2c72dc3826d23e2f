package huayu.zhang.batsched.decisions;

import java.util.*;

public class ExecuteJob extends Decision {
  private final String jobId_;
  private final List<Integer> resources_;    // ascending

  public ExecuteJob(String jobId, Collection<Integer> resources) {
    jobId_ = jobId;
    List<Integer> sorted = new ArrayList<>(resources);
    Collections.sort(sorted);
    resources_ = Collections.unmodifiableList(sorted);
  }

  public String getJobId() { return jobId_; }
  public List<Integer> getResources() { return resources_; }

  @Override
  public DecisionType getType() { return DecisionType.EXECUTE_JOB; }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ExecuteJob)) {
      return false;
    }
    ExecuteJob that = (ExecuteJob) o;
    return jobId_.equals(that.jobId_) && resources_.equals(that.resources_);
  }

  @Override
  public int hashCode() { return Objects.hash(jobId_, resources_); }

  @Override
  public String toString() {
    return "ExecuteJob(" + jobId_ + ", " + resources_ + ")";
  }
}
