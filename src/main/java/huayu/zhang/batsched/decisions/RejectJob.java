package huayu.zhang.batsched.decisions;

public class RejectJob extends Decision {
  private final String jobId_;

  public RejectJob(String jobId) {
    jobId_ = jobId;
  }

  public String getJobId() { return jobId_; }

  @Override
  public DecisionType getType() { return DecisionType.REJECT_JOB; }

  @Override
  public boolean equals(Object o) {
    return o instanceof RejectJob && jobId_.equals(((RejectJob) o).jobId_);
  }

  @Override
  public int hashCode() { return jobId_.hashCode(); }

  @Override
  public String toString() {
    return "RejectJob(" + jobId_ + ")";
  }
}
