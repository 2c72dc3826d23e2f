package huayu.zhang.batsched.simulator;

import java.util.*;

// a workload entry plus what happened to it during the replay
public class SimulatedJob {
  private final String jobId_;
  private final int resourceRequest_;
  private final double walltime_;
  private final double submissionTime_;
  private final double delay_;

  double startTime_ = -1;
  double finishTime_ = -1;
  boolean rejected_;
  List<Integer> resources_ = Collections.emptyList();

  public SimulatedJob(String jobId, int resourceRequest, double walltime, double submissionTime,
      double delay) {
    jobId_ = jobId;
    resourceRequest_ = resourceRequest;
    walltime_ = walltime;
    submissionTime_ = submissionTime;
    delay_ = delay;
  }

  public String getJobId() { return jobId_; }
  public int getResourceRequest() { return resourceRequest_; }
  public double getWalltime() { return walltime_; }
  public double getSubmissionTime() { return submissionTime_; }
  public double getDelay() { return delay_; }

  public double getStartTime() { return startTime_; }
  public double getFinishTime() { return finishTime_; }
  public boolean isRejected() { return rejected_; }
  public List<Integer> getResources() { return resources_; }

  // a job is killed when it reaches its walltime
  public double getRuntime() {
    return walltime_ > 0 ? Math.min(delay_, walltime_) : delay_;
  }

  @Override
  public String toString() {
    return String.format("Job %s (%d hosts, walltime %.2f, subtime %.2f, delay %.2f)", jobId_,
        resourceRequest_, walltime_, submissionTime_, delay_);
  }
}
