package huayu.zhang.batsched.events;

public class JobSubmittedEvent extends BaseEvent {
  private String jobId_;
  private int resourceRequest_;
  private double walltime_;

  public JobSubmittedEvent(double timestamp, String jobId, int resourceRequest, double walltime) {
    super(timestamp);
    jobId_ = jobId;
    resourceRequest_ = resourceRequest;
    walltime_ = walltime;
  }

  public String getJobId() { return jobId_; }
  public int getResourceRequest() { return resourceRequest_; }
  public double getWalltime() { return walltime_; }

  @Override
  public EventType getType() { return EventType.JOB_SUBMITTED; }

  @Override
  public String toString() {
    return String.format("JobSubmitted(job: %s, hosts: %d, walltime: %.2f)", jobId_,
        resourceRequest_, walltime_);
  }
}
