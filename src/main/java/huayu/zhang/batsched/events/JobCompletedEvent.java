package huayu.zhang.batsched.events;

public class JobCompletedEvent extends BaseEvent {
  private String jobId_;

  public JobCompletedEvent(double timestamp, String jobId) {
    super(timestamp);
    jobId_ = jobId;
  }

  public String getJobId() { return jobId_; }

  @Override
  public EventType getType() { return EventType.JOB_COMPLETED; }

  @Override
  public String toString() {
    return "JobCompleted(job: " + jobId_ + ")";
  }
}
