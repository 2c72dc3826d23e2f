package huayu.zhang.batsched.datastructures;

public class Job {
  // longer walltimes are not reserved slot by slot but held until completion
  public static final int MAX_RESERVED_SLOTS = 1000000;

  private final String jobId_;
  private final int resourcesRequested_;
  private final double walltime_;    // <= 0 means until an explicit completion
  private final double submissionTime_;

  private JobState state_;
  private double startTime_;

  public Job(String jobId, int resourcesRequested, double walltime, double submissionTime) {
    if (jobId == null) {
      throw new IllegalArgumentException("job id must not be null");
    }
    jobId_ = jobId;
    resourcesRequested_ = resourcesRequested;
    walltime_ = walltime;
    submissionTime_ = submissionTime;
    state_ = JobState.PENDING;
    startTime_ = -1;
  }

  public String getJobId() { return jobId_; }
  public int getResourcesRequested() { return resourcesRequested_; }
  public double getWalltime() { return walltime_; }
  public double getSubmissionTime() { return submissionTime_; }
  public JobState getState() { return state_; }
  public double getStartTime() { return startTime_; }

  public boolean isOpenEnded() { return walltime_ <= 0; }

  /**
   * Exclusive end slot of a reservation started at {@code startTime}: the
   * first slot after every slot {@code [startTime, startTime + walltime)}
   * touches. {@link Allocation#OPEN_END} for open-ended jobs and for
   * reservations longer than {@link #MAX_RESERVED_SLOTS}.
   */
  public int getEndSlot(double startTime) {
    if (isOpenEnded()) {
      return Allocation.OPEN_END;
    }
    double end = Math.ceil(startTime + walltime_);
    if (end - Math.floor(startTime) > MAX_RESERVED_SLOTS) {
      return Allocation.OPEN_END;
    }
    return (int) end;
  }

  void setState(JobState state) { state_ = state; }
  void setStartTime(double startTime) { startTime_ = startTime; }

  @Override
  public String toString() {
    return String.format("Job %s (%d hosts, walltime %.2f, %s)", jobId_,
        resourcesRequested_, walltime_, state_);
  }
}
