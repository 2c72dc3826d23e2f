package huayu.zhang.batsched.simulator;

import java.util.*;

public class Workload {
  private final int numResources_;
  private final String description_;
  private final List<SimulatedJob> jobs_;

  public Workload(int numResources, String description, List<SimulatedJob> jobs) {
    numResources_ = numResources;
    description_ = description;
    jobs_ = Collections.unmodifiableList(new ArrayList<>(jobs));
  }

  public int getNumResources() { return numResources_; }
  public String getDescription() { return description_; }
  public List<SimulatedJob> getJobs() { return jobs_; }
}
