package huayu.zhang.batsched.schedulers;

import huayu.zhang.batsched.cluster.ResourceTracker;
import huayu.zhang.batsched.datastructures.Allocation;
import huayu.zhang.batsched.datastructures.Job;
import huayu.zhang.batsched.datastructures.JobRegistry;
import huayu.zhang.batsched.decisions.Decision;
import huayu.zhang.batsched.utils.Utils;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Human-readable trace of every cycle: queue, running jobs and the tracker
 * state. Table dumps are logged at FINE.
 */
public class LoggingSchedulingListener implements SchedulingListener {
  private static Logger LOG = Logger.getLogger(LoggingSchedulingListener.class.getName());

  @Override
  public void onCycleStart(double now, JobRegistry registry, ResourceTracker tracker) {
    if (!LOG.isLoggable(Level.FINE)) {
      return;
    }
    StringBuilder sb = new StringBuilder();
    sb.append("Queue state (").append(registry.numPending()).append(" jobs):");
    int position = 0;
    for (Job job : registry.getPendingJobs()) {
      sb.append(String.format("%n  [%d] Job %s: %d hosts, walltime %.2f", position++,
          job.getJobId(), job.getResourcesRequested(), job.getWalltime()));
    }
    sb.append(String.format("%nRunning jobs (%d):", registry.numRunning()));
    for (Allocation allocation : registry.getAllocations()) {
      sb.append(String.format("%n  Job %s on resources %s", allocation.getJobId(),
          Utils.toHostAllocation(allocation.getResources())));
    }
    LOG.fine(sb.toString());
    LOG.fine(tracker.describe(Utils.toSlot(now)));
  }

  @Override
  public void onJobStarted(Job job, Allocation allocation, boolean backfilled) {
    LOG.info("Job " + job.getJobId() + (backfilled ? " backfilled on " : " scheduled on ")
        + Utils.toHostAllocation(allocation.getResources()));
  }

  @Override
  public void onJobRejected(Job job, int numResources) {
    LOG.info("Job " + job.getJobId() + " rejected: requests " + job.getResourcesRequested()
        + " hosts, platform has " + numResources);
  }

  @Override
  public void onJobCompleted(String jobId, Allocation allocation, ResourceTracker tracker) {
    LOG.info("Job " + jobId + " completed, freed " + allocation.size() + " resources");
    LOG.fine(tracker.describe(allocation.getStartSlot()));
  }

  @Override
  public void onCycleEnd(double now, List<Decision> decisions) {
    LOG.fine("===== SCHEDULING CYCLE END (time: " + now + ", " + decisions.size()
        + " decisions) =====");
  }
}
