package huayu.zhang.batsched.events;

import huayu.zhang.batsched.cluster.ResourceTracker;
import huayu.zhang.batsched.datastructures.Allocation;
import huayu.zhang.batsched.datastructures.Job;
import huayu.zhang.batsched.datastructures.JobRegistry;
import huayu.zhang.batsched.decisions.AcknowledgeHandshake;
import huayu.zhang.batsched.decisions.Decision;
import huayu.zhang.batsched.decisions.RejectJob;
import huayu.zhang.batsched.schedpolicies.SchedPolicy;
import huayu.zhang.batsched.schedulers.SchedulingListener;
import huayu.zhang.batsched.utils.Utils;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Applies one batch of events, strictly in delivery order, to the job
 * registry and the resource tracker. The tracker is created by the policy
 * when the simulation begins.
 */
public class EventIngestor {
  private static Logger LOG = Logger.getLogger(EventIngestor.class.getName());

  private final JobRegistry registry_;
  private final SchedPolicy policy_;
  private SchedulingListener listener_;

  private ResourceTracker tracker_;
  private int numResources_;

  public EventIngestor(JobRegistry registry, SchedPolicy policy) {
    registry_ = registry;
    policy_ = policy;
    listener_ = SchedulingListener.NOOP;
  }

  public void setListener(SchedulingListener listener) { listener_ = listener; }

  // null until the simulation begins
  public ResourceTracker getTracker() { return tracker_; }
  public int getNumResources() { return numResources_; }

  public void ingest(double now, List<BaseEvent> events, List<Decision> decisions) {
    for (BaseEvent event : events) {
      LOG.fine(policy_.getName() + " received event " + event);
      switch (event.getType()) {
      case HANDSHAKE:
        decisions.add(new AcknowledgeHandshake(policy_.getName(), policy_.getVersion()));
        break;
      case SIMULATION_BEGINS:
        onSimulationBegins((SimulationBeginsEvent) event);
        break;
      case JOB_SUBMITTED:
        onJobSubmitted(now, (JobSubmittedEvent) event, decisions);
        break;
      case JOB_COMPLETED:
        onJobCompleted(now, (JobCompletedEvent) event);
        break;
      case UNKNOWN:
      default:
        LOG.warning("Ignoring event " + event);
      }
    }
  }

  private void onSimulationBegins(SimulationBeginsEvent event) {
    if (tracker_ != null) {
      LOG.warning("Simulation already started with " + numResources_ + " hosts, ignoring " + event);
      return;
    }
    numResources_ = event.getNumResources();
    tracker_ = policy_.createTracker(numResources_);
    LOG.info("Simulation started with " + numResources_ + " hosts");
  }

  private void onJobSubmitted(double now, JobSubmittedEvent event, List<Decision> decisions) {
    if (registry_.isKnown(event.getJobId())) {
      LOG.warning("Job " + event.getJobId() + " is already tracked, ignoring duplicate submission");
      return;
    }
    Job job = new Job(event.getJobId(), event.getResourceRequest(), event.getWalltime(), now);
    if (job.getResourcesRequested() <= 0 || job.getResourcesRequested() > numResources_) {
      LOG.info("Job " + job.getJobId() + " requests " + job.getResourcesRequested()
          + " hosts, platform has " + numResources_ + ". Rejecting.");
      registry_.reject(job);
      decisions.add(new RejectJob(job.getJobId()));
      listener_.onJobRejected(job, numResources_);
      return;
    }
    registry_.submit(job);
  }

  private void onJobCompleted(double now, JobCompletedEvent event) {
    Optional<Allocation> allocation = registry_.complete(event.getJobId());
    if (!allocation.isPresent()) {
      LOG.warning("Completion of untracked job " + event.getJobId() + ", nothing to release");
      return;
    }
    tracker_.release(allocation.get(), Utils.toSlot(now));
    LOG.info("Job " + event.getJobId() + " completed, freed " + allocation.get().size() + " resources");
    listener_.onJobCompleted(event.getJobId(), allocation.get(), tracker_);
  }
}
