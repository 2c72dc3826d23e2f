package huayu.zhang.batsched.datastructures;

import java.util.*;
import java.util.logging.Logger;

/**
 * Owns every job record the scheduler tracks: the FIFO pending queue, the
 * running set and each running job's allocation. Completed and rejected jobs
 * are discarded.
 *
 * <p>Not thread-safe; callers serialize access.
 */
public class JobRegistry {
  private static Logger LOG = Logger.getLogger(JobRegistry.class.getName());

  private final LinkedList<Job> pending_;
  private final Map<String, Job> running_;
  private final Map<String, Allocation> allocations_;

  private int numRejected_;
  private int numCompleted_;

  public JobRegistry() {
    pending_ = new LinkedList<>();
    running_ = new LinkedHashMap<>();
    allocations_ = new LinkedHashMap<>();
  }

  public boolean isKnown(String jobId) {
    if (running_.containsKey(jobId)) {
      return true;
    }
    for (Job job : pending_) {
      if (job.getJobId().equals(jobId)) {
        return true;
      }
    }
    return false;
  }

  public void submit(Job job) {
    if (job.getState() != JobState.PENDING) {
      throw new IllegalStateException(job + " cannot be queued");
    }
    pending_.addLast(job);
    LOG.fine("Job " + job.getJobId() + " added to queue (queue size: " + pending_.size() + ")");
  }

  public void reject(Job job) {
    job.setState(JobState.REJECTED);
    numRejected_++;
  }

  public Job peekPending() { return pending_.peekFirst(); }
  public boolean hasPending() { return !pending_.isEmpty(); }
  public int numPending() { return pending_.size(); }

  // queue order, head first
  public List<Job> getPendingJobs() {
    return Collections.unmodifiableList(pending_);
  }

  /**
   * Moves a pending job, wherever it sits in the queue, to the running set.
   */
  public void markRunning(Job job, Allocation allocation, double now) {
    if (!job.getJobId().equals(allocation.getJobId())) {
      throw new IllegalArgumentException("Allocation of job " + allocation.getJobId()
          + " given to job " + job.getJobId());
    }
    if (!pending_.remove(job)) {
      throw new IllegalStateException(job + " is not pending");
    }
    job.setState(JobState.RUNNING);
    job.setStartTime(now);
    running_.put(job.getJobId(), job);
    allocations_.put(job.getJobId(), allocation);
  }

  /**
   * Completes a running job and hands back its allocation. Unknown ids,
   * including jobs completed before, yield an empty result.
   */
  public Optional<Allocation> complete(String jobId) {
    Job job = running_.remove(jobId);
    if (job == null) {
      return Optional.empty();
    }
    job.setState(JobState.COMPLETED);
    numCompleted_++;
    return Optional.of(allocations_.remove(jobId));
  }

  public Job getRunningJob(String jobId) { return running_.get(jobId); }
  public Allocation getAllocation(String jobId) { return allocations_.get(jobId); }
  public int numRunning() { return running_.size(); }
  public int getNumRejected() { return numRejected_; }
  public int getNumCompleted() { return numCompleted_; }

  public Collection<Job> getRunningJobs() {
    return Collections.unmodifiableCollection(running_.values());
  }

  public Collection<Allocation> getAllocations() {
    return Collections.unmodifiableCollection(allocations_.values());
  }

  public void clear() {
    if (!running_.isEmpty()) {
      LOG.info("Discarding " + running_.size() + " running jobs");
    }
    pending_.clear();
    running_.clear();
    allocations_.clear();
  }
}
