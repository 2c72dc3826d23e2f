package huayu.zhang.batsched.simulator;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.*;
import java.util.logging.Logger;

import huayu.zhang.batsched.decisions.Decision;
import huayu.zhang.batsched.decisions.ExecuteJob;
import huayu.zhang.batsched.decisions.RejectJob;
import huayu.zhang.batsched.events.*;
import huayu.zhang.batsched.protocol.JsonMessageCodec;
import huayu.zhang.batsched.schedulers.DecisionComponent;
import huayu.zhang.batsched.schedulers.LoggingSchedulingListener;
import huayu.zhang.batsched.utils.Configuration;
import huayu.zhang.batsched.utils.ConfigurationException;
import huayu.zhang.batsched.utils.Utils;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

// plays the resource manager: replays a workload against the decision
// component over the JSON protocol and measures the resulting schedule
public class Simulator {
  private static Logger LOG = Logger.getLogger(Simulator.class.getName());

  // time
  private final double endTime_;
  private final double timeStep_;
  private double currentTime_;

  // job queues
  private final Queue<SimulatedJob> runnableJobs_;    // not submitted yet, by subtime
  private final Map<String, SimulatedJob> waitingJobs_;
  private final Map<String, SimulatedJob> runningJobs_;
  private final List<SimulatedJob> completedJobs_;
  private final List<SimulatedJob> rejectedJobs_;

  private final Workload workload_;
  private final DecisionComponent component_;
  private final JsonMessageCodec codec_;
  private boolean simulationBegun_;
  private int numCycles_;

  public Simulator(Workload workload, Configuration config) throws ConfigurationException {
    workload_ = workload;
    endTime_ = config.getEndTime();
    timeStep_ = config.getTimeStep();

    runnableJobs_ = new LinkedList<>(workload.getJobs());
    waitingJobs_ = new LinkedHashMap<>();
    runningJobs_ = new LinkedHashMap<>();
    completedJobs_ = new ArrayList<>();
    rejectedJobs_ = new ArrayList<>();

    codec_ = new JsonMessageCodec();
    component_ = new DecisionComponent(config.getSchedPolicy(), DecisionComponent.FORMAT_JSON);
    if (config.isTraceReservations()) {
      component_.setListener(new LoggingSchedulingListener());
    }
  }

  public JSONObject simulate() {
    for (currentTime_ = 0; currentTime_ < endTime_; currentTime_ = Utils.round(currentTime_ + timeStep_, 6)) {
      List<BaseEvent> events = new ArrayList<>();
      if (!simulationBegun_) {
        events.add(new HandshakeEvent(currentTime_, JsonMessageCodec.PROTOCOL_VERSION));
        events.add(new SimulationBeginsEvent(currentTime_, workload_.getNumResources()));
        simulationBegun_ = true;
      }
      finishJobs(events);
      submitJobs(events);

      if (!events.isEmpty()) {
        LOG.fine("==== STEP_TIME:" + currentTime_ + ", " + events.size() + " events ====");
        String reply = component_.takeDecisions(codec_.encodeEvents(currentTime_, events));
        applyDecisions(codec_.decodeDecisions(reply));
        numCycles_++;
      }

      if (stop()) {
        break;
      }
    }
    if (!stop()) {
      LOG.warning("End time " + endTime_ + " reached with " + runningJobs_.size() + " running and "
          + (waitingJobs_.size() + runnableJobs_.size()) + " unscheduled jobs");
    }
    JSONObject jStats = generateStatistics();
    component_.shutdown();
    return jStats;
  }

  boolean stop() {
    return runnableJobs_.isEmpty() && waitingJobs_.isEmpty() && runningJobs_.isEmpty();
  }

  private void finishJobs(List<BaseEvent> events) {
    Iterator<SimulatedJob> iter = runningJobs_.values().iterator();
    while (iter.hasNext()) {
      SimulatedJob job = iter.next();
      if (job.finishTime_ <= currentTime_) {
        events.add(new JobCompletedEvent(currentTime_, job.getJobId()));
        completedJobs_.add(job);
        iter.remove();
      }
    }
  }

  private void submitJobs(List<BaseEvent> events) {
    while (!runnableJobs_.isEmpty() && runnableJobs_.peek().getSubmissionTime() <= currentTime_) {
      SimulatedJob job = runnableJobs_.poll();
      events.add(new JobSubmittedEvent(currentTime_, job.getJobId(), job.getResourceRequest(),
          job.getWalltime()));
      waitingJobs_.put(job.getJobId(), job);
    }
  }

  private void applyDecisions(List<Decision> decisions) {
    for (Decision decision : decisions) {
      switch (decision.getType()) {
      case EXECUTE_JOB:
        ExecuteJob execute = (ExecuteJob) decision;
        SimulatedJob job = waitingJobs_.remove(execute.getJobId());
        if (job == null) {
          throw new IllegalStateException("Decision component started unknown job " + execute.getJobId());
        }
        job.startTime_ = currentTime_;
        job.finishTime_ = Utils.round(currentTime_ + job.getRuntime(), 6);
        job.resources_ = execute.getResources();
        runningJobs_.put(job.getJobId(), job);
        LOG.fine("Started job:" + job.getJobId() + " at time:" + currentTime_ + " on "
            + Utils.toHostAllocation(job.resources_));
        break;
      case REJECT_JOB:
        SimulatedJob rejected = waitingJobs_.remove(((RejectJob) decision).getJobId());
        if (rejected != null) {
          rejected.rejected_ = true;
          rejectedJobs_.add(rejected);
        }
        break;
      case ACKNOWLEDGE_HANDSHAKE:
      default:
        LOG.info("Decision component: " + decision);
      }
    }
  }

  @SuppressWarnings("unchecked")
  public JSONObject generateStatistics() {
    double makespan = 0.0;
    double totalWaiting = 0.0;
    double totalTurnaround = 0.0;
    JSONArray jJobs = new JSONArray();
    for (SimulatedJob job : completedJobs_) {
      makespan = Math.max(makespan, job.getFinishTime());
      totalWaiting += job.getStartTime() - job.getSubmissionTime();
      totalTurnaround += job.getFinishTime() - job.getSubmissionTime();
      JSONObject jJob = new JSONObject();
      jJob.put("id", job.getJobId());
      jJob.put("start", job.getStartTime());
      jJob.put("finish", job.getFinishTime());
      jJob.put("allocation", Utils.toHostAllocation(job.getResources()));
      jJobs.add(jJob);
    }
    int numCompleted = completedJobs_.size();

    JSONObject jStats = new JSONObject();
    jStats.put("policy", component_.getPolicyName());
    jStats.put("nb_res", workload_.getNumResources());
    jStats.put("nb_jobs", workload_.getJobs().size());
    jStats.put("completed", numCompleted);
    jStats.put("rejected", rejectedJobs_.size());
    jStats.put("decision_cycles", numCycles_);
    jStats.put("makespan", Utils.round(makespan, 2));
    jStats.put("mean_waiting_time", numCompleted == 0 ? 0.0 : Utils.round(totalWaiting / numCompleted, 2));
    jStats.put("mean_turnaround_time", numCompleted == 0 ? 0.0 : Utils.round(totalTurnaround / numCompleted, 2));
    jStats.put("backfilling", component_.getStats().toJSON());
    jStats.put("jobs", jJobs);
    return jStats;
  }

  public static void writeStatistics(JSONObject jStats, String pathToStatsOutput) throws IOException {
    File parent = new File(pathToStatsOutput).getAbsoluteFile().getParentFile();
    if (parent != null && !parent.exists() && !parent.mkdirs()) {
      throw new IOException("Cannot create directory " + parent);
    }
    try (PrintWriter outStats = new PrintWriter(pathToStatsOutput, "UTF-8")) {
      outStats.println(jStats.toJSONString());
    }
    LOG.info("write statistics to " + pathToStatsOutput);
  }

  public List<SimulatedJob> getCompletedJobs() { return Collections.unmodifiableList(completedJobs_); }
  public List<SimulatedJob> getRejectedJobs() { return Collections.unmodifiableList(rejectedJobs_); }
  public double getCurrentTime() { return currentTime_; }
}
