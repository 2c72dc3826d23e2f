package huayu.zhang.batsched.schedulers;

import huayu.zhang.batsched.cluster.ResourceTracker;
import huayu.zhang.batsched.datastructures.JobRegistry;
import huayu.zhang.batsched.decisions.Decision;
import huayu.zhang.batsched.events.BaseEvent;
import huayu.zhang.batsched.events.EventIngestor;
import huayu.zhang.batsched.protocol.EventBatch;
import huayu.zhang.batsched.protocol.JsonMessageCodec;
import huayu.zhang.batsched.protocol.MessageCodec;
import huayu.zhang.batsched.utils.Configuration;
import huayu.zhang.batsched.utils.Configuration.SchedulingPolicy;
import huayu.zhang.batsched.utils.ConfigurationException;

import java.util.*;
import java.util.logging.Logger;

/**
 * One scheduler instance for one simulation run, driven through
 * {@link #init}, any number of {@link #takeDecisions} calls and
 * {@link #shutdown}.
 *
 * <p>All entry points are non-reentrant. Callers using an instance from
 * several threads must serialize the calls themselves.
 */
public class DecisionComponent {
  private static Logger LOG = Logger.getLogger(DecisionComponent.class.getName());

  public static final int FORMAT_BINARY = 0x1;
  public static final int FORMAT_JSON = 0x2;

  private final MessageCodec codec_;
  private final JobRegistry registry_;
  private final EventIngestor ingestor_;
  private final BackfillScheduler scheduler_;
  private SchedulingListener listener_;
  private boolean shutdown_;

  public DecisionComponent(SchedulingPolicy schedPolicy, int flags) throws ConfigurationException {
    codec_ = createCodec(flags);
    registry_ = new JobRegistry();
    scheduler_ = new BackfillScheduler(schedPolicy);
    ingestor_ = new EventIngestor(registry_, scheduler_.getPolicy());
    listener_ = SchedulingListener.NOOP;
    LOG.info("Initialized " + scheduler_.getPolicy() + " decision component");
  }

  /**
   * @param flags encoding flags, {@link #FORMAT_BINARY} and/or {@link #FORMAT_JSON}
   * @param initData optional JSON object selecting the policy
   */
  public static DecisionComponent init(int flags, String initData) throws ConfigurationException {
    return new DecisionComponent(Configuration.parseInitData(initData), flags);
  }

  private static MessageCodec createCodec(int flags) throws ConfigurationException {
    if ((flags & (FORMAT_BINARY | FORMAT_JSON)) != flags) {
      throw new ConfigurationException("Unknown flags used, cannot initialize: 0x"
          + Integer.toHexString(flags));
    }
    if ((flags & FORMAT_BINARY) != 0) {
      throw new ConfigurationException("Binary encoding is not available, use the JSON format");
    }
    return new JsonMessageCodec();
  }

  public void setListener(SchedulingListener listener) {
    listener_ = listener;
    ingestor_.setListener(listener);
    scheduler_.setListener(listener);
  }

  /**
   * Wire entry point: decodes the event batch, decides, and encodes the
   * decisions with the codec chosen at initialization.
   */
  public String takeDecisions(String whatHappened) {
    EventBatch batch = codec_.decodeEvents(whatHappened);
    List<Decision> decisions = takeDecisions(batch.getNow(), batch.getEvents());
    return codec_.encodeDecisions(batch.getNow(), decisions);
  }

  /**
   * Applies the events in order, then runs the scheduling loop once.
   * Rejections from ingestion precede the start decisions of the loop.
   */
  public List<Decision> takeDecisions(double now, List<BaseEvent> events) {
    if (shutdown_) {
      throw new IllegalStateException("Decision component was shut down");
    }
    List<Decision> decisions = new ArrayList<>();
    ingestor_.ingest(now, events, decisions);
    ResourceTracker tracker = ingestor_.getTracker();
    if (tracker != null) {
      listener_.onCycleStart(now, registry_, tracker);
      scheduler_.schedule(now, registry_, tracker, decisions);
    }
    listener_.onCycleEnd(now, decisions);
    return decisions;
  }

  public void shutdown() {
    if (shutdown_) {
      return;
    }
    LOG.info("Backfilling statistics: " + scheduler_.getStats());
    registry_.clear();
    shutdown_ = true;
  }

  public boolean isShutdown() { return shutdown_; }
  public JobRegistry getRegistry() { return registry_; }
  public BackfillStats getStats() { return scheduler_.getStats(); }
  public String getPolicyName() { return scheduler_.getPolicy().getName(); }

  // null until the simulation begins
  public ResourceTracker getTracker() { return ingestor_.getTracker(); }
}
